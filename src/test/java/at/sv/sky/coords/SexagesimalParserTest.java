package at.sv.sky.coords;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SexagesimalParserTest {

    @Test
    void parseRightAscension() {
        assertThat(SexagesimalParser.parseRightAscension("05h 35m 17.3s")).isCloseTo(5.588139, within(1e-6));
        assertThat(SexagesimalParser.parseRightAscension("0h 0m 0s")).isEqualTo(0.0);
        assertThat(SexagesimalParser.parseRightAscension("16h41m41.2s")).isCloseTo(16.694778, within(1e-6));
    }

    @Test
    void parseRightAscension_invalid_null() {
        assertThat(SexagesimalParser.parseRightAscension(null)).isNull();
        assertThat(SexagesimalParser.parseRightAscension("")).isNull();
        assertThat(SexagesimalParser.parseRightAscension("5.5")).isNull();
        assertThat(SexagesimalParser.parseRightAscension("24h 00m 00s")).isNull();
        assertThat(SexagesimalParser.parseRightAscension("05h 61m 00s")).isNull();
        assertThat(SexagesimalParser.parseRightAscension("05h 35m")).isNull();
    }

    @Test
    void parseDeclination() {
        assertThat(SexagesimalParser.parseDeclination("-05° 23' 28\"")).isCloseTo(-5.391111, within(1e-6));
        assertThat(SexagesimalParser.parseDeclination("+22° 00' 52\"")).isCloseTo(22.014444, within(1e-6));
        assertThat(SexagesimalParser.parseDeclination("41° 16' 09''")).isCloseTo(41.269167, within(1e-6));
    }

    @Test
    void parseDeclination_negativeBelowOneDegree_keepsSign() {
        assertThat(SexagesimalParser.parseDeclination("-00° 30' 00\"")).isEqualTo(-0.5);
    }

    @Test
    void parseDeclination_invalid_null() {
        assertThat(SexagesimalParser.parseDeclination(null)).isNull();
        assertThat(SexagesimalParser.parseDeclination("-5.39")).isNull();
        assertThat(SexagesimalParser.parseDeclination("+91° 00' 00\"")).isNull();
        assertThat(SexagesimalParser.parseDeclination("+45° 60' 00\"")).isNull();
        assertThat(SexagesimalParser.parseDeclination("north")).isNull();
    }
}
