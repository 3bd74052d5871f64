package at.sv.sky.horizon;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HorizonFileParserTest {

    @Test
    void parse_skipsCommentsBlankAndMalformedLines() {
        HorizonProfile profile = HorizonFileParser.parse("backyard", """
                # azimuth altitude
                0 10

                90\t20  tree line
                abc def
                180
                -90 5
                """);

        assertThat(profile.getName()).isEqualTo("backyard");
        assertThat(profile.getPoints()).containsExactly(
                new HorizonPoint(0, 10), new HorizonPoint(90, 20), new HorizonPoint(270, 5));
        assertThat(profile.altitudeAt(45)).isCloseTo(15.0, within(1e-9));
    }

    @Test
    void parse_blank_emptyProfile() {
        assertThat(HorizonFileParser.parse("").isEmpty()).isTrue();
        assertThat(HorizonFileParser.parse("   \n").isEmpty()).isTrue();
        assertThat(HorizonFileParser.parse(null).isEmpty()).isTrue();
        assertThat(HorizonFileParser.parse("# only comments\n# here").isEmpty()).isTrue();
    }

    @Test
    void parseLine() {
        assertThat(HorizonFileParser.parseLine("  370.5   12.25 ")).isEqualTo(new HorizonPoint(10.5, 12.25));
        assertThat(HorizonFileParser.parseLine("10 NaN")).isNull();
        assertThat(HorizonFileParser.parseLine("#10 20")).isNull();
        assertThat(HorizonFileParser.parseLine("10,20")).isNull();
    }
}
