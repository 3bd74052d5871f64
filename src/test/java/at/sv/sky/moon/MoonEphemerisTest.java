package at.sv.sky.moon;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MoonEphemerisTest {

    @Test
    void fullMoon_oppositeTheSun() {
        double[] equatorial = MoonEphemeris.equatorial(Instant.parse("2023-02-05T18:28:00Z"));

        assertThat(equatorial[0]).isCloseTo(9.36, within(0.05));
        assertThat(equatorial[1]).isCloseTo(20.76, within(0.05));
    }

    @Test
    void newMoon_nextToTheSun() {
        double[] equatorial = MoonEphemeris.equatorial(Instant.parse("2023-01-21T20:53:00Z"));

        assertThat(equatorial[0]).isCloseTo(20.34, within(0.05));
        assertThat(equatorial[1]).isCloseTo(-24.75, within(0.05));
    }

    @Test
    void rightAscension_isNormalized() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        for (int day = 0; day < 60; day++) {
            double[] equatorial = MoonEphemeris.equatorial(start.plusSeconds(day * 86_400L));
            assertThat(equatorial[0]).isGreaterThanOrEqualTo(0.0).isLessThan(24.0);
            assertThat(equatorial[1]).isBetween(-30.0, 30.0);
        }
    }
}
