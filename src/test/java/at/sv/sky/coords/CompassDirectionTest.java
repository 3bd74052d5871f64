package at.sv.sky.coords;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class CompassDirectionTest {

    private void assertDirection(double azimuth, CompassDirection expected) {
        assertThat("Direction differs for " + azimuth, CompassDirection.of(azimuth), is(expected));
    }

    @Test
    void cardinalPoints() {
        assertDirection(0, CompassDirection.N);
        assertDirection(90, CompassDirection.E);
        assertDirection(180, CompassDirection.S);
        assertDirection(270, CompassDirection.W);
    }

    @Test
    void roundsToNearestPoint() {
        assertDirection(11.2, CompassDirection.N);
        assertDirection(11.25, CompassDirection.NNE);
        assertDirection(44, CompassDirection.NE);
        assertDirection(166.5, CompassDirection.SSE);
        assertDirection(304, CompassDirection.NW);
    }

    @Test
    void wrapsAroundNorth() {
        assertDirection(359, CompassDirection.N);
        assertDirection(350, CompassDirection.N);
        assertDirection(-45, CompassDirection.NW);
        assertDirection(720, CompassDirection.N);
    }
}
