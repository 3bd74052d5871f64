package at.sv.sky.moon;

import at.sv.sky.coords.CoordinateTransform;

import java.time.Instant;

/**
 * Low precision geocentric lunar position (main terms only, about a degree of accuracy),
 * which is sufficient for deciding whether the Moon is up and roughly where it stands.
 */
final class MoonEphemeris {

    private static final double J2000 = 2451545.0;
    private static final double OBLIQUITY = Math.toRadians(23.4397);

    private MoonEphemeris() {
    }

    /**
     * @return {raHours [0, 24), decDegrees}
     */
    static double[] equatorial(Instant instant) {
        double d = CoordinateTransform.julianDate(instant) - J2000;

        double meanLongitude = Math.toRadians(218.316 + 13.176396 * d);
        double meanAnomaly = Math.toRadians(134.963 + 13.064993 * d);
        double argumentOfLatitude = Math.toRadians(93.272 + 13.229350 * d);

        double longitude = meanLongitude + Math.toRadians(6.289) * Math.sin(meanAnomaly);
        double latitude = Math.toRadians(5.128) * Math.sin(argumentOfLatitude);

        double ra = Math.atan2(Math.sin(longitude) * Math.cos(OBLIQUITY) - Math.tan(latitude) * Math.sin(OBLIQUITY),
                Math.cos(longitude));
        double dec = Math.asin(Math.sin(latitude) * Math.cos(OBLIQUITY)
                               + Math.cos(latitude) * Math.sin(OBLIQUITY) * Math.sin(longitude));

        double raHours = Math.toDegrees(ra) / 15.0;
        raHours = raHours % 24.0;
        if (raHours < 0) {
            raHours += 24.0;
        }
        return new double[]{raHours, Math.toDegrees(dec)};
    }
}
