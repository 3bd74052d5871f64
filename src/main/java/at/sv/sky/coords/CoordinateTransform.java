package at.sv.sky.coords;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Equatorial to horizontal conversion using a simplified mean sidereal time model.
 * No refraction, nutation, precession or parallax is applied, so altitudes near the
 * horizon may read up to a degree or two high compared to the apparent position.
 */
public final class CoordinateTransform {

    private static final double J2000 = 2451545.0;
    private static final double UNIX_EPOCH_JD = 2440587.5;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private CoordinateTransform() {
    }

    public static double julianDate(Instant instant) {
        return instant.toEpochMilli() / MILLIS_PER_DAY + UNIX_EPOCH_JD;
    }

    /**
     * @return Greenwich mean sidereal time in hours [0, 24)
     */
    public static double greenwichMeanSiderealTime(Instant instant) {
        double daysSinceJ2000 = julianDate(instant) - J2000;
        double t = daysSinceJ2000 / 36525.0;
        double gmst = 18.697374558 + 24.06570982441908 * daysSinceJ2000 + 0.000026 * t * t;
        return normalize(gmst, 24.0);
    }

    /**
     * @param longitude east-positive degrees
     * @return local sidereal time in hours [0, 24)
     */
    public static double localSiderealTime(Instant instant, double longitude) {
        return normalize(greenwichMeanSiderealTime(instant) + longitude / 15.0, 24.0);
    }

    /**
     * @return hour angle in degrees [0, 360), positive west of the meridian
     */
    public static double hourAngle(double raHours, double longitude, Instant instant) {
        return normalize(localSiderealTime(instant, longitude) * 15.0 - raHours * 15.0, 360.0);
    }

    public static AltAz altAz(double raHours, double decDeg, double latitude, double longitude, ZonedDateTime dateTime) {
        return altAz(raHours, decDeg, latitude, longitude, dateTime.toInstant());
    }

    public static AltAz altAz(double raHours, double decDeg, double latitude, double longitude, Instant instant) {
        return altAzFromHourAngle(hourAngle(raHours, longitude, instant), decDeg, latitude);
    }

    public static AltAz altAzFromHourAngle(double hourAngleDeg, double decDeg, double latitude) {
        double ha = Math.toRadians(hourAngleDeg);
        double dec = Math.toRadians(decDeg);
        double lat = Math.toRadians(latitude);

        double sinAlt = Math.sin(dec) * Math.sin(lat) + Math.cos(dec) * Math.cos(lat) * Math.cos(ha);
        double altitude = Math.toDegrees(Math.asin(clamp(sinAlt)));

        // both components are scaled by cos(alt) * cos(lat), which keeps the zenith free of divisions by zero
        double y = -Math.cos(dec) * Math.sin(ha);
        double x = Math.sin(dec) * Math.cos(lat) - Math.cos(dec) * Math.sin(lat) * Math.cos(ha);
        double azimuth = normalize(Math.toDegrees(Math.atan2(y, x)), 360.0);
        return new AltAz(altitude, azimuth);
    }

    /**
     * Spherical law of cosines on two horizontal positions.
     *
     * @return separation in degrees [0, 180]
     */
    public static double angularSeparation(double alt1, double az1, double alt2, double az2) {
        double a1 = Math.toRadians(alt1);
        double a2 = Math.toRadians(alt2);
        double deltaAz = Math.toRadians(az1 - az2);
        double cosD = Math.sin(a1) * Math.sin(a2) + Math.cos(a1) * Math.cos(a2) * Math.cos(deltaAz);
        return Math.toDegrees(Math.acos(clamp(cosD)));
    }

    static double normalize(double value, double period) {
        double result = value % period;
        if (result < 0) {
            result += period;
        }
        return result >= period ? 0.0 : result;
    }

    private static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
