package at.sv.sky.coords;

/**
 * Horizontal coordinates of a target for one observer and instant.
 *
 * @param altitude degrees above the mathematical horizon [-90, 90]
 * @param azimuth  degrees clockwise from North [0, 360)
 */
public record AltAz(double altitude, double azimuth) {

    public double separationTo(AltAz other) {
        return CoordinateTransform.angularSeparation(altitude, azimuth, other.altitude, other.azimuth);
    }

    public CompassDirection direction() {
        return CompassDirection.of(azimuth);
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT, "[alt=%.2f,az=%.2f]", altitude, azimuth);
    }
}
