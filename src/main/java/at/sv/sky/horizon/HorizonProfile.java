package at.sv.sky.horizon;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Observer specific minimum altitude per azimuth, e.g. trees, buildings or terrain.
 * Samples are kept sorted by azimuth and wrap around at 360°. An empty profile is a flat 0° horizon.
 */
@Getter
@EqualsAndHashCode
public final class HorizonProfile {

    public static final HorizonProfile FLAT = new HorizonProfile(null, List.of());

    private static final double SAME_AZIMUTH_TOLERANCE = 0.01;

    private final String name;
    private final List<HorizonPoint> points;

    public HorizonProfile(String name, Collection<HorizonPoint> points) {
        this.name = name;
        List<HorizonPoint> sorted = new ArrayList<>();
        for (HorizonPoint point : points) {
            sorted.add(new HorizonPoint(normalizeAzimuth(point.azimuth()), point.altitude()));
        }
        sorted.sort(Comparator.comparingDouble(HorizonPoint::azimuth));
        this.points = List.copyOf(sorted);
    }

    public static HorizonProfile of(HorizonPoint... points) {
        return new HorizonProfile(null, List.of(points));
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * Linearly interpolates the horizon altitude at the given azimuth between the two bracketing samples,
     * wrapping from the last sample back to the first across 0°.
     */
    public double altitudeAt(double azimuth) {
        if (points.isEmpty()) {
            return 0.0;
        }
        if (points.size() == 1) {
            return points.get(0).altitude();
        }
        double az = normalizeAzimuth(azimuth);

        HorizonPoint low = null;
        HorizonPoint high = null;
        for (HorizonPoint point : points) {
            if (point.azimuth() <= az) {
                low = point;
            }
            if (high == null && point.azimuth() >= az) {
                high = point;
            }
        }
        if (low == null) {
            low = points.get(points.size() - 1);
        }
        if (high == null) {
            high = points.get(0);
        }
        if (low == high || Math.abs(low.azimuth() - high.azimuth()) < SAME_AZIMUTH_TOLERANCE) {
            return low.altitude();
        }

        double range;
        double offset;
        if (high.azimuth() < low.azimuth()) {
            range = 360.0 - low.azimuth() + high.azimuth();
            offset = az >= low.azimuth() ? az - low.azimuth() : 360.0 - low.azimuth() + az;
        } else {
            range = high.azimuth() - low.azimuth();
            offset = az - low.azimuth();
        }
        double fraction = offset / range;
        return low.altitude() + fraction * (high.altitude() - low.altitude());
    }

    public boolean isAbove(double altitude, double azimuth) {
        return altitude > altitudeAt(azimuth);
    }

    /**
     * A missing profile counts as a flat 0° horizon, not as "no limit".
     */
    public static double horizonAltitude(HorizonProfile profile, double azimuth) {
        return profile == null ? 0.0 : profile.altitudeAt(azimuth);
    }

    public static boolean isAboveHorizon(double altitude, double azimuth, HorizonProfile profile) {
        return altitude > horizonAltitude(profile, azimuth);
    }

    /**
     * The custom horizon can only raise the configured floor, never lower it.
     */
    public static double effectiveMinimumAltitude(double minAltitude, HorizonProfile profile, double azimuth) {
        return Math.max(minAltitude, horizonAltitude(profile, azimuth));
    }

    static double normalizeAzimuth(double azimuth) {
        double az = azimuth % 360.0;
        if (az < 0) {
            az += 360.0;
        }
        return az >= 360.0 ? 0.0 : az;
    }

    @Override
    public String toString() {
        return "HorizonProfile{" + (name != null ? name + ", " : "") + points.size() + " points}";
    }
}
