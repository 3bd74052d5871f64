package at.sv.sky;

import at.sv.sky.horizon.HorizonProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.Locale;

/**
 * Immutable snapshot of where the observer stands. Engine calls read it once at entry.
 */
@Data
@AllArgsConstructor
@Builder(toBuilder = true)
public final class ObserverLocation {

    private final String name;
    /**
     * Degrees, -90..90.
     */
    private final double latitude;
    /**
     * Degrees, -180..180, east-positive.
     */
    private final double longitude;
    /**
     * Meters above sea level, used for Sun and Moon rise/set times only.
     */
    private final double elevation;
    private final HorizonProfile horizon;

    public static ObserverLocation of(double latitude, double longitude) {
        return new ObserverLocation(null, latitude, longitude, 0.0, null);
    }

    public HorizonProfile horizonOrFlat() {
        return horizon != null ? horizon : HorizonProfile.FLAT;
    }

    /**
     * Stable key for caching results that depend on position and horizon.
     */
    public String fingerprint() {
        return String.format(Locale.ROOT, "%.4f,%.4f#%d", latitude, longitude,
                horizon == null ? 0 : horizon.hashCode());
    }
}
