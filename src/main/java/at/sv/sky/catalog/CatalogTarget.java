package at.sv.sky.catalog;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * A catalog entry as supplied by the catalog source.
 */
@Data
@AllArgsConstructor
@Builder
public final class CatalogTarget {

    private final String id;
    private final String name;
    private final String commonName;
    private final String type;
    /**
     * Right ascension in hours [0, 24).
     */
    private final double ra;
    /**
     * Declination in degrees [-90, 90].
     */
    private final double dec;
    private final Double magnitude;
    /**
     * Angular size in arc minutes.
     */
    private final Double size;
    private final String constellation;
    /**
     * Distance in light years.
     */
    private final Double distance;

    public boolean hasMagnitude() {
        return magnitude != null;
    }

    public String getDisplayName() {
        return commonName != null ? name + " (" + commonName + ")" : name;
    }
}
