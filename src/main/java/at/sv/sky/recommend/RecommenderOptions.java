package at.sv.sky.recommend;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
@Builder(toBuilder = true)
public final class RecommenderOptions {

    public static final double DEFAULT_MIN_ALTITUDE = 20.0;
    public static final int DEFAULT_MAX_TARGETS = 20;

    /**
     * Minimum altitude above the horizon in degrees.
     */
    @Builder.Default
    private final double minAltitude = DEFAULT_MIN_ALTITUDE;
    @Builder.Default
    private final int maxTargets = DEFAULT_MAX_TARGETS;
    /**
     * Exact object types to include, empty or null for all.
     */
    private final List<String> typeFilter;
    /**
     * Faintest magnitude to include (numerically largest).
     */
    private final Double minMagnitude;
    /**
     * Brightest magnitude to include (numerically smallest).
     */
    private final Double maxMagnitude;

    public static RecommenderOptions defaults() {
        return RecommenderOptions.builder().build();
    }
}
