package at.sv.sky.recommend;

import at.sv.sky.catalog.CatalogTarget;
import at.sv.sky.coords.CompassDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * A catalog target enriched with its current position, tonight's window and its score.
 * Created per request and never persisted.
 */
@Data
@AllArgsConstructor
@Builder
public final class RecommendedTarget {

    private final CatalogTarget target;

    /**
     * Current altitude, rounded to whole degrees.
     */
    private final long altitude;
    /**
     * Current azimuth, rounded to whole degrees.
     */
    private final long azimuth;
    private final CompassDirection direction;
    private final boolean aboveHorizon;

    private final long maxAltitude;
    private final ZonedDateTime maxAltitudeTime;

    private final ZonedDateTime visibilityStart;
    private final ZonedDateTime visibilityEnd;
    /**
     * Rounded to one decimal.
     */
    private final double visibilityHours;
    private final ZonedDateTime optimalTime;

    /**
     * [0, 100], higher is better.
     */
    private final int score;
    private final List<String> reasons;

    public String getId() {
        return target.getId();
    }

    public String getName() {
        return target.getName();
    }

    public String getType() {
        return target.getType();
    }

    public Double getMagnitude() {
        return target.getMagnitude();
    }
}
