package at.sv.sky.recommend;

import at.sv.sky.ObserverLocation;
import at.sv.sky.moon.MoonState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.ZonedDateTime;

/**
 * Observer, time and sky conditions for one recommendation request.
 */
@Data
@AllArgsConstructor
@Builder
public final class RecommendationContext {

    private final ObserverLocation location;
    private final ZonedDateTime time;
    /**
     * Moon illumination in percent [0, 100].
     */
    private final double moonIllumination;
    private final String moonPhase;
    private final double moonAltitude;
    /**
     * Cloud cover in percent [0, 100], null if unknown.
     */
    private final Double cloudCover;
    /**
     * Seeing in arc seconds, null if unknown.
     */
    private final Double seeing;

    public static RecommendationContext of(ObserverLocation location, ZonedDateTime time, MoonState moon,
                                           Double cloudCover, Double seeing) {
        return new RecommendationContext(location, time, moon.getIlluminationPercent(),
                moon.getPhaseName().getDisplayName(), moon.getAltitude(), cloudCover, seeing);
    }
}
