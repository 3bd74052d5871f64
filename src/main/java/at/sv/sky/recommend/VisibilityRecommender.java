package at.sv.sky.recommend;

import at.sv.sky.ObserverLocation;
import at.sv.sky.catalog.CatalogTarget;
import at.sv.sky.coords.AltAz;
import at.sv.sky.coords.CoordinateTransform;
import at.sv.sky.horizon.HorizonProfile;
import at.sv.sky.visibility.VisibilityWindow;
import at.sv.sky.visibility.VisibilityWindowCache;
import at.sv.sky.visibility.VisibilityWindowSearch;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks targets that are up right now and stay above the minimum altitude for at least half an hour tonight.
 * Ties keep the catalog order.
 */
@Slf4j
public final class VisibilityRecommender implements Recommender {

    private final VisibilityScorer scorer;
    private final VisibilityWindowCache windowCache;

    public VisibilityRecommender() {
        this(null);
    }

    /**
     * @param windowCache optional cache for nightly windows, may be null
     */
    public VisibilityRecommender(VisibilityWindowCache windowCache) {
        this.scorer = new VisibilityScorer();
        this.windowCache = windowCache;
    }

    @Override
    public String name() {
        return "Visibility-Based";
    }

    @Override
    public String description() {
        return "Recommends targets based on current visibility, altitude, moon interference, and object brightness";
    }

    @Override
    public List<RecommendedTarget> recommend(List<CatalogTarget> targets, RecommendationContext context,
                                             RecommenderOptions options) {
        RecommenderOptions effectiveOptions = options != null ? options : RecommenderOptions.defaults();
        ObserverLocation location = context.getLocation();
        ZonedDateTime time = context.getTime();
        double minAltitude = effectiveOptions.getMinAltitude();
        if (effectiveOptions.getMaxTargets() < 1) {
            throw new IllegalArgumentException("maxTargets must be >= 1: " + effectiveOptions.getMaxTargets());
        }

        List<RecommendedTarget> results = new ArrayList<>();
        for (CatalogTarget target : targets) {
            if (isFilteredOut(target, effectiveOptions)) {
                log.trace("{}: excluded by filter", target.getId());
                continue;
            }

            AltAz position = CoordinateTransform.altAz(target.getRa(), target.getDec(),
                    location.getLatitude(), location.getLongitude(), time);
            if (!HorizonProfile.isAboveHorizon(position.altitude(), position.azimuth(), location.getHorizon())
                || position.altitude() < minAltitude) {
                log.debug("{}: currently too low {}", target.getId(), position);
                continue;
            }

            VisibilityWindow window = visibilityWindow(target, location, minAltitude, time);
            if (!window.isVisibleTonight()) {
                log.debug("{}: visible only {}h tonight", target.getId(), window.visibleHours());
                continue;
            }

            TargetScore score = scorer.score(target, position.altitude(), window.maxAltitude(), context);
            results.add(toRecommendedTarget(target, position, window, score));
        }

        results.sort(Comparator.comparingInt(RecommendedTarget::getScore).reversed());
        List<RecommendedTarget> ranked = results.size() > effectiveOptions.getMaxTargets()
                ? new ArrayList<>(results.subList(0, effectiveOptions.getMaxTargets()))
                : results;
        log.info("Recommended {} of {} candidates ({} observable)", ranked.size(), targets.size(), results.size());
        return ranked;
    }

    private boolean isFilteredOut(CatalogTarget target, RecommenderOptions options) {
        List<String> typeFilter = options.getTypeFilter();
        if (typeFilter != null && !typeFilter.isEmpty() && !typeFilter.contains(target.getType())) {
            return true;
        }
        Double magnitude = target.getMagnitude();
        if (magnitude == null) {
            return false;
        }
        if (options.getMinMagnitude() != null && magnitude > options.getMinMagnitude()) {
            return true;
        }
        return options.getMaxMagnitude() != null && magnitude < options.getMaxMagnitude();
    }

    private VisibilityWindow visibilityWindow(CatalogTarget target, ObserverLocation location, double minAltitude,
                                              ZonedDateTime time) {
        if (windowCache == null) {
            return computeWindow(target, location, minAltitude, time);
        }
        return windowCache.get(target.getId(), location, minAltitude, time,
                () -> computeWindow(target, location, minAltitude, time));
    }

    private static VisibilityWindow computeWindow(CatalogTarget target, ObserverLocation location, double minAltitude,
                                                  ZonedDateTime time) {
        return VisibilityWindowSearch.visibilityWindow(target.getRa(), target.getDec(), location.getLatitude(),
                location.getLongitude(), minAltitude, location.getHorizon(), time);
    }

    private static RecommendedTarget toRecommendedTarget(CatalogTarget target, AltAz position, VisibilityWindow window,
                                                         TargetScore score) {
        return RecommendedTarget.builder()
                                .target(target)
                                .altitude(Math.round(position.altitude()))
                                .azimuth(Math.round(position.azimuth()))
                                .direction(position.direction())
                                .aboveHorizon(true)
                                .maxAltitude(Math.round(window.maxAltitude()))
                                .maxAltitudeTime(window.optimalTime())
                                .visibilityStart(window.start())
                                .visibilityEnd(window.end())
                                .visibilityHours(Math.round(window.visibleHours() * 10) / 10.0)
                                .optimalTime(window.optimalTime())
                                .score(score.score())
                                .reasons(score.reasons())
                                .build();
    }
}
