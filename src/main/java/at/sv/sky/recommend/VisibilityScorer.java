package at.sv.sky.recommend;

import at.sv.sky.catalog.CatalogTarget;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Heuristic score starting at 50. Each rule that fires adjusts the score and records a reason;
 * the order of the reasons follows the order in which the rules are evaluated.
 */
public final class VisibilityScorer {

    static final int BASE_SCORE = 50;
    static final List<String> POPULAR_TYPES = List.of("Globular Cluster", "Open Cluster", "Galaxy", "Nebula",
            "Planetary Nebula");
    static final List<String> DETAILED_TYPES = List.of("Planetary Nebula", "Galaxy", "Double Star");

    public TargetScore score(CatalogTarget target, double altitude, double maxAltitudeTonight,
                             RecommendationContext context) {
        int score = BASE_SCORE;
        List<String> reasons = new ArrayList<>();

        if (altitude >= 60) {
            score += 25;
            reasons.add("Excellent altitude (>60°)");
        } else if (altitude >= 40) {
            score += 15;
            reasons.add("Good altitude (40-60°)");
        } else if (altitude >= 30) {
            score += 8;
            reasons.add("Fair altitude (30-40°)");
        }

        if (maxAltitudeTonight > 0 && altitude >= maxAltitudeTonight * 0.9) {
            score += 5;
            reasons.add("Near peak altitude");
        }

        boolean faint = target.hasMagnitude() && target.getMagnitude() > 8;
        boolean moonUp = context.getMoonAltitude() > 0;
        boolean moonBright = context.getMoonIllumination() > 50;
        if (!moonUp || context.getMoonIllumination() < 25) {
            score += 15;
            reasons.add("Dark sky (low moon)");
        } else if (moonBright && faint) {
            score -= 20;
            reasons.add("Moon interference (faint target)");
        } else if (moonBright) {
            score -= 5;
            reasons.add("Bright moon");
        }

        if (target.hasMagnitude()) {
            double magnitude = target.getMagnitude();
            if (magnitude < 4) {
                score += 15;
                reasons.add("Very bright target");
            } else if (magnitude < 6) {
                score += 10;
                reasons.add("Easy to see");
            } else if (magnitude < 8) {
                score += 5;
                reasons.add("Moderately bright");
            }
        }

        if (matchesAny(target.getType(), POPULAR_TYPES)) {
            score += 10;
            reasons.add("Popular object type");
        }

        Double cloudCover = context.getCloudCover();
        if (cloudCover != null && cloudCover > 50) {
            long penalty = Math.round((cloudCover - 50) * 0.3);
            if (penalty > 0) {
                score -= (int) penalty;
                reasons.add(String.format(Locale.ROOT, "Cloud cover %.0f%% (-%d)", cloudCover, penalty));
            }
        }

        Double seeing = context.getSeeing();
        if (seeing != null && seeing > 3 && matchesAny(target.getType(), DETAILED_TYPES)) {
            score -= 10;
            reasons.add("Poor seeing for fine detail");
        }

        return new TargetScore(Math.max(0, Math.min(100, score)), reasons);
    }

    static boolean matchesAny(String type, List<String> candidates) {
        if (type == null) {
            return false;
        }
        String normalized = type.toLowerCase(Locale.ENGLISH);
        return candidates.stream().anyMatch(candidate -> normalized.contains(candidate.toLowerCase(Locale.ENGLISH)));
    }
}
