package at.sv.sky.recommend;

import at.sv.sky.catalog.CatalogTarget;

import java.util.List;

/**
 * A ranking strategy. Implementations must not mutate the given targets, context or options.
 */
public interface Recommender {

    String name();

    String description();

    /**
     * @return targets ranked best first, at most {@link RecommenderOptions#getMaxTargets()} entries
     */
    List<RecommendedTarget> recommend(List<CatalogTarget> targets, RecommendationContext context,
                                      RecommenderOptions options);
}
