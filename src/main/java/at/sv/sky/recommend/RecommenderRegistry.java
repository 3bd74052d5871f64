package at.sv.sky.recommend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recommenders keyed by a string identifier, so callers can switch strategies without code changes.
 */
public final class RecommenderRegistry {

    public static final String VISIBILITY = "visibility";

    private final Map<String, Recommender> recommenders = new LinkedHashMap<>();

    public static RecommenderRegistry withDefaults() {
        RecommenderRegistry registry = new RecommenderRegistry();
        registry.register(VISIBILITY, new VisibilityRecommender());
        return registry;
    }

    public static RecommenderRegistry withDefaults(Recommender visibilityRecommender) {
        RecommenderRegistry registry = new RecommenderRegistry();
        registry.register(VISIBILITY, visibilityRecommender);
        return registry;
    }

    public void register(String id, Recommender recommender) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Recommender id must not be blank");
        }
        recommenders.put(id, recommender);
    }

    public Optional<Recommender> find(String id) {
        return Optional.ofNullable(recommenders.get(id));
    }

    /**
     * @throws UnknownRecommenderException if no recommender is registered under the given id
     */
    public Recommender get(String id) {
        return find(id).orElseThrow(() -> new UnknownRecommenderException(
                "Unknown recommender '" + id + "'. Available: " + recommenders.keySet()));
    }

    public List<RecommenderInfo> available() {
        List<RecommenderInfo> result = new ArrayList<>();
        recommenders.forEach((id, recommender) ->
                result.add(new RecommenderInfo(id, recommender.name(), recommender.description())));
        return result;
    }
}
