package at.sv.sky.recommend;

import at.sv.sky.ObserverLocation;
import at.sv.sky.catalog.CatalogTarget;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecommenderRegistryTest {

    @Mock
    private Recommender custom;

    @Test
    void withDefaults_visibilityRecommender() {
        RecommenderRegistry registry = RecommenderRegistry.withDefaults();

        assertThat(registry.get(RecommenderRegistry.VISIBILITY)).isInstanceOf(VisibilityRecommender.class);
        assertThat(registry.available()).containsExactly(new RecommenderInfo("visibility", "Visibility-Based",
                "Recommends targets based on current visibility, altitude, moon interference, and object brightness"));
    }

    @Test
    void unknownKey_exception() {
        RecommenderRegistry registry = RecommenderRegistry.withDefaults();

        assertThat(registry.find("seasonal")).isEmpty();
        assertThatThrownBy(() -> registry.get("seasonal"))
                .isInstanceOf(UnknownRecommenderException.class)
                .hasMessageContaining("seasonal")
                .hasMessageContaining("visibility");
    }

    @Test
    void register_customRecommender_usedThroughSameContract() {
        RecommenderRegistry registry = RecommenderRegistry.withDefaults();
        when(custom.name()).thenReturn("Seasonal");
        when(custom.description()).thenReturn("Best targets of the season");
        registry.register("seasonal", custom);

        RecommendationContext context = RecommendationContext.builder()
                                                             .location(ObserverLocation.of(48.2, 16.39))
                                                             .time(ZonedDateTime.of(2024, 1, 15, 21, 0, 0, 0,
                                                                     ZoneId.of("Europe/Vienna")))
                                                             .build();
        List<CatalogTarget> targets = List.of();
        registry.get("seasonal").recommend(targets, context, RecommenderOptions.defaults());

        verify(custom).recommend(targets, context, RecommenderOptions.defaults());
        assertThat(registry.available()).extracting(RecommenderInfo::id).containsExactly("visibility", "seasonal");
        assertThat(registry.available().get(1).name()).isEqualTo("Seasonal");
    }

    @Test
    void withDefaults_customVisibilityRecommender() {
        RecommenderRegistry registry = RecommenderRegistry.withDefaults(custom);

        assertThat(registry.get(RecommenderRegistry.VISIBILITY)).isSameAs(custom);
    }

    @Test
    void register_blankId_exception() {
        RecommenderRegistry registry = new RecommenderRegistry();

        assertThatThrownBy(() -> registry.register(" ", custom)).isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.available()).isEmpty();
    }
}
