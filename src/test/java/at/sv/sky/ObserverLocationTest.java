package at.sv.sky;

import at.sv.sky.horizon.HorizonPoint;
import at.sv.sky.horizon.HorizonProfile;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ObserverLocationTest {

    @Test
    void horizonOrFlat() {
        assertThat(ObserverLocation.of(48.2, 16.39).horizonOrFlat()).isSameAs(HorizonProfile.FLAT);
    }

    @Test
    void fingerprint_dependsOnPositionAndHorizon() {
        ObserverLocation vienna = ObserverLocation.of(48.2, 16.39);
        ObserverLocation withTrees = vienna.toBuilder().horizon(HorizonProfile.of(new HorizonPoint(180, 25))).build();

        assertThat(vienna.fingerprint()).isEqualTo(ObserverLocation.of(48.2, 16.39).fingerprint());
        assertThat(vienna.fingerprint()).isNotEqualTo(ObserverLocation.of(48.3, 16.39).fingerprint());
        assertThat(withTrees.fingerprint()).isNotEqualTo(vienna.fingerprint());
        assertThat(withTrees.toBuilder().name("Backyard").build().fingerprint()).isEqualTo(withTrees.fingerprint());
    }
}
