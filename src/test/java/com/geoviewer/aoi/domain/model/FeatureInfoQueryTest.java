package com.geoviewer.aoi.domain.model;

import org.junit.jupiter.api.Test;

import static com.geoviewer.aoi.support.TestFixtures.featureInfoQuery;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureInfoQueryTest {

    @Test
    void testFingerprint_SameInputs_SameKey() {
        assertThat(featureInfoQuery().fingerprint()).isEqualTo(featureInfoQuery().fingerprint());
    }

    @Test
    void testFingerprint_Format() {
        assertThat(featureInfoQuery().fingerprint())
            .isEqualTo("topp%3Astates|120|85|91.28%2C23.83%2C91.30%2C23.85|256|256");
    }

    @Test
    void testFingerprint_AnyFieldChanged_DifferentKey() {
        String base = featureInfoQuery().fingerprint();

        assertThat(new FeatureInfoQuery(121, 85, "91.28,23.83,91.30,23.85", 256, 256, "topp:states").fingerprint())
            .isNotEqualTo(base);
        assertThat(new FeatureInfoQuery(120, 86, "91.28,23.83,91.30,23.85", 256, 256, "topp:states").fingerprint())
            .isNotEqualTo(base);
        assertThat(new FeatureInfoQuery(120, 85, "91.28,23.83,91.30,23.86", 256, 256, "topp:states").fingerprint())
            .isNotEqualTo(base);
        assertThat(new FeatureInfoQuery(120, 85, "91.28,23.83,91.30,23.85", 512, 256, "topp:states").fingerprint())
            .isNotEqualTo(base);
        assertThat(new FeatureInfoQuery(120, 85, "91.28,23.83,91.30,23.85", 256, 512, "topp:states").fingerprint())
            .isNotEqualTo(base);
        assertThat(new FeatureInfoQuery(120, 85, "91.28,23.83,91.30,23.85", 256, 256, "topp:roads").fingerprint())
            .isNotEqualTo(base);
    }

    @Test
    void testFingerprint_SeparatorInsideField_DoesNotCollide() {
        FeatureInfoQuery pipeInLayers = new FeatureInfoQuery(1, 2, "0,0,1,1", 10, 10, "a|1");
        FeatureInfoQuery plainLayers = new FeatureInfoQuery(1, 2, "0,0,1,1", 10, 10, "a");

        assertThat(pipeInLayers.fingerprint()).isNotEqualTo(plainLayers.fingerprint());
        assertThat(pipeInLayers.fingerprint().chars().filter(c -> c == '|').count()).isEqualTo(5);
    }

    @Test
    void testConstructor_NullBbox_Throws() {
        assertThatThrownBy(() -> new FeatureInfoQuery(1, 2, null, 10, 10, "a"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
