package org.javai.projective;

import org.javai.projective.family.ProductFamily;
import org.javai.projective.space.DiscreteMeasure;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ExtensionSettingsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("projective.quadrature.resolution");
        System.clearProperty("projective.tolerance");
    }

    @Test
    void defaults() {
        ExtensionSettings settings = ExtensionSettings.defaults();

        assertThat(settings.quadratureResolution()).isEqualTo(256);
        assertThat(settings.tailTolerance()).isEqualTo(1e-12);
        assertThat(settings.vanishingTolerance()).isEqualTo(1e-9);
        assertThat(settings.probeDepth()).isEqualTo(3);
    }

    @Test
    void fromEnvironment_readsSystemProperties() {
        System.setProperty("projective.quadrature.resolution", "64");
        System.setProperty("projective.tolerance", " 1e-6 ");

        ExtensionSettings settings = ExtensionSettings.fromEnvironment();

        assertThat(settings.quadratureResolution()).isEqualTo(64);
        assertThat(settings.tolerance()).isEqualTo(1e-6);
        assertThat(settings.maxAtoms()).isEqualTo(ExtensionSettings.defaults().maxAtoms());
    }

    @Test
    void factoriesWithoutSettings_resolveFromEnvironment() {
        System.setProperty("projective.tolerance", "1e-7");

        ProductFamily<Integer> family = ProductFamily.iid(DiscreteMeasure.fairCoin());

        assertThat(family.settings().tolerance()).isEqualTo(1e-7);
        assertThat(ProjectiveLimits.build(family).settings().tolerance()).isEqualTo(1e-7);
    }

    @Test
    void fromEnvironment_rejectsUnparseableValue() {
        System.setProperty("projective.quadrature.resolution", "many");

        assertThatThrownBy(ExtensionSettings::fromEnvironment)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("projective.quadrature.resolution");
    }

    @Test
    void resolve_fallsBackWhenUnset() {
        Integer value = ExtensionSettings.resolve("projective.unset.property", "PROJECTIVE_UNSET_VARIABLE",
                Integer::parseInt, 17);

        assertThat(value).isEqualTo(17);
    }

    @Test
    void builder_validatesRanges() {
        assertThatThrownBy(() -> ExtensionSettings.builder().quadratureResolution(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExtensionSettings.builder().probeDepth(-1).build())
                .isInstanceOf(IllegalArgumentException.class);

        ExtensionSettings custom = ExtensionSettings.defaults().toBuilder().probePieces(2).build();
        assertThat(custom.probePieces()).isEqualTo(2);
    }
}
