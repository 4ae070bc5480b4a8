package com.jay.proforma.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.*;

class ModelConfigTest {

    @Test
    @DisplayName("Loads solver, defaults, waterfall and validation sections from proforma.yaml")
    void loadsYaml() {
        ModelConfig config = new ModelConfig();
        config.load();

        assertThat(config.solver().getTolerance()).isEqualTo(1e-7);
        assertThat(config.solver().getBisectionLow()).isEqualTo(-0.99);
        assertThat(config.defaults().isCircularReferences()).isTrue();
        assertThat(config.defaults().isActual365()).isTrue();
        assertThat(config.waterfall().getTiers()).hasSize(4);
        assertThat(config.waterfall().getTiers().get(1).getGpPromote()).isEqualTo(0.1667);
        assertThat(config.waterfall().getTiers().get(3).getName()).isEqualTo("Final Split");
        assertThat(config.validation().getAmountTolerance()).isEqualTo(0.01);
    }

    @Test
    @DisplayName("Missing file leaves built-in defaults in place")
    void missingFileKeepsDefaults() {
        ModelConfig config = new ModelConfig();
        ReflectionTestUtils.setField(config, "configFile", "does-not-exist.yaml");
        config.load();

        assertThat(config.solver().getInitialGuess()).isEqualTo(0.10);
        assertThat(config.waterfall().getTiers()).hasSize(4);
        assertThat(config.defaults().getDiscountRate()).isEqualTo(0.10);
    }
}
