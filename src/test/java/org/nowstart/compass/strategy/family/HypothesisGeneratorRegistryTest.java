package org.nowstart.compass.strategy.family;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class HypothesisGeneratorRegistryTest {

    @Test
    void all_returnsGeneratorsOrderedByFamily() {
        HypothesisGeneratorRegistry registry = new HypothesisGeneratorRegistry(List.of(
                new SignalWeightedGenerator(),
                new EqualWeightGenerator(),
                new CapitalPreservationGenerator()
        ));
        registry.init();

        assertThat(registry.all()).extracting(HypothesisGenerator::family)
                .containsExactly("capital_preservation", "equal_weight", "signal_weighted");
        assertThat(registry.getRequired(" Equal_Weight ")).isInstanceOf(EqualWeightGenerator.class);
    }

    @Test
    void init_rejectsDuplicateFamilies() {
        HypothesisGeneratorRegistry registry = new HypothesisGeneratorRegistry(List.of(
                new EqualWeightGenerator(),
                new EqualWeightGenerator()
        ));

        assertThatThrownBy(registry::init)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("equal_weight");
    }

    @Test
    void getRequired_failsForUnknownFamily() {
        HypothesisGeneratorRegistry registry = new HypothesisGeneratorRegistry(List.of(new EqualWeightGenerator()));
        registry.init();

        assertThatThrownBy(() -> registry.getRequired("momentum"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("momentum");
    }
}
