package com.sylva.codegen.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureUniverseTest {

    @Test
    @DisplayName("ofCount declares f0..f(n-1) in order")
    void ofCountDeclaresDefaultNames() {
        FeatureUniverse universe = FeatureUniverse.ofCount(116);

        assertThat(universe.size()).isEqualTo(116);
        assertThat(universe.name(0)).isEqualTo("f0");
        assertThat(universe.name(115)).isEqualTo("f115");
    }

    @Test
    @DisplayName("Should reject duplicate names")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> new FeatureUniverse(List.of("age", "income", "age")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate feature name: age");
    }

    @Test
    @DisplayName("Should reject empty universes and blank names")
    void shouldRejectEmptyAndBlank() {
        assertThatThrownBy(() -> new FeatureUniverse(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FeatureUniverse(Arrays.asList("a", null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FeatureUniverse(List.of("a", " ")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FeatureUniverse.ofCount(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Names are copied on construction")
    void namesAreCopied() {
        List<String> names = new ArrayList<>(List.of("a", "b"));
        FeatureUniverse universe = new FeatureUniverse(names);
        names.add("c");

        assertThat(universe.size()).isEqualTo(2);
        assertThatThrownBy(() -> universe.names().add("d"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
