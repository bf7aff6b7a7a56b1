package com.sylva.codegen.compiler.feature;

import com.sylva.codegen.api.exceptions.UnknownFeatureException;
import com.sylva.codegen.api.model.FeatureMapping;
import com.sylva.codegen.api.model.FeatureReference;
import com.sylva.codegen.api.model.FeatureUniverse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureResolverTest {

    private final FeatureResolver resolver = new FeatureResolver(FeatureUniverse.ofCount(116));

    @Test
    @DisplayName("Should resolve referenced names to their dense universe index")
    void shouldResolveToUniverseIndex() {
        FeatureMapping mapping = resolver.resolveAll(List.of("f115", "f3", "f50", "f3"));

        assertThat(mapping.references())
                .containsExactly(
                        new FeatureReference("f3", 3),
                        new FeatureReference("f50", 50),
                        new FeatureReference("f115", 115));
    }

    @Test
    @DisplayName("Should reject names outside the universe")
    void shouldRejectUnknownName() {
        assertThatThrownBy(() -> resolver.resolveAll(List.of("f3", "f200")))
                .isInstanceOf(UnknownFeatureException.class)
                .hasMessageContaining("f200")
                .hasMessageContaining("116");
    }

    @Test
    @DisplayName("Numeric identifiers resolve by position")
    void numericIdentifiersResolveByPosition() {
        assertThat(resolver.resolve("42")).isEqualTo(new FeatureReference("f42", 42));
        assertThatThrownBy(() -> resolver.resolve("116")).isInstanceOf(UnknownFeatureException.class);
        assertThatThrownBy(() -> resolver.resolve("-1")).isInstanceOf(UnknownFeatureException.class);
    }

    @Test
    @DisplayName("Named universes resolve by declared name")
    void namedUniverse() {
        FeatureResolver named = new FeatureResolver(new FeatureUniverse(List.of("age", "income", "tenure")));

        assertThat(named.resolve("tenure").index()).isEqualTo(2);
        assertThat(named.resolve("0").name()).isEqualTo("age");
        assertThatThrownBy(() -> named.resolve("salary"))
                .isInstanceOf(UnknownFeatureException.class)
                .satisfies(e -> assertThat(((UnknownFeatureException) e).getFeatureName()).isEqualTo("salary"));
    }

    @Test
    @DisplayName("Dump names fN resolve by position in a named universe")
    void dumpNamesResolveByPositionInNamedUniverse() {
        FeatureResolver named = new FeatureResolver(new FeatureUniverse(List.of(
                "age", "income", "tenure", "balance", "region", "score", "visits", "extra")));

        assertThat(named.resolve("f5")).isEqualTo(new FeatureReference("score", 5));
        assertThat(named.resolveAll(List.of("f7", "f2", "f5")).references())
                .extracting(FeatureReference::index)
                .containsExactly(2, 5, 7);
        assertThatThrownBy(() -> named.resolve("f8"))
                .isInstanceOf(UnknownFeatureException.class)
                .hasMessageContaining("f8")
                .hasMessageContaining("8");
        assertThatThrownBy(() -> named.resolve("f")).isInstanceOf(UnknownFeatureException.class);
        assertThatThrownBy(() -> named.resolve("f-1")).isInstanceOf(UnknownFeatureException.class);
    }

    @Test
    @DisplayName("A declared name wins over the positional form")
    void declaredNameWinsOverPosition() {
        FeatureResolver named = new FeatureResolver(new FeatureUniverse(List.of("f1", "f0")));

        assertThat(named.resolve("f1").index()).isEqualTo(0);
        assertThat(named.resolve("f0").index()).isEqualTo(1);
    }

    @Test
    @DisplayName("Dictionary maps both ways")
    void dictionaryMapsBothWays() {
        FeatureDictionary dictionary = new FeatureDictionary(FeatureUniverse.ofCount(4));

        assertThat(dictionary.getId("f2")).isEqualTo(2);
        assertThat(dictionary.getId("f9")).isEqualTo(-1);
        assertThat(dictionary.decode(3)).isEqualTo("f3");
        assertThat(dictionary.decode(4)).isNull();
        assertThat(dictionary.size()).isEqualTo(4);
    }
}
