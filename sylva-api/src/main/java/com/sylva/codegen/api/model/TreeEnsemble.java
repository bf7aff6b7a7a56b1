/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.model;

import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of trees whose outputs are summed to form one prediction.
 *
 * Tree order is evaluation order. Emitting only the first {@code k} trees is equivalent to
 * summing a prefix of the full ensemble.
 *
 * @param trees    trees in evaluation order
 * @param universe the feature universe every split was resolved against
 * @param mapping  the features actually referenced, ordered by index
 */
public record TreeEnsemble(List<Tree> trees, FeatureUniverse universe, FeatureMapping mapping) {

    public TreeEnsemble {
        Objects.requireNonNull(trees, "Trees cannot be null");
        Objects.requireNonNull(universe, "Feature universe cannot be null");
        Objects.requireNonNull(mapping, "Feature mapping cannot be null");
        trees = List.copyOf(trees);
        for (int i = 0; i < trees.size(); i++) {
            if (trees.get(i).getIndex() != i) {
                throw new IllegalArgumentException(
                        "Tree at position " + i + " carries index " + trees.get(i).getIndex());
            }
        }
    }

    public int treeCount() {
        return trees.size();
    }

    public int featureCount() {
        return universe.size();
    }

    public Tree tree(int index) {
        return trees.get(index);
    }
}
