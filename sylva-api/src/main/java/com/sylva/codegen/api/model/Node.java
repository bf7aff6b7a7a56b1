/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.model;

import java.util.Objects;

/**
 * A node of a {@link Tree}. Either a {@link Split} with exactly two children or a
 * {@link Leaf} with none.
 *
 * <p>Children are referenced by their slot in the owning tree's node arena, so a node can
 * never be shared between trees or between two parents of the same tree.
 */
public interface Node {

    /** The node id from the raw dump, kept for diagnostics. */
    int id();

    /**
     * An internal node: the {@code yes} child is taken when {@code feature <= threshold}.
     *
     * @param id        node id from the dump
     * @param feature   resolved feature reference
     * @param threshold fixed-point threshold
     * @param yes       arena slot of the yes-branch child
     * @param no        arena slot of the no-branch child
     */
    record Split(int id, FeatureReference feature, long threshold, int yes, int no) implements Node {
        public Split {
            Objects.requireNonNull(feature, "Split feature cannot be null");
        }
    }

    /**
     * A terminal node holding a fixed-point contribution.
     */
    record Leaf(int id, long value) implements Node {
    }
}
