/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One node of a raw per-tree dump, as produced by the model loader.
 * A split carries a feature, a threshold and both child ids; a leaf carries only a value.
 * No validation happens here: structural checks belong to the tree builder.
 */
public record RawNode(
        @JsonProperty("id") int id,
        @JsonProperty("feature") String feature,
        @JsonProperty("threshold") Double threshold,
        @JsonProperty("yes_child") Integer yesChild,
        @JsonProperty("no_child") Integer noChild,
        @JsonProperty("leaf_value") Double leafValue
) {

    public static RawNode split(int id, String feature, double threshold, int yesChild, int noChild) {
        return new RawNode(id, feature, threshold, yesChild, noChild, null);
    }

    public static RawNode leaf(int id, double value) {
        return new RawNode(id, null, null, null, null, value);
    }

    public boolean hasPredicate() {
        return feature != null || threshold != null;
    }

    public boolean hasChildren() {
        return yesChild != null || noChild != null;
    }

    public boolean isLeaf() {
        return leafValue != null;
    }
}
