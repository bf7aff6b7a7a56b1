/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The fixed-size, ordered domain of all inputs a model accepts.
 * A feature's dense index is its position in {@link #names()}.
 */
public record FeatureUniverse(List<String> names) {

    /** Prefix of the feature names XGBoost assigns when a booster carries no names. */
    public static final String DEFAULT_PREFIX = "f";

    public FeatureUniverse {
        Objects.requireNonNull(names, "Feature names cannot be null");
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Feature universe cannot be empty");
        }
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Feature names cannot be null or blank");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate feature name: " + name);
            }
        }
        names = List.copyOf(names);
    }

    /**
     * Declares the universe {@code f0 .. f(count-1)}.
     */
    public static FeatureUniverse ofCount(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Feature count must be positive, got " + count);
        }
        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            names.add(DEFAULT_PREFIX + i);
        }
        return new FeatureUniverse(names);
    }

    public int size() {
        return names.size();
    }

    public String name(int index) {
        return names.get(index);
    }
}
