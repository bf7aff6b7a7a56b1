/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.model;

import java.util.Objects;

/**
 * A symbolic feature name paired with its resolved dense index.
 */
public record FeatureReference(String name, int index) {

    public FeatureReference {
        Objects.requireNonNull(name, "Feature name cannot be null");
        if (index < 0) {
            throw new IllegalArgumentException("Feature index cannot be negative: " + index);
        }
    }

    @Override
    public String toString() {
        return name + "->" + index;
    }
}
