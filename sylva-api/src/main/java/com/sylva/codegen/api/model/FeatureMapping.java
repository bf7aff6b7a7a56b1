/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The features referenced by one ensemble, ordered by index.
 */
public record FeatureMapping(List<FeatureReference> references) {

    public FeatureMapping {
        references = references.stream()
                .sorted(Comparator.comparingInt(FeatureReference::index))
                .toList();
    }

    public int size() {
        return references.size();
    }

    public Optional<FeatureReference> find(String name) {
        return references.stream().filter(ref -> ref.name().equals(name)).findFirst();
    }
}
