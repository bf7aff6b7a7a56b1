/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.compiler.feature;

import com.sylva.codegen.api.model.FeatureUniverse;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Maps feature names of a declared universe to their dense indices and back.
 * Built once per universe; read-only afterwards.
 */
public final class FeatureDictionary {

    private final Object2IntMap<String> nameToIndex;
    private final FeatureUniverse universe;

    public FeatureDictionary(FeatureUniverse universe) {
        this.universe = universe;
        this.nameToIndex = new Object2IntOpenHashMap<>(universe.size());
        this.nameToIndex.defaultReturnValue(-1);
        for (int i = 0; i < universe.size(); i++) {
            nameToIndex.put(universe.name(i), i);
        }
    }

    /**
     * Gets the index for a given name.
     *
     * @param name The feature name.
     * @return The dense index, or -1 if the name is not declared.
     */
    public int getId(String name) {
        return nameToIndex.getInt(name);
    }

    /**
     * Decodes an index back to its feature name.
     *
     * @return The feature name, or null if the index is out of range.
     */
    public String decode(int index) {
        if (index >= 0 && index < universe.size()) {
            return universe.name(index);
        }
        return null;
    }

    public int size() {
        return universe.size();
    }
}
