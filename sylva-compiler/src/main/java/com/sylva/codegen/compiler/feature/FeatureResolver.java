/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.compiler.feature;

import com.sylva.codegen.api.exceptions.UnknownFeatureException;
import com.sylva.codegen.api.model.FeatureMapping;
import com.sylva.codegen.api.model.FeatureReference;
import com.sylva.codegen.api.model.FeatureUniverse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Resolves symbolic feature identifiers to dense array indices of a declared universe.
 *
 * <p>Every backend addresses features by numeric index only. Name-based access is not
 * available in several target runtimes, so it is never emitted.
 *
 * <p>An identifier resolves by declared name first (e.g. {@code f34} or {@code Reflectivity_mean}).
 * An undeclared identifier of the form {@code f<digits>} or a plain non-negative integer resolves
 * by position, since booster dumps name splits {@code fN} whatever the column names were.
 */
public class FeatureResolver {
    private static final Logger logger = Logger.getLogger(FeatureResolver.class.getName());

    private final FeatureDictionary dictionary;
    private final FeatureUniverse universe;

    public FeatureResolver(FeatureUniverse universe) {
        this.universe = universe;
        this.dictionary = new FeatureDictionary(universe);
    }

    /**
     * @throws UnknownFeatureException if the identifier is outside the universe
     */
    public FeatureReference resolve(String identifier) {
        if (identifier == null) {
            throw new UnknownFeatureException("null", universe.size());
        }
        int index = dictionary.getId(identifier);
        if (index < 0 && isIndex(identifier)) {
            index = parseIndex(identifier);
        }
        if (index < 0 && identifier.length() > 1 && identifier.charAt(0) == 'f'
                && isIndex(identifier.substring(1))) {
            index = parseIndex(identifier.substring(1));
        }
        if (index < 0) {
            throw new UnknownFeatureException(identifier, universe.size());
        }
        return new FeatureReference(dictionary.decode(index), index);
    }

    /**
     * Resolves every referenced identifier, failing on the first unknown one.
     *
     * @param identifiers referenced identifiers, in first-reference order
     * @return the referenced features ordered by index
     */
    public FeatureMapping resolveAll(Collection<String> identifiers) {
        Map<String, FeatureReference> resolved = new LinkedHashMap<>();
        for (String identifier : identifiers) {
            FeatureReference reference = resolve(identifier);
            resolved.putIfAbsent(reference.name(), reference);
        }
        List<FeatureReference> references = new ArrayList<>(resolved.values());
        logger.fine(() -> String.format("Resolved %d referenced features out of %d declared",
                references.size(), universe.size()));
        return new FeatureMapping(references);
    }

    public FeatureUniverse getUniverse() {
        return universe;
    }

    private static boolean isIndex(String identifier) {
        if (identifier.isEmpty() || identifier.length() > 9) {
            return false;
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private int parseIndex(String identifier) {
        int index = Integer.parseInt(identifier);
        return index < universe.size() ? index : -1;
    }
}
