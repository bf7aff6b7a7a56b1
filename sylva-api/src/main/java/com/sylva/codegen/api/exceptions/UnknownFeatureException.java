/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.exceptions;

/**
 * Thrown when a split references a feature outside the declared feature universe.
 */
public class UnknownFeatureException extends ConversionException {

    private final String featureName;
    private final int universeSize;

    public UnknownFeatureException(String featureName, int universeSize) {
        super(String.format("Unknown feature '%s': not part of the declared universe of %d features",
                featureName, universeSize));
        this.featureName = featureName;
        this.universeSize = universeSize;
    }

    public String getFeatureName() {
        return featureName;
    }

    public int getUniverseSize() {
        return universeSize;
    }
}
