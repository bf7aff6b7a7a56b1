/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.exceptions;

/**
 * Thrown when the requested number of trees to emit is zero, negative or larger
 * than the ensemble.
 */
public class InvalidTreeLimitException extends ConversionException {

    private final int requestedLimit;
    private final int treeCount;

    public InvalidTreeLimitException(int requestedLimit, int treeCount) {
        super(String.format("Invalid tree limit %d: must be between 1 and %d", requestedLimit, treeCount));
        this.requestedLimit = requestedLimit;
        this.treeCount = treeCount;
    }

    public int getRequestedLimit() {
        return requestedLimit;
    }

    public int getTreeCount() {
        return treeCount;
    }
}
