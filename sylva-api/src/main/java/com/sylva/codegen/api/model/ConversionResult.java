/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.model;

/**
 * The output of one conversion run: source text for one backend and one tree limit.
 *
 * @param backendName   name of the backend that produced the source
 * @param fileExtension extension the source should be written with, including the dot
 * @param treeCount     number of trees emitted
 * @param featureCount  size of the input array the emitted code expects
 * @param source        the emitted source text
 */
public record ConversionResult(
        String backendName,
        String fileExtension,
        int treeCount,
        int featureCount,
        String source
) {
}
