/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api;

import java.util.Map;

/**
 * Callback interface for conversion stage events.
 *
 * <p>A conversion run consists of the following stages:
 * <ol>
 *   <li>TREE_BUILDING - Resolve features, validate and quantize every tree</li>
 *   <li>RENDERING - Render one fragment per emitted tree</li>
 *   <li>ASSEMBLY - Stitch header, fragments, entry point and extras together</li>
 * </ol>
 * TREE_BUILDING belongs to {@link IEnsembleConverter#buildEnsemble}; the other two to
 * {@link IEnsembleConverter#convert}.
 */
public interface ConversionListener {

    String TREE_BUILDING = "TREE_BUILDING";
    String RENDERING = "RENDERING";
    String ASSEMBLY = "ASSEMBLY";

    /**
     * Called when a stage starts.
     *
     * @param stageName   Name of the stage
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a stage completes successfully.
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a stage fails. The exception is rethrown afterwards.
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single stage.
     *
     * @param stageName     Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics       Stage-specific metrics (e.g., "treeCount", "nodeCount")
     */
    record StageResult(
            String stageName,
            long durationNanos,
            Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
