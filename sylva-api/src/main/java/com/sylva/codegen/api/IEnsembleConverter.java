/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api;

import com.sylva.codegen.api.backend.Backend;
import com.sylva.codegen.api.model.ConversionResult;
import com.sylva.codegen.api.model.FeatureUniverse;
import com.sylva.codegen.api.model.RawNode;
import com.sylva.codegen.api.model.TreeEnsemble;
import io.opentelemetry.api.trace.Tracer;

import java.util.List;

/**
 * Contract for converting a tree ensemble into target-language source code.
 */
public interface IEnsembleConverter {

    /**
     * Builds the ensemble IR from raw per-tree dumps.
     *
     * @param dumps    one node list per tree, in evaluation order
     * @param universe the declared feature universe
     * @return the validated, quantized ensemble
     * @throws com.sylva.codegen.api.exceptions.MalformedTreeException  if a dump is not a valid tree
     * @throws com.sylva.codegen.api.exceptions.UnknownFeatureException if a split uses an undeclared feature
     */
    TreeEnsemble buildEnsemble(List<List<RawNode>> dumps, FeatureUniverse universe);

    /**
     * Emits source code for the first {@code treeLimit} trees of the ensemble.
     *
     * @throws com.sylva.codegen.api.exceptions.InvalidTreeLimitException     if the limit is out of range
     * @throws com.sylva.codegen.api.exceptions.UnresolvedPlaceholderException if the backend is inconsistent
     */
    ConversionResult convert(TreeEnsemble ensemble, Backend backend, int treeLimit);

    /**
     * Emits source code for the whole ensemble.
     */
    default ConversionResult convert(TreeEnsemble ensemble, Backend backend) {
        return convert(ensemble, backend, ensemble.treeCount());
    }

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a listener for tracking conversion progress.
     *
     * @param listener the conversion listener (null to disable)
     */
    default void setConversionListener(ConversionListener listener) {
    }
}
