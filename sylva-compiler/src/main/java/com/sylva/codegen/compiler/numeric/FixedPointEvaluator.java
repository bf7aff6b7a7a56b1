/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.compiler.numeric;

import com.sylva.codegen.api.exceptions.InvalidTreeLimitException;
import com.sylva.codegen.api.model.FixedPoint;
import com.sylva.codegen.api.model.Node;
import com.sylva.codegen.api.model.Tree;
import com.sylva.codegen.api.model.TreeEnsemble;

/**
 * Evaluates an ensemble directly on the IR with the arithmetic every emitted backend
 * implements: {@code <=} comparisons on pre-scaled integers and saturating accumulation
 * starting from zero.
 */
public final class FixedPointEvaluator {

    private FixedPointEvaluator() {
    }

    /**
     * @param ensemble  the ensemble to evaluate
     * @param features  input vector pre-scaled by the precision multiplier, at least as long as
     *                  the feature universe (callers pad short inputs with zeros)
     * @param treeLimit number of leading trees to sum
     * @return the accumulated prediction, scaled by the precision multiplier
     */
    public static long evaluate(TreeEnsemble ensemble, long[] features, int treeLimit) {
        if (treeLimit < 1 || treeLimit > ensemble.treeCount()) {
            throw new InvalidTreeLimitException(treeLimit, ensemble.treeCount());
        }
        if (features.length < ensemble.featureCount()) {
            throw new IllegalArgumentException(String.format(
                    "Expected at least %d features, got %d", ensemble.featureCount(), features.length));
        }
        long total = 0;
        for (int i = 0; i < treeLimit; i++) {
            total = FixedPoint.saturatingAdd(total, evaluateTree(ensemble.tree(i), features));
        }
        return total;
    }

    public static long evaluate(TreeEnsemble ensemble, long[] features) {
        return evaluate(ensemble, features, ensemble.treeCount());
    }

    /**
     * Returns the leaf value the given input reaches in one tree.
     */
    public static long evaluateTree(Tree tree, long[] features) {
        Node node = tree.getRoot();
        while (node instanceof Node.Split split) {
            long value = features[split.feature().index()];
            node = tree.getNode(value <= split.threshold() ? split.yes() : split.no());
        }
        return ((Node.Leaf) node).value();
    }
}
