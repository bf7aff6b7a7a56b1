/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.compiler.render;

import com.sylva.codegen.api.backend.Backend;
import com.sylva.codegen.api.backend.BackendDescriptor;
import com.sylva.codegen.api.backend.TemplateSet;
import com.sylva.codegen.api.exceptions.BackendConfigurationException;
import com.sylva.codegen.api.exceptions.InvalidTreeLimitException;
import com.sylva.codegen.api.model.FixedPoint;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stitches rendered tree fragments into one emittable source unit.
 *
 * Layout: the header template once; then the main template, whose {@code ${tree_code}} holds
 * one {@code tree} template instance per emitted tree joined by newlines; then each extra
 * template named by the descriptor, in order. Parts are joined by a newline.
 *
 * Only the first {@code treeLimit} fragments are emitted. A prefix is a valid program on its
 * own: the accumulator starts at zero and only the included trees contribute.
 */
public class CodeAssembler {

    private final TemplateRenderer renderer;

    public CodeAssembler(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * @param fragments    rendered tree logic, one per tree in ensemble order
     * @param backend      the backend's descriptor and templates
     * @param featureCount size of the input array of the emitted code
     * @param treeCount    number of trees in the ensemble
     * @param treeLimit    number of leading trees to emit
     * @return the assembled source text
     * @throws InvalidTreeLimitException if {@code treeLimit} is below 1 or above {@code treeCount}
     */
    public String assemble(List<String> fragments, Backend backend, int featureCount, int treeCount, int treeLimit) {
        validateTreeLimit(treeLimit, treeCount);
        if (fragments.size() < treeLimit) {
            throw new IllegalArgumentException(String.format(
                    "Expected at least %d rendered fragments, got %d", treeLimit, fragments.size()));
        }

        TemplateSet templates = backend.templates();
        BackendDescriptor descriptor = backend.descriptor();
        Map<String, String> values = globalValues(descriptor, featureCount, treeLimit);

        List<String> treeCode = new ArrayList<>(treeLimit);
        for (int i = 0; i < treeLimit; i++) {
            treeCode.add(renderTree(templates, values, i, fragments.get(i)));
        }

        List<String> parts = new ArrayList<>();
        parts.add(renderer.render(TemplateSet.HEADER, templates.header(), values));

        Map<String, String> mainValues = new HashMap<>(values);
        mainValues.put("tree_code", String.join("\n", treeCode));
        parts.add(renderer.render(TemplateSet.MAIN, templates.main(), mainValues));

        for (String extraName : descriptor.extraTemplates()) {
            String extra = templates.extra(extraName).orElseThrow(() -> new BackendConfigurationException(
                    descriptor.name(), "extra template '" + extraName + "' is not loaded"));
            parts.add(renderer.render(extraName, extra, values));
        }
        return String.join("\n", parts);
    }

    /**
     * @throws InvalidTreeLimitException if {@code treeLimit} is below 1 or above {@code treeCount}
     */
    public static void validateTreeLimit(int treeLimit, int treeCount) {
        if (treeLimit < 1 || treeLimit > treeCount) {
            throw new InvalidTreeLimitException(treeLimit, treeCount);
        }
    }

    private String renderTree(TemplateSet templates, Map<String, String> values, int treeIndex, String logic) {
        Map<String, String> treeValues = new HashMap<>(values);
        treeValues.put("tree_index", Integer.toString(treeIndex));
        treeValues.put("tree_logic", logic);
        return renderer.render(TemplateSet.TREE, templates.tree(), treeValues);
    }

    private Map<String, String> globalValues(BackendDescriptor descriptor, int featureCount, int treeLimit) {
        Map<String, String> values = new HashMap<>();
        values.put("num_features", Integer.toString(featureCount));
        values.put("tree_count", Integer.toString(treeLimit));
        values.put("accumulator", descriptor.accumulator());
        values.put("tree_result", descriptor.treeResult());
        values.put("precision_multiplier", Long.toString(FixedPoint.PRECISION_MULTIPLIER));
        values.put("backend", descriptor.name());
        return values;
    }
}
