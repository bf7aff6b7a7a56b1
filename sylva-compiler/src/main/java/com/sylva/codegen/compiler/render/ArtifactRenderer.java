/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.compiler.render;

import com.sylva.codegen.api.backend.BackendDescriptor;
import com.sylva.codegen.api.model.FeatureMapping;
import com.sylva.codegen.api.model.FeatureReference;
import com.sylva.codegen.api.model.Node;
import com.sylva.codegen.api.model.Tree;
import com.sylva.codegen.api.model.TreeEnsemble;
import com.sylva.codegen.compiler.numeric.NumericQuantizer;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Produces the derived per-backend artifacts that are not needed to run the emitted code:
 * the feature-name-to-index listing, the per-tree instruction dump and the formatted
 * input vector.
 */
public class ArtifactRenderer {

    private final TemplateRenderer renderer;
    private final LiteralFormatter literals;

    public ArtifactRenderer(TemplateRenderer renderer, LiteralFormatter literals) {
        this.renderer = renderer;
        this.literals = literals;
    }

    /**
     * One comment line per referenced feature, ordered by index: {@code // f34 -> 34}.
     */
    public String featureMappingListing(FeatureMapping mapping, BackendDescriptor descriptor) {
        StringBuilder out = new StringBuilder();
        String prefix = commentPrefix(descriptor);
        for (FeatureReference reference : mapping.references()) {
            out.append(prefix).append(reference.name()).append(" -> ").append(reference.index()).append('\n');
        }
        return out.toString();
    }

    /**
     * A readable listing of every node of the first {@code treeLimit} trees, in depth-first
     * order with the yes branch first. Node numbers are the dump ids.
     */
    public String instructionDump(TreeEnsemble ensemble, int treeLimit, BackendDescriptor descriptor) {
        CodeAssembler.validateTreeLimit(treeLimit, ensemble.treeCount());
        String prefix = commentPrefix(descriptor);
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < treeLimit; i++) {
            Tree tree = ensemble.tree(i);
            out.append(prefix).append(String.format("tree %d: %d splits, %d leaves\n",
                    tree.getIndex(), tree.getSplitCount(), tree.getLeafCount()));
            for (String line : instructions(tree)) {
                out.append(prefix).append("  ").append(line).append('\n');
            }
        }
        return out.toString();
    }

    /**
     * Quantizes a raw feature vector and writes it in the backend's input syntax.
     */
    public String inputVector(double[] features, BackendDescriptor descriptor) {
        long[] quantized = NumericQuantizer.quantizeAll(features);
        BackendDescriptor.InputFormat format = descriptor.input();
        List<String> elements = new ArrayList<>(quantized.length);
        for (long value : quantized) {
            Map<String, String> parts = literals.valueParts(value, descriptor);
            elements.add(renderer.render("input.element", format.element(), parts));
        }
        return nullToEmpty(format.prefix()) + String.join(nullToEmpty(format.separator()), elements)
                + nullToEmpty(format.suffix());
    }

    private List<String> instructions(Tree tree) {
        List<String> lines = new ArrayList<>(tree.size());
        IntArrayList stack = new IntArrayList();
        stack.push(0);
        while (!stack.isEmpty()) {
            Node node = tree.getNode(stack.popInt());
            if (node instanceof Node.Split split) {
                lines.add(String.format("[%d] if f[%d] (%s) <= %d then [%d] else [%d]",
                        split.id(), split.feature().index(), split.feature().name(), split.threshold(),
                        tree.getNode(split.yes()).id(), tree.getNode(split.no()).id()));
                stack.push(split.no());
                stack.push(split.yes());
            } else {
                Node.Leaf leaf = (Node.Leaf) node;
                lines.add(String.format("[%d] leaf %d", leaf.id(), leaf.value()));
            }
        }
        return lines;
    }

    private static String commentPrefix(BackendDescriptor descriptor) {
        String marker = descriptor.commentPrefix();
        return marker == null || marker.isEmpty() ? "" : marker + " ";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
