/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.compiler.render;

import com.sylva.codegen.api.backend.BackendDescriptor;
import com.sylva.codegen.api.backend.BackendDescriptor.ControlSyntax;
import com.sylva.codegen.api.model.Node;
import com.sylva.codegen.api.model.Tree;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the nested conditional body of a single tree using a backend descriptor.
 *
 * <p>For each split the descriptor's {@code open}/{@code else}/{@code close} lines are emitted
 * around the yes and no subtrees, with {@code ${condition}} bound to the descriptor's {@code le}
 * operator applied to the feature access and the threshold literal. For each leaf the
 * {@code leaf} lines are emitted with {@code ${value}} and {@code ${add}}, the latter being the
 * {@code add} operator applied to the accumulator and the leaf literal. The root uses the
 * {@code root_*} variants, where {@code ${add}} accumulates the tree result variable instead.
 *
 * <p>The root sits at depth 1; each level adds one indentation unit. Every emitted line ends
 * with a newline. Blank pattern lines are emitted without indentation.
 */
public class TreeLogicRenderer {

    private final TemplateRenderer renderer;
    private final LiteralFormatter literals;

    public TreeLogicRenderer(TemplateRenderer renderer, LiteralFormatter literals) {
        this.renderer = renderer;
        this.literals = literals;
    }

    public String render(Tree tree, BackendDescriptor descriptor) {
        StringBuilder out = new StringBuilder(tree.size() * 48);
        renderNode(tree, tree.getRoot(), 1, true, descriptor, out);
        return out.toString();
    }

    private void renderNode(Tree tree, Node node, int depth, boolean root,
                            BackendDescriptor descriptor, StringBuilder out) {
        ControlSyntax control = descriptor.control();
        String indent = descriptor.indentation().unit().repeat(depth);
        Map<String, String> values = baseValues(tree, descriptor);

        if (node instanceof Node.Leaf leaf) {
            String literal = literals.literal(leaf.value(), descriptor);
            values.put("value", literal);
            values.put("add", add(descriptor, descriptor.accumulator(), literal));
            emit(root ? "control.root_leaf" : "control.leaf",
                    root ? control.rootLeaf() : control.leaf(), indent, values, out);
            return;
        }

        Node.Split split = (Node.Split) node;
        String feature = renderer.render("feature_access", descriptor.featureAccess(),
                Map.of("index", Integer.toString(split.feature().index())));
        String threshold = literals.literal(split.threshold(), descriptor);
        values.put("feature", feature);
        values.put("feature_index", Integer.toString(split.feature().index()));
        values.put("feature_name", split.feature().name());
        values.put("threshold", threshold);
        values.put("condition", renderer.render("operators.le", descriptor.operators().lessOrEqual(),
                Map.of("lhs", feature, "rhs", threshold)));

        emit(root ? "control.root_open" : "control.open",
                root ? control.rootOpen() : control.open(), indent, values, out);
        renderNode(tree, tree.getNode(split.yes()), depth + 1, false, descriptor, out);
        emit("control.else", control.elseBranch(), indent, values, out);
        renderNode(tree, tree.getNode(split.no()), depth + 1, false, descriptor, out);

        if (root) {
            values.put("add", add(descriptor, descriptor.accumulator(), descriptor.treeResult()));
            emit("control.root_close", control.rootClose(), indent, values, out);
        } else {
            emit("control.close", control.close(), indent, values, out);
        }
    }

    private Map<String, String> baseValues(Tree tree, BackendDescriptor descriptor) {
        Map<String, String> values = new HashMap<>();
        values.put("accumulator", descriptor.accumulator());
        values.put("tree_result", descriptor.treeResult());
        values.put("tree_index", Integer.toString(tree.getIndex()));
        return values;
    }

    private String add(BackendDescriptor descriptor, String lhs, String rhs) {
        return renderer.render("operators.add", descriptor.operators().add(), Map.of("lhs", lhs, "rhs", rhs));
    }

    private void emit(String patternName, List<String> lines, String indent,
                      Map<String, String> values, StringBuilder out) {
        for (String line : lines) {
            if (line.isEmpty()) {
                out.append('\n');
                continue;
            }
            out.append(indent).append(renderer.render(patternName, line, values)).append('\n');
        }
    }
}
