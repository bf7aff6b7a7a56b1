/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.compiler;

import com.sylva.codegen.api.exceptions.MalformedTreeException;
import com.sylva.codegen.api.model.Node;
import com.sylva.codegen.api.model.RawNode;
import com.sylva.codegen.api.model.Tree;
import com.sylva.codegen.compiler.feature.FeatureResolver;
import com.sylva.codegen.compiler.numeric.NumericQuantizer;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a raw per-tree node dump into a validated, quantized {@link Tree}.
 *
 * The transformation is pure. Validation steps:
 * 1. Node-level: every node is exactly one of a complete split (feature, threshold, yes, no)
 *    or a leaf, with finite numbers and a unique, non-negative id.
 * 2. Link-level: every child id resolves to a node of the same dump.
 * 3. Graph-level: walking from node 0 reaches every node exactly once, which rules out
 *    shared subtrees, cycles and disconnected fragments.
 *
 * Nodes are stored in an arena ordered by ascending dump id, so the root lands in slot 0.
 * Branch order is kept as declared: yes first.
 */
public class TreeIrBuilder {

    private final FeatureResolver resolver;

    public TreeIrBuilder(FeatureResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @param treeIndex position of the tree in the ensemble, used in diagnostics
     * @param dump      the raw nodes, in any order
     * @return the built tree
     * @throws MalformedTreeException if the dump is structurally invalid
     * @throws com.sylva.codegen.api.exceptions.UnknownFeatureException if a split uses an undeclared feature
     */
    public Tree build(int treeIndex, List<RawNode> dump) {
        if (dump == null || dump.isEmpty()) {
            throw new MalformedTreeException(treeIndex, "dump contains no nodes");
        }

        Map<Integer, RawNode> byId = indexById(treeIndex, dump);
        if (!byId.containsKey(0)) {
            throw new MalformedTreeException(treeIndex, "no root node with id 0");
        }
        for (RawNode node : byId.values()) {
            validateNode(treeIndex, node);
        }
        for (RawNode node : byId.values()) {
            if (node.hasChildren()) {
                requireResolvable(treeIndex, node, node.yesChild(), byId);
                requireResolvable(treeIndex, node, node.noChild(), byId);
            }
        }
        validateSingleTree(treeIndex, byId);

        Int2IntOpenHashMap slotOf = new Int2IntOpenHashMap(byId.size());
        int slot = 0;
        for (int id : byId.keySet()) {
            slotOf.put(id, slot++);
        }

        List<Node> arena = new ArrayList<>(byId.size());
        for (RawNode raw : byId.values()) {
            arena.add(toNode(raw, slotOf));
        }

        Tree tree = new Tree(treeIndex, arena);
        if (tree.getLeafCount() != tree.getSplitCount() + 1) {
            throw new MalformedTreeException(treeIndex, String.format(
                    "not a full binary tree: %d splits, %d leaves", tree.getSplitCount(), tree.getLeafCount()));
        }
        return tree;
    }

    private Map<Integer, RawNode> indexById(int treeIndex, List<RawNode> dump) {
        Map<Integer, RawNode> byId = new TreeMap<>();
        for (RawNode node : dump) {
            if (node == null) {
                throw new MalformedTreeException(treeIndex, "dump contains a null node");
            }
            if (node.id() < 0) {
                throw new MalformedTreeException(treeIndex, node.id(), "node id cannot be negative");
            }
            if (byId.putIfAbsent(node.id(), node) != null) {
                throw new MalformedTreeException(treeIndex, node.id(), "duplicate node id");
            }
        }
        return byId;
    }

    private void validateNode(int treeIndex, RawNode node) {
        int id = node.id();
        if (node.hasChildren() && !node.hasPredicate()) {
            throw new MalformedTreeException(treeIndex, id, "declares children but no split predicate");
        }
        if (node.hasPredicate() && !node.hasChildren()) {
            throw new MalformedTreeException(treeIndex, id, "declares a split predicate but no children");
        }
        if (node.hasPredicate() && node.isLeaf()) {
            throw new MalformedTreeException(treeIndex, id, "is both a split and a leaf");
        }
        if (!node.hasPredicate() && !node.isLeaf()) {
            throw new MalformedTreeException(treeIndex, id, "is neither a split nor a leaf");
        }

        if (node.hasPredicate()) {
            if (node.feature() == null || node.feature().isBlank()) {
                throw new MalformedTreeException(treeIndex, id, "split predicate has no feature");
            }
            if (node.threshold() == null || !Double.isFinite(node.threshold())) {
                throw new MalformedTreeException(treeIndex, id, "split threshold must be a finite number");
            }
            if (node.yesChild() == null || node.noChild() == null) {
                throw new MalformedTreeException(treeIndex, id, "split must declare both a yes and a no child");
            }
        } else if (!Double.isFinite(node.leafValue())) {
            throw new MalformedTreeException(treeIndex, id, "leaf value must be a finite number");
        }
    }

    private void requireResolvable(int treeIndex, RawNode parent, int childId, Map<Integer, RawNode> byId) {
        if (!byId.containsKey(childId)) {
            throw new MalformedTreeException(treeIndex, parent.id(),
                    "child id " + childId + " does not resolve to a node in the same dump");
        }
    }

    private void validateSingleTree(int treeIndex, Map<Integer, RawNode> byId) {
        IntSet visited = new IntOpenHashSet(byId.size());
        IntArrayList stack = new IntArrayList();
        stack.push(0);
        visited.add(0);

        while (!stack.isEmpty()) {
            RawNode node = byId.get(stack.popInt());
            if (!node.hasChildren()) continue;

            for (int childId : new int[]{node.yesChild(), node.noChild()}) {
                if (!visited.add(childId)) {
                    throw new MalformedTreeException(treeIndex, childId,
                            "reachable through more than one parent (shared subtree or cycle)");
                }
                stack.push(childId);
            }
        }

        if (visited.size() != byId.size()) {
            int orphan = byId.keySet().stream().filter(id -> !visited.contains(id)).findFirst().orElse(-1);
            throw new MalformedTreeException(treeIndex, orphan, "not reachable from root node 0");
        }
    }

    private Node toNode(RawNode raw, Int2IntOpenHashMap slotOf) {
        if (raw.isLeaf()) {
            return new Node.Leaf(raw.id(), NumericQuantizer.quantize(raw.leafValue()));
        }
        return new Node.Split(
                raw.id(),
                resolver.resolve(raw.feature()),
                NumericQuantizer.quantize(raw.threshold()),
                slotOf.get(raw.yesChild().intValue()),
                slotOf.get(raw.noChild().intValue()));
    }
}
