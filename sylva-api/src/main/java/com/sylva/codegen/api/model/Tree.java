/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One decision tree of an ensemble, stored as an arena of nodes.
 *
 * The root always occupies slot 0. Child links in {@link Node.Split} are arena slots.
 * Instances are immutable and are only created by the tree builder once the
 * structure has been validated.
 */
public final class Tree {
    private final int index;
    private final Node[] nodes;
    private final int splitCount;

    public Tree(int index, List<Node> nodes) {
        Objects.requireNonNull(nodes, "Tree nodes cannot be null");
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Tree " + index + " has no nodes");
        }
        this.index = index;
        this.nodes = nodes.toArray(new Node[0]);
        this.splitCount = (int) Arrays.stream(this.nodes).filter(n -> n instanceof Node.Split).count();
    }

    public int getIndex() { return index; }
    public Node getRoot() { return nodes[0]; }
    public Node getNode(int slot) { return nodes[slot]; }
    public int size() { return nodes.length; }
    public int getSplitCount() { return splitCount; }
    public int getLeafCount() { return nodes.length - splitCount; }

    public List<Node> getNodes() {
        return List.of(nodes);
    }

    @Override
    public String toString() {
        return String.format("Tree[index=%d, splits=%d, leaves=%d]", index, splitCount, getLeafCount());
    }
}
