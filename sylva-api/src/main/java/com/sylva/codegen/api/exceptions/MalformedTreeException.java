/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.exceptions;

/**
 * Thrown when a raw per-tree node dump does not describe a single, connected,
 * full binary tree rooted at node 0.
 */
public class MalformedTreeException extends ConversionException {

    /** Node id used when the defect is not attached to a particular node. */
    public static final int NO_NODE = -1;

    private final int treeIndex;
    private final int nodeId;

    public MalformedTreeException(int treeIndex, int nodeId, String reason) {
        super(describe(treeIndex, nodeId, reason));
        this.treeIndex = treeIndex;
        this.nodeId = nodeId;
    }

    public MalformedTreeException(int treeIndex, String reason) {
        this(treeIndex, NO_NODE, reason);
    }

    public int getTreeIndex() {
        return treeIndex;
    }

    public int getNodeId() {
        return nodeId;
    }

    private static String describe(int treeIndex, int nodeId, String reason) {
        if (nodeId == NO_NODE) {
            return String.format("Malformed tree %d: %s", treeIndex, reason);
        }
        return String.format("Malformed tree %d, node %d: %s", treeIndex, nodeId, reason);
    }
}
