/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.infra.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sylva.codegen.api.model.RawNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads the JSON text dump of an XGBoost booster into one list of {@link RawNode}s per tree.
 *
 * Three layouts are accepted at the top level, which must be a JSON array with one element per
 * tree, in ensemble order:
 * <ul>
 *   <li>nested tree objects, as written by {@code booster.get_dump(dump_format='json')} joined
 *       into an array: {@code {"nodeid", "split", "split_condition", "yes", "no", "children"}}
 *       for splits and {@code {"nodeid", "leaf"}} for leaves;</li>
 *   <li>strings, each holding one nested tree as JSON text (the raw {@code get_dump} list);</li>
 *   <li>arrays of flat nodes {@code {"id", "feature", "threshold", "yes_child", "no_child",
 *       "leaf_value"}}.</li>
 * </ul>
 * The loader only extracts fields; structural validation happens when trees are built. The
 * {@code missing} branch of a split is ignored: the emitted code has no notion of absent values.
 */
public class XGBoostDumpLoader {
    private static final Logger logger = Logger.getLogger(XGBoostDumpLoader.class.getName());

    private final ObjectMapper objectMapper;

    public XGBoostDumpLoader() {
        this(new ObjectMapper());
    }

    public XGBoostDumpLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<List<RawNode>> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Model dump not found: " + path);
        }
        List<List<RawNode>> dumps = parse(Files.readString(path));
        logger.info(String.format("Loaded %d trees (%d nodes) from %s", dumps.size(),
                dumps.stream().mapToInt(List::size).sum(), path));
        return dumps;
    }

    public List<List<RawNode>> parse(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of trees at the root of the dump");
        }
        List<List<RawNode>> dumps = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode tree = root.get(i);
            if (tree.isTextual()) {
                dumps.add(flattenNested(i, readTextualTree(i, tree.asText())));
            } else if (tree.isObject()) {
                dumps.add(flattenNested(i, tree));
            } else if (tree.isArray()) {
                dumps.add(readFlat(i, tree));
            } else {
                throw new IOException(String.format("Tree %d: expected an object, string or array, got %s",
                        i, tree.getNodeType()));
            }
        }
        return dumps;
    }

    private JsonNode readTextualTree(int treeIndex, String text) throws IOException {
        try {
            JsonNode tree = objectMapper.readTree(text);
            if (tree == null || !tree.isObject()) {
                throw new IOException(String.format("Tree %d: string does not hold a JSON object", treeIndex));
            }
            return tree;
        } catch (JsonProcessingException e) {
            throw new IOException(String.format("Tree %d: invalid JSON in string element", treeIndex), e);
        }
    }

    private List<RawNode> flattenNested(int treeIndex, JsonNode root) throws IOException {
        List<RawNode> nodes = new ArrayList<>();
        Deque<JsonNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            JsonNode node = pending.pop();
            if (!node.isObject()) {
                throw new IOException(String.format("Tree %d: child is not a JSON object", treeIndex));
            }
            nodes.add(new RawNode(
                    requiredInt(treeIndex, node, "nodeid"),
                    optionalText(node, "split"),
                    optionalDouble(treeIndex, node, "split_condition"),
                    optionalInt(treeIndex, node, "yes"),
                    optionalInt(treeIndex, node, "no"),
                    optionalDouble(treeIndex, node, "leaf")));

            JsonNode children = node.get("children");
            if (children != null) {
                if (!children.isArray()) {
                    throw new IOException(String.format("Tree %d: 'children' must be an array", treeIndex));
                }
                for (int c = children.size() - 1; c >= 0; c--) {
                    pending.push(children.get(c));
                }
            }
        }
        return nodes;
    }

    private List<RawNode> readFlat(int treeIndex, JsonNode tree) throws IOException {
        List<RawNode> nodes = new ArrayList<>(tree.size());
        for (JsonNode node : tree) {
            if (!node.isObject()) {
                throw new IOException(String.format("Tree %d: flat node is not a JSON object", treeIndex));
            }
            nodes.add(new RawNode(
                    requiredInt(treeIndex, node, "id"),
                    optionalText(node, "feature"),
                    optionalDouble(treeIndex, node, "threshold"),
                    optionalInt(treeIndex, node, "yes_child"),
                    optionalInt(treeIndex, node, "no_child"),
                    optionalDouble(treeIndex, node, "leaf_value")));
        }
        return nodes;
    }

    private static int requiredInt(int treeIndex, JsonNode node, String field) throws IOException {
        Integer value = optionalInt(treeIndex, node, field);
        if (value == null) {
            throw new IOException(String.format("Tree %d: node without '%s'", treeIndex, field));
        }
        return value;
    }

    private static Integer optionalInt(int treeIndex, JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IOException(String.format("Tree %d: '%s' must be an integer, got %s", treeIndex, field, value));
        }
        return value.intValue();
    }

    private static Double optionalDouble(int treeIndex, JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new IOException(String.format("Tree %d: '%s' must be a number, got %s", treeIndex, field, value));
        }
        return value.doubleValue();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
