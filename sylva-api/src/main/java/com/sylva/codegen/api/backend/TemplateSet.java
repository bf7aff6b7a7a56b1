/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.backend;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The named text templates of one backend.
 *
 * @param header emitted once, before everything else
 * @param tree   wraps the logic of a single tree
 * @param main   the entry point; wraps all tree fragments
 * @param extras additional templates appended after the entry point, keyed by name
 */
public record TemplateSet(String header, String tree, String main, Map<String, String> extras) {

    public static final String HEADER = "header";
    public static final String TREE = "tree";
    public static final String MAIN = "main";

    public TemplateSet {
        Objects.requireNonNull(header, "Header template cannot be null");
        Objects.requireNonNull(tree, "Tree template cannot be null");
        Objects.requireNonNull(main, "Main template cannot be null");
        extras = extras != null ? Map.copyOf(extras) : Map.of();
    }

    public TemplateSet(String header, String tree, String main) {
        this(header, tree, main, Map.of());
    }

    public Optional<String> extra(String name) {
        return Optional.ofNullable(extras.get(name));
    }
}
