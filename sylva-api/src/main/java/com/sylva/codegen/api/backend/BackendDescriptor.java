/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.backend;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data-only description of a target language's syntax, deserialized from {@code backend.json}.
 *
 * <p>Every string pattern uses the same {@code ${name}} placeholder grammar as the templates.
 * The renderer consumes a descriptor uniformly and never inspects {@link #name()}, so adding a
 * target is a matter of supplying a new descriptor and template set.
 *
 * <p>{@code extra_templates} are appended to the emitted source; {@code companion_files} maps a
 * template name to a file written next to the source (a build manifest, for instance).
 *
 * <p>Instances are immutable; list-valued components are copied on construction.
 */
public record BackendDescriptor(
        @JsonProperty("name") String name,
        @JsonProperty("file_extension") String fileExtension,
        @JsonProperty("comment_prefix") String commentPrefix,
        @JsonProperty("indentation") Indentation indentation,
        @JsonProperty("fixed_point") FixedPointFormat fixedPoint,
        @JsonProperty("operators") Operators operators,
        @JsonProperty("feature_access") String featureAccess,
        @JsonProperty("control") ControlSyntax control,
        @JsonProperty("accumulator") String accumulator,
        @JsonProperty("tree_result") String treeResult,
        @JsonProperty("input") InputFormat input,
        @JsonProperty("extra_templates") List<String> extraTemplates,
        @JsonProperty("companion_files") Map<String, String> companionFiles
) {

    public BackendDescriptor {
        extraTemplates = extraTemplates != null ? List.copyOf(extraTemplates) : List.of();
        companionFiles = companionFiles != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(companionFiles))
                : Map.of();
    }

    /**
     * Indentation style: {@code spaces} or {@code tabs}, repeated {@code size} times per level.
     */
    public record Indentation(
            @JsonProperty("type") String type,
            @JsonProperty("size") int size
    ) {
        public String unit() {
            String ch = "tabs".equalsIgnoreCase(type) ? "\t" : " ";
            return ch.repeat(size);
        }
    }

    /**
     * How a fixed-point constant is written.
     * {@code literal} may use {@code ${value}}, {@code ${magnitude}}, {@code ${positive}} and
     * {@code ${sign_bit}}.
     */
    public record FixedPointFormat(
            @JsonProperty("type") String type,
            @JsonProperty("literal") String literal,
            @JsonProperty("true_keyword") String trueKeyword,
            @JsonProperty("false_keyword") String falseKeyword
    ) {
    }

    /**
     * Call conventions of the two operators the emitted code needs.
     * Both take {@code ${lhs}} and {@code ${rhs}}.
     */
    public record Operators(
            @JsonProperty("le") String lessOrEqual,
            @JsonProperty("add") String add
    ) {
    }

    /**
     * Line patterns for the conditional structure of a tree.
     * Each entry is a list of lines emitted at the node's indentation.
     * {@code root_leaf} is used for a tree that consists of a single leaf and falls back to
     * {@code leaf} when absent.
     */
    public record ControlSyntax(
            @JsonProperty("root_open") List<String> rootOpen,
            @JsonProperty("open") List<String> open,
            @JsonProperty("else") List<String> elseBranch,
            @JsonProperty("close") List<String> close,
            @JsonProperty("root_close") List<String> rootClose,
            @JsonProperty("leaf") List<String> leaf,
            @JsonProperty("root_leaf") List<String> rootLeaf
    ) {
        public ControlSyntax {
            rootOpen = copy(rootOpen);
            open = copy(open);
            elseBranch = copy(elseBranch);
            close = copy(close);
            rootClose = copy(rootClose);
            leaf = copy(leaf);
            rootLeaf = rootLeaf != null ? copy(rootLeaf) : leaf;
        }

        private static List<String> copy(List<String> lines) {
            // Null lines are kept so the loader can report them.
            return lines != null ? Collections.unmodifiableList(new ArrayList<>(lines)) : null;
        }
    }

    /**
     * How a quantized input vector is written for the backend's runtime.
     * {@code element} uses the same placeholders as {@link FixedPointFormat#literal()}.
     */
    public record InputFormat(
            @JsonProperty("prefix") String prefix,
            @JsonProperty("element") String element,
            @JsonProperty("separator") String separator,
            @JsonProperty("suffix") String suffix
    ) {
    }
}
