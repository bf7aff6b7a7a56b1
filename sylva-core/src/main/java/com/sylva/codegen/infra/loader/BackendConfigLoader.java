/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.infra.loader;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sylva.codegen.api.backend.Backend;
import com.sylva.codegen.api.backend.BackendDescriptor;
import com.sylva.codegen.api.backend.TemplateSet;
import com.sylva.codegen.api.exceptions.BackendConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Loads backends from {@code <root>/<name>/backend.json} plus the {@code header}, {@code tree}
 * and {@code main} templates and any extra or companion templates the descriptor names, each stored as
 * {@code <template>.template}.
 *
 * <p>The root is either a classpath prefix (the bundled {@code backends/} resources) or a
 * directory on disk. Loaded backends are memoized by name; a {@link Backend} is immutable, so the
 * same instance can serve every conversion run.
 */
public class BackendConfigLoader {
    private static final Logger logger = Logger.getLogger(BackendConfigLoader.class.getName());

    public static final String DEFAULT_CLASSPATH_ROOT = "backends";
    static final String DESCRIPTOR_FILE = "backend.json";
    static final String TEMPLATE_SUFFIX = ".template";

    private static final int MAX_CACHED_BACKENDS = 64;

    private final ObjectMapper objectMapper;
    private final Path directory;
    private final String classpathRoot;
    private final Cache<String, Backend> backends;

    private BackendConfigLoader(Path directory, String classpathRoot) {
        this.directory = directory;
        this.classpathRoot = classpathRoot;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.backends = Caffeine.newBuilder()
                .maximumSize(MAX_CACHED_BACKENDS)
                .build();
    }

    /**
     * A loader over the backends bundled with the converter.
     */
    public static BackendConfigLoader fromClasspath() {
        return fromClasspath(DEFAULT_CLASSPATH_ROOT);
    }

    public static BackendConfigLoader fromClasspath(String root) {
        return new BackendConfigLoader(null, root);
    }

    /**
     * A loader over backend directories below {@code directory}.
     */
    public static BackendConfigLoader fromDirectory(Path directory) {
        return new BackendConfigLoader(directory, null);
    }

    /**
     * @throws BackendConfigurationException if the backend is missing, unreadable or incomplete
     */
    public Backend load(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Backend name cannot be null or blank");
        }
        try {
            return backends.get(name, this::read);
        } catch (UncheckedIOException e) {
            throw new BackendConfigurationException(name, "cannot be read: " + e.getCause().getMessage(),
                    e.getCause());
        }
    }

    private Backend read(String name) {
        try {
            String descriptorJson = resource(name, DESCRIPTOR_FILE);
            if (descriptorJson == null) {
                throw new BackendConfigurationException(name, "no " + DESCRIPTOR_FILE + " found in " + location(name));
            }
            BackendDescriptor descriptor = objectMapper.readValue(descriptorJson, BackendDescriptor.class);
            validate(name, descriptor);

            TemplateSet templates = new TemplateSet(
                    template(name, TemplateSet.HEADER),
                    template(name, TemplateSet.TREE),
                    template(name, TemplateSet.MAIN),
                    extras(name, descriptor));

            logger.info(String.format("Loaded backend '%s' from %s (%d extra templates)",
                    descriptor.name(), location(name), templates.extras().size()));
            return new Backend(descriptor, templates);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Map<String, String> extras(String name, BackendDescriptor descriptor) throws IOException {
        Map<String, String> extras = new LinkedHashMap<>();
        for (String extra : descriptor.extraTemplates()) {
            extras.put(extra, template(name, extra));
        }
        for (String companion : descriptor.companionFiles().keySet()) {
            extras.putIfAbsent(companion, template(name, companion));
        }
        return extras;
    }

    private String template(String name, String templateName) throws IOException {
        String text = resource(name, templateName + TEMPLATE_SUFFIX);
        if (text == null) {
            throw new BackendConfigurationException(name, "missing template '" + templateName + "'");
        }
        // Editors add a final newline; the assembler supplies its own separators.
        if (text.endsWith("\r\n")) {
            return text.substring(0, text.length() - 2);
        }
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }

    private String resource(String name, String file) throws IOException {
        if (directory != null) {
            Path path = directory.resolve(name).resolve(file);
            return Files.isRegularFile(path) ? Files.readString(path, StandardCharsets.UTF_8) : null;
        }
        String resourceName = classpathRoot + "/" + name + "/" + file;
        try (InputStream in = BackendConfigLoader.class.getClassLoader().getResourceAsStream(resourceName)) {
            return in != null ? new String(in.readAllBytes(), StandardCharsets.UTF_8) : null;
        }
    }

    private String location(String name) {
        return directory != null
                ? directory.resolve(name).toString()
                : "classpath:" + classpathRoot + "/" + name;
    }

    static void validate(String name, BackendDescriptor descriptor) {
        require(name, descriptor.name(), "name");
        if (!name.equals(descriptor.name())) {
            throw new BackendConfigurationException(name,
                    "descriptor declares name '" + descriptor.name() + "'");
        }
        require(name, descriptor.fileExtension(), "file_extension");
        if (!descriptor.fileExtension().startsWith(".")) {
            throw new BackendConfigurationException(name, "file_extension must start with '.'");
        }
        require(name, descriptor.featureAccess(), "feature_access");
        require(name, descriptor.accumulator(), "accumulator");
        require(name, descriptor.treeResult(), "tree_result");

        BackendDescriptor.Indentation indentation = descriptor.indentation();
        requirePresent(name, indentation, "indentation");
        if (indentation.size() < 0) {
            throw new BackendConfigurationException(name, "indentation.size cannot be negative");
        }

        BackendDescriptor.FixedPointFormat fixedPoint = descriptor.fixedPoint();
        requirePresent(name, fixedPoint, "fixed_point");
        require(name, fixedPoint.literal(), "fixed_point.literal");
        require(name, fixedPoint.trueKeyword(), "fixed_point.true_keyword");
        require(name, fixedPoint.falseKeyword(), "fixed_point.false_keyword");

        BackendDescriptor.Operators operators = descriptor.operators();
        requirePresent(name, operators, "operators");
        require(name, operators.lessOrEqual(), "operators.le");
        require(name, operators.add(), "operators.add");

        BackendDescriptor.ControlSyntax control = descriptor.control();
        requirePresent(name, control, "control");
        requireLines(name, control.rootOpen(), "control.root_open");
        requireLines(name, control.open(), "control.open");
        requireLines(name, control.elseBranch(), "control.else");
        requireLines(name, control.close(), "control.close");
        requireLines(name, control.rootClose(), "control.root_close");
        requireLines(name, control.leaf(), "control.leaf");
        requireLines(name, control.rootLeaf(), "control.root_leaf");

        BackendDescriptor.InputFormat input = descriptor.input();
        requirePresent(name, input, "input");
        require(name, input.element(), "input.element");

        for (String extra : descriptor.extraTemplates()) {
            require(name, extra, "extra_templates[]");
        }
        descriptor.companionFiles().forEach((template, file) -> {
            require(name, template, "companion_files key");
            require(name, file, "companion_files." + template);
        });
    }

    private static void require(String name, String value, String key) {
        if (value == null || value.isEmpty()) {
            throw new BackendConfigurationException(name, "missing required key '" + key + "'");
        }
    }

    private static void requirePresent(String name, Object value, String key) {
        if (value == null) {
            throw new BackendConfigurationException(name, "missing required key '" + key + "'");
        }
    }

    private static void requireLines(String name, List<String> lines, String key) {
        requirePresent(name, lines, key);
        if (lines.contains(null)) {
            throw new BackendConfigurationException(name, "null line in '" + key + "'");
        }
    }
}
