/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.infra.output;

import com.sylva.codegen.api.backend.Backend;
import com.sylva.codegen.api.exceptions.BackendConfigurationException;
import com.sylva.codegen.api.model.ConversionResult;
import com.sylva.codegen.compiler.render.TemplateRenderer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Writes conversion output below an output directory.
 */
public class ConversionWriter {
    private static final Logger logger = Logger.getLogger(ConversionWriter.class.getName());

    public static final String FEATURE_LISTING_SUFFIX = ".features.txt";
    public static final String INSTRUCTION_DUMP_SUFFIX = ".instructions.txt";

    public static final String INPUT_VECTOR_SUFFIX = ".input.txt";

    private final Path outputDirectory;
    private final TemplateRenderer renderer = new TemplateRenderer();

    public ConversionWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Writes the source to {@code <outputDirectory>/<fileName>}, appending the backend's extension
     * unless {@code fileName} already ends with it. Existing files are replaced.
     *
     * @return the written path
     */
    public Path write(ConversionResult result, String fileName) throws IOException {
        Path target = outputDirectory.resolve(withExtension(fileName, result.fileExtension()));
        writeText(target, result.source());
        logger.info(String.format("Wrote %s source (%d trees, %d features) to %s",
                result.backendName(), result.treeCount(), result.featureCount(), target));
        return target;
    }

    /**
     * Writes the feature-name-to-index listing next to the sources.
     */
    public Path writeFeatureListing(String baseName, String listing) throws IOException {
        return writeArtifact(baseName + FEATURE_LISTING_SUFFIX, listing);
    }

    public Path writeInstructionDump(String baseName, String dump) throws IOException {
        return writeArtifact(baseName + INSTRUCTION_DUMP_SUFFIX, dump);
    }

    /**
     * Writes the formatted input vector the emitted program is run with.
     */
    public Path writeInputVector(String baseName, String input) throws IOException {
        return writeArtifact(baseName + INPUT_VECTOR_SUFFIX, input);
    }

    /**
     * Writes the backend's companion files next to {@code sourceFile}. Companion templates see
     * {@code ${source_file}} (the source's file name) and {@code ${backend}}.
     *
     * @return the written paths, in descriptor order
     */
    public List<Path> writeCompanions(Backend backend, Path sourceFile) throws IOException {
        List<Path> written = new ArrayList<>();
        Map<String, String> values = Map.of(
                "source_file", sourceFile.getFileName().toString(),
                "backend", backend.name());
        for (Map.Entry<String, String> companion : backend.descriptor().companionFiles().entrySet()) {
            String template = backend.templates().extra(companion.getKey())
                    .orElseThrow(() -> new BackendConfigurationException(backend.name(),
                            "companion template '" + companion.getKey() + "' is not loaded"));
            Path target = sourceFile.resolveSibling(companion.getValue());
            writeText(target, renderer.render(companion.getKey(), template, values) + "\n");
            logger.info(String.format("Wrote %s companion file %s", backend.name(), target));
            written.add(target);
        }
        return written;
    }

    static String withExtension(String fileName, String extension) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("Output file name cannot be null or blank");
        }
        if (extension == null || extension.isEmpty() || fileName.endsWith(extension)) {
            return fileName;
        }
        return fileName + extension;
    }

    private Path writeArtifact(String fileName, String text) throws IOException {
        Path target = outputDirectory.resolve(fileName);
        writeText(target, text);
        logger.fine(() -> "Wrote artifact " + target);
        return target;
    }

    private static void writeText(Path target, String text) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, text, StandardCharsets.UTF_8);
    }
}
