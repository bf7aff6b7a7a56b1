/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen;

import com.sylva.codegen.api.ConversionListener;
import com.sylva.codegen.api.backend.Backend;
import com.sylva.codegen.api.model.ConversionResult;
import com.sylva.codegen.api.model.FeatureUniverse;
import com.sylva.codegen.api.model.RawNode;
import com.sylva.codegen.api.model.TreeEnsemble;
import com.sylva.codegen.compiler.EnsembleConverter;
import com.sylva.codegen.infra.features.CachingFeatureNameLoader;
import com.sylva.codegen.infra.loader.BackendConfigLoader;
import com.sylva.codegen.infra.loader.XGBoostDumpLoader;
import com.sylva.codegen.infra.output.ConversionWriter;
import com.sylva.codegen.infra.telemetry.TracingService;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Command-line entry point: converts one XGBoost dump into every requested backend and tree limit.
 *
 * <p>Options are system properties:
 * <ul>
 *   <li>{@code sylva.model} - path of the JSON dump (required)</li>
 *   <li>{@code sylva.backend} - comma-separated backend names (default {@code zokrates,rust,python})</li>
 *   <li>{@code sylva.backends.dir} - directory of additional backends; the bundled ones otherwise</li>
 *   <li>{@code sylva.features} - feature-name file; {@code sylva.features.variant} picks an entry of a
 *       variant-keyed file</li>
 *   <li>{@code sylva.feature.count} - declares {@code f0..f(n-1)} when no name file is given</li>
 *   <li>{@code sylva.trees} - comma-separated tree limits (default: all trees)</li>
 *   <li>{@code sylva.output} - output directory (default {@code generated})</li>
 *   <li>{@code sylva.artifacts} - also write the feature listing and instruction dump</li>
 *   <li>{@code sylva.input} - raw feature vector to format for each backend</li>
 * </ul>
 */
public class ConverterApplication {
    private static final Logger logger = Logger.getLogger(ConverterApplication.class.getName());

    static final String DEFAULT_BACKENDS = "zokrates,rust,python";

    private final Options options;
    private final EnsembleConverter converter;
    private final XGBoostDumpLoader dumpLoader = new XGBoostDumpLoader();
    private final CachingFeatureNameLoader featureNameLoader = new CachingFeatureNameLoader();
    private final BackendConfigLoader backendLoader;
    private final ConversionWriter writer;

    ConverterApplication(Options options, TracingService tracingService) {
        this.options = options;
        this.converter = new EnsembleConverter(tracingService.getTracer());
        this.converter.setConversionListener(new LoggingListener());
        this.backendLoader = options.backendsDirectory() != null
                ? BackendConfigLoader.fromDirectory(options.backendsDirectory())
                : BackendConfigLoader.fromClasspath();
        this.writer = new ConversionWriter(options.outputDirectory());
    }

    public static void main(String[] args) {
        configureLogging();
        TracingService tracingService = TracingService.getInstance();
        try {
            List<Path> written = new ConverterApplication(Options.fromSystemProperties(), tracingService).run();
            logger.info("Conversion complete: " + written.size() + " files written");
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Conversion failed: " + e.getMessage(), e);
            tracingService.shutdown();
            System.exit(1);
        }
        tracingService.shutdown();
    }

    /**
     * @return every file written, in order
     */
    List<Path> run() throws IOException {
        List<List<RawNode>> dumps = dumpLoader.load(options.modelPath());
        TreeEnsemble ensemble = converter.buildEnsemble(dumps, universe());
        String baseName = baseName(options.modelPath());

        List<Path> written = new ArrayList<>();
        for (String backendName : options.backends()) {
            Backend backend = backendLoader.load(backendName);
            List<Integer> limits = options.treeLimits().isEmpty()
                    ? List.of(ensemble.treeCount())
                    : options.treeLimits();
            int largestLimit = Collections.max(limits);
            Path companionSource = null;
            for (int limit : limits) {
                ConversionResult result = converter.convert(ensemble, backend, limit);
                String stem = String.format("%s_%s_%dtrees", baseName, backendName, limit);
                Path source = writer.write(result, stem);
                written.add(source);
                if (limit == largestLimit) {
                    companionSource = source;
                }
                if (options.artifacts()) {
                    written.add(writer.writeInstructionDump(stem, converter.instructionDump(ensemble, backend, limit)));
                }
            }
            // One companion set per backend, bound to the largest emitted prefix.
            written.addAll(writer.writeCompanions(backend, companionSource));
            String backendStem = baseName + "_" + backendName;
            if (options.artifacts()) {
                written.add(writer.writeFeatureListing(backendStem, converter.featureMappingListing(ensemble, backend)));
            }
            if (options.inputPath() != null) {
                double[] input = readInput(options.inputPath(), ensemble.featureCount());
                written.add(writer.writeInputVector(backendStem, converter.formatInput(input, backend)));
            }
        }
        return written;
    }

    private FeatureUniverse universe() throws IOException {
        if (options.featuresPath() != null) {
            return featureNameLoader.loadUniverse(options.featuresPath(), options.featureVariant());
        }
        if (options.featureCount() > 0) {
            return FeatureUniverse.ofCount(options.featureCount());
        }
        throw new IllegalArgumentException("Either sylva.features or sylva.feature.count must be set");
    }

    /**
     * Reads comma or whitespace separated values, zero-padded to {@code featureCount}.
     */
    static double[] readInput(Path path, int featureCount) throws IOException {
        String[] tokens = Files.readString(path).trim().split("[,\\s]+");
        if (tokens.length > featureCount) {
            throw new IllegalArgumentException(String.format(
                    "Input holds %d values but the model declares %d features", tokens.length, featureCount));
        }
        double[] values = new double[featureCount];
        for (int i = 0; i < tokens.length; i++) {
            if (!tokens[i].isEmpty()) {
                values[i] = Double.parseDouble(tokens[i]);
            }
        }
        return values;
    }

    static String baseName(Path modelPath) {
        String name = modelPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void configureLogging() {
        try (InputStream in = ConverterApplication.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
                return;
            }
        } catch (IOException e) {
            System.err.println("Could not read logging.properties: " + e.getMessage());
        }
        LogManager.getLogManager().reset();
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.INFO);
        handler.setFormatter(new SimpleFormatter());
        Logger.getLogger("").addHandler(handler);
    }

    /**
     * Run options, read from system properties.
     */
    record Options(Path modelPath, List<String> backends, Path backendsDirectory, Path featuresPath,
                   String featureVariant, int featureCount, List<Integer> treeLimits, Path outputDirectory,
                   boolean artifacts, Path inputPath) {

        static Options fromSystemProperties() {
            String model = System.getProperty("sylva.model");
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("sylva.model must point to an XGBoost JSON dump");
            }
            return new Options(
                    Paths.get(model),
                    splitList(System.getProperty("sylva.backend", DEFAULT_BACKENDS)),
                    optionalPath("sylva.backends.dir"),
                    optionalPath("sylva.features"),
                    System.getProperty("sylva.features.variant"),
                    Integer.parseInt(System.getProperty("sylva.feature.count", "0")),
                    splitList(System.getProperty("sylva.trees", "")).stream().map(Integer::parseInt).toList(),
                    Paths.get(System.getProperty("sylva.output", "generated")),
                    Boolean.parseBoolean(System.getProperty("sylva.artifacts", "false")),
                    optionalPath("sylva.input"));
        }

        private static Path optionalPath(String property) {
            String value = System.getProperty(property);
            return value == null || value.isBlank() ? null : Paths.get(value);
        }

        private static List<String> splitList(String value) {
            return Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
    }

    private static final class LoggingListener implements ConversionListener {

        @Override
        public void onStageStart(String stageName, int stageNumber, int totalStages) {
            logger.fine(() -> String.format("Starting %s (%d/%d)", stageName, stageNumber, totalStages));
        }

        @Override
        public void onStageComplete(String stageName, StageResult result) {
            logger.fine(() -> String.format("Completed %s in %d ms %s", stageName, result.durationMillis(),
                    result.metrics()));
        }

        @Override
        public void onError(String stageName, Exception error) {
            logger.warning(String.format("Stage %s failed: %s", stageName, error.getMessage()));
        }
    }
}
