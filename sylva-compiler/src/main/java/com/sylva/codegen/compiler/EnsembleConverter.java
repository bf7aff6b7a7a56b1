/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.compiler;

import com.sylva.codegen.api.ConversionListener;
import com.sylva.codegen.api.IEnsembleConverter;
import com.sylva.codegen.api.backend.Backend;
import com.sylva.codegen.api.exceptions.ConversionException;
import com.sylva.codegen.api.model.ConversionResult;
import com.sylva.codegen.api.model.FeatureMapping;
import com.sylva.codegen.api.model.FeatureUniverse;
import com.sylva.codegen.api.model.RawNode;
import com.sylva.codegen.api.model.Tree;
import com.sylva.codegen.api.model.TreeEnsemble;
import com.sylva.codegen.compiler.feature.FeatureResolver;
import com.sylva.codegen.compiler.render.ArtifactRenderer;
import com.sylva.codegen.compiler.render.CodeAssembler;
import com.sylva.codegen.compiler.render.LiteralFormatter;
import com.sylva.codegen.compiler.render.TemplateRenderer;
import com.sylva.codegen.compiler.render.TreeLogicRenderer;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Converts raw tree dumps into source code for any backend.
 *
 * The conversion process involves several key steps:
 * 1. Resolving every referenced feature against the declared universe (fails fast on unknown names).
 * 2. Building, validating and quantizing one arena-backed tree per dump.
 * 3. Rendering one fragment per emitted tree from the backend descriptor.
 * 4. Assembling header, fragments, entry point and extra templates.
 *
 * A failure in any tree aborts the whole run; nothing is emitted partially.
 * Instances hold no per-conversion state, so one converter may serve concurrent runs as long
 * as the listener it is given is thread-safe.
 */
public class EnsembleConverter implements IEnsembleConverter {
    private static final Logger logger = Logger.getLogger(EnsembleConverter.class.getName());

    private static final int BUILD_STAGES = 1;
    private static final int CONVERT_STAGES = 2;

    private final TemplateRenderer templateRenderer = new TemplateRenderer();
    private final LiteralFormatter literals = new LiteralFormatter(templateRenderer);
    private final TreeLogicRenderer treeLogicRenderer = new TreeLogicRenderer(templateRenderer, literals);
    private final CodeAssembler assembler = new CodeAssembler(templateRenderer);
    private final ArtifactRenderer artifacts = new ArtifactRenderer(templateRenderer, literals);

    private Tracer tracer;
    private ConversionListener listener;

    public EnsembleConverter(Tracer tracer) {
        this.tracer = tracer;
    }

    public EnsembleConverter() {
        this(OpenTelemetry.noop().getTracer("sylva"));
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setConversionListener(ConversionListener listener) {
        this.listener = listener;
    }

    @Override
    public TreeEnsemble buildEnsemble(List<List<RawNode>> dumps, FeatureUniverse universe) {
        if (dumps == null || dumps.isEmpty()) {
            throw new ConversionException("Ensemble must contain at least one tree");
        }
        Span span = tracer.spanBuilder("build-ensemble").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("treeCount", dumps.size());
            span.setAttribute("featureCount", universe.size());

            TreeEnsemble ensemble = runStage(ConversionListener.TREE_BUILDING, 1, BUILD_STAGES, () -> {
                FeatureResolver resolver = new FeatureResolver(universe);
                FeatureMapping mapping = resolver.resolveAll(referencedFeatures(dumps));

                TreeIrBuilder builder = new TreeIrBuilder(resolver);
                List<Tree> trees = new ArrayList<>(dumps.size());
                for (int i = 0; i < dumps.size(); i++) {
                    trees.add(builder.build(i, dumps.get(i)));
                }
                return new TreeEnsemble(trees, universe, mapping);
            }, result -> Map.of(
                    "treeCount", result.treeCount(),
                    "nodeCount", result.trees().stream().mapToInt(Tree::size).sum(),
                    "referencedFeatures", result.mapping().size()));

            span.setAttribute("referencedFeatures", ensemble.mapping().size());
            logger.info(String.format("Built ensemble of %d trees over %d features (%d referenced)",
                    ensemble.treeCount(), universe.size(), ensemble.mapping().size()));
            return ensemble;
        } catch (ConversionException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public ConversionResult convert(TreeEnsemble ensemble, Backend backend, int treeLimit) {
        Span span = tracer.spanBuilder("convert-ensemble").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("backend", backend.name());
            span.setAttribute("treeLimit", treeLimit);
            long startTime = System.nanoTime();

            CodeAssembler.validateTreeLimit(treeLimit, ensemble.treeCount());

            List<String> fragments = runStage(ConversionListener.RENDERING, 1, CONVERT_STAGES, () -> {
                List<String> rendered = new ArrayList<>(treeLimit);
                for (int i = 0; i < treeLimit; i++) {
                    rendered.add(treeLogicRenderer.render(ensemble.tree(i), backend.descriptor()));
                }
                return rendered;
            }, rendered -> Map.of("fragmentCount", rendered.size()));

            String source = runStage(ConversionListener.ASSEMBLY, 2, CONVERT_STAGES,
                    () -> assembler.assemble(fragments, backend, ensemble.featureCount(),
                            ensemble.treeCount(), treeLimit),
                    text -> Map.of("sourceLength", text.length()));

            long elapsed = System.nanoTime() - startTime;
            span.setAttribute("conversionTimeMs", TimeUnit.NANOSECONDS.toMillis(elapsed));
            logger.fine(() -> String.format("Converted %d trees for backend '%s' in %.2f ms",
                    treeLimit, backend.name(), elapsed / 1_000_000.0));

            return new ConversionResult(backend.name(), backend.descriptor().fileExtension(),
                    treeLimit, ensemble.featureCount(), source);
        } catch (ConversionException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Lists every referenced feature as {@code name -> index}, one comment line each.
     */
    public String featureMappingListing(TreeEnsemble ensemble, Backend backend) {
        return artifacts.featureMappingListing(ensemble.mapping(), backend.descriptor());
    }

    /**
     * Dumps the nodes of the first {@code treeLimit} trees in readable form.
     */
    public String instructionDump(TreeEnsemble ensemble, Backend backend, int treeLimit) {
        return artifacts.instructionDump(ensemble, treeLimit, backend.descriptor());
    }

    /**
     * Quantizes a raw feature vector and formats it as the backend's runtime input.
     */
    public String formatInput(double[] features, Backend backend) {
        return artifacts.inputVector(features, backend.descriptor());
    }

    private static Set<String> referencedFeatures(List<List<RawNode>> dumps) {
        Set<String> names = new LinkedHashSet<>();
        for (List<RawNode> dump : dumps) {
            if (dump == null) continue;
            for (RawNode node : dump) {
                if (node != null && node.feature() != null) {
                    names.add(node.feature());
                }
            }
        }
        return names;
    }

    private <T> T runStage(String stageName, int stageNumber, int totalStages, Supplier<T> stage,
                           Function<T, Map<String, Object>> metrics) {
        ConversionListener current = this.listener;
        if (current != null) {
            current.onStageStart(stageName, stageNumber, totalStages);
        }
        long start = System.nanoTime();
        try {
            T result = stage.get();
            if (current != null) {
                current.onStageComplete(stageName,
                        new ConversionListener.StageResult(stageName, System.nanoTime() - start, metrics.apply(result)));
            }
            return result;
        } catch (ConversionException e) {
            if (current != null) {
                current.onError(stageName, e);
            }
            throw e;
        }
    }
}
