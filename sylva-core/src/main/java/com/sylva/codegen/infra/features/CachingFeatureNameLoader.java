/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.infra.features;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.sylva.codegen.api.model.FeatureUniverse;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Memoizing loader for declared feature names.
 *
 * <p>Accepted file layouts:
 * <ul>
 *   <li>a JSON array of names;</li>
 *   <li>a JSON object keyed by model variant ({@code "model_4_with_xtra"}), each entry holding a
 *       {@code feature_names} array;</li>
 *   <li>plain text with one name per line, blank lines and {@code #} comments ignored.</li>
 * </ul>
 * Deriving names from the training data is slow, so the result is cached per file and variant.
 * Entries are never refreshed; call {@link #invalidateAll()} after rewriting a file.
 */
public class CachingFeatureNameLoader {
    private static final Logger logger = Logger.getLogger(CachingFeatureNameLoader.class.getName());

    public static final String FEATURE_NAMES_KEY = "feature_names";
    private static final int DEFAULT_MAX_ENTRIES = 256;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Cache<CacheKey, List<String>> cache;

    public CachingFeatureNameLoader() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public CachingFeatureNameLoader(long maxEntries) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .recordStats()
                .build();
    }

    /**
     * Loads the names of a file holding a single list.
     */
    public List<String> load(Path path) throws IOException {
        return load(path, null);
    }

    /**
     * Loads the names stored under {@code variant} in a variant-keyed JSON file.
     * A {@code null} variant reads the whole file as one list.
     */
    public List<String> load(Path path, String variant) throws IOException {
        CacheKey key = new CacheKey(path.toAbsolutePath().normalize(), variant);
        try {
            return cache.get(key, this::read);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public FeatureUniverse loadUniverse(Path path, String variant) throws IOException {
        return new FeatureUniverse(load(path, variant));
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private List<String> read(CacheKey key) {
        try {
            List<String> names = parse(Files.readString(key.path(), StandardCharsets.UTF_8), key);
            logger.info(String.format("Loaded %d feature names from %s%s", names.size(), key.path(),
                    key.variant() != null ? " [" + key.variant() + "]" : ""));
            return List.copyOf(names);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private List<String> parse(String content, CacheKey key) throws IOException {
        String trimmed = content.strip();
        if (trimmed.startsWith("[") || trimmed.startsWith("{")) {
            JsonNode root = objectMapper.readTree(trimmed);
            if (root.isObject()) {
                return fromVariants(root, key);
            }
            if (key.variant() != null) {
                throw new IOException("Variant '" + key.variant() + "' requested but " + key.path()
                        + " holds a single list");
            }
            return names(root, key.path().toString());
        }
        if (key.variant() != null) {
            throw new IOException("Variant '" + key.variant() + "' requested but " + key.path()
                    + " is a plain name list");
        }
        List<String> names = new ArrayList<>();
        for (String line : content.split("\\R")) {
            String name = line.strip();
            if (!name.isEmpty() && !name.startsWith("#")) {
                names.add(name);
            }
        }
        return names;
    }

    private List<String> fromVariants(JsonNode root, CacheKey key) throws IOException {
        if (key.variant() == null) {
            throw new IOException(key.path() + " is keyed by model variant; one of "
                    + fieldNames(root) + " must be given");
        }
        JsonNode entry = root.get(key.variant());
        if (entry == null) {
            throw new IOException("Unknown variant '" + key.variant() + "' in " + key.path()
                    + "; known variants: " + fieldNames(root));
        }
        JsonNode names = entry.isObject() ? entry.get(FEATURE_NAMES_KEY) : entry;
        if (names == null) {
            throw new IOException("Variant '" + key.variant() + "' has no '" + FEATURE_NAMES_KEY + "'");
        }
        return names(names, key.path() + " [" + key.variant() + "]");
    }

    private static List<String> names(JsonNode array, String source) throws IOException {
        if (!array.isArray()) {
            throw new IOException("Expected a JSON array of feature names in " + source);
        }
        List<String> names = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isTextual()) {
                throw new IOException("Feature names must be strings in " + source + ", got " + element);
            }
            names.add(element.asText());
        }
        return names;
    }

    private static List<String> fieldNames(JsonNode root) {
        List<String> fields = new ArrayList<>();
        root.fieldNames().forEachRemaining(fields::add);
        return fields;
    }

    private record CacheKey(Path path, String variant) {
    }
}
