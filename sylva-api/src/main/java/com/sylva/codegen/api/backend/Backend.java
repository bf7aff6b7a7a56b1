/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.backend;

import java.util.Objects;

/**
 * A target language: its descriptor together with its template set.
 */
public record Backend(BackendDescriptor descriptor, TemplateSet templates) {

    public Backend {
        Objects.requireNonNull(descriptor, "Backend descriptor cannot be null");
        Objects.requireNonNull(templates, "Template set cannot be null");
    }

    public String name() {
        return descriptor.name();
    }
}
