/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.exceptions;

/**
 * Thrown when a template references a placeholder for which no value was supplied.
 * Always indicates a mismatch between a backend's templates and its descriptor.
 */
public class UnresolvedPlaceholderException extends ConversionException {

    private final String placeholder;
    private final String templateName;

    public UnresolvedPlaceholderException(String placeholder, String templateName) {
        super(String.format("Unresolved placeholder '${%s}' in template '%s'", placeholder, templateName));
        this.placeholder = placeholder;
        this.templateName = templateName;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public String getTemplateName() {
        return templateName;
    }
}
