/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.exceptions;

/**
 * Thrown when a backend descriptor or its template set is incomplete.
 */
public class BackendConfigurationException extends ConversionException {

    private final String backendName;

    public BackendConfigurationException(String backendName, String message) {
        super(String.format("Backend '%s': %s", backendName, message));
        this.backendName = backendName;
    }

    public BackendConfigurationException(String backendName, String message, Throwable cause) {
        super(String.format("Backend '%s': %s", backendName, message), cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
