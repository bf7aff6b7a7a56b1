/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.exceptions;

/**
 * Base exception for every failure of a conversion run.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * through the pipeline stages. None of the subclasses describe transient
 * failures; a conversion that throws is never retried.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
