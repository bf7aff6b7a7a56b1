/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.compiler.render;

import com.sylva.codegen.api.backend.BackendDescriptor;

import java.util.HashMap;
import java.util.Map;

/**
 * Writes fixed-point constants in a backend's literal syntax.
 */
public class LiteralFormatter {

    private final TemplateRenderer renderer;

    public LiteralFormatter(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    public String literal(long value, BackendDescriptor descriptor) {
        return renderer.render("fixed_point.literal", descriptor.fixedPoint().literal(),
                valueParts(value, descriptor));
    }

    /**
     * The placeholder values describing one fixed-point number:
     * {@code value} (signed decimal), {@code magnitude} (absolute decimal),
     * {@code positive} (the backend's boolean keyword for {@code value >= 0}) and
     * {@code sign_bit} ({@code 1} for non-negative, {@code 0} otherwise).
     */
    public Map<String, String> valueParts(long value, BackendDescriptor descriptor) {
        boolean nonNegative = value >= 0;
        Map<String, String> parts = new HashMap<>();
        parts.put("value", Long.toString(value));
        // Unsigned rendering keeps Long.MIN_VALUE's magnitude correct.
        parts.put("magnitude", Long.toUnsignedString(nonNegative ? value : -value));
        parts.put("positive", nonNegative
                ? descriptor.fixedPoint().trueKeyword()
                : descriptor.fixedPoint().falseKeyword());
        parts.put("sign_bit", nonNegative ? "1" : "0");
        return parts;
    }
}
