/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.compiler.numeric;

import com.sylva.codegen.api.model.FixedPoint;

/**
 * Converts floating-point domain values to and from the fixed-point representation.
 *
 * <p>This is the single rounding rule of the system. Thresholds, leaf values and input
 * vectors all go through {@link #quantize(double)}; no backend derives its own multiplier
 * or rounding.
 *
 * <p>Rounding is half away from zero: the absolute value of the scaled product is rounded
 * half-up and the sign is reapplied afterwards, so {@code 2.5 -> 3} and {@code -2.5 -> -3}.
 * Products outside the {@code long} range clamp to {@code ±Long.MAX_VALUE}.
 */
public final class NumericQuantizer {

    private NumericQuantizer() {
    }

    /**
     * @param value a finite value or an infinity
     * @return {@code value * 10^10}, rounded half away from zero and clamped
     * @throws IllegalArgumentException if {@code value} is NaN
     */
    public static long quantize(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Cannot quantize NaN");
        }
        double scaled = value * FixedPoint.PRECISION_MULTIPLIER;
        // Math.round saturates at Long.MAX_VALUE, which gives the clamp for free.
        long magnitude = Math.round(Math.abs(scaled));
        return scaled < 0 ? -magnitude : magnitude;
    }

    public static double dequantize(long fixedValue) {
        return (double) fixedValue / FixedPoint.PRECISION_MULTIPLIER;
    }

    /**
     * Quantizes every element of a feature vector.
     */
    public static long[] quantizeAll(double[] values) {
        long[] result = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = quantize(values[i]);
        }
        return result;
    }
}
