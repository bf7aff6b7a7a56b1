/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.api.model;

/**
 * The fixed-point contract shared by every emitted backend.
 *
 * <p>All domain values (feature inputs, split thresholds, leaf contributions and the
 * returned prediction) are signed 64-bit integers scaled by {@link #PRECISION_MULTIPLIER}.
 * The multiplier is a cross-language constant: it never varies per backend, per tree or
 * per run, and it is deliberately not configurable.
 *
 * <h2>Saturation</h2>
 * Backends whose native arithmetic can overflow must accumulate tree contributions with
 * saturating addition: a sum that exceeds {@link Long#MAX_VALUE} yields {@code Long.MAX_VALUE},
 * a sum below {@link Long#MIN_VALUE} yields {@code Long.MIN_VALUE}. The bounds are asymmetric:
 * sign-magnitude backends clamp negative sums to a magnitude of 2^63, not 2^63 - 1. Each backend implements this
 * through the {@code add} operator of its descriptor; {@link #saturatingAdd(long, long)} is the
 * reference behaviour.
 */
public final class FixedPoint {

    /** 10^10: the only conversion factor between floating-point and fixed-point values. */
    public static final long PRECISION_MULTIPLIER = 10_000_000_000L;

    private FixedPoint() {
    }

    /**
     * Adds two fixed-point values, clamping to the {@code long} range instead of wrapping.
     */
    public static long saturatingAdd(long a, long b) {
        long sum = a + b;
        // Overflow iff both operands have the same sign and the result's sign differs.
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return sum;
    }
}
