package com.algebra.config;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Settings for the expression simplifier, loaded from environment variables.
 * <p>
 * Depth ceiling: ALGEBRA_MAX_RECURSION_DEPTH (default 32). Factorial folding ceiling:
 * ALGEBRA_FACTORIAL_LIMIT (default 10). Per-pass trace logging: ALGEBRA_TRACE_PASSES (default false).
 * Blank or unparsable values fall back to the defaults.
 */
public final class SimplifierConfig {

    private static final String ENV_MAX_RECURSION_DEPTH = "ALGEBRA_MAX_RECURSION_DEPTH";
    private static final String ENV_FACTORIAL_LIMIT = "ALGEBRA_FACTORIAL_LIMIT";
    private static final String ENV_TRACE_PASSES = "ALGEBRA_TRACE_PASSES";

    private static final int DEFAULT_MAX_RECURSION_DEPTH = 32;
    /** 10! is the largest factorial folded to a literal; larger ones stay symbolic. */
    private static final int DEFAULT_FACTORIAL_LIMIT = 10;
    private static final boolean DEFAULT_TRACE_PASSES = false;

    public static final SimplifierConfig DEFAULT = builder().build();

    private final int maxRecursionDepth;
    private final int factorialLimit;
    private final boolean tracePasses;

    private SimplifierConfig(Builder b) {
        this.maxRecursionDepth = requirePositive(b.maxRecursionDepth, "maxRecursionDepth");
        if (b.factorialLimit < 0) {
            throw new IllegalArgumentException("factorialLimit must not be negative, got: " + b.factorialLimit);
        }
        // 20! is the largest factorial that fits in a long
        if (b.factorialLimit > 20) {
            throw new IllegalArgumentException("factorialLimit must be at most 20, got: " + b.factorialLimit);
        }
        this.factorialLimit = b.factorialLimit;
        this.tracePasses = b.tracePasses;
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    /** Depth at which a sweep aborts (root is depth 0). Default 32. */
    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    /** Largest literal n for which n! is folded. Default 10. */
    public int getFactorialLimit() {
        return factorialLimit;
    }

    /** Whether every pass result is logged at DEBUG. Default false. */
    public boolean isTracePasses() {
        return tracePasses;
    }

    public static SimplifierConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Reads settings through {@code env} (variable name → value, null when unset). */
    public static SimplifierConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .maxRecursionDepth(parseInt(env.apply(ENV_MAX_RECURSION_DEPTH), DEFAULT_MAX_RECURSION_DEPTH))
                .factorialLimit(parseInt(env.apply(ENV_FACTORIAL_LIMIT), DEFAULT_FACTORIAL_LIMIT))
                .tracePasses(parseBoolean(env.apply(ENV_TRACE_PASSES), DEFAULT_TRACE_PASSES))
                .build();
    }

    /** Convenience for tests and embedding: settings from a fixed map of variables. */
    public static SimplifierConfig fromMap(Map<String, String> variables) {
        Objects.requireNonNull(variables, "variables");
        return fromEnvironment(variables::get);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimplifierConfig that = (SimplifierConfig) o;
        return maxRecursionDepth == that.maxRecursionDepth
                && factorialLimit == that.factorialLimit
                && tracePasses == that.tracePasses;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRecursionDepth, factorialLimit, tracePasses);
    }

    @Override
    public String toString() {
        return "SimplifierConfig{maxRecursionDepth=" + maxRecursionDepth
                + ", factorialLimit=" + factorialLimit
                + ", tracePasses=" + tracePasses + "}";
    }

    public static final class Builder {
        private int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;
        private int factorialLimit = DEFAULT_FACTORIAL_LIMIT;
        private boolean tracePasses = DEFAULT_TRACE_PASSES;

        public Builder maxRecursionDepth(int maxRecursionDepth) {
            this.maxRecursionDepth = maxRecursionDepth;
            return this;
        }

        public Builder factorialLimit(int factorialLimit) {
            this.factorialLimit = factorialLimit;
            return this;
        }

        public Builder tracePasses(boolean tracePasses) {
            this.tracePasses = tracePasses;
            return this;
        }

        public SimplifierConfig build() {
            return new SimplifierConfig(this);
        }
    }
}
