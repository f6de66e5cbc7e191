package com.algebra.simplifier.pass;

import com.algebra.expressiontree.tree.NaryOp;

import java.util.OptionalLong;

/**
 * Exact {@code long} arithmetic for constant folding. Every operation returns empty instead of a wrapped
 * value when the exact result does not fit.
 */
final class LiteralArithmetic {

    private LiteralArithmetic() {
    }

    /**
     * Folds literal {@code value} into {@code accumulator} for {@code operator}. POWER is right-nested:
     * the literal becomes the base and the accumulator the exponent.
     */
    static OptionalLong fold(NaryOp operator, long accumulator, long value) {
        return switch (operator) {
            case ADD -> add(accumulator, value);
            case MULTIPLY -> multiply(accumulator, value);
            case POWER -> power(value, accumulator);
        };
    }

    static OptionalLong add(long a, long b) {
        try {
            return OptionalLong.of(Math.addExact(a, b));
        } catch (ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    static OptionalLong multiply(long a, long b) {
        try {
            return OptionalLong.of(Math.multiplyExact(a, b));
        } catch (ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    /** {@code base} raised to a non-negative {@code exponent}; empty for negative exponents or overflow. */
    static OptionalLong power(long base, long exponent) {
        if (exponent < 0) return OptionalLong.empty();
        if (exponent == 0 || base == 1) return OptionalLong.of(1);
        if (base == 0) return OptionalLong.of(0);
        if (base == -1) return OptionalLong.of((exponent & 1) == 0 ? 1 : -1);
        // |base| >= 2 overflows within 63 steps, so the loop is bounded
        long result = 1;
        for (long i = 0; i < exponent; i++) {
            OptionalLong next = multiply(result, base);
            if (next.isEmpty()) return next;
            result = next.getAsLong();
        }
        return OptionalLong.of(result);
    }

    /** {@code n!} for {@code n >= 0}; empty on overflow. */
    static OptionalLong factorial(long n) {
        long result = 1;
        for (long i = 2; i <= n; i++) {
            OptionalLong next = multiply(result, i);
            if (next.isEmpty()) return next;
            result = next.getAsLong();
        }
        return OptionalLong.of(result);
    }
}
