package com.algebra.expressiontree.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operator tag of an {@link NaryNode}. JSON uses the enum name as string; parsing also accepts the infix symbol.
 * Each operator knows its identity value, which constant folding uses both as the accumulator seed and as the
 * value an empty operand list stands for.
 *
 * @see NaryNode#getOperator()
 */
public enum NaryOp {
    ADD("+", 0L),
    MULTIPLY("*", 1L),
    /** Exponentiation. Literal operands fold right-nested, see the rewrite engine's constant folding. */
    POWER("^", 1L);

    private final String symbol;
    private final long identity;

    NaryOp(String symbol, long identity) {
        this.symbol = symbol;
        this.identity = identity;
    }

    /** Infix symbol used when rendering (e.g. {@code +}). */
    public String getSymbol() {
        return symbol;
    }

    /** Identity value: 0 for ADD, 1 for MULTIPLY and POWER. */
    public long getIdentity() {
        return identity;
    }

    @JsonValue
    public String toValue() {
        return name();
    }

    /**
     * Parses an operator from its enum name (case-insensitive) or its symbol.
     *
     * @throws IllegalArgumentException if the value names no n-ary operator
     */
    @JsonCreator
    public static NaryOp fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("N-ary operator must be non-blank");
        }
        String normalized = value.trim();
        for (NaryOp op : values()) {
            if (op.name().equalsIgnoreCase(normalized) || op.symbol.equals(normalized)) return op;
        }
        throw new IllegalArgumentException("Unknown n-ary operator: " + value);
    }
}
