package com.algebra.expressiontree.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operator tag of a {@link UnaryNode}. Only factorial exists today.
 */
public enum UnaryOp {
    FACTORIAL("!");

    private final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }

    /** Postfix symbol used when rendering. */
    public String getSymbol() {
        return symbol;
    }

    @JsonValue
    public String toValue() {
        return name();
    }

    /**
     * Parses an operator from its enum name (case-insensitive) or its symbol.
     *
     * @throws IllegalArgumentException if the value names no unary operator
     */
    @JsonCreator
    public static UnaryOp fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Unary operator must be non-blank");
        }
        String normalized = value.trim();
        for (UnaryOp op : values()) {
            if (op.name().equalsIgnoreCase(normalized) || op.symbol.equals(normalized)) return op;
        }
        throw new IllegalArgumentException("Unknown unary operator: " + value);
    }
}
