package com.algebra.expressiontree.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Integer literal. */
public final class NumberNode implements Expression {

    private final long value;

    public NumberNode(long value) {
        this.value = value;
    }

    /** JSON creator: {@code value} must be present and non-null. */
    @JsonCreator
    static NumberNode fromJson(@JsonProperty(value = "value", required = true) Long value) {
        return new NumberNode(Objects.requireNonNull(value, "value"));
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((NumberNode) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return InfixRenderer.render(this);
    }
}
