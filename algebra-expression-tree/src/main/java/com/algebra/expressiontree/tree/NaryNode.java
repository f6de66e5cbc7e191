package com.algebra.expressiontree.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Operation over an ordered list of operands (ADD, MULTIPLY, POWER). The list may be empty or hold a
 * single operand; such nodes are valid intermediate states. Operand order is significant for equality
 * and for like-term combination.
 * <p>
 * The constructor keeps the operand list as given. {@link #of} and {@link Builder#build()} are the
 * canonical construction: one operand collapses to that operand, no operands collapse to the
 * operator's identity literal.
 */
public final class NaryNode implements Expression {

    private final NaryOp operator;
    private final List<Expression> operands;

    @JsonCreator
    public NaryNode(
            @JsonProperty("operator") NaryOp operator,
            @JsonProperty("operands") List<Expression> operands) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operands = operands != null ? List.copyOf(operands) : List.of();
    }

    /**
     * Canonical construction: returns the only operand for a one-operand list, the identity literal for an
     * empty list, otherwise a new node.
     */
    public static Expression of(NaryOp operator, List<? extends Expression> operands) {
        Objects.requireNonNull(operator, "operator");
        if (operands == null || operands.isEmpty()) return new NumberNode(operator.getIdentity());
        if (operands.size() == 1) return Objects.requireNonNull(operands.get(0), "operand");
        return new NaryNode(operator, List.copyOf(operands));
    }

    public static Builder builder(NaryOp operator) {
        return new Builder(operator);
    }

    public NaryOp getOperator() {
        return operator;
    }

    /** Operands in order. Unmodifiable. */
    public List<Expression> getOperands() {
        return operands;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NaryNode that = (NaryNode) o;
        return operator == that.operator && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operands);
    }

    @Override
    public String toString() {
        return InfixRenderer.render(this);
    }

    /**
     * Fluent builder. Operands may be given as expressions, as {@code long} literals or as symbol names.
     */
    public static final class Builder {
        private final NaryOp operator;
        private final List<Expression> operands = new ArrayList<>();

        private Builder(NaryOp operator) {
            this.operator = Objects.requireNonNull(operator, "operator");
        }

        public Builder with(Expression operand) {
            operands.add(Objects.requireNonNull(operand, "operand"));
            return this;
        }

        public Builder with(long value) {
            return with(new NumberNode(value));
        }

        public Builder with(String symbolName) {
            return with(new SymbolNode(symbolName));
        }

        public Builder clear() {
            operands.clear();
            return this;
        }

        /** Canonical construction, see {@link NaryNode#of}. */
        public Expression build() {
            return NaryNode.of(operator, operands);
        }

        /** Keeps the operand list as-is, even when empty or single. */
        public NaryNode buildRaw() {
            return new NaryNode(operator, operands);
        }
    }
}
