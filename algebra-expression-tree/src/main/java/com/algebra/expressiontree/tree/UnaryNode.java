package com.algebra.expressiontree.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Unary operation with exactly one operand (e.g. {@code 4!}). */
public final class UnaryNode implements Expression {

    private final UnaryOp operator;
    private final Expression operand;

    @JsonCreator
    public UnaryNode(
            @JsonProperty("operator") UnaryOp operator,
            @JsonProperty("operand") Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnaryNode that = (UnaryNode) o;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return InfixRenderer.render(this);
    }
}
