package com.algebra.simplifier.pass;

import com.algebra.expressiontree.tree.Expression;
import com.algebra.expressiontree.tree.NumberNode;
import com.algebra.expressiontree.tree.UnaryNode;
import com.algebra.expressiontree.tree.UnaryOp;

import java.util.OptionalLong;

/**
 * Replaces {@code n!} by its value when {@code n} is a literal in {@code [0, factorialLimit]}.
 * Larger or negative literals and non-literal operands stay symbolic.
 */
public final class UnaryConstantFolding implements RewritePass {

    private final int factorialLimit;

    public UnaryConstantFolding(int factorialLimit) {
        if (factorialLimit < 0) {
            throw new IllegalArgumentException("factorialLimit must not be negative, got: " + factorialLimit);
        }
        this.factorialLimit = factorialLimit;
    }

    @Override
    public Expression rewrite(Expression node, int depth) {
        if (!(node instanceof UnaryNode unary) || unary.getOperator() != UnaryOp.FACTORIAL) return node;
        if (!(unary.getOperand() instanceof NumberNode literal)) return node;
        long n = literal.getValue();
        if (n < 0 || n > factorialLimit) return node;
        OptionalLong value = LiteralArithmetic.factorial(n);
        return value.isPresent() ? new NumberNode(value.getAsLong()) : node;
    }

    @Override
    public String name() {
        return "fold-unary";
    }
}
