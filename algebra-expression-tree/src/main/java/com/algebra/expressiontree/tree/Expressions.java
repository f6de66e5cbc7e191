package com.algebra.expressiontree.tree;

import java.util.List;

/** Short factories for building trees in code and tests. N-ary factories use canonical construction. */
public final class Expressions {

    private Expressions() {
    }

    public static NumberNode num(long value) {
        return new NumberNode(value);
    }

    public static SymbolNode sym(String name) {
        return new SymbolNode(name);
    }

    public static UnaryNode factorial(Expression operand) {
        return new UnaryNode(UnaryOp.FACTORIAL, operand);
    }

    public static UnaryNode factorial(long operand) {
        return factorial(num(operand));
    }

    public static Expression add(Expression... operands) {
        return NaryNode.of(NaryOp.ADD, List.of(operands));
    }

    public static Expression mul(Expression... operands) {
        return NaryNode.of(NaryOp.MULTIPLY, List.of(operands));
    }
}
