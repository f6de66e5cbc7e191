package com.algebra.expressiontree.tree;

import java.util.stream.Collectors;

/**
 * Renders an expression as infix text for logs and assertion messages. Nested operations are always
 * parenthesized, so the text shows the tree shape rather than relying on precedence.
 */
final class InfixRenderer {

    private InfixRenderer() {
    }

    static String render(Expression e) {
        if (e instanceof NumberNode n) return Long.toString(n.getValue());
        if (e instanceof SymbolNode s) return s.getName();
        if (e instanceof UnaryNode u) return nested(u.getOperand()) + u.getOperator().getSymbol();
        if (e instanceof NaryNode n) {
            if (n.getOperands().isEmpty()) return n.getOperator().getSymbol() + "()";
            return n.getOperands().stream()
                    .map(InfixRenderer::nested)
                    .collect(Collectors.joining(" " + n.getOperator().getSymbol() + " "));
        }
        throw new IllegalArgumentException("Unknown expression type: " + e.getClass().getName());
    }

    private static String nested(Expression e) {
        if (e instanceof NaryNode || e instanceof UnaryNode) return "(" + render(e) + ")";
        return render(e);
    }
}
