package com.algebra.simplifier.pass;

import com.algebra.expressiontree.tree.Expression;
import com.algebra.expressiontree.tree.NaryNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes redundant grouping: an operand that is an n-ary node with the same operator as its parent is
 * replaced in place by its own operands, e.g. {@code (a + b) + c} becomes {@code a + b + c}.
 * Splices one level only; deeper nesting was already flattened when the operand itself was simplified.
 */
public final class AssociativeFlattening implements RewritePass {

    @Override
    public Expression rewrite(Expression node, int depth) {
        if (!(node instanceof NaryNode nary)) return node;
        List<Expression> operands = new ArrayList<>(nary.getOperands().size());
        for (Expression operand : nary.getOperands()) {
            if (operand instanceof NaryNode inner && inner.getOperator() == nary.getOperator()) {
                operands.addAll(inner.getOperands());
            } else {
                operands.add(operand);
            }
        }
        return NaryNode.of(nary.getOperator(), operands);
    }

    @Override
    public String name() {
        return "de-paren";
    }
}
