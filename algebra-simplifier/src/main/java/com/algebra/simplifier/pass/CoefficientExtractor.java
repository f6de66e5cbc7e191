package com.algebra.simplifier.pass;

import com.algebra.expressiontree.tree.Expression;
import com.algebra.expressiontree.tree.NaryNode;
import com.algebra.expressiontree.tree.NumberNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds what remains of a term once a given factor is taken out of it.
 * <ul>
 *   <li>n-ary term: the first operand structurally equal to the factor is removed and the coefficient is the
 *       same operator over the remaining operands, canonically constructed (e.g. {@code y} out of
 *       {@code x * y * 4} leaves {@code x * 4}; {@code x} out of {@code x * 2} leaves {@code 2})</li>
 *   <li>any other term equal to the factor: coefficient {@code 1}</li>
 *   <li>otherwise: empty</li>
 * </ul>
 */
public final class CoefficientExtractor {

    private CoefficientExtractor() {
    }

    public static Optional<Expression> extract(Expression term, Expression factor) {
        if (term instanceof NaryNode nary) {
            List<Expression> remaining = new ArrayList<>(nary.getOperands().size());
            boolean found = false;
            for (Expression operand : nary.getOperands()) {
                if (!found && operand.structurallyEquals(factor)) {
                    found = true;
                } else {
                    remaining.add(operand);
                }
            }
            return found ? Optional.of(NaryNode.of(nary.getOperator(), remaining)) : Optional.empty();
        }
        if (term.structurallyEquals(factor)) {
            return Optional.of(new NumberNode(1));
        }
        return Optional.empty();
    }
}
