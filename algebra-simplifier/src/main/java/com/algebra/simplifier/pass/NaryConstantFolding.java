package com.algebra.simplifier.pass;

import com.algebra.expressiontree.tree.Expression;
import com.algebra.expressiontree.tree.NaryNode;
import com.algebra.expressiontree.tree.NaryOp;
import com.algebra.expressiontree.tree.NumberNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Folds the literal operands of an n-ary node into a single literal placed after the non-literal
 * operands, e.g. {@code 1 + a + 2 + 3} becomes {@code a + 6}. Non-literal operands keep their order.
 * <p>
 * ADD sums from 0 and MULTIPLY multiplies from 1. POWER starts from 1 and, for each literal {@code v} in
 * operand order, sets the accumulator to {@code v ^ accumulator}, so {@code 2 ^ 3} folds to
 * {@code 3 ^ (2 ^ 1) = 9}. A result equal to the operator's identity is not appended.
 * <p>
 * When the exact result does not fit a {@code long} (or POWER meets a negative exponent) the node is
 * returned unchanged.
 */
public final class NaryConstantFolding implements RewritePass {

    private static final Logger log = LoggerFactory.getLogger(NaryConstantFolding.class);

    @Override
    public Expression rewrite(Expression node, int depth) {
        if (!(node instanceof NaryNode nary)) return node;
        NaryOp operator = nary.getOperator();
        long accumulator = operator.getIdentity();
        List<Expression> operands = new ArrayList<>(nary.getOperands().size() + 1);
        for (Expression operand : nary.getOperands()) {
            if (operand instanceof NumberNode literal) {
                OptionalLong next = LiteralArithmetic.fold(operator, accumulator, literal.getValue());
                if (next.isEmpty()) {
                    log.debug("Constant fold skipped | operator={} | accumulator={} | literal={} | result out of range",
                            operator, accumulator, literal.getValue());
                    return node;
                }
                accumulator = next.getAsLong();
            } else {
                operands.add(operand);
            }
        }
        if (accumulator != operator.getIdentity()) {
            operands.add(new NumberNode(accumulator));
        }
        return NaryNode.of(operator, operands);
    }

    @Override
    public String name() {
        return "fold-nary";
    }
}
