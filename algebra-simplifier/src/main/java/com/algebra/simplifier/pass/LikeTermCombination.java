package com.algebra.simplifier.pass;

import com.algebra.expressiontree.tree.Expression;
import com.algebra.expressiontree.tree.NaryNode;
import com.algebra.expressiontree.tree.NaryOp;
import com.algebra.expressiontree.tree.NumberNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Groups the terms of a sum that share a factor: {@code y*x*2 + x + x*2 + 3} becomes
 * {@code ((y*2 + 3) * x) + 3}. Only ADD nodes are rewritten.
 * <p>
 * Terms are visited left to right. For a product term each of its operands is tried in turn as the
 * shared factor; the first one that also occurs in a later term wins, and every term from the current
 * position onward that yields a coefficient for it is merged and marked consumed. The forward scan
 * does not skip terms consumed by an earlier factor. Any other term is its own factor.
 * <p>
 * The merged coefficients form a sum that is constant-folded; a coefficient of exactly {@code 1} emits
 * the bare factor, anything else emits {@code coefficient * factor}.
 * <p>
 * A term for which no factor is found is dropped from the result, not carried over. That happens to a
 * product that shares no operand with a later term (a lone {@code x*y} in a sum vanishes) and to a
 * POWER term whose coefficient against itself cannot be extracted. This changes the value of the sum
 * and is kept as existing behavior.
 */
public final class LikeTermCombination implements RewritePass {

    private static final Logger log = LoggerFactory.getLogger(LikeTermCombination.class);

    private final NaryConstantFolding constantFolding;

    public LikeTermCombination(NaryConstantFolding constantFolding) {
        this.constantFolding = Objects.requireNonNull(constantFolding, "constantFolding");
    }

    @Override
    public Expression rewrite(Expression node, int depth) {
        if (!(node instanceof NaryNode sum) || sum.getOperator() != NaryOp.ADD) return node;
        List<Expression> terms = sum.getOperands();
        List<Expression> combined = new ArrayList<>(terms.size());
        Set<Integer> consumed = new HashSet<>();

        for (int i = 0; i < terms.size(); i++) {
            if (consumed.contains(i)) continue;
            Expression term = terms.get(i);
            NaryNode.Builder coefficient = NaryNode.builder(NaryOp.ADD);

            Expression factor;
            if (term instanceof NaryNode product && product.getOperator() == NaryOp.MULTIPLY) {
                factor = sharedFactor(product, terms, i, coefficient, consumed);
            } else {
                factor = collect(term, terms, i, coefficient, consumed) > 0 ? term : null;
            }

            Expression folded = constantFolding.rewrite(coefficient.build(), depth);
            log.debug("Combine terms | term={} | factor={} | coefficient={}", term, factor, folded);
            if (factor == null) continue;
            if (folded instanceof NumberNode literal && literal.getValue() == 1) {
                combined.add(factor);
            } else {
                combined.add(NaryNode.builder(NaryOp.MULTIPLY).with(folded).with(factor).build());
            }
        }
        return NaryNode.of(NaryOp.ADD, combined);
    }

    /**
     * Tries each operand of {@code product} as the factor. Returns the first one that appears in more than
     * one term, with its coefficients in {@code coefficient}, or null when every candidate only matches
     * the product itself.
     */
    private static Expression sharedFactor(NaryNode product, List<Expression> terms, int start,
                                           NaryNode.Builder coefficient, Set<Integer> consumed) {
        for (Expression candidate : product.getOperands()) {
            int matches = collect(candidate, terms, start, coefficient, consumed);
            if (matches > 1) {
                return candidate;
            }
            // only the product itself matched
            coefficient.clear();
        }
        return null;
    }

    /**
     * Adds the coefficient of {@code factor} in every term from {@code start} onward to
     * {@code coefficient} and marks those terms consumed. Returns the number of matching terms.
     */
    private static int collect(Expression factor, List<Expression> terms, int start,
                               NaryNode.Builder coefficient, Set<Integer> consumed) {
        int matches = 0;
        for (int j = start; j < terms.size(); j++) {
            Optional<Expression> found = CoefficientExtractor.extract(terms.get(j), factor);
            if (found.isPresent()) {
                coefficient.with(found.get());
                consumed.add(j);
                matches++;
            }
        }
        return matches;
    }

    @Override
    public String name() {
        return "combine-terms";
    }
}
