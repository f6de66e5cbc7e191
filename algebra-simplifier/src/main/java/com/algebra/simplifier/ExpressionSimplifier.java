package com.algebra.simplifier;

import com.algebra.config.SimplifierConfig;
import com.algebra.expressiontree.tree.Expression;
import com.algebra.expressiontree.tree.NaryNode;
import com.algebra.simplifier.pass.AssociativeFlattening;
import com.algebra.simplifier.pass.LikeTermCombination;
import com.algebra.simplifier.pass.NaryConstantFolding;
import com.algebra.simplifier.pass.RewritePass;
import com.algebra.simplifier.pass.UnaryConstantFolding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Simplifies an expression tree in one bottom-up sweep. For every node: the operands of an n-ary node are
 * simplified first (unary operands are not descended into), then the node is passed through
 * de-paren, combine-terms, fold-unary and fold-nary in that order.
 * <p>
 * The input tree is not modified. Instances hold only immutable settings and can be shared between threads.
 */
public final class ExpressionSimplifier {

    private static final Logger log = LoggerFactory.getLogger(ExpressionSimplifier.class);

    private final SimplifierConfig config;
    private final List<RewritePass> passes;

    /** Uses settings from the ALGEBRA_* environment variables, see {@link SimplifierConfig#fromEnvironment()}. */
    public ExpressionSimplifier() {
        this(SimplifierConfig.fromEnvironment());
    }

    public ExpressionSimplifier(SimplifierConfig config) {
        this.config = config != null ? config : SimplifierConfig.DEFAULT;
        NaryConstantFolding naryFolding = new NaryConstantFolding();
        this.passes = List.of(
                new AssociativeFlattening(),
                new LikeTermCombination(naryFolding),
                new UnaryConstantFolding(this.config.getFactorialLimit()),
                naryFolding);
        log.info("ExpressionSimplifier created | maxRecursionDepth={} | factorialLimit={} | tracePasses={}",
                this.config.getMaxRecursionDepth(), this.config.getFactorialLimit(), this.config.isTracePasses());
    }

    public SimplifierConfig getConfig() {
        return config;
    }

    /**
     * Returns the simplified form of {@code tree}.
     *
     * @throws RecursionDepthExceededException if the tree nests n-ary nodes as deep as the configured limit
     */
    public Expression simplify(Expression tree) {
        Objects.requireNonNull(tree, "tree");
        return simplify(tree, 0);
    }

    private Expression simplify(Expression node, int depth) {
        if (depth >= config.getMaxRecursionDepth()) {
            throw new RecursionDepthExceededException(depth, config.getMaxRecursionDepth());
        }
        Expression result = simplifyOperands(node, depth);
        for (RewritePass pass : passes) {
            result = pass.rewrite(result, depth);
            if (config.isTracePasses()) {
                log.debug("{} | depth={} | {}", pass.name(), depth, result);
            }
        }
        return result;
    }

    private Expression simplifyOperands(Expression node, int depth) {
        if (!(node instanceof NaryNode nary)) return node;
        List<Expression> operands = new ArrayList<>(nary.getOperands().size());
        for (Expression operand : nary.getOperands()) {
            operands.add(simplify(operand, depth + 1));
        }
        return NaryNode.of(nary.getOperator(), operands);
    }
}
