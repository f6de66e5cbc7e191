package com.algebra.simplifier.pass;

import com.algebra.expressiontree.tree.Expression;

/**
 * One local rewrite rule applied by the simplifier to a single node after its operands have been
 * simplified. A pass never descends into the tree on its own; a node whose shape the rule does not
 * cover is returned unchanged.
 */
public interface RewritePass {

    /**
     * Rewrites {@code node}.
     *
     * @param node  node to rewrite (operands already simplified by the driver)
     * @param depth recursion depth of {@code node} in the current sweep (root 0)
     * @return the rewritten node, or {@code node} itself when the rule does not apply
     */
    Expression rewrite(Expression node, int depth);

    /** Short name for trace logging. */
    String name();
}
