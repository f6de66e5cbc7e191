/**
 * Rewrite engine for expression trees.
 *
 * <ul>
 *   <li>{@link com.algebra.simplifier.ExpressionSimplifier} – recursion driver; one bottom-up sweep per call,
 *       aborted with {@link com.algebra.simplifier.RecursionDepthExceededException} at the depth ceiling</li>
 *   <li>{@link com.algebra.simplifier.pass} – the local rewrite rules, applied in order:
 *       {@link com.algebra.simplifier.pass.AssociativeFlattening},
 *       {@link com.algebra.simplifier.pass.LikeTermCombination},
 *       {@link com.algebra.simplifier.pass.UnaryConstantFolding},
 *       {@link com.algebra.simplifier.pass.NaryConstantFolding}</li>
 * </ul>
 */
package com.algebra.simplifier;
