/**
 * Expression tree: data model, structural equality and JSON serialization.
 *
 * <ul>
 *   <li>{@link com.algebra.expressiontree.tree} – {@link com.algebra.expressiontree.tree.Expression} and its
 *       node types ({@link com.algebra.expressiontree.tree.NumberNode}, {@link com.algebra.expressiontree.tree.SymbolNode},
 *       {@link com.algebra.expressiontree.tree.UnaryNode}, {@link com.algebra.expressiontree.tree.NaryNode}),
 *       operator tags and factories</li>
 *   <li>{@link com.algebra.expressiontree.ExpressionTreeJson} – {@code fromJson}/{@code toJson}</li>
 * </ul>
 */
package com.algebra.expressiontree;
