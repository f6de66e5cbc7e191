package com.algebra.expressiontree.tree;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Node of an expression tree: a {@link NumberNode}, a {@link SymbolNode}, a {@link UnaryNode} or an
 * {@link NaryNode}. Nodes are immutable; children are owned by exactly one parent.
 * <p>
 * {@link Object#equals} on every implementation is structural equality: same variant, same operator,
 * same value or name, and children equal element-wise in order. No commutative or associative
 * normalization happens, so {@code a*b} and {@code b*a} are different trees.
 * <p>
 * JSON uses a {@code "type"} discriminator: NUMBER, SYMBOL, UNARY, NARY.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NumberNode.class, name = "NUMBER"),
        @JsonSubTypes.Type(value = SymbolNode.class, name = "SYMBOL"),
        @JsonSubTypes.Type(value = UnaryNode.class, name = "UNARY"),
        @JsonSubTypes.Type(value = NaryNode.class, name = "NARY")
})
public interface Expression {

    /** Deep, order-sensitive value equality with {@code other}. Same relation as {@link Object#equals}. */
    default boolean structurallyEquals(Expression other) {
        return equals(other);
    }
}
