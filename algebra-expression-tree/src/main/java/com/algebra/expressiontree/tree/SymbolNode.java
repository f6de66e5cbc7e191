package com.algebra.expressiontree.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Opaque named symbol. Two symbols are equal iff their names match exactly (case-sensitive). */
public final class SymbolNode implements Expression {

    private final String name;

    @JsonCreator
    public SymbolNode(@JsonProperty("name") String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((SymbolNode) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return InfixRenderer.render(this);
    }
}
