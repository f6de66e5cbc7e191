package com.algebra.expressiontree;

import com.algebra.expressiontree.tree.Expression;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of expression trees. Reading keeps n-ary operand lists exactly as
 * written (no collapse of empty or single-operand nodes), so a tree survives a round trip unchanged.
 */
public final class ExpressionTreeJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    private static final ObjectReader READER = MAPPER.readerFor(Expression.class);
    private static final ObjectWriter WRITER = MAPPER.writerFor(Expression.class);

    private ExpressionTreeJson() {
    }

    /**
     * Deserializes an expression tree from a JSON string.
     *
     * @param json the JSON string (e.g. from a parser front end or a fixture file)
     * @return the parsed tree
     * @throws UncheckedIOException on parse failure, including unknown node types and operators
     */
    public static Expression fromJson(String json) {
        try {
            return READER.readValue(json);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes an expression tree to a compact JSON string.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(Expression expression) {
        try {
            return WRITER.writeValueAsString(expression);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Serializes an expression tree to a pretty-printed JSON string. */
    public static String toJsonPretty(Expression expression) {
        try {
            return WRITER.withDefaultPrettyPrinter().writeValueAsString(expression);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
