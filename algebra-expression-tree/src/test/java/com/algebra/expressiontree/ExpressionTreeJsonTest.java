package com.algebra.expressiontree;

import com.algebra.expressiontree.tree.Expression;
import com.algebra.expressiontree.tree.NaryNode;
import com.algebra.expressiontree.tree.NaryOp;
import com.algebra.expressiontree.tree.NumberNode;
import com.algebra.expressiontree.tree.SymbolNode;
import com.algebra.expressiontree.tree.UnaryNode;
import com.algebra.expressiontree.tree.UnaryOp;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionTreeJsonTest {

    private static final String SAMPLE_TREE_JSON = """
            {
              "type": "NARY",
              "operator": "ADD",
              "operands": [
                {
                  "type": "NARY",
                  "operator": "MULTIPLY",
                  "operands": [
                    { "type": "SYMBOL", "name": "y" },
                    { "type": "SYMBOL", "name": "x" },
                    { "type": "NUMBER", "value": 2 }
                  ]
                },
                { "type": "SYMBOL", "name": "x" },
                {
                  "type": "UNARY",
                  "operator": "FACTORIAL",
                  "operand": { "type": "NUMBER", "value": 4 }
                },
                { "type": "NARY", "operator": "POWER", "operands": [] }
              ]
            }
            """;

    @Test
    void fromJson_parsesExpressionTree() {
        Expression tree = ExpressionTreeJson.fromJson(SAMPLE_TREE_JSON);

        NaryNode root = assertInstanceOf(NaryNode.class, tree);
        assertEquals(NaryOp.ADD, root.getOperator());
        assertEquals(4, root.getOperands().size());

        NaryNode product = assertInstanceOf(NaryNode.class, root.getOperands().get(0));
        assertEquals(NaryOp.MULTIPLY, product.getOperator());
        assertEquals(List.of(new SymbolNode("y"), new SymbolNode("x"), new NumberNode(2)), product.getOperands());

        assertEquals(new SymbolNode("x"), root.getOperands().get(1));

        UnaryNode fact = assertInstanceOf(UnaryNode.class, root.getOperands().get(2));
        assertEquals(UnaryOp.FACTORIAL, fact.getOperator());
        assertEquals(new NumberNode(4), fact.getOperand());

        NaryNode emptyPower = assertInstanceOf(NaryNode.class, root.getOperands().get(3));
        assertTrue(emptyPower.getOperands().isEmpty());
    }

    @Test
    void toJson_roundTrip() {
        Expression tree = ExpressionTreeJson.fromJson(SAMPLE_TREE_JSON);
        String json = ExpressionTreeJson.toJson(tree);
        assertEquals(tree, ExpressionTreeJson.fromJson(json));
    }

    @Test
    void toJson_writesTypeDiscriminatorForLeaf() {
        String json = ExpressionTreeJson.toJson(new SymbolNode("abc"));
        assertTrue(json.contains("\"type\":\"SYMBOL\""), json);
        assertTrue(json.contains("\"name\":\"abc\""), json);
    }

    @Test
    void toJsonPretty_roundTrip() {
        Expression tree = ExpressionTreeJson.fromJson(SAMPLE_TREE_JSON);
        assertEquals(tree, ExpressionTreeJson.fromJson(ExpressionTreeJson.toJsonPretty(tree)));
    }

    @Test
    void fromJson_unknownOperator_fails() {
        String json = """
                { "type": "NARY", "operator": "DIVIDE", "operands": [] }
                """;
        assertThrows(UncheckedIOException.class, () -> ExpressionTreeJson.fromJson(json));
    }

    @Test
    void fromJson_numberWithoutValue_fails() {
        assertThrows(UncheckedIOException.class, () -> ExpressionTreeJson.fromJson("{ \"type\": \"NUMBER\" }"));
    }

    @Test
    void fromJson_numberWithNullValue_fails() {
        assertThrows(UncheckedIOException.class,
                () -> ExpressionTreeJson.fromJson("{ \"type\": \"NUMBER\", \"value\": null }"));
    }

    @Test
    void fromJson_numberZeroIsKept() {
        assertEquals(new NumberNode(0), ExpressionTreeJson.fromJson("{ \"type\": \"NUMBER\", \"value\": 0 }"));
    }

    @Test
    void fromJson_unknownNodeType_fails() {
        assertThrows(UncheckedIOException.class, () -> ExpressionTreeJson.fromJson("{ \"type\": \"MATRIX\" }"));
    }
}
