package com.algebra.simplifier.pass;

import com.algebra.expressiontree.tree.Expression;
import com.algebra.expressiontree.tree.NaryNode;
import com.algebra.expressiontree.tree.NaryOp;
import org.junit.jupiter.api.Test;

import static com.algebra.expressiontree.tree.Expressions.factorial;
import static com.algebra.expressiontree.tree.Expressions.num;
import static com.algebra.expressiontree.tree.Expressions.sym;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class LikeTermCombinationTest {

    private final LikeTermCombination pass = new LikeTermCombination(new NaryConstantFolding());

    private static NaryNode.Builder add() {
        return NaryNode.builder(NaryOp.ADD);
    }

    private static NaryNode.Builder mul() {
        return NaryNode.builder(NaryOp.MULTIPLY);
    }

    @Test
    void rewrite_groupsTermsSharingFactor() {
        // y * x * 2 + x + x * 2 + 3  ==  (y * 2 + 3) * x + 3
        Expression sum = add()
                .with(mul().with("y").with("x").with(2).build())
                .with("x")
                .with(mul().with("x").with(2).build())
                .with(3)
                .build();

        Expression expected = add()
                .with(mul()
                        .with(add().with(mul().with("y").with(2).build()).with(3).build())
                        .with("x")
                        .build())
                .with(3)
                .build();

        assertEquals(expected, pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_repeatedBareTermsGetNumericCoefficient() {
        Expression sum = add().with("x").with("y").with("x").with("x").build();

        Expression expected = add().with(mul().with(3).with("x").build()).with("y").build();
        assertEquals(expected, pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_coefficientOfOneEmitsBareFactor() {
        Expression sum = add().with("x").with("y").build();
        assertEquals(sum, pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_repeatedLiteralsAreCountedNotSummed() {
        Expression sum = add().with(3).with(3).build();
        assertEquals(mul().with(2).with(3).build(), pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_productWithoutPartnerIsDropped() {
        // existing behavior: a product sharing no operand with another term vanishes from the sum
        Expression sum = add().with(mul().with("x").with("y").build()).with("z").build();
        assertEquals(sym("z"), pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_loneProductInSumIsDropped() {
        Expression sum = add().with(mul().with("x").with("y").build()).with(3).build();
        assertEquals(num(3), pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_sumOfOnlyUnrelatedProductsBecomesZero() {
        Expression sum = add()
                .with(mul().with("a").with("b").build())
                .with(mul().with("c").with("d").build())
                .build();
        assertEquals(num(0), pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_powerTermWithoutPartnerIsDropped() {
        Expression sum = add().with(NaryNode.builder(NaryOp.POWER).with("x").with(2).build()).with("y").build();
        assertEquals(sym("y"), pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_powerTermGroupsWithProductContainingIt() {
        Expression square = NaryNode.builder(NaryOp.POWER).with("x").with(2).build();
        Expression sum = add().with(square).with(mul().with(square).with(3).build()).build();

        assertEquals(mul().with(3).with(square).build(), pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_triesNextOperandWhenFirstHasNoPartner() {
        // a only occurs in the first term, b occurs in both
        Expression sum = add()
                .with(mul().with("a").with("b").build())
                .with(mul().with("b").with(5).build())
                .build();

        Expression expected = mul().with(add().with("a").with(5).build()).with("b").build();
        assertEquals(expected, pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_forwardScanRevisitsTermsConsumedByEarlierFactor() {
        // x*w is merged under x first, then counted again under w
        Expression sum = add()
                .with(mul().with("x").with("y").build())
                .with(mul().with("z").with("w").build())
                .with(mul().with("x").with("w").build())
                .with("w")
                .build();

        Expression expected = add()
                .with(mul().with(add().with("y").with("w").build()).with("x").build())
                .with(mul().with(add().with("z").with("x").with(1).build()).with("w").build())
                .build();
        assertEquals(expected, pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_unaryTermIsKept() {
        Expression sum = add().with(factorial(sym("n"))).with(factorial(sym("n"))).build();
        assertEquals(mul().with(2).with(factorial(sym("n"))).build(), pass.rewrite(sum, 0));
    }

    @Test
    void rewrite_ignoresNonSumNodes() {
        Expression product = mul().with("x").with("x").build();
        Expression x = sym("x");
        assertSame(product, pass.rewrite(product, 0));
        assertSame(x, pass.rewrite(x, 0));
    }
}
