package org.blockgen.emit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IndexExpressionBuilderTest {

    // ── Literal folding ────────────────────────────────────────────────────

    @Test
    void literal_foldsDelta() {
        assertThat(IndexExpressionBuilder.adjust("5", 2, false, Order.NONE, false)).isEqualTo("7");
        assertThat(IndexExpressionBuilder.adjust("5", -7, false, Order.MEMBER, false)).isEqualTo("-2");
    }

    @Test
    void literal_foldsOneBasedShiftThenNegates() {
        // 1 - 1 = 0, and negating zero stays 0
        assertThat(IndexExpressionBuilder.adjust("1", 0, true, Order.NONE, true)).isEqualTo("0");
        // 3 + 1 - 1 = 3, negated
        assertThat(IndexExpressionBuilder.adjust("3", 1, true, Order.NONE, true)).isEqualTo("-3");
    }

    @Test
    void literal_neverGetsParentheses() {
        assertThat(IndexExpressionBuilder.adjust("4", 1, true, Order.ATOMIC, false)).isEqualTo("-5");
    }

    @Test
    void literal_keepsDecimals() {
        assertThat(IndexExpressionBuilder.adjust("2.5", 1, false, Order.NONE, false)).isEqualTo("3.5");
        assertThat(IndexExpressionBuilder.adjust("1.50", 0, false, Order.NONE, false)).isEqualTo("1.5");
    }

    @Test
    void literal_acceptsNegativeAndPaddedNumbers() {
        assertThat(IndexExpressionBuilder.adjust("-4", 1, false, Order.NONE, false)).isEqualTo("-3");
        assertThat(IndexExpressionBuilder.adjust(" 8 ", 0, false, Order.NONE, true)).isEqualTo("7");
    }

    @Test
    void missingProducer_usesDefaultIndex() {
        assertThat(IndexExpressionBuilder.adjust(null, 0, false, Order.NONE, false)).isEqualTo("0");
        assertThat(IndexExpressionBuilder.adjust("", 0, false, Order.NONE, true)).isEqualTo("0");
        assertThat(IndexExpressionBuilder.adjust(null, 1, true, Order.NONE, false)).isEqualTo("-1");
    }

    // ── Dynamic expressions ───────────────────────────────────────────────

    @Test
    void dynamic_positiveDelta_appendsAddition() {
        assertThat(IndexExpressionBuilder.adjust("foo()", 1, false, Order.ADDITION, false)).isEqualTo("foo() + 1");
    }

    @Test
    void dynamic_additionInTighterContext_isParenthesized() {
        assertThat(IndexExpressionBuilder.adjust("foo()", 1, false, Order.SUBTRACTION, false))
                .isEqualTo("(foo() + 1)");
        assertThat(IndexExpressionBuilder.adjust("foo()", 1, false, Order.MULTIPLICATION, false))
                .isEqualTo("(foo() + 1)");
    }

    @Test
    void dynamic_negativeDelta_appendsSubtraction() {
        assertThat(IndexExpressionBuilder.adjust("i", -2, false, Order.NONE, false)).isEqualTo("i - 2");
        assertThat(IndexExpressionBuilder.adjust("i", 0, false, Order.ADDITION, true)).isEqualTo("i - 1");
        assertThat(IndexExpressionBuilder.adjust("i", 0, false, Order.MULTIPLICATION, true)).isEqualTo("(i - 1)");
    }

    @Test
    void dynamic_negationWithoutDelta_prefixesMinus() {
        assertThat(IndexExpressionBuilder.adjust("i", 0, true, Order.NONE, false)).isEqualTo("-i");
        assertThat(IndexExpressionBuilder.adjust("i", 0, true, Order.MEMBER, false)).isEqualTo("(-i)");
    }

    @Test
    void dynamic_negationWithDelta_negatesShiftedValue() {
        assertThat(IndexExpressionBuilder.adjust("i", 1, true, Order.NONE, false)).isEqualTo("-(i + 1)");
        assertThat(IndexExpressionBuilder.adjust("i", 1, true, Order.NONE, true)).isEqualTo("-i");
        assertThat(IndexExpressionBuilder.adjust("i", 3, true, Order.NONE, true)).isEqualTo("-(i + 2)");
    }

    @Test
    void dynamic_negatingSignedBase_keepsParentheses() {
        assertThat(IndexExpressionBuilder.adjust("-i", 0, true, Order.NONE, false)).isEqualTo("-(-i)");
        assertThat(IndexExpressionBuilder.adjust("-i", 1, true, Order.NONE, true)).isEqualTo("-(-i)");
        assertThat(IndexExpressionBuilder.adjust("--i", 0, true, Order.NONE, false)).isEqualTo("-(--i)");
        assertThat(IndexExpressionBuilder.adjust("+x", 0, true, Order.NONE, false)).isEqualTo("-(+x)");
        assertThat(IndexExpressionBuilder.adjust("-i", 0, true, Order.MEMBER, false)).isEqualTo("(-(-i))");
    }

    @Test
    void extremeDeltas_doNotOverflow() {
        assertThat(IndexExpressionBuilder.adjust("i", Integer.MIN_VALUE, false, Order.NONE, false))
                .isEqualTo("i - 2147483648");
        assertThat(IndexExpressionBuilder.adjust("i", Integer.MIN_VALUE, false, Order.NONE, true))
                .isEqualTo("i - 2147483649");
        assertThat(IndexExpressionBuilder.adjust("0", Integer.MIN_VALUE, true, Order.NONE, true))
                .isEqualTo("2147483649");
        assertThat(IndexExpressionBuilder.outerOrder(Integer.MIN_VALUE, false, Order.NONE, true))
                .isEqualTo(Order.SUBTRACTION);
    }

    @Test
    void dynamic_zeroDelta_passesThrough() {
        assertThat(IndexExpressionBuilder.adjust("a + b", 0, false, Order.MULTIPLICATION, false)).isEqualTo("a + b");
        assertThat(IndexExpressionBuilder.adjust("xs.length", 1, false, Order.NONE, true)).isEqualTo("xs.length");
    }

    // ── Outer order ───────────────────────────────────────────────────────

    @Test
    void outerOrder_followsPendingArithmetic() {
        assertThat(IndexExpressionBuilder.outerOrder(2, false, Order.NONE, false)).isEqualTo(Order.ADDITION);
        assertThat(IndexExpressionBuilder.outerOrder(0, false, Order.NONE, true)).isEqualTo(Order.SUBTRACTION);
        assertThat(IndexExpressionBuilder.outerOrder(1, true, Order.NONE, true)).isEqualTo(Order.UNARY_NEGATION);
        assertThat(IndexExpressionBuilder.outerOrder(0, false, Order.MEMBER, false)).isEqualTo(Order.MEMBER);
    }

    @Test
    void isNumber_recognizesBareLiterals() {
        assertThat(IndexExpressionBuilder.isNumber("42")).isTrue();
        assertThat(IndexExpressionBuilder.isNumber("-3.25")).isTrue();
        assertThat(IndexExpressionBuilder.isNumber("1e3")).isFalse();
        assertThat(IndexExpressionBuilder.isNumber("(1)")).isFalse();
        assertThat(IndexExpressionBuilder.isNumber(".5")).isFalse();
    }
}
