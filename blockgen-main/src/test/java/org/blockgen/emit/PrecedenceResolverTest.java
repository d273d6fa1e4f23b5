package org.blockgen.emit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PrecedenceResolverTest {

    @Test
    void tighterProducer_isLeftAlone() {
        assertThat(PrecedenceResolver.wrap("a * b", Order.MULTIPLICATION, Order.ADDITION)).isEqualTo("a * b");
        assertThat(PrecedenceResolver.wrap("x", Order.ATOMIC, Order.MEMBER)).isEqualTo("x");
    }

    @Test
    void looserProducer_isParenthesized() {
        assertThat(PrecedenceResolver.wrap("a + b", Order.ADDITION, Order.MULTIPLICATION)).isEqualTo("(a + b)");
        assertThat(PrecedenceResolver.wrap("a || b", Order.LOGICAL_OR, Order.LOGICAL_AND)).isEqualTo("(a || b)");
        assertThat(PrecedenceResolver.wrap("typeof a", Order.TYPEOF, Order.LOGICAL_NOT)).isEqualTo("(typeof a)");
    }

    @Test
    void equalOrder_isLeftAloneInBothDirections() {
        assertThat(PrecedenceResolver.wrap("a - b", Order.SUBTRACTION, Order.SUBTRACTION)).isEqualTo("a - b");
        // Increment and decrement share one level.
        assertThat(PrecedenceResolver.wrap("i++", Order.INCREMENT, Order.DECREMENT)).isEqualTo("i++");
        assertThat(PrecedenceResolver.wrap("i--", Order.DECREMENT, Order.INCREMENT)).isEqualTo("i--");
        assertThat(PrecedenceResolver.wrap("a in b", Order.IN, Order.RELATIONAL)).isEqualTo("a in b");
    }

    @Test
    void oneStepLooser_isParenthesized() {
        assertThat(PrecedenceResolver.wrap("a + b", Order.ADDITION, Order.SUBTRACTION)).isEqualTo("(a + b)");
        assertThat(PrecedenceResolver.wrap("-a", Order.UNARY_NEGATION, Order.UNARY_PLUS)).isEqualTo("(-a)");
    }

    @Test
    void memberAndCallChains_needNoParentheses() {
        assertThat(PrecedenceResolver.wrap("foo()", Order.FUNCTION_CALL, Order.MEMBER)).isEqualTo("foo()");
        assertThat(PrecedenceResolver.wrap("foo.bar", Order.MEMBER, Order.FUNCTION_CALL)).isEqualTo("foo.bar");
        assertThat(PrecedenceResolver.wrap("foo()", Order.FUNCTION_CALL, Order.FUNCTION_CALL)).isEqualTo("foo()");
    }

    @Test
    void noneContext_acceptsEverything() {
        for (Order producer : Order.values()) {
            assertThat(PrecedenceResolver.needsParentheses(producer, Order.NONE)).as(producer.name()).isFalse();
        }
    }

    @Test
    void atomicContext_parenthesizesEverythingButAtoms() {
        assertThat(PrecedenceResolver.wrap("1", Order.ATOMIC, Order.ATOMIC)).isEqualTo("1");
        assertThat(PrecedenceResolver.wrap("new Foo()", Order.NEW, Order.ATOMIC)).isEqualTo("(new Foo())");
    }

    @Test
    void everyPair_followsRankOrOverride() {
        for (Order producer : Order.values()) {
            for (Order consumer : Order.values()) {
                String wrapped = PrecedenceResolver.wrap("e", producer, consumer);
                boolean elided = producer.rank() <= consumer.rank()
                        || PrecedenceResolver.OVERRIDES.contains(OverridePair.of(consumer, producer));
                assertThat(wrapped).as(producer + " into " + consumer).isEqualTo(elided ? "e" : "(e)");
            }
        }
    }

    @Test
    void overrideTable_isFixed() {
        assertThat(PrecedenceResolver.OVERRIDES).containsExactlyInAnyOrder(
                OverridePair.of(Order.FUNCTION_CALL, Order.MEMBER),
                OverridePair.of(Order.FUNCTION_CALL, Order.FUNCTION_CALL),
                OverridePair.of(Order.MEMBER, Order.MEMBER),
                OverridePair.of(Order.MEMBER, Order.FUNCTION_CALL),
                OverridePair.of(Order.LOGICAL_NOT, Order.LOGICAL_NOT),
                OverridePair.of(Order.MULTIPLICATION, Order.MULTIPLICATION),
                OverridePair.of(Order.ADDITION, Order.ADDITION),
                OverridePair.of(Order.LOGICAL_AND, Order.LOGICAL_AND),
                OverridePair.of(Order.LOGICAL_OR, Order.LOGICAL_OR));
    }

    @Test
    void ranks_keepOperatorOrdering() {
        assertThat(Order.MEMBER.rank()).isLessThan(Order.FUNCTION_CALL.rank());
        assertThat(Order.UNARY_NEGATION.rank()).isLessThan(Order.LOGICAL_NOT.rank());
        assertThat(Order.MULTIPLICATION.rank()).isLessThan(Order.DIVISION.rank());
        assertThat(Order.SUBTRACTION.rank()).isLessThan(Order.ADDITION.rank());
        assertThat(Order.INCREMENT.rank()).isEqualTo(Order.DECREMENT.rank());
        assertThat(Order.LOGICAL_AND.rank()).isLessThan(Order.LOGICAL_OR.rank());
    }
}
