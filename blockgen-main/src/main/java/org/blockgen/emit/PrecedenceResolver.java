package org.blockgen.emit;

import java.util.Set;

/**
 * Decides whether generated code must be parenthesized before it is placed into a surrounding
 * expression.
 */
public final class PrecedenceResolver {

    /**
     * Combinations that never need parentheses. Fixed to match the WebPPL grammar.
     */
    public static final Set<OverridePair> OVERRIDES = Set.of(
            // (foo()).bar -> foo().bar
            // (foo())[0] -> foo()[0]
            OverridePair.of(Order.FUNCTION_CALL, Order.MEMBER),
            // (foo())() -> foo()()
            OverridePair.of(Order.FUNCTION_CALL, Order.FUNCTION_CALL),
            // (foo.bar).baz -> foo.bar.baz
            // (foo[0])[1] -> foo[0][1]
            OverridePair.of(Order.MEMBER, Order.MEMBER),
            // (foo.bar)() -> foo.bar()
            OverridePair.of(Order.MEMBER, Order.FUNCTION_CALL),
            // !(!foo) -> !!foo
            OverridePair.of(Order.LOGICAL_NOT, Order.LOGICAL_NOT),
            // a * (b * c) -> a * b * c
            OverridePair.of(Order.MULTIPLICATION, Order.MULTIPLICATION),
            // a + (b + c) -> a + b + c
            OverridePair.of(Order.ADDITION, Order.ADDITION),
            // a && (b && c) -> a && b && c
            OverridePair.of(Order.LOGICAL_AND, Order.LOGICAL_AND),
            // a || (b || c) -> a || b || c
            OverridePair.of(Order.LOGICAL_OR, Order.LOGICAL_OR)
    );

    private PrecedenceResolver() {}

    /**
     * @param producer         order of the code being placed
     * @param consumerMaxOrder loosest order the surrounding context accepts without parentheses
     */
    public static boolean needsParentheses(Order producer, Order consumerMaxOrder) {
        if (producer.bindsAtLeastAsTightAs(consumerMaxOrder)) {
            return false;
        }
        return !OVERRIDES.contains(OverridePair.of(consumerMaxOrder, producer));
    }

    public static String wrap(String code, Order producer, Order consumerMaxOrder) {
        if (needsParentheses(producer, consumerMaxOrder)) {
            return "(" + code + ")";
        }
        return code;
    }
}
