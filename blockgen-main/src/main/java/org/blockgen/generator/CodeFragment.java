package org.blockgen.generator;

import java.util.Objects;

import org.blockgen.emit.Order;

/**
 * What a handler produced for one block: statement code, an expression with its order, or nothing.
 *
 * @param code  generated text, never {@code null}
 * @param order order of an expression; {@code null} for statement code
 */
public record CodeFragment(String code, Order order) {

    private static final CodeFragment NONE = new CodeFragment("", null);

    public CodeFragment {
        Objects.requireNonNull(code, "code");
    }

    public static CodeFragment statement(String code) {
        return new CodeFragment(code, null);
    }

    public static CodeFragment expression(String code, Order order) {
        return new CodeFragment(code, Objects.requireNonNull(order, "order"));
    }

    /**
     * For blocks that only contribute declarations; the block emits no code, and its successor is
     * not chained.
     */
    public static CodeFragment none() {
        return NONE;
    }

    public boolean isExpression() {
        return order != null;
    }

    public boolean isEmpty() {
        return code.isEmpty();
    }
}
