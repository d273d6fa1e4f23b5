package org.blockgen.emit;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Builds index expressions shifted by a constant, optionally negated, and moved between zero- and
 * one-based indexing. Numeric literals are folded right away; anything else is adjusted in the
 * generated code.
 */
public final class IndexExpressionBuilder {

    private static final Pattern NUMBER = Pattern.compile("^\\s*-?\\d+(\\.\\d+)?\\s*$");

    private IndexExpressionBuilder() {}

    /**
     * The order to request when fetching the base expression. A pending shift or negation binds
     * the base as its left operand, otherwise the caller's own demand passes through.
     */
    public static Order outerOrder(int delta, boolean negate, Order requested, boolean oneBased) {
        return innerOrder(effectiveDelta(delta, oneBased), negate, requested);
    }

    public static String defaultIndex(boolean oneBased) {
        return oneBased ? "1" : "0";
    }

    /**
     * @param base      code of the connected index expression, or {@code null} if none is connected
     * @param delta     value to add to the index
     * @param negate    whether to negate the shifted index
     * @param requested the loosest order the caller accepts for the result
     * @param oneBased  whether the workspace counts from one
     */
    public static String adjust(String base, int delta, boolean negate, Order requested, boolean oneBased) {
        long effective = effectiveDelta(delta, oneBased);
        String at = base == null || base.isEmpty() ? defaultIndex(oneBased) : base;

        if (isNumber(at)) {
            BigDecimal value = new BigDecimal(at.trim()).add(BigDecimal.valueOf(effective));
            if (negate) {
                value = value.negate();
            }
            return render(value);
        }

        if (effective > 0) {
            at = at + " + " + effective;
        } else if (effective < 0) {
            at = at + " - " + -effective;
        }
        if (negate) {
            // A signed operand must not merge with the minus into "--" or "-+".
            at = effective != 0 || startsWithSign(at) ? "-(" + at + ")" : "-" + at;
        }
        return PrecedenceResolver.wrap(at, innerOrder(effective, negate, requested), requested);
    }

    public static boolean isNumber(String code) {
        return NUMBER.matcher(code).matches();
    }

    private static long effectiveDelta(int delta, boolean oneBased) {
        return oneBased ? (long) delta - 1 : delta;
    }

    private static boolean startsWithSign(String code) {
        String trimmed = code.stripLeading();
        return trimmed.startsWith("-") || trimmed.startsWith("+");
    }

    private static Order innerOrder(long effectiveDelta, boolean negate, Order requested) {
        if (effectiveDelta > 0) {
            return Order.ADDITION;
        } else if (effectiveDelta < 0) {
            return Order.SUBTRACTION;
        } else if (negate) {
            return Order.UNARY_NEGATION;
        }
        return requested;
    }

    private static String render(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }
}
