package org.blockgen.emit;

import java.util.Objects;

/**
 * A context/expression combination that may go without parentheses even though the expression
 * binds more loosely than the context demands.
 *
 * @param consumer the order demanded by the surrounding expression
 * @param producer the order of the expression placed into it
 */
public record OverridePair(Order consumer, Order producer) {

    public OverridePair {
        Objects.requireNonNull(consumer, "consumer");
        Objects.requireNonNull(producer, "producer");
    }

    public static OverridePair of(Order consumer, Order producer) {
        return new OverridePair(consumer, producer);
    }
}
