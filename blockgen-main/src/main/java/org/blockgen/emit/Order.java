package org.blockgen.emit;

/**
 * Operator precedence of generated WebPPL expressions. A lower rank binds tighter; {@link #ATOMIC}
 * is a literal or identifier and {@link #NONE} is a context that accepts anything, such as a
 * function argument or the inside of existing parentheses.
 * <p>
 * Orders that share a rank bind equally ({@link #INCREMENT} and {@link #DECREMENT}; the
 * relational operators).
 */
public enum Order {
    ATOMIC(0),          // 0 "" ...
    NEW(1),             // new
    MEMBER(2),          // . []
    FUNCTION_CALL(3),   // ()
    INCREMENT(4),       // ++
    DECREMENT(4),       // --
    BITWISE_NOT(5),     // ~
    UNARY_PLUS(6),      // +
    UNARY_NEGATION(7),  // -
    LOGICAL_NOT(8),     // !
    TYPEOF(9),          // typeof
    VOID(10),           // void
    DELETE(11),         // delete
    AWAIT(12),          // await
    EXPONENTIATION(13), // **
    MULTIPLICATION(14), // *
    DIVISION(15),       // /
    MODULUS(16),        // %
    SUBTRACTION(17),    // -
    ADDITION(18),       // +
    BITWISE_SHIFT(19),  // << >> >>>
    RELATIONAL(20),     // < <= > >=
    IN(20),             // in
    INSTANCEOF(20),     // instanceof
    EQUALITY(21),       // == != === !==
    BITWISE_AND(22),    // &
    BITWISE_XOR(23),    // ^
    BITWISE_OR(24),     // |
    LOGICAL_AND(25),    // &&
    LOGICAL_OR(26),     // ||
    CONDITIONAL(27),    // ?:
    ASSIGNMENT(28),     // = += -= **= *= /= %= <<= >>= ...
    YIELD(29),          // yield
    COMMA(30),          // ,
    NONE(99);           // (...)

    private final int rank;

    Order(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean bindsAtLeastAsTightAs(Order other) {
        return rank <= other.rank;
    }
}
