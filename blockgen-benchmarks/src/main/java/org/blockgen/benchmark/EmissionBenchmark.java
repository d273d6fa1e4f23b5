package org.blockgen.benchmark;

import java.util.concurrent.TimeUnit;

import org.blockgen.emit.IndexExpressionBuilder;
import org.blockgen.emit.Order;
import org.blockgen.emit.PrecedenceResolver;
import org.blockgen.emit.StringLiteralEncoder;
import org.openjdk.jmh.annotations.*;

/**
 * Cost of the individual emission helpers called for every block.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 1)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@State(Scope.Thread)
public class EmissionBenchmark {

    String text = "It's a \\ path\nover two lines";
    String literalIndex = "42";
    String dynamicIndex = "xs.length";

    @Benchmark
    public String quote() {
        return StringLiteralEncoder.quote(text);
    }

    @Benchmark
    public String multilineQuote() {
        return StringLiteralEncoder.multilineQuote(text);
    }

    @Benchmark
    public String wrap() {
        return PrecedenceResolver.wrap("a + b", Order.ADDITION, Order.MULTIPLICATION);
    }

    @Benchmark
    public String adjustLiteral() {
        return IndexExpressionBuilder.adjust(literalIndex, 1, true, Order.NONE, true);
    }

    @Benchmark
    public String adjustDynamic() {
        return IndexExpressionBuilder.adjust(dynamicIndex, 1, true, Order.MEMBER, false);
    }
}
