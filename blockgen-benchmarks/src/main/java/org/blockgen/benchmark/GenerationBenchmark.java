package org.blockgen.benchmark;

import java.util.concurrent.TimeUnit;

import org.blockgen.GeneratorOptions;
import org.blockgen.WebPplGenerator;
import org.blockgen.benchmark.domain.ProgramHandlers;
import org.blockgen.benchmark.domain.ProgramWorkspace;
import org.blockgen.benchmark.domain.Programs;
import org.openjdk.jmh.annotations.*;

/**
 * Whole-workspace generation: names, comments, parenthesization and index adjustment over
 * programs of increasing size.
 */
@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class GenerationBenchmark {

    @State(Scope.Thread)
    public static class ProgramState {

        @Param({"10", "100", "1000"})
        int statements;

        @Param({"false", "true"})
        boolean oneBased;

        WebPplGenerator generator;
        ProgramWorkspace workspace;

        @Setup(Level.Trial)
        public void build() {
            generator = ProgramHandlers.generator(GeneratorOptions.builder()
                    .infiniteLoopTrap("if (--loopTrap == 0) throw 'Infinite loop.';\n")
                    .build());
            workspace = Programs.generate(statements, oneBased);
        }
    }

    @Benchmark
    public String workspaceToCode(ProgramState state) {
        return state.generator.workspaceToCode(state.workspace);
    }
}
