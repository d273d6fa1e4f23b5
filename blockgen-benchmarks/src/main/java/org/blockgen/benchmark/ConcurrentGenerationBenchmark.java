package org.blockgen.benchmark;

import java.util.concurrent.TimeUnit;

import org.blockgen.GeneratorOptions;
import org.blockgen.WebPplGenerator;
import org.blockgen.benchmark.domain.ProgramHandlers;
import org.blockgen.benchmark.domain.ProgramWorkspace;
import org.blockgen.benchmark.domain.Programs;
import org.openjdk.jmh.annotations.*;

/**
 * Four threads sharing one generator, each translating its own workspace. Every pass runs in its own
 * session, so this should scale with the thread count.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(4)
public class ConcurrentGenerationBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        WebPplGenerator generator;

        @Setup(Level.Trial)
        public void init() {
            generator = ProgramHandlers.generator(GeneratorOptions.builder().build());
        }
    }

    @State(Scope.Thread)
    public static class ThreadState {

        ProgramWorkspace workspace;

        @Setup(Level.Trial)
        public void init() {
            workspace = Programs.generate(100, false);
        }
    }

    @Benchmark
    public String workspaceToCode(SharedState shared, ThreadState local) {
        return shared.generator.workspaceToCode(local.workspace);
    }
}
