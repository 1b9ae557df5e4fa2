package io.setkit.benchmarks;

import io.setkit.collect.SeenSet;
import io.setkit.core.SetkitConfiguration;
import io.setkit.core.SetkitConfiguration.DedupStrategy;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Compares the two dedup strategies through the seen-set filters, where they
 * run on every batch. The compacting scan should win for small batches.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class SeenSetFilterBenchmark {

    @Param({"COMPACTING", "HASHED"})
    public DedupStrategy strategy;

    @Param({"8", "64", "1024"})
    public int batchSize;

    private SeenSet<Integer> seen;
    private List<Integer> batch;

    @Setup(Level.Trial)
    public void setup() {
        var random = new Random(17);
        seen = new SeenSet<>(SetkitConfiguration.builder().dedupStrategy(strategy).build());
        for (var i = 0; i < batchSize; i += 2) {
            seen.see(i);
        }
        batch = new ArrayList<>(batchSize);
        for (var i = 0; i < batchSize; i++) {
            // roughly half the batch repeats an earlier value
            batch.add(random.nextInt(Math.max(1, batchSize / 2)));
        }
    }

    @Benchmark
    public int filterSeen() {
        return seen.filterSeen(batch).size();
    }

    @Benchmark
    public int filterNotSeen() {
        return seen.filterNotSeen(batch).size();
    }
}
