package io.setkit.benchmarks;

import io.setkit.collect.OrderedMap;
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
import org.openjdk.jmh.infra.Blackhole;

import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class OrderedMapBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({"1000", "100000"})
        public int size;

        private OrderedMap<Integer, String> map;
        private int[] probes;
        private int cursor;

        @Setup(Level.Trial)
        public void setUp() {
            var random = new Random(23);
            map = new OrderedMap<>();
            for (var i = 0; i < size; i++) {
                var key = random.nextInt(size * 4);
                map.add(key, "v" + key);
            }
            probes = new int[1024];
            for (var i = 0; i < probes.length; i++) {
                probes[i] = random.nextInt(size * 4);
            }
        }
    }

    @Benchmark
    public boolean get(BenchmarkState state) {
        return state.map.get(nextProbe(state)).isPresent();
    }

    @Benchmark
    public boolean contains(BenchmarkState state) {
        return state.map.contains(nextProbe(state));
    }

    @Benchmark
    public void insertAndRemove(BenchmarkState state) {
        var key = -1 - (nextProbe(state) & 0xff);
        state.map.add(key, "tmp");
        state.map.remove(key);
    }

    @Benchmark
    public void iterate(BenchmarkState state, Blackhole blackhole) {
        for (Map.Entry<Integer, String> entry : state.map.entries()) {
            blackhole.consume(entry);
        }
    }

    private static int nextProbe(BenchmarkState state) {
        state.cursor = (state.cursor + 1) & (state.probes.length - 1);
        return state.probes[state.cursor];
    }
}
