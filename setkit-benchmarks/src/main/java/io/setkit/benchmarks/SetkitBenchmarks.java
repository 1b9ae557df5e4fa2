package io.setkit.benchmarks;

import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.OptionsBuilder;

/**
 * Runs every setkit benchmark, or the ones matching the regular expressions
 * given as arguments.
 */
public final class SetkitBenchmarks {

    private SetkitBenchmarks() {
    }

    public static void main(String[] args) throws RunnerException {
        var options = new OptionsBuilder();
        if (args.length == 0) {
            options.include(SetkitBenchmarks.class.getPackageName() + ".*Benchmark");
        } else {
            for (var pattern : args) {
                options.include(pattern);
            }
        }
        new Runner(options.build()).run();
    }
}
