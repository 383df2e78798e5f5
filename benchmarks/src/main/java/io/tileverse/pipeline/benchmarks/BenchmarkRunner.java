/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.pipeline.benchmarks;

import java.util.Collection;
import java.util.List;
import org.openjdk.jmh.results.RunResult;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.ChainedOptionsBuilder;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

/**
 * Command line entry point running the pipeline benchmarks.
 * <p>
 * Options: {@code --type CHUNKED|LINE|ALL}, {@code --forks N}, {@code --warmup-iterations N},
 * {@code --measurement-iterations N}, {@code --measurement-time SECONDS}.
 */
public class BenchmarkRunner {

    /**
     * Available benchmark types.
     */
    public enum BenchmarkType {
        CHUNKED(ChunkedApplyBenchmark.class),
        LINE(LineParallelBenchmark.class),
        ALL(ChunkedApplyBenchmark.class, LineParallelBenchmark.class);

        private final List<Class<?>> benchmarkClasses;

        BenchmarkType(Class<?>... classes) {
            this.benchmarkClasses = List.of(classes);
        }
    }

    public static void main(String[] args) throws RunnerException {
        BenchmarkType type = BenchmarkType.ALL;
        int forks = 1;
        int warmupIterations = 2;
        int measurementIterations = 5;
        int measurementTime = 5;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + arg);
            }
            String value = args[++i];
            switch (arg) {
                case "--type" -> type = BenchmarkType.valueOf(value.toUpperCase());
                case "--forks" -> forks = Integer.parseInt(value);
                case "--warmup-iterations" -> warmupIterations = Integer.parseInt(value);
                case "--measurement-iterations" -> measurementIterations = Integer.parseInt(value);
                case "--measurement-time" -> measurementTime = Integer.parseInt(value);
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        ChainedOptionsBuilder options = new OptionsBuilder()
                .forks(forks)
                .warmupIterations(warmupIterations)
                .measurementIterations(measurementIterations)
                .measurementTime(TimeValue.seconds(measurementTime));
        for (Class<?> benchmarkClass : type.benchmarkClasses) {
            options.include(benchmarkClass.getSimpleName());
        }
        Collection<RunResult> results = new Runner(options.build()).run();
        System.out.println("Completed " + results.size() + " benchmark runs");
    }
}
