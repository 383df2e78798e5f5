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

import io.tileverse.pipeline.exec.ExecutionConfig;
import io.tileverse.pipeline.exec.LineProcessingCapsule;
import io.tileverse.pipeline.exec.ProgressListener;
import java.io.IOException;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.runner.RunnerException;

/**
 * JMH benchmark of {@link LineProcessingCapsule} for several worker counts.
 */
@State(Scope.Benchmark)
public class LineParallelBenchmark extends AbstractPipelineBenchmark {

    @Param({"1", "4", "8"})
    public int workerCount;

    /**
     * Iterations of the per-signal smoothing kernel, to make the transform CPU bound.
     */
    @Param({"20"})
    public int passes;

    @Benchmark
    public int[] smoothTimeSeries() throws IOException {
        new LineProcessingCapsule(ExecutionConfig.unbounded(workerCount), ProgressListener.noop())
                .run(this::smooth, inputPort(), outputPort(), "benchmark");
        return store.getShape(OUTPUT_TAG);
    }

    private double[] smooth(double[] signal) {
        double[] current = signal.clone();
        double[] next = new double[current.length];
        for (int p = 0; p < passes; p++) {
            for (int t = 0; t < current.length; t++) {
                double left = current[Math.max(0, t - 1)];
                double right = current[Math.min(current.length - 1, t + 1)];
                next[t] = 0.25 * left + 0.5 * current[t] + 0.25 * right;
            }
            double[] swap = current;
            current = next;
            next = swap;
        }
        return current;
    }

    public static void main(String[] args) throws RunnerException {
        runBenchmark(LineParallelBenchmark.class);
    }
}
