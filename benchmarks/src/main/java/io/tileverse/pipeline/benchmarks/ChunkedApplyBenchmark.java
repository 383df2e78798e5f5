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

import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.exec.ChunkScheduler;
import io.tileverse.pipeline.exec.ExecutionConfig;
import io.tileverse.pipeline.exec.ProgressListener;
import java.io.IOException;
import java.util.OptionalInt;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.runner.RunnerException;

/**
 * JMH benchmark of {@link ChunkScheduler} for several memory budgets.
 */
@State(Scope.Benchmark)
public class ChunkedApplyBenchmark extends AbstractPipelineBenchmark {

    /**
     * Frames per chunk, {@code 0} for unbounded.
     */
    @Param({"0", "10", "50"})
    public int memoryFrames;

    @Benchmark
    public int[] applyToNewTag() throws IOException {
        OptionalInt budget = memoryFrames == 0 ? OptionalInt.empty() : OptionalInt.of(memoryFrames);
        ExecutionConfig config = new ExecutionConfig(budget, 1);
        new ChunkScheduler(config, ProgressListener.noop())
                .apply(ChunkedApplyBenchmark::subtractMean, inputPort(), outputPort(), "benchmark");
        return store.getShape(OUTPUT_TAG);
    }

    private static NdArray subtractMean(NdArray frame) {
        double[] values = frame.toArray();
        double mean = 0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        for (int i = 0; i < values.length; i++) {
            values[i] -= mean;
        }
        return NdArray.wrap(values, frame.shape());
    }

    public static void main(String[] args) throws RunnerException {
        runBenchmark(ChunkedApplyBenchmark.class);
    }
}
