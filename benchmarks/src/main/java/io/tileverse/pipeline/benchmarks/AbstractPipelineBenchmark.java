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
import io.tileverse.pipeline.port.InputPort;
import io.tileverse.pipeline.port.OutputPort;
import io.tileverse.pipeline.store.ArrayStore;
import io.tileverse.pipeline.store.cache.CachingArrayStore;
import io.tileverse.pipeline.store.file.FileArrayStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import org.apache.commons.io.FileUtils;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.profile.GCProfiler;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

/**
 * Base class of the execution strategy benchmarks.
 * <p>
 * A random frame stack is written once per trial to a {@link FileArrayStore} in a temporary directory; every
 * iteration opens a fresh store connection, optionally decorated with a {@link CachingArrayStore}.
 */
@BenchmarkMode({Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
public abstract class AbstractPipelineBenchmark {

    /**
     * Store configurations to benchmark.
     */
    public enum StoreConfig {
        PLAIN, // file store
        MEMORY_CACHE // file store behind a region cache
    }

    static final String INPUT_TAG = "images";
    static final String OUTPUT_TAG = "result";

    @Param
    public StoreConfig storeConfig;

    /**
     * Number of frames of the input stack.
     */
    @Param({"100"})
    public int nframes;

    /**
     * Side length of the square frames.
     */
    @Param({"128"})
    public int frameSize;

    protected Path tempDir;

    protected ArrayStore store;

    @Setup(Level.Trial)
    public void setupTrial() throws IOException {
        tempDir = Files.createTempDirectory("pipeline-benchmark");
        try (FileArrayStore fileStore = new FileArrayStore(tempDir.resolve("store"))) {
            fileStore.open();
            fileStore.replace(INPUT_TAG, randomFrames());
        }
    }

    @TearDown(Level.Trial)
    public void teardownTrial() throws IOException {
        if (tempDir != null && Files.exists(tempDir)) {
            FileUtils.deleteDirectory(tempDir.toFile());
        }
    }

    @Setup(Level.Iteration)
    public void setupStore() throws IOException {
        ArrayStore base = new FileArrayStore(tempDir.resolve("store"));
        store = switch (storeConfig) {
            case PLAIN -> base;
            case MEMORY_CACHE -> CachingArrayStore.builder(base)
                    .maximumWeight(64L * 1024 * 1024)
                    .build();
        };
        store.open();
    }

    @TearDown(Level.Iteration)
    public void tearDownStore() throws IOException {
        if (store != null) {
            store.close();
        }
    }

    protected InputPort inputPort() {
        InputPort port = new InputPort(INPUT_TAG);
        port.bind(store);
        return port;
    }

    protected OutputPort outputPort() {
        OutputPort port = new OutputPort(OUTPUT_TAG);
        port.bind(store);
        return port;
    }

    private NdArray randomFrames() {
        Random random = new Random(42); // Fixed seed for reproducibility
        double[] values = new double[nframes * frameSize * frameSize];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextGaussian();
        }
        return NdArray.wrap(values, nframes, frameSize, frameSize);
    }

    /**
     * Runs a single benchmark class with the GC profiler.
     */
    public static void runBenchmark(Class<? extends AbstractPipelineBenchmark> benchmarkClass)
            throws RunnerException {
        Options options = new OptionsBuilder()
                .include(benchmarkClass.getSimpleName())
                .addProfiler(GCProfiler.class)
                .build();

        new Runner(options).run();
    }
}
