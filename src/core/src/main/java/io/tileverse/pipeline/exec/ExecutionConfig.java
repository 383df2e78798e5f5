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
package io.tileverse.pipeline.exec;

import static java.util.Objects.requireNonNull;

import io.tileverse.pipeline.PipelineConfigurationException;
import io.tileverse.pipeline.port.ConfigPort;
import java.io.IOException;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The process-wide execution settings, read once at the start of a run.
 *
 * @param memoryFrames the maximum number of frames loaded at once by the {@link ChunkScheduler}, empty for
 *     unbounded
 * @param workerCount the number of worker threads of the {@link LineProcessingCapsule}
 */
public record ExecutionConfig(OptionalInt memoryFrames, int workerCount) {

    /** Name of the {@code config} attribute holding the maximum number of frames per chunk. */
    public static final String MEMORY = "MEMORY";

    /** Name of the {@code config} attribute holding the worker count. */
    public static final String CPU = "CPU";

    /**
     * @throws PipelineConfigurationException if the memory budget is not positive or the worker count is below 1
     */
    public ExecutionConfig {
        requireNonNull(memoryFrames, "memoryFrames");
        if (memoryFrames.isPresent() && memoryFrames.getAsInt() <= 0) {
            throw new PipelineConfigurationException(
                    "Invalid memory budget: " + memoryFrames.getAsInt() + " frames, must be at least 1");
        }
        if (workerCount < 1) {
            throw new PipelineConfigurationException("Invalid worker count: " + workerCount + ", must be at least 1");
        }
    }

    /**
     * @return unbounded chunks and one worker per available processor
     */
    public static ExecutionConfig defaults() {
        return new ExecutionConfig(OptionalInt.empty(), Runtime.getRuntime().availableProcessors());
    }

    public static ExecutionConfig of(int memoryFrames, int workerCount) {
        return new ExecutionConfig(OptionalInt.of(memoryFrames), workerCount);
    }

    public static ExecutionConfig unbounded(int workerCount) {
        return new ExecutionConfig(OptionalInt.empty(), workerCount);
    }

    public ExecutionConfig withMemoryFrames(OptionalInt memoryFrames) {
        return new ExecutionConfig(memoryFrames, workerCount);
    }

    public ExecutionConfig withWorkerCount(int workerCount) {
        return new ExecutionConfig(memoryFrames, workerCount);
    }

    /**
     * Reads {@link #MEMORY} and {@link #CPU} from the settings entry. A missing {@code MEMORY} means unbounded, a
     * missing {@code CPU} means one worker per available processor.
     *
     * @param configPort a bound config port
     * @return the settings
     * @throws PipelineConfigurationException if a value is not a positive whole number
     * @throws IOException If an I/O error occurs
     */
    public static ExecutionConfig fromConfigPort(ConfigPort configPort) throws IOException {
        requireNonNull(configPort, "configPort");
        OptionalInt memory = toInt(MEMORY, configPort.getAttribute(MEMORY));
        OptionalInt cpu = toInt(CPU, configPort.getAttribute(CPU));
        return new ExecutionConfig(memory, cpu.orElse(Runtime.getRuntime().availableProcessors()));
    }

    private static OptionalInt toInt(String name, Optional<Object> value) {
        if (value.isEmpty()) {
            return OptionalInt.empty();
        }
        Object v = value.orElseThrow();
        try {
            if (v instanceof Integer i) {
                return OptionalInt.of(i);
            }
            if (v instanceof Long l) {
                return OptionalInt.of(Math.toIntExact(l));
            }
            if (v instanceof Double d && d == Math.rint(d)) {
                return OptionalInt.of(Math.toIntExact(d.longValue()));
            }
            if (v instanceof String s) {
                return OptionalInt.of(Integer.parseInt(s.trim()));
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw new PipelineConfigurationException("Invalid " + name + " setting: " + v, e);
        }
        throw new PipelineConfigurationException("Invalid " + name + " setting: " + v);
    }
}
