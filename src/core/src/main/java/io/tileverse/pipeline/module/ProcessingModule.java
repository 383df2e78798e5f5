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
package io.tileverse.pipeline.module;

import io.tileverse.pipeline.exec.ChunkScheduler;
import io.tileverse.pipeline.exec.FrameFunction;
import io.tileverse.pipeline.exec.LineFunction;
import io.tileverse.pipeline.exec.LineProcessingCapsule;
import io.tileverse.pipeline.port.InputPort;
import io.tileverse.pipeline.port.OutputPort;
import java.io.IOException;
import java.util.Optional;

/**
 * A module reading, transforming and writing data: it owns both input and output ports.
 * <p>
 * Subclasses implement {@link #run()} with the two strategies provided here, which read the {@code MEMORY} and
 * {@code CPU} settings from the config port when invoked:
 *
 * <pre>{@code
 * public void run() throws IOException {
 *     NdArray dark = darkIn.read().frame(0);
 *     applyFunctionToImages(frame -> subtract(frame, dark), imagesIn, imagesOut, "Dark frame subtraction");
 * }
 * }</pre>
 */
public abstract class ProcessingModule extends PipelineModule {

    protected ProcessingModule(String name) {
        super(name);
    }

    protected final InputPort addInputPort(String tag) {
        return registerInputPort(tag);
    }

    protected final OutputPort addOutputPort(String tag) {
        return addOutputPort(tag, true);
    }

    /**
     * Adds an output port; a port already registered under {@code tag} is replaced and deactivated.
     *
     * @param tag the tag written by the port
     * @param active whether writes through the port are persisted
     * @return the new port
     */
    protected final OutputPort addOutputPort(String tag, boolean active) {
        return registerOutputPort(tag, active);
    }

    public Optional<InputPort> getInputPort(String tag) {
        return inputPort(tag);
    }

    public Optional<OutputPort> getOutputPort(String tag) {
        return outputPort(tag);
    }

    /**
     * Applies {@code transform} to every frame of {@code in} under the configured memory budget.
     *
     * @param transform the per-frame transform
     * @param in the input
     * @param out the output, or {@code null} to discard the results
     * @param message a label for progress reporting
     * @throws IOException If an I/O error occurs
     * @see ChunkScheduler#apply(FrameFunction, InputPort, OutputPort, String)
     */
    protected void applyFunctionToImages(FrameFunction transform, InputPort in, OutputPort out, String message)
            throws IOException {
        new ChunkScheduler(getExecutionConfig(), getProgressListener()).apply(transform, in, out, message);
    }

    /**
     * Applies {@code transform} to the time series at every position of {@code in} with the configured worker count.
     *
     * @param transform the per-position transform
     * @param in the 3-D input
     * @param out the output
     * @throws IOException If an I/O error occurs
     * @see LineProcessingCapsule#run(LineFunction, InputPort, OutputPort)
     */
    protected void applyFunctionInTime(LineFunction transform, InputPort in, OutputPort out) throws IOException {
        new LineProcessingCapsule(getExecutionConfig(), getProgressListener()).run(transform, in, out);
    }
}
