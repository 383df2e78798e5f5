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
import io.tileverse.pipeline.ShapeConflictException;
import io.tileverse.pipeline.TransformException;
import io.tileverse.pipeline.array.FrameRange;
import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.port.AttributePolicy;
import io.tileverse.pipeline.port.InputPort;
import io.tileverse.pipeline.port.OutputPort;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies a {@link FrameFunction} to every frame of a 2-D or 3-D array, loading at most
 * {@link ExecutionConfig#memoryFrames() memoryFrames} frames at a time.
 * <p>
 * The frames are processed in ascending chunks on the calling thread. Where the results go depends on the output:
 * <ul>
 * <li><strong>No output:</strong> results are computed and dropped.
 * <li><strong>Same tag as the input (in place):</strong> a single chunk replaces the whole entry keeping its
 * attributes; several chunks are written back at their own frame range, which requires the transform to preserve
 * the frame shape. A shape change is detected before the chunk is written and raises
 * {@link ShapeConflictException}; the chunks written until then stay written.
 * <li><strong>Different tag:</strong> the output is cleared first, then every chunk result is appended.
 * </ul>
 * For a deterministic transform the stored result does not depend on the memory budget.
 */
@Slf4j
public class ChunkScheduler {

    private final ExecutionConfig config;
    private final ProgressListener progress;

    public ChunkScheduler(ExecutionConfig config) {
        this(config, new LoggingProgressListener());
    }

    public ChunkScheduler(ExecutionConfig config, ProgressListener progress) {
        this.config = requireNonNull(config, "config");
        this.progress = requireNonNull(progress, "progress");
    }

    /**
     * Splits {@code [0, nframes)} into ordered, contiguous chunks of at most {@code maxFrames} frames; the last chunk
     * may be shorter.
     *
     * @param nframes the number of frames
     * @param maxFrames the maximum chunk length, empty for a single chunk
     * @return the chunks, empty if {@code nframes == 0}
     */
    public static List<FrameRange> partition(int nframes, OptionalInt maxFrames) {
        if (nframes < 0) {
            throw new IllegalArgumentException("nframes can't be negative: " + nframes);
        }
        requireNonNull(maxFrames, "maxFrames");
        if (maxFrames.isPresent() && maxFrames.getAsInt() <= 0) {
            throw new PipelineConfigurationException("Invalid memory budget: " + maxFrames.getAsInt());
        }
        final int step = maxFrames.orElse(Math.max(1, nframes));
        List<FrameRange> chunks = new ArrayList<>();
        for (int start = 0; start < nframes; start += step) {
            chunks.add(FrameRange.of(start, Math.min(nframes, start + step)));
        }
        return chunks;
    }

    /**
     * Applies {@code transform} to every frame of the input.
     *
     * @param transform the per-frame transform
     * @param in the input, 2-D (a single frame) or 3-D (a stack of frames)
     * @param out the output, or {@code null} to discard the results
     * @param label a label for progress reporting
     * @throws io.tileverse.pipeline.TagNotFoundException if the input does not exist
     * @throws PipelineConfigurationException if the input is neither 2-D nor 3-D
     * @throws ShapeConflictException if results can't be written to the output
     * @throws TransformException if the transform fails
     * @throws IOException If an I/O error occurs
     */
    public void apply(FrameFunction transform, InputPort in, OutputPort out, String label) throws IOException {
        requireNonNull(transform, "transform");
        requireNonNull(in, "in");
        requireNonNull(label, "label");

        final int[] shape = in.getShape();
        final int ndim = shape.length;
        if (ndim != 2 && ndim != 3) {
            throw new PipelineConfigurationException("Expected a 2-D or 3-D array under '" + in.getTag()
                    + "', got shape " + Arrays.toString(shape));
        }
        final int nframes = ndim == 2 ? 1 : shape[0];
        final boolean inPlace = out != null && out.getTag().equals(in.getTag());
        if (out != null && !inPlace) {
            out.deleteAll();
        }

        final List<FrameRange> chunks = partition(nframes, config.memoryFrames());
        log.debug("{}: {} frames of '{}' in {} chunks", label, nframes, in.getTag(), chunks.size());

        for (int c = 0; c < chunks.size(); c++) {
            final FrameRange chunk = chunks.get(c);
            List<NdArray> results = transformChunk(transform, in, ndim, chunk);
            if (out != null) {
                write(out, results, chunk, chunks.size(), shape, inPlace);
            }
            progress.report(c + 1, chunks.size(), label);
        }
        progress.done(label);
    }

    private List<NdArray> transformChunk(FrameFunction transform, InputPort in, int ndim, FrameRange chunk)
            throws IOException {
        List<NdArray> results = new ArrayList<>(chunk.length());
        if (ndim == 2) {
            results.add(invoke(transform, in.read(), 0));
        } else {
            NdArray images = in.readSlice(chunk);
            for (int k = 0; k < chunk.length(); k++) {
                results.add(invoke(transform, images.frame(k), chunk.start() + k));
            }
        }
        return results;
    }

    private static NdArray invoke(FrameFunction transform, NdArray frame, int frameIndex) {
        NdArray result;
        try {
            result = transform.apply(frame);
        } catch (Exception e) {
            throw TransformException.atFrame(frameIndex, e);
        }
        if (result == null) {
            throw TransformException.atFrame(frameIndex, new NullPointerException("transform returned null"));
        }
        return result;
    }

    private void write(
            OutputPort out, List<NdArray> results, FrameRange chunk, int nchunks, int[] inputShape, boolean inPlace)
            throws IOException {
        final NdArray stacked = stack(results, chunk);
        if (!inPlace) {
            out.append(stacked);
        } else if (nchunks == 1) {
            // a single 2-D frame is written back with its own rank
            NdArray content = inputShape.length == 2 ? results.get(0) : stacked;
            out.writeAll(content, AttributePolicy.KEEP);
        } else {
            int[] expected = chunk.toRegion(inputShape).size();
            if (!Arrays.equals(expected, stacked.shape())) {
                throw new ShapeConflictException("Input and output port have the same tag '" + out.getTag()
                        + "' while the transform changes the frame shape from "
                        + Arrays.toString(Arrays.copyOfRange(inputShape, 1, inputShape.length)) + " to "
                        + Arrays.toString(results.get(0).shape())
                        + ". Use a different output tag or an unbounded memory budget.");
            }
            out.writeSlice(chunk, stacked);
        }
    }

    private static NdArray stack(List<NdArray> results, FrameRange chunk) {
        try {
            return NdArray.stack(results);
        } catch (IllegalArgumentException e) {
            throw new ShapeConflictException(
                    "Transform results of chunk " + chunk + " have different shapes: " + e.getMessage());
        }
    }
}
