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
import io.tileverse.pipeline.PipelineException;
import io.tileverse.pipeline.ShapeConflictException;
import io.tileverse.pipeline.TransformException;
import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.array.Region;
import io.tileverse.pipeline.port.InputPort;
import io.tileverse.pipeline.port.OutputPort;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Arrays;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies a {@link LineFunction} to the time series at every spatial position of a 3-D array, on a fixed pool of
 * {@link ExecutionConfig#workerCount() workerCount} threads.
 * <p>
 * The transform is first probed on the calling thread with the series at {@code (0, 0)} to learn the output length
 * {@code L}. If the output has the input's tag, {@code L} must equal the number of frames, otherwise a
 * {@link ShapeConflictException} is raised before any task is dispatched. A differently tagged output is cleared and
 * pre-allocated with zeros of shape {@code (L, sizeY, sizeX)}; an in-place output is overwritten column by column.
 * <p>
 * The calling thread reads the input one row at a time, dispatches one task per position with at most
 * {@code 4 * workerCount} tasks in flight, and writes every result into its own column as it completes. It is the
 * only thread touching the store. The result is therefore independent of the worker count and of the completion
 * order.
 * <p>
 * While the run is in progress the output carries the attribute {@value #INCOMPLETE_ATTRIBUTE}{@code = true}. The
 * attribute is removed when every position has been written; after a failure it stays, marking the partially written
 * output as invalid.
 */
@Slf4j
public class LineProcessingCapsule {

    /** Attribute marking an output whose line-parallel run did not complete. */
    public static final String INCOMPLETE_ATTRIBUTE = "INCOMPLETE";

    private static final int TASKS_PER_WORKER = 4;

    private final ExecutionConfig config;
    private final ProgressListener progress;

    public LineProcessingCapsule(ExecutionConfig config) {
        this(config, new LoggingProgressListener());
    }

    public LineProcessingCapsule(ExecutionConfig config, ProgressListener progress) {
        this.config = requireNonNull(config, "config");
        this.progress = requireNonNull(progress, "progress");
    }

    public void run(LineFunction transform, InputPort in, OutputPort out) throws IOException {
        run(transform, in, out, "Applying function in time to '" + in.getTag() + "'");
    }

    /**
     * Applies {@code transform} to every time series of {@code in}, blocking until all positions are written.
     *
     * @param transform the per-position transform, invoked concurrently
     * @param in a 3-D input, axis 0 being time
     * @param out the output
     * @param label a label for progress reporting
     * @throws PipelineConfigurationException if the input is not 3-D or has no spatial positions
     * @throws ShapeConflictException if an in-place run changes the series length, or results differ in length
     * @throws TransformException on the first transform failure, carrying its position
     * @throws IOException If an I/O error occurs
     */
    public void run(LineFunction transform, InputPort in, OutputPort out, String label) throws IOException {
        requireNonNull(transform, "transform");
        requireNonNull(in, "in");
        requireNonNull(out, "out");
        requireNonNull(label, "label");

        final int[] shape = in.getShape();
        if (shape.length != 3) {
            throw new PipelineConfigurationException("Line-parallel processing requires a 3-D array under '"
                    + in.getTag() + "', got shape " + Arrays.toString(shape));
        }
        final int nframes = shape[0];
        final int sizeY = shape[1];
        final int sizeX = shape[2];
        if (sizeY == 0 || sizeX == 0) {
            throw new PipelineConfigurationException(
                    "'" + in.getTag() + "' has no spatial positions: " + Arrays.toString(shape));
        }

        final boolean inPlace = out.getTag().equals(in.getTag());
        final double[] probe = invoke(transform, in.readRegion(Region.line(nframes, 0, 0)).toArray(), 0, 0);
        final int length = probe.length;
        if (inPlace && length != nframes) {
            throw new ShapeConflictException("Input and output port have the same tag '" + out.getTag()
                    + "' while the transform changes the signal length from " + nframes + " to " + length
                    + ". Use a different output tag instead.");
        }
        if (!inPlace) {
            out.deleteAll();
            out.writeAll(NdArray.zeros(length, sizeY, sizeX));
        }
        out.writeAttribute(INCOMPLETE_ATTRIBUTE, Boolean.TRUE);

        final int workers = config.workerCount();
        log.debug("{}: {} positions of length {} on {} workers", label, sizeY * sizeX, nframes, workers);
        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            dispatch(transform, in, out, new ExecutorCompletionService<>(pool), nframes, length, sizeY, sizeX, label);
        } finally {
            pool.shutdownNow();
        }
        out.deleteAttribute(INCOMPLETE_ATTRIBUTE);
        progress.done(label);
    }

    private void dispatch(
            LineFunction transform,
            InputPort in,
            OutputPort out,
            CompletionService<LineResult> completion,
            int nframes,
            int length,
            int sizeY,
            int sizeX,
            String label)
            throws IOException {

        final int maxInFlight = TASKS_PER_WORKER * config.workerCount();
        final int total = sizeY * sizeX;
        int inFlight = 0;
        int completed = 0;
        for (int y = 0; y < sizeY; y++) {
            final double[] row = in.readRegion(new Region(new int[] {0, y, 0}, new int[] {nframes, 1, sizeX}))
                    .toArray();
            for (int x = 0; x < sizeX; x++) {
                if (inFlight == maxInFlight) {
                    collect(completion, out, length);
                    inFlight--;
                    report(++completed, sizeX, sizeY, label);
                }
                final double[] signal = column(row, nframes, sizeX, x);
                final int py = y;
                final int px = x;
                completion.submit(() -> new LineResult(py, px, invoke(transform, signal, py, px)));
                inFlight++;
            }
        }
        while (inFlight > 0) {
            collect(completion, out, length);
            inFlight--;
            report(++completed, sizeX, sizeY, label);
        }
        log.debug("{}: {} of {} positions written", label, completed, total);
    }

    private void report(int completed, int sizeX, int sizeY, String label) {
        if (completed % sizeX == 0) {
            progress.report(completed / sizeX, sizeY, label);
        }
    }

    private static void collect(CompletionService<LineResult> completion, OutputPort out, int length)
            throws IOException {
        LineResult result;
        try {
            Future<LineResult> future = completion.take();
            result = future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ioe = new InterruptedIOException("Line-parallel run was interrupted");
            ioe.initCause(e);
            throw ioe;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException pe) {
                throw pe;
            }
            throw new PipelineException("Line-parallel task failed", cause);
        }
        if (result.values().length != length) {
            throw new ShapeConflictException("Transform returned a signal of length " + result.values().length
                    + " at (" + result.y() + ", " + result.x() + "), expected " + length);
        }
        out.writeRegion(Region.line(length, result.y(), result.x()), NdArray.wrap(result.values(), length, 1, 1));
    }

    private static double[] column(double[] row, int nframes, int sizeX, int x) {
        double[] signal = new double[nframes];
        for (int t = 0; t < nframes; t++) {
            signal[t] = row[t * sizeX + x];
        }
        return signal;
    }

    private static double[] invoke(LineFunction transform, double[] signal, int y, int x) {
        double[] result;
        try {
            result = transform.apply(signal);
        } catch (Exception e) {
            throw TransformException.atPosition(y, x, e);
        }
        if (result == null) {
            throw TransformException.atPosition(y, x, new NullPointerException("transform returned null"));
        }
        return result;
    }

    private record LineResult(int y, int x, double[] values) {}

    private static class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();
        private final int pool = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger thread = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "line-capsule-" + pool + "-worker-" + thread.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
