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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.tileverse.pipeline.PipelineConfigurationException;
import io.tileverse.pipeline.ShapeConflictException;
import io.tileverse.pipeline.TransformException;
import io.tileverse.pipeline.array.FrameRange;
import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.port.InputPort;
import io.tileverse.pipeline.port.OutputPort;
import io.tileverse.pipeline.store.ArrayStore;
import io.tileverse.pipeline.store.memory.MemoryArrayStore;
import java.io.IOException;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for {@link ChunkScheduler}.
 */
@ExtendWith(MockitoExtension.class)
class ChunkSchedulerTest {

    @Mock
    private ProgressListener progress;

    private ArrayStore store;

    @BeforeEach
    void setUp() throws IOException {
        store = new MemoryArrayStore("chunks");
        store.open();
    }

    @AfterEach
    void tearDown() throws IOException {
        store.close();
    }

    private InputPort input(String tag) {
        InputPort port = new InputPort(tag);
        port.bind(store);
        return port;
    }

    private OutputPort output(String tag) {
        OutputPort port = new OutputPort(tag);
        port.bind(store);
        return port;
    }

    private ChunkScheduler scheduler(int memoryFrames) {
        return new ChunkScheduler(ExecutionConfig.of(memoryFrames, 1), progress);
    }

    /** A stack where frame {@code i} is filled with {@code i}. */
    private static NdArray indexedFrames(int nframes, int ny, int nx) {
        double[] values = new double[nframes * ny * nx];
        for (int i = 0; i < values.length; i++) {
            values[i] = i / (ny * nx);
        }
        return NdArray.wrap(values, nframes, ny, nx);
    }

    private static NdArray scale(NdArray frame, double factor) {
        double[] values = frame.toArray();
        for (int i = 0; i < values.length; i++) {
            values[i] *= factor;
        }
        return NdArray.wrap(values, frame.shape());
    }

    @Test
    void testPartition() {
        assertThat(ChunkScheduler.partition(5, OptionalInt.of(2)))
                .containsExactly(FrameRange.of(0, 2), FrameRange.of(2, 4), FrameRange.of(4, 5));
        assertThat(ChunkScheduler.partition(4, OptionalInt.of(4))).containsExactly(FrameRange.of(0, 4));
        assertThat(ChunkScheduler.partition(3, OptionalInt.of(10))).containsExactly(FrameRange.of(0, 3));
        assertThat(ChunkScheduler.partition(7, OptionalInt.empty())).containsExactly(FrameRange.of(0, 7));
        assertThat(ChunkScheduler.partition(0, OptionalInt.of(3))).isEmpty();

        assertThrows(IllegalArgumentException.class, () -> ChunkScheduler.partition(-1, OptionalInt.empty()));
        assertThrows(PipelineConfigurationException.class, () -> ChunkScheduler.partition(3, OptionalInt.of(0)));
    }

    @Test
    void testChunkedAppendToNewTag() throws IOException {
        store.replace("images", indexedFrames(6, 2, 2));

        scheduler(2).apply(frame -> scale(frame, 10), input("images"), output("scaled"), "Scaling");

        NdArray result = store.get("scaled");
        assertThat(result.shape()).containsExactly(6, 2, 2);
        assertEquals(NdArray.filled(10, 2, 2), result.frame(1));
        assertEquals(NdArray.filled(20, 2, 2), result.frame(2));
        assertEquals(NdArray.filled(30, 2, 2), result.frame(3));
        assertEquals(NdArray.filled(40, 2, 2), result.frame(4));

        InOrder order = inOrder(progress);
        order.verify(progress).report(1, 3, "Scaling");
        order.verify(progress).report(2, 3, "Scaling");
        order.verify(progress).report(3, 3, "Scaling");
        order.verify(progress).done("Scaling");
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 7, 100})
    void testResultDoesNotDependOnMemoryBudget(int memoryFrames) throws IOException {
        NdArray images = NdArray.arange(7, 2, 3);
        store.replace("images", images);
        store.replace("inplace", images);
        FrameFunction transform = frame -> scale(frame, -0.5);

        new ChunkScheduler(ExecutionConfig.unbounded(1), progress)
                .apply(transform, input("images"), output("reference"), "reference");
        scheduler(memoryFrames).apply(transform, input("images"), output("chunked"), "chunked");
        scheduler(memoryFrames).apply(transform, input("inplace"), output("inplace"), "in place");

        NdArray reference = store.get("reference");
        assertEquals(reference, store.get("chunked"));
        assertEquals(reference, store.get("inplace"));
        assertEquals(scale(images, -0.5), reference);
    }

    @Test
    void testOutputIsClearedBeforeAppending() throws IOException {
        store.replace("images", indexedFrames(3, 2, 2));
        store.replace("scaled", NdArray.zeros(10, 2, 2));
        store.setAttribute("scaled", "STALE", true);

        scheduler(2).apply(FrameFunction.identity(), input("images"), output("scaled"), "Copy");

        assertEquals(store.get("images"), store.get("scaled"));
        assertThat(store.getAttributes("scaled")).isEmpty();
    }

    @Test
    void testInPlaceSingleChunkKeepsAttributes() throws IOException {
        store.replace("images", indexedFrames(3, 2, 2));
        store.setAttribute("images", "PIXSCALE", 0.027d);

        // the frame shape may change when all frames fit in one chunk
        FrameFunction crop = frame -> NdArray.of(new double[] {frame.get(0, 0)}, 1);
        scheduler(3).apply(crop, input("images"), output("images"), "Cropping");

        NdArray result = store.get("images");
        assertThat(result.shape()).containsExactly(3, 1);
        assertThat(result.toArray()).containsExactly(0, 1, 2);
        assertThat(store.getAttribute("images", "PIXSCALE")).contains(0.027d);
    }

    @Test
    void testInPlaceShapeChangeAcrossChunks() throws IOException {
        store.replace("images", indexedFrames(4, 2, 2));
        FrameFunction crop = frame -> NdArray.zeros(1, 1);

        InputPort in = input("images");
        OutputPort out = output("images");
        ShapeConflictException e =
                assertThrows(ShapeConflictException.class, () -> scheduler(2).apply(crop, in, out, "Cropping"));
        assertThat(e.getMessage()).contains("images");
        // nothing was written
        assertEquals(indexedFrames(4, 2, 2), store.get("images"));
        verify(progress, never()).done("Cropping");
    }

    @Test
    void testShapeChangeToNewTag() throws IOException {
        store.replace("images", indexedFrames(5, 4, 4));
        FrameFunction bin = frame -> NdArray.filled(frame.get(0, 0), 2, 2);

        scheduler(2).apply(bin, input("images"), output("binned"), "Binning");

        NdArray result = store.get("binned");
        assertThat(result.shape()).containsExactly(5, 2, 2);
        assertEquals(NdArray.filled(4, 2, 2), result.frame(4));
    }

    @Test
    void testInconsistentResultShapes() throws IOException {
        store.replace("images", indexedFrames(2, 2, 2));
        AtomicInteger calls = new AtomicInteger();
        FrameFunction ragged = frame -> NdArray.zeros(1 + calls.getAndIncrement());

        InputPort in = input("images");
        OutputPort out = output("ragged");
        assertThrows(ShapeConflictException.class, () -> scheduler(2).apply(ragged, in, out, "Ragged"));
    }

    @Test
    void testWithoutOutput() throws IOException {
        store.replace("images", indexedFrames(5, 2, 2));
        AtomicInteger calls = new AtomicInteger();

        scheduler(2).apply(
                frame -> {
                    calls.incrementAndGet();
                    return frame;
                },
                input("images"),
                null,
                "Statistics");

        assertEquals(5, calls.get());
        assertThat(store.tags()).containsExactly("images");
        verify(progress).done("Statistics");
    }

    @Test
    void testTransformFailureReportsFrameIndex() throws IOException {
        store.replace("images", indexedFrames(6, 2, 2));
        FrameFunction failing = frame -> {
            if (frame.get(0, 0) == 3) {
                throw new IllegalStateException("bad frame");
            }
            return frame;
        };

        InputPort in = input("images");
        OutputPort out = output("result");
        TransformException e =
                assertThrows(TransformException.class, () -> scheduler(2).apply(failing, in, out, "Failing"));
        assertEquals(OptionalInt.of(3), e.getFrameIndex());
        assertThat(e.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("bad frame");
        // chunks completed before the failure stay written
        assertThat(store.getShape("result")).containsExactly(2, 2, 2);
        verify(progress, never()).done("Failing");
    }

    @Test
    void testNullResult() throws IOException {
        store.replace("images", indexedFrames(2, 2, 2));
        InputPort in = input("images");
        assertThrows(TransformException.class, () -> scheduler(1).apply(frame -> null, in, null, "Null"));
    }

    @Test
    void testSingleImageInput() throws IOException {
        NdArray image = NdArray.arange(3, 3);
        store.replace("image", image);

        scheduler(1).apply(frame -> scale(frame, 2), input("image"), output("doubled"), "Doubling");
        assertThat(store.getShape("doubled")).containsExactly(1, 3, 3);
        assertEquals(scale(image, 2), store.get("doubled").frame(0));

        scheduler(1).apply(frame -> scale(frame, 2), input("image"), output("image"), "Doubling in place");
        assertEquals(scale(image, 2), store.get("image"));
    }

    @Test
    void testUnsupportedRank() throws IOException {
        store.replace("cube", NdArray.zeros(2, 2, 2, 2));
        store.replace("line", NdArray.zeros(4));
        ChunkScheduler scheduler = scheduler(1);
        assertThrows(
                PipelineConfigurationException.class,
                () -> scheduler.apply(FrameFunction.identity(), input("cube"), null, "4-D"));
        assertThrows(
                PipelineConfigurationException.class,
                () -> scheduler.apply(FrameFunction.identity(), input("line"), null, "1-D"));
    }

    @Test
    void testEmptyInput() throws IOException {
        store.replace("empty", NdArray.zeros(0, 2, 2));
        scheduler(2).apply(FrameFunction.identity(), input("empty"), output("copy"), "Empty");
        assertThat(store.exists("copy")).isFalse();
        verify(progress).done("Empty");
    }

    @Test
    void testPartitionListIsOrdered() {
        List<FrameRange> chunks = ChunkScheduler.partition(10, OptionalInt.of(3));
        assertThat(chunks).isSorted();
        assertEquals(10, chunks.stream().mapToInt(FrameRange::length).sum());
    }
}
