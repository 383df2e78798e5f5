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
package io.tileverse.pipeline.port;

import io.tileverse.pipeline.array.FrameRange;
import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.array.Region;
import java.io.IOException;
import java.util.Arrays;

/**
 * Read-only {@link Port}.
 * <p>
 * All reads throw {@link io.tileverse.pipeline.TagNotFoundException} if no array is stored under the tag, and
 * {@link io.tileverse.pipeline.UnboundPortException} if the port is not bound.
 */
public class InputPort extends Port {

    public InputPort(String tag) {
        super(tag);
    }

    /**
     * @return the whole array
     * @throws IOException If an I/O error occurs
     */
    public NdArray read() throws IOException {
        return store().get(getTag());
    }

    /**
     * @param range a range over the first axis
     * @return the frames in {@code range}
     * @throws IOException If an I/O error occurs
     */
    public NdArray readSlice(FrameRange range) throws IOException {
        return store().getSlice(getTag(), range);
    }

    public NdArray readRegion(Region region) throws IOException {
        return store().getSlice(getTag(), region);
    }

    /**
     * Reads one frame. A 2-D array is a single frame, read whole at index 0.
     *
     * @param index the frame index
     * @return the frame, with one axis less than a stack of frames
     * @throws IOException If an I/O error occurs
     */
    public NdArray readFrame(int index) throws IOException {
        final int[] shape = getShape();
        if (shape.length == 2) {
            if (index != 0) {
                throw new IndexOutOfBoundsException("frame " + index + " out of [0, 1) for a single frame");
            }
            return read();
        }
        NdArray frame = readSlice(FrameRange.of(index, index + 1));
        return frame.reshape(Arrays.copyOfRange(shape, 1, shape.length));
    }
}
