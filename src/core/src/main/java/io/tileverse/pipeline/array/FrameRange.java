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
package io.tileverse.pipeline.array;

import java.io.Serializable;

/**
 * Half-open range of frame indices {@code [start, end)} over the first axis of an array.
 *
 * @param start the first frame index, inclusive
 * @param end the last frame index, exclusive
 */
public record FrameRange(
        /** The first frame index, inclusive */
        int start,
        /** The last frame index, exclusive */
        int end)
        implements Serializable, Comparable<FrameRange> {

    /**
     * Compact constructor that validates the range bounds.
     *
     * @param start the first frame index (must be non-negative)
     * @param end the end frame index (must be {@code >= start})
     */
    public FrameRange {
        if (start < 0) {
            throw new IllegalArgumentException("start can't be < 0: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("end can't be < start: [" + start + ", " + end + ")");
        }
    }

    /**
     * @return the number of frames covered by this range
     */
    public int length() {
        return end - start;
    }

    /**
     * Converts this frame range into a {@link Region} covering every other axis of an array of the given shape.
     *
     * @param shape the shape of the array the range applies to
     * @return the region selecting frames {@code [start, end)} and the full extent of the remaining axes
     */
    public Region toRegion(int[] shape) {
        if (shape.length == 0) {
            throw new IllegalArgumentException("Frame ranges do not apply to zero-dimensional arrays");
        }
        int[] offset = new int[shape.length];
        int[] size = shape.clone();
        offset[0] = start;
        size[0] = length();
        return new Region(offset, size);
    }

    @Override
    public int compareTo(FrameRange o) {
        return Integer.compare(start, o.start());
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }

    /**
     * Factory method to create a new {@link FrameRange}.
     *
     * @param start the first frame index, inclusive
     * @param end the last frame index, exclusive
     * @return a new {@link FrameRange}
     */
    public static FrameRange of(int start, int end) {
        return new FrameRange(start, end);
    }
}
