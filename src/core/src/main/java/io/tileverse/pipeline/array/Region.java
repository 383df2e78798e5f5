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
import java.util.Arrays;

/**
 * A box inside an N-dimensional array, defined per axis by an offset and a size.
 * <p>
 * Regions are value objects: two regions with the same offsets and sizes are equal, which makes them usable as
 * cache keys.
 *
 * @param offset the first index covered on each axis
 * @param size the number of indices covered on each axis
 */
public record Region(int[] offset, int[] size) implements Serializable {

    /**
     * Compact constructor validating and defensively copying the per-axis arrays.
     *
     * @param offset the first index covered on each axis, all non-negative
     * @param size the number of indices covered on each axis, all non-negative
     */
    public Region {
        if (offset == null || size == null) {
            throw new IllegalArgumentException("offset and size can't be null");
        }
        if (offset.length != size.length) {
            throw new IllegalArgumentException(
                    "offset and size rank differ: " + offset.length + " != " + size.length);
        }
        for (int i = 0; i < offset.length; i++) {
            if (offset[i] < 0) {
                throw new IllegalArgumentException("offset can't be < 0 on axis " + i + ": " + offset[i]);
            }
            if (size[i] < 0) {
                throw new IllegalArgumentException("size can't be < 0 on axis " + i + ": " + size[i]);
            }
        }
        offset = offset.clone();
        size = size.clone();
    }

    @Override
    public int[] offset() {
        return offset.clone();
    }

    @Override
    public int[] size() {
        return size.clone();
    }

    public int ndim() {
        return offset.length;
    }

    /**
     * @return the number of elements covered by this region
     */
    public long volume() {
        long volume = 1;
        for (int s : size) {
            volume *= s;
        }
        return volume;
    }

    /**
     * @param shape an array shape
     * @return whether this region has the same rank as {@code shape} and lies entirely inside it
     */
    public boolean fitsIn(int[] shape) {
        if (shape.length != offset.length) {
            return false;
        }
        for (int i = 0; i < shape.length; i++) {
            if ((long) offset[i] + size[i] > shape[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Creates a region covering the whole of an array.
     *
     * @param shape the array shape
     * @return a region with zero offsets and {@code shape} as size
     */
    public static Region whole(int[] shape) {
        return new Region(new int[shape.length], shape);
    }

    /**
     * Creates a region selecting the full time series at spatial position {@code (y, x)} of a 3-D array.
     *
     * @param nframes the length of the first axis
     * @param y the index on the second axis
     * @param x the index on the third axis
     * @return the {@code (nframes, 1, 1)} column region
     */
    public static Region line(int nframes, int y, int x) {
        return new Region(new int[] {0, y, x}, new int[] {nframes, 1, 1});
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Region r && Arrays.equals(offset, r.offset) && Arrays.equals(size, r.size);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(offset) + Arrays.hashCode(size);
    }

    @Override
    public String toString() {
        return "Region[offset=" + Arrays.toString(offset) + ", size=" + Arrays.toString(size) + "]";
    }
}
