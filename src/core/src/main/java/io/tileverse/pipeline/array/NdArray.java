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

import static java.util.Objects.requireNonNull;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

/**
 * A dense, row-major, N-dimensional array of {@code double} values.
 * <p>
 * This is the in-memory representation of frames, frame stacks and time series exchanged between
 * {@link io.tileverse.pipeline.store.ArrayStore stores}, {@link io.tileverse.pipeline.port.Port ports} and transform
 * functions. Instances are mutable through {@link #set(double, int...)} and {@link #setRegion(Region, NdArray)};
 * every method returning a sub-array returns a copy, never a view.
 */
public final class NdArray implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int[] shape;
    private final double[] data;

    private NdArray(int[] shape, double[] data) {
        this.shape = shape;
        this.data = data;
    }

    /**
     * Creates an array holding a copy of {@code data} with the given shape.
     *
     * @param data the row-major values
     * @param shape the array shape, at least one axis
     * @return a new array
     * @throws IllegalArgumentException if the number of values does not match the shape
     */
    public static NdArray of(double[] data, int... shape) {
        return wrap(requireNonNull(data, "data").clone(), shape);
    }

    /**
     * Creates an array backed by {@code data} without copying it. The caller must not modify {@code data}
     * afterwards.
     *
     * @param data the row-major values
     * @param shape the array shape, at least one axis
     * @return a new array sharing {@code data}
     * @throws IllegalArgumentException if the number of values does not match the shape
     */
    public static NdArray wrap(double[] data, int... shape) {
        requireNonNull(data, "data");
        int[] s = validShape(shape);
        if (volume(s) != data.length) {
            throw new IllegalArgumentException(
                    "Shape " + Arrays.toString(s) + " requires " + volume(s) + " values, got " + data.length);
        }
        return new NdArray(s, data);
    }

    public static NdArray zeros(int... shape) {
        return filled(0d, shape);
    }

    public static NdArray filled(double value, int... shape) {
        int[] s = validShape(shape);
        double[] values = new double[Math.toIntExact(volume(s))];
        if (value != 0d) {
            Arrays.fill(values, value);
        }
        return new NdArray(s, values);
    }

    /**
     * Creates an array holding {@code 0, 1, 2, ...} in row-major order.
     *
     * @param shape the array shape
     * @return a new array
     */
    public static NdArray arange(int... shape) {
        NdArray array = zeros(shape);
        for (int i = 0; i < array.data.length; i++) {
            array.data[i] = i;
        }
        return array;
    }

    /**
     * Stacks equally shaped arrays along a new leading axis.
     *
     * @param arrays the arrays to stack, at least one
     * @return an array of shape {@code (arrays.size(), ...arrays[0].shape)}
     * @throws IllegalArgumentException if the list is empty or the shapes differ
     */
    public static NdArray stack(List<NdArray> arrays) {
        if (arrays.isEmpty()) {
            throw new IllegalArgumentException("Nothing to stack");
        }
        int[] frameShape = arrays.get(0).shape;
        int frameSize = arrays.get(0).data.length;
        double[] values = new double[Math.multiplyExact(frameSize, arrays.size())];
        for (int i = 0; i < arrays.size(); i++) {
            NdArray a = arrays.get(i);
            if (!Arrays.equals(frameShape, a.shape)) {
                throw new IllegalArgumentException("Cannot stack arrays of shape " + Arrays.toString(frameShape)
                        + " and " + Arrays.toString(a.shape));
            }
            System.arraycopy(a.data, 0, values, i * frameSize, frameSize);
        }
        int[] shape = new int[frameShape.length + 1];
        shape[0] = arrays.size();
        System.arraycopy(frameShape, 0, shape, 1, frameShape.length);
        return new NdArray(shape, values);
    }

    /**
     * Concatenates two arrays along their first axis.
     *
     * @param head the leading array
     * @param tail the trailing array, with the same rank and trailing axes as {@code head}
     * @return a new array
     * @throws IllegalArgumentException if the trailing axes differ
     */
    public static NdArray concat(NdArray head, NdArray tail) {
        if (!sameTrailingShape(head.shape, tail.shape)) {
            throw new IllegalArgumentException("Cannot concatenate " + Arrays.toString(head.shape) + " and "
                    + Arrays.toString(tail.shape));
        }
        double[] values = Arrays.copyOf(head.data, head.data.length + tail.data.length);
        System.arraycopy(tail.data, 0, values, head.data.length, tail.data.length);
        int[] shape = head.shape.clone();
        shape[0] += tail.shape[0];
        return new NdArray(shape, values);
    }

    /**
     * @param a a shape
     * @param b another shape
     * @return whether both shapes have the same rank and agree on every axis but the first
     */
    public static boolean sameTrailingShape(int[] a, int[] b) {
        if (a.length != b.length) {
            return false;
        }
        for (int i = 1; i < a.length; i++) {
            if (a[i] != b[i]) {
                return false;
            }
        }
        return true;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int ndim() {
        return shape.length;
    }

    public int dim(int axis) {
        return shape[axis];
    }

    /**
     * @return the total number of elements
     */
    public int size() {
        return data.length;
    }

    public double get(int... index) {
        return data[flatIndex(index)];
    }

    public void set(double value, int... index) {
        data[flatIndex(index)] = value;
    }

    /**
     * @param flatIndex a row-major element index
     * @return the element at that position
     */
    public double getFlat(int flatIndex) {
        return data[flatIndex];
    }

    /**
     * @return a copy of the row-major values
     */
    public double[] toArray() {
        return data.clone();
    }

    /**
     * Returns frame {@code i} along the first axis.
     *
     * @param i the frame index
     * @return a copy of the sub-array at index {@code i}, with one axis less than this array
     */
    public NdArray frame(int i) {
        if (shape.length < 2) {
            throw new IllegalStateException("A " + shape.length + "-D array has no frames");
        }
        if (i < 0 || i >= shape[0]) {
            throw new IndexOutOfBoundsException("frame " + i + " out of [0, " + shape[0] + ")");
        }
        int frameSize = data.length / Math.max(1, shape[0]);
        double[] values = Arrays.copyOfRange(data, i * frameSize, (i + 1) * frameSize);
        return new NdArray(Arrays.copyOfRange(shape, 1, shape.length), values);
    }

    /**
     * @param range a range over the first axis
     * @return a copy of the frames in {@code range}
     */
    public NdArray frames(FrameRange range) {
        return region(range.toRegion(shape));
    }

    /**
     * Extracts a copy of the values inside {@code region}.
     *
     * @param region a region fitting in this array's shape
     * @return a new array of shape {@code region.size()}
     */
    public NdArray region(Region region) {
        checkFits(region);
        int[] size = region.size();
        NdArray result = new NdArray(size, new double[Math.toIntExact(region.volume())]);
        copy(data, shape, region.offset(), result.data, size, new int[size.length], size);
        return result;
    }

    /**
     * Overwrites the values inside {@code region} with {@code values}.
     *
     * @param region a region fitting in this array's shape
     * @param values an array whose shape equals the region size
     */
    public void setRegion(Region region, NdArray values) {
        checkFits(region);
        int[] size = region.size();
        if (!Arrays.equals(size, values.shape)) {
            throw new IllegalArgumentException(
                    "Values of shape " + Arrays.toString(values.shape) + " do not match " + region);
        }
        copy(values.data, size, new int[size.length], data, shape, region.offset(), size);
    }

    public NdArray reshape(int... newShape) {
        int[] s = validShape(newShape);
        if (volume(s) != data.length) {
            throw new IllegalArgumentException(
                    "Cannot reshape " + Arrays.toString(shape) + " into " + Arrays.toString(s));
        }
        return new NdArray(s, data.clone());
    }

    public NdArray copy() {
        return new NdArray(shape.clone(), data.clone());
    }

    /**
     * Copies a box of {@code size} from {@code src} at {@code srcOffset} into {@code dst} at {@code dstOffset},
     * one contiguous run of the last axis at a time.
     */
    private static void copy(
            double[] src, int[] srcShape, int[] srcOffset, double[] dst, int[] dstShape, int[] dstOffset, int[] size) {
        final int rank = size.length;
        final int run = size[rank - 1];
        if (run == 0) {
            return;
        }
        for (int s : size) {
            if (s == 0) {
                return;
            }
        }
        final int[] srcStrides = strides(srcShape);
        final int[] dstStrides = strides(dstShape);
        final int[] cursor = new int[rank];
        while (true) {
            int srcPos = 0;
            int dstPos = 0;
            for (int axis = 0; axis < rank; axis++) {
                srcPos += (srcOffset[axis] + cursor[axis]) * srcStrides[axis];
                dstPos += (dstOffset[axis] + cursor[axis]) * dstStrides[axis];
            }
            System.arraycopy(src, srcPos, dst, dstPos, run);
            int axis = rank - 2;
            while (axis >= 0) {
                if (++cursor[axis] < size[axis]) {
                    break;
                }
                cursor[axis] = 0;
                axis--;
            }
            if (axis < 0) {
                return;
            }
        }
    }

    /**
     * @param shape an array shape
     * @return the row-major element strides of each axis
     */
    public static int[] strides(int[] shape) {
        int[] strides = new int[shape.length];
        int stride = 1;
        for (int axis = shape.length - 1; axis >= 0; axis--) {
            strides[axis] = stride;
            stride *= shape[axis];
        }
        return strides;
    }

    private int flatIndex(int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException(
                    "Expected " + shape.length + " indices, got " + index.length);
        }
        int flat = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException(
                        "Index " + Arrays.toString(index) + " out of shape " + Arrays.toString(shape));
            }
            flat = flat * shape[axis] + index[axis];
        }
        return flat;
    }

    private void checkFits(Region region) {
        if (!region.fitsIn(shape)) {
            throw new IndexOutOfBoundsException(region + " does not fit in shape " + Arrays.toString(shape));
        }
    }

    private static int[] validShape(int[] shape) {
        if (shape == null || shape.length == 0) {
            throw new IllegalArgumentException("shape must have at least one axis");
        }
        for (int s : shape) {
            if (s < 0) {
                throw new IllegalArgumentException("Negative axis length in " + Arrays.toString(shape));
            }
        }
        return shape.clone();
    }

    private static long volume(int[] shape) {
        long volume = 1;
        for (int s : shape) {
            volume *= s;
        }
        return volume;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NdArray a && Arrays.equals(shape, a.shape) && Arrays.equals(data, a.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "NdArray" + Arrays.toString(shape);
    }
}
