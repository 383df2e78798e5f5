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
package io.tileverse.pipeline.store;

import static java.util.Objects.requireNonNull;

import io.tileverse.pipeline.ShapeConflictException;
import io.tileverse.pipeline.TagNotFoundException;
import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.array.Region;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class providing the common contract checks of {@link ArrayStore}.
 * <p>
 * The public methods validate the lifecycle state, tags, regions, shapes and attribute values, then delegate to the
 * {@code *Internal} template methods. Concrete stores only implement the storage mechanics and may rely on the
 * guarantees listed on each template method.
 * <p>
 * <strong>Append semantics:</strong> appending to a missing tag creates it with the appended data as content;
 * appending a single frame (one axis less than the stored array) is treated as a stack of one frame.
 */
@Slf4j
public abstract class AbstractArrayStore implements ArrayStore {

    private final AtomicBoolean open = new AtomicBoolean();

    /**
     * Creates a new, closed store.
     */
    protected AbstractArrayStore() {
        // Default constructor for subclasses
    }

    @Override
    public final void open() throws IOException {
        if (open.compareAndSet(false, true)) {
            try {
                openInternal();
            } catch (IOException | RuntimeException e) {
                open.set(false);
                throw e;
            }
            log.debug("Opened array store {}", getStoreIdentifier());
        }
    }

    @Override
    public final boolean isOpen() {
        return open.get();
    }

    @Override
    public final void close() throws IOException {
        if (open.compareAndSet(true, false)) {
            closeInternal();
            log.debug("Closed array store {}", getStoreIdentifier());
        }
    }

    @Override
    public final boolean exists(String tag) throws IOException {
        checkOpen();
        return existsInternal(checkTag(tag));
    }

    @Override
    public final Set<String> tags() throws IOException {
        checkOpen();
        return Set.copyOf(tagsInternal());
    }

    @Override
    public final int[] getShape(String tag) throws IOException {
        checkOpen();
        checkTag(tag);
        if (!existsInternal(tag)) {
            throw new TagNotFoundException(tag, getStoreIdentifier());
        }
        return shapeInternal(tag).clone();
    }

    @Override
    public final NdArray getSlice(String tag, Region region) throws IOException {
        requireNonNull(region, "region");
        int[] shape = getShape(tag);
        if (!region.fitsIn(shape)) {
            throw new IndexOutOfBoundsException(
                    region + " does not fit in '" + tag + "' of shape " + Arrays.toString(shape));
        }
        return getSliceInternal(tag, region, shape);
    }

    @Override
    public final void setSlice(String tag, Region region, NdArray data) throws IOException {
        requireNonNull(region, "region");
        requireNonNull(data, "data");
        int[] shape = getShape(tag);
        if (!region.fitsIn(shape)) {
            throw new ShapeConflictException(
                    region + " does not fit in '" + tag + "' of shape " + Arrays.toString(shape));
        }
        if (!Arrays.equals(region.size(), data.shape())) {
            throw new ShapeConflictException("Cannot write data of shape " + Arrays.toString(data.shape())
                    + " into " + region + " of '" + tag + "'");
        }
        setSliceInternal(tag, region, shape, data);
    }

    @Override
    public final void append(String tag, NdArray data) throws IOException {
        checkOpen();
        checkTag(tag);
        requireNonNull(data, "data");
        if (!existsInternal(tag)) {
            replaceInternal(tag, data);
            return;
        }
        final int[] shape = shapeInternal(tag);
        final int[] dataShape = data.shape();
        NdArray tail;
        if (dataShape.length == shape.length && NdArray.sameTrailingShape(shape, dataShape)) {
            tail = data;
        } else if (dataShape.length == shape.length - 1
                && Arrays.equals(dataShape, Arrays.copyOfRange(shape, 1, shape.length))) {
            int[] stacked = new int[shape.length];
            stacked[0] = 1;
            System.arraycopy(dataShape, 0, stacked, 1, dataShape.length);
            tail = data.reshape(stacked);
        } else {
            throw new ShapeConflictException("Cannot append data of shape " + Arrays.toString(dataShape)
                    + " to '" + tag + "' of shape " + Arrays.toString(shape));
        }
        appendInternal(tag, shape, tail);
    }

    @Override
    public final void replace(String tag, NdArray data) throws IOException {
        checkOpen();
        checkTag(tag);
        replaceInternal(tag, requireNonNull(data, "data"));
    }

    @Override
    public final void deleteAll(String tag) throws IOException {
        checkOpen();
        deleteAllInternal(checkTag(tag));
    }

    @Override
    public final Optional<Object> getAttribute(String tag, String name) throws IOException {
        checkOpen();
        checkTag(tag);
        requireNonNull(name, "name");
        return Optional.ofNullable(getAttributesInternal(tag).get(name)).map(AbstractArrayStore::copyValue);
    }

    @Override
    public final Map<String, Object> getAttributes(String tag) throws IOException {
        checkOpen();
        checkTag(tag);
        Map<String, Object> attributes = new LinkedHashMap<>();
        getAttributesInternal(tag).forEach((k, v) -> attributes.put(k, copyValue(v)));
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public final void setAttribute(String tag, String name, Object value) throws IOException {
        checkOpen();
        checkTag(tag);
        requireNonNull(name, "name");
        setAttributeInternal(tag, name, copyValue(checkAttributeValue(value)));
    }

    @Override
    public final void deleteAttribute(String tag, String name) throws IOException {
        checkOpen();
        checkTag(tag);
        deleteAttributeInternal(tag, requireNonNull(name, "name"));
    }

    @Override
    public final void deleteAttributes(String tag) throws IOException {
        checkOpen();
        deleteAttributesInternal(checkTag(tag));
    }

    /**
     * Validates an attribute value.
     *
     * @param value the candidate value
     * @return {@code value}
     * @throws IllegalArgumentException if the value is null or of an unsupported type
     */
    public static Object checkAttributeValue(Object value) {
        if (value instanceof String
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Double
                || value instanceof Boolean
                || value instanceof double[]) {
            return value;
        }
        throw new IllegalArgumentException("Unsupported attribute value: "
                + (value == null ? "null" : value.getClass().getCanonicalName()));
    }

    private static Object copyValue(Object value) {
        return value instanceof double[] d ? d.clone() : value;
    }

    private void checkOpen() {
        if (!open.get()) {
            throw new IllegalStateException("Array store is not open: " + getStoreIdentifier());
        }
    }

    private static String checkTag(String tag) {
        requireNonNull(tag, "tag");
        if (tag.isBlank()) {
            throw new IllegalArgumentException("tag can't be blank");
        }
        return tag;
    }

    /**
     * Opens the underlying storage. Called once per transition from closed to open.
     *
     * @throws IOException If the storage cannot be opened
     */
    protected abstract void openInternal() throws IOException;

    /**
     * Releases the underlying storage. Called once per transition from open to closed.
     *
     * @throws IOException If an I/O error occurs
     */
    protected abstract void closeInternal() throws IOException;

    protected abstract boolean existsInternal(String tag) throws IOException;

    protected abstract Set<String> tagsInternal() throws IOException;

    /**
     * @param tag a tag for which {@link #existsInternal(String)} returned {@code true}
     * @return the stored shape
     * @throws IOException If an I/O error occurs
     */
    protected abstract int[] shapeInternal(String tag) throws IOException;

    /**
     * Reads a region already validated against {@code shape}.
     *
     * @param tag an existing tag
     * @param region a region fitting in {@code shape}
     * @param shape the stored shape
     * @return a new array of shape {@code region.size()}
     * @throws IOException If an I/O error occurs
     */
    protected abstract NdArray getSliceInternal(String tag, Region region, int[] shape) throws IOException;

    /**
     * Overwrites a region already validated against {@code shape}; {@code data} is shaped like the region.
     *
     * @param tag an existing tag
     * @param region a region fitting in {@code shape}
     * @param shape the stored shape
     * @param data the new values
     * @throws IOException If an I/O error occurs
     */
    protected abstract void setSliceInternal(String tag, Region region, int[] shape, NdArray data)
            throws IOException;

    /**
     * Appends frames to an existing array; {@code data} has the stored rank and trailing axes.
     *
     * @param tag an existing tag
     * @param shape the stored shape before appending
     * @param data the frames to append
     * @throws IOException If an I/O error occurs
     */
    protected abstract void appendInternal(String tag, int[] shape, NdArray data) throws IOException;

    protected abstract void replaceInternal(String tag, NdArray data) throws IOException;

    protected abstract void deleteAllInternal(String tag) throws IOException;

    /**
     * @param tag an entry tag
     * @return the attributes under {@code tag}, empty if none; callers do not modify the returned map
     * @throws IOException If an I/O error occurs
     */
    protected abstract Map<String, Object> getAttributesInternal(String tag) throws IOException;

    protected abstract void setAttributeInternal(String tag, String name, Object value) throws IOException;

    protected abstract void deleteAttributeInternal(String tag, String name) throws IOException;

    protected abstract void deleteAttributesInternal(String tag) throws IOException;
}
