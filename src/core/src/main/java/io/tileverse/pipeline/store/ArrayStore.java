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

import io.tileverse.pipeline.array.FrameRange;
import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.array.Region;
import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Connection to a persistent store of named N-dimensional arrays.
 * <p>
 * Each entry is identified by a unique tag and may hold array content, a map of attributes, or both. Attribute
 * values are restricted to {@link String}, {@link Integer}, {@link Long}, {@link Double}, {@link Boolean} and
 * {@code double[]}.
 * <p>
 * The connection has an explicit lifecycle: {@link #open()} must be called before any data access, and both
 * {@code open()} and {@link #close()} are idempotent. A closed store can be opened again.
 * <p>
 * Implementations MUST be thread-safe. The pipeline engine performs all writes of a run from a single thread, but
 * reads may be issued concurrently.
 */
public interface ArrayStore extends Closeable {

    /**
     * Opens the connection. Calling this method on an open store has no effect.
     *
     * @throws IOException If the underlying storage cannot be opened
     */
    void open() throws IOException;

    /**
     * @return whether the store is currently open
     */
    boolean isOpen();

    /**
     * Closes the connection, flushing pending state. Calling this method on a closed store has no effect.
     *
     * @throws IOException If an I/O error occurs
     */
    @Override
    void close() throws IOException;

    /**
     * @param tag an entry tag
     * @return whether array content is stored under {@code tag}
     * @throws IOException If an I/O error occurs
     */
    boolean exists(String tag) throws IOException;

    /**
     * @return the tags holding array content
     * @throws IOException If an I/O error occurs
     */
    Set<String> tags() throws IOException;

    /**
     * @param tag an entry tag
     * @return the shape of the array stored under {@code tag}
     * @throws io.tileverse.pipeline.TagNotFoundException if there is no array under {@code tag}
     * @throws IOException If an I/O error occurs
     */
    int[] getShape(String tag) throws IOException;

    /**
     * @param tag an entry tag
     * @return the number of dimensions of the array stored under {@code tag}
     * @throws io.tileverse.pipeline.TagNotFoundException if there is no array under {@code tag}
     * @throws IOException If an I/O error occurs
     */
    default int getNdim(String tag) throws IOException {
        return getShape(tag).length;
    }

    /**
     * Reads a region of the array stored under {@code tag}. Only the requested region is loaded.
     *
     * @param tag an entry tag
     * @param region the region to read, must fit in the stored shape
     * @return a new array of shape {@code region.size()}
     * @throws io.tileverse.pipeline.TagNotFoundException if there is no array under {@code tag}
     * @throws IndexOutOfBoundsException if the region does not fit in the stored array
     * @throws IOException If an I/O error occurs
     */
    NdArray getSlice(String tag, Region region) throws IOException;

    /**
     * Reads a range of frames of the array stored under {@code tag}.
     *
     * @param tag an entry tag
     * @param range the frames to read
     * @return a new array holding frames {@code [range.start(), range.end())}
     * @throws IOException If an I/O error occurs
     */
    default NdArray getSlice(String tag, FrameRange range) throws IOException {
        requireNonNull(range, "range");
        return getSlice(tag, range.toRegion(getShape(tag)));
    }

    /**
     * Reads the whole array stored under {@code tag}.
     *
     * @param tag an entry tag
     * @return a new array with the stored content
     * @throws IOException If an I/O error occurs
     */
    default NdArray get(String tag) throws IOException {
        return getSlice(tag, Region.whole(getShape(tag)));
    }

    /**
     * Overwrites a region of an existing array.
     *
     * @param tag an entry tag
     * @param region the region to overwrite, must fit in the stored shape
     * @param data the new values, shaped like {@code region.size()}
     * @throws io.tileverse.pipeline.TagNotFoundException if there is no array under {@code tag}
     * @throws io.tileverse.pipeline.ShapeConflictException if the region or the data do not fit
     * @throws IOException If an I/O error occurs
     */
    void setSlice(String tag, Region region, NdArray data) throws IOException;

    /**
     * Extends the array stored under {@code tag} along its first axis, creating it if it does not exist.
     * <p>
     * {@code data} must either have the stored rank and trailing axes, or be a single frame with one axis less.
     *
     * @param tag an entry tag
     * @param data the values to append
     * @throws io.tileverse.pipeline.ShapeConflictException if {@code data} does not match the stored layout
     * @throws IOException If an I/O error occurs
     */
    void append(String tag, NdArray data) throws IOException;

    /**
     * Replaces the whole array content under {@code tag}, leaving its attributes untouched.
     *
     * @param tag an entry tag
     * @param data the new content
     * @throws IOException If an I/O error occurs
     */
    void replace(String tag, NdArray data) throws IOException;

    /**
     * Removes the array content and all attributes under {@code tag}. Missing tags are ignored.
     *
     * @param tag an entry tag
     * @throws IOException If an I/O error occurs
     */
    void deleteAll(String tag) throws IOException;

    /**
     * @param tag an entry tag
     * @param name an attribute name
     * @return the attribute value, or empty if not set
     * @throws IOException If an I/O error occurs
     */
    Optional<Object> getAttribute(String tag, String name) throws IOException;

    /**
     * @param tag an entry tag
     * @return an immutable snapshot of all attributes under {@code tag}
     * @throws IOException If an I/O error occurs
     */
    Map<String, Object> getAttributes(String tag) throws IOException;

    /**
     * Sets an attribute, whether or not array content exists under {@code tag}.
     *
     * @param tag an entry tag
     * @param name an attribute name
     * @param value the value, of one of the supported attribute types
     * @throws IllegalArgumentException if the value type is not supported
     * @throws IOException If an I/O error occurs
     */
    void setAttribute(String tag, String name, Object value) throws IOException;

    /**
     * Removes one attribute. Missing attributes are ignored.
     *
     * @param tag an entry tag
     * @param name an attribute name
     * @throws IOException If an I/O error occurs
     */
    void deleteAttribute(String tag, String name) throws IOException;

    /**
     * Removes all attributes under {@code tag}, keeping the array content.
     *
     * @param tag an entry tag
     * @throws IOException If an I/O error occurs
     */
    void deleteAttributes(String tag) throws IOException;

    /**
     * Gets a unique identifier for this store, used in log and error messages. Decorators should include their
     * decoration (e.g., {@literal memory-cached:file:///data/pipeline}).
     *
     * @return A unique identifier for this store
     */
    String getStoreIdentifier();
}
