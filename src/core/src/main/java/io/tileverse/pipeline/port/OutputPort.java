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

import static java.util.Objects.requireNonNull;

import io.tileverse.pipeline.array.FrameRange;
import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.array.Region;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-capable {@link Port}.
 * <p>
 * An output port carries an {@code active} flag. Every write on an inactive port is a no-op that returns normally,
 * so modules can compute optional outputs without checking whether they are wanted. Reads are not affected by the
 * flag.
 */
public class OutputPort extends Port {

    private static final Logger logger = LoggerFactory.getLogger(OutputPort.class);

    private volatile boolean active;

    /**
     * Creates an active output port.
     *
     * @param tag the tag written by this port
     */
    public OutputPort(String tag) {
        this(tag, true);
    }

    public OutputPort(String tag, boolean active) {
        super(tag);
        this.active = active;
    }

    public boolean isActive() {
        return active;
    }

    public void activate() {
        this.active = true;
    }

    public void deactivate() {
        this.active = false;
    }

    /**
     * Replaces the whole entry, discarding its attributes.
     *
     * @param data the new content
     * @throws IOException If an I/O error occurs
     */
    public void writeAll(NdArray data) throws IOException {
        writeAll(data, AttributePolicy.DISCARD);
    }

    /**
     * Replaces the whole entry.
     *
     * @param data the new content
     * @param policy whether the existing attributes survive the replacement
     * @throws IOException If an I/O error occurs
     */
    public void writeAll(NdArray data, AttributePolicy policy) throws IOException {
        requireNonNull(data, "data");
        requireNonNull(policy, "policy");
        if (skip("writeAll")) {
            return;
        }
        if (policy == AttributePolicy.DISCARD) {
            store().deleteAttributes(getTag());
        }
        store().replace(getTag(), data);
    }

    /**
     * Overwrites frames {@code [range.start(), range.end())} of an existing entry.
     *
     * @param range the frames to overwrite
     * @param data the new frames
     * @throws io.tileverse.pipeline.TagNotFoundException if there is no array under the tag
     * @throws io.tileverse.pipeline.ShapeConflictException if {@code data} does not fit the stored layout
     * @throws IOException If an I/O error occurs
     */
    public void writeSlice(FrameRange range, NdArray data) throws IOException {
        requireNonNull(range, "range");
        requireNonNull(data, "data");
        if (skip("writeSlice")) {
            return;
        }
        store().setSlice(getTag(), range.toRegion(data.shape()), data);
    }

    public void writeRegion(Region region, NdArray data) throws IOException {
        requireNonNull(region, "region");
        requireNonNull(data, "data");
        if (skip("writeRegion")) {
            return;
        }
        store().setSlice(getTag(), region, data);
    }

    /**
     * Extends the entry along its first axis, creating it if absent.
     *
     * @param data a stack of frames, or a single frame
     * @throws io.tileverse.pipeline.ShapeConflictException if {@code data} does not match the stored layout
     * @throws IOException If an I/O error occurs
     */
    public void append(NdArray data) throws IOException {
        requireNonNull(data, "data");
        if (skip("append")) {
            return;
        }
        store().append(getTag(), data);
    }

    /**
     * Removes the array content and the attributes stored under the tag.
     *
     * @throws IOException If an I/O error occurs
     */
    public void deleteAll() throws IOException {
        if (skip("deleteAll")) {
            return;
        }
        store().deleteAll(getTag());
    }

    public void writeAttribute(String name, Object value) throws IOException {
        requireNonNull(name, "name");
        if (skip("writeAttribute")) {
            return;
        }
        store().setAttribute(getTag(), name, value);
    }

    public void deleteAttribute(String name) throws IOException {
        requireNonNull(name, "name");
        if (skip("deleteAttribute")) {
            return;
        }
        store().deleteAttribute(getTag(), name);
    }

    private boolean skip(String operation) {
        // unbound ports fail even when inactive
        store();
        if (!active) {
            logger.trace("Discarding {} on inactive output port '{}'", operation, getTag());
            return true;
        }
        return false;
    }
}
