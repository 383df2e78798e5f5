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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tileverse.pipeline.ShapeConflictException;
import io.tileverse.pipeline.TagNotFoundException;
import io.tileverse.pipeline.UnboundPortException;
import io.tileverse.pipeline.array.FrameRange;
import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.array.Region;
import io.tileverse.pipeline.store.ArrayStore;
import io.tileverse.pipeline.store.memory.MemoryArrayStore;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link InputPort}, {@link OutputPort} and {@link ConfigPort}.
 */
class PortTest {

    private ArrayStore store;

    @BeforeEach
    void setUp() throws IOException {
        store = new MemoryArrayStore("ports");
        store.open();
    }

    @AfterEach
    void tearDown() throws IOException {
        store.close();
    }

    @Test
    void testInvalidTag() {
        assertThrows(NullPointerException.class, () -> new InputPort(null));
        assertThrows(IllegalArgumentException.class, () -> new OutputPort(""));
    }

    @Test
    void testUnboundPort() {
        InputPort in = new InputPort("images");
        assertFalse(in.isBound());
        UnboundPortException e = assertThrows(UnboundPortException.class, in::read);
        assertEquals("images", e.getTag());

        OutputPort inactive = new OutputPort("images", false);
        // inactive ports still require a store
        assertThrows(UnboundPortException.class, () -> inactive.writeAll(NdArray.zeros(1)));
    }

    @Test
    void testBind() {
        InputPort in = new InputPort("images");
        assertThrows(NullPointerException.class, () -> in.bind(null));
        in.bind(store);
        in.bind(store);
        assertTrue(in.isBound());
        assertThrows(IllegalStateException.class, () -> in.bind(new MemoryArrayStore("other")));
    }

    @Test
    void testReadMissingTag() {
        InputPort in = new InputPort("missing");
        in.bind(store);
        assertThrows(TagNotFoundException.class, in::read);
        assertThrows(TagNotFoundException.class, in::getShape);
    }

    @Test
    void testReadAccessors() throws IOException {
        NdArray data = NdArray.arange(5, 2, 3);
        store.replace("images", data);
        InputPort in = new InputPort("images");
        in.bind(store);

        assertTrue(in.exists());
        assertThat(in.getShape()).containsExactly(5, 2, 3);
        assertEquals(3, in.getNdim());
        assertEquals(data, in.read());
        assertEquals(data.frames(FrameRange.of(1, 3)), in.readSlice(FrameRange.of(1, 3)));
        assertEquals(data.region(Region.line(5, 1, 2)), in.readRegion(Region.line(5, 1, 2)));
        assertEquals(data.frame(4), in.readFrame(4));
        assertThat(in.readFrame(0).shape()).containsExactly(2, 3);
    }

    @Test
    void testReadFrameOfSingleImage() throws IOException {
        NdArray image = NdArray.arange(3, 3);
        store.replace("dark", image);
        InputPort in = new InputPort("dark");
        in.bind(store);
        assertEquals(image, in.readFrame(0));
        assertThrows(IndexOutOfBoundsException.class, () -> in.readFrame(1));
    }

    @Test
    void testWriteAllDiscardsAttributesByDefault() throws IOException {
        OutputPort out = new OutputPort("images");
        out.bind(store);
        out.writeAll(NdArray.zeros(2, 2));
        out.writeAttribute("PIXSCALE", 0.027d);

        out.writeAll(NdArray.zeros(3, 3), AttributePolicy.KEEP);
        assertThat(out.getAttribute("PIXSCALE")).contains(0.027d);

        out.writeAll(NdArray.zeros(4, 4));
        assertThat(out.getAttributes()).isEmpty();
        assertThat(out.getShape()).containsExactly(4, 4);
    }

    @Test
    void testWriteSliceAndRegion() throws IOException {
        OutputPort out = new OutputPort("images");
        out.bind(store);
        out.writeAll(NdArray.zeros(4, 2, 2));

        out.writeSlice(FrameRange.of(1, 3), NdArray.filled(1, 2, 2, 2));
        out.writeRegion(Region.line(4, 0, 1), NdArray.filled(2, 4, 1, 1));

        NdArray stored = store.get("images");
        assertEquals(0d, stored.get(0, 0, 0));
        assertEquals(1d, stored.get(1, 1, 0));
        assertEquals(2d, stored.get(2, 0, 1));
        assertEquals(0d, stored.get(3, 1, 1));

        assertThrows(ShapeConflictException.class, () -> out.writeSlice(FrameRange.of(3, 4), NdArray.zeros(1, 3, 3)));
    }

    @Test
    void testAppendAndDelete() throws IOException {
        OutputPort out = new OutputPort("images");
        out.bind(store);
        out.append(NdArray.zeros(2, 2));
        out.append(NdArray.zeros(2, 2));
        assertThat(out.getShape()).containsExactly(4, 2);
        out.deleteAll();
        out.append(NdArray.zeros(1, 2, 2));
        out.append(NdArray.zeros(2, 2));
        assertThat(out.getShape()).containsExactly(2, 2, 2);

        out.writeAttribute("INCOMPLETE", true);
        out.deleteAttribute("INCOMPLETE");
        assertThat(out.getAttribute("INCOMPLETE")).isEmpty();

        out.deleteAll();
        assertFalse(out.exists());
    }

    @Test
    void testInactivePortIgnoresWrites() throws IOException {
        store.replace("images", NdArray.zeros(2, 2));
        OutputPort out = new OutputPort("images", false);
        out.bind(store);
        assertFalse(out.isActive());

        out.writeAll(NdArray.filled(1, 3, 3));
        out.append(NdArray.zeros(2));
        out.writeAttribute("PIXSCALE", 1.0d);
        out.deleteAll();

        assertEquals(NdArray.zeros(2, 2), store.get("images"));
        assertThat(store.getAttributes("images")).isEmpty();

        out.activate();
        out.writeAll(NdArray.filled(1, 3, 3));
        assertEquals(NdArray.filled(1, 3, 3), store.get("images"));
        out.deactivate();
        assertFalse(out.isActive());
    }

    @Test
    void testConfigPort() throws IOException {
        store.setAttribute(ConfigPort.TAG, "CPU", 4);
        ConfigPort config = new ConfigPort();
        config.bind(store);
        assertSame(ConfigPort.TAG, config.getTag());
        assertFalse(config.exists());
        assertThat(config.getAttribute("CPU")).contains(4);
        assertEquals("ConfigPort[config]", config.toString());
    }
}
