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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tileverse.pipeline.ShapeConflictException;
import io.tileverse.pipeline.TagNotFoundException;
import io.tileverse.pipeline.array.FrameRange;
import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.array.Region;
import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Contract tests shared by every {@link ArrayStore} implementation.
 */
public abstract class AbstractArrayStoreTest {

    protected ArrayStore store;

    /**
     * @return a new, closed and empty store
     * @throws IOException If the store can't be created
     */
    protected abstract ArrayStore createStore() throws IOException;

    @BeforeEach
    void setUpStore() throws IOException {
        store = createStore();
        store.open();
    }

    @AfterEach
    void tearDownStore() throws IOException {
        store.close();
    }

    @Test
    void testOpenAndCloseAreIdempotent() throws IOException {
        assertTrue(store.isOpen());
        store.open();
        assertTrue(store.isOpen());
        store.close();
        store.close();
        assertFalse(store.isOpen());
        assertThrows(IllegalStateException.class, () -> store.tags());
        store.open();
        assertTrue(store.isOpen());
    }

    @Test
    void testMissingTag() throws IOException {
        assertFalse(store.exists("missing"));
        TagNotFoundException e = assertThrows(TagNotFoundException.class, () -> store.get("missing"));
        assertEquals("missing", e.getTag());
        assertThrows(TagNotFoundException.class, () -> store.getShape("missing"));
        assertThat(store.getAttribute("missing", "name")).isEmpty();
        assertThat(store.getAttributes("missing")).isEmpty();
        // deleting a missing entry is a no-op
        store.deleteAll("missing");
    }

    @Test
    void testInvalidTag() {
        assertThrows(NullPointerException.class, () -> store.exists(null));
        assertThrows(IllegalArgumentException.class, () -> store.exists(" "));
    }

    @Test
    void testReplaceAndGet() throws IOException {
        NdArray data = NdArray.arange(3, 2, 4);
        store.replace("images", data);

        assertTrue(store.exists("images"));
        assertThat(store.tags()).containsExactly("images");
        assertArrayEquals(new int[] {3, 2, 4}, store.getShape("images"));
        assertEquals(3, store.getNdim("images"));
        assertEquals(data, store.get("images"));

        store.replace("images", NdArray.filled(1, 5, 5));
        assertEquals(NdArray.filled(1, 5, 5), store.get("images"));
    }

    @Test
    void testReadsAreCopies() throws IOException {
        store.replace("images", NdArray.zeros(2, 2, 2));
        NdArray read = store.get("images");
        read.set(9, 0, 0, 0);
        assertEquals(0d, store.get("images").get(0, 0, 0));
    }

    @Test
    void testGetSlice() throws IOException {
        NdArray data = NdArray.arange(6, 3, 4);
        store.replace("images", data);

        assertEquals(data.frames(FrameRange.of(2, 5)), store.getSlice("images", FrameRange.of(2, 5)));
        Region line = Region.line(6, 2, 1);
        assertEquals(data.region(line), store.getSlice("images", line));
        Region box = new Region(new int[] {1, 1, 1}, new int[] {2, 2, 3});
        assertEquals(data.region(box), store.getSlice("images", box));

        assertThrows(IndexOutOfBoundsException.class, () -> store.getSlice("images", FrameRange.of(4, 7)));
    }

    @Test
    void testSetSlice() throws IOException {
        NdArray data = NdArray.arange(4, 3, 4);
        store.replace("images", data);

        Region line = Region.line(4, 1, 3);
        NdArray values = NdArray.filled(-1, 4, 1, 1);
        store.setSlice("images", line, values);
        data.setRegion(line, values);
        assertEquals(data, store.get("images"));

        Region frames = FrameRange.of(1, 3).toRegion(data.shape());
        NdArray zeros = NdArray.zeros(2, 3, 4);
        store.setSlice("images", frames, zeros);
        data.setRegion(frames, zeros);
        assertEquals(data, store.get("images"));

        assertThrows(ShapeConflictException.class, () -> store.setSlice("images", line, NdArray.zeros(3, 1, 1)));
        assertThrows(
                ShapeConflictException.class,
                () -> store.setSlice("images", Region.line(5, 0, 0), NdArray.zeros(5, 1, 1)));
        assertThrows(
                TagNotFoundException.class, () -> store.setSlice("missing", line, NdArray.zeros(4, 1, 1)));
    }

    @Test
    void testAppendCreatesAndExtends() throws IOException {
        store.append("images", NdArray.filled(1, 2, 2, 2));
        store.append("images", NdArray.filled(2, 1, 2, 2));
        // a single frame is appended as a stack of one
        store.append("images", NdArray.filled(3, 2, 2));

        assertArrayEquals(new int[] {4, 2, 2}, store.getShape("images"));
        NdArray stored = store.get("images");
        assertEquals(1d, stored.get(1, 1, 1));
        assertEquals(2d, stored.get(2, 0, 0));
        assertEquals(3d, stored.get(3, 1, 0));

        assertThrows(ShapeConflictException.class, () -> store.append("images", NdArray.zeros(1, 3, 2)));
        assertThrows(ShapeConflictException.class, () -> store.append("images", NdArray.zeros(3)));
        assertArrayEquals(new int[] {4, 2, 2}, store.getShape("images"));
    }

    @Test
    void testAttributes() throws IOException {
        store.setAttribute("images", "PIXSCALE", 0.027d);
        store.setAttribute("images", "EXPTIME", 30);
        store.setAttribute("images", "FRAMES", 12L);
        store.setAttribute("images", "INSTRUMENT", "NACO");
        store.setAttribute("images", "FLIPPED", Boolean.TRUE);
        store.setAttribute("images", "PARANG", new double[] {1.5, 2.5});

        // attributes exist independently from the array content
        assertFalse(store.exists("images"));
        assertEquals(Double.valueOf(0.027d), store.getAttribute("images", "PIXSCALE").orElseThrow());
        assertEquals(Integer.valueOf(30), store.getAttribute("images", "EXPTIME").orElseThrow());
        assertEquals(Long.valueOf(12L), store.getAttribute("images", "FRAMES").orElseThrow());
        assertEquals("NACO", store.getAttribute("images", "INSTRUMENT").orElseThrow());
        assertEquals(Boolean.TRUE, store.getAttribute("images", "FLIPPED").orElseThrow());
        assertArrayEquals(
                new double[] {1.5, 2.5}, (double[]) store.getAttribute("images", "PARANG").orElseThrow());

        Map<String, Object> all = store.getAttributes("images");
        assertThat(all).containsOnlyKeys("PIXSCALE", "EXPTIME", "FRAMES", "INSTRUMENT", "FLIPPED", "PARANG");
        assertThrows(UnsupportedOperationException.class, () -> all.put("other", 1));

        store.deleteAttribute("images", "EXPTIME");
        store.deleteAttribute("images", "missing");
        assertThat(store.getAttribute("images", "EXPTIME")).isEmpty();

        assertThrows(IllegalArgumentException.class, () -> store.setAttribute("images", "bad", new Object()));
        assertThrows(IllegalArgumentException.class, () -> store.setAttribute("images", "bad", null));
    }

    @Test
    void testLongStringAttribute() throws IOException {
        String history = "x".repeat(70_000);
        String comment = "étoile λ ".repeat(10_000);
        store.setAttribute("images", "HISTORY", history);
        store.setAttribute("images", "COMMENT", comment);
        store.setAttribute("images", "EXPTIME", 30);

        assertEquals(history, store.getAttribute("images", "HISTORY").orElseThrow());
        assertEquals(comment, store.getAttribute("images", "COMMENT").orElseThrow());
        assertEquals(Integer.valueOf(30), store.getAttribute("images", "EXPTIME").orElseThrow());
    }

    @Test
    void testReplaceKeepsAttributes() throws IOException {
        store.replace("images", NdArray.zeros(2, 2));
        store.setAttribute("images", "PIXSCALE", 0.01d);
        store.replace("images", NdArray.zeros(3, 3));
        assertEquals(Double.valueOf(0.01d), store.getAttribute("images", "PIXSCALE").orElseThrow());
    }

    @Test
    void testDeleteAttributesKeepsContent() throws IOException {
        store.replace("images", NdArray.zeros(2, 2));
        store.setAttribute("images", "PIXSCALE", 0.01d);
        store.deleteAttributes("images");
        assertTrue(store.exists("images"));
        assertThat(store.getAttributes("images")).isEmpty();
    }

    @Test
    void testDeleteAll() throws IOException {
        store.replace("images", NdArray.zeros(2, 2));
        store.replace("other", NdArray.zeros(1));
        store.setAttribute("images", "PIXSCALE", 0.01d);

        store.deleteAll("images");
        assertFalse(store.exists("images"));
        assertThat(store.getAttributes("images")).isEmpty();
        assertThat(store.tags()).containsExactly("other");
    }

    @Test
    void testContentSurvivesReopen() throws IOException {
        store.replace("images", NdArray.arange(2, 3));
        store.setAttribute("images", "EXPTIME", 5);
        store.close();
        store.open();
        assertEquals(NdArray.arange(2, 3), store.get("images"));
        assertEquals(Integer.valueOf(5), store.getAttribute("images", "EXPTIME").orElseThrow());
    }

    @Test
    void testStoreIdentifier() {
        assertThat(store.getStoreIdentifier()).isNotBlank();
    }
}
