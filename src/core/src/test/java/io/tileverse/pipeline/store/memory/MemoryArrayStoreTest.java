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
package io.tileverse.pipeline.store.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.store.AbstractArrayStoreTest;
import io.tileverse.pipeline.store.ArrayStore;
import java.io.IOException;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MemoryArrayStore}.
 */
class MemoryArrayStoreTest extends AbstractArrayStoreTest {

    @Override
    protected ArrayStore createStore() {
        return new MemoryArrayStore("test");
    }

    @Test
    void testIdentifier() {
        assertEquals("memory:test", store.getStoreIdentifier());
        assertEquals("memory:anonymous", new MemoryArrayStore().getStoreIdentifier());
    }

    @Test
    void testInputIsCopied() throws IOException {
        NdArray data = NdArray.zeros(2, 2);
        store.replace("images", data);
        data.set(5, 1, 1);
        assertEquals(0d, store.get("images").get(1, 1));
    }
}
