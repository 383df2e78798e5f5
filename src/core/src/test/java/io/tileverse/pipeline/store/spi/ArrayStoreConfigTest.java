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
package io.tileverse.pipeline.store.spi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tileverse.pipeline.store.ArrayStore;
import io.tileverse.pipeline.store.cache.CachingArrayStore;
import io.tileverse.pipeline.store.memory.MemoryArrayStore;
import java.net.URI;
import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests for {@link ArrayStoreConfig}, {@link ArrayStoreParameter} and {@link CachingProviderHelper}. */
class ArrayStoreConfigTest {

    private static final ArrayStoreParameter<Boolean> CACHE = CachingProviderHelper.MEMORY_CACHE;
    private static final ArrayStoreParameter<Long> MAX_BYTES = CachingProviderHelper.MEMORY_CACHE_MAX_BYTES;

    @Test
    void testDefaults() {
        ArrayStoreConfig config = new ArrayStoreConfig().uri("file:/tmp/store");
        assertThat(config.get(CACHE)).contains(false);
        assertThat(config.get(MAX_BYTES)).isEmpty();
        assertThat(config.providerId()).isEmpty();
    }

    @Test
    void testValuesInStringForm() {
        ArrayStoreConfig config = new ArrayStoreConfig()
                .uri("file:/tmp/store")
                .set(CACHE.key(), " TRUE ")
                .set(MAX_BYTES.key(), "4096");
        assertThat(config.get(CACHE)).contains(true);
        assertThat(config.get(MAX_BYTES)).contains(4096L);

        config.set(MAX_BYTES, null);
        assertThat(config.get(MAX_BYTES)).isEmpty();
    }

    @Test
    void testInvalidValues() {
        ArrayStoreConfig config = new ArrayStoreConfig()
                .uri("file:/tmp/store")
                .set(CACHE.key(), "yes")
                .set(MAX_BYTES.key(), "lots");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> config.get(CACHE));
        assertThat(e.getMessage()).contains(CACHE.key()).contains("yes");
        assertThrows(IllegalArgumentException.class, () -> config.get(MAX_BYTES));
    }

    @Test
    void testParameterTypes() {
        ArrayStoreParameter<Integer> count = new ArrayStoreParameter<>("count", Integer.class, 1);
        assertEquals(Integer.valueOf(42), count.parse("42"));
        assertEquals(Integer.valueOf(7), count.parse(7));
        assertEquals(Integer.valueOf(7), count.parse(7L));
        assertThrows(IllegalArgumentException.class, () -> count.parse("7.5"));
        assertThrows(IllegalArgumentException.class, () -> new ArrayStoreParameter<>("ratio", Double.class, null));
        assertThrows(IllegalArgumentException.class, () -> ArrayStoreParameter.flag(" ", true));
    }

    @Test
    void testPropertiesRoundTrip() {
        ArrayStoreConfig config = new ArrayStoreConfig()
                .uri(URI.create("file:/data/run"))
                .providerId("file")
                .set(CACHE, true)
                .set(MAX_BYTES, 1024L);

        Properties properties = config.toProperties();
        assertEquals("file:/data/run", properties.getProperty(ArrayStoreConfig.URI_KEY));
        assertEquals("file", properties.getProperty(ArrayStoreConfig.PROVIDER_ID_KEY));
        assertEquals("1024", properties.getProperty(MAX_BYTES.key()));

        ArrayStoreConfig parsed = ArrayStoreConfig.fromProperties(properties);
        assertEquals(URI.create("file:/data/run"), parsed.uri());
        assertThat(parsed.providerId()).contains("file");
        assertThat(parsed.get(CACHE)).contains(true);
        assertThat(parsed.get(MAX_BYTES)).contains(1024L);
        assertEquals(properties, parsed.toProperties());
    }

    @Test
    void testFromPropertiesAcceptsUriObjects() {
        Properties properties = new Properties();
        assertThrows(NullPointerException.class, () -> ArrayStoreConfig.fromProperties(properties));

        properties.put(ArrayStoreConfig.URI_KEY, URI.create("memory:scratch"));
        assertEquals(URI.create("memory:scratch"), ArrayStoreConfig.fromProperties(properties).uri());
    }

    @Test
    void testTargets() {
        ArrayStoreConfig file = new ArrayStoreConfig().uri("file:/tmp/x");
        ArrayStoreConfig path = new ArrayStoreConfig().uri("/tmp/x");

        assertTrue(file.targets("file", "file", null));
        assertTrue(path.targets("file", "file", null));
        assertFalse(path.targets("memory", "memory"));
        assertFalse(file.targets("memory", "memory"));
        assertFalse(new ArrayStoreConfig().targets("file", "file", null));

        file.providerId("memory");
        assertFalse(file.targets("file", "file", null));
        file.providerId(" ");
        assertTrue(file.targets("file", "file", null));
    }

    @Test
    void testDecorateDisabled() {
        ArrayStore store = new MemoryArrayStore();
        ArrayStoreConfig config = new ArrayStoreConfig().uri("memory:x");
        assertSame(store, CachingProviderHelper.decorate(store, config));

        config.set(CACHE, false);
        assertSame(store, CachingProviderHelper.decorate(store, config));
    }

    @Test
    void testDecorateEnabled() {
        ArrayStore store = new MemoryArrayStore();
        ArrayStoreConfig config = new ArrayStoreConfig()
                .uri("memory:x")
                .set(CACHE.key(), "true")
                .set(MAX_BYTES.key(), "4096");

        ArrayStore decorated = CachingProviderHelper.decorate(store, config);
        assertThat(decorated).isInstanceOf(CachingArrayStore.class);
        assertSame(store, ((CachingArrayStore) decorated).getDelegate());
    }
}
