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
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.tileverse.pipeline.store.cache.CachingArrayStore;
import io.tileverse.pipeline.store.file.FileArrayStore;
import io.tileverse.pipeline.store.file.FileArrayStoreProvider;
import io.tileverse.pipeline.store.memory.MemoryArrayStore;
import io.tileverse.pipeline.store.memory.MemoryArrayStoreProvider;
import io.tileverse.pipeline.store.spi.AbstractArrayStoreProvider;
import io.tileverse.pipeline.store.spi.ArrayStoreConfig;
import io.tileverse.pipeline.store.spi.ArrayStoreProvider;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ArrayStoreFactory}.
 */
class ArrayStoreFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    void testProvidersAreRegistered() {
        assertThat(ArrayStoreProvider.getProviders())
                .extracting(ArrayStoreProvider::getId)
                .contains(MemoryArrayStoreProvider.ID, FileArrayStoreProvider.ID);
        assertThat(ArrayStoreProvider.findProvider("FILE")).isPresent();
        assertThrows(IllegalStateException.class, () -> ArrayStoreProvider.getProvider("nope", false));
    }

    @Test
    void testFileUri() throws IOException {
        URI uri = tempDir.resolve("store").toUri();
        ArrayStore store = ArrayStoreFactory.create(uri);
        assertThat(store).isInstanceOf(FileArrayStore.class);
        assertEquals(tempDir.resolve("store"), ((FileArrayStore) store).getDirectory());
    }

    @Test
    void testPlainPath() throws IOException {
        URI uri = URI.create(tempDir.resolve("plain").toString());
        ArrayStore store = ArrayStoreFactory.create(uri);
        assertThat(store).isInstanceOf(FileArrayStore.class);
    }

    @Test
    void testMemoryUri() throws IOException {
        ArrayStore store = ArrayStoreFactory.create(URI.create("memory:scratch"));
        assertThat(store).isInstanceOf(MemoryArrayStore.class);
        assertEquals("memory:scratch", store.getStoreIdentifier());
    }

    @Test
    void testExplicitProviderId() throws IOException {
        ArrayStoreConfig config = new ArrayStoreConfig()
                .uri(tempDir.resolve("store").toUri())
                .providerId(FileArrayStoreProvider.ID);
        assertThat(ArrayStoreFactory.findBestProvider(config)).isInstanceOf(FileArrayStoreProvider.class);

        config.providerId("missing");
        assertThrows(IllegalStateException.class, () -> ArrayStoreFactory.create(config));
    }

    @Test
    void testCachingFromProperties() throws IOException {
        Properties props = new Properties();
        props.setProperty(AbstractArrayStoreProvider.MEMORY_CACHE.key(), "true");
        props.setProperty(AbstractArrayStoreProvider.MEMORY_CACHE_MAX_BYTES.key(), "1048576");

        ArrayStore store = ArrayStoreFactory.create(tempDir.resolve("cached").toUri(), props);
        assertThat(store).isInstanceOf(CachingArrayStore.class);
        assertThat(((CachingArrayStore) store).getDelegate()).isInstanceOf(FileArrayStore.class);
        assertThat(store.getStoreIdentifier()).startsWith("memory-cached:file:");
    }

    @Test
    void testMemoryStoresAreNeverCached() throws IOException {
        ArrayStoreConfig config = new ArrayStoreConfig().uri("memory:scratch");
        config.set(AbstractArrayStoreProvider.MEMORY_CACHE, true);
        assertThat(ArrayStoreFactory.create(config)).isInstanceOf(MemoryArrayStore.class);
        assertThat(new MemoryArrayStoreProvider().supportsCaching()).isFalse();
        assertThat(new FileArrayStoreProvider().supportsCaching()).isTrue();
    }

    @Test
    void testUnknownScheme() {
        assertThrows(IllegalStateException.class, () -> ArrayStoreFactory.create(URI.create("s3://bucket/run")));
    }

    @Test
    void testConfigPropertiesRoundTrip() {
        ArrayStoreConfig config = new ArrayStoreConfig()
                .uri("file:/data/run")
                .providerId(FileArrayStoreProvider.ID)
                .set(AbstractArrayStoreProvider.MEMORY_CACHE, true);
        ArrayStoreConfig copy = ArrayStoreConfig.fromProperties(config.toProperties());
        assertEquals(URI.create("file:/data/run"), copy.uri());
        assertEquals(FileArrayStoreProvider.ID, copy.providerId().orElseThrow());
        assertEquals(Boolean.TRUE, copy.get(AbstractArrayStoreProvider.MEMORY_CACHE).orElseThrow());
    }
}
