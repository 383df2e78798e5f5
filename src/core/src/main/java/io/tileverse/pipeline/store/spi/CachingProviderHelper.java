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

import io.tileverse.pipeline.store.ArrayStore;
import io.tileverse.pipeline.store.cache.CachingArrayStore;
import java.util.Optional;

/**
 * Holds the caching options shared by {@link AbstractArrayStoreProvider} implementations and decorates created
 * stores with {@link CachingArrayStore}.
 */
class CachingProviderHelper {

    /**
     * Caches region reads in memory. Every write through the store invalidates the cached regions of the written
     * tag.
     */
    static final ArrayStoreParameter<Boolean> MEMORY_CACHE =
            ArrayStoreParameter.flag("io.tileverse.pipeline.store.cache", false);

    /**
     * Upper bound of the total size of the cached regions, each value weighing 8 bytes. When unset the cache holds
     * soft references and the garbage collector decides.
     */
    static final ArrayStoreParameter<Long> MEMORY_CACHE_MAX_BYTES =
            ArrayStoreParameter.longValue("io.tileverse.pipeline.store.cache.maxbytes");

    private CachingProviderHelper() {
        // utility class
    }

    /**
     * Decorates {@code store} with a {@link CachingArrayStore} if caching is enabled in {@code config}.
     *
     * @param store The store to decorate.
     * @param config The configuration holding the caching settings.
     * @return the decorated store, or {@code store} if caching is disabled.
     */
    static ArrayStore decorate(ArrayStore store, ArrayStoreConfig config) {
        final boolean enableCaching = config.get(MEMORY_CACHE).orElse(false);
        if (!enableCaching) {
            return store;
        }
        Optional<Long> maxBytes = config.get(MEMORY_CACHE_MAX_BYTES);
        CachingArrayStore.Builder builder = CachingArrayStore.builder(store);
        maxBytes.ifPresent(builder::maximumWeight);
        return builder.build();
    }
}
