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
import java.io.IOException;

/**
 * An abstract base class for {@link ArrayStoreProvider} implementations applying the caching decoration to the
 * created {@link ArrayStore} instances.
 */
public abstract class AbstractArrayStoreProvider implements ArrayStoreProvider {

    /**
     * Enables or disables memory caching of region reads. When enabled, a {@link CachingArrayStore} wraps the
     * underlying {@link ArrayStore}.
     */
    public static final ArrayStoreParameter<Boolean> MEMORY_CACHE = CachingProviderHelper.MEMORY_CACHE;

    /**
     * Limits the total size in bytes of the cached regions. Only effective when {@link #MEMORY_CACHE caching} is
     * enabled.
     */
    public static final ArrayStoreParameter<Long> MEMORY_CACHE_MAX_BYTES = CachingProviderHelper.MEMORY_CACHE_MAX_BYTES;

    private final boolean supportsCaching;

    /**
     * Constructs a provider supporting the caching decorator.
     */
    protected AbstractArrayStoreProvider() {
        this(true);
    }

    /**
     * @param supportsCaching {@code false} to ignore the {@link #MEMORY_CACHE caching options}
     */
    protected AbstractArrayStoreProvider(boolean supportsCaching) {
        this.supportsCaching = supportsCaching;
    }

    public final boolean supportsCaching() {
        return supportsCaching;
    }

    /**
     * Creates an {@link ArrayStore}, decorated with a {@link CachingArrayStore} if caching is supported and enabled
     * in the configuration.
     */
    @Override
    public final ArrayStore create(ArrayStoreConfig config) throws IOException {
        ArrayStore store = createInternal(config);
        if (supportsCaching) {
            store = CachingProviderHelper.decorate(store, config);
        }
        return store;
    }

    /**
     * Creates the core {@link ArrayStore} instance without any caching decoration.
     *
     * @param config The configuration containing the URI and other parameters.
     * @return The raw {@link ArrayStore} instance.
     * @throws IOException If an I/O error occurs during store creation.
     */
    protected abstract ArrayStore createInternal(ArrayStoreConfig config) throws IOException;
}
