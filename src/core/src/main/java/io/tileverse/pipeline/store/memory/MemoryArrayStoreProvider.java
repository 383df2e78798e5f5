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

import io.tileverse.pipeline.store.ArrayStore;
import io.tileverse.pipeline.store.spi.AbstractArrayStoreProvider;
import io.tileverse.pipeline.store.spi.ArrayStoreConfig;
import io.tileverse.pipeline.store.spi.ArrayStoreProvider;
import java.net.URI;

/**
 * An {@link ArrayStoreProvider} for {@code memory:<name>} URIs. Each call to {@link #create(ArrayStoreConfig)}
 * returns a new, empty {@link MemoryArrayStore}.
 */
public class MemoryArrayStoreProvider extends AbstractArrayStoreProvider {

    /**
     * Key used as environment variable name to disable this provider
     * <pre>
     * {@code export IO_TILEVERSE_PIPELINE_STORE_MEMORY=false}
     * </pre>
     */
    public static final String ENABLED_KEY = "IO_TILEVERSE_PIPELINE_STORE_MEMORY";

    public static final String ID = "memory";

    /**
     * Create a new MemoryArrayStoreProvider without support for the caching decorator
     */
    public MemoryArrayStoreProvider() {
        super(false);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public boolean isAvailable() {
        return ArrayStoreProvider.isEnabled(ENABLED_KEY);
    }

    @Override
    public String getDescription() {
        return "Keeps arrays and attributes on the heap for the lifetime of the store.";
    }

    @Override
    public boolean canProcess(ArrayStoreConfig config) {
        return config.targets(getId(), "memory");
    }

    @Override
    protected ArrayStore createInternal(ArrayStoreConfig config) {
        URI uri = config.uri();
        String name = uri.getSchemeSpecificPart();
        return name == null || name.isBlank() ? new MemoryArrayStore() : new MemoryArrayStore(name);
    }
}
