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
package io.tileverse.pipeline.store.file;

import io.tileverse.pipeline.store.ArrayStore;
import io.tileverse.pipeline.store.spi.AbstractArrayStoreProvider;
import io.tileverse.pipeline.store.spi.ArrayStoreConfig;
import io.tileverse.pipeline.store.spi.ArrayStoreProvider;

/**
 * An {@link ArrayStoreProvider} creating {@link FileArrayStore} instances rooted at a local directory, given as a
 * {@code file:} URI or a plain path. Supports the caching decorator.
 */
public class FileArrayStoreProvider extends AbstractArrayStoreProvider {

    /**
     * Key used as environment variable name to disable this provider
     * <pre>
     * {@code export IO_TILEVERSE_PIPELINE_STORE_FILE=false}
     * </pre>
     */
    public static final String ENABLED_KEY = "IO_TILEVERSE_PIPELINE_STORE_FILE";

    public static final String ID = "file";

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
        return "Persists each array and its attributes as files in a local directory.";
    }

    @Override
    public boolean canProcess(ArrayStoreConfig config) {
        return config.targets(getId(), "file", null);
    }

    @Override
    protected ArrayStore createInternal(ArrayStoreConfig config) {
        return FileArrayStore.of(config.uri());
    }
}
