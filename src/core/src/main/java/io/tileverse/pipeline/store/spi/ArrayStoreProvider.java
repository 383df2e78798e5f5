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
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.stream.Stream;

/**
 * Service Provider Interface (SPI) for creating {@link ArrayStore} instances.
 * Implementations of this interface are discovered at runtime using {@link ServiceLoader}.
 */
public interface ArrayStoreProvider {

    /**
     * @return The unique ID of this provider.
     */
    String getId();

    /**
     * @return A human-readable description of this provider.
     */
    String getDescription();

    /**
     * Checks if this provider is available in the current environment, for example based on a configuration flag.
     *
     * @return {@code true} if available, {@code false} otherwise.
     */
    boolean isAvailable();

    /**
     * Performs a fast, static check to see if this provider can handle the given config, based on the URI scheme
     * and the explicit provider id only, without I/O.
     *
     * @param config The configuration to check.
     * @return {@code true} if this provider can handle the config
     */
    boolean canProcess(ArrayStoreConfig config);

    /**
     * Gets the order value of this provider. Lower values have higher priority.
     *
     * @return The order value.
     */
    default int getOrder() {
        return 0;
    }

    /**
     * Creates a new, closed {@link ArrayStore} for the given URI with default options.
     *
     * @param uri The URI of the store.
     * @return A new {@link ArrayStore} instance.
     * @throws IOException If an I/O error occurs during store creation.
     */
    default ArrayStore create(URI uri) throws IOException {
        return create(new ArrayStoreConfig().uri(uri));
    }

    /**
     * Creates a new, closed {@link ArrayStore} with the specified configuration.
     *
     * @param config The configuration for the {@link ArrayStore}.
     * @return A new {@link ArrayStore} instance.
     * @throws IOException If an I/O error occurs during store creation.
     */
    ArrayStore create(ArrayStoreConfig config) throws IOException;

    /**
     * Checks if a feature is enabled via a system property or environment variable. The property is checked first,
     * then the environment variable. If neither is set, it defaults to {@code true}.
     *
     * @param key The key for the system property/environment variable.
     * @return {@code true} if enabled, {@code false} otherwise.
     */
    static boolean isEnabled(String key) {
        String enabled = System.getProperty(key);
        if (enabled == null) {
            enabled = System.getenv(key);
        }
        return enabled == null ? true : Boolean.parseBoolean(enabled);
    }

    /**
     * @return A stream of the providers registered through {@link ServiceLoader}.
     */
    static Stream<ArrayStoreProvider> findProviders() {
        ServiceLoader<ArrayStoreProvider> loader = ServiceLoader.load(ArrayStoreProvider.class);
        return loader.stream().map(Provider::get);
    }

    static List<ArrayStoreProvider> getProviders() {
        return findProviders().toList();
    }

    static List<ArrayStoreProvider> getAvailableProviders() {
        return findProviders().filter(ArrayStoreProvider::isAvailable).toList();
    }

    static Optional<ArrayStoreProvider> findProvider(String providerId) {
        return findProviders()
                .filter(p -> p.getId().equalsIgnoreCase(providerId))
                .findFirst();
    }

    /**
     * Retrieves a specific provider by its ID, with an option to check for availability.
     *
     * @param providerId The ID of the provider to retrieve.
     * @param available If {@code true}, fail if the provider is not available.
     * @return The requested {@link ArrayStoreProvider}.
     * @throws IllegalStateException if the provider is not found, or if {@code available} is true and the provider
     *     is not available.
     */
    static ArrayStoreProvider getProvider(String providerId, boolean available) {
        ArrayStoreProvider provider = findProvider(providerId)
                .orElseThrow(() ->
                        new IllegalStateException("The specified ArrayStoreProvider is not found: " + providerId));

        if (available && !provider.isAvailable()) {
            throw new IllegalStateException("The specified ArrayStoreProvider is not available: " + providerId);
        }
        return provider;
    }
}
