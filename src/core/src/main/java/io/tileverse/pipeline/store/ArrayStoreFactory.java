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

import static java.util.Objects.requireNonNull;

import io.tileverse.pipeline.store.spi.ArrayStoreConfig;
import io.tileverse.pipeline.store.spi.ArrayStoreProvider;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A factory for creating {@link ArrayStore} instances.
 * This factory uses the Java Service Provider Interface (SPI) to discover
 * available {@link ArrayStoreProvider} implementations at runtime.
 */
public final class ArrayStoreFactory {
    private static final Logger logger = LoggerFactory.getLogger(ArrayStoreFactory.class);

    private ArrayStoreFactory() {
        // Private constructor to prevent instantiation of this utility class.
    }

    /**
     * Creates an {@link ArrayStore} for the given URI.
     *
     * @param uri The URI of the store.
     * @return A new, closed {@link ArrayStore} instance.
     * @throws IOException If an I/O error occurs during store creation.
     * @throws IllegalStateException If no suitable provider is found or if there is an unresolvable ambiguity.
     */
    public static ArrayStore create(URI uri) throws IOException {
        return create(uri, new Properties());
    }

    /**
     * Creates an {@link ArrayStore} for the given URI and configuration properties.
     *
     * @param uri The URI of the store.
     * @param config Additional configuration properties.
     * @return A new, closed {@link ArrayStore} instance.
     * @throws IOException If an I/O error occurs during store creation.
     * @throws IllegalStateException If no suitable provider is found or if there is an unresolvable ambiguity.
     */
    public static ArrayStore create(URI uri, Properties config) throws IOException {
        Properties properties = new Properties();
        properties.putAll(requireNonNull(config));
        properties.put(ArrayStoreConfig.URI_KEY, requireNonNull(uri));
        return create(properties);
    }

    /**
     * Creates an {@link ArrayStore} from configuration properties including {@link ArrayStoreConfig#URI_KEY}.
     *
     * @param config the configuration properties
     * @return A new, closed {@link ArrayStore} instance.
     * @throws IOException If an I/O error occurs during store creation.
     */
    public static ArrayStore create(Properties config) throws IOException {
        return create(ArrayStoreConfig.fromProperties(requireNonNull(config)));
    }

    /**
     * Creates an {@link ArrayStore} using the best available provider for the given configuration.
     *
     * @param config The configuration, including the URI and optional provider ID.
     * @return A new, closed {@link ArrayStore} instance.
     * @throws IOException If an I/O error occurs during store creation.
     * @throws IllegalStateException If no suitable provider is found or if there is an unresolvable ambiguity.
     */
    public static ArrayStore create(ArrayStoreConfig config) throws IOException {
        ArrayStoreProvider provider = findBestProvider(requireNonNull(config));
        ArrayStore store = provider.create(config);
        logger.debug("Created {} with provider {}", store.getStoreIdentifier(), provider.getId());
        return store;
    }

    /**
     * Finds the best {@link ArrayStoreProvider} for the given configuration.
     * <ol>
     *   <li>If a provider ID is explicitly set, only that provider is considered and it must be available.</li>
     *   <li>Otherwise the available providers that {@link ArrayStoreProvider#canProcess(ArrayStoreConfig) can
     *       process} the config are candidates; ties are resolved by {@link ArrayStoreProvider#getOrder() order}.</li>
     * </ol>
     *
     * @param config The configuration of the store.
     * @return The selected {@link ArrayStoreProvider}.
     * @throws IllegalStateException If no suitable provider is found or if there is an unresolvable ambiguity.
     */
    public static ArrayStoreProvider findBestProvider(ArrayStoreConfig config) {
        final URI uri = requireNonNull(config.uri(), "config uri is null");

        if (config.providerId().isPresent()) {
            return ArrayStoreProvider.getProvider(config.providerId().orElseThrow(), true);
        }

        final List<ArrayStoreProvider> candidates = ArrayStoreProvider.getAvailableProviders().stream()
                .filter(p -> p.canProcess(config))
                .toList();

        return switch (candidates.size()) {
            case 0 -> throw new IllegalStateException("No suitable provider found for URI: " + uri);
            case 1 -> candidates.get(0);
            default -> resolveByPriority(candidates);
        };
    }

    private static ArrayStoreProvider resolveByPriority(List<ArrayStoreProvider> candidates) {
        final int highestPriority = candidates.stream()
                .mapToInt(ArrayStoreProvider::getOrder)
                .min()
                .orElseThrow(() -> new IllegalStateException("No candidates to resolve by priority."));
        List<ArrayStoreProvider> bestCandidates = candidates.stream()
                .filter(p -> p.getOrder() == highestPriority)
                .toList();

        if (bestCandidates.size() > 1) {
            String conflictingIds =
                    bestCandidates.stream().map(ArrayStoreProvider::getId).collect(Collectors.joining(", "));
            throw new IllegalStateException("URI ambiguity detected. Multiple providers matched with the same priority ("
                    + highestPriority + "): [" + conflictingIds + "]. "
                    + "Please specify a provider ID in the ArrayStoreConfig to resolve this ambiguity.");
        }
        return bestCandidates.get(0);
    }
}
