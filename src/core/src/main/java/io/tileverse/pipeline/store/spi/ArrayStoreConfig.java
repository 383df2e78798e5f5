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

import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Where and how to open an {@link io.tileverse.pipeline.store.ArrayStore}: the store location ({@code memory:<name>},
 * {@code file:/path/to/dir} or a plain path), an optional provider to force, and the values of
 * {@link ArrayStoreParameter store options} keyed by property name.
 * <p>
 * Option values are kept as given and converted when read, so a config loaded from {@link Properties} and one built
 * in code behave the same.
 */
public class ArrayStoreConfig {

    /** Property holding the store location. */
    public static final String URI_KEY = "io.tileverse.pipeline.store.uri";

    /** Property holding the id of the {@link ArrayStoreProvider} to use regardless of the location. */
    public static final String PROVIDER_ID_KEY = "io.tileverse.pipeline.store.provider";

    private URI uri;

    private String providerId;

    private final Map<String, Object> options = new LinkedHashMap<>();

    public URI uri() {
        return uri;
    }

    public ArrayStoreConfig uri(URI uri) {
        this.uri = requireNonNull(uri, "uri can't be null");
        return this;
    }

    /**
     * @throws IllegalArgumentException if {@code uri} is not a valid URI
     */
    public ArrayStoreConfig uri(String uri) {
        return uri(URI.create(uri));
    }

    public Optional<String> providerId() {
        return Optional.ofNullable(providerId);
    }

    public ArrayStoreConfig providerId(String providerId) {
        this.providerId = providerId == null || providerId.isBlank() ? null : providerId.trim();
        return this;
    }

    /**
     * Sets an option; a {@code null} value unsets it.
     */
    public <T> ArrayStoreConfig set(ArrayStoreParameter<T> parameter, T value) {
        return set(parameter.key(), value);
    }

    /**
     * Sets an option by key, with a value that may still be in string form.
     */
    public ArrayStoreConfig set(String key, Object value) {
        requireNonNull(key, "key");
        if (value == null) {
            options.remove(key);
        } else {
            options.put(key, value);
        }
        return this;
    }

    /**
     * @return the option value, or the parameter default when unset
     * @throws IllegalArgumentException if the stored value does not denote a value of the parameter type
     */
    public <T> Optional<T> get(ArrayStoreParameter<T> parameter) {
        Object raw = options.get(parameter.key());
        if (raw == null) {
            return Optional.ofNullable(parameter.defaultValue());
        }
        return Optional.of(parameter.parse(raw));
    }

    /**
     * Whether this config targets the given provider: the forced provider id, if any, is {@code providerId} and the
     * location scheme is one of {@code schemes}.
     *
     * @param providerId the provider id
     * @param schemes the accepted URI schemes; {@code null} accepts a plain path
     * @return {@code true} if the provider can handle this config
     */
    public boolean targets(String providerId, String... schemes) {
        requireNonNull(providerId, "providerId");
        if (uri == null) {
            return false;
        }
        if (this.providerId != null && !this.providerId.equalsIgnoreCase(providerId)) {
            return false;
        }
        final String scheme = uri.getScheme();
        for (String accepted : schemes) {
            if (accepted == null ? scheme == null : accepted.equalsIgnoreCase(scheme)) {
                return true;
            }
        }
        return false;
    }

    public Properties toProperties() {
        Properties properties = new Properties();
        options.forEach((key, value) -> properties.setProperty(key, String.valueOf(value)));
        if (uri != null) {
            properties.setProperty(URI_KEY, uri.toString());
        }
        if (providerId != null) {
            properties.setProperty(PROVIDER_ID_KEY, providerId);
        }
        return properties;
    }

    /**
     * Reads a config from properties. {@link #URI_KEY} is required and may hold a {@link URI} or a string;
     * {@link #PROVIDER_ID_KEY} is optional; every other entry becomes an option.
     *
     * @throws NullPointerException if {@link #URI_KEY} is missing
     */
    public static ArrayStoreConfig fromProperties(Properties properties) {
        requireNonNull(properties, "properties");
        Object location = requireNonNull(properties.get(URI_KEY), "Properties must include " + URI_KEY);

        ArrayStoreConfig config = new ArrayStoreConfig();
        config.uri(location instanceof URI u ? u : URI.create(location.toString()));
        Object provider = properties.get(PROVIDER_ID_KEY);
        config.providerId(provider == null ? null : provider.toString());
        properties.forEach((key, value) -> {
            if (!URI_KEY.equals(key) && !PROVIDER_ID_KEY.equals(key)) {
                config.set(String.valueOf(key), value);
            }
        });
        return config;
    }

    @Override
    public String toString() {
        return "ArrayStoreConfig[uri=%s, provider=%s, options=%s]".formatted(uri, providerId, options);
    }
}
