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

/**
 * A typed store option, identified by the key it has in {@link ArrayStoreConfig} and in {@link java.util.Properties}.
 * <p>
 * Values come from properties files, system properties or code, so {@link #parse(Object)} accepts both the target
 * type and its string form. Only {@code Boolean}, {@code Integer}, {@code Long} and {@code String} options exist.
 *
 * @param <T> the value type
 * @param key the property key
 * @param type the value type
 * @param defaultValue the value used when the option is not set, may be {@code null}
 */
public record ArrayStoreParameter<T>(String key, Class<T> type, T defaultValue) {

    public ArrayStoreParameter {
        requireNonNull(key, "key");
        requireNonNull(type, "type");
        if (key.isBlank()) {
            throw new IllegalArgumentException("parameter key can't be blank");
        }
        if (type != Boolean.class && type != Integer.class && type != Long.class && type != String.class) {
            throw new IllegalArgumentException("Unsupported parameter type " + type.getName());
        }
    }

    public static ArrayStoreParameter<Boolean> flag(String key, boolean defaultValue) {
        return new ArrayStoreParameter<>(key, Boolean.class, defaultValue);
    }

    public static ArrayStoreParameter<Long> longValue(String key) {
        return new ArrayStoreParameter<>(key, Long.class, null);
    }

    /**
     * Converts a raw option value to this parameter's type.
     *
     * @param raw a value of type {@code T} or its string form
     * @return the typed value
     * @throws IllegalArgumentException if {@code raw} does not denote a {@code T}
     */
    public T parse(Object raw) {
        requireNonNull(raw, "raw");
        if (type.isInstance(raw)) {
            return type.cast(raw);
        }
        final String text = String.valueOf(raw).trim();
        try {
            if (type == String.class) {
                return type.cast(text);
            }
            if (type == Boolean.class) {
                if (!"true".equalsIgnoreCase(text) && !"false".equalsIgnoreCase(text)) {
                    throw new IllegalArgumentException("not a boolean");
                }
                return type.cast(Boolean.valueOf(text));
            }
            if (type == Integer.class) {
                return type.cast(Integer.valueOf(text));
            }
            return type.cast(Long.valueOf(text));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid value for %s (%s): '%s'".formatted(key, type.getSimpleName(), raw), e);
        }
    }
}
