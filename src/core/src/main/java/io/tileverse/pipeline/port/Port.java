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
package io.tileverse.pipeline.port;

import io.tileverse.pipeline.UnboundPortException;
import io.tileverse.pipeline.store.ArrayStore;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.NonNull;

/**
 * A named handle mediating the access of one pipeline module to one tag of an {@link ArrayStore}.
 * <p>
 * A port is unusable until {@link #bind(ArrayStore) bound}: every operation touching the store throws
 * {@link UnboundPortException} before that. Binding is idempotent for the same store and permanent; an attempt to
 * bind a port to another store is rejected.
 */
public abstract class Port {

    private final String tag;

    private volatile ArrayStore store;

    protected Port(String tag) {
        Objects.requireNonNull(tag, "tag");
        if (tag.isBlank()) {
            throw new IllegalArgumentException("tag can't be blank");
        }
        this.tag = tag;
    }

    /**
     * Associates this port with a store connection.
     *
     * @param store the store connection
     * @throws NullPointerException if {@code store} is null
     * @throws IllegalStateException if this port is already bound to a different store
     */
    public final synchronized void bind(@NonNull ArrayStore store) {
        if (this.store == null) {
            this.store = store;
        } else if (this.store != store) {
            throw new IllegalStateException("Port '" + tag + "' is already bound to "
                    + this.store.getStoreIdentifier() + ", can't rebind it to " + store.getStoreIdentifier());
        }
    }

    public final boolean isBound() {
        return store != null;
    }

    public final String getTag() {
        return tag;
    }

    /**
     * @return the bound store
     * @throws UnboundPortException if this port is not bound
     */
    protected final ArrayStore store() {
        ArrayStore s = store;
        if (s == null) {
            throw new UnboundPortException(tag);
        }
        return s;
    }

    /**
     * @return whether an array is stored under this port's tag
     * @throws IOException If an I/O error occurs
     */
    public boolean exists() throws IOException {
        return store().exists(tag);
    }

    /**
     * @return the shape of the array under this port's tag
     * @throws io.tileverse.pipeline.TagNotFoundException if there is no array under the tag
     * @throws IOException If an I/O error occurs
     */
    public int[] getShape() throws IOException {
        return store().getShape(tag);
    }

    public int getNdim() throws IOException {
        return store().getNdim(tag);
    }

    public Optional<Object> getAttribute(String name) throws IOException {
        return store().getAttribute(tag, name);
    }

    public Map<String, Object> getAttributes() throws IOException {
        return store().getAttributes(tag);
    }

    @Override
    public String toString() {
        return "%s[%s]".formatted(getClass().getSimpleName(), tag);
    }
}
