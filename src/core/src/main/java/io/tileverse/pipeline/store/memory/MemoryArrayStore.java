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

import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.array.Region;
import io.tileverse.pipeline.store.AbstractArrayStore;
import io.tileverse.pipeline.store.ArrayStore;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A thread-safe {@link ArrayStore} keeping every entry on the heap.
 * <p>
 * Content survives {@link #close()} and re-{@link #open()} for the lifetime of the instance, which makes this store
 * suitable for tests and for pipelines whose intermediate results fit in memory. Arrays are copied on the way in and
 * on the way out, so callers never share state with the store.
 */
public class MemoryArrayStore extends AbstractArrayStore implements ArrayStore {

    private final String name;
    private final Map<String, NdArray> arrays = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> attributes = new ConcurrentHashMap<>();

    /**
     * Creates an anonymous in-memory store.
     */
    public MemoryArrayStore() {
        this("anonymous");
    }

    /**
     * @param name a name identifying this store in logs
     */
    public MemoryArrayStore(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    protected void openInternal() {
        // nothing to acquire
    }

    @Override
    protected void closeInternal() {
        // content is kept for the lifetime of the instance
    }

    @Override
    protected boolean existsInternal(String tag) {
        return arrays.containsKey(tag);
    }

    @Override
    protected Set<String> tagsInternal() {
        return arrays.keySet();
    }

    @Override
    protected int[] shapeInternal(String tag) {
        return arrays.get(tag).shape();
    }

    @Override
    protected NdArray getSliceInternal(String tag, Region region, int[] shape) {
        return arrays.get(tag).region(region);
    }

    @Override
    protected void setSliceInternal(String tag, Region region, int[] shape, NdArray data) {
        arrays.computeIfPresent(tag, (t, current) -> {
            current.setRegion(region, data);
            return current;
        });
    }

    @Override
    protected void appendInternal(String tag, int[] shape, NdArray data) {
        arrays.compute(tag, (t, current) -> current == null ? data.copy() : NdArray.concat(current, data));
    }

    @Override
    protected void replaceInternal(String tag, NdArray data) {
        arrays.put(tag, data.copy());
    }

    @Override
    protected void deleteAllInternal(String tag) {
        arrays.remove(tag);
        attributes.remove(tag);
    }

    @Override
    protected Map<String, Object> getAttributesInternal(String tag) {
        return attributes.getOrDefault(tag, Map.of());
    }

    @Override
    protected void setAttributeInternal(String tag, String name, Object value) {
        attributes.computeIfAbsent(tag, t -> new ConcurrentHashMap<>()).put(name, value);
    }

    @Override
    protected void deleteAttributeInternal(String tag, String name) {
        attributes.computeIfPresent(tag, (t, attrs) -> {
            attrs.remove(name);
            return attrs.isEmpty() ? null : attrs;
        });
    }

    @Override
    protected void deleteAttributesInternal(String tag) {
        attributes.remove(tag);
    }

    @Override
    public String getStoreIdentifier() {
        return "memory:" + name;
    }
}
