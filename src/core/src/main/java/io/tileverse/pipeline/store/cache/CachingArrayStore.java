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
package io.tileverse.pipeline.store.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.array.Region;
import io.tileverse.pipeline.store.AbstractArrayStore;
import io.tileverse.pipeline.store.ArrayStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * A decorator for {@link ArrayStore} that caches region reads in memory using Caffeine.
 * <p>
 * Modules frequently read the same input several times, for instance a reference frame read once per chunk, or
 * the input of a line-parallel run probed before the run proper. This decorator serves repeated
 * {@link #getSlice(String, Region) region reads} from memory.
 * <p>
 * <strong>Consistency:</strong> every mutation issued through this store (slice writes, appends, replacements and
 * deletions) invalidates all cached regions of the affected tag before returning. Mutations applied to the delegate
 * directly, bypassing the decorator, are not observed.
 * <p>
 * <strong>Cache Configuration:</strong>
 * <ul>
 * <li><strong>Memory-based sizing:</strong> Use {@code maximumWeight(long)} to limit the total size in bytes of the
 * cached arrays</li>
 * <li><strong>Entry-based sizing:</strong> Use {@code maximumSize(long)} to limit the number of cached regions</li>
 * <li><strong>Adaptive sizing (default):</strong> If no size limit is specified, soft references are used, allowing
 * the garbage collector to manage the cache size based on memory pressure</li>
 * </ul>
 *
 * <pre>{@code
 * ArrayStore store = CachingArrayStore.builder(new FileArrayStore(dir))
 *     .maximumWeight(256 * 1024 * 1024) // 256MB
 *     .expireAfterAccess(10, TimeUnit.MINUTES)
 *     .build();
 * }</pre>
 */
public class CachingArrayStore extends AbstractArrayStore implements ArrayStore {

    private final ArrayStore delegate;
    private final Cache<SliceKey, NdArray> cache;

    /**
     * Package-private constructor, use the {@link #builder(ArrayStore) builder} instead.
     *
     * @param delegate the decorated store
     * @param cache the cache holding region reads
     */
    CachingArrayStore(ArrayStore delegate, Cache<SliceKey, NdArray> cache) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate ArrayStore cannot be null");
        this.cache = Objects.requireNonNull(cache, "Cache cannot be null");
    }

    @Override
    protected void openInternal() throws IOException {
        delegate.open();
    }

    @Override
    protected void closeInternal() throws IOException {
        cache.invalidateAll();
        delegate.close();
    }

    @Override
    protected boolean existsInternal(String tag) throws IOException {
        return delegate.exists(tag);
    }

    @Override
    protected Set<String> tagsInternal() throws IOException {
        return delegate.tags();
    }

    @Override
    protected int[] shapeInternal(String tag) throws IOException {
        return delegate.getShape(tag);
    }

    @Override
    protected NdArray getSliceInternal(String tag, Region region, int[] shape) throws IOException {
        try {
            NdArray cached = cache.get(new SliceKey(tag, region), this::load);
            return cached.copy();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private NdArray load(SliceKey key) {
        try {
            return delegate.getSlice(key.tag(), key.region());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    protected void setSliceInternal(String tag, Region region, int[] shape, NdArray data) throws IOException {
        try {
            delegate.setSlice(tag, region, data);
        } finally {
            invalidate(tag);
        }
    }

    @Override
    protected void appendInternal(String tag, int[] shape, NdArray data) throws IOException {
        try {
            delegate.append(tag, data);
        } finally {
            invalidate(tag);
        }
    }

    @Override
    protected void replaceInternal(String tag, NdArray data) throws IOException {
        try {
            delegate.replace(tag, data);
        } finally {
            invalidate(tag);
        }
    }

    @Override
    protected void deleteAllInternal(String tag) throws IOException {
        try {
            delegate.deleteAll(tag);
        } finally {
            invalidate(tag);
        }
    }

    @Override
    protected Map<String, Object> getAttributesInternal(String tag) throws IOException {
        return delegate.getAttributes(tag);
    }

    @Override
    protected void setAttributeInternal(String tag, String name, Object value) throws IOException {
        delegate.setAttribute(tag, name, value);
    }

    @Override
    protected void deleteAttributeInternal(String tag, String name) throws IOException {
        delegate.deleteAttribute(tag, name);
    }

    @Override
    protected void deleteAttributesInternal(String tag) throws IOException {
        delegate.deleteAttributes(tag);
    }

    private void invalidate(String tag) {
        cache.asMap().keySet().removeIf(key -> key.tag().equals(tag));
    }

    @Override
    public String getStoreIdentifier() {
        return "memory-cached:" + delegate.getStoreIdentifier();
    }

    /**
     * @return the decorated store
     */
    public ArrayStore getDelegate() {
        return delegate;
    }

    /**
     * @return the Caffeine statistics of this cache
     */
    public CacheStats getCacheStats() {
        return cache.stats();
    }

    /**
     * @return the approximate number of cached regions
     */
    public long getCacheEntryCount() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * Discards every cached region.
     */
    public void clearCache() {
        cache.invalidateAll();
    }

    /**
     * Cache key: a region of one tag.
     */
    record SliceKey(String tag, Region region) {}

    /**
     * Creates a new builder for CachingArrayStore.
     *
     * @param delegate the store to decorate
     * @return a new builder instance
     */
    public static Builder builder(ArrayStore delegate) {
        return new Builder(delegate);
    }

    /**
     * Builder for CachingArrayStore.
     */
    public static class Builder {
        private final ArrayStore delegate;
        private long maximumSize = -1;
        private long maximumWeight = -1;
        private long expireAfterAccessDuration = -1;
        private TimeUnit expireAfterAccessUnit;
        private boolean softValues = false;

        private Builder(ArrayStore delegate) {
            this.delegate = Objects.requireNonNull(delegate, "Delegate cannot be null");
        }

        /**
         * Sets the maximum number of cached regions.
         *
         * @param maximumSize the maximum number of entries
         * @return this builder
         */
        public Builder maximumSize(long maximumSize) {
            if (maximumSize <= 0) {
                throw new IllegalArgumentException("Maximum size must be positive: " + maximumSize);
            }
            this.maximumSize = maximumSize;
            return this;
        }

        /**
         * Sets the maximum total size in bytes of the cached arrays, each weighted as 8 bytes per value.
         *
         * @param maximumWeight the maximum weight in bytes
         * @return this builder
         */
        public Builder maximumWeight(long maximumWeight) {
            if (maximumWeight <= 0) {
                throw new IllegalArgumentException("Maximum weight must be positive: " + maximumWeight);
            }
            this.maximumWeight = maximumWeight;
            return this;
        }

        /**
         * Expires entries that have not been read for the given duration.
         *
         * @param duration the idle duration
         * @param unit the duration unit
         * @return this builder
         */
        public Builder expireAfterAccess(long duration, TimeUnit unit) {
            if (duration <= 0) {
                throw new IllegalArgumentException("Duration must be positive: " + duration);
            }
            this.expireAfterAccessDuration = duration;
            this.expireAfterAccessUnit = Objects.requireNonNull(unit, "Time unit cannot be null");
            return this;
        }

        /**
         * Uses soft references for the cached arrays.
         *
         * @return this builder
         */
        public Builder softValues() {
            this.softValues = true;
            return this;
        }

        /**
         * Builds the CachingArrayStore.
         *
         * @return a new, closed CachingArrayStore
         * @throws IllegalStateException if both a maximum size and a maximum weight are set
         */
        public CachingArrayStore build() {
            if (maximumSize > 0 && maximumWeight > 0) {
                throw new IllegalStateException("Cannot set both maximumSize and maximumWeight");
            }
            Caffeine<Object, Object> builder = Caffeine.newBuilder().recordStats();
            if (maximumSize > 0) {
                builder.maximumSize(maximumSize);
            } else if (maximumWeight > 0) {
                builder.maximumWeight(maximumWeight)
                        .weigher((SliceKey key, NdArray value) -> (int) Math.min(
                                Integer.MAX_VALUE, (long) value.size() * Double.BYTES));
            } else {
                softValues = true;
            }
            if (softValues) {
                builder.softValues();
            }
            if (expireAfterAccessDuration > 0) {
                builder.expireAfterAccess(expireAfterAccessDuration, expireAfterAccessUnit);
            }
            Cache<SliceKey, NdArray> cache = castBuilder(builder).build();
            return new CachingArrayStore(delegate, cache);
        }

        @SuppressWarnings("unchecked")
        private static Caffeine<SliceKey, NdArray> castBuilder(Caffeine<?, ?> builder) {
            return (Caffeine<SliceKey, NdArray>) builder;
        }
    }
}
