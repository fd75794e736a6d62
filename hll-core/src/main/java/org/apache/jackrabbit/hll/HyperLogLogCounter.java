/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.hll;

import java.io.Closeable;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.collect.Sets;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import org.apache.jackrabbit.hll.batch.FlushErrorDispatcher;
import org.apache.jackrabbit.hll.batch.FlushErrorListener;
import org.apache.jackrabbit.hll.batch.WriteBatcher;
import org.apache.jackrabbit.hll.sketch.HashAssigner;
import org.apache.jackrabbit.hll.sketch.HyperLogLogEstimator;
import org.apache.jackrabbit.hll.sketch.RegisterArray;
import org.apache.jackrabbit.hll.sketch.SketchAlgebra;
import org.apache.jackrabbit.hll.store.RegisterStore;
import org.apache.jackrabbit.hll.store.RegisterStoreException;
import org.apache.jackrabbit.hll.util.SystemPropertySupplier;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Estimates the number of distinct values added to named sets. Each set is a
 * HyperLogLog sketch of {@value RegisterArray#SIZE} registers persisted in a
 * {@link RegisterStore}.
 * <p>
 * Values added with {@link #add(String, String)} are written asynchronously
 * (see {@link WriteBatcher}). Write failures are not thrown but reported to
 * the listeners registered with {@link #addErrorListener(FlushErrorListener)}.
 * Read failures of the count methods are thrown as
 * {@link RegisterStoreException}.
 * <p>
 * Instances are created with a {@link Builder}:
 * <pre>
 * HyperLogLogCounter counter = new HyperLogLogCounter.Builder()
 *         .setRegisterStore(store)
 *         .setFlushInterval(500)
 *         .build();
 * </pre>
 */
public class HyperLogLogCounter implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(HyperLogLogCounter.class);

    /**
     * The default interval between background flushes, in milliseconds.
     */
    static final int DEFAULT_FLUSH_INTERVAL = SystemPropertySupplier
            .create("hll.flushInterval", 1000).loggingTo(LOG).validateWith(v -> v > 0).get();

    static final boolean DEFAULT_IMMEDIATE_FLUSH = SystemPropertySupplier
            .create("hll.immediateFlush", false).loggingTo(LOG).get();

    /**
     * Number of threads writing keys of a flush concurrently.
     */
    static final int DEFAULT_FLUSH_THREADS = SystemPropertySupplier
            .create("hll.flushThreads", 4).loggingTo(LOG).validateWith(v -> v > 0).get();

    /**
     * How long {@link #close()} waits for the final flush to complete.
     */
    static final int DEFAULT_CLOSE_TIMEOUT_SECONDS = SystemPropertySupplier
            .create("hll.closeTimeoutSeconds", 60).loggingTo(LOG).validateWith(v -> v > 0).get();

    private final RegisterStore store;

    private final FlushErrorDispatcher errorDispatcher;

    private final WriteBatcher batcher;

    private final AtomicBoolean closed = new AtomicBoolean();

    HyperLogLogCounter(Builder builder) {
        this.store = checkNotNull(builder.store, "register store not set");
        HashAssigner hashAssigner = new HashAssigner(builder.hashFunction);
        this.errorDispatcher = new FlushErrorDispatcher();
        this.batcher = new WriteBatcher(store, hashAssigner, errorDispatcher,
                builder.flushInterval, builder.immediateFlush,
                builder.flushThreads, builder.closeTimeoutSeconds);
        LOG.info("Initialized HyperLogLogCounter on {} with flushInterval: {} ms, immediateFlush: {}",
                store, builder.flushInterval, builder.immediateFlush);
    }

    /**
     * Adds a value to the set with the given key. Never fails because of the
     * store, write failures go to the error listeners.
     *
     * @param key the key of the set.
     * @param value the value.
     * @throws IllegalStateException if this counter is closed.
     */
    public void add(@NotNull String key, @NotNull String value) {
        checkOpen();
        batcher.add(key, value);
    }

    /**
     * @param key the key of the set.
     * @return the estimated number of distinct values written for the key,
     *          zero if nothing was written yet.
     * @throws RegisterStoreException if the store cannot be read.
     */
    public long count(@NotNull String key) {
        checkNotNull(key);
        checkOpen();
        RegisterArray registers = store.fetchOne(key);
        if (registers == null) {
            return 0;
        }
        return HyperLogLogEstimator.estimate(registers);
    }

    /**
     * Estimates the size of the union of the given sets. Keys that do not
     * exist are ignored.
     *
     * @param keys the keys of the sets.
     * @return the estimate, zero if none of the keys exist.
     * @throws RegisterStoreException if the store cannot be read.
     */
    public long countUnion(@NotNull Collection<String> keys) {
        checkOpen();
        Set<String> distinct = distinctKeys(keys);
        if (distinct.isEmpty()) {
            return 0;
        }
        Map<String, RegisterArray> found = store.fetchMany(distinct);
        return SketchAlgebra.union(found.values());
    }

    /**
     * Estimates the size of the intersection of the given sets as
     * {@code |union - sum of the individual estimates|}. This is exact
     * inclusion-exclusion for two keys only; for three or more keys the
     * result is a rough approximation.
     *
     * @param keys the keys of the sets.
     * @return the estimate, zero if any of the keys does not exist.
     * @throws RegisterStoreException if the store cannot be read.
     */
    public long countIntersection(@NotNull Collection<String> keys) {
        checkOpen();
        Set<String> distinct = distinctKeys(keys);
        if (distinct.isEmpty()) {
            return 0;
        }
        Map<String, RegisterArray> found = store.fetchMany(distinct);
        return SketchAlgebra.intersection(found.values(), distinct.size());
    }

    /**
     * Writes all pending values and waits for the writes to complete.
     */
    public void flush() {
        checkOpen();
        batcher.flush();
    }

    /**
     * Registers a listener for write failures.
     *
     * @return a {@code Closeable} that unregisters the listener again.
     */
    @NotNull
    public Closeable addErrorListener(@NotNull FlushErrorListener listener) {
        return errorDispatcher.addListener(listener);
    }

    @NotNull
    public RegisterStore getRegisterStore() {
        return store;
    }

    /**
     * Stops background flushing, writes pending values and waits for the
     * write to complete. The store itself is not closed.
     */
    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        batcher.close();
        errorDispatcher.stop();
        LOG.info("Closed HyperLogLogCounter on {}", store);
    }

    private void checkOpen() {
        checkState(!closed.get(), "HyperLogLogCounter is closed");
    }

    private static Set<String> distinctKeys(Collection<String> keys) {
        checkNotNull(keys);
        for (String key : keys) {
            checkArgument(key != null, "null key in %s", keys);
        }
        return Sets.newLinkedHashSet(keys);
    }

    /**
     * A builder for a {@link HyperLogLogCounter}.
     */
    public static class Builder {

        private RegisterStore store;
        private HashFunction hashFunction = Hashing.sha256();
        private int flushInterval = DEFAULT_FLUSH_INTERVAL;
        private boolean immediateFlush = DEFAULT_IMMEDIATE_FLUSH;
        private int flushThreads = DEFAULT_FLUSH_THREADS;
        private int closeTimeoutSeconds = DEFAULT_CLOSE_TIMEOUT_SECONDS;

        public Builder() {
        }

        /**
         * Set the store the sketches are persisted in.
         *
         * @param store the store
         * @return this
         */
        public Builder setRegisterStore(@NotNull RegisterStore store) {
            this.store = store;
            return this;
        }

        @NotNull
        public RegisterStore getRegisterStore() {
            return store;
        }

        /**
         * Set the hash function. It must produce at least 64 bits. Sketches
         * written with different hash functions must not be combined.
         *
         * @param hashFunction the hash function, SHA-256 by default
         * @return this
         */
        public Builder setHashFunction(@NotNull HashFunction hashFunction) {
            this.hashFunction = hashFunction;
            return this;
        }

        public HashFunction getHashFunction() {
            return hashFunction;
        }

        /**
         * Set the interval between background flushes.
         *
         * @param flushInterval in milliseconds, must be positive
         * @return this
         */
        public Builder setFlushInterval(int flushInterval) {
            this.flushInterval = flushInterval;
            return this;
        }

        public int getFlushInterval() {
            return flushInterval;
        }

        /**
         * Set whether every {@code add} writes to the store before it returns.
         * There is no background flush in this mode.
         *
         * @param immediateFlush whether to flush on every add
         * @return this
         */
        public Builder setImmediateFlush(boolean immediateFlush) {
            this.immediateFlush = immediateFlush;
            return this;
        }

        public boolean isImmediateFlush() {
            return immediateFlush;
        }

        public Builder setFlushThreads(int flushThreads) {
            this.flushThreads = flushThreads;
            return this;
        }

        public Builder setCloseTimeoutSeconds(int closeTimeoutSeconds) {
            this.closeTimeoutSeconds = closeTimeoutSeconds;
            return this;
        }

        /**
         * Open the counter.
         *
         * @return the counter
         * @throws IllegalArgumentException if the configuration is invalid
         * @throws NullPointerException if no store or hash function is set
         */
        public HyperLogLogCounter build() {
            checkNotNull(store, "register store not set");
            checkNotNull(hashFunction, "hash function not set");
            checkArgument(flushInterval > 0, "flushInterval must be positive: %s", flushInterval);
            checkArgument(flushThreads > 0, "flushThreads must be positive: %s", flushThreads);
            checkArgument(closeTimeoutSeconds > 0,
                    "closeTimeoutSeconds must be positive: %s", closeTimeoutSeconds);
            checkArgument(hashFunction.bits() >= 64,
                    "hash function must produce at least 64 bits: %s", hashFunction);
            return new HyperLogLogCounter(this);
        }
    }
}
