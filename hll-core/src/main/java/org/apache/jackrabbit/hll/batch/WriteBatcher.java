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
package org.apache.jackrabbit.hll.batch;

import java.io.Closeable;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;

import org.apache.jackrabbit.hll.sketch.HashAssigner;
import org.apache.jackrabbit.hll.sketch.RegisterArray;
import org.apache.jackrabbit.hll.sketch.RegisterAssignment;
import org.apache.jackrabbit.hll.store.RegisterStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Coalesces added values per key in memory and writes them to the
 * {@link RegisterStore} in batches.
 * <p>
 * A flush takes all pending updates at once and writes each key in a
 * separate task. The write of a key first raises the registers of the
 * existing document. If there is no document yet, an empty one is created
 * unless another writer was faster, and the update is repeated. Because
 * registers are only ever raised, duplicate or reordered writes are harmless.
 * <p>
 * Failures are contained per key: they are logged and passed to the
 * {@link FlushErrorDispatcher}, never thrown to the caller of
 * {@link #add(String, String)} or {@link #flush()}.
 * <p>
 * Unless in immediate mode, a background thread flushes every
 * {@code flushInterval} milliseconds. The next wait only starts once the
 * current flush completed, so flushes never overlap.
 * <p>
 * {@link #close()} waits for pending writes at most
 * {@code closeTimeoutSeconds}. Keys whose write did not complete by then are
 * reported to the error dispatcher with a {@link TimeoutException}.
 */
public class WriteBatcher implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(WriteBatcher.class);

    /**
     * How long to wait for a write before checking whether close started.
     */
    private static final long AWAIT_SLICE_MILLIS = 100;

    private final RegisterStore store;

    private final HashAssigner hashAssigner;

    private final FlushErrorDispatcher errorDispatcher;

    private final int flushInterval;

    private final boolean immediateFlush;

    private final long closeTimeoutSeconds;

    private final PendingUpdates pending = new PendingUpdates();

    /**
     * Executes the per key writes of a flush.
     */
    private final ExecutorService executor;

    /**
     * Serializes flushes.
     */
    private final ReentrantLock flushLock = new ReentrantLock();

    /**
     * Adds hold the read lock, close takes the write lock. An add that
     * passed the open check is in the pending updates before close drains
     * them.
     */
    private final ReadWriteLock addLock = new ReentrantReadWriteLock();

    /**
     * The time in milliseconds by which writes must complete, zero while
     * this batcher is open.
     */
    private volatile long closeDeadline;

    /**
     * Whether this instance is closed.
     */
    private final AtomicBoolean isDisposed = new AtomicBoolean();

    private final Thread backgroundThread;

    public WriteBatcher(@NotNull RegisterStore store,
                        @NotNull HashAssigner hashAssigner,
                        @NotNull FlushErrorDispatcher errorDispatcher,
                        int flushInterval,
                        boolean immediateFlush,
                        int flushThreads,
                        long closeTimeoutSeconds) {
        checkArgument(flushInterval > 0, "flushInterval must be positive: %s", flushInterval);
        checkArgument(flushThreads > 0, "flushThreads must be positive: %s", flushThreads);
        checkArgument(closeTimeoutSeconds > 0, "closeTimeoutSeconds must be positive: %s", closeTimeoutSeconds);
        this.store = checkNotNull(store);
        this.hashAssigner = checkNotNull(hashAssigner);
        this.errorDispatcher = checkNotNull(errorDispatcher);
        this.flushInterval = flushInterval;
        this.immediateFlush = immediateFlush;
        this.closeTimeoutSeconds = closeTimeoutSeconds;
        this.executor = Executors.newFixedThreadPool(flushThreads, new ThreadFactoryBuilder()
                .setNameFormat("hll-flush-%d").setDaemon(true).build());
        if (immediateFlush) {
            backgroundThread = null;
        } else {
            backgroundThread = new Thread(
                    new BackgroundFlush(this, isDisposed),
                    "HyperLogLog background flush");
            backgroundThread.setDaemon(true);
            backgroundThread.start();
        }
    }

    /**
     * Adds a value to the sketch of the given key. In immediate mode the
     * value is written before this method returns, otherwise with the next
     * flush.
     *
     * @throws IllegalStateException if this batcher is closed.
     */
    public void add(@NotNull String key, @NotNull String value) {
        checkNotNull(key);
        Lock lock = addLock.readLock();
        lock.lock();
        try {
            checkState(!isDisposed.get(), "WriteBatcher is closed");
            RegisterAssignment assignment = hashAssigner.assign(value);
            pending.put(key, assignment.getBucket(), assignment.getRank());
        } finally {
            lock.unlock();
        }
        if (immediateFlush) {
            runFlush();
        }
    }

    /**
     * Writes all pending updates and waits until the writes completed.
     * Failed writes are reported to the error dispatcher.
     *
     * @throws IllegalStateException if this batcher is closed.
     */
    public void flush() {
        checkState(!isDisposed.get(), "WriteBatcher is closed");
        runFlush();
    }

    public boolean hasPendingUpdates() {
        return !pending.isEmpty();
    }

    public int getFlushInterval() {
        return flushInterval;
    }

    public boolean isImmediateFlush() {
        return immediateFlush;
    }

    /**
     * Stops the background flush, writes the remaining updates and waits for
     * the writes to complete, at most the configured close timeout.
     */
    @Override
    public void close() {
        Lock lock = addLock.writeLock();
        lock.lock();
        try {
            if (isDisposed.getAndSet(true)) {
                return;
            }
        } finally {
            lock.unlock();
        }
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(closeTimeoutSeconds);
        closeDeadline = deadline;
        if (backgroundThread != null) {
            synchronized (isDisposed) {
                isDisposed.notifyAll();
            }
            // a flush in progress completes or times out before the thread ends
            Uninterruptibles.joinUninterruptibly(backgroundThread);
        }
        runFlush();
        executor.shutdown();
        try {
            long remaining = Math.max(0, deadline - System.currentTimeMillis());
            if (!executor.awaitTermination(remaining, TimeUnit.MILLISECONDS)) {
                LOG.warn("Flush executor did not terminate within {} seconds", closeTimeoutSeconds);
            }
        } catch (InterruptedException e) {
            LOG.warn("Interrupted while waiting for flush executor", e);
            Thread.currentThread().interrupt();
        } finally {
            executor.shutdownNow();
        }
        LOG.info("Closed WriteBatcher for {}", store);
    }

    void runFlush() {
        flushLock.lock();
        try {
            Map<String, Map<Integer, Integer>> updates = pending.drain();
            if (updates.isEmpty()) {
                return;
            }
            long start = System.currentTimeMillis();
            List<KeyWrite> writes = new ArrayList<KeyWrite>(updates.size());
            for (Map.Entry<String, Map<Integer, Integer>> e : updates.entrySet()) {
                KeyWrite write = new KeyWrite(e.getKey(), e.getValue());
                try {
                    write.future = executor.submit(write);
                    writes.add(write);
                } catch (RejectedExecutionException ex) {
                    // closed concurrently
                    write.failed(ex);
                }
            }
            for (KeyWrite write : writes) {
                awaitWrite(write);
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug("Flushed {} keys in {} ms", updates.size(),
                        System.currentTimeMillis() - start);
            }
        } finally {
            flushLock.unlock();
        }
    }

    /**
     * Waits for a write until it completes. Once close started, waits at
     * most until the close deadline and reports the key as failed if the
     * write is still outstanding then.
     */
    private void awaitWrite(KeyWrite write) {
        for (;;) {
            long deadline = closeDeadline;
            long timeout = deadline == 0 ? AWAIT_SLICE_MILLIS
                    : Math.max(0, deadline - System.currentTimeMillis());
            try {
                Uninterruptibles.getUninterruptibly(write.future, timeout, TimeUnit.MILLISECONDS);
                return;
            } catch (ExecutionException e) {
                // KeyWrite.run() catches RuntimeException, this is an Error
                LOG.error("Flush task failed", e.getCause());
                return;
            } catch (TimeoutException e) {
                if (deadline != 0) {
                    write.failed(new TimeoutException("Write of " + write.key
                            + " did not complete within " + closeTimeoutSeconds + " seconds"));
                    return;
                }
            }
        }
    }

    private void write(String key, Map<Integer, Integer> ranks) {
        if (store.maxUpdate(key, ranks) == 0) {
            store.ensureExists(key, RegisterArray.empty());
            if (store.maxUpdate(key, ranks) == 0) {
                throw new IllegalStateException("No document for " + key + " after insert");
            }
        }
    }

    /**
     * The write of the pending updates of one key. Its outcome is settled
     * once, either by the write itself or by a timeout on close.
     */
    private final class KeyWrite implements Runnable {

        private final String key;

        private final Map<Integer, Integer> ranks;

        private final AtomicBoolean settled = new AtomicBoolean();

        private Future<?> future;

        KeyWrite(String key, Map<Integer, Integer> ranks) {
            this.key = key;
            this.ranks = ranks;
        }

        @Override
        public void run() {
            try {
                write(key, ranks);
                settled.set(true);
            } catch (RuntimeException e) {
                failed(e);
            }
        }

        void failed(Exception e) {
            if (settled.compareAndSet(false, true)) {
                LOG.warn("Failed to write {} registers of {}: {}", ranks.size(), key, e.toString());
                errorDispatcher.flushFailed(key, e);
            }
        }
    }

    /**
     * A background thread.
     */
    static class BackgroundFlush implements Runnable {
        final WeakReference<WriteBatcher> ref;
        private final AtomicBoolean isDisposed;
        private final int delay;

        BackgroundFlush(WriteBatcher batcher, AtomicBoolean isDisposed) {
            this.ref = new WeakReference<WriteBatcher>(batcher);
            this.delay = batcher.getFlushInterval();
            this.isDisposed = isDisposed;
        }

        @Override
        public void run() {
            while (!isDisposed.get()) {
                synchronized (isDisposed) {
                    try {
                        if (!isDisposed.get()) {
                            isDisposed.wait(delay);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        LOG.warn("Background flush interrupted, stopping");
                        return;
                    }
                }
                if (isDisposed.get()) {
                    // close() does the final flush
                    return;
                }
                WriteBatcher batcher = ref.get();
                if (batcher == null) {
                    return;
                }
                try {
                    batcher.runFlush();
                } catch (RuntimeException e) {
                    LOG.warn("Background flush failed: " + e.toString(), e);
                }
            }
        }
    }
}
