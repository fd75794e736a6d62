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
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Forwards flush failures to the registered {@link FlushErrorListener}s on a
 * background thread. {@link #flushFailed(String, Exception)} never blocks,
 * regardless of the behavior of the listeners, and a listener that throws
 * does not prevent the others from being notified.
 */
public class FlushErrorDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(FlushErrorDispatcher.class);

    private static class FlushError {
        private final String key;
        private final Exception error;
        FlushError(String key, Exception error) {
            this.key = key;
            this.error = error;
        }
    }

    /**
     * Signal for the background thread to stop delivering errors.
     */
    private static final FlushError STOP = new FlushError(null, null);

    private final List<FlushErrorListener> listeners = new CopyOnWriteArrayList<>();

    private final BlockingQueue<FlushError> queue = new LinkedBlockingQueue<>();

    private final Thread thread;

    // guarded by this
    private boolean stopped;

    public FlushErrorDispatcher() {
        this.thread = new Thread(new Runnable() {
            @Override
            public void run() {
                try {
                    while (true) {
                        FlushError e = queue.take();
                        if (e == STOP) {
                            return;
                        }
                        deliver(e);
                    }
                } catch (InterruptedException e) {
                    LOG.warn("Flush error delivery interrupted", e);
                    Thread.currentThread().interrupt();
                }
            }
        }, "HyperLogLog flush error dispatcher");
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Registers a listener.
     *
     * @return a {@code Closeable} that unregisters the listener.
     */
    @NotNull
    public Closeable addListener(@NotNull final FlushErrorListener listener) {
        checkNotNull(listener);
        listeners.add(listener);
        return new Closeable() {
            @Override
            public void close() {
                listeners.remove(listener);
            }
        };
    }

    /**
     * Queues a failure for delivery. Failures reported after {@link #stop()}
     * are only logged.
     *
     * @return {@code true} if the failure will be delivered to the listeners.
     */
    public boolean flushFailed(@NotNull String key, @NotNull Exception error) {
        synchronized (this) {
            if (!stopped) {
                queue.add(new FlushError(key, error));
                return true;
            }
        }
        LOG.warn("Flush error for key {} not delivered, dispatcher is stopped", key, error);
        return false;
    }

    /**
     * Delivers the failures queued so far, then stops the background thread
     * and waits for it to finish.
     */
    public void stop() {
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
            queue.add(STOP);
        }
        try {
            if (thread != Thread.currentThread()) {
                thread.join();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Thread interrupted while joining flush error dispatcher thread.", e);
        }
    }

    private void deliver(FlushError e) {
        if (listeners.isEmpty()) {
            LOG.debug("No listener for flush error of key {}", e.key);
            return;
        }
        for (FlushErrorListener listener : listeners) {
            try {
                listener.flushFailed(e.key, e.error);
            } catch (RuntimeException ex) {
                LOG.error("Flush error listener {} failed for key {}", listener, e.key, ex);
            }
        }
    }
}
