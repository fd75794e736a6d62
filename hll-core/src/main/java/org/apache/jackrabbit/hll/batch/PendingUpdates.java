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

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Keeps track of the highest rank per bucket and key added since the last
 * {@link #drain()}. To be persisted later by a flush.
 * <p>
 * Any number of threads may call {@link #put(String, int, int)} concurrently.
 * {@link #drain()} takes all pending updates in one step: every put either
 * ends up in the returned snapshot or remains for the next drain.
 */
class PendingUpdates {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Key to bucket to rank. Guarded by {@link #lock}: the reference is only
     * replaced while holding the write lock.
     */
    private ConcurrentMap<String, ConcurrentMap<Integer, Integer>> map = newMap();

    /**
     * Puts a rank for the given key and bucket. The rank is only put if there
     * is no rank pending for the bucket or the pending rank is lower.
     *
     * @param key the key of the sketch.
     * @param bucket the register index.
     * @param rank the observed rank.
     * @return {@code true} if the pending rank changed.
     */
    boolean put(@NotNull String key, int bucket, int rank) {
        checkNotNull(key);
        checkArgument(rank > 0, "rank must be positive: %s", rank);
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            ConcurrentMap<Integer, Integer> buckets = map.computeIfAbsent(
                    key, k -> new ConcurrentHashMap<Integer, Integer>());
            for (;;) {
                Integer previous = buckets.get(bucket);
                if (previous == null) {
                    if (buckets.putIfAbsent(bucket, rank) == null) {
                        return true;
                    }
                } else if (previous < rank) {
                    if (buckets.replace(bucket, previous, rank)) {
                        return true;
                    }
                } else {
                    // an equal or higher rank is already pending
                    return false;
                }
            }
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Removes and returns all pending updates.
     *
     * @return key to (bucket to rank), empty if nothing is pending.
     */
    @NotNull
    Map<String, Map<Integer, Integer>> drain() {
        ConcurrentMap<String, ConcurrentMap<Integer, Integer>> snapshot;
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            if (map.isEmpty()) {
                return Collections.emptyMap();
            }
            snapshot = map;
            map = newMap();
        } finally {
            writeLock.unlock();
        }
        return Collections.<String, Map<Integer, Integer>>unmodifiableMap(snapshot);
    }

    boolean isEmpty() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return map.isEmpty();
        } finally {
            readLock.unlock();
        }
    }

    private static ConcurrentMap<String, ConcurrentMap<Integer, Integer>> newMap() {
        return new ConcurrentHashMap<String, ConcurrentMap<Integer, Integer>>();
    }
}
