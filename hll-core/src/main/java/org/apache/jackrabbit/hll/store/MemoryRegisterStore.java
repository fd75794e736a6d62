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
package org.apache.jackrabbit.hll.store;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.jackrabbit.hll.sketch.RegisterArray;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Emulates a document store that supports per-field max updates. Register
 * arrays are copied on the way in and out, so callers never share state with
 * the store.
 */
public class MemoryRegisterStore implements RegisterStore {

    private final ConcurrentSkipListMap<String, RegisterArray> sketches =
            new ConcurrentSkipListMap<String, RegisterArray>();

    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    @Override
    public long maxUpdate(@NotNull String key, @NotNull Map<Integer, Integer> ranks) {
        checkNotNull(key);
        checkArgument(!ranks.isEmpty(), "no registers to update for %s", key);
        Lock lock = rwLock.writeLock();
        lock.lock();
        try {
            RegisterArray doc = sketches.get(key);
            if (doc == null) {
                return 0;
            }
            // apply to a copy so a bad entry leaves the document untouched
            RegisterArray updated = doc.copy();
            try {
                for (Map.Entry<Integer, Integer> e : ranks.entrySet()) {
                    updated.merge(e.getKey(), e.getValue());
                }
            } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                throw new RegisterStoreException("Invalid register update for "
                        + key + ": " + e.getMessage(), e);
            }
            sketches.put(key, updated);
            return 1;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void ensureExists(@NotNull String key, @NotNull RegisterArray empty) {
        checkNotNull(key);
        Lock lock = rwLock.writeLock();
        lock.lock();
        try {
            sketches.putIfAbsent(key, empty.copy());
        } finally {
            lock.unlock();
        }
    }

    @Nullable
    @Override
    public RegisterArray fetchOne(@NotNull String key) {
        Lock lock = rwLock.readLock();
        lock.lock();
        try {
            RegisterArray doc = sketches.get(key);
            return doc == null ? null : doc.copy();
        } finally {
            lock.unlock();
        }
    }

    @NotNull
    @Override
    public Map<String, RegisterArray> fetchMany(@NotNull Collection<String> keys) {
        Lock lock = rwLock.readLock();
        lock.lock();
        try {
            Map<String, RegisterArray> result = new LinkedHashMap<String, RegisterArray>();
            for (String key : keys) {
                RegisterArray doc = sketches.get(key);
                if (doc != null) {
                    result.put(key, doc.copy());
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the document for the given key. Does nothing if there is none.
     */
    public void remove(@NotNull String key) {
        Lock lock = rwLock.writeLock();
        lock.lock();
        try {
            sketches.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return sketches.size();
    }

    @Override
    public String toString() {
        StringBuilder buff = new StringBuilder();
        buff.append("Sketches:\n");
        for (Map.Entry<String, RegisterArray> e : sketches.entrySet()) {
            buff.append("Key: ").append(e.getKey()).append(' ')
                    .append(e.getValue()).append('\n');
        }
        return buff.toString();
    }
}
