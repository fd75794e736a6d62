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
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.jackrabbit.hll.sketch.RegisterArray;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link MemoryRegisterStore} that records calls and fails on request.
 */
public class FailingRegisterStore extends MemoryRegisterStore {

    private final Set<String> failingWrites = ConcurrentHashMap.newKeySet();

    private final List<String> calls = new CopyOnWriteArrayList<String>();

    private volatile boolean failReads;

    public void failWritesFor(String key) {
        failingWrites.add(key);
    }

    public void failReads(boolean fail) {
        this.failReads = fail;
    }

    /**
     * @return the write calls in the form {@code method:key}.
     */
    public List<String> getCalls() {
        return calls;
    }

    @Override
    public long maxUpdate(@NotNull String key, @NotNull Map<Integer, Integer> ranks) {
        calls.add("maxUpdate:" + key);
        if (failingWrites.contains(key)) {
            throw new RegisterStoreException("maxUpdate failed for " + key);
        }
        return super.maxUpdate(key, ranks);
    }

    @Override
    public void ensureExists(@NotNull String key, @NotNull RegisterArray empty) {
        calls.add("ensureExists:" + key);
        super.ensureExists(key, empty);
    }

    @Nullable
    @Override
    public RegisterArray fetchOne(@NotNull String key) {
        if (failReads) {
            throw new RegisterStoreException("fetchOne failed for " + key);
        }
        return super.fetchOne(key);
    }

    @NotNull
    @Override
    public Map<String, RegisterArray> fetchMany(@NotNull Collection<String> keys) {
        if (failReads) {
            throw new RegisterStoreException("fetchMany failed for " + keys);
        }
        return super.fetchMany(keys);
    }
}
