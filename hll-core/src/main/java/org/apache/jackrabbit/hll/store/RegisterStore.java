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
import java.util.Map;

import org.apache.jackrabbit.hll.sketch.RegisterArray;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The backend storage for register arrays, one document per key.
 * <p>
 * Implementations must apply register updates atomically per document: a
 * register is only ever raised, never lowered, regardless of the order or
 * number of times the same update arrives. No atomicity across keys is
 * required.
 * <p>
 * All methods report failures with a {@link RegisterStoreException}.
 */
public interface RegisterStore {

    /**
     * Raises the listed registers of the document for {@code key}. Each
     * register is set to the given rank only if the rank is higher than the
     * current value.
     *
     * @param key the key.
     * @param ranks bucket to rank, must not be empty.
     * @return the number of documents matched: zero if there is no document
     *          for {@code key}, one otherwise.
     * @throws RegisterStoreException if the update fails.
     */
    long maxUpdate(@NotNull String key, @NotNull Map<Integer, Integer> ranks)
            throws RegisterStoreException;

    /**
     * Creates the document for {@code key} with the given registers unless a
     * document already exists. Does nothing otherwise.
     *
     * @param key the key.
     * @param empty the initial registers, usually {@link RegisterArray#empty()}.
     * @throws RegisterStoreException if the insert fails.
     */
    void ensureExists(@NotNull String key, @NotNull RegisterArray empty)
            throws RegisterStoreException;

    /**
     * @param key the key.
     * @return the registers for {@code key} or {@code null} if there is no
     *          document for it.
     * @throws RegisterStoreException if the read fails.
     */
    @Nullable
    RegisterArray fetchOne(@NotNull String key) throws RegisterStoreException;

    /**
     * @param keys the keys.
     * @return the registers of the keys that exist. Missing keys are not
     *          contained in the map.
     * @throws RegisterStoreException if the read fails.
     */
    @NotNull
    Map<String, RegisterArray> fetchMany(@NotNull Collection<String> keys)
            throws RegisterStoreException;
}
