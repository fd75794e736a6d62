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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements a <code>RegisterStore</code> wrapper and logs all calls.
 */
public class LoggingRegisterStoreWrapper implements RegisterStore {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingRegisterStoreWrapper.class);

    private final RegisterStore store;

    public LoggingRegisterStoreWrapper(@NotNull RegisterStore store) {
        this.store = store;
    }

    @Override
    public long maxUpdate(@NotNull String key, @NotNull Map<Integer, Integer> ranks) {
        try {
            logMethod("maxUpdate", key, ranks.size() + " registers");
            return logResult(store.maxUpdate(key, ranks));
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Override
    public void ensureExists(@NotNull String key, @NotNull RegisterArray empty) {
        try {
            logMethod("ensureExists", key);
            store.ensureExists(key, empty);
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Nullable
    @Override
    public RegisterArray fetchOne(@NotNull String key) {
        try {
            logMethod("fetchOne", key);
            return logResult(store.fetchOne(key));
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @NotNull
    @Override
    public Map<String, RegisterArray> fetchMany(@NotNull Collection<String> keys) {
        try {
            logMethod("fetchMany", keys);
            return logResult(store.fetchMany(keys));
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @NotNull
    public RegisterStore getWrappedStore() {
        return store;
    }

    @Override
    public String toString() {
        return store.toString();
    }

    private static void logMethod(String methodName, Object... args) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        StringBuilder buff = new StringBuilder("store.");
        buff.append(methodName).append('(');
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                buff.append(", ");
            }
            buff.append(args[i]);
        }
        buff.append(");");
        LOG.debug(buff.toString());
    }

    private static void logException(Exception e) {
        LOG.debug("// exception: {}", e.toString());
    }

    private static <T> T logResult(T result) {
        LOG.debug("// {}", result);
        return result;
    }
}
