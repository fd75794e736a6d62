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

import org.jetbrains.annotations.NotNull;

/**
 * Receives the failures of background writes. A failed write of one key does
 * not affect the other keys flushed at the same time.
 */
public interface FlushErrorListener {

    /**
     * Called once per key and failed flush, from a dedicated notification
     * thread. Exceptions thrown by this method are logged and otherwise
     * ignored.
     *
     * @param key the key whose pending updates could not be written.
     * @param error the underlying error.
     */
    void flushFailed(@NotNull String key, @NotNull Exception error);
}
