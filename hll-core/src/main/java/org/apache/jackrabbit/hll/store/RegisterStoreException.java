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

import org.jetbrains.annotations.NotNull;

/**
 * <code>RegisterStoreException</code> is an unchecked exception for errors
 * raised by a {@link RegisterStore}.
 */
public class RegisterStoreException extends RuntimeException {

    private static final long serialVersionUID = 4135594565927443068L;

    public RegisterStoreException(String message) {
        super(message);
    }

    public RegisterStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Converts the given {@code Throwable} into a
     * {@code RegisterStoreException}. If the {@code Throwable} already is a
     * {@code RegisterStoreException} it is returned as is.
     *
     * @param t the throwable to convert.
     * @param msg the message for the new exception.
     * @return a {@code RegisterStoreException}.
     */
    @NotNull
    public static RegisterStoreException convert(@NotNull Throwable t, String msg) {
        if (t instanceof RegisterStoreException) {
            return (RegisterStoreException) t;
        }
        return new RegisterStoreException(msg, t);
    }
}
