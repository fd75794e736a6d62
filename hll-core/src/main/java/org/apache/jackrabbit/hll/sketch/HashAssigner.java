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
package org.apache.jackrabbit.hll.sketch;

import java.nio.charset.StandardCharsets;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Ints;

import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Maps values to a register of a {@link RegisterArray}.
 * <p>
 * The digest of a value is read as two big-endian 32 bit words. The top
 * {@value #BUCKET_BITS} bits of the first word select the bucket, the number
 * of leading zeros of the second word plus one is the rank. A second word of
 * zero is clamped to {@link RegisterArray#MAX_RANK}.
 */
public class HashAssigner {

    /**
     * Number of bits of the first word used as bucket index.
     */
    static final int BUCKET_BITS = 14;

    private static final int BUCKET_SHIFT = Integer.SIZE - BUCKET_BITS;

    private final HashFunction hashFunction;

    public HashAssigner() {
        this(Hashing.sha256());
    }

    /**
     * @param hashFunction the hash function, must produce at least 64 bits.
     * @throws IllegalArgumentException if the hash function is too short.
     */
    public HashAssigner(@NotNull HashFunction hashFunction) {
        this.hashFunction = checkNotNull(hashFunction);
        checkArgument(hashFunction.bits() >= 64,
                "hash function must produce at least 64 bits, %s produces %s",
                hashFunction, hashFunction.bits());
    }

    @NotNull
    public RegisterAssignment assign(@NotNull String value) {
        checkNotNull(value);
        return assign(hashFunction.hashString(value, StandardCharsets.UTF_8));
    }

    @NotNull
    public static RegisterAssignment assign(@NotNull HashCode hash) {
        byte[] bytes = hash.asBytes();
        checkArgument(bytes.length >= 8, "digest too short: %s bytes", bytes.length);
        int w1 = Ints.fromBytes(bytes[0], bytes[1], bytes[2], bytes[3]);
        int w2 = Ints.fromBytes(bytes[4], bytes[5], bytes[6], bytes[7]);
        int bucket = w1 >>> BUCKET_SHIFT;
        int rank = Math.min(Integer.numberOfLeadingZeros(w2) + 1, RegisterArray.MAX_RANK);
        return new RegisterAssignment(bucket, rank);
    }

    @NotNull
    public HashFunction getHashFunction() {
        return hashFunction;
    }
}
