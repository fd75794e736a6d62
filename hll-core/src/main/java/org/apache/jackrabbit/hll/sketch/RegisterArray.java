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

import java.util.Arrays;
import java.util.List;

import com.google.common.primitives.Ints;

import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The sketch of a single key: {@value #SIZE} registers, each holding the
 * highest rank observed for its bucket, or zero if the bucket was never
 * observed.
 * <p>
 * Registers only ever grow. Merging is done by taking the maximum of each
 * register, which makes it commutative, associative and idempotent.
 * <p>
 * Instances are not thread-safe.
 */
public final class RegisterArray {

    /**
     * The number of registers (m).
     */
    public static final int SIZE = 1 << HashAssigner.BUCKET_BITS;

    /**
     * The highest rank a register can hold.
     */
    public static final int MAX_RANK = 32;

    private final byte[] registers;

    private RegisterArray(byte[] registers) {
        this.registers = registers;
    }

    /**
     * @return a new array with all registers unobserved.
     */
    @NotNull
    public static RegisterArray empty() {
        return new RegisterArray(new byte[SIZE]);
    }

    /**
     * Reads registers as persisted by a store. {@code null} entries are
     * treated as unobserved.
     *
     * @param values exactly {@link #SIZE} values in {@code [0, MAX_RANK]}.
     * @return the register array.
     * @throws IllegalArgumentException if the length or a value is invalid.
     */
    @NotNull
    public static RegisterArray fromList(@NotNull List<? extends Number> values) {
        checkNotNull(values);
        checkArgument(values.size() == SIZE,
                "expected %s registers, got %s", SIZE, values.size());
        byte[] registers = new byte[SIZE];
        int i = 0;
        for (Number n : values) {
            if (n != null) {
                int rank = n.intValue();
                checkArgument(rank >= 0 && rank <= MAX_RANK,
                        "register %s out of range: %s", i, rank);
                registers[i] = (byte) rank;
            }
            i++;
        }
        return new RegisterArray(registers);
    }

    /**
     * @return the registers as a list of integers, the form stores persist.
     */
    @NotNull
    public List<Integer> toList() {
        int[] values = new int[SIZE];
        for (int i = 0; i < SIZE; i++) {
            values[i] = registers[i];
        }
        return Ints.asList(values);
    }

    public int get(int bucket) {
        checkElementIndex(bucket, SIZE);
        return registers[bucket];
    }

    /**
     * Raises the register at {@code bucket} to {@code rank} unless it
     * already holds a higher rank.
     *
     * @return {@code true} if the register changed.
     */
    public boolean merge(int bucket, int rank) {
        checkElementIndex(bucket, SIZE);
        checkArgument(rank >= 0 && rank <= MAX_RANK, "rank out of range: %s", rank);
        if (registers[bucket] < rank) {
            registers[bucket] = (byte) rank;
            return true;
        }
        return false;
    }

    public boolean merge(@NotNull RegisterAssignment assignment) {
        return merge(assignment.getBucket(), assignment.getRank());
    }

    /**
     * Merges all registers of {@code other} into this array.
     */
    public void mergeAll(@NotNull RegisterArray other) {
        for (int i = 0; i < SIZE; i++) {
            if (registers[i] < other.registers[i]) {
                registers[i] = other.registers[i];
            }
        }
    }

    /**
     * @return a new array with the register-wise maximum of {@code a} and {@code b}.
     */
    @NotNull
    public static RegisterArray merge(@NotNull RegisterArray a, @NotNull RegisterArray b) {
        RegisterArray result = a.copy();
        result.mergeAll(b);
        return result;
    }

    /**
     * @return the number of registers still at zero (V).
     */
    public int getUnobservedCount() {
        int count = 0;
        for (byte r : registers) {
            if (r == 0) {
                count++;
            }
        }
        return count;
    }

    public boolean isEmpty() {
        return getUnobservedCount() == SIZE;
    }

    @NotNull
    public RegisterArray copy() {
        return new RegisterArray(registers.clone());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RegisterArray)) {
            return false;
        }
        return Arrays.equals(registers, ((RegisterArray) obj).registers);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(registers);
    }

    @Override
    public String toString() {
        int max = 0;
        for (byte r : registers) {
            max = Math.max(max, r);
        }
        return "RegisterArray[observed=" + (SIZE - getUnobservedCount()) + ", max=" + max + "]";
    }
}
