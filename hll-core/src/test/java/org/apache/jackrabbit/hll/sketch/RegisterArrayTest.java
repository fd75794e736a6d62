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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class RegisterArrayTest {

    @Test
    public void empty() {
        RegisterArray registers = RegisterArray.empty();
        assertEquals(RegisterArray.SIZE, registers.getUnobservedCount());
        assertTrue(registers.isEmpty());
        assertEquals(16384, registers.toList().size());
        assertEquals(0, (int) registers.toList().get(42));
    }

    @Test
    public void mergeKeepsMaximum() {
        RegisterArray registers = RegisterArray.empty();
        assertTrue(registers.merge(7, 3));
        assertFalse(registers.merge(7, 2));
        assertFalse(registers.merge(7, 3));
        assertEquals(3, registers.get(7));
        assertTrue(registers.merge(new RegisterAssignment(7, 5)));
        assertEquals(5, registers.get(7));
        assertEquals(RegisterArray.SIZE - 1, registers.getUnobservedCount());
    }

    @Test
    public void mergeArrays() {
        RegisterArray a = RegisterArray.empty();
        a.merge(0, 4);
        a.merge(1, 1);
        RegisterArray b = RegisterArray.empty();
        b.merge(1, 6);
        b.merge(2, 2);

        RegisterArray ab = RegisterArray.merge(a, b);
        assertEquals(4, ab.get(0));
        assertEquals(6, ab.get(1));
        assertEquals(2, ab.get(2));
        // inputs are unchanged
        assertEquals(1, a.get(1));
        assertEquals(0, b.get(0));
    }

    @Test
    public void mergeIsCommutativeAssociativeIdempotent() {
        RegisterArray a = sketch(0, 100);
        RegisterArray b = sketch(50, 150);
        RegisterArray c = sketch(120, 300);

        assertEquals(RegisterArray.merge(a, b), RegisterArray.merge(b, a));
        assertEquals(RegisterArray.merge(RegisterArray.merge(a, b), c),
                RegisterArray.merge(a, RegisterArray.merge(b, c)));
        assertEquals(a, RegisterArray.merge(a, a));
    }

    @Test
    public void listRoundTripWithNulls() {
        List<Integer> values = new ArrayList<Integer>(Collections.nCopies(RegisterArray.SIZE, (Integer) null));
        values.set(3, 7);
        values.set(RegisterArray.SIZE - 1, 32);
        RegisterArray registers = RegisterArray.fromList(values);
        assertEquals(7, registers.get(3));
        assertEquals(32, registers.get(RegisterArray.SIZE - 1));
        assertEquals(0, registers.get(0));
        assertEquals(registers, RegisterArray.fromList(registers.toList()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromListWrongSize() {
        RegisterArray.fromList(Collections.nCopies(100, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromListOutOfRange() {
        List<Integer> values = new ArrayList<Integer>(Collections.nCopies(RegisterArray.SIZE, 0));
        values.set(10, 33);
        RegisterArray.fromList(values);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void bucketOutOfRange() {
        RegisterArray.empty().merge(RegisterArray.SIZE, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rankOutOfRange() {
        RegisterArray.empty().merge(0, 33);
    }

    @Test
    public void copyIsIndependent() {
        RegisterArray a = sketch(0, 10);
        RegisterArray copy = a.copy();
        assertEquals(a, copy);
        copy.merge(0, 32);
        assertNotEquals(a, copy);
    }

    private static RegisterArray sketch(int from, int to) {
        HashAssigner assigner = new HashAssigner();
        RegisterArray registers = RegisterArray.empty();
        for (int i = from; i < to; i++) {
            registers.merge(assigner.assign(String.valueOf(i)));
        }
        return registers;
    }
}
