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

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class HashAssignerTest {

    @Test
    public void bucketFromTopBitsOfFirstWord() {
        assertEquals(0, assign(0x00, 0x00, 0x00, 0x00, 0x80, 0, 0, 0).getBucket());
        assertEquals(1, assign(0x00, 0x04, 0x00, 0x00, 0x80, 0, 0, 0).getBucket());
        // the lower 18 bits are ignored
        assertEquals(1, assign(0x00, 0x07, 0xff, 0xff, 0x80, 0, 0, 0).getBucket());
        assertEquals(16383, assign(0xff, 0xff, 0xff, 0xff, 0x80, 0, 0, 0).getBucket());
    }

    @Test
    public void rankFromLeadingZerosOfSecondWord() {
        assertEquals(1, assign(0, 0, 0, 0, 0x80, 0x00, 0x00, 0x00).getRank());
        assertEquals(2, assign(0, 0, 0, 0, 0x40, 0x00, 0x00, 0x00).getRank());
        assertEquals(16, assign(0, 0, 0, 0, 0x00, 0x01, 0x00, 0x00).getRank());
        assertEquals(32, assign(0, 0, 0, 0, 0x00, 0x00, 0x00, 0x01).getRank());
    }

    @Test
    public void zeroSecondWordIsClamped() {
        RegisterAssignment a = assign(0, 0, 0, 0, 0, 0, 0, 0);
        assertEquals(0, a.getBucket());
        assertEquals(RegisterArray.MAX_RANK, a.getRank());
    }

    @Test
    public void bytesAfterSecondWordAreIgnored() {
        assertEquals(assign(1, 2, 3, 4, 5, 6, 7, 8),
                assign(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12));
    }

    @Test(expected = IllegalArgumentException.class)
    public void shortDigest() {
        assign(1, 2, 3, 4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void shortHashFunction() {
        new HashAssigner(Hashing.crc32());
    }

    @Test
    public void sha256ByDefault() {
        HashAssigner assigner = new HashAssigner();
        // sha256("hello!") starts with ce06092f b948d9ff
        assertEquals(new RegisterAssignment(0xce06092f >>> 18, 1), assigner.assign("hello!"));
        assertEquals(new RegisterAssignment(13185, 1), assigner.assign("hello!"));
        assertEquals(Hashing.sha256(), assigner.getHashFunction());
    }

    @Test
    public void deterministic() {
        HashAssigner a = new HashAssigner();
        HashAssigner b = new HashAssigner();
        for (int i = 0; i < 1000; i++) {
            String value = "value-" + i;
            assertEquals(a.assign(value), b.assign(value));
        }
    }

    @Test
    public void pluggableHashFunction() {
        HashAssigner sha = new HashAssigner();
        HashAssigner sip = new HashAssigner(Hashing.sipHash24());
        int differences = 0;
        for (int i = 0; i < 100; i++) {
            RegisterAssignment a = sip.assign(String.valueOf(i));
            assertTrue(a.getBucket() >= 0 && a.getBucket() < RegisterArray.SIZE);
            assertTrue(a.getRank() >= 1 && a.getRank() <= RegisterArray.MAX_RANK);
            if (!a.equals(sha.assign(String.valueOf(i)))) {
                differences++;
            }
        }
        assertNotEquals(0, differences);
    }

    private static RegisterAssignment assign(int... bytes) {
        byte[] digest = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            digest[i] = (byte) bytes[i];
        }
        return HashAssigner.assign(HashCode.fromBytes(digest));
    }
}
