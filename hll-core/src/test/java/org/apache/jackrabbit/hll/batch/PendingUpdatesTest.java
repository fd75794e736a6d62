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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PendingUpdatesTest {

    @Test
    public void keepsHighestRank() {
        PendingUpdates pending = new PendingUpdates();
        assertTrue(pending.put("a", 1, 3));
        assertFalse(pending.put("a", 1, 2));
        assertFalse(pending.put("a", 1, 3));
        assertTrue(pending.put("a", 1, 4));
        assertTrue(pending.put("b", 1, 1));

        Map<String, Map<Integer, Integer>> drained = pending.drain();
        assertEquals(2, drained.size());
        assertEquals(Collections.singletonMap(1, 4), drained.get("a"));
        assertEquals(Collections.singletonMap(1, 1), drained.get("b"));
    }

    @Test
    public void drainClears() {
        PendingUpdates pending = new PendingUpdates();
        assertTrue(pending.isEmpty());
        assertTrue(pending.drain().isEmpty());
        pending.put("a", 0, 1);
        assertFalse(pending.isEmpty());
        assertEquals(1, pending.drain().size());
        assertTrue(pending.isEmpty());
        assertTrue(pending.drain().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroRank() {
        new PendingUpdates().put("a", 0, 0);
    }

    /**
     * Concurrent puts and drains: every put ends up in exactly one drain.
     */
    @Test
    public void concurrentPutAndDrain() throws Exception {
        final PendingUpdates pending = new PendingUpdates();
        final int threads = 4;
        final int putsPerThread = 20000;
        final AtomicBoolean done = new AtomicBoolean();
        final List<Map<String, Map<Integer, Integer>>> drains =
                Collections.synchronizedList(new ArrayList<Map<String, Map<Integer, Integer>>>());
        final List<Throwable> exceptions = Collections.synchronizedList(new ArrayList<Throwable>());

        Thread drainer = new Thread(new Runnable() {
            @Override
            public void run() {
                while (!done.get()) {
                    drains.add(pending.drain());
                }
            }
        });
        drainer.start();

        List<Thread> writers = new ArrayList<Thread>();
        for (int t = 0; t < threads; t++) {
            final String key = "key-" + t;
            writers.add(new Thread(new Runnable() {
                @Override
                public void run() {
                    try {
                        // every bucket is put once per key
                        for (int i = 0; i < putsPerThread; i++) {
                            pending.put(key, i, 1);
                        }
                    } catch (Throwable e) {
                        exceptions.add(e);
                    }
                }
            }));
        }
        for (Thread t : writers) {
            t.start();
        }
        for (Thread t : writers) {
            t.join();
        }
        done.set(true);
        drainer.join();
        drains.add(pending.drain());
        assertTrue(exceptions.toString(), exceptions.isEmpty());

        Map<String, Integer> counts = new HashMap<String, Integer>();
        for (Map<String, Map<Integer, Integer>> drain : drains) {
            for (Map.Entry<String, Map<Integer, Integer>> e : drain.entrySet()) {
                Integer c = counts.get(e.getKey());
                counts.put(e.getKey(), (c == null ? 0 : c) + e.getValue().size());
            }
        }
        assertEquals(threads, counts.size());
        for (int t = 0; t < threads; t++) {
            assertEquals(Integer.valueOf(putsPerThread), counts.get("key-" + t));
        }
    }
}
