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

import org.jetbrains.annotations.NotNull;

/**
 * Cardinality estimation for a {@link RegisterArray}, as described in
 * "HyperLogLog: the analysis of a near-optimal cardinality estimation
 * algorithm" (Flajolet et al., 2007).
 * <p>
 * Small cardinalities use linear counting over the unobserved registers:
 * while some registers are still zero and the raw estimate is at most
 * {@value #LINEAR_COUNTING_FACTOR}m, the raw HyperLogLog estimate has a large
 * relative error.
 */
public final class HyperLogLogEstimator {

    static final int LINEAR_COUNTING_FACTOR = 3;

    private static final int M = RegisterArray.SIZE;

    private static final double ALPHA_M2 = alpha(M) * M * M;

    private HyperLogLogEstimator() {
    }

    /**
     * The bias correction constant for {@code m} registers.
     */
    public static double alpha(int m) {
        if (m <= 16) {
            return 0.673;
        } else if (m <= 32) {
            return 0.697;
        } else if (m <= 64) {
            return 0.709;
        }
        return 0.7213 / (1 + 1.079 / m);
    }

    /**
     * Estimates the number of distinct values merged into {@code registers}.
     * Must not be called for a key that was never written, callers return
     * zero for those directly.
     *
     * @param registers the sketch.
     * @return the estimate, never negative.
     */
    public static long estimate(@NotNull RegisterArray registers) {
        long raw = rawEstimate(registers);
        int unobserved = registers.getUnobservedCount();
        if (unobserved > 0 && raw <= (long) LINEAR_COUNTING_FACTOR * M) {
            return linearCountingEstimate(unobserved);
        }
        return raw;
    }

    static long rawEstimate(@NotNull RegisterArray registers) {
        double z = 0;
        for (int i = 0; i < M; i++) {
            z += 1.0 / (1L << registers.get(i));
        }
        return Math.round(ALPHA_M2 / z);
    }

    static long linearCountingEstimate(int unobserved) {
        // unobserved > 0, otherwise the log is -Infinity
        return Math.round(-M * Math.log((double) unobserved / M));
    }
}
