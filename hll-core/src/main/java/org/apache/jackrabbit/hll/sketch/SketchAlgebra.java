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

import java.util.Collection;

import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Union and intersection estimates over the sketches of several keys.
 */
public final class SketchAlgebra {

    private SketchAlgebra() {
    }

    /**
     * Merges all sketches into a new one.
     *
     * @param sketches the sketches, must not be empty.
     */
    @NotNull
    public static RegisterArray mergeAll(@NotNull Collection<RegisterArray> sketches) {
        checkArgument(!sketches.isEmpty(), "nothing to merge");
        RegisterArray merged = RegisterArray.empty();
        for (RegisterArray sketch : sketches) {
            merged.mergeAll(sketch);
        }
        return merged;
    }

    /**
     * @param found the sketches of the keys that exist.
     * @return the estimated size of the union, or zero if no key exists.
     */
    public static long union(@NotNull Collection<RegisterArray> found) {
        if (found.isEmpty()) {
            return 0;
        }
        return HyperLogLogEstimator.estimate(mergeAll(found));
    }

    /**
     * Estimates the size of the intersection as the absolute difference
     * between the union estimate and the sum of the individual estimates.
     * <p>
     * This is inclusion-exclusion for two keys. For three or more keys the
     * result is a biased approximation and not the size of the intersection.
     *
     * @param found the sketches of the keys that exist.
     * @param requested the number of distinct keys asked for.
     * @return the estimate, zero if any requested key does not exist.
     */
    public static long intersection(@NotNull Collection<RegisterArray> found, int requested) {
        if (found.isEmpty() || found.size() < requested) {
            return 0;
        }
        long union = HyperLogLogEstimator.estimate(mergeAll(found));
        long sum = 0;
        for (RegisterArray sketch : found) {
            sum += HyperLogLogEstimator.estimate(sketch);
        }
        return Math.abs(union - sum);
    }
}
