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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A (bucket, rank) pair derived from a hashed value.
 */
public final class RegisterAssignment {

    private final int bucket;

    private final int rank;

    public RegisterAssignment(int bucket, int rank) {
        checkArgument(bucket >= 0 && bucket < RegisterArray.SIZE,
                "bucket out of range: %s", bucket);
        checkArgument(rank >= 1 && rank <= RegisterArray.MAX_RANK,
                "rank out of range: %s", rank);
        this.bucket = bucket;
        this.rank = rank;
    }

    public int getBucket() {
        return bucket;
    }

    public int getRank() {
        return rank;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RegisterAssignment)) {
            return false;
        }
        RegisterAssignment other = (RegisterAssignment) obj;
        return bucket == other.bucket && rank == other.rank;
    }

    @Override
    public int hashCode() {
        return 31 * bucket + rank;
    }

    @Override
    public String toString() {
        return "(" + bucket + ", " + rank + ")";
    }
}
