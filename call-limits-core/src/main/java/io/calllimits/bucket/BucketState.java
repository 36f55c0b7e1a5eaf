/**
 * Copyright 2026 The call-limits Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.calllimits.bucket;

import io.calllimits.internal.Preconditions;

import java.util.Objects;

/**
 * Snapshot of a bucket as reported by the remote service: how many units are in use and how many
 * the service allows.  Both values always come from the same observation.
 */
public final class BucketState {
    private final int capacity;
    private final int currentFillLevel;

    public BucketState(int capacity, int currentFillLevel) {
        Preconditions.checkArgument(capacity > 0, "Capacity must be positive, was " + capacity);
        Preconditions.checkArgument(currentFillLevel >= 0, "Fill level cannot be negative, was " + currentFillLevel);
        Preconditions.checkArgument(currentFillLevel <= capacity,
                "Fill level " + currentFillLevel + " exceeds capacity " + capacity);
        this.capacity = capacity;
        this.currentFillLevel = currentFillLevel;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getCurrentFillLevel() {
        return currentFillLevel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BucketState)) {
            return false;
        }
        BucketState that = (BucketState) o;
        return capacity == that.capacity && currentFillLevel == that.currentFillLevel;
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, currentFillLevel);
    }

    @Override
    public String toString() {
        return "BucketState [" + currentFillLevel + "/" + capacity + "]";
    }
}
