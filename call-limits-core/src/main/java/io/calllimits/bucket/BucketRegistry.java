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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * {@link LeakyBucket} lookup keyed by credential.  Buckets are created on first use and kept for the
 * lifetime of the registry.  Share one registry between policies that talk to the same service so
 * that calls made with the same credential drain the same bucket.
 */
public final class BucketRegistry {
    private static final Logger log = LoggerFactory.getLogger(BucketRegistry.class);

    private final ConcurrentMap<String, LeakyBucket> buckets = new ConcurrentHashMap<>();
    private final Supplier<LeakyBucket> bucketFactory;

    /**
     * @param bucketFactory Creates the bucket for a credential seen for the first time
     */
    public BucketRegistry(Supplier<LeakyBucket> bucketFactory) {
        this.bucketFactory = Preconditions.checkNotNull(bucketFactory, "bucketFactory");
    }

    public static BucketRegistry newDefault() {
        return new BucketRegistry(LeakyBucket::newDefault);
    }

    /**
     * Get the bucket for a credential, creating it if needed.  Concurrent first callers for the
     * same credential receive the same instance.
     */
    public LeakyBucket get(String credential) {
        Preconditions.checkNotNull(credential, "credential");
        return buckets.computeIfAbsent(credential, key -> {
            log.debug("Creating bucket #{}", buckets.size() + 1);
            return bucketFactory.get();
        });
    }

    /**
     * Get the bucket for a credential without creating it.
     */
    public Optional<LeakyBucket> find(String credential) {
        return credential == null ? Optional.empty() : Optional.ofNullable(buckets.get(credential));
    }

    public int size() {
        return buckets.size();
    }

    @Override
    public String toString() {
        return "BucketRegistry [buckets=" + buckets.size() + "]";
    }
}
