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
import io.calllimits.internal.Schedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Client side estimate of a remote leaky bucket shared by every call made with one credential.
 * <p>
 * Each admitted call adds one unit to the estimated fill level, which drains continuously at one
 * unit per drain interval.  A call is admitted immediately while one more unit keeps the estimate
 * below the capacity, leaving one unit of headroom for calls made with the same credential from
 * elsewhere.  Otherwise the caller is suspended, without holding a thread, until enough has leaked.
 * <p>
 * The estimate is corrected with {@link #setState(BucketState)} whenever the remote service reports
 * its own counter.  Suspended callers re-evaluate against the corrected estimate right away.
 */
public final class LeakyBucket {
    private static final Logger log = LoggerFactory.getLogger(LeakyBucket.class);

    public static final int DEFAULT_CAPACITY = 40;
    public static final Duration DEFAULT_DRAIN_INTERVAL = Duration.ofMillis(500);

    public static class Builder {
        private int capacity = DEFAULT_CAPACITY;
        private long drainIntervalNanos = DEFAULT_DRAIN_INTERVAL.toNanos();
        private LongSupplier clock = System::nanoTime;
        private ScheduledExecutorService scheduler;

        /**
         * Capacity assumed until the remote service reports its own.  Default is 40.
         * @param capacity Maximum fill level
         * @return Chainable builder
         */
        public Builder capacity(int capacity) {
            Preconditions.checkArgument(capacity > 0, "Capacity must be positive");
            this.capacity = capacity;
            return this;
        }

        /**
         * Time it takes for one unit to leak out of the bucket.  Default is 500 millis.
         * @param interval
         * @param units
         * @return Chainable builder
         */
        public Builder drainInterval(long interval, TimeUnit units) {
            Preconditions.checkArgument(interval > 0, "Drain interval must be positive");
            this.drainIntervalNanos = units.toNanos(interval);
            return this;
        }

        public Builder drainInterval(Duration interval) {
            return drainInterval(interval.toNanos(), TimeUnit.NANOSECONDS);
        }

        public Builder nanoClock(LongSupplier clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Scheduler used to wake up suspended callers.  Defaults to a shared daemon thread.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public LeakyBucket build() {
            return new LeakyBucket(this);
        }
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static LeakyBucket newDefault() {
        return newBuilder().build();
    }

    private final Object lock = new Object();
    private final long drainIntervalNanos;
    private final LongSupplier clock;
    private final ScheduledExecutorService scheduler;
    private final Set<Waiter> waiters = ConcurrentHashMap.newKeySet();

    // Bumped on every setState so that a waiter suspending concurrently notices it
    private volatile long stateVersion;

    // Guarded by lock
    private int capacity;
    private double fillLevel;
    private long lastUpdateTime;

    private LeakyBucket(Builder builder) {
        this.drainIntervalNanos = builder.drainIntervalNanos;
        this.clock = builder.clock;
        this.scheduler = builder.scheduler != null ? builder.scheduler : Schedulers.shared();
        this.capacity = builder.capacity;
        this.fillLevel = 0;
        this.lastUpdateTime = clock.getAsLong();
    }

    /**
     * Request admission for one unit of work.
     *
     * @return Future completed once the unit has been added to the bucket.  Cancelling it abandons the
     *         wait without consuming a unit.  A future that is not complete on return is completed from
     *         the scheduler thread, so blocking work should be chained with an async stage.
     */
    public CompletableFuture<Void> grant() {
        Waiter waiter = new Waiter();
        waiter.run();
        return waiter.granted;
    }

    /**
     * Replace the estimate with state observed from the remote service.
     */
    public void setState(BucketState state) {
        synchronized (lock) {
            capacity = state.getCapacity();
            fillLevel = state.getCurrentFillLevel();
            lastUpdateTime = clock.getAsLong();
            stateVersion++;
        }
        waiters.forEach(Waiter::wake);
    }

    /**
     * @return Current estimate including leakage since the last update
     */
    public double getEstimatedFillLevel() {
        synchronized (lock) {
            return leaked(clock.getAsLong());
        }
    }

    public int getCapacity() {
        synchronized (lock) {
            return capacity;
        }
    }

    /**
     * @return Number of callers currently suspended in {@link #grant()}
     */
    public int getWaiting() {
        return waiters.size();
    }

    /**
     * Reserve a unit if it fits, otherwise compute how long to wait before it will.
     *
     * @return 0 if a unit was reserved, otherwise the wait in nanos
     */
    private long tryReserve() {
        synchronized (lock) {
            long now = clock.getAsLong();
            fillLevel = leaked(now);
            if (now > lastUpdateTime) {
                lastUpdateTime = now;
            }

            int ceiling = Math.max(capacity - 1, 1);
            double excess = fillLevel + 1 - ceiling;
            if (excess <= 0) {
                fillLevel += 1;
                return 0;
            }
            return Math.max(1L, (long) Math.ceil(excess * drainIntervalNanos));
        }
    }

    private void release() {
        synchronized (lock) {
            long now = clock.getAsLong();
            fillLevel = Math.max(0, leaked(now) - 1);
            if (now > lastUpdateTime) {
                lastUpdateTime = now;
            }
        }
    }

    private double leaked(long now) {
        long elapsed = now - lastUpdateTime;
        if (elapsed <= 0) {
            return fillLevel;
        }
        return Math.max(0, fillLevel - (double) elapsed / drainIntervalNanos);
    }

    /**
     * One pending call to {@link #grant()}.  Runs once per evaluation, either on the calling thread,
     * when its timer fires or when new state arrives.
     */
    private final class Waiter implements Runnable {
        private final CompletableFuture<Void> granted = new CompletableFuture<>();
        private ScheduledFuture<?> pending;

        Waiter() {
            granted.whenComplete((ignore, t) -> {
                if (t != null) {
                    waiters.remove(this);
                    cancelPending();
                }
            });
        }

        @Override
        public void run() {
            if (granted.isDone()) {
                waiters.remove(this);
                return;
            }

            long version = stateVersion;
            long waitNanos = tryReserve();
            if (waitNanos == 0) {
                waiters.remove(this);
                if (!granted.complete(null)) {
                    // Cancelled while the unit was being reserved
                    release();
                }
                return;
            }

            log.trace("Bucket full, re-evaluating in {} ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            waiters.add(this);
            schedule(waitNanos);
            if (granted.isDone()) {
                waiters.remove(this);
                cancelPending();
            } else if (stateVersion != version) {
                // State arrived after the estimate was read but before this waiter could be woken
                wake();
            }
        }

        void wake() {
            schedule(0);
        }

        private synchronized void schedule(long delayNanos) {
            if (pending != null) {
                pending.cancel(false);
            }
            try {
                pending = scheduler.schedule(this, delayNanos, TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                waiters.remove(this);
                granted.completeExceptionally(e);
            }
        }

        private synchronized void cancelPending() {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "LeakyBucket [fillLevel=" + leaked(clock.getAsLong()) + ", capacity=" + capacity + "]";
        }
    }
}
