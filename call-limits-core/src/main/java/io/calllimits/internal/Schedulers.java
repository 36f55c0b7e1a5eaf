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
package io.calllimits.internal;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holder for the scheduler used by buckets and policies when none is configured.  The scheduler is
 * a timer only: it re-evaluates admission, and anything that may call out to a transport is handed
 * off to {@link #callbacks()}.
 */
public final class Schedulers {
    private static final AtomicInteger threadCounter = new AtomicInteger();

    private static final class Holder {
        static final ScheduledExecutorService INSTANCE = create();

        private static ScheduledExecutorService create() {
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
                Thread thread = new Thread(runnable, "call-limits-scheduler-" + threadCounter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            executor.setRemoveOnCancelPolicy(true);
            return executor;
        }
    }

    public static ScheduledExecutorService shared() {
        return Holder.INSTANCE;
    }

    /**
     * @return Executor used by {@link CompletableFuture} for async stages, which falls back to a thread
     *         per task when the common pool has a single worker
     */
    public static Executor callbacks() {
        return CallbacksHolder.INSTANCE;
    }

    private static final class CallbacksHolder {
        static final Executor INSTANCE = new CompletableFuture<Void>().defaultExecutor();
    }

    private Schedulers() {
    }
}
