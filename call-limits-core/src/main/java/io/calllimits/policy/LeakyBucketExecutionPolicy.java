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
package io.calllimits.policy;

import io.calllimits.Attempt;
import io.calllimits.CallLimitHeaders;
import io.calllimits.ExecutionPolicy;
import io.calllimits.MetricIds;
import io.calllimits.MetricRegistry;
import io.calllimits.RateLimitExceededException;
import io.calllimits.RequestExecutor;
import io.calllimits.bucket.BucketRegistry;
import io.calllimits.bucket.LeakyBucket;
import io.calllimits.internal.EmptyMetricRegistry;
import io.calllimits.internal.Preconditions;
import io.calllimits.internal.Schedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * {@link ExecutionPolicy} that keeps callers under the published rate limit of a remote service
 * instead of discovering it through rejected requests.
 * <p>
 * Requests carrying a credential are admitted through the {@link LeakyBucket} of that credential,
 * and every successful response that reports the bucket state corrects the local estimate.  When the
 * estimate is wrong and the service rejects a request anyway, the request is retried after a fixed
 * delay, for as long as it takes.  Requests without a credential are executed directly.  Any other
 * failure is passed to the caller unchanged.
 * <p>
 * For example: if 100 requests with the same credential are started together against a bucket of
 * 40, 39 are sent right away and the rest are paced at one per drain interval.
 *
 * @param <RequestT> Request type
 */
public class LeakyBucketExecutionPolicy<RequestT> implements ExecutionPolicy<RequestT> {
    private static final Logger log = LoggerFactory.getLogger(LeakyBucketExecutionPolicy.class);

    public static final Duration DEFAULT_THROTTLE_DELAY = Duration.ofMillis(500);

    public abstract static class AbstractBuilder<RequestT, BuilderT extends AbstractBuilder<RequestT, BuilderT>> {
        private static final AtomicInteger idCounter = new AtomicInteger();

        protected String name = "unnamed-" + idCounter.incrementAndGet();
        protected MetricRegistry registry = EmptyMetricRegistry.INSTANCE;
        protected Function<RequestT, String> credentialResolver;
        protected UnaryOperator<RequestT> requestCopier = UnaryOperator.identity();
        protected Predicate<Throwable> rateLimitClassifier = t -> t instanceof RateLimitExceededException;

        private BucketRegistry bucketRegistry;
        private ScheduledExecutorService scheduler;
        private Executor callbackExecutor;
        private LongSupplier clock = System::nanoTime;
        private long throttleDelayNanos = DEFAULT_THROTTLE_DELAY.toNanos();

        public BuilderT named(String name) {
            this.name = name;
            return self();
        }

        public BuilderT metricRegistry(MetricRegistry registry) {
            this.registry = registry;
            return self();
        }

        /**
         * Resolve the credential that scopes the rate limit of a request.  Requests for which the
         * resolver returns null are not admitted through any bucket.
         * @param credentialResolver Mapping from the request to its credential
         * @return Chainable builder
         */
        public BuilderT credentialResolver(Function<RequestT, String> credentialResolver) {
            this.credentialResolver = credentialResolver;
            return self();
        }

        /**
         * Copy made of the request template for every attempt.  Default is the identity, which only
         * suits immutable requests.
         * @param requestCopier
         * @return Chainable builder
         */
        public BuilderT requestCopier(UnaryOperator<RequestT> requestCopier) {
            this.requestCopier = requestCopier;
            return self();
        }

        /**
         * Predicate that recognizes failures signaling a rate limit rejection, for transports that
         * fail the attempt instead of returning {@link Attempt#rateLimited()}.  Default matches
         * {@link RateLimitExceededException}.
         * @param rateLimitClassifier
         * @return Chainable builder
         */
        public BuilderT rateLimitClassifier(Predicate<Throwable> rateLimitClassifier) {
            this.rateLimitClassifier = rateLimitClassifier;
            return self();
        }

        /**
         * Registry to look up buckets from.  Default is a new registry of default buckets owned by
         * the policy.
         * @param bucketRegistry
         * @return Chainable builder
         */
        public BuilderT bucketRegistry(BucketRegistry bucketRegistry) {
            this.bucketRegistry = bucketRegistry;
            return self();
        }

        /**
         * Delay before retrying a request the remote service rejected.  Default is 500 millis.
         * @param delay
         * @param units
         * @return Chainable builder
         */
        public BuilderT throttleDelay(long delay, TimeUnit units) {
            Preconditions.checkArgument(delay >= 0, "Throttle delay cannot be negative");
            this.throttleDelayNanos = units.toNanos(delay);
            return self();
        }

        public BuilderT throttleDelay(Duration delay) {
            return throttleDelay(delay.toNanos(), TimeUnit.NANOSECONDS);
        }

        public BuilderT scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return self();
        }

        /**
         * Executor that attempts resume on after waiting for admission or for a retry delay, so that
         * a slow transport call never holds the scheduler.  Default is the executor
         * {@link CompletableFuture} uses for async stages.
         * @param callbackExecutor
         * @return Chainable builder
         */
        public BuilderT callbackExecutor(Executor callbackExecutor) {
            this.callbackExecutor = callbackExecutor;
            return self();
        }

        public BuilderT nanoClock(LongSupplier clock) {
            this.clock = clock;
            return self();
        }

        protected abstract BuilderT self();

        public LeakyBucketExecutionPolicy<RequestT> build() {
            if (credentialResolver == null) {
                log.warn("No credential resolver configured for policy {}, requests will not be paced", name);
            }
            return new LeakyBucketExecutionPolicy<>(this);
        }
    }

    public static final class Builder<RequestT> extends AbstractBuilder<RequestT, Builder<RequestT>> {
        @Override
        protected Builder<RequestT> self() {
            return this;
        }
    }

    public static <RequestT> Builder<RequestT> newBuilder() {
        return new Builder<>();
    }

    private final String name;
    private final Function<RequestT, String> credentialResolver;
    private final UnaryOperator<RequestT> requestCopier;
    private final Predicate<Throwable> rateLimitClassifier;
    private final BucketRegistry bucketRegistry;
    private final ScheduledExecutorService scheduler;
    private final Executor callbackExecutor;
    private final LongSupplier clock;
    private final long throttleDelayNanos;

    private final MetricRegistry.Counter successCounter;
    private final MetricRegistry.Counter rateLimitedCounter;
    private final MetricRegistry.Counter failedCounter;
    private final MetricRegistry.Counter bypassCounter;
    private final MetricRegistry.SampleListener grantDelay;

    protected LeakyBucketExecutionPolicy(AbstractBuilder<RequestT, ?> builder) {
        this.name = builder.name;
        this.credentialResolver = builder.credentialResolver != null ? builder.credentialResolver : request -> null;
        this.requestCopier = builder.requestCopier;
        this.rateLimitClassifier = builder.rateLimitClassifier;
        this.bucketRegistry = builder.bucketRegistry != null ? builder.bucketRegistry : BucketRegistry.newDefault();
        this.scheduler = builder.scheduler != null ? builder.scheduler : Schedulers.shared();
        this.callbackExecutor = builder.callbackExecutor != null ? builder.callbackExecutor : Schedulers.callbacks();
        this.clock = builder.clock;
        this.throttleDelayNanos = builder.throttleDelayNanos;

        this.successCounter = builder.registry.counter(MetricIds.CALL_NAME, MetricIds.ID_TAG, name, MetricIds.STATUS_TAG, "success");
        this.rateLimitedCounter = builder.registry.counter(MetricIds.CALL_NAME, MetricIds.ID_TAG, name, MetricIds.STATUS_TAG, "rate_limited");
        this.failedCounter = builder.registry.counter(MetricIds.CALL_NAME, MetricIds.ID_TAG, name, MetricIds.STATUS_TAG, "failed");
        this.bypassCounter = builder.registry.counter(MetricIds.CALL_NAME, MetricIds.ID_TAG, name, MetricIds.STATUS_TAG, "bypassed");
        this.grantDelay = builder.registry.distribution(MetricIds.GRANT_DELAY_NAME, MetricIds.ID_TAG, name);
        builder.registry.gauge(MetricIds.BUCKETS_NAME, bucketRegistry::size, MetricIds.ID_TAG, name);
    }

    @Override
    public <T> CompletableFuture<T> run(RequestT request, RequestExecutor<RequestT, T> executor) {
        final String credential = credentialResolver.apply(request);
        final LeakyBucket bucket;
        if (credential == null) {
            bypassCounter.increment();
            bucket = null;
        } else {
            bucket = bucketRegistry.get(credential);
        }

        Execution<T> execution = new Execution<>(request, executor, bucket);
        execution.attempt();
        return execution.result;
    }

    public BucketRegistry getBucketRegistry() {
        return bucketRegistry;
    }

    /**
     * State of one call to {@link #run(Object, RequestExecutor)} across its attempts.
     */
    private final class Execution<T> {
        private final RequestT template;
        private final RequestExecutor<RequestT, T> executor;
        private final LeakyBucket bucket;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        /**
         * Grant, transport call or retry delay the execution is currently suspended on
         */
        private volatile Future<?> current;

        Execution(RequestT template, RequestExecutor<RequestT, T> executor, LeakyBucket bucket) {
            this.template = template;
            this.executor = executor;
            this.bucket = bucket;

            result.whenComplete((ignore, t) -> {
                Future<?> suspended = current;
                if (result.isCancelled() && suspended != null) {
                    suspended.cancel(true);
                }
            });
        }

        void attempt() {
            if (result.isDone()) {
                return;
            }

            final RequestT request;
            try {
                request = requestCopier.apply(template);
            } catch (RuntimeException e) {
                fail(e);
                return;
            }

            if (bucket == null) {
                execute(request);
                return;
            }

            final long start = clock.getAsLong();
            CompletableFuture<Void> granted = bucket.grant();
            track(granted);
            if (granted.isDone()) {
                granted.whenComplete((ignore, t) -> onGranted(request, start, t));
            } else {
                // Completed on the scheduler thread, which must not run the transport call
                granted.whenCompleteAsync((ignore, t) -> onGranted(request, start, t), callbackExecutor);
            }
        }

        private void onGranted(RequestT request, long start, Throwable t) {
            if (t != null) {
                fail(t);
                return;
            }
            grantDelay.addLongSample(clock.getAsLong() - start);
            execute(request);
        }

        private void execute(RequestT request) {
            if (result.isDone()) {
                return;
            }

            final CompletableFuture<Attempt<T>> stage;
            try {
                stage = executor.execute(request).toCompletableFuture();
            } catch (RuntimeException e) {
                onFailure(e);
                return;
            }

            track(stage);
            stage.whenComplete((attempt, t) -> {
                try {
                    if (t != null) {
                        onFailure(t);
                    } else {
                        onAttempt(attempt);
                    }
                } catch (RuntimeException e) {
                    fail(e);
                }
            });
        }

        private void onAttempt(Attempt<T> attempt) {
            if (attempt == null) {
                fail(new NullPointerException("Executor returned no attempt"));
                return;
            }
            switch (attempt.getKind()) {
                case SUCCESS:
                    if (bucket != null) {
                        CallLimitHeaders.getBucketState(attempt.getHeaders()).ifPresent(bucket::setState);
                    }
                    successCounter.increment();
                    result.complete(attempt.getValue());
                    break;
                case RATE_LIMITED:
                    retryLater();
                    break;
                default:
                    onFailure(attempt.getCause());
                    break;
            }
        }

        private void onFailure(Throwable throwable) {
            if (result.isCancelled()) {
                return;
            }

            Throwable cause = unwrap(throwable);
            if (rateLimitClassifier.test(cause)) {
                retryLater();
            } else {
                fail(cause);
            }
        }

        private void retryLater() {
            if (result.isDone()) {
                return;
            }
            rateLimitedCounter.increment();

            log.debug("Request rejected by rate limit ({}), retrying in {} ms", name,
                    TimeUnit.NANOSECONDS.toMillis(throttleDelayNanos));
            try {
                track(scheduler.schedule(this::resume, throttleDelayNanos, TimeUnit.NANOSECONDS));
            } catch (RejectedExecutionException e) {
                fail(e);
            }
        }

        private void resume() {
            try {
                callbackExecutor.execute(this::attempt);
            } catch (RejectedExecutionException e) {
                fail(e);
            }
        }

        private void fail(Throwable cause) {
            if (cause instanceof CancellationException && result.isCancelled()) {
                return;
            }
            if (result.completeExceptionally(cause)) {
                failedCounter.increment();
            }
        }

        private void track(Future<?> future) {
            current = future;
            if (result.isCancelled()) {
                future.cancel(true);
            }
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        return (throwable instanceof CompletionException || throwable instanceof ExecutionException)
                && throwable.getCause() != null
                ? unwrap(throwable.getCause())
                : throwable;
    }

    @Override
    public String toString() {
        return "LeakyBucketExecutionPolicy [name=" + name + ", buckets=" + bucketRegistry.size() + "]";
    }
}
