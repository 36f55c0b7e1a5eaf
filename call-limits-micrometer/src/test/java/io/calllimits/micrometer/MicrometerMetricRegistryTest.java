package io.calllimits.micrometer;

import io.calllimits.Attempt;
import io.calllimits.MetricIds;
import io.calllimits.MetricRegistry.Counter;
import io.calllimits.MetricRegistry.SampleListener;
import io.calllimits.ResponseHeaders;
import io.calllimits.policy.LeakyBucketExecutionPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class MicrometerMetricRegistryTest {

    private SimpleMeterRegistry meterRegistry;

    private MicrometerMetricRegistry metricRegistry;

    @Before
    public void setup() {
        meterRegistry = new SimpleMeterRegistry();
        metricRegistry = new MicrometerMetricRegistry(meterRegistry);
    }

    @Test
    public void testDistribution() {
        SampleListener listener = metricRegistry.distribution("distribution", "foo", "bar");
        listener.addDoubleSample(40);
        listener.addDoubleSample(2);

        double sum = meterRegistry.get("call.limits.distribution")
                .tag("foo", "bar")
                .summary()
                .totalAmount();

        Assert.assertEquals(42, sum, 0);
    }

    @Test
    public void testGrantDelayIsTimer() {
        SampleListener listener = metricRegistry.distribution(MetricIds.GRANT_DELAY_NAME, "id", "shop");
        listener.addLongSample(TimeUnit.MILLISECONDS.toNanos(500));

        double millis = meterRegistry.get("call.limits.grant.delay")
                .tag("id", "shop")
                .timer()
                .totalTime(TimeUnit.MILLISECONDS);

        Assert.assertEquals(500, millis, 0.001);
    }

    @Test
    public void testGauge() {
        final AtomicLong value = new AtomicLong(42);
        metricRegistry.gauge("gauge", () -> value, "foo", "bar");

        Assert.assertEquals(42, meterRegistry.get("call.limits.gauge").tag("foo", "bar").gauge().value(), 0);

        value.set(43);

        Assert.assertEquals(43, meterRegistry.get("call.limits.gauge").tag("foo", "bar").gauge().value(), 0);
    }

    @Test
    public void testCounterWithCustomPrefix() {
        MicrometerMetricRegistry prefixed = new MicrometerMetricRegistry(meterRegistry, "shop.api.");
        Counter counter = prefixed.counter("counter", "foo", "bar");
        counter.increment();
        counter.increment();

        Assert.assertEquals(2, meterRegistry.get("shop.api.counter").tag("foo", "bar").counter().count(), 0);
    }

    @Test
    public void testPolicyMeters() throws Exception {
        LeakyBucketExecutionPolicy<String> policy = LeakyBucketExecutionPolicy.<String>newBuilder()
                .named("shop")
                .credentialResolver(token -> token.isEmpty() ? null : token)
                .throttleDelay(1, TimeUnit.MILLISECONDS)
                .metricRegistry(metricRegistry)
                .build();

        AtomicInteger attempts = new AtomicInteger();
        policy.<String>run("shpat_0001", token -> CompletableFuture.completedFuture(
                attempts.incrementAndGet() == 1
                        ? Attempt.rateLimited()
                        : Attempt.success("ok", ResponseHeaders.empty())))
                .get(5, TimeUnit.SECONDS);
        policy.<String>run("", token -> CompletableFuture.completedFuture(Attempt.success("ok", ResponseHeaders.empty())))
                .get(5, TimeUnit.SECONDS);

        Assert.assertEquals(2, meterRegistry.get("call.limits.call").tag("id", "shop").tag("status", "success").counter().count(), 0);
        Assert.assertEquals(1, meterRegistry.get("call.limits.call").tag("id", "shop").tag("status", "rate_limited").counter().count(), 0);
        Assert.assertEquals(1, meterRegistry.get("call.limits.call").tag("id", "shop").tag("status", "bypassed").counter().count(), 0);
        Assert.assertEquals(0, meterRegistry.get("call.limits.call").tag("id", "shop").tag("status", "failed").counter().count(), 0);
        Assert.assertEquals(2, meterRegistry.get("call.limits.grant.delay").tag("id", "shop").timer().count());
        Assert.assertEquals(1, meterRegistry.get("call.limits.buckets").tag("id", "shop").gauge().value(), 0);
    }
}
