package io.calllimits.httpclient;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.calllimits.CallLimitHeaders;
import io.calllimits.bucket.LeakyBucket;
import io.calllimits.policy.LeakyBucketExecutionPolicy;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

public class CallLimitedHttpClientTest {
    private static final String TOKEN = "shpat_0001";

    private static final class Reply {
        final int status;
        final String callLimit;

        Reply(int status, String callLimit) {
            this.status = status;
            this.callLimit = callLimit;
        }
    }

    private final Queue<Reply> replies = new ConcurrentLinkedQueue<>();
    private final List<String> receivedTokens = new CopyOnWriteArrayList<>();

    private HttpServer server;
    private URI uri;
    private LeakyBucketExecutionPolicy<HttpRequest> policy;
    private CallLimitedHttpClient client;

    @Before
    public void setup() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/admin/api/shop.json", this::handle);
        server.start();
        uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/admin/api/shop.json");

        policy = new HttpRequestPolicyBuilder().named("shop").build();
        client = new CallLimitedHttpClient(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build(), policy);
    }

    @After
    public void teardown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        receivedTokens.add(String.valueOf(exchange.getRequestHeaders().getFirst(CallLimitHeaders.ACCESS_TOKEN)));
        Reply reply = replies.poll();
        if (reply == null) {
            reply = new Reply(200, null);
        }
        if (reply.callLimit != null) {
            exchange.getResponseHeaders().add(CallLimitHeaders.API_CALL_LIMIT, reply.callLimit);
        }
        byte[] body = ("status " + reply.status).getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(reply.status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private HttpRequest.Builder request() {
        return HttpRequest.newBuilder(uri).GET();
    }

    @Test
    public void retriesTooManyRequestsUntilAccepted() throws Exception {
        replies.add(new Reply(429, null));
        replies.add(new Reply(429, null));
        replies.add(new Reply(200, "3/40"));

        long start = System.nanoTime();
        HttpResponse<String> response = client.send(
                request().header(CallLimitHeaders.ACCESS_TOKEN, TOKEN).build(), HttpResponse.BodyHandlers.ofString());
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        Assert.assertEquals(200, response.statusCode());
        Assert.assertEquals("status 200", response.body());
        Assert.assertEquals(3, receivedTokens.size());
        Assert.assertTrue("Elapsed " + elapsedMillis + " millis", elapsedMillis >= 1000);
    }

    @Test
    public void responseHeaderCorrectsBucketOfAccessToken() throws Exception {
        replies.add(new Reply(200, "32/80"));

        client.send(request().header(CallLimitHeaders.ACCESS_TOKEN, TOKEN).build(), HttpResponse.BodyHandlers.ofString());

        LeakyBucket bucket = policy.getBucketRegistry().find(TOKEN).get();
        Assert.assertEquals(80, bucket.getCapacity());
        Assert.assertTrue(bucket.getEstimatedFillLevel() <= 32.0);
        Assert.assertTrue(bucket.getEstimatedFillLevel() > 30.0);
        Assert.assertEquals(List.of(TOKEN), receivedTokens);
    }

    @Test
    public void requestWithoutAccessTokenIsNotPaced() throws Exception {
        replies.add(new Reply(200, "39/40"));

        HttpResponse<String> response = client.sendAsync(request().build(), HttpResponse.BodyHandlers.ofString())
                .get(5, TimeUnit.SECONDS);

        Assert.assertEquals(200, response.statusCode());
        Assert.assertEquals(0, policy.getBucketRegistry().size());
    }

    @Test
    public void otherErrorStatusIsReturnedWithoutRetry() throws Exception {
        replies.add(new Reply(503, null));

        HttpResponse<String> response = client.send(
                request().header(CallLimitHeaders.ACCESS_TOKEN, TOKEN).build(), HttpResponse.BodyHandlers.ofString());

        Assert.assertEquals(503, response.statusCode());
        Assert.assertEquals(1, receivedTokens.size());
    }

    @Test(expected = IOException.class)
    public void connectionFailurePropagates() throws Exception {
        server.stop(0);
        client.send(request().header(CallLimitHeaders.ACCESS_TOKEN, TOKEN).build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void customCredentialHeader() throws Exception {
        LeakyBucketExecutionPolicy<HttpRequest> byTenant = new HttpRequestPolicyBuilder()
                .credentialHeader("X-Tenant")
                .build();
        CallLimitedHttpClient tenantClient = new CallLimitedHttpClient(HttpClient.newHttpClient(), byTenant);

        tenantClient.send(request().header("X-Tenant", "acme").build(), HttpResponse.BodyHandlers.discarding());

        Assert.assertTrue(byTenant.getBucketRegistry().find("acme").isPresent());
    }

    @Test
    public void cancellingCallCancelsExchange() {
        HttpClient pending = Mockito.mock(HttpClient.class);
        CompletableFuture<HttpResponse<String>> exchange = new CompletableFuture<>();
        Mockito.doReturn(exchange).when(pending).sendAsync(any(HttpRequest.class), any());
        CallLimitedHttpClient limited = new CallLimitedHttpClient(pending, policy);

        CompletableFuture<HttpResponse<String>> result = limited.sendAsync(
                request().header(CallLimitHeaders.ACCESS_TOKEN, TOKEN).build(), HttpResponse.BodyHandlers.ofString());
        verify(pending).sendAsync(any(HttpRequest.class), any());

        result.cancel(true);

        Assert.assertTrue(exchange.isCancelled());
    }

    @Test
    public void interruptingSendCancelsExchange() throws Exception {
        HttpClient pending = Mockito.mock(HttpClient.class);
        CompletableFuture<HttpResponse<String>> exchange = new CompletableFuture<>();
        Mockito.doReturn(exchange).when(pending).sendAsync(any(HttpRequest.class), any());
        CallLimitedHttpClient limited = new CallLimitedHttpClient(pending, policy);

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                limited.send(request().header(CallLimitHeaders.ACCESS_TOKEN, TOKEN).build(),
                        HttpResponse.BodyHandlers.ofString());
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        caller.start();
        verify(pending, timeout(1000)).sendAsync(any(HttpRequest.class), any());

        caller.interrupt();
        caller.join(1000);

        Assert.assertTrue(String.valueOf(thrown.get()), thrown.get() instanceof InterruptedException);
        Assert.assertTrue(exchange.isCancelled());
    }
}
