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
package io.calllimits.httpclient;

import io.calllimits.Attempt;
import io.calllimits.ExecutionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Sends requests with an {@link HttpClient} through an {@link ExecutionPolicy}.
 * <p>
 * A response with the throttle status code, {@code 429 Too Many Requests} by default, is reported to
 * the policy as a rate limit rejection.  Any other response is a success and is returned to the
 * caller whatever its status; its headers are used to correct the bucket estimate.
 */
public class CallLimitedHttpClient {
    private static final Logger log = LoggerFactory.getLogger(CallLimitedHttpClient.class);

    private static final int STATUS_TOO_MANY_REQUESTS = 429;

    private final HttpClient client;
    private final ExecutionPolicy<HttpRequest> policy;
    private final int throttleStatusCode;

    public CallLimitedHttpClient(HttpClient client, ExecutionPolicy<HttpRequest> policy) {
        this(client, policy, STATUS_TOO_MANY_REQUESTS);
    }

    public CallLimitedHttpClient(HttpClient client, ExecutionPolicy<HttpRequest> policy, int throttleStatusCode) {
        this.client = client;
        this.policy = policy;
        this.throttleStatusCode = throttleStatusCode;
    }

    public <T> CompletableFuture<HttpResponse<T>> sendAsync(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        return policy.run(request, attempt -> exchange(attempt, handler));
    }

    private <T> CompletableFuture<Attempt<HttpResponse<T>>> exchange(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        CompletableFuture<HttpResponse<T>> sent = client.sendAsync(request, handler);
        CompletableFuture<Attempt<HttpResponse<T>>> attempt = sent.thenApply(this::toAttempt);
        // Cancelling a dependent stage leaves its source running
        attempt.whenComplete((ignore, t) -> {
            if (attempt.isCancelled()) {
                sent.cancel(true);
            }
        });
        return attempt;
    }

    /**
     * Blocking variant of {@link #sendAsync(HttpRequest, HttpResponse.BodyHandler)}.  Interrupting the
     * caller cancels the call, including any pending retry.
     */
    public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler)
            throws IOException, InterruptedException {
        CompletableFuture<HttpResponse<T>> future = sendAsync(request, handler);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IOException(cause);
        }
    }

    protected <T> Attempt<HttpResponse<T>> toAttempt(HttpResponse<T> response) {
        if (response.statusCode() == throttleStatusCode) {
            log.debug("{} {} returned {}", response.request().method(), response.uri(), throttleStatusCode);
            return Attempt.rateLimited();
        }
        return Attempt.success(response, response.headers()::firstValue);
    }

    @Override
    public String toString() {
        return "CallLimitedHttpClient [" + policy + "]";
    }
}
