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

import io.calllimits.CallLimitHeaders;
import io.calllimits.policy.LeakyBucketExecutionPolicy;

import java.net.http.HttpRequest;

/**
 * Builder of a {@link LeakyBucketExecutionPolicy} for {@link HttpRequest}s.  Requests are scoped by
 * their {@link CallLimitHeaders#ACCESS_TOKEN} header unless configured otherwise, and every attempt
 * sends its own copy of the request.
 */
public final class HttpRequestPolicyBuilder
        extends LeakyBucketExecutionPolicy.AbstractBuilder<HttpRequest, HttpRequestPolicyBuilder> {

    public HttpRequestPolicyBuilder() {
        credentialHeader(CallLimitHeaders.ACCESS_TOKEN);
        requestCopier(request -> HttpRequest.newBuilder(request, (name, value) -> true).build());
    }

    /**
     * Scope the rate limit by the value of a request header
     * @param name Header name
     * @return Chainable builder
     */
    public HttpRequestPolicyBuilder credentialHeader(String name) {
        return credentialResolver(request -> request.headers().firstValue(name).orElse(null));
    }

    @Override
    protected HttpRequestPolicyBuilder self() {
        return this;
    }
}
