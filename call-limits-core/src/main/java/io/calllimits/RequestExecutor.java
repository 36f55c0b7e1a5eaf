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
package io.calllimits;

import java.util.concurrent.CompletionStage;

/**
 * Executes a single attempt of a request against the transport.
 *
 * @param <RequestT> Request type
 * @param <T> Result type of a successful attempt
 */
@FunctionalInterface
public interface RequestExecutor<RequestT, T> {
    /**
     * @param request A fresh copy of the request, owned by this attempt
     * @return Stage completed with the outcome of the attempt.  Completing it exceptionally is
     *         equivalent to {@link Attempt#failure(Throwable)}, unless the policy classifies the
     *         exception as a rate limit rejection.
     */
    CompletionStage<Attempt<T>> execute(RequestT request);
}
