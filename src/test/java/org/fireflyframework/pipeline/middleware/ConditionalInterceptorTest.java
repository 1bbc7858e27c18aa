/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
package org.fireflyframework.pipeline.middleware;

import org.fireflyframework.pipeline.core.PipelineContext;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConditionalInterceptor} and {@link ConditionalTransform}.
 */
class ConditionalInterceptorTest {

    private final AtomicInteger innerCalls = new AtomicInteger();

    private final Interceptor<String, String> auth = Middlewares.interceptor("auth", (request, context, next) -> {
        innerCalls.incrementAndGet();
        return next.handle(request).map(result -> result + "+auth");
    });

    @Test
    void intercept_shouldDelegateWhenPredicateMatches() {
        // Given
        PipelineContext context = PipelineContext.of("req-1", "/api/users");
        Interceptor<String, String> conditional = Middlewares.when(path -> path.startsWith("/api"), auth);

        // When & Then
        StepVerifier.create(conditional.intercept("/api/users", context, Mono::just))
                .expectNext("/api/users+auth")
                .verifyComplete();

        assertThat(innerCalls).hasValue(1);
        assertThat(context.getSkippedMiddleware()).isEmpty();
    }

    @Test
    void intercept_shouldCallNextDirectlyAndRecordSkipWhenPredicateFails() {
        // Given
        PipelineContext context = PipelineContext.of("req-1", "/health");
        Interceptor<String, String> conditional = new ConditionalInterceptor<>(path -> path.startsWith("/api"), auth);

        // When & Then
        StepVerifier.create(conditional.intercept("/health", context, Mono::just))
                .expectNext("/health")
                .verifyComplete();

        assertThat(innerCalls).hasValue(0);
        assertThat(context.getSkippedMiddleware()).containsExactly("auth");
    }

    @Test
    void getName_shouldExposeInnerName() {
        // When & Then
        assertThat(Middlewares.when(path -> true, auth).getName()).isEqualTo("auth");
    }

    @Test
    void conditionalTransform_shouldPassPayloadThroughWhenSkipped() {
        // Given
        PipelineContext context = PipelineContext.of("req-1", "payload");
        TransformMiddleware<String> shout = Middlewares.transform("shout",
                (payload, ctx) -> Mono.just(payload.toUpperCase()));
        TransformMiddleware<String> conditional = Middlewares.whenPayload(payload -> payload.length() > 3, shout);

        // When & Then
        StepVerifier.create(conditional.process("abc", context)).expectNext("abc").verifyComplete();
        StepVerifier.create(conditional.process("abcd", context)).expectNext("ABCD").verifyComplete();
        assertThat(context.getSkippedMiddleware()).containsExactly("shout");
    }
}
