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
package org.fireflyframework.pipeline.integration;

import org.fireflyframework.pipeline.core.MiddlewarePipeline;
import org.fireflyframework.pipeline.core.PipelineConfig;
import org.fireflyframework.pipeline.core.PipelineContext;
import org.fireflyframework.pipeline.core.RecoveryPayload;
import org.fireflyframework.pipeline.error.StageMiddlewareException;
import org.fireflyframework.pipeline.middleware.Middlewares;
import org.fireflyframework.pipeline.middleware.RequestHandler;
import org.fireflyframework.pipeline.validation.RequestValidationException;
import org.fireflyframework.pipeline.validation.ValidationMiddleware;
import org.fireflyframework.pipeline.validation.ValidationReport;
import org.fireflyframework.pipeline.validation.ValidationRule;
import org.fireflyframework.pipeline.validation.ValidationStrategy;
import org.fireflyframework.pipeline.validation.rules.AllowedValuesRule;
import org.fireflyframework.pipeline.validation.rules.NotNullRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of a map-shaped pipeline the way a web server layer drives it:
 * validation in pre-processing, an auth gate and a downstream interceptor in request
 * handling, and a routed handler.
 */
class RequestLifecycleIntegrationTest {

    private final AtomicInteger handlerCalls = new AtomicInteger();
    private final AtomicInteger downstreamCalls = new AtomicInteger();
    private final AtomicReference<PipelineContext> lastContext = new AtomicReference<>();

    private MiddlewarePipeline<Map<String, Object>, Map<String, Object>> pipeline;
    private RequestHandler<Map<String, Object>, Map<String, Object>> handler;

    @BeforeEach
    void setUp() {
        ValidationRule<Map<String, Object>> methodRule = new AllowedValuesRule<>(
                "method", Set.of("GET", "POST", "PUT", "DELETE"), request -> request.get("method"));
        ValidationRule<Map<String, Object>> pathRule = new NotNullRule<>("path", request -> request.get("path"));

        pipeline = MiddlewarePipeline.forMaps(PipelineConfig.defaults())
                .preProcessing(new ValidationMiddleware<>("request-validation",
                        List.of(methodRule, pathRule), ValidationStrategy.COLLECT_ALL))
                .use(Middlewares.interceptor("auth", (request, context, next) -> {
                    Object headers = request.get("headers");
                    if (!(headers instanceof Map) || !((Map<?, ?>) headers).containsKey("Authorization")) {
                        return Mono.just(Map.<String, Object>of("status", 401));
                    }
                    return next.handle(request);
                }))
                .use(Middlewares.interceptor("downstream", (request, context, next) -> {
                    downstreamCalls.incrementAndGet();
                    return next.handle(request);
                }))
                .cleanup(Middlewares.cleanup("capture", context -> Mono.fromRunnable(() -> lastContext.set(context))));

        handler = request -> {
            handlerCalls.incrementAndGet();
            return Mono.just(Map.of("status", 200, "path", request.get("path")));
        };
    }

    @Test
    void disallowedMethod_shouldReturnRecoveryPayloadWithoutReachingHandler() {
        // Given - TRACE is not an accepted method
        Map<String, Object> request = Map.of(
                "method", "TRACE",
                "path", "/users",
                "headers", Map.of("Authorization", "Bearer token"));

        // When & Then
        StepVerifier.create(pipeline.execute(request, handler))
                .assertNext(response -> {
                    assertThat(response).containsEntry("error", RecoveryPayload.DEFAULT_ERROR);
                    assertThat(response).containsEntry("error_kind", StageMiddlewareException.ERROR_KIND);
                    assertThat(response.get("request_id")).isEqualTo(lastContext.get().getRequestId());
                })
                .verifyComplete();

        assertThat(handlerCalls).hasValue(0);
        assertThat(downstreamCalls).hasValue(0);

        PipelineContext context = lastContext.get();
        assertThat(context.getErrors()).hasSize(1);
        assertThat(context.getErrors().get(0)).hasCauseInstanceOf(RequestValidationException.class);
        ValidationReport report = (ValidationReport) context.getMiddlewareData(
                "request-validation", ValidationMiddleware.REPORT_KEY);
        assertThat(report.isPassed()).isFalse();
        assertThat(report.getFailures()).extracting("fieldName").containsExactly("method");
    }

    @Test
    void missingAuthorization_shouldReturnUnauthorizedWithoutRunningDownstream() {
        // Given
        Map<String, Object> request = Map.of("method", "GET", "path", "/users");

        // When & Then
        StepVerifier.create(pipeline.execute(request, handler))
                .expectNext(Map.of("status", 401))
                .verifyComplete();

        assertThat(handlerCalls).hasValue(0);
        assertThat(downstreamCalls).hasValue(0);
        assertThat(lastContext.get().getErrors()).isEmpty();
    }

    @Test
    void validAuthorizedRequest_shouldReachHandler() {
        // Given
        Map<String, Object> request = Map.of(
                "method", "GET",
                "path", "/users",
                "headers", Map.of("Authorization", "Bearer token"));

        // When & Then
        StepVerifier.create(pipeline.execute(request, handler))
                .expectNext(Map.of("status", 200, "path", "/users"))
                .verifyComplete();

        assertThat(handlerCalls).hasValue(1);
        assertThat(downstreamCalls).hasValue(1);
        assertThat(lastContext.get().getExecutedMiddleware())
                .containsExactly("request-validation", "auth", "downstream", "capture");
        assertThat(pipeline.getStats().getActiveContexts()).isZero();
    }
}
