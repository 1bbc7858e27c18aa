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

import lombok.Getter;
import org.fireflyframework.pipeline.core.MiddlewarePipeline;
import org.fireflyframework.pipeline.core.PipelineStage;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A middleware tagged with the stage it belongs to, typed for the pipeline it is
 * registered with.
 *
 * <p>Each factory fixes the stage from the middleware shape, so a transform over the
 * wrong payload type is rejected by the compiler instead of failing per request.
 * Declared as Spring beans, registrations are picked up by the auto-configured
 * pipeline in bean order:</p>
 * <pre>{@code
 * @Bean
 * MiddlewareRegistration<Object, Object> requestLogging() {
 *     return MiddlewareRegistration.requestHandling(Middlewares.requestLogging("access"));
 * }
 * }</pre>
 *
 * @param <Q> the request type of the target pipeline
 * @param <R> the result type of the target pipeline
 */
public final class MiddlewareRegistration<Q, R> {

    @Getter
    private final PipelineStage stage;

    @Getter
    private final Middleware middleware;

    private final Consumer<MiddlewarePipeline<Q, R>> registrar;

    private MiddlewareRegistration(PipelineStage stage, Middleware middleware,
                                   Consumer<MiddlewarePipeline<Q, R>> registrar) {
        this.stage = stage;
        this.middleware = Objects.requireNonNull(middleware, "middleware must not be null");
        this.registrar = registrar;
    }

    public static <Q, R> MiddlewareRegistration<Q, R> preProcessing(TransformMiddleware<Q> transform) {
        return new MiddlewareRegistration<>(PipelineStage.PRE_PROCESSING, transform,
                pipeline -> pipeline.preProcessing(transform));
    }

    public static <Q, R> MiddlewareRegistration<Q, R> requestHandling(Interceptor<Q, R> interceptor) {
        return new MiddlewareRegistration<>(PipelineStage.REQUEST_HANDLING, interceptor,
                pipeline -> pipeline.use(interceptor));
    }

    public static <Q, R> MiddlewareRegistration<Q, R> postProcessing(TransformMiddleware<R> transform) {
        return new MiddlewareRegistration<>(PipelineStage.POST_PROCESSING, transform,
                pipeline -> pipeline.postProcessing(transform));
    }

    public static <Q, R> MiddlewareRegistration<Q, R> errorHandling(ErrorHandler handler) {
        return new MiddlewareRegistration<>(PipelineStage.ERROR_HANDLING, handler,
                pipeline -> pipeline.errorHandling(handler));
    }

    public static <Q, R> MiddlewareRegistration<Q, R> cleanup(CleanupHandler handler) {
        return new MiddlewareRegistration<>(PipelineStage.CLEANUP, handler,
                pipeline -> pipeline.cleanup(handler));
    }

    /**
     * Appends the middleware to {@code pipeline} in its stage.
     */
    public void registerWith(MiddlewarePipeline<Q, R> pipeline) {
        registrar.accept(pipeline);
    }

    @Override
    public String toString() {
        return "MiddlewareRegistration(" + stage + ", " + middleware.getName() + ")";
    }
}
