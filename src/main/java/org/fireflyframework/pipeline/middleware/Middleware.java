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

/**
 * Common supertype of every value that can be registered in a
 * {@link org.fireflyframework.pipeline.core.MiddlewarePipeline}.
 *
 * <p>The pipeline dispatches on the concrete shape: {@link TransformMiddleware},
 * {@link Interceptor}, {@link ErrorHandler} or {@link CleanupHandler}. Each
 * {@link org.fireflyframework.pipeline.core.PipelineStage stage} accepts exactly one shape.</p>
 */
public interface Middleware {

    /**
     * Returns the identity of this middleware, used in error reports, execution trails,
     * timings and as the namespace of the middleware-scoped context store.
     *
     * <p>Defaults to the simple class name, or {@code "anonymous"} for lambdas and
     * anonymous classes. Use {@link Middlewares} to give a lambda a meaningful name.</p>
     *
     * @return the middleware name
     */
    default String getName() {
        Class<?> type = getClass();
        String simpleName = type.getSimpleName();
        if (type.isSynthetic() || simpleName.isEmpty() || simpleName.contains("$$Lambda")) {
            return "anonymous";
        }
        return simpleName;
    }
}
