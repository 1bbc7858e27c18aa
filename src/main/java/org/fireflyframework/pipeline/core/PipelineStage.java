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
package org.fireflyframework.pipeline.core;

import org.fireflyframework.pipeline.middleware.CleanupHandler;
import org.fireflyframework.pipeline.middleware.ErrorHandler;
import org.fireflyframework.pipeline.middleware.Interceptor;
import org.fireflyframework.pipeline.middleware.TransformMiddleware;

/**
 * The five phases a request passes through, each with its own execution model.
 *
 * <ul>
 *   <li>{@link #PRE_PROCESSING} - sequential {@link TransformMiddleware} over the request</li>
 *   <li>{@link #REQUEST_HANDLING} - {@link Interceptor}s nested around the terminal handler</li>
 *   <li>{@link #POST_PROCESSING} - sequential {@link TransformMiddleware} over the result</li>
 *   <li>{@link #ERROR_HANDLING} - best-effort {@link ErrorHandler}s, only on failure</li>
 *   <li>{@link #CLEANUP} - best-effort {@link CleanupHandler}s, always</li>
 * </ul>
 */
public enum PipelineStage {

    PRE_PROCESSING("pre_processing"),
    REQUEST_HANDLING("request_handling"),
    POST_PROCESSING("post_processing"),
    ERROR_HANDLING("error_handling"),
    CLEANUP("cleanup");

    private final String value;

    PipelineStage(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
