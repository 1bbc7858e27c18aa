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
package org.fireflyframework.pipeline.error;

import lombok.Getter;
import org.fireflyframework.pipeline.core.PipelineStage;

/**
 * Raised when a transform middleware in a sequential stage
 * ({@link PipelineStage#PRE_PROCESSING} or {@link PipelineStage#POST_PROCESSING}) fails.
 */
@Getter
public class StageMiddlewareException extends PipelineException {

    public static final String ERROR_KIND = "stage_middleware_error";

    private final PipelineStage stage;
    private final String middlewareName;

    public StageMiddlewareException(PipelineStage stage, String middlewareName, Throwable cause) {
        super(ERROR_KIND,
                "Middleware '" + middlewareName + "' failed in stage " + stage + ": " + describe(cause),
                cause);
        this.stage = stage;
        this.middlewareName = middlewareName;
    }

    static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
