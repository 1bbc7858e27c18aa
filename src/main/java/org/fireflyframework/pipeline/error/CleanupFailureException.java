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

/**
 * Describes a failure of a cleanup middleware. Never propagated past the cleanup
 * phase; only logged.
 */
@Getter
public class CleanupFailureException extends PipelineException {

    public static final String ERROR_KIND = "cleanup_failure";

    private final String handlerName;

    public CleanupFailureException(String handlerName, Throwable cause) {
        super(ERROR_KIND,
                "Cleanup handler '" + handlerName + "' failed: " + StageMiddlewareException.describe(cause),
                cause);
        this.handlerName = handlerName;
    }
}
