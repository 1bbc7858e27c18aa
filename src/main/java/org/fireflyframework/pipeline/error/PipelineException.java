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
 * Base type for every failure raised by the middleware pipeline.
 *
 * <p>Each subtype reports a stable {@link #getErrorKind() error kind} that is safe to
 * expose to clients, for example inside a recovery payload. The underlying failure,
 * when there is one, is always available as the exception cause.</p>
 */
@Getter
public abstract class PipelineException extends RuntimeException {

    private final String errorKind;

    protected PipelineException(String errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }
}
