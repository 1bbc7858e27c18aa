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

/**
 * Raised by a transform that deliberately refuses the request, as opposed to one that
 * failed while processing it.
 *
 * <p>A rejection always ends its stage and enters the failure path, even when error
 * recovery is enabled, so the handler chain is never reached with a rejected request.</p>
 */
public abstract class RequestRejectedException extends PipelineException {

    protected RequestRejectedException(String errorKind, String message) {
        super(errorKind, message, null);
    }
}
