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
package org.fireflyframework.pipeline.validation;

import lombok.Getter;
import org.fireflyframework.pipeline.error.RequestRejectedException;

import java.util.stream.Collectors;

/**
 * Raised by a {@link ValidationMiddleware} when a CRITICAL rule rejects the request.
 */
@Getter
public class RequestValidationException extends RequestRejectedException {

    public static final String ERROR_KIND = "validation_error";

    private final ValidationReport report;

    public RequestValidationException(ValidationReport report) {
        super(ERROR_KIND, "Request validation failed: " + summarize(report));
        this.report = report;
    }

    private static String summarize(ValidationReport report) {
        return report.getFailures().stream()
                .filter(ValidationResult::isRejecting)
                .map(ValidationResult::getMessage)
                .collect(Collectors.joining("; "));
    }
}
