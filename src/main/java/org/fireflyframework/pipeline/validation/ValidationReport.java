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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated outcome of a {@link ValidationMiddleware} run. A report passes unless at
 * least one CRITICAL rule failed.
 */
@Data
@Builder
public class ValidationReport {

    private final boolean passed;
    private final int totalRules;
    private final int passedRules;
    private final int failedRules;
    private final List<ValidationResult> results;
    private final Instant timestamp;

    public List<ValidationResult> getFailures() {
        return results.stream()
                .filter(result -> !result.isPassed())
                .toList();
    }

    public List<ValidationResult> getBySeverity(ValidationSeverity severity) {
        return results.stream()
                .filter(result -> result.getSeverity() == severity)
                .toList();
    }

    static ValidationReport of(List<ValidationResult> results) {
        int passedCount = 0;
        boolean rejected = false;
        for (ValidationResult result : results) {
            if (result.isPassed()) {
                passedCount++;
            } else if (result.isRejecting()) {
                rejected = true;
            }
        }
        return ValidationReport.builder()
                .passed(!rejected)
                .totalRules(results.size())
                .passedRules(passedCount)
                .failedRules(results.size() - passedCount)
                .results(List.copyOf(results))
                .timestamp(Instant.now())
                .build();
    }
}
