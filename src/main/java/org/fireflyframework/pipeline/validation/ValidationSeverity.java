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

/**
 * Severity levels for request validation rule violations.
 *
 * <ul>
 *   <li>{@link #INFO} - Informational, recorded in the report only</li>
 *   <li>{@link #WARNING} - Recorded and logged, the request continues</li>
 *   <li>{@link #CRITICAL} - Rejects the request</li>
 * </ul>
 */
public enum ValidationSeverity {

    INFO,
    WARNING,
    CRITICAL
}
