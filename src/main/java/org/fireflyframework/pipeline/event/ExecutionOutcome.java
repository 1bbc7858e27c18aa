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
package org.fireflyframework.pipeline.event;

/**
 * How a single {@code execute} call ended.
 *
 * <ul>
 *   <li>{@link #COMPLETED} - the result went through every stage</li>
 *   <li>{@link #RECOVERED} - a failure was turned into a recovery payload</li>
 *   <li>{@link #FAILED} - a failure was propagated to the caller</li>
 *   <li>{@link #CANCELLED} - the subscriber cancelled before completion</li>
 * </ul>
 */
public enum ExecutionOutcome {

    COMPLETED,
    RECOVERED,
    FAILED,
    CANCELLED
}
