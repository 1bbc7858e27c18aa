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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic, safe description of a failed request, returned in place of a result when
 * error recovery is enabled.
 */
@Data
@Builder
public class RecoveryPayload {

    public static final String DEFAULT_ERROR = "Internal Server Error";
    public static final String SAFE_MESSAGE = "An error occurred while processing the request";

    private final String error;
    private final String errorKind;
    private final String message;
    private final String requestId;
    private final Instant timestamp;

    /**
     * Returns the payload as an insertion-ordered map with the keys {@code error},
     * {@code error_kind}, {@code message}, {@code request_id} and {@code timestamp}.
     *
     * @return the map representation
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("error", error);
        map.put("error_kind", errorKind);
        map.put("message", message);
        map.put("request_id", requestId);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
