/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.curator.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result handed back to the caller: generated text plus metering on success,
 * a {@link GenerationError} otherwise.
 */
@Value
@Builder
public class GenerationResult {

    String requestId;
    String text;
    String provider;
    String model;
    Integer inputTokens;
    Integer outputTokens;
    double cost;
    int attempts;
    long durationMs;
    boolean truncated;
    GenerationError error;

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isCancelled() {
        return error != null && error.kind() == ErrorKind.CANCELLED;
    }
}
