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
 * Outcome of a requests-per-minute bucket check.
 */
@Value
@Builder
public class RateLimitResult {

    boolean allowed;
    long remainingTokens;
    long waitMillis;
    String reason;

    public static RateLimitResult allowed(long remaining) {
        return RateLimitResult.builder()
                .allowed(true)
                .remainingTokens(remaining)
                .waitMillis(0)
                .build();
    }

    public static RateLimitResult denied(long waitMillis, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .remainingTokens(0)
                .waitMillis(waitMillis)
                .reason(reason)
                .build();
    }
}
