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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Terminal record of one generation request, written to the usage tracker for
 * every request regardless of how it ended.
 *
 * <p>
 * Provider and model name the last provider attempted (null when alias
 * resolution failed). Token counts are null when no provider produced a
 * response.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GenerationOutcome {

    String requestId;
    Instant timestamp;
    String alias;
    String provider;
    String model;
    String workflowId;
    String stepName;
    Integer inputTokens;
    Integer outputTokens;
    double cost;
    long durationMs;
    OutcomeStatus status;
    ErrorKind errorKind;
    ErrorKind lastErrorKind;
    String errorMessage;
    int attempts;
    @Singular
    List<FailedAttempt> failedAttempts;
    boolean truncated;

    @JsonIgnore
    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }

    @JsonIgnore
    public int totalTokens() {
        int input = inputTokens != null ? inputTokens : 0;
        int output = outputTokens != null ? outputTokens : 0;
        return input + output;
    }
}
