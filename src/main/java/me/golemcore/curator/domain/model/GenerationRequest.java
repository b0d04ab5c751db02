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
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable working state of a generation request while it moves through
 * resolution, fitting and dispatch. The provider, model and prompt change as
 * the request falls back. Never persisted.
 */
@Data
@Builder
public class GenerationRequest {

    private String requestId;
    private String prompt;
    private String alias;
    private String provider;
    private String model;
    @Builder.Default
    private GenerationParameters parameters = GenerationParameters.defaults();
    @Builder.Default
    private Correlation correlation = Correlation.none();
    @Builder.Default
    private CancellationToken cancellationToken = new CancellationToken();
    private Instant startedAt;
    private boolean truncated;
    private int attempts;
    @Builder.Default
    private List<FailedAttempt> failedAttempts = new ArrayList<>();

    public void recordFailedAttempt(ErrorKind kind, String message) {
        failedAttempts.add(FailedAttempt.builder()
                .provider(provider)
                .model(model)
                .errorKind(kind)
                .message(message)
                .build());
    }
}
