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
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Connection and policy settings of one configured LLM provider.
 *
 * <p>
 * The credential is kept as a reference ({@code env(NAME)}) and resolved only
 * when a call is dispatched.
 */
@Value
@Builder(toBuilder = true)
public class ProviderConfig {

    String name;
    String type;
    String baseUrl;
    String credentialRef;
    String defaultModel;
    @Singular("fallback")
    List<String> fallbackChain;
    @Builder.Default
    Duration timeout = Duration.ofSeconds(60);
    @Builder.Default
    int maxRetries = 2;
    @Builder.Default
    int maxConcurrentRequests = 4;
    int requestsPerMinute;
    double defaultInputCostPer1k;
    double defaultOutputCostPer1k;
}
