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
 * Usage totals of one provider and model pair, or of a whole report.
 * Average duration covers successful requests only.
 */
@Value
@Builder
public class ModelUsage {

    String provider;
    String model;
    long requests;
    long successes;
    long errors;
    long cancelled;
    long inputTokens;
    long outputTokens;
    double cost;
    double avgDurationMs;

    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
