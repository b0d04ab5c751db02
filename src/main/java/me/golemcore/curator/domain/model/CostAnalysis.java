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

import java.time.Duration;
import java.util.Map;

/**
 * Spending summary over a time window with a per-provider breakdown.
 */
@Value
@Builder
public class CostAnalysis {

    Duration window;
    long totalRequests;
    long successfulRequests;
    long totalTokens;
    double totalCost;
    double averageCostPerRequest;
    double successRate;
    Map<String, ProviderCost> byProvider;

    @Value
    @Builder
    public static class ProviderCost {
        long requests;
        long tokens;
        double cost;
        double averageCostPerRequest;
    }
}
