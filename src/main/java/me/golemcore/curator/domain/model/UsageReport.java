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

import java.time.Instant;
import java.util.Map;

/**
 * Usage aggregated per provider and model for the records matching a filter.
 * Entries are keyed by {@code provider/model}.
 */
@Value
@Builder
public class UsageReport {

    String workflowId;
    String stepName;
    Instant generatedAt;
    Map<String, ModelUsage> byModel;
    ModelUsage totals;

    public static UsageReport empty(UsageFilter filter, Instant generatedAt) {
        return UsageReport.builder()
                .workflowId(filter.workflowId())
                .stepName(filter.stepName())
                .generatedAt(generatedAt)
                .byModel(Map.of())
                .totals(ModelUsage.builder().build())
                .build();
    }
}
