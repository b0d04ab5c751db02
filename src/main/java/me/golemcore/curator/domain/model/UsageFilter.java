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

import java.util.Objects;

/**
 * Selects usage records by workflow and step. A null component matches any
 * value.
 */
public record UsageFilter(String workflowId, String stepName) {

    private static final UsageFilter ALL = new UsageFilter(null, null);

    public static UsageFilter all() {
        return ALL;
    }

    public static UsageFilter workflow(String workflowId) {
        return new UsageFilter(workflowId, null);
    }

    public static UsageFilter step(String workflowId, String stepName) {
        return new UsageFilter(workflowId, stepName);
    }

    public boolean matches(String recordWorkflowId, String recordStepName) {
        return (workflowId == null || Objects.equals(workflowId, recordWorkflowId))
                && (stepName == null || Objects.equals(stepName, recordStepName));
    }
}
