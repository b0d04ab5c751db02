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

package me.golemcore.curator.usage;

import me.golemcore.curator.domain.model.GenerationOutcome;
import me.golemcore.curator.domain.model.ModelUsage;
import me.golemcore.curator.domain.model.OutcomeStatus;

/**
 * Running totals for one workflow, step, provider and model combination.
 * Updated on every record; the average duration is maintained incrementally
 * over successful requests.
 */
final class UsageAggregate {

    private final String provider;
    private final String model;
    private long requests;
    private long successes;
    private long errors;
    private long cancelled;
    private long inputTokens;
    private long outputTokens;
    private double cost;
    private double avgDurationMs;

    UsageAggregate(String provider, String model) {
        this.provider = provider;
        this.model = model;
    }

    synchronized void add(GenerationOutcome outcome) {
        requests++;
        if (outcome.getStatus() == OutcomeStatus.SUCCESS) {
            successes++;
            avgDurationMs += (outcome.getDurationMs() - avgDurationMs) / successes;
        } else if (outcome.getStatus() == OutcomeStatus.CANCELLED) {
            cancelled++;
        } else {
            errors++;
        }
        if (outcome.getInputTokens() != null) {
            inputTokens += outcome.getInputTokens();
        }
        if (outcome.getOutputTokens() != null) {
            outputTokens += outcome.getOutputTokens();
        }
        cost += outcome.getCost();
    }

    synchronized ModelUsage snapshot() {
        return ModelUsage.builder()
                .provider(provider)
                .model(model)
                .requests(requests)
                .successes(successes)
                .errors(errors)
                .cancelled(cancelled)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .cost(cost)
                .avgDurationMs(avgDurationMs)
                .build();
    }

    /**
     * Combines two snapshots, weighting the average duration by the number of
     * successes behind each.
     */
    static ModelUsage merge(ModelUsage left, ModelUsage right, String provider, String model) {
        long successes = left.getSuccesses() + right.getSuccesses();
        double avg = successes == 0 ? 0.0
                : (left.getAvgDurationMs() * left.getSuccesses() + right.getAvgDurationMs() * right.getSuccesses())
                        / successes;
        return ModelUsage.builder()
                .provider(provider)
                .model(model)
                .requests(left.getRequests() + right.getRequests())
                .successes(successes)
                .errors(left.getErrors() + right.getErrors())
                .cancelled(left.getCancelled() + right.getCancelled())
                .inputTokens(left.getInputTokens() + right.getInputTokens())
                .outputTokens(left.getOutputTokens() + right.getOutputTokens())
                .cost(left.getCost() + right.getCost())
                .avgDurationMs(avg)
                .build();
    }
}
