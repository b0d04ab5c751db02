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

package me.golemcore.curator.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;
import me.golemcore.curator.domain.model.FitResult;
import me.golemcore.curator.domain.model.ModelCapability;
import me.golemcore.curator.domain.model.TruncationStrategy;
import me.golemcore.curator.infrastructure.config.CuratorProperties;
import org.springframework.stereotype.Service;

/**
 * Keeps prompts within the input budget of a model.
 *
 * <p>
 * Token counts are approximated as {@code ceil(chars / charsPerToken)}, which
 * overestimates for English prose and is close enough for budgeting. The
 * budget is the context window minus the reserved output tokens
 * ({@code max(requested, model max output)}) minus a safety margin.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextWindowManager {

    static final String TRUNCATION_MARKER = "\n[... truncated ...]\n";

    private final CuratorProperties properties;

    public int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int charsPerToken = charsPerToken();
        return (text.length() + charsPerToken - 1) / charsPerToken;
    }

    public int budgetFor(ModelCapability model, Integer requestedOutputTokens) {
        int requested = requestedOutputTokens != null ? requestedOutputTokens : 0;
        int reserved = Math.max(requested, model.getMaxOutputTokens());
        return model.getContextWindow() - reserved - properties.getContext().getSafetyMarginTokens();
    }

    /**
     * Truncates the prompt if its estimate exceeds the model's input budget.
     *
     * @throws ProviderException
     *             of kind {@link ErrorKind#INVALID_REQUEST} if the model leaves
     *             no room for input at all
     */
    public FitResult fit(String prompt, ModelCapability model, Integer requestedOutputTokens) {
        String text = prompt != null ? prompt : "";
        int budget = budgetFor(model, requestedOutputTokens);
        if (budget <= 0) {
            throw new ProviderException(ErrorKind.INVALID_REQUEST, model.getProvider(),
                    "Model " + model.getName() + " has no input budget left (window=" + model.getContextWindow()
                            + ", budget=" + budget + ")");
        }

        int estimate = estimateTokens(text);
        if (estimate <= budget) {
            return new FitResult(text, false, estimate, budget);
        }

        String truncated = truncate(text, (long) budget * charsPerToken());
        int truncatedEstimate = estimateTokens(truncated);
        log.warn("[Context] Prompt truncated | model={}/{} | originalChars={} | truncatedChars={} | "
                + "estimatedTokens={} | budgetTokens={}",
                model.getProvider(), model.getName(), text.length(), truncated.length(), estimate, budget);
        return new FitResult(truncated, true, truncatedEstimate, budget);
    }

    private String truncate(String text, long maxCharsLong) {
        int maxChars = (int) Math.min(maxCharsLong, text.length());
        String marker = TRUNCATION_MARKER.length() < maxChars ? TRUNCATION_MARKER : "";
        int keep = maxChars - marker.length();

        if (properties.getContext().getTruncation() == TruncationStrategy.HEAD) {
            int start = text.length() - keep;
            if (start < text.length() && Character.isLowSurrogate(text.charAt(start))) {
                start++;
            }
            return marker + text.substring(start);
        }

        int end = keep;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + marker;
    }

    private int charsPerToken() {
        return Math.max(1, properties.getContext().getCharsPerToken());
    }
}
