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

package me.golemcore.curator.adapter.outbound.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.curator.domain.model.GenerationParameters;
import me.golemcore.curator.domain.model.ProviderCall;
import me.golemcore.curator.domain.service.ContextWindowManager;
import org.springframework.stereotype.Component;

/**
 * OpenAI chat completions, also used for OpenAI-compatible endpoints through
 * {@code base-url}.
 */
@Component
public class OpenAiProviderAdapter extends ChatModelAdapter {

    public static final String TYPE = "openai";

    public OpenAiProviderAdapter(ContextWindowManager contextWindowManager) {
        super(contextWindowManager);
    }

    @Override
    public String getProviderType() {
        return TYPE;
    }

    @Override
    protected ChatModel createChatModel(ProviderCall call) {
        GenerationParameters parameters = call.getParameters();
        var builder = OpenAiChatModel.builder()
                .apiKey(call.getApiKey())
                .modelName(call.getModel())
                .maxRetries(0)
                .timeout(call.getTimeout());

        if (call.getProvider().getBaseUrl() != null) {
            builder.baseUrl(call.getProvider().getBaseUrl());
        }
        if (parameters.getTemperature() != null) {
            builder.temperature(parameters.getTemperature());
        }
        if (parameters.getTopP() != null) {
            builder.topP(parameters.getTopP());
        }
        if (parameters.getMaxTokens() != null) {
            builder.maxTokens(parameters.getMaxTokens());
        }
        if (!parameters.getStopSequences().isEmpty()) {
            builder.stop(parameters.getStopSequences());
        }

        return builder.build();
    }
}
