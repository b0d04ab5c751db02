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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ProviderCall;
import me.golemcore.curator.domain.model.ProviderReply;
import me.golemcore.curator.domain.service.ContextWindowManager;
import me.golemcore.curator.domain.service.LlmErrorClassifier;
import me.golemcore.curator.port.outbound.LlmPort;

import java.util.List;

/**
 * Base for vendors reached through a langchain4j {@link ChatModel}.
 *
 * <p>
 * A model instance is built per call from the call's provider settings, with
 * library retries disabled. Failures are classified into
 * {@link ProviderException}. When the vendor omits token usage the counts are
 * estimated from text length.
 */
@Slf4j
public abstract class ChatModelAdapter implements LlmPort {

    private final ContextWindowManager contextWindowManager;

    protected ChatModelAdapter(ContextWindowManager contextWindowManager) {
        this.contextWindowManager = contextWindowManager;
    }

    @Override
    public ProviderReply generate(ProviderCall call) {
        String provider = call.getProvider().getName();

        ChatResponse response;
        try {
            ChatModel model = createChatModel(call);
            List<ChatMessage> messages = List.of(UserMessage.from(call.getPrompt()));
            response = model.chat(messages);
        } catch (RuntimeException e) {
            ProviderException classified = LlmErrorClassifier.toProviderException(provider, e);
            log.debug("[{}] Call failed | model={} | kind={} | error={}", getProviderType(), call.getModel(),
                    classified.getKind(), e.getMessage());
            throw classified;
        }

        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        TokenUsage usage = response.tokenUsage();
        Integer input = usage != null ? usage.inputTokenCount() : null;
        Integer output = usage != null ? usage.outputTokenCount() : null;

        return ProviderReply.builder()
                .text(text != null ? text : "")
                .inputTokens(input != null ? input : contextWindowManager.estimateTokens(call.getPrompt()))
                .outputTokens(output != null ? output : contextWindowManager.estimateTokens(text))
                .model(response.modelName() != null ? response.modelName() : call.getModel())
                .build();
    }

    /**
     * Builds the vendor model for one call.
     */
    protected abstract ChatModel createChatModel(ProviderCall call);
}
