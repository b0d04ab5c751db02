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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Request;
import feign.RequestLine;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;
import me.golemcore.curator.domain.model.GenerationParameters;
import me.golemcore.curator.domain.model.ProviderCall;
import me.golemcore.curator.domain.model.ProviderReply;
import me.golemcore.curator.domain.service.ContextWindowManager;
import me.golemcore.curator.domain.service.LlmErrorClassifier;
import me.golemcore.curator.infrastructure.http.FeignClientFactory;
import me.golemcore.curator.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Locally hosted Ollama server, called through its {@code /api/generate}
 * endpoint with streaming disabled. No credential is needed.
 *
 * <p>
 * One Feign client is kept per base URL. The call timeout travels with each
 * request as {@link Request.Options}.
 */
@Component
@Slf4j
public class OllamaProviderAdapter implements LlmPort {

    public static final String TYPE = "ollama";
    static final String DEFAULT_BASE_URL = "http://localhost:11434";

    private final FeignClientFactory feignClientFactory;
    private final ContextWindowManager contextWindowManager;
    private final Map<String, OllamaApi> clients = new ConcurrentHashMap<>();

    public OllamaProviderAdapter(FeignClientFactory feignClientFactory, ContextWindowManager contextWindowManager) {
        this.feignClientFactory = feignClientFactory;
        this.contextWindowManager = contextWindowManager;
    }

    @Override
    public String getProviderType() {
        return TYPE;
    }

    @Override
    public boolean requiresCredential() {
        return false;
    }

    @Override
    public ProviderReply generate(ProviderCall call) {
        String provider = call.getProvider().getName();
        String baseUrl = call.getProvider().getBaseUrl() != null ? call.getProvider().getBaseUrl()
                : DEFAULT_BASE_URL;
        OllamaApi api = clients.computeIfAbsent(baseUrl, url -> feignClientFactory.create(OllamaApi.class, url));

        GenerateResponse response;
        try {
            response = api.generate(toRequest(call), feignClientFactory.requestOptions(call.getTimeout()));
        } catch (RuntimeException e) {
            ProviderException classified = LlmErrorClassifier.toProviderException(provider, e);
            log.debug("[Ollama] Call failed | model={} | kind={} | error={}", call.getModel(),
                    classified.getKind(), e.getMessage());
            throw classified;
        }

        if (response == null || response.getResponse() == null) {
            throw new ProviderException(ErrorKind.PROVIDER_UNAVAILABLE, provider, "Empty response from Ollama");
        }

        String text = response.getResponse();
        return ProviderReply.builder()
                .text(text)
                .inputTokens(response.getPromptEvalCount() != null ? response.getPromptEvalCount()
                        : contextWindowManager.estimateTokens(call.getPrompt()))
                .outputTokens(response.getEvalCount() != null ? response.getEvalCount()
                        : contextWindowManager.estimateTokens(text))
                .model(response.getModel() != null ? response.getModel() : call.getModel())
                .build();
    }

    private GenerateRequest toRequest(ProviderCall call) {
        GenerationParameters parameters = call.getParameters();
        GenerateOptions options = new GenerateOptions();
        options.setTemperature(parameters.getTemperature());
        options.setTopP(parameters.getTopP());
        options.setNumPredict(parameters.getMaxTokens() != null ? parameters.getMaxTokens()
                : call.getMaxOutputTokens());
        options.setStop(parameters.getStopSequences().isEmpty() ? null : parameters.getStopSequences());

        GenerateRequest request = new GenerateRequest();
        request.setModel(call.getModel());
        request.setPrompt(call.getPrompt());
        request.setStream(false);
        request.setOptions(options);
        return request;
    }

    // Feign API interface
    public interface OllamaApi {
        @RequestLine("POST /api/generate")
        @Headers("Content-Type: application/json")
        GenerateResponse generate(GenerateRequest request, Request.Options options);
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GenerateRequest {
        private String model;
        private String prompt;
        private boolean stream;
        private GenerateOptions options;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GenerateOptions {
        private Double temperature;
        @JsonProperty("top_p")
        private Double topP;
        @JsonProperty("num_predict")
        private Integer numPredict;
        private List<String> stop;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerateResponse {
        private String model;
        private String response;
        private boolean done;
        @JsonProperty("prompt_eval_count")
        private Integer promptEvalCount;
        @JsonProperty("eval_count")
        private Integer evalCount;
    }
}
