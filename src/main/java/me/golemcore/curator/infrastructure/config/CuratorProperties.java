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

package me.golemcore.curator.infrastructure.config;

import lombok.Data;
import me.golemcore.curator.domain.model.TruncationStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties of the orchestration layer, bound from
 * application.properties.
 *
 * <p>
 * All settings are organized under the {@code curator.*} prefix:
 * <ul>
 * <li>{@link ProviderProperties} - providers, their model catalogues and
 * fallback chains</li>
 * <li>{@code aliases} - logical model names mapped to {@code provider/model}</li>
 * <li>{@link RetryProperties} - backoff between retries</li>
 * <li>{@link ContextProperties} - context window budgeting</li>
 * <li>{@link UsageProperties} - usage tracking and persistence</li>
 * </ul>
 *
 * <p>
 * Model names often contain dots, so catalogue keys are written in brackets:
 * {@code curator.providers.openai.models[gpt-4.1].context-window=1047576}.
 */
@Component
@ConfigurationProperties(prefix = "curator")
@Data
public class CuratorProperties {

    private Map<String, ProviderProperties> providers = new LinkedHashMap<>();
    private Map<String, String> aliases = new LinkedHashMap<>();
    private RetryProperties retry = new RetryProperties();
    private ContextProperties context = new ContextProperties();
    private UsageProperties usage = new UsageProperties();
    private StorageProperties storage = new StorageProperties();
    private ExecutorProperties executor = new ExecutorProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class ProviderProperties {
        private String type;
        private String credentialRef;
        private String baseUrl;
        private String defaultModel;
        private List<String> fallbackChain = new ArrayList<>();
        private int timeoutSeconds = 60;
        private int maxRetries = 2;
        private int maxConcurrentRequests = 4;
        private int requestsPerMinute = 0;
        private double inputCostPer1k = 0.0;
        private double outputCostPer1k = 0.0;
        private Map<String, ModelProperties> models = new LinkedHashMap<>();
    }

    @Data
    public static class ModelProperties {
        private int contextWindow = 8192;
        private int maxOutputTokens = 2048;
        private Double inputCostPer1k;
        private Double outputCostPer1k;
    }

    @Data
    public static class RetryProperties {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double jitterRatio = 0.2;
    }

    @Data
    public static class ContextProperties {
        private int charsPerToken = 4;
        private int safetyMarginTokens = 256;
        private TruncationStrategy truncation = TruncationStrategy.TAIL;
    }

    @Data
    public static class UsageProperties {
        private boolean enabled = true;
        private boolean persist = true;
        private int retentionDays = 30;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.curator/workspace";
    }

    @Data
    public static class ExecutorProperties {
        private int workerThreads = 8;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
