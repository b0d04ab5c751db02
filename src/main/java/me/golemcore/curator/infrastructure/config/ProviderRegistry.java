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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.curator.domain.exception.ModelNotFoundException;
import me.golemcore.curator.domain.exception.ProviderNotFoundException;
import me.golemcore.curator.domain.model.ModelCapability;
import me.golemcore.curator.domain.model.ProviderConfig;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalogue of configured providers and the models each of them serves.
 *
 * <p>
 * Loaded from {@code curator.providers.*} at startup and read-only afterwards.
 * Lookups never block: the catalogue is an immutable snapshot swapped as a
 * whole by {@link #register} and {@link #reload()}; a reload that fails
 * validation leaves the previous snapshot in place. Configuration mistakes
 * (unknown fallback providers, a default model missing from the catalogue, an
 * unresolvable credential) fail startup with {@link IllegalStateException}.
 */
@Service
@Slf4j
public class ProviderRegistry {

    private final CuratorProperties properties;
    private final CredentialResolver credentialResolver;

    private volatile Map<String, RegisteredProvider> providers = Map.of();

    public ProviderRegistry(CuratorProperties properties, CredentialResolver credentialResolver) {
        this.properties = properties;
        this.credentialResolver = credentialResolver;
    }

    @PostConstruct
    public synchronized void init() {
        Map<String, RegisteredProvider> loaded = loadFromProperties();
        validate(loaded);
        providers = loaded;
        log.info("[Registry] Loaded {} providers: {}", loaded.size(), loaded.keySet());
    }

    /**
     * Rebuilds the catalogue from the current properties. The new catalogue
     * replaces the old one only after it validates; on failure the previous
     * catalogue stays live.
     */
    public synchronized void reload() {
        init();
    }

    private Map<String, RegisteredProvider> loadFromProperties() {
        Map<String, RegisteredProvider> loaded = new LinkedHashMap<>();
        for (Map.Entry<String, CuratorProperties.ProviderProperties> entry : properties.getProviders().entrySet()) {
            String name = entry.getKey();
            CuratorProperties.ProviderProperties settings = entry.getValue();

            ProviderConfig config = ProviderConfig.builder()
                    .name(name)
                    .type(settings.getType() != null ? settings.getType() : name)
                    .baseUrl(settings.getBaseUrl())
                    .credentialRef(settings.getCredentialRef())
                    .defaultModel(settings.getDefaultModel())
                    .fallbackChain(settings.getFallbackChain())
                    .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                    .maxRetries(settings.getMaxRetries())
                    .maxConcurrentRequests(settings.getMaxConcurrentRequests())
                    .requestsPerMinute(settings.getRequestsPerMinute())
                    .defaultInputCostPer1k(settings.getInputCostPer1k())
                    .defaultOutputCostPer1k(settings.getOutputCostPer1k())
                    .build();

            List<ModelCapability> models = new ArrayList<>();
            settings.getModels().forEach((modelName, model) -> models.add(ModelCapability.builder()
                    .provider(name)
                    .name(modelName)
                    .contextWindow(model.getContextWindow())
                    .maxOutputTokens(model.getMaxOutputTokens())
                    .inputCostPer1k(model.getInputCostPer1k())
                    .outputCostPer1k(model.getOutputCostPer1k())
                    .build()));

            loaded.put(name, toRegistered(config, models));
        }
        return Collections.unmodifiableMap(loaded);
    }

    /**
     * Adds or replaces a provider and its model catalogue.
     *
     * @throws IllegalArgumentException
     *             if the provider or one of its models is malformed
     */
    public synchronized void register(ProviderConfig config, List<ModelCapability> models) {
        RegisteredProvider registered = toRegistered(config, models);
        Map<String, RegisteredProvider> updated = new LinkedHashMap<>(providers);
        updated.put(config.getName(), registered);
        providers = Collections.unmodifiableMap(updated);
        log.debug("[Registry] Registered provider {} with {} models", config.getName(), registered.models().size());
    }

    private RegisteredProvider toRegistered(ProviderConfig config, List<ModelCapability> models) {
        if (config.getName() == null || config.getName().isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        if (config.getMaxRetries() < 0) {
            throw new IllegalArgumentException("Provider '" + config.getName() + "' has negative max-retries");
        }
        if (config.getMaxConcurrentRequests() < 1) {
            throw new IllegalArgumentException(
                    "Provider '" + config.getName() + "' needs at least one concurrent request");
        }
        if (config.getDefaultInputCostPer1k() < 0 || config.getDefaultOutputCostPer1k() < 0) {
            throw new IllegalArgumentException("Provider '" + config.getName() + "' has a negative cost rate");
        }

        Map<String, ModelCapability> catalogue = new LinkedHashMap<>();
        for (ModelCapability model : models) {
            validateModel(config.getName(), model);
            if (catalogue.putIfAbsent(model.getName(), model) != null) {
                throw new IllegalArgumentException(
                        "Duplicate model '" + model.getName() + "' for provider '" + config.getName() + "'");
            }
        }

        return new RegisteredProvider(config, Collections.unmodifiableMap(catalogue));
    }

    private void validateModel(String provider, ModelCapability model) {
        String label = provider + "/" + model.getName();
        if (model.getName() == null || model.getName().isBlank()) {
            throw new IllegalArgumentException("Provider '" + provider + "' has a model without a name");
        }
        if (model.getContextWindow() <= 0) {
            throw new IllegalArgumentException("Model " + label + " needs a positive context window");
        }
        if (model.getMaxOutputTokens() < 0) {
            throw new IllegalArgumentException("Model " + label + " has negative max output tokens");
        }
        if (isNegative(model.getInputCostPer1k()) || isNegative(model.getOutputCostPer1k())) {
            throw new IllegalArgumentException("Model " + label + " has a negative cost rate");
        }
    }

    private static boolean isNegative(Double value) {
        return value != null && value < 0;
    }

    /**
     * Cross-provider checks run once the whole catalogue is loaded.
     *
     * @throws IllegalStateException
     *             on the first configuration error found
     */
    public void validate() {
        validate(providers);
    }

    private void validate(Map<String, RegisteredProvider> candidate) {
        for (RegisteredProvider registered : candidate.values()) {
            ProviderConfig config = registered.config();
            for (String fallback : config.getFallbackChain()) {
                if (!candidate.containsKey(fallback)) {
                    throw new IllegalStateException("Provider '" + config.getName()
                            + "' lists unknown fallback provider '" + fallback + "'");
                }
            }
            if (config.getDefaultModel() == null || !registered.models().containsKey(config.getDefaultModel())) {
                throw new IllegalStateException("Provider '" + config.getName() + "' default model '"
                        + config.getDefaultModel() + "' is not in its catalogue");
            }
            if (config.getCredentialRef() != null) {
                credentialResolver.validate(config.getName(), config.getCredentialRef());
            }
        }
    }

    public ProviderConfig get(String providerName) {
        return find(providerName).orElseThrow(() -> new ProviderNotFoundException(providerName));
    }

    public Optional<ProviderConfig> find(String providerName) {
        RegisteredProvider registered = providerName != null ? providers.get(providerName) : null;
        return Optional.ofNullable(registered).map(RegisteredProvider::config);
    }

    public ModelCapability getModel(String providerName, String modelName) {
        RegisteredProvider registered = providers.get(providerName);
        if (registered == null) {
            throw new ProviderNotFoundException(providerName);
        }
        ModelCapability model = registered.models().get(modelName);
        if (model == null) {
            throw new ModelNotFoundException(providerName, modelName);
        }
        return model;
    }

    public Optional<ModelCapability> findModel(String providerName, String modelName) {
        RegisteredProvider registered = providerName != null ? providers.get(providerName) : null;
        if (registered == null || modelName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registered.models().get(modelName));
    }

    public List<String> getProviderNames() {
        return List.copyOf(providers.keySet());
    }

    public List<ProviderConfig> getProviders() {
        return providers.values().stream().map(RegisteredProvider::config).toList();
    }

    public List<ModelCapability> getModels(String providerName) {
        RegisteredProvider registered = providers.get(providerName);
        if (registered == null) {
            throw new ProviderNotFoundException(providerName);
        }
        return List.copyOf(registered.models().values());
    }

    private record RegisteredProvider(ProviderConfig config, Map<String, ModelCapability> models) {
    }
}
