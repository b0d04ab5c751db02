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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;
import me.golemcore.curator.domain.model.ProviderConfig;
import me.golemcore.curator.infrastructure.config.ProviderRegistry;
import me.golemcore.curator.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Indexes provider clients by type and hands out the one serving a provider.
 *
 * <p>
 * At startup every configured provider is checked for a matching client and,
 * where that client needs one, a credential reference.
 *
 * @see me.golemcore.curator.adapter.outbound.llm.OpenAiProviderAdapter
 * @see me.golemcore.curator.adapter.outbound.llm.AnthropicProviderAdapter
 * @see me.golemcore.curator.adapter.outbound.llm.OllamaProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmClientRegistry {

    private final List<LlmPort> clients;
    private final ProviderRegistry providerRegistry;

    private final Map<String, LlmPort> clientsByType = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (LlmPort client : clients) {
            clientsByType.put(client.getProviderType(), client);
            log.debug("[Clients] Registered provider client: {}", client.getProviderType());
        }

        for (ProviderConfig provider : providerRegistry.getProviders()) {
            LlmPort client = clientsByType.get(provider.getType());
            if (client == null) {
                throw new IllegalStateException("Provider '" + provider.getName() + "' has type '"
                        + provider.getType() + "' but no client serves it; supported: " + clientsByType.keySet());
            }
            if (client.requiresCredential() && provider.getCredentialRef() == null) {
                throw new IllegalStateException("Provider '" + provider.getName() + "' needs a credential-ref");
            }
        }
        log.info("[Clients] Provider clients ready: {}", clientsByType.keySet());
    }

    /**
     * @throws ProviderException
     *             of kind {@link ErrorKind#PROVIDER_UNAVAILABLE} if no client
     *             serves the provider's type
     */
    public LlmPort getClient(ProviderConfig provider) {
        LlmPort client = clientsByType.get(provider.getType());
        if (client == null) {
            throw new ProviderException(ErrorKind.PROVIDER_UNAVAILABLE, provider.getName(),
                    "No client for provider type " + provider.getType());
        }
        return client;
    }

    public Set<String> getSupportedTypes() {
        return Set.copyOf(clientsByType.keySet());
    }
}
