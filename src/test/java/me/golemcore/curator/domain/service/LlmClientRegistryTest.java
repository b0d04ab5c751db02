package me.golemcore.curator.domain.service;

import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;
import me.golemcore.curator.domain.model.ModelCapability;
import me.golemcore.curator.domain.model.ProviderConfig;
import me.golemcore.curator.infrastructure.config.CredentialResolver;
import me.golemcore.curator.infrastructure.config.CuratorProperties;
import me.golemcore.curator.infrastructure.config.ProviderRegistry;
import me.golemcore.curator.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmClientRegistryTest {

    private ProviderRegistry providerRegistry;
    private LlmPort openAiClient;
    private LlmPort ollamaClient;

    @BeforeEach
    void setUp() {
        providerRegistry = new ProviderRegistry(new CuratorProperties(), new CredentialResolver());
        openAiClient = mock(LlmPort.class);
        when(openAiClient.getProviderType()).thenReturn("openai");
        when(openAiClient.requiresCredential()).thenReturn(true);
        ollamaClient = mock(LlmPort.class);
        when(ollamaClient.getProviderType()).thenReturn("ollama");
        when(ollamaClient.requiresCredential()).thenReturn(false);
    }

    @Test
    void returnsClientByProviderType() {
        register(ProviderConfig.builder().name("local").type("ollama").defaultModel("m").build());
        LlmClientRegistry registry = new LlmClientRegistry(List.of(openAiClient, ollamaClient), providerRegistry);
        registry.init();

        assertSame(ollamaClient, registry.getClient(providerRegistry.get("local")));
        assertEquals(Set.of("openai", "ollama"), registry.getSupportedTypes());
    }

    @Test
    void failsStartupWhenNoClientServesType() {
        register(ProviderConfig.builder().name("gemini").type("gemini").defaultModel("m").build());
        LlmClientRegistry registry = new LlmClientRegistry(List.of(openAiClient), providerRegistry);

        IllegalStateException error = assertThrows(IllegalStateException.class, registry::init);
        assertTrue(error.getMessage().contains("gemini"));
    }

    @Test
    void failsStartupWhenCredentialIsMissing() {
        register(ProviderConfig.builder().name("openai").type("openai").defaultModel("m").build());
        LlmClientRegistry registry = new LlmClientRegistry(List.of(openAiClient), providerRegistry);

        assertThrows(IllegalStateException.class, registry::init);
    }

    @Test
    void unknownTypeAtRuntimeIsProviderUnavailable() {
        LlmClientRegistry registry = new LlmClientRegistry(List.of(openAiClient), providerRegistry);
        registry.init();
        ProviderConfig provider = ProviderConfig.builder().name("x").type("mystery").build();

        ProviderException error = assertThrows(ProviderException.class, () -> registry.getClient(provider));
        assertEquals(ErrorKind.PROVIDER_UNAVAILABLE, error.getKind());
    }

    private void register(ProviderConfig config) {
        providerRegistry.register(config, List.of(ModelCapability.builder().provider(config.getName()).name("m")
                .contextWindow(4096).maxOutputTokens(512).build()));
    }
}
