package me.golemcore.curator.domain.service;

import me.golemcore.curator.domain.exception.UnknownAliasException;
import me.golemcore.curator.domain.model.ModelCapability;
import me.golemcore.curator.domain.model.ProviderConfig;
import me.golemcore.curator.domain.model.ResolvedModel;
import me.golemcore.curator.infrastructure.config.CredentialResolver;
import me.golemcore.curator.infrastructure.config.CuratorProperties;
import me.golemcore.curator.infrastructure.config.ProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelAliasResolverTest {

    private CuratorProperties properties;
    private ModelAliasResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new CuratorProperties();
        ProviderRegistry registry = new ProviderRegistry(properties, new CredentialResolver());
        registry.register(ProviderConfig.builder().name("openai").defaultModel("gpt-4o").build(),
                List.of(model("openai", "gpt-4o"), model("openai", "gpt-4.1")));
        registry.register(ProviderConfig.builder().name("ollama").defaultModel("llama3.1").build(),
                List.of(model("ollama", "llama3.1")));
        resolver = new ModelAliasResolver(properties, registry);
    }

    @Test
    void resolvesAliasFromTable() {
        properties.getAliases().put("smart", "openai/gpt-4o");

        assertEquals(new ResolvedModel("openai", "gpt-4o"), resolver.resolve("smart"));
    }

    @Test
    void resolvesLiteralProviderModelReference() {
        ResolvedModel resolved = resolver.resolve("openai/gpt-4.1");

        assertEquals("openai", resolved.provider());
        assertEquals("gpt-4.1", resolved.model());
        assertEquals("openai/gpt-4.1", resolved.qualifiedName());
    }

    @Test
    void tablePrecedesLiteralParsing() {
        properties.getAliases().put("openai/gpt-4o", "ollama/llama3.1");

        assertEquals(new ResolvedModel("ollama", "llama3.1"), resolver.resolve("openai/gpt-4o"));
    }

    @Test
    void splitsLiteralAtFirstSlash() {
        UnknownAliasException error = assertThrows(UnknownAliasException.class,
                () -> resolver.resolve("openai/org/gpt-4o"));

        assertTrue(error.getMessage().contains("org/gpt-4o"));
    }

    @Test
    void failsOnUnknownAlias() {
        UnknownAliasException error = assertThrows(UnknownAliasException.class, () -> resolver.resolve("genius"));

        assertEquals("genius", error.getAlias());
    }

    @Test
    void failsOnNullOrBlankAlias() {
        assertThrows(UnknownAliasException.class, () -> resolver.resolve(null));
        assertThrows(UnknownAliasException.class, () -> resolver.resolve("  "));
    }

    @Test
    void failsWhenAliasPointsAtMissingProvider() {
        properties.getAliases().put("cloud", "azure/gpt-4o");

        UnknownAliasException error = assertThrows(UnknownAliasException.class, () -> resolver.resolve("cloud"));
        assertTrue(error.getMessage().contains("azure"));
    }

    @Test
    void failsWhenAliasPointsAtMissingModel() {
        properties.getAliases().put("smart", "openai/gpt-9");

        assertThrows(UnknownAliasException.class, () -> resolver.resolve("smart"));
    }

    @Test
    void failsOnMalformedTarget() {
        properties.getAliases().put("broken", "openai/");

        assertThrows(UnknownAliasException.class, () -> resolver.resolve("broken"));
    }

    @Test
    void listsAliases() {
        properties.getAliases().put("smart", "openai/gpt-4o");

        assertEquals("openai/gpt-4o", resolver.listAliases().get("smart"));
    }

    private static ModelCapability model(String provider, String name) {
        return ModelCapability.builder().provider(provider).name(name).contextWindow(8192).maxOutputTokens(1024)
                .build();
    }
}
