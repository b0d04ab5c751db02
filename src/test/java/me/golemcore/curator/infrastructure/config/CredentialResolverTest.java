package me.golemcore.curator.infrastructure.config;

import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CredentialResolverTest {

    private final Map<String, String> environment = new HashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();
    private final CredentialResolver resolver = new CredentialResolver(name -> {
        lookups.incrementAndGet();
        return environment.get(name);
    });

    // ===== validate =====

    @Test
    void acceptsResolvableEnvReference() {
        environment.put("OPENAI_API_KEY", "sk-test");

        assertDoesNotThrow(() -> resolver.validate("openai", "env(OPENAI_API_KEY)"));
    }

    @Test
    void rejectsLiteralSecret() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> resolver.validate("openai", "sk-live-1234"));

        assertTrue(error.getMessage().contains("openai"));
        assertFalse(error.getMessage().contains("sk-live-1234"));
    }

    @Test
    void rejectsUnsetVariable() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> resolver.validate("anthropic", "env(ANTHROPIC_API_KEY)"));

        assertTrue(error.getMessage().contains("ANTHROPIC_API_KEY"));
    }

    @Test
    void rejectsBlankVariable() {
        environment.put("EMPTY_KEY", "  ");

        assertThrows(IllegalStateException.class, () -> resolver.validate("openai", "env(EMPTY_KEY)"));
    }

    @Test
    void rejectsMalformedReference() {
        environment.put("KEY", "value");

        assertThrows(IllegalStateException.class, () -> resolver.validate("openai", "env(1KEY)"));
        assertThrows(IllegalStateException.class, () -> resolver.validate("openai", "env(KEY"));
        assertThrows(IllegalStateException.class, () -> resolver.validate("openai", null));
    }

    // ===== resolve =====

    @Test
    void resolvesAndCachesValue() {
        environment.put("OPENAI_API_KEY", "sk-test");

        assertEquals("sk-test", resolver.resolve("openai", "env(OPENAI_API_KEY)"));
        environment.put("OPENAI_API_KEY", "sk-rotated");
        assertEquals("sk-test", resolver.resolve("openai", "env(OPENAI_API_KEY)"));
        assertEquals(1, lookups.get());
    }

    @Test
    void resolvesNullReferenceToNull() {
        assertNull(resolver.resolve("ollama", null));
    }

    @Test
    void unresolvableReferenceIsAuthError() {
        ProviderException error = assertThrows(ProviderException.class,
                () -> resolver.resolve("openai", "env(MISSING_KEY)"));

        assertEquals(ErrorKind.AUTH_ERROR, error.getKind());
        assertEquals("openai", error.getProvider());
    }

    @Test
    void recognizesReferences() {
        assertTrue(resolver.isReference("env(KEY_1)"));
        assertFalse(resolver.isReference("KEY_1"));
        assertFalse(resolver.isReference(null));
    }
}
