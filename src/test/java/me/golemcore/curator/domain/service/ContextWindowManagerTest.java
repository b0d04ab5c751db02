package me.golemcore.curator.domain.service;

import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;
import me.golemcore.curator.domain.model.FitResult;
import me.golemcore.curator.domain.model.ModelCapability;
import me.golemcore.curator.domain.model.TruncationStrategy;
import me.golemcore.curator.infrastructure.config.CuratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ContextWindowManagerTest {

    private CuratorProperties properties;
    private ContextWindowManager manager;

    @BeforeEach
    void setUp() {
        properties = new CuratorProperties();
        manager = new ContextWindowManager(properties);
    }

    // ===== Estimation and budget =====

    @Test
    void estimatesCeilingOfCharsOverFour() {
        assertEquals(0, manager.estimateTokens(""));
        assertEquals(0, manager.estimateTokens(null));
        assertEquals(1, manager.estimateTokens("a"));
        assertEquals(1, manager.estimateTokens("abcd"));
        assertEquals(2, manager.estimateTokens("abcde"));
    }

    @Test
    void reservesLargerOfRequestedAndModelOutput() {
        ModelCapability model = model(8192, 2048);

        assertEquals(8192 - 2048 - 256, manager.budgetFor(model, null));
        assertEquals(8192 - 2048 - 256, manager.budgetFor(model, 1000));
        assertEquals(8192 - 4000 - 256, manager.budgetFor(model, 4000));
    }

    // ===== Fitting =====

    @Test
    void leavesFittingPromptUntouched() {
        String prompt = "Write a lesson plan about photosynthesis.";

        FitResult result = manager.fit(prompt, model(8192, 2048), null);

        assertFalse(result.truncated());
        assertSame(prompt, result.prompt());
    }

    @Test
    void truncatesOversizedPromptToBudget() {
        // 9000 estimated tokens against a 8192 window with 2048 reserved for output
        String prompt = "x".repeat(36000);
        ModelCapability model = model(8192, 2048);

        FitResult result = manager.fit(prompt, model, null);

        assertTrue(result.truncated());
        int budget = 8192 - 2048 - 256;
        assertEquals(budget, result.budgetTokens());
        assertTrue(manager.estimateTokens(result.prompt()) <= budget);
        assertTrue(manager.estimateTokens(result.prompt()) + 2048 <= 8192);
        assertTrue(result.prompt().startsWith("xxxx"));
        assertTrue(result.prompt().endsWith(ContextWindowManager.TRUNCATION_MARKER));
    }

    @Test
    void headStrategyKeepsTheEnd() {
        properties.getContext().setTruncation(TruncationStrategy.HEAD);
        String prompt = "a".repeat(20000) + "THE END";

        FitResult result = manager.fit(prompt, model(4096, 1024), null);

        assertTrue(result.truncated());
        assertTrue(result.prompt().startsWith(ContextWindowManager.TRUNCATION_MARKER));
        assertTrue(result.prompt().endsWith("THE END"));
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 100, 3071, 3072, 3073, 5000, 12000, 50000 })
    void fittedPromptNeverExceedsBudget(int chars) {
        ModelCapability model = model(2048, 1024);
        String prompt = "p".repeat(chars);

        FitResult result = manager.fit(prompt, model, 512);

        assertTrue(manager.estimateTokens(result.prompt()) <= result.budgetTokens());
        assertEquals(manager.estimateTokens(prompt) > result.budgetTokens(), result.truncated());
    }

    @Test
    void doesNotSplitSurrogatePairs() {
        String emoji = "😀";
        String prompt = emoji.repeat(10000);

        FitResult result = manager.fit(prompt, model(4096, 1024), null);

        String body = result.prompt().substring(0,
                result.prompt().length() - ContextWindowManager.TRUNCATION_MARKER.length());
        assertFalse(Character.isHighSurrogate(body.charAt(body.length() - 1)));
        assertEquals(0, body.length() % 2);
    }

    @Test
    void modelWithoutInputBudgetIsInvalidRequest() {
        ProviderException error = assertThrows(ProviderException.class,
                () -> manager.fit("hello", model(2048, 2048), null));

        assertEquals(ErrorKind.INVALID_REQUEST, error.getKind());
    }

    @Test
    void honoursConfiguredCharsPerToken() {
        properties.getContext().setCharsPerToken(2);

        assertEquals(3, manager.estimateTokens("abcde"));
    }

    private static ModelCapability model(int window, int maxOutput) {
        return ModelCapability.builder().provider("openai").name("gpt-4o").contextWindow(window)
                .maxOutputTokens(maxOutput).build();
    }
}
