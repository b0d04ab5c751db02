package me.golemcore.curator.domain.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffPolicyTest {

    private static final Duration BASE = Duration.ofMillis(1000);
    private static final Duration MAX = Duration.ofMillis(30000);

    @ParameterizedTest
    @CsvSource({
            "1, 1000",
            "2, 2000",
            "3, 4000",
            "5, 16000",
            "6, 30000",
            "40, 30000"
    })
    void doublesUntilCapWithoutJitter(int retry, long expectedMs) {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(BASE, MAX, 0.2, () -> 0.0);

        assertEquals(Duration.ofMillis(expectedMs), policy.delayBeforeRetry(retry, null));
    }

    @Test
    void jitterStaysBelowRatioOfCappedDelay() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(BASE, MAX, 0.2, () -> 0.999);

        long delay = policy.delayBeforeRetry(2, null).toMillis();

        assertTrue(delay >= 2000);
        assertTrue(delay < 2400);
    }

    @Test
    void delaysAreNonDecreasingWithoutJitter() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(BASE, MAX, 0.0, () -> 0.5);

        Duration previous = Duration.ZERO;
        for (int retry = 1; retry <= 10; retry++) {
            Duration delay = policy.delayBeforeRetry(retry, null);
            assertTrue(delay.compareTo(previous) >= 0);
            assertTrue(delay.compareTo(MAX) <= 0);
            previous = delay;
        }
    }

    @Test
    void retryAfterHintIsLowerBound() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(BASE, MAX, 0.2, () -> 0.0);

        assertEquals(Duration.ofSeconds(45), policy.delayBeforeRetry(1, Duration.ofSeconds(45)));
        assertEquals(Duration.ofMillis(4000), policy.delayBeforeRetry(3, Duration.ofMillis(500)));
    }

    @Test
    void treatsNonPositiveRetryNumberAsFirstRetry() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(BASE, MAX, 0.2, () -> 0.0);

        assertEquals(BASE, policy.delayBeforeRetry(0, null));
    }
}
