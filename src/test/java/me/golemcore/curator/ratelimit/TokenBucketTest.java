package me.golemcore.curator.ratelimit;

import me.golemcore.curator.domain.model.RateLimitResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketTest {

    private AtomicLong nanos;
    private TokenBucket bucket;

    @BeforeEach
    void setUp() {
        nanos = new AtomicLong(1_000_000_000L);
        bucket = new TokenBucket(3, Duration.ofMinutes(1), nanos::get);
    }

    @Test
    void startsFull() {
        assertTrue(bucket.tryConsume().isAllowed());
        assertTrue(bucket.tryConsume().isAllowed());
        RateLimitResult third = bucket.tryConsume();
        assertTrue(third.isAllowed());
        assertEquals(0, third.getRemainingTokens());
    }

    @Test
    void deniesWhenEmptyWithWaitUntilNextToken() {
        bucket.tryConsume();
        bucket.tryConsume();
        bucket.tryConsume();

        RateLimitResult denied = bucket.tryConsume();

        assertFalse(denied.isAllowed());
        assertEquals(20_000, denied.getWaitMillis());
        assertNotNull(denied.getReason());
    }

    @Test
    void refillsProportionallyToElapsedTime() {
        bucket.tryConsume();
        bucket.tryConsume();
        bucket.tryConsume();

        nanos.addAndGet(Duration.ofSeconds(10).toNanos());
        RateLimitResult halfway = bucket.tryConsume();
        assertFalse(halfway.isAllowed());
        assertEquals(10_000, halfway.getWaitMillis());

        nanos.addAndGet(Duration.ofSeconds(10).toNanos());
        assertTrue(bucket.tryConsume().isAllowed());
    }

    @Test
    void neverRefillsBeyondCapacity() {
        nanos.addAndGet(Duration.ofHours(1).toNanos());

        int allowed = 0;
        while (bucket.tryConsume().isAllowed()) {
            allowed++;
        }

        assertEquals(3, allowed);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket(0, Duration.ofMinutes(1)));
    }
}
