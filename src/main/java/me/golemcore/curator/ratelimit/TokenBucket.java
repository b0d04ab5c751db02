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

package me.golemcore.curator.ratelimit;

import me.golemcore.curator.domain.model.RateLimitResult;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Token bucket refilled continuously at {@code capacity} tokens per
 * {@code refillPeriod}. Starts full. Refill is computed lazily on each
 * {@link #tryConsume()}.
 */
public class TokenBucket {

    private final long capacity;
    private final double nanosPerToken;
    private final LongSupplier nanoClock;
    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(long capacity, Duration refillPeriod) {
        this(capacity, refillPeriod, System::nanoTime);
    }

    TokenBucket(long capacity, Duration refillPeriod, LongSupplier nanoClock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Bucket capacity must be positive");
        }
        this.capacity = capacity;
        this.nanosPerToken = (double) refillPeriod.toNanos() / capacity;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    public synchronized RateLimitResult tryConsume() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return RateLimitResult.allowed((long) tokens);
        }
        long waitNanos = (long) Math.ceil((1.0 - tokens) * nanosPerToken);
        return RateLimitResult.denied(Math.max(1, Duration.ofNanos(waitNanos).toMillis()),
                "Requests per minute exhausted");
    }

    public long getCapacity() {
        return capacity;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + elapsed / nanosPerToken);
        lastRefillNanos = now;
    }
}
