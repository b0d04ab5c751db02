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

import me.golemcore.curator.infrastructure.config.CuratorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with uniform jitter: {@code min(max, base * 2^(n-1))}
 * plus a random share of up to {@code jitterRatio} of that value. A
 * retry-after hint acts as a floor.
 */
@Component
public class ExponentialBackoffPolicy implements BackoffPolicy {

    private static final int MAX_SHIFT = 30;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterRatio;
    private final DoubleSupplier random;

    @Autowired
    public ExponentialBackoffPolicy(CuratorProperties properties) {
        this(properties.getRetry().getBaseDelay(), properties.getRetry().getMaxDelay(),
                properties.getRetry().getJitterRatio(), () -> ThreadLocalRandom.current().nextDouble());
    }

    public ExponentialBackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterRatio,
            DoubleSupplier random) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterRatio = Math.max(0.0, jitterRatio);
        this.random = random;
    }

    @Override
    public Duration delayBeforeRetry(int retryNumber, Duration retryAfterHint) {
        int shift = Math.min(Math.max(retryNumber, 1) - 1, MAX_SHIFT);
        long exponential = baseDelay.toMillis() * (1L << shift);
        long capped = Math.min(maxDelay.toMillis(), exponential);
        long jitter = (long) (random.getAsDouble() * jitterRatio * capped);
        Duration delay = Duration.ofMillis(capped + jitter);

        if (retryAfterHint != null && retryAfterHint.compareTo(delay) > 0) {
            return retryAfterHint;
        }
        return delay;
    }
}
