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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;
import me.golemcore.curator.domain.model.ProviderConfig;
import me.golemcore.curator.domain.model.RateLimitResult;
import me.golemcore.curator.port.outbound.RateLimitPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Per-provider admission control: a cap on concurrent in-flight calls and an
 * optional requests-per-minute bucket.
 *
 * <p>
 * Limits are created lazily from the provider's configuration and rebuilt when
 * it changes. Permits issued before a rebuild are released to the semaphore
 * they came from.
 */
@Component
@Slf4j
public class ProviderRateLimiter implements RateLimitPort {

    private static final Duration MINUTE = Duration.ofMinutes(1);

    private final Map<String, ConfiguredSemaphore> semaphores = new ConcurrentHashMap<>();
    private final Map<String, ConfiguredBucket> buckets = new ConcurrentHashMap<>();

    /**
     * Waits up to {@code maxWait} for a concurrency slot, then consumes one
     * request from the provider's per-minute budget.
     */
    @Override
    public Permit acquire(ProviderConfig provider, Duration maxWait) throws InterruptedException {
        Semaphore semaphore = resolveSemaphore(provider);
        if (!semaphore.tryAcquire(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new ProviderException(ErrorKind.RATE_LIMITED, provider.getName(),
                    "No concurrency slot available within " + maxWait.toMillis() + "ms");
        }

        if (provider.getRequestsPerMinute() > 0) {
            RateLimitResult result = resolveBucket(provider).tryConsume();
            if (!result.isAllowed()) {
                semaphore.release();
                log.debug("[RateLimit] {} per-minute budget spent, retry in {}ms", provider.getName(),
                        result.getWaitMillis());
                throw new ProviderException(ErrorKind.RATE_LIMITED, provider.getName(), result.getReason(),
                        Duration.ofMillis(result.getWaitMillis()), null);
            }
        }
        return new SemaphorePermit(semaphore);
    }

    public int availableSlots(ProviderConfig provider) {
        return resolveSemaphore(provider).availablePermits();
    }

    private Semaphore resolveSemaphore(ProviderConfig provider) {
        int slots = provider.getMaxConcurrentRequests();
        return semaphores.compute(provider.getName(), (name, existing) -> {
            if (existing == null || existing.slots() != slots) {
                return new ConfiguredSemaphore(new Semaphore(slots, true), slots);
            }
            return existing;
        }).semaphore();
    }

    private TokenBucket resolveBucket(ProviderConfig provider) {
        int perMinute = provider.getRequestsPerMinute();
        return buckets.compute(provider.getName(), (name, existing) -> {
            if (existing == null || existing.perMinute() != perMinute) {
                return new ConfiguredBucket(new TokenBucket(perMinute, MINUTE), perMinute);
            }
            return existing;
        }).bucket();
    }

    /**
     * A held concurrency slot, released on close.
     */
    private static final class SemaphorePermit implements Permit {

        private final Semaphore semaphore;
        private boolean released;

        private SemaphorePermit(Semaphore semaphore) {
            this.semaphore = semaphore;
        }

        @Override
        public synchronized void close() {
            if (!released) {
                released = true;
                semaphore.release();
            }
        }
    }

    private record ConfiguredSemaphore(Semaphore semaphore, int slots) {
    }

    private record ConfiguredBucket(TokenBucket bucket, int perMinute) {
    }
}
