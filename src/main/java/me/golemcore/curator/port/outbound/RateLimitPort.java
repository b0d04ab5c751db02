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

package me.golemcore.curator.port.outbound;

import me.golemcore.curator.domain.model.ProviderConfig;

import java.time.Duration;

/**
 * Port for per-provider admission control.
 */
public interface RateLimitPort {

    /**
     * Blocks for at most {@code maxWait} until the provider may be called.
     *
     * @throws me.golemcore.curator.domain.exception.ProviderException
     *             of kind RATE_LIMITED when the provider's limits do not admit
     *             the call
     * @throws InterruptedException
     *             if the waiting thread is interrupted
     */
    Permit acquire(ProviderConfig provider, Duration maxWait) throws InterruptedException;

    /**
     * Admission held for the duration of one call.
     */
    interface Permit extends AutoCloseable {

        @Override
        void close();
    }
}
