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

import me.golemcore.curator.domain.model.ProviderCall;
import me.golemcore.curator.domain.model.ProviderReply;

/**
 * Port for calling one vendor API. Implementations are selected by
 * {@link #getProviderType()} and must not retry on their own.
 */
public interface LlmPort {

    String getProviderType();

    /**
     * Performs a blocking generation call.
     *
     * @throws me.golemcore.curator.domain.exception.ProviderException
     *             classified failure
     */
    ProviderReply generate(ProviderCall call);

    default boolean requiresCredential() {
        return true;
    }
}
