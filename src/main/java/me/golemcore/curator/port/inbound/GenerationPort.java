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

package me.golemcore.curator.port.inbound;

import me.golemcore.curator.domain.model.CancellationToken;
import me.golemcore.curator.domain.model.Correlation;
import me.golemcore.curator.domain.model.GenerationParameters;
import me.golemcore.curator.domain.model.GenerationResult;
import me.golemcore.curator.domain.model.UsageFilter;
import me.golemcore.curator.domain.model.UsageReport;

import java.util.concurrent.CompletableFuture;

/**
 * Caller-facing entry point for text generation.
 *
 * <p>
 * The returned future always completes normally. Request failures are
 * reported through {@link GenerationResult#getError()}.
 */
public interface GenerationPort {

    CompletableFuture<GenerationResult> generate(String prompt, String modelAlias, GenerationParameters parameters,
            Correlation correlation);

    CompletableFuture<GenerationResult> generate(String prompt, String modelAlias, GenerationParameters parameters,
            Correlation correlation, CancellationToken cancellationToken);

    UsageReport usageReport(UsageFilter filter);
}
