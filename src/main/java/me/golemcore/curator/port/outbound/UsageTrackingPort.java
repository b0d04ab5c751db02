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

import me.golemcore.curator.domain.model.CostAnalysis;
import me.golemcore.curator.domain.model.GenerationOutcome;
import me.golemcore.curator.domain.model.UsageFilter;
import me.golemcore.curator.domain.model.UsageReport;

import java.time.Duration;
import java.util.List;

/**
 * Port for recording generation outcomes and reporting on them.
 */
public interface UsageTrackingPort {

    void record(GenerationOutcome outcome);

    UsageReport report(UsageFilter filter);

    List<GenerationOutcome> getOutcomes(UsageFilter filter);

    CostAnalysis costAnalysis(Duration window);
}
