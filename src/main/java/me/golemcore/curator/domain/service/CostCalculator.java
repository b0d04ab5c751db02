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

import me.golemcore.curator.domain.model.ModelCapability;
import me.golemcore.curator.domain.model.ProviderConfig;
import org.springframework.stereotype.Component;

/**
 * Prices a call from its token counts. Model rates take precedence over the
 * provider's default rates.
 */
@Component
public class CostCalculator {

    public double calculate(ProviderConfig provider, ModelCapability model, int inputTokens, int outputTokens) {
        double inputRate = model != null && model.getInputCostPer1k() != null
                ? model.getInputCostPer1k()
                : provider.getDefaultInputCostPer1k();
        double outputRate = model != null && model.getOutputCostPer1k() != null
                ? model.getOutputCostPer1k()
                : provider.getDefaultOutputCostPer1k();
        return (inputTokens / 1000.0) * inputRate + (outputTokens / 1000.0) * outputRate;
    }
}
