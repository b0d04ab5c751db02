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

package me.golemcore.curator.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Catalogue entry describing the limits and pricing of one model of a
 * provider. Null cost rates fall back to the provider's default rates.
 */
@Value
@Builder
public class ModelCapability {

    String provider;
    String name;
    int contextWindow;
    int maxOutputTokens;
    Double inputCostPer1k;
    Double outputCostPer1k;
}
