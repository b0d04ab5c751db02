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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Sampling parameters of a generation call. Null values leave the vendor
 * default in place.
 */
@Value
@Builder
public class GenerationParameters {

    private static final GenerationParameters DEFAULTS = GenerationParameters.builder().build();

    Double temperature;
    Integer maxTokens;
    Double topP;
    @Singular
    List<String> stopSequences;

    public static GenerationParameters defaults() {
        return DEFAULTS;
    }
}
