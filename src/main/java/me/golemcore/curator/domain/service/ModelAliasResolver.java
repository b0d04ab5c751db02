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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.curator.domain.exception.UnknownAliasException;
import me.golemcore.curator.domain.model.ResolvedModel;
import me.golemcore.curator.infrastructure.config.CuratorProperties;
import me.golemcore.curator.infrastructure.config.ProviderRegistry;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Resolves logical model names to a concrete provider and model.
 *
 * <p>
 * Resolution order:
 * <ol>
 * <li>Alias table ({@code curator.aliases.<alias>=<provider>/<model>})</li>
 * <li>A literal {@code provider/model} reference, split at the first slash</li>
 * </ol>
 * The target must exist in the {@link ProviderRegistry}. There is no default
 * substitution: anything that does not resolve fails with
 * {@link UnknownAliasException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelAliasResolver {

    private static final char SEPARATOR = '/';

    private final CuratorProperties properties;
    private final ProviderRegistry providerRegistry;

    public ResolvedModel resolve(String alias) {
        if (alias == null || alias.isBlank()) {
            throw new UnknownAliasException(alias, "alias is empty");
        }

        String target = properties.getAliases().get(alias);
        if (target != null) {
            ResolvedModel resolved = validate(alias, parse(alias, target));
            log.trace("[Alias] {} -> {}", alias, resolved.qualifiedName());
            return resolved;
        }

        if (alias.indexOf(SEPARATOR) > 0) {
            return validate(alias, parse(alias, alias));
        }

        throw new UnknownAliasException(alias, "not in the alias table and not a provider/model reference");
    }

    public Map<String, String> listAliases() {
        return Map.copyOf(properties.getAliases());
    }

    private ResolvedModel parse(String alias, String target) {
        int separator = target.indexOf(SEPARATOR);
        if (separator <= 0 || separator == target.length() - 1) {
            throw new UnknownAliasException(alias, "target '" + target + "' is not of the form provider/model");
        }
        return new ResolvedModel(target.substring(0, separator).trim(), target.substring(separator + 1).trim());
    }

    private ResolvedModel validate(String alias, ResolvedModel resolved) {
        if (providerRegistry.find(resolved.provider()).isEmpty()) {
            throw new UnknownAliasException(alias, "provider '" + resolved.provider() + "' is not configured");
        }
        if (providerRegistry.findModel(resolved.provider(), resolved.model()).isEmpty()) {
            throw new UnknownAliasException(alias,
                    "model '" + resolved.model() + "' is not offered by provider '" + resolved.provider() + "'");
        }
        return resolved;
    }
}
