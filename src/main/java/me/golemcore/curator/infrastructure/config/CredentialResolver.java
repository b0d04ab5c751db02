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

package me.golemcore.curator.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves credential references of the form {@code env(NAME)} to the value of
 * the environment variable {@code NAME}. Literal secrets in configuration are
 * rejected. Resolved values are cached and never logged.
 */
@Component
@Slf4j
public class CredentialResolver {

    private static final Pattern ENV_REFERENCE = Pattern.compile("^env\\(([A-Za-z_][A-Za-z0-9_]*)\\)$");

    private final Function<String, String> environment;
    private final Map<String, String> resolved = new ConcurrentHashMap<>();

    public CredentialResolver() {
        this(System::getenv);
    }

    CredentialResolver(Function<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Checks a reference at startup.
     *
     * @throws IllegalStateException
     *             if the reference is malformed or the variable is not set
     */
    public void validate(String providerName, String reference) {
        String variable = variableName(reference);
        if (variable == null) {
            throw new IllegalStateException("Provider '" + providerName
                    + "' credential must be an env(NAME) reference, literal secrets are not accepted");
        }
        String value = environment.apply(variable);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Provider '" + providerName
                    + "' credential references unset environment variable " + variable);
        }
    }

    /**
     * Resolves a reference to its secret value, or returns null for a null
     * reference.
     *
     * @throws ProviderException
     *             with {@link ErrorKind#AUTH_ERROR} when the reference cannot be
     *             resolved
     */
    public String resolve(String providerName, String reference) {
        if (reference == null) {
            return null;
        }
        String cached = resolved.get(reference);
        if (cached != null) {
            return cached;
        }
        String variable = variableName(reference);
        String value = variable != null ? environment.apply(variable) : null;
        if (value == null || value.isBlank()) {
            throw new ProviderException(ErrorKind.AUTH_ERROR, providerName,
                    "Credential reference " + reference + " could not be resolved");
        }
        resolved.put(reference, value);
        log.debug("[Credentials] Resolved {} for provider {}", reference, providerName);
        return value;
    }

    public boolean isReference(String reference) {
        return variableName(reference) != null;
    }

    private String variableName(String reference) {
        if (reference == null) {
            return null;
        }
        Matcher matcher = ENV_REFERENCE.matcher(reference.trim());
        return matcher.matches() ? matcher.group(1) : null;
    }
}
