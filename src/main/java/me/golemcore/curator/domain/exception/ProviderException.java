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

package me.golemcore.curator.domain.exception;

import me.golemcore.curator.domain.model.ErrorKind;

import java.time.Duration;

/**
 * A provider failure normalized into an {@link ErrorKind}. Rate limit failures
 * may carry the vendor's retry-after hint.
 */
public class ProviderException extends CuratorException {

    private final ErrorKind kind;
    private final String provider;
    private final Duration retryAfter;

    public ProviderException(ErrorKind kind, String provider, String message) {
        this(kind, provider, message, null, null);
    }

    public ProviderException(ErrorKind kind, String provider, String message, Throwable cause) {
        this(kind, provider, message, null, cause);
    }

    public ProviderException(ErrorKind kind, String provider, String message, Duration retryAfter,
            Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.provider = provider;
        this.retryAfter = retryAfter;
    }

    public static ProviderException cancelled(String provider) {
        return new ProviderException(ErrorKind.CANCELLED, provider, "Request cancelled");
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getProvider() {
        return provider;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
