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

/**
 * Classified failure kinds shared by provider clients, the request executor
 * and usage records.
 *
 * <p>
 * {@link #isRetryable()} means the same provider may be attempted again after
 * a backoff delay. {@link #isFallbackCandidate()} means the request may move on
 * to the next provider of the fallback chain once retries are exhausted.
 */
public enum ErrorKind {

    UNKNOWN_ALIAS(false, false),
    AUTH_ERROR(false, false),
    INVALID_REQUEST(false, false),
    RATE_LIMITED(true, true),
    TRANSIENT_NETWORK_ERROR(true, true),
    PROVIDER_UNAVAILABLE(false, true),
    ALL_PROVIDERS_EXHAUSTED(false, false),
    CANCELLED(false, false);

    private final boolean retryable;
    private final boolean fallbackCandidate;

    ErrorKind(boolean retryable, boolean fallbackCandidate) {
        this.retryable = retryable;
        this.fallbackCandidate = fallbackCandidate;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isFallbackCandidate() {
        return fallbackCandidate;
    }
}
