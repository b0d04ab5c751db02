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

import java.time.Duration;

/**
 * Decides how long to wait before retrying a failed provider call.
 */
public interface BackoffPolicy {

    /**
     * @param retryNumber
     *            1 for the first retry, 2 for the second, and so on
     * @param retryAfterHint
     *            vendor supplied minimum delay, may be null
     */
    Duration delayBeforeRetry(int retryNumber, Duration retryAfterHint);
}
