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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation handle for a generation request.
 *
 * <p>
 * A token is cancelled either explicitly through {@link #cancel()} or
 * implicitly once its optional deadline passes. While a request is running the
 * executing thread is bound to the token, so an explicit cancel interrupts any
 * blocking wait (provider call, concurrency slot, backoff sleep) immediately.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Instant deadline;
    private final Clock clock;
    private Thread boundThread;

    public CancellationToken() {
        this(null, Clock.systemUTC());
    }

    public CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken withTimeout(Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    public synchronized void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        if (boundThread != null) {
            boundThread.interrupt();
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || isDeadlineExceeded();
    }

    public boolean isDeadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Time left until the deadline, empty when the token has none.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Caps a wait so that it never outlives the deadline.
     */
    public Duration bound(Duration wait) {
        return remaining().filter(left -> left.compareTo(wait) < 0).orElse(wait);
    }

    /**
     * Waits for the given delay unless cancelled first.
     *
     * @return true if the token is cancelled when the wait ends
     */
    public boolean await(Duration delay) {
        Duration wait = bound(delay);
        try {
            if (cancelled.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
        return isCancelled();
    }

    public synchronized void bind(Thread thread) {
        this.boundThread = thread;
        if (cancelled.getCount() == 0) {
            thread.interrupt();
        }
    }

    public synchronized void unbind() {
        this.boundThread = null;
    }
}
