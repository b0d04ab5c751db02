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

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for generation requests.
 *
 * <p>
 * Each request runs on a {@code generation-*} worker. The vendor call itself
 * runs on a {@code provider-call-*} thread so the worker can stop waiting on
 * timeout or cancellation.
 */
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    public static final String GENERATION_EXECUTOR = "generationExecutor";
    public static final String PROVIDER_CALL_EXECUTOR = "providerCallExecutor";

    private final CuratorProperties properties;

    @Bean(name = GENERATION_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService generationExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecutor().getWorkerThreads()),
                daemonThreads("generation-"));
    }

    @Bean(name = PROVIDER_CALL_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("provider-call-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
