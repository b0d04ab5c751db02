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

package me.golemcore.curator.usage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.curator.domain.model.CostAnalysis;
import me.golemcore.curator.domain.model.GenerationOutcome;
import me.golemcore.curator.domain.model.ModelUsage;
import me.golemcore.curator.domain.model.UsageFilter;
import me.golemcore.curator.domain.model.UsageReport;
import me.golemcore.curator.infrastructure.config.CuratorProperties;
import me.golemcore.curator.port.outbound.StoragePort;
import me.golemcore.curator.port.outbound.UsageTrackingPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of {@link UsageTrackingPort} with persistence to
 * JSONL files.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Append-only in-memory history safe for concurrent writers</li>
 * <li>Incremental aggregates per workflow, step, provider and model, so
 * reports never rescan history</li>
 * <li>One JSONL line per outcome in {@code usage/<yyyy-MM-dd>.jsonl}</li>
 * <li>Persisted outcomes reloaded on startup within the retention window</li>
 * <li>Hourly eviction of raw history beyond the retention window</li>
 * </ul>
 *
 * <p>
 * Aggregates cover everything recorded since startup plus what was reloaded;
 * eviction only trims the raw history returned by {@link #getOutcomes}.
 *
 * <p>
 * Can be disabled via {@code curator.usage.enabled=false}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmUsageTrackerImpl implements UsageTrackingPort {

    private static final String USAGE_DIR = "usage";
    private static final String UNKNOWN = "unknown";
    private static final String LOG_PREFIX = "[Usage]";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";
    private static final int EVICTION_INTERVAL_HOURS = 1;
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final StoragePort storagePort;
    private final CuratorProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Queue<GenerationOutcome> history = new ConcurrentLinkedQueue<>();
    private final Map<AggregateKey, UsageAggregate> aggregates = new ConcurrentHashMap<>();

    private final ScheduledExecutorService evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "usage-eviction");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        loadPersistedUsage();
        evictionExecutor.scheduleAtFixedRate(this::evictOldRecords,
                EVICTION_INTERVAL_HOURS, EVICTION_INTERVAL_HOURS, TimeUnit.HOURS);
    }

    @PreDestroy
    void destroy() {
        evictionExecutor.shutdownNow();
        try {
            evictionExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void record(GenerationOutcome outcome) {
        if (!properties.getUsage().isEnabled()) {
            return;
        }
        index(outcome);
        if (properties.getUsage().isPersist()) {
            persist(outcome);
        }
        log.debug("{} Recorded | request={} | provider={} | model={} | status={} | tokens={} | cost={}",
                LOG_PREFIX, outcome.getRequestId(), outcome.getProvider(), outcome.getModel(),
                outcome.getStatus(), outcome.totalTokens(), outcome.getCost());
    }

    @Override
    public UsageReport report(UsageFilter filter) {
        Instant now = clock.instant();
        if (!properties.getUsage().isEnabled()) {
            return UsageReport.empty(filter, now);
        }

        Map<String, ModelUsage> byModel = new TreeMap<>();
        for (Map.Entry<AggregateKey, UsageAggregate> entry : aggregates.entrySet()) {
            AggregateKey key = entry.getKey();
            if (!filter.matches(key.workflowId(), key.stepName())) {
                continue;
            }
            ModelUsage snapshot = entry.getValue().snapshot();
            byModel.merge(key.qualifiedModel(), snapshot,
                    (left, right) -> UsageAggregate.merge(left, right, key.provider(), key.model()));
        }

        ModelUsage totals = ModelUsage.builder().build();
        for (ModelUsage usage : byModel.values()) {
            totals = UsageAggregate.merge(totals, usage, null, null);
        }

        return UsageReport.builder()
                .workflowId(filter.workflowId())
                .stepName(filter.stepName())
                .generatedAt(now)
                .byModel(new LinkedHashMap<>(byModel))
                .totals(totals)
                .build();
    }

    @Override
    public List<GenerationOutcome> getOutcomes(UsageFilter filter) {
        return history.stream()
                .filter(outcome -> filter.matches(outcome.getWorkflowId(), outcome.getStepName()))
                .toList();
    }

    @Override
    public CostAnalysis costAnalysis(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        List<GenerationOutcome> recent = history.stream()
                .filter(outcome -> outcome.getTimestamp() != null && !outcome.getTimestamp().isBefore(cutoff))
                .toList();

        long total = recent.size();
        long successful = recent.stream().filter(GenerationOutcome::isSuccess).count();
        long tokens = recent.stream().mapToLong(GenerationOutcome::totalTokens).sum();
        double cost = recent.stream().mapToDouble(GenerationOutcome::getCost).sum();

        Map<String, CostAnalysis.ProviderCost> byProvider = new TreeMap<>();
        Map<String, List<GenerationOutcome>> grouped = new TreeMap<>();
        for (GenerationOutcome outcome : recent) {
            String provider = outcome.getProvider() != null ? outcome.getProvider() : UNKNOWN;
            grouped.computeIfAbsent(provider, k -> new ArrayList<>()).add(outcome);
        }
        grouped.forEach((provider, outcomes) -> {
            double providerCost = outcomes.stream().mapToDouble(GenerationOutcome::getCost).sum();
            byProvider.put(provider, CostAnalysis.ProviderCost.builder()
                    .requests(outcomes.size())
                    .tokens(outcomes.stream().mapToLong(GenerationOutcome::totalTokens).sum())
                    .cost(providerCost)
                    .averageCostPerRequest(providerCost / outcomes.size())
                    .build());
        });

        return CostAnalysis.builder()
                .window(window)
                .totalRequests(total)
                .successfulRequests(successful)
                .totalTokens(tokens)
                .totalCost(cost)
                .averageCostPerRequest(total > 0 ? cost / total : 0.0)
                .successRate(total > 0 ? (double) successful / total : 0.0)
                .byProvider(byProvider)
                .build();
    }

    private void index(GenerationOutcome outcome) {
        history.add(outcome);
        AggregateKey key = AggregateKey.of(outcome);
        aggregates.computeIfAbsent(key, k -> new UsageAggregate(k.provider(), k.model())).add(outcome);
    }

    private void persist(GenerationOutcome outcome) {
        Instant timestamp = outcome.getTimestamp() != null ? outcome.getTimestamp() : clock.instant();
        String file = LocalDate.ofInstant(timestamp, ZoneOffset.UTC) + JSONL_EXTENSION;
        String json;
        try {
            json = objectMapper.writeValueAsString(outcome) + NEWLINE;
        } catch (JsonProcessingException e) {
            log.warn("{} Failed to serialize outcome {}", LOG_PREFIX, outcome.getRequestId(), e);
            return;
        }
        storagePort.appendText(USAGE_DIR, file, json).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("{} Failed to persist outcome {}: {}", LOG_PREFIX, outcome.getRequestId(),
                        error.getMessage());
            }
        });
    }

    private void loadPersistedUsage() {
        if (!properties.getUsage().isEnabled() || !properties.getUsage().isPersist()) {
            return;
        }
        Instant cutoff = retentionCutoff();
        try {
            List<String> files = storagePort.listObjects(USAGE_DIR, "").join();
            if (files == null || files.isEmpty()) {
                log.debug("{} No persisted usage files found", LOG_PREFIX);
                return;
            }

            int loaded = 0;
            int skippedOld = 0;
            for (String file : files) {
                if (!file.endsWith(JSONL_EXTENSION)) {
                    continue;
                }
                String content = storagePort.getText(USAGE_DIR, file).join();
                if (content == null || content.isBlank()) {
                    continue;
                }
                for (String line : content.split(NEWLINE)) {
                    if (line.isBlank()) {
                        continue;
                    }
                    GenerationOutcome outcome = parseLine(file, line);
                    if (outcome == null) {
                        continue;
                    }
                    if (outcome.getTimestamp() != null && outcome.getTimestamp().isBefore(cutoff)) {
                        skippedOld++;
                        continue;
                    }
                    index(outcome);
                    loaded++;
                }
            }
            log.info("{} Loaded {} usage records from storage (skipped {} old records beyond {}d retention)",
                    LOG_PREFIX, loaded, skippedOld, properties.getUsage().getRetentionDays());
        } catch (RuntimeException e) {
            log.warn("{} Failed to load persisted usage", LOG_PREFIX, e);
        }
    }

    private GenerationOutcome parseLine(String file, String line) {
        try {
            return objectMapper.readValue(line, GenerationOutcome.class);
        } catch (JsonProcessingException e) {
            log.debug("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getMessage());
            return null;
        }
    }

    void evictOldRecords() {
        Instant cutoff = retentionCutoff();
        boolean evicted = history.removeIf(outcome -> outcome.getTimestamp() != null
                && outcome.getTimestamp().isBefore(cutoff));
        if (evicted) {
            log.debug("{} Evicted records beyond {}d retention", LOG_PREFIX,
                    properties.getUsage().getRetentionDays());
        }
    }

    private Instant retentionCutoff() {
        return clock.instant().minus(Duration.ofDays(properties.getUsage().getRetentionDays()));
    }

    private record AggregateKey(String workflowId, String stepName, String provider, String model) {

        static AggregateKey of(GenerationOutcome outcome) {
            return new AggregateKey(outcome.getWorkflowId(), outcome.getStepName(),
                    outcome.getProvider() != null ? outcome.getProvider() : UNKNOWN,
                    outcome.getModel() != null ? outcome.getModel() : UNKNOWN);
        }

        String qualifiedModel() {
            return provider + "/" + model;
        }
    }
}
