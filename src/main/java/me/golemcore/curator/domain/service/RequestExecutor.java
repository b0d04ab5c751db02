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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.curator.domain.exception.CuratorException;
import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.exception.UnknownAliasException;
import me.golemcore.curator.domain.model.CancellationToken;
import me.golemcore.curator.domain.model.Correlation;
import me.golemcore.curator.domain.model.ErrorKind;
import me.golemcore.curator.domain.model.FitResult;
import me.golemcore.curator.domain.model.GenerationError;
import me.golemcore.curator.domain.model.GenerationOutcome;
import me.golemcore.curator.domain.model.GenerationParameters;
import me.golemcore.curator.domain.model.GenerationRequest;
import me.golemcore.curator.domain.model.GenerationResult;
import me.golemcore.curator.domain.model.ModelCapability;
import me.golemcore.curator.domain.model.OutcomeStatus;
import me.golemcore.curator.domain.model.ProviderCall;
import me.golemcore.curator.domain.model.ProviderConfig;
import me.golemcore.curator.domain.model.ProviderReply;
import me.golemcore.curator.domain.model.ResolvedModel;
import me.golemcore.curator.domain.model.UsageFilter;
import me.golemcore.curator.domain.model.UsageReport;
import me.golemcore.curator.infrastructure.config.CredentialResolver;
import me.golemcore.curator.infrastructure.config.ExecutorConfig;
import me.golemcore.curator.infrastructure.config.ProviderRegistry;
import me.golemcore.curator.port.inbound.GenerationPort;
import me.golemcore.curator.port.outbound.LlmPort;
import me.golemcore.curator.port.outbound.RateLimitPort;
import me.golemcore.curator.port.outbound.UsageTrackingPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs generation requests: resolves the alias, fits the prompt into the
 * model's context window, then dispatches with retries and provider fallback.
 *
 * <p>
 * Error handling per attempt:
 * <ul>
 * <li>AUTH_ERROR, INVALID_REQUEST - the request fails immediately</li>
 * <li>RATE_LIMITED, TRANSIENT_NETWORK_ERROR - retried on the same provider up
 * to its {@code maxRetries} with backoff, then fallback</li>
 * <li>PROVIDER_UNAVAILABLE - straight to the next fallback provider</li>
 * </ul>
 * Fallback follows only the chain of the originally resolved provider and uses
 * each fallback provider's default model.
 *
 * <p>
 * Every request ends with exactly one {@link GenerationOutcome} recorded,
 * whether it succeeded, failed or was cancelled. The returned future never
 * completes exceptionally for request failures.
 */
@Service
@Slf4j
public class RequestExecutor implements GenerationPort {

    private final ModelAliasResolver aliasResolver;
    private final ProviderRegistry providerRegistry;
    private final ContextWindowManager contextWindowManager;
    private final LlmClientRegistry clientRegistry;
    private final CredentialResolver credentialResolver;
    private final BackoffPolicy backoffPolicy;
    private final RateLimitPort rateLimiter;
    private final CostCalculator costCalculator;
    private final UsageTrackingPort usageTracker;
    private final ExecutorService generationExecutor;
    private final ExecutorService providerCallExecutor;
    private final Clock clock;

    @SuppressWarnings("PMD.ExcessiveParameterList")
    public RequestExecutor(ModelAliasResolver aliasResolver, ProviderRegistry providerRegistry,
            ContextWindowManager contextWindowManager, LlmClientRegistry clientRegistry,
            CredentialResolver credentialResolver, BackoffPolicy backoffPolicy, RateLimitPort rateLimiter,
            CostCalculator costCalculator, UsageTrackingPort usageTracker,
            @Qualifier(ExecutorConfig.GENERATION_EXECUTOR) ExecutorService generationExecutor,
            @Qualifier(ExecutorConfig.PROVIDER_CALL_EXECUTOR) ExecutorService providerCallExecutor,
            Clock clock) {
        this.aliasResolver = aliasResolver;
        this.providerRegistry = providerRegistry;
        this.contextWindowManager = contextWindowManager;
        this.clientRegistry = clientRegistry;
        this.credentialResolver = credentialResolver;
        this.backoffPolicy = backoffPolicy;
        this.rateLimiter = rateLimiter;
        this.costCalculator = costCalculator;
        this.usageTracker = usageTracker;
        this.generationExecutor = generationExecutor;
        this.providerCallExecutor = providerCallExecutor;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<GenerationResult> generate(String prompt, String modelAlias,
            GenerationParameters parameters, Correlation correlation) {
        return generate(prompt, modelAlias, parameters, correlation, new CancellationToken());
    }

    @Override
    public CompletableFuture<GenerationResult> generate(String prompt, String modelAlias,
            GenerationParameters parameters, Correlation correlation, CancellationToken cancellationToken) {
        GenerationRequest request = GenerationRequest.builder()
                .requestId(UUID.randomUUID().toString())
                .prompt(prompt)
                .alias(modelAlias)
                .parameters(parameters != null ? parameters : GenerationParameters.defaults())
                .correlation(correlation != null ? correlation : Correlation.none())
                .cancellationToken(cancellationToken != null ? cancellationToken : new CancellationToken())
                .build();
        return CompletableFuture.supplyAsync(() -> execute(request), generationExecutor);
    }

    @Override
    public UsageReport usageReport(UsageFilter filter) {
        return usageTracker.report(filter != null ? filter : UsageFilter.all());
    }

    /**
     * Runs a request to completion on the calling thread.
     */
    public GenerationResult execute(GenerationRequest request) {
        long startNanos = System.nanoTime();
        request.setStartedAt(clock.instant());
        CancellationToken token = request.getCancellationToken();
        token.bind(Thread.currentThread());
        try {
            return run(request, startNanos);
        } catch (RuntimeException e) {
            log.error("[Executor] Request failed unexpectedly | request={} | alias={}", request.getRequestId(),
                    request.getAlias(), e);
            return finishFailure(request, startNanos, ErrorKind.PROVIDER_UNAVAILABLE,
                    "Unexpected failure: " + e.getMessage(), null);
        } finally {
            token.unbind();
            // a cancel may have interrupted this pooled thread after its last blocking call
            Thread.interrupted();
        }
    }

    private GenerationResult run(GenerationRequest request, long startNanos) {
        if (request.getCancellationToken().isCancelled()) {
            return finishFailure(request, startNanos, ErrorKind.CANCELLED, "Request cancelled", null);
        }

        if (request.getPrompt() == null || request.getPrompt().isBlank()) {
            return finishFailure(request, startNanos, ErrorKind.INVALID_REQUEST, "Prompt must not be blank", null);
        }

        ResolvedModel resolved;
        try {
            resolved = aliasResolver.resolve(request.getAlias());
        } catch (UnknownAliasException e) {
            return finishFailure(request, startNanos, ErrorKind.UNKNOWN_ALIAS, e.getMessage(), null);
        }

        // the catalogue may have been reloaded since the alias was resolved
        Optional<ProviderConfig> origin = providerRegistry.find(resolved.provider());
        if (origin.isEmpty()) {
            return finishFailure(request, startNanos, ErrorKind.UNKNOWN_ALIAS, "Alias " + request.getAlias()
                    + " resolved to provider " + resolved.provider() + " which is not configured", null);
        }

        List<ProviderConfig> chain = buildChain(origin.get());
        ProviderException last = null;
        for (int i = 0; i < chain.size(); i++) {
            ProviderConfig provider = chain.get(i);
            String model = i == 0 ? resolved.model() : provider.getDefaultModel();
            if (i > 0) {
                log.warn("[Executor] Falling back | request={} | from={}/{} | to={}/{} | lastError={}",
                        request.getRequestId(), request.getProvider(), request.getModel(), provider.getName(),
                        model, last != null ? last.getKind() : null);
            }
            request.setProvider(provider.getName());
            request.setModel(model);

            try {
                ModelCapability capability = providerRegistry.getModel(provider.getName(), model);
                fit(request, capability);
                ProviderReply reply = dispatchWithRetries(request, provider, capability);
                return finishSuccess(request, startNanos, provider, capability, reply);
            } catch (ProviderException e) {
                last = e;
                if (e.getKind() == ErrorKind.CANCELLED || request.getCancellationToken().isCancelled()) {
                    return finishFailure(request, startNanos, ErrorKind.CANCELLED, "Request cancelled", null);
                }
                if (!e.getKind().isFallbackCandidate()) {
                    return finishFailure(request, startNanos, e.getKind(), e.getMessage(), null);
                }
            } catch (CuratorException e) {
                // catalogue lookup failures of a fallback hop
                last = new ProviderException(ErrorKind.PROVIDER_UNAVAILABLE, provider.getName(), e.getMessage(), e);
                request.recordFailedAttempt(ErrorKind.PROVIDER_UNAVAILABLE, e.getMessage());
            }
        }

        ErrorKind lastKind = last != null ? last.getKind() : null;
        String message = "All providers exhausted for alias " + request.getAlias()
                + (last != null ? ": " + last.getMessage() : "");
        return finishFailure(request, startNanos, ErrorKind.ALL_PROVIDERS_EXHAUSTED, message, lastKind);
    }

    private List<ProviderConfig> buildChain(ProviderConfig origin) {
        List<ProviderConfig> chain = new ArrayList<>();
        chain.add(origin);
        Set<String> seen = new LinkedHashSet<>();
        seen.add(origin.getName());
        for (String name : origin.getFallbackChain()) {
            if (!seen.add(name)) {
                continue;
            }
            Optional<ProviderConfig> fallback = providerRegistry.find(name);
            if (fallback.isPresent()) {
                chain.add(fallback.get());
            } else {
                log.warn("[Executor] Fallback provider {} of {} is not configured", name, origin.getName());
            }
        }
        return chain;
    }

    private void fit(GenerationRequest request, ModelCapability capability) {
        FitResult fit = contextWindowManager.fit(request.getPrompt(), capability,
                request.getParameters().getMaxTokens());
        if (fit.truncated()) {
            request.setPrompt(fit.prompt());
            request.setTruncated(true);
        }
    }

    private ProviderReply dispatchWithRetries(GenerationRequest request, ProviderConfig provider,
            ModelCapability capability) {
        int maxAttempts = provider.getMaxRetries() + 1;
        for (int attempt = 1;; attempt++) {
            if (request.getCancellationToken().isCancelled()) {
                throw ProviderException.cancelled(provider.getName());
            }
            request.setAttempts(request.getAttempts() + 1);
            try {
                return dispatch(request, provider, capability);
            } catch (ProviderException e) {
                if (e.getKind() == ErrorKind.CANCELLED) {
                    throw e;
                }
                request.recordFailedAttempt(e.getKind(), e.getMessage());
                if (!e.getKind().isRetryable() || attempt >= maxAttempts) {
                    log.warn("[Executor] Attempt failed | request={} | provider={} | model={} | attempt={}/{} | "
                            + "kind={} | error={}", request.getRequestId(), provider.getName(), request.getModel(),
                            attempt, maxAttempts, e.getKind(), e.getMessage());
                    throw e;
                }

                Duration delay = backoffPolicy.delayBeforeRetry(attempt, e.getRetryAfter());
                log.warn("[Executor] Retrying | request={} | provider={} | model={} | attempt={}/{} | kind={} | "
                        + "delay={}ms", request.getRequestId(), provider.getName(), request.getModel(), attempt,
                        maxAttempts, e.getKind(), delay.toMillis());
                if (request.getCancellationToken().await(delay)) {
                    throw ProviderException.cancelled(provider.getName());
                }
            }
        }
    }

    private ProviderReply dispatch(GenerationRequest request, ProviderConfig provider, ModelCapability capability) {
        LlmPort client = clientRegistry.getClient(provider);
        CancellationToken token = request.getCancellationToken();
        Duration timeout = token.bound(provider.getTimeout());

        ProviderCall call = ProviderCall.builder()
                .prompt(request.getPrompt())
                .model(request.getModel())
                .parameters(request.getParameters())
                .provider(provider)
                .apiKey(credentialResolver.resolve(provider.getName(), provider.getCredentialRef()))
                .timeout(timeout)
                .maxOutputTokens(capability.getMaxOutputTokens())
                .build();

        RateLimitPort.Permit permit;
        try {
            permit = rateLimiter.acquire(provider, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderException.cancelled(provider.getName());
        }

        PermitHoldingCall task = new PermitHoldingCall(() -> client.generate(call), permit);
        try {
            providerCallExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            permit.close();
            throw new ProviderException(ErrorKind.PROVIDER_UNAVAILABLE, provider.getName(),
                    "Provider call rejected: " + e.getMessage(), e);
        }

        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            if (token.isCancelled()) {
                throw ProviderException.cancelled(provider.getName());
            }
            throw new ProviderException(ErrorKind.TRANSIENT_NETWORK_ERROR, provider.getName(),
                    "No response within " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw ProviderException.cancelled(provider.getName());
        } catch (ExecutionException e) {
            throw LlmErrorClassifier.toProviderException(provider.getName(), e.getCause());
        }
    }

    /**
     * Provider call that keeps its concurrency permit until the vendor call
     * returns, even when the caller has already given up on it. A task
     * cancelled before it started releases the permit on cancellation.
     */
    private static final class PermitHoldingCall extends FutureTask<ProviderReply> {

        private final RateLimitPort.Permit permit;
        private final AtomicBoolean claimed;

        private PermitHoldingCall(Callable<ProviderReply> call, RateLimitPort.Permit permit) {
            this(call, permit, new AtomicBoolean());
        }

        private PermitHoldingCall(Callable<ProviderReply> call, RateLimitPort.Permit permit, AtomicBoolean claimed) {
            super(() -> {
                claimed.set(true);
                try {
                    return call.call();
                } finally {
                    permit.close();
                }
            });
            this.permit = permit;
            this.claimed = claimed;
        }

        @Override
        protected void done() {
            if (claimed.compareAndSet(false, true)) {
                permit.close();
            }
        }
    }

    private GenerationResult finishSuccess(GenerationRequest request, long startNanos, ProviderConfig provider,
            ModelCapability capability, ProviderReply reply) {
        long durationMs = elapsedMillis(startNanos);
        double cost = costCalculator.calculate(provider, capability, reply.getInputTokens(),
                reply.getOutputTokens());

        GenerationOutcome outcome = baseOutcome(request, durationMs)
                .status(OutcomeStatus.SUCCESS)
                .inputTokens(reply.getInputTokens())
                .outputTokens(reply.getOutputTokens())
                .cost(cost)
                .build();
        recordOutcome(outcome);

        log.info("[Executor] Completed | request={} | provider={} | model={} | attempts={} | tokens={}+{} | "
                + "cost={} | duration={}ms", request.getRequestId(), provider.getName(), request.getModel(),
                request.getAttempts(), reply.getInputTokens(), reply.getOutputTokens(), cost, durationMs);

        return GenerationResult.builder()
                .requestId(request.getRequestId())
                .text(reply.getText())
                .provider(provider.getName())
                .model(request.getModel())
                .inputTokens(reply.getInputTokens())
                .outputTokens(reply.getOutputTokens())
                .cost(cost)
                .attempts(request.getAttempts())
                .durationMs(durationMs)
                .truncated(request.isTruncated())
                .build();
    }

    private GenerationResult finishFailure(GenerationRequest request, long startNanos, ErrorKind kind,
            String message, ErrorKind lastKind) {
        long durationMs = elapsedMillis(startNanos);
        OutcomeStatus status = kind == ErrorKind.CANCELLED ? OutcomeStatus.CANCELLED : OutcomeStatus.ERROR;

        GenerationOutcome outcome = baseOutcome(request, durationMs)
                .status(status)
                .errorKind(kind)
                .lastErrorKind(lastKind)
                .errorMessage(message)
                .build();
        recordOutcome(outcome);

        if (status == OutcomeStatus.CANCELLED) {
            log.info("[Executor] Cancelled | request={} | alias={} | attempts={}", request.getRequestId(),
                    request.getAlias(), request.getAttempts());
        } else {
            log.error("[Executor] Failed | request={} | alias={} | provider={} | kind={} | lastKind={} | "
                    + "attempts={} | error={}", request.getRequestId(), request.getAlias(), request.getProvider(),
                    kind, lastKind, request.getAttempts(), message);
        }

        return GenerationResult.builder()
                .requestId(request.getRequestId())
                .provider(request.getProvider())
                .model(request.getModel())
                .attempts(request.getAttempts())
                .durationMs(durationMs)
                .truncated(request.isTruncated())
                .error(new GenerationError(kind, message, lastKind))
                .build();
    }

    private GenerationOutcome.GenerationOutcomeBuilder baseOutcome(GenerationRequest request, long durationMs) {
        return GenerationOutcome.builder()
                .requestId(request.getRequestId())
                .timestamp(clock.instant())
                .alias(request.getAlias())
                .provider(request.getProvider())
                .model(request.getModel())
                .workflowId(request.getCorrelation().workflowId())
                .stepName(request.getCorrelation().stepName())
                .durationMs(durationMs)
                .attempts(request.getAttempts())
                .failedAttempts(request.getFailedAttempts())
                .truncated(request.isTruncated());
    }

    private void recordOutcome(GenerationOutcome outcome) {
        try {
            usageTracker.record(outcome);
        } catch (RuntimeException e) {
            log.error("[Executor] Failed to record outcome of request {}", outcome.getRequestId(), e);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
