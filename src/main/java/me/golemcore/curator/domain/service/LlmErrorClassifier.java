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

import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes provider failures into {@link ErrorKind}.
 *
 * <p>
 * Vendor library exceptions are recognized by class name and HTTP status codes
 * are read reflectively ({@code statusCode()} on langchain4j, {@code status()}
 * on Feign), so the domain stays free of client library imports.
 */
public final class LlmErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNSUPPORTED_FEATURE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnsupportedFeatureException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";

    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");
    private static final Pattern RETRY_AFTER_PATTERN = Pattern
            .compile("(?i)(?:retry|try again) (?:after|in) (\\d+(?:\\.\\d+)?)\\s*(ms|s|sec|seconds?)?");

    private LlmErrorClassifier() {
    }

    /**
     * Classifies a failure by walking its cause chain. The first cause that can
     * be classified wins; anything unrecognized is treated as the provider being
     * unavailable.
     */
    public static ErrorKind classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            ErrorKind byType = classifyKnownThrowable(current);
            if (byType != null) {
                return byType;
            }
            current = current.getCause();
        }

        current = throwable;
        visited.clear();
        while (current != null && visited.add(current)) {
            ErrorKind byMessage = classifyFromMessage(current.getMessage());
            if (byMessage != null) {
                return byMessage;
            }
            current = current.getCause();
        }
        return ErrorKind.PROVIDER_UNAVAILABLE;
    }

    /**
     * Maps an HTTP status code to an error kind.
     */
    public static ErrorKind classifyHttpStatus(int statusCode) {
        if (statusCode == 429) {
            return ErrorKind.RATE_LIMITED;
        }
        if (statusCode == 401 || statusCode == 403) {
            return ErrorKind.AUTH_ERROR;
        }
        if (statusCode == 408 || statusCode == 500 || statusCode == 502 || statusCode == 504) {
            return ErrorKind.TRANSIENT_NETWORK_ERROR;
        }
        if (statusCode >= 500) {
            // 503 and vendor overload codes such as 529
            return ErrorKind.PROVIDER_UNAVAILABLE;
        }
        if (statusCode >= 400) {
            return ErrorKind.INVALID_REQUEST;
        }
        return ErrorKind.PROVIDER_UNAVAILABLE;
    }

    /**
     * Looks for a retry-after hint in response headers or error bodies of the
     * cause chain.
     */
    public static Duration extractRetryAfter(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof ProviderException providerException
                    && providerException.getRetryAfter() != null) {
                return providerException.getRetryAfter();
            }
            Duration fromHeader = readRetryAfterHeader(current);
            if (fromHeader != null) {
                return fromHeader;
            }
            Duration fromMessage = parseRetryAfter(current.getMessage());
            if (fromMessage != null) {
                return fromMessage;
            }
            current = current.getCause();
        }
        return null;
    }

    /**
     * Wraps a client failure into a classified {@link ProviderException}.
     */
    public static ProviderException toProviderException(String provider, Throwable throwable) {
        if (throwable instanceof ProviderException providerException) {
            return providerException;
        }
        ErrorKind kind = classify(throwable);
        Duration retryAfter = kind == ErrorKind.RATE_LIMITED ? extractRetryAfter(throwable) : null;
        String message = throwable.getMessage() != null ? throwable.getMessage()
                : throwable.getClass().getSimpleName();
        return new ProviderException(kind, provider, message, retryAfter, throwable);
    }

    static Duration parseRetryAfter(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        Matcher reset = RESET_SECONDS_PATTERN.matcher(message);
        if (reset.find()) {
            return Duration.ofSeconds(Long.parseLong(reset.group(1)));
        }
        Matcher retry = RETRY_AFTER_PATTERN.matcher(message);
        if (retry.find()) {
            double amount = Double.parseDouble(retry.group(1));
            String unit = retry.group(2);
            if ("ms".equalsIgnoreCase(unit)) {
                return Duration.ofMillis((long) amount);
            }
            return Duration.ofMillis((long) (amount * 1000));
        }
        return null;
    }

    private static ErrorKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof ProviderException providerException) {
            return providerException.getKind();
        }
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return ErrorKind.CANCELLED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return ErrorKind.TRANSIENT_NETWORK_ERROR;
        }
        if (throwable instanceof ConnectException
                || throwable instanceof UnknownHostException
                || throwable instanceof NoRouteToHostException) {
            return ErrorKind.PROVIDER_UNAVAILABLE;
        }

        String className = throwable.getClass().getName();
        if (className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            ErrorKind byLangchain4j = classifyLangchain4j(className);
            if (byLangchain4j != null) {
                return byLangchain4j;
            }
        }

        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode != null && statusCode > 0) {
            return classifyHttpStatus(statusCode);
        }

        if (throwable instanceof IOException) {
            return ErrorKind.TRANSIENT_NETWORK_ERROR;
        }
        // client-side argument checks, e.g. a blank message rejected before sending
        if (throwable instanceof IllegalArgumentException) {
            return ErrorKind.INVALID_REQUEST;
        }
        return null;
    }

    private static ErrorKind classifyLangchain4j(String className) {
        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return ErrorKind.RATE_LIMITED;
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className) || CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)
                || CLASS_RETRIABLE_EXCEPTION.equals(className)) {
            return ErrorKind.TRANSIENT_NETWORK_ERROR;
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)) {
            return ErrorKind.AUTH_ERROR;
        }
        if (CLASS_INVALID_REQUEST_EXCEPTION.equals(className)
                || CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)
                || CLASS_CONTENT_FILTERED_EXCEPTION.equals(className)
                || CLASS_UNSUPPORTED_FEATURE_EXCEPTION.equals(className)
                || CLASS_NON_RETRIABLE_EXCEPTION.equals(className)) {
            return ErrorKind.INVALID_REQUEST;
        }
        if (CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION.equals(className)) {
            return ErrorKind.PROVIDER_UNAVAILABLE;
        }
        // HttpException and the generic LangChain4jException: decided by status
        return null;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        for (String accessor : new String[] { "statusCode", "status" }) {
            Object result = invokeAccessor(throwable, accessor);
            if (result instanceof Integer statusCode) {
                return statusCode;
            }
        }
        return null;
    }

    private static Duration readRetryAfterHeader(Throwable throwable) {
        Object headers = invokeAccessor(throwable, "responseHeaders");
        if (!(headers instanceof Map<?, ?> map)) {
            return null;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() instanceof String name && "retry-after".equalsIgnoreCase(name)
                    && entry.getValue() instanceof Collection<?> values && !values.isEmpty()) {
                String value = String.valueOf(values.iterator().next()).trim();
                try {
                    return Duration.ofSeconds(Long.parseLong(value));
                } catch (NumberFormatException e) {
                    // HTTP-date form is not used by the supported vendors
                    return null;
                }
            }
        }
        return null;
    }

    private static Object invokeAccessor(Throwable throwable, String name) {
        try {
            Method method = throwable.getClass().getMethod(name);
            if (method.getParameterCount() != 0) {
                return null;
            }
            return method.invoke(throwable);
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            return null;
        }
    }

    private static ErrorKind classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("prompt is too long")) {
            return ErrorKind.INVALID_REQUEST;
        }
        if (normalized.contains("rate_limit") || normalized.contains("rate limit")
                || normalized.contains("too many requests")) {
            return ErrorKind.RATE_LIMITED;
        }
        if (normalized.contains("unauthorized") || normalized.contains("invalid api key")
                || normalized.contains("invalid x-api-key")) {
            return ErrorKind.AUTH_ERROR;
        }
        if (normalized.contains("timed out") || normalized.contains("timeout")) {
            return ErrorKind.TRANSIENT_NETWORK_ERROR;
        }
        return null;
    }
}
