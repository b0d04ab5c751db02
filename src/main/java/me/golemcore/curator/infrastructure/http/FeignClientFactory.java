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

package me.golemcore.curator.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import me.golemcore.curator.infrastructure.config.CuratorProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Creates Feign HTTP clients with OkHttp transport and Jackson JSON encoding.
 *
 * <p>
 * Clients never retry on their own. Their default read timeout comes from
 * {@code curator.http.read-timeout}; a call with its own deadline passes
 * {@link #requestOptions(Duration)} as a {@link Request.Options} argument of
 * the API method, so one client serves calls with any timeout.
 *
 * <pre>{@code
 * OllamaApi client = factory.create(OllamaApi.class, "http://localhost:11434");
 * client.generate(request, factory.requestOptions(Duration.ofSeconds(120)));
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final CuratorProperties properties;

    public <T> T create(Class<T> apiType, String baseUrl) {
        Request.Options options = requestOptions(Duration.ofMillis(properties.getHttp().getReadTimeout()));
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .retryer(Retryer.NEVER_RETRY)
                .options(options)
                .target(apiType, baseUrl);
    }

    public Request.Options requestOptions(Duration readTimeout) {
        return new Request.Options(
                properties.getHttp().getConnectTimeout(), TimeUnit.MILLISECONDS,
                readTimeout.toMillis(), TimeUnit.MILLISECONDS,
                true);
    }
}
