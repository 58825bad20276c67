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

package me.golemcore.research.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Factory for Feign HTTP clients with OkHttp transport and Jackson JSON
 * decoding.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * WikipediaApi client = factory.create(WikipediaApi.class, "https://en.wikipedia.org", Duration.ofSeconds(15),
 *         "GolemCore-Research-Bot/1.0");
 * }</pre>
 *
 * Transport-level retries are disabled; adapters decide themselves which
 * failures are worth retrying.
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a Feign client with a per-call timeout and an identifying
     * user agent.
     */
    public <T> T create(Class<T> apiType, String baseUrl, Duration timeout, String userAgent) {
        Feign.Builder builder = builder()
                .options(new Request.Options(timeout.toMillis(), TimeUnit.MILLISECONDS,
                        timeout.toMillis(), TimeUnit.MILLISECONDS, true));
        if (userAgent != null && !userAgent.isBlank()) {
            builder.requestInterceptor(template -> template.header("User-Agent", userAgent));
        }
        return builder.target(apiType, baseUrl);
    }

    private Feign.Builder builder() {
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .retryer(Retryer.NEVER_RETRY);
    }
}
