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

package me.golemcore.research.adapter.outbound.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import feign.codec.DecodeException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.model.SearchHit;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.infrastructure.http.FeignClientFactory;
import me.golemcore.research.port.outbound.SearchProviderException;
import me.golemcore.research.port.outbound.WebSearchPort;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Web search using the Brave Search API.
 *
 * <p>
 * Rate-limited requests (HTTP 429) are retried with exponential backoff.
 * Requires {@code research.tools.search.brave-api-key}.
 *
 * @see <a href="https://brave.com/search/api/">Brave Search API</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BraveSearchAdapter implements WebSearchPort {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final FeignClientFactory feignClientFactory;
    private final ResearchProperties properties;

    private BraveSearchApi searchApi;

    @PostConstruct
    public void init() {
        var config = properties.getTools().getSearch();
        this.searchApi = feignClientFactory.create(BraveSearchApi.class, config.getBraveUrl(),
                Duration.ofSeconds(config.getTimeoutSeconds()), null);
    }

    @Override
    public String getProviderId() {
        return "brave";
    }

    @Override
    public List<SearchHit> search(String query, int count) throws SearchProviderException {
        String apiKey = properties.getTools().getSearch().getBraveApiKey();
        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            try {
                log.debug("[Search] Brave: query='{}', count={}, attempt={}", query, count, attempt);
                return toHits(searchApi.search(apiKey, query, count));
            } catch (RetryableException e) {
                ToolFailureKind kind = e.getCause() instanceof InterruptedIOException
                        ? ToolFailureKind.TIMEOUT
                        : ToolFailureKind.NETWORK_ERROR;
                throw new SearchProviderException(kind, "Brave Search request failed: " + e.getMessage(), e);
            } catch (DecodeException e) {
                throw new SearchProviderException(ToolFailureKind.PARSE_ERROR,
                        "Failed to parse Brave Search response", e);
            } catch (FeignException e) {
                if (isSuccessStatus(e.status())) {
                    // unreadable body on a 2xx answer
                    throw new SearchProviderException(ToolFailureKind.PARSE_ERROR,
                            "Failed to parse Brave Search response", e);
                }
                if (e.status() == HTTP_TOO_MANY_REQUESTS && attempt < MAX_RETRIES) {
                    long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[Search] Brave rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, MAX_RETRIES, backoffMs);
                    sleepBeforeRetry(backoffMs);
                } else {
                    log.error("[Search] Brave API error (status {}) for query: {}", e.status(), query);
                    throw new SearchProviderException(ToolFailureKind.NETWORK_ERROR,
                            "Brave Search returned HTTP " + e.status(), e);
                }
            }
        }
        throw new SearchProviderException(ToolFailureKind.NETWORK_ERROR, "Brave Search rate limit exceeded");
    }

    private List<SearchHit> toHits(BraveSearchResponse response) {
        List<SearchHit> hits = new ArrayList<>();
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null) {
            return hits;
        }
        for (WebResult result : response.getWeb().getResults()) {
            if (result.getUrl() == null || result.getUrl().isBlank()) {
                continue;
            }
            hits.add(new SearchHit(hits.size() + 1,
                    result.getTitle() != null ? result.getTitle() : "",
                    result.getDescription() != null ? result.getDescription() : "",
                    result.getUrl()));
        }
        return hits;
    }

    private static boolean isSuccessStatus(int status) {
        return status >= 200 && status < 300;
    }

    protected void sleepBeforeRetry(long millis) throws SearchProviderException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchProviderException(ToolFailureKind.CANCELLED, "Brave Search retry interrupted", e);
        }
    }

    // Feign API interface
    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        BraveSearchResponse search(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BraveSearchResponse {
        private WebResults web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResults {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
    }
}
