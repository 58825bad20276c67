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

package me.golemcore.research.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import feign.codec.DecodeException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.component.ToolComponent;
import me.golemcore.research.domain.model.MathResult;
import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Tool for Wolfram Alpha queries ({@code wolfram_query}).
 *
 * <p>
 * Expects input already in Wolfram syntax (see {@link WolframQueryRewriteTool}).
 * Returns "pod title: plaintext" lines in provider order. A query the provider
 * could not interpret is a {@link ToolFailureKind#PROVIDER_ERROR}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code research.tools.wolfram.enabled} - Enable/disable
 * <li>{@code research.tools.wolfram.app-id} - Wolfram Alpha AppID (required)
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WolframAlphaTool implements ToolComponent {

    static final String NAME = "wolfram_query";
    static final String NO_PLAINTEXT = "No plaintext results found";
    private static final String PARAM_QUERY = "formatted_query";

    private final FeignClientFactory feignClientFactory;
    private final ResearchProperties properties;
    private final ExecutorService researchExecutor;

    private WolframApi wolframApi;

    @PostConstruct
    public void init() {
        var config = properties.getTools().getWolfram();
        this.wolframApi = feignClientFactory.create(WolframApi.class, config.getApiUrl(),
                Duration.ofSeconds(config.getTimeoutSeconds()), null);
        if (isEnabled()) {
            log.info("[Wolfram] Wolfram Alpha tool initialized");
        }
    }

    @Override
    public boolean isEnabled() {
        var config = properties.getTools().getWolfram();
        return config.isEnabled() && config.getAppId() != null && !config.getAppId().isBlank();
    }

    @Override
    public Duration getTimeout() {
        return Duration.ofSeconds(properties.getTools().getWolfram().getTimeoutSeconds() + 5L);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Execute a query to Wolfram Alpha with properly formatted mathematical syntax. "
                        + "IMPORTANT: Only use this tool with output from rewrite_for_wolfram. "
                        + "Do not pass raw natural language to this tool.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", "string",
                                        "description", "Query in Wolfram Alpha syntax, "
                                                + "e.g. \"solve 2x + 10 = 300 for x\"")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> query(((String) parameters.get(PARAM_QUERY)).trim()),
                researchExecutor);
    }

    private ToolResult query(String formattedQuery) {
        String appId = properties.getTools().getWolfram().getAppId();
        WolframResponse response;
        try {
            log.info("[Wolfram] Query: {}", formattedQuery);
            response = wolframApi.query(formattedQuery, appId);
        } catch (DecodeException e) {
            return failure(ToolFailureKind.PARSE_ERROR, "Failed to parse Wolfram Alpha response", formattedQuery);
        } catch (RetryableException e) {
            ToolFailureKind kind = e.getCause() instanceof InterruptedIOException
                    ? ToolFailureKind.TIMEOUT
                    : ToolFailureKind.NETWORK_ERROR;
            return failure(kind, "Error querying Wolfram Alpha: " + e.getMessage(), formattedQuery);
        } catch (FeignException e) {
            if (e.status() >= 200 && e.status() < 300) {
                return failure(ToolFailureKind.PARSE_ERROR, "Failed to parse Wolfram Alpha response",
                        formattedQuery);
            }
            return failure(ToolFailureKind.NETWORK_ERROR, "Wolfram Alpha returned HTTP " + e.status(),
                    formattedQuery);
        }

        QueryResult result = response != null ? response.getQueryresult() : null;
        if (result == null || !result.isSuccess()) {
            log.warn("[Wolfram] Query not understood: {}", formattedQuery);
            return failure(ToolFailureKind.PROVIDER_ERROR,
                    "Wolfram Alpha could not understand the query: " + formattedQuery, formattedQuery);
        }

        List<String> lines = new ArrayList<>();
        if (result.getPods() != null) {
            for (Pod pod : result.getPods()) {
                if (pod.getSubpods() == null) {
                    continue;
                }
                String title = pod.getTitle() != null ? pod.getTitle() : "";
                for (Subpod subpod : pod.getSubpods()) {
                    if (subpod.getPlaintext() != null && !subpod.getPlaintext().isBlank()) {
                        lines.add(title + ": " + subpod.getPlaintext());
                    }
                }
            }
        }
        MathResult mathResult = new MathResult(formattedQuery, lines);
        return ToolResult.success(lines.isEmpty() ? NO_PLAINTEXT : mathResult.text(), mathResult);
    }

    private static ToolResult failure(ToolFailureKind kind, String message, String query) {
        return ToolResult.failure(kind, message, Map.of(PARAM_QUERY, query));
    }

    // Feign API interface
    interface WolframApi {
        @RequestLine("GET /v2/query?input={input}&appid={appid}&output=json")
        WolframResponse query(@Param("input") String input, @Param("appid") String appId);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WolframResponse {
        private QueryResult queryresult;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class QueryResult {
        private boolean success;
        private List<Pod> pods;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Pod {
        private String title;
        private List<Subpod> subpods;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Subpod {
        private String plaintext;
    }
}
