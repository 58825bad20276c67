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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.component.ToolComponent;
import me.golemcore.research.domain.model.SearchHit;
import me.golemcore.research.domain.model.SearchResults;
import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.port.outbound.SearchProviderException;
import me.golemcore.research.port.outbound.WebSearchPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Tool for web search ({@code web_search}).
 *
 * <p>
 * Delegates to the {@link WebSearchPort} selected by
 * {@code research.tools.search.provider} (DuckDuckGo by default, Brave when a
 * key is configured). Zero hits is a successful result with an empty list and a
 * suggestion to rephrase.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSearchTool implements ToolComponent {

    static final String NAME = "web_search";
    private static final String PARAM_QUERY = "query";
    private static final String PARAM_MAX_RESULTS = "max_results";

    private final List<WebSearchPort> searchPorts;
    private final ResearchProperties properties;
    private final ExecutorService researchExecutor;

    private WebSearchPort searchPort;

    @PostConstruct
    public void init() {
        String provider = properties.getTools().getSearch().getProvider();
        this.searchPort = searchPorts.stream()
                .filter(port -> port.getProviderId().equalsIgnoreCase(provider))
                .findFirst()
                .orElse(null);
        if (searchPort == null) {
            log.warn("[Search] No search provider '{}' available, web_search disabled", provider);
        } else {
            log.info("[Search] Using {} search provider", searchPort.getProviderId());
        }
    }

    @Override
    public boolean isEnabled() {
        return searchPort != null;
    }

    @Override
    public ToolDefinition getDefinition() {
        int defaultCount = properties.getTools().getSearch().getDefaultCount();
        int maxCount = properties.getTools().getSearch().getMaxCount();
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search the web. Returns ranked results with title, snippet and URL. "
                        + "If results are poor, try different keywords.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", "string",
                                        "description", "The search query"),
                                PARAM_MAX_RESULTS, Map.of(
                                        "type", "integer",
                                        "description", "Number of results to return (1-" + maxCount
                                                + ", default: " + defaultCount + ")")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> search(parameters), researchExecutor);
    }

    private ToolResult search(Map<String, Object> parameters) {
        String query = ((String) parameters.get(PARAM_QUERY)).trim();
        int count = resolveCount(parameters.get(PARAM_MAX_RESULTS));
        try {
            List<SearchHit> hits = searchPort.search(query, count);
            SearchResults results = SearchResults.of(query, hits.size() > count ? hits.subList(0, count) : hits);
            log.info("[Search] '{}' -> {} result(s)", query, results.hits().size());
            return ToolResult.success(format(results), results);
        } catch (SearchProviderException e) {
            log.warn("[Search] Search failed for '{}': {}", query, e.getMessage());
            return ToolResult.failure(e.getKind(), "Search failed: " + e.getMessage(), Map.of(PARAM_QUERY, query));
        } catch (RuntimeException e) {
            log.error("[Search] Unexpected error for query: {}", query, e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Search failed: " + e.getMessage(),
                    Map.of(PARAM_QUERY, query));
        }
    }

    private int resolveCount(Object value) {
        var config = properties.getTools().getSearch();
        int count = value instanceof Number n ? n.intValue() : config.getDefaultCount();
        return Math.max(1, Math.min(config.getMaxCount(), count));
    }

    static String format(SearchResults results) {
        if (results.isEmpty()) {
            return "No results found for \"" + results.query() + "\". " + results.suggestion();
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Search results for \"%s\" (%d results):%n", results.query(), results.hits().size()));
        for (SearchHit hit : results.hits()) {
            sb.append(String.format("%n%d. **%s**%n   URL: %s%n   %s%n", hit.rank(), hit.title(), hit.url(),
                    hit.snippet()));
        }
        return sb.toString();
    }
}
