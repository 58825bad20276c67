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

import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.component.ToolComponent;
import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.domain.model.WikipediaPage;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Tool for encyclopedia lookups ({@code wikipedia_search}). Returns the
 * article summary (first N sentences), canonical URL, top-level section titles
 * and related link titles. A missing article is a successful result with
 * {@code found=false}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WikipediaSearchTool implements ToolComponent {

    static final String NAME = "wikipedia_search";
    private static final String PARAM_QUERY = "query";
    private static final String PARAM_SENTENCES = "sentences";

    private final WikipediaClient wikipediaClient;
    private final ResearchProperties properties;
    private final ExecutorService researchExecutor;

    @Override
    public boolean isEnabled() {
        return properties.getTools().getWikipedia().isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search Wikipedia for information on a topic. Returns a summary, the article URL, "
                        + "its main sections and related topics.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", "string",
                                        "description", "Topic or article title to look up"),
                                PARAM_SENTENCES, Map.of(
                                        "type", "integer",
                                        "description", "Number of summary sentences (default: "
                                                + properties.getTools().getWikipedia().getDefaultSentences() + ")")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> lookup(parameters), researchExecutor);
    }

    private ToolResult lookup(Map<String, Object> parameters) {
        var config = properties.getTools().getWikipedia();
        String query = ((String) parameters.get(PARAM_QUERY)).trim();
        int sentences = parameters.get(PARAM_SENTENCES) instanceof Number n && n.intValue() > 0
                ? n.intValue()
                : config.getDefaultSentences();

        Optional<WikipediaClient.Article> article;
        try {
            article = wikipediaClient.findArticle(query);
        } catch (FeignException e) {
            log.warn("[Wikipedia] Lookup failed for '{}': {}", query, e.getMessage());
            return ToolResult.failure(WikipediaClient.classify(e), "Wikipedia lookup failed: " + e.getMessage(),
                    Map.of(PARAM_QUERY, query));
        }

        if (article.isEmpty()) {
            WikipediaPage notFound = WikipediaPage.notFound(query);
            return ToolResult.success("No Wikipedia page found for '" + query + "'. " + notFound.suggestion(),
                    notFound);
        }

        WikipediaClient.Article found = article.get();
        List<String> sections = limit(found.topLevelSectionTitles(), config.getMaxSections());
        WikipediaPage page = new WikipediaPage(true, query, found.title(),
                firstSentences(found.summary(), sentences), found.url(), sections,
                limit(found.links(), config.getMaxLinks()), null);
        log.info("[Wikipedia] '{}' -> {}", query, page.title());
        return ToolResult.success(format(page), page);
    }

    static String firstSentences(String text, int count) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String[] sentences = text.split("\\. ");
        if (sentences.length <= count) {
            return text;
        }
        String joined = String.join(". ", Arrays.copyOfRange(sentences, 0, count));
        return joined.endsWith(".") ? joined : joined + ".";
    }

    private static List<String> limit(List<String> values, int max) {
        return values.size() > max ? values.subList(0, max) : values;
    }

    private static String format(WikipediaPage page) {
        StringBuilder sb = new StringBuilder();
        sb.append("**").append(page.title()).append("**\n");
        sb.append("URL: ").append(page.url()).append("\n\n");
        sb.append(page.summary()).append('\n');
        if (!page.sections().isEmpty()) {
            sb.append("\nSections: ").append(String.join(", ", page.sections())).append('\n');
        }
        if (!page.relatedTopics().isEmpty()) {
            sb.append("Related topics: ").append(String.join(", ", page.relatedTopics())).append('\n');
        }
        return sb.toString();
    }
}
