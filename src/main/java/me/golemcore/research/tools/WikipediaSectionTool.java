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
import me.golemcore.research.domain.model.TextTruncator;
import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.domain.model.WikipediaSection;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Tool for reading one section of a Wikipedia article
 * ({@code wikipedia_get_section}). When the section does not exist the result
 * has {@code found=false} and lists the valid section titles.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WikipediaSectionTool implements ToolComponent {

    static final String NAME = "wikipedia_get_section";
    private static final String PARAM_PAGE_TITLE = "page_title";
    private static final String PARAM_SECTION_TITLE = "section_title";

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
                .description("Get detailed content from a specific section of a Wikipedia page. "
                        + "Use section titles returned by wikipedia_search.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PAGE_TITLE, Map.of(
                                        "type", "string",
                                        "description", "Title of the Wikipedia page"),
                                PARAM_SECTION_TITLE, Map.of(
                                        "type", "string",
                                        "description", "Title of the section to read")),
                        "required", List.of(PARAM_PAGE_TITLE, PARAM_SECTION_TITLE)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> readSection(parameters), researchExecutor);
    }

    private ToolResult readSection(Map<String, Object> parameters) {
        String pageTitle = ((String) parameters.get(PARAM_PAGE_TITLE)).trim();
        String sectionTitle = ((String) parameters.get(PARAM_SECTION_TITLE)).trim();

        Optional<WikipediaClient.Article> article;
        try {
            article = wikipediaClient.findArticle(pageTitle);
        } catch (FeignException e) {
            log.warn("[Wikipedia] Section lookup failed for '{}': {}", pageTitle, e.getMessage());
            return ToolResult.failure(WikipediaClient.classify(e), "Wikipedia lookup failed: " + e.getMessage(),
                    Map.of(PARAM_PAGE_TITLE, pageTitle));
        }
        if (article.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.PROVIDER_ERROR, "Page '" + pageTitle + "' not found",
                    new WikipediaSection(false, pageTitle, sectionTitle, null, List.of()));
        }

        WikipediaClient.Article page = article.get();
        Optional<WikipediaClient.Section> section = page.findSection(sectionTitle);
        if (section.isEmpty()) {
            List<String> available = page.sections().stream().map(WikipediaClient.Section::title).toList();
            WikipediaSection missing = new WikipediaSection(false, page.title(), sectionTitle, null, available);
            return ToolResult.success("Section '" + sectionTitle + "' not found in '" + page.title()
                    + "'. Available sections: " + String.join(", ", available), missing);
        }

        int maxChars = properties.getTools().getWikipedia().getMaxSectionChars();
        String content = TextTruncator.truncate(section.get().content(), maxChars);
        WikipediaSection result = new WikipediaSection(true, page.title(), section.get().title(), content,
                List.of());
        log.info("[Wikipedia] Read section '{}' of '{}'", result.sectionTitle(), result.pageTitle());
        return ToolResult.success("**" + result.pageTitle() + " - " + result.sectionTitle() + "**\n\n" + content,
                result);
    }
}
