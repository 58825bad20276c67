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
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MediaWiki API client shared by the Wikipedia tools. Looks pages up by exact
 * title (following redirects) and falls back to full-text search for the best
 * matching title. Plain-text extracts are split into sections on their
 * {@code == Heading ==} markers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WikipediaClient {

    private static final Pattern HEADING = Pattern.compile("^(={2,6})\\s*(.+?)\\s*\\1\\s*$");
    private static final String PAGE_PROPS = "extracts|info|links";
    private static final int LINK_LIMIT = 100;

    private final FeignClientFactory feignClientFactory;
    private final ResearchProperties properties;

    private WikipediaApi api;

    @PostConstruct
    public void init() {
        var config = properties.getTools().getWikipedia();
        String baseUrl = "https://" + config.getLanguage() + ".wikipedia.org";
        this.api = feignClientFactory.create(WikipediaApi.class, baseUrl,
                Duration.ofSeconds(config.getTimeoutSeconds()), config.getUserAgent());
        log.info("[Wikipedia] Client initialized for {}", baseUrl);
    }

    /**
     * One section of an article. Content includes nested subsections.
     */
    public record Section(int level, String title, String content) {
    }

    public record Article(String title, String url, String summary, List<Section> sections, List<String> links) {

        public List<String> topLevelSectionTitles() {
            return sections.stream().filter(s -> s.level() == 2).map(Section::title).toList();
        }

        public Optional<Section> findSection(String title) {
            return sections.stream().filter(s -> s.title().equalsIgnoreCase(title.trim())).findFirst();
        }
    }

    /**
     * Looks up an article by title, then by search.
     *
     * @throws FeignException
     *             on transport or decoding problems
     */
    public Optional<Article> findArticle(String titleOrQuery) {
        Optional<Article> exact = fetchPage(titleOrQuery);
        if (exact.isPresent()) {
            return exact;
        }
        WikiResponse search = api.search(titleOrQuery, 1);
        if (search == null || search.getQuery() == null || search.getQuery().getSearch() == null
                || search.getQuery().getSearch().isEmpty()) {
            return Optional.empty();
        }
        String bestTitle = search.getQuery().getSearch().get(0).getTitle();
        log.debug("[Wikipedia] '{}' resolved by search to '{}'", titleOrQuery, bestTitle);
        return fetchPage(bestTitle);
    }

    private Optional<Article> fetchPage(String title) {
        WikiResponse response = api.page(title, PAGE_PROPS, LINK_LIMIT);
        if (response == null || response.getQuery() == null || response.getQuery().getPages() == null) {
            return Optional.empty();
        }
        for (WikiPage page : response.getQuery().getPages()) {
            if (page.isMissing() || page.isInvalid() || page.getExtract() == null) {
                continue;
            }
            return Optional.of(toArticle(page));
        }
        return Optional.empty();
    }

    static Article toArticle(WikiPage page) {
        List<String> links = new ArrayList<>();
        if (page.getLinks() != null) {
            page.getLinks().forEach(link -> links.add(link.getTitle()));
        }
        String extract = page.getExtract();
        List<String> lines = extract.lines().toList();

        StringBuilder summary = new StringBuilder();
        List<int[]> headings = new ArrayList<>();
        List<String> titles = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = HEADING.matcher(lines.get(i));
            if (matcher.matches()) {
                headings.add(new int[] { i, matcher.group(1).length() });
                titles.add(matcher.group(2));
            } else if (headings.isEmpty()) {
                summary.append(lines.get(i)).append('\n');
            }
        }

        List<Section> sections = new ArrayList<>();
        for (int h = 0; h < headings.size(); h++) {
            int start = headings.get(h)[0];
            int level = headings.get(h)[1];
            int end = lines.size();
            for (int next = h + 1; next < headings.size(); next++) {
                if (headings.get(next)[1] <= level) {
                    end = headings.get(next)[0];
                    break;
                }
            }
            String content = String.join("\n", lines.subList(start + 1, end)).strip();
            sections.add(new Section(level, titles.get(h), content));
        }
        return new Article(page.getTitle(), page.getFullurl(), summary.toString().strip(), sections, links);
    }

    static ToolFailureKind classify(FeignException e) {
        if (e instanceof DecodeException || e.status() >= 200 && e.status() < 300) {
            return ToolFailureKind.PARSE_ERROR;
        }
        if (e instanceof RetryableException && e.getCause() instanceof InterruptedIOException) {
            return ToolFailureKind.TIMEOUT;
        }
        return ToolFailureKind.NETWORK_ERROR;
    }

    // Feign API interface
    interface WikipediaApi {
        @RequestLine("GET /w/api.php?action=query&format=json&formatversion=2&redirects=1&prop={prop}"
                + "&explaintext=1&exsectionformat=wiki&inprop=url&plnamespace=0&pllimit={limit}&titles={title}")
        WikiResponse page(@Param("title") String title, @Param("prop") String prop, @Param("limit") int limit);

        @RequestLine("GET /w/api.php?action=query&format=json&formatversion=2&list=search&srlimit={limit}"
                + "&srsearch={query}")
        WikiResponse search(@Param("query") String query, @Param("limit") int limit);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WikiResponse {
        private WikiQuery query;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WikiQuery {
        private List<WikiPage> pages;
        private List<WikiSearchHit> search;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WikiPage {
        private String title;
        private boolean missing;
        private boolean invalid;
        private String extract;
        private String fullurl;
        private List<WikiLink> links;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WikiLink {
        private String title;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WikiSearchHit {
        private String title;
    }
}
