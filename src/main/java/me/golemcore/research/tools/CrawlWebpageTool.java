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
import me.golemcore.research.domain.model.CrawledPage;
import me.golemcore.research.domain.model.TextTruncator;
import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Tool for fetching a web page and extracting its main text
 * ({@code crawl_webpage}).
 *
 * <p>
 * Security:
 * <ul>
 * <li>Only http:// and https:// URLs allowed
 * <li>Bare hosts are fetched over https
 * </ul>
 *
 * <p>
 * Extraction drops script, style, navigation, header and footer elements,
 * prefers {@code main}, then {@code article}, then {@code body}, collapses
 * whitespace and truncates to {@code max_chars}. Every failure is returned as a
 * failed result carrying the URL.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CrawlWebpageTool implements ToolComponent {

    static final String NAME = "crawl_webpage";
    private static final String PARAM_URL = "url";
    private static final String PARAM_MAX_CHARS = "max_chars";
    private static final String NON_CONTENT = "script, style, noscript, nav, footer, header, iframe, svg";
    private static final List<String> CONTENT_ROOTS = List.of("main", "article", "body");

    private final OkHttpClient okHttpClient;
    private final ResearchProperties properties;
    private final ExecutorService researchExecutor;

    private OkHttpClient client;

    @PostConstruct
    public void init() {
        this.client = okHttpClient.newBuilder()
                .callTimeout(properties.getTools().getCrawl().getTimeoutSeconds(), TimeUnit.SECONDS)
                .followRedirects(true)
                .build();
    }

    @Override
    public boolean isEnabled() {
        return properties.getTools().getCrawl().isEnabled();
    }

    @Override
    public Duration getTimeout() {
        // call timeout plus headroom for parsing
        return Duration.ofSeconds(properties.getTools().getCrawl().getTimeoutSeconds() + 5L);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Fetch a web page and extract its main text content. "
                        + "Use it when search snippets are insufficient.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_URL, Map.of(
                                        "type", "string",
                                        "description", "The http(s) URL to crawl"),
                                PARAM_MAX_CHARS, Map.of(
                                        "type", "integer",
                                        "description", "Maximum characters to return (default: "
                                                + properties.getTools().getCrawl().getDefaultMaxChars() + ")")),
                        "required", List.of(PARAM_URL)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> crawl(parameters), researchExecutor);
    }

    private ToolResult crawl(Map<String, Object> parameters) {
        String url = ((String) parameters.get(PARAM_URL)).trim();
        int maxChars = parameters.get(PARAM_MAX_CHARS) instanceof Number n && n.intValue() > 0
                ? n.intValue()
                : properties.getTools().getCrawl().getDefaultMaxChars();

        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            if (url.contains("://") || url.startsWith("javascript:") || url.startsWith("data:")
                    || url.startsWith("file:")) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Only http and https URLs are allowed",
                        Map.of(PARAM_URL, url));
            }
            url = "https://" + url;
        }

        String html;
        try {
            html = fetch(url);
        } catch (InterruptedIOException e) {
            log.warn("[Crawl] Timed out: {}", url);
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Request timed out (" + properties.getTools().getCrawl().getTimeoutSeconds() + "s limit)",
                    Map.of(PARAM_URL, url));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("[Crawl] Failed to fetch {}: {}", url, e.getMessage());
            return ToolResult.failure(ToolFailureKind.NETWORK_ERROR, "Failed to fetch page: " + e.getMessage(),
                    Map.of(PARAM_URL, url));
        }

        try {
            CrawledPage page = extract(url, html, maxChars);
            log.info("[Crawl] {} -> {} chars{}", url, page.charCount(), page.truncated() ? " (truncated)" : "");
            String output = String.format("**%s**%n%nURL: %s%n%n%s", page.title(), page.url(), page.content());
            return ToolResult.success(output, page);
        } catch (RuntimeException e) {
            log.warn("[Crawl] Failed to parse {}: {}", url, e.getMessage());
            return ToolResult.failure(ToolFailureKind.PARSE_ERROR, "Failed to parse page: " + e.getMessage(),
                    Map.of(PARAM_URL, url));
        }
    }

    private String fetch(String url) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", properties.getTools().getCrawl().getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                .get()
                .build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                return "";
            }
            MediaType contentType = body.contentType();
            if (contentType != null && !isTextual(contentType)) {
                throw new IOException("Unsupported content type " + contentType);
            }
            return body.string();
        }
    }

    private static boolean isTextual(MediaType contentType) {
        String subtype = contentType.subtype().toLowerCase(Locale.ROOT);
        return "text".equalsIgnoreCase(contentType.type()) || subtype.contains("html") || subtype.contains("xml");
    }

    static CrawledPage extract(String url, String html, int maxChars) {
        Document document = Jsoup.parse(html, url);
        document.select(NON_CONTENT).remove();

        Element root = null;
        for (String selector : CONTENT_ROOTS) {
            root = document.selectFirst(selector);
            if (root != null) {
                break;
            }
        }
        String text = root != null ? root.text() : document.text();
        text = text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();

        boolean truncated = TextTruncator.needsTruncation(text, maxChars);
        String content = TextTruncator.truncate(text, maxChars);
        return new CrawledPage(url, document.title(), content, content.length(), truncated);
    }
}
