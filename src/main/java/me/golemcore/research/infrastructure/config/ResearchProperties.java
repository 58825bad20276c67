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

package me.golemcore.research.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the research service, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code research.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - chat model provider, endpoint and credentials</li>
 * <li>{@link EngineProperties} - step, time and output budgets of the
 * conversation engine</li>
 * <li>{@link ValidationProperties} - claim validation rounds and budgets</li>
 * <li>{@link ToolsProperties} - search, crawl, Wikipedia and Wolfram Alpha</li>
 * <li>{@link StorageProperties} - where reports are written</li>
 * <li>{@link CliProperties} - one-shot command line run</li>
 * <li>{@link RunsProperties} - retention of finished runs</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "research")
@Data
public class ResearchProperties {

    private LlmProperties llm = new LlmProperties();
    private EngineProperties engine = new EngineProperties();
    private ValidationProperties validation = new ValidationProperties();
    private ReportProperties report = new ReportProperties();
    private HttpProperties http = new HttpProperties();
    private StorageProperties storage = new StorageProperties();
    private ToolsProperties tools = new ToolsProperties();
    private CliProperties cli = new CliProperties();
    private RunsProperties runs = new RunsProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /**
         * One of {@code openai}, {@code azure}, {@code anthropic}. {@code openai}
         * covers every OpenAI-compatible endpoint, LM Studio included.
         */
        private String provider = "openai";
        private String baseUrl = "http://localhost:1234/v1";
        private String apiKey;
        private String model = "qwen2.5-14b-instruct";
        private Double temperature = 0.7;
        private Integer maxTokens;
        private long requestTimeoutSeconds = 300;
        private int maxRetries = 5;
        private long retryInitialBackoffMs = 5000;
        private AzureProperties azure = new AzureProperties();
    }

    @Data
    public static class AzureProperties {
        private String endpoint;
        private String deployment = "gpt-4o";
    }

    // ==================== ENGINE ====================

    @Data
    public static class EngineProperties {
        private int maxSteps = 25;
        private long deadlineSeconds = 600;
        private int maxEmptyResponseRetries = 2;
        private int maxToolResultChars = 8000;
    }

    @Data
    public static class ValidationProperties {
        private int maxRounds = 3;
        private int maxStepsPerRound = 8;
        private int maxClaims = 10;
    }

    @Data
    public static class ReportProperties {
        private int minLength = 200;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/research";
        private boolean enabled = true;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private SearchToolProperties search = new SearchToolProperties();
        private CrawlToolProperties crawl = new CrawlToolProperties();
        private WikipediaToolProperties wikipedia = new WikipediaToolProperties();
        private WolframToolProperties wolfram = new WolframToolProperties();
    }

    @Data
    public static class SearchToolProperties {
        /**
         * {@code duckduckgo} (no key) or {@code brave}.
         */
        private String provider = "duckduckgo";
        private int defaultCount = 5;
        private int maxCount = 20;
        private String duckDuckGoUrl = "https://html.duckduckgo.com/html/";
        private String braveApiKey;
        private String braveUrl = "https://api.search.brave.com";
        private int timeoutSeconds = 15;
    }

    @Data
    public static class CrawlToolProperties {
        private boolean enabled = true;
        private int defaultMaxChars = 5000;
        private int timeoutSeconds = 10;
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    }

    @Data
    public static class WikipediaToolProperties {
        private boolean enabled = true;
        private String language = "en";
        private String userAgent = "GolemCore-Research-Bot/1.0";
        private int defaultSentences = 10;
        private int maxSections = 5;
        private int maxLinks = 10;
        private int maxSectionChars = 3000;
        private int timeoutSeconds = 15;
    }

    @Data
    public static class WolframToolProperties {
        private boolean enabled = false;
        private String appId;
        private String apiUrl = "https://api.wolframalpha.com";
        private int timeoutSeconds = 30;
    }

    // ==================== CLI ====================

    @Data
    public static class CliProperties {
        private String query;
        private String mode = "web";
        private boolean compareDirect = false;
        private boolean exitOnCompletion = false;
    }

    // ==================== Runs ====================

    /**
     * Retention of finished runs tracked by the run coordinator. A finished run
     * is dropped once it is older than the retention period, and the oldest
     * finished runs are dropped above the count cap.
     */
    @Data
    public static class RunsProperties {
        private long retentionMinutes = 60;
        private int maxFinished = 100;
    }
}
