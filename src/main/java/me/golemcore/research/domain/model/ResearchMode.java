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

package me.golemcore.research.domain.model;

import java.util.List;
import java.util.Locale;

/**
 * Research workflows. Each mode fixes the tools the model may call and the
 * title used when the report is persisted.
 */
public enum ResearchMode {

    WEB("Web Research", List.of("web_search", "crawl_webpage")),

    VALIDATED("Validated Research", List.of("web_search", "crawl_webpage", "fact_check")),

    WIKIPEDIA("Wikipedia Research Report", List.of("wikipedia_search", "wikipedia_get_section")),

    MATH("Wolfram Alpha Solution", List.of("rewrite_for_wolfram", "wolfram_query")),

    /**
     * Tool-less single answer, kept as the unvalidated baseline.
     */
    DIRECT("Unvalidated LLM Response (No Web Search, No Fact-Checking)", List.of());

    private final String reportTitle;
    private final List<String> toolNames;

    ResearchMode(String reportTitle, List<String> toolNames) {
        this.reportTitle = reportTitle;
        this.toolNames = toolNames;
    }

    public String getReportTitle() {
        return reportTitle;
    }

    public List<String> getToolNames() {
        return toolNames;
    }

    public String fileStem() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ResearchMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return WEB;
        }
        return ResearchMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
