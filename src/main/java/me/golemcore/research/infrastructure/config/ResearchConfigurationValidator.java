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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks provider credentials at startup. Missing credentials are reported all
 * at once and abort context startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchConfigurationValidator {

    private final ResearchProperties properties;

    @PostConstruct
    public void validate() {
        List<String> problems = new ArrayList<>();
        validateLlm(properties.getLlm(), problems);
        validateTools(properties.getTools(), problems);

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid research configuration:\n  " + String.join("\n  ", problems));
        }
        log.info("[Config] LLM provider: {}, model: {}, search: {}",
                properties.getLlm().getProvider(), properties.getLlm().getModel(),
                properties.getTools().getSearch().getProvider());
    }

    private void validateLlm(ResearchProperties.LlmProperties llm, List<String> problems) {
        String provider = llm.getProvider() == null ? "" : llm.getProvider().toLowerCase(Locale.ROOT);
        switch (provider) {
        case "openai" -> {
            if (isBlank(llm.getBaseUrl()) && isBlank(llm.getApiKey())) {
                problems.add("research.llm.api-key is required for the official OpenAI endpoint");
            }
        }
        case "azure" -> {
            if (isBlank(llm.getApiKey())) {
                problems.add("research.llm.api-key (AZURE_OPENAI_API_KEY) is required for azure");
            }
            if (isBlank(llm.getAzure().getEndpoint())) {
                problems.add("research.llm.azure.endpoint (AZURE_OPENAI_ENDPOINT) is required for azure");
            }
        }
        case "anthropic" -> {
            if (isBlank(llm.getApiKey())) {
                problems.add("research.llm.api-key is required for anthropic");
            }
        }
        default -> problems.add("Unsupported research.llm.provider: '" + llm.getProvider() + "'");
        }
    }

    private void validateTools(ResearchProperties.ToolsProperties tools, List<String> problems) {
        if (tools.getWolfram().isEnabled() && isBlank(tools.getWolfram().getAppId())) {
            problems.add("research.tools.wolfram.app-id (WOLFRAM_ALPHA_APPID) is required when Wolfram Alpha is enabled");
        }
        String searchProvider = tools.getSearch().getProvider();
        if ("brave".equalsIgnoreCase(searchProvider) && isBlank(tools.getSearch().getBraveApiKey())) {
            problems.add("research.tools.search.brave-api-key (BRAVE_API_KEY) is required for brave search");
        } else if (!"brave".equalsIgnoreCase(searchProvider) && !"duckduckgo".equalsIgnoreCase(searchProvider)) {
            problems.add("Unsupported research.tools.search.provider: '" + searchProvider + "'");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
