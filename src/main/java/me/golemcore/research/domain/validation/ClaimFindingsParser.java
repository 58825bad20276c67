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

package me.golemcore.research.domain.validation;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.model.Citation;
import me.golemcore.research.domain.model.Confidence;
import me.golemcore.research.domain.model.Verdict;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the labelled fact-checker answer
 * ({@code CLAIM / SUPPORTING / CONTRADICTING / CONFIDENCE / VERDICT / NOTES / NEEDS_MORE_RESEARCH}).
 * Tolerates markdown decoration around labels and multi-line sections. Only
 * evidence lines carrying a URL become citations.
 */
@Component
@Slf4j
public class ClaimFindingsParser {

    private enum Label {
        CLAIM, SUPPORTING, CONTRADICTING, CONFIDENCE, VERDICT, NOTES, NEEDS_MORE_RESEARCH
    }

    private static final Pattern LABEL_LINE = Pattern.compile(
            "^[\\s>*#-]*(CLAIM|SUPPORTING|CONTRADICTING|CONFIDENCE|VERDICT|NOTES|NEEDS[_ ]MORE[_ ]RESEARCH)[\\s*]*:[\\s*]*(.*)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern URL = Pattern.compile("https?://[^\\s)\\]>\"']+");
    private static final String TRAILING_PUNCTUATION = ".,;:!?";

    public ClaimFindings parse(String text) {
        if (text == null || text.isBlank()) {
            return ClaimFindings.empty();
        }

        Map<Label, StringBuilder> sections = new EnumMap<>(Label.class);
        Label current = null;
        for (String line : text.split("\\R")) {
            Matcher matcher = LABEL_LINE.matcher(line);
            if (matcher.matches()) {
                current = toLabel(matcher.group(1));
                StringBuilder section = sections.computeIfAbsent(current, k -> new StringBuilder());
                appendLine(section, matcher.group(2));
            } else if (current != null) {
                appendLine(sections.get(current), line);
            }
        }
        if (sections.isEmpty()) {
            log.debug("[Validator] Answer carries no fact-check labels");
        }

        return new ClaimFindings(
                value(sections, Label.CLAIM),
                citations(value(sections, Label.SUPPORTING)),
                citations(value(sections, Label.CONTRADICTING)),
                parseConfidence(value(sections, Label.CONFIDENCE)),
                parseVerdict(value(sections, Label.VERDICT)),
                value(sections, Label.NOTES),
                parseYesNo(value(sections, Label.NEEDS_MORE_RESEARCH)));
    }

    /**
     * Extracts one citation per URL. The snippet is the evidence line without
     * its URLs and list decoration.
     */
    List<Citation> citations(String section) {
        List<Citation> citations = new ArrayList<>();
        if (section == null) {
            return citations;
        }
        for (String line : section.split("\\R")) {
            Matcher matcher = URL.matcher(line);
            List<String> urls = new ArrayList<>();
            while (matcher.find()) {
                urls.add(stripTrailingPunctuation(matcher.group()));
            }
            if (urls.isEmpty()) {
                continue;
            }
            String snippet = cleanSnippet(URL.matcher(line).replaceAll(""));
            for (String url : urls) {
                Citation citation = new Citation(url, snippet);
                if (!citations.contains(citation)) {
                    citations.add(citation);
                }
            }
        }
        return citations;
    }

    private static Label toLabel(String raw) {
        return Label.valueOf(raw.toUpperCase(Locale.ROOT).replace(' ', '_'));
    }

    private static void appendLine(StringBuilder section, String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        if (section.length() > 0) {
            section.append('\n');
        }
        section.append(line.trim());
    }

    private static String value(Map<Label, StringBuilder> sections, Label label) {
        StringBuilder section = sections.get(label);
        if (section == null || section.length() == 0) {
            return null;
        }
        return section.toString();
    }

    static Confidence parseConfidence(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.toUpperCase(Locale.ROOT);
        // "HIGH / MEDIUM / LOW" echoed from the template is not an answer
        int found = 0;
        Confidence result = null;
        for (Confidence confidence : Confidence.values()) {
            if (normalized.contains(confidence.name())) {
                found++;
                if (result == null) {
                    result = confidence;
                }
            }
        }
        return found == 1 ? result : null;
    }

    static Verdict parseVerdict(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        if (normalized.contains("LIKELY_TRUE")) {
            return Verdict.LIKELY_TRUE;
        }
        if (normalized.contains("LIKELY_FALSE")) {
            return Verdict.LIKELY_FALSE;
        }
        if (normalized.contains("CONFIRMED")) {
            return Verdict.CONFIRMED;
        }
        if (normalized.contains("UNCERTAIN")) {
            return Verdict.UNCERTAIN;
        }
        return null;
    }

    static Boolean parseYesNo(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("YES")) {
            return Boolean.TRUE;
        }
        if (normalized.startsWith("NO")) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static String stripTrailingPunctuation(String url) {
        int end = url.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }

    private static String cleanSnippet(String line) {
        String cleaned = line.replaceAll("\\(\\s*\\)|\\[\\s*]|<\\s*>", "")
                .replaceAll("(?i)\\b(source|sources|url)\\s*:\\s*", "")
                .replaceAll("\\s+", " ")
                .trim();
        cleaned = cleaned.replaceAll("^[-*\\d.)\\s]+", "").replaceAll("[\\s,;:(-]+$", "").trim();
        return cleaned;
    }
}
