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

package me.golemcore.research.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.model.Conversation;
import me.golemcore.research.domain.model.Message;
import me.golemcore.research.domain.model.Report;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Selects the single final-answer text of a conversation.
 *
 * <p>
 * Every assistant text is scored by {@link #shapeOf(String)}. Among the texts
 * that qualify as a report (long enough and carrying at least one structural
 * marker) the longest wins, ties going to the latest. When nothing qualifies
 * the extractor falls back, in order, to the last non-empty assistant text, the
 * text sent alongside the last tool invocation, and the last non-empty tool
 * output. Every fallback is logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportExtractor {

    static final List<String> MARKERS = List.of("##", "# ", "Executive Summary", "Introduction", "Sources");

    private final ResearchProperties properties;

    /**
     * Report-shape score of one candidate text.
     *
     * @param length
     *            character count
     * @param markerCount
     *            number of distinct structural markers present
     */
    public record ReportShape(int length, int markerCount) {

        boolean qualifies(int minLength) {
            return length > minLength && markerCount > 0;
        }
    }

    public static ReportShape shapeOf(String text) {
        if (text == null) {
            return new ReportShape(0, 0);
        }
        int markers = 0;
        for (String marker : MARKERS) {
            if (text.contains(marker)) {
                markers++;
            }
        }
        return new ReportShape(text.length(), markers);
    }

    /**
     * @param query
     *            the research query as the user asked it, recorded on the report
     * @return the selected report, or empty when no message carries any text
     */
    public Optional<Report> extract(Conversation conversation, String query) {
        int minLength = properties.getReport().getMinLength();
        List<Message> messages = conversation.getMessages();

        int bestIndex = -1;
        int bestLength = -1;
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (!message.isAssistantText() || !message.hasText()) {
                continue;
            }
            ReportShape shape = shapeOf(message.getContent());
            if (shape.qualifies(minLength) && shape.length() >= bestLength) {
                bestIndex = i;
                bestLength = shape.length();
            }
        }
        if (bestIndex >= 0) {
            log.debug("[Report] Selected message #{} ({} chars)", bestIndex, bestLength);
            return Optional.of(new Report(query, messages.get(bestIndex).getContent(), bestIndex, false));
        }

        int fallback = lastIndexWithText(messages, Message.Type.ASSISTANT_TEXT);
        if (fallback >= 0) {
            log.warn("[Report] No message matched the report shape, using last assistant text (#{})", fallback);
            return Optional.of(new Report(query, messages.get(fallback).getContent(), fallback, true));
        }
        fallback = lastIndexWithText(messages, Message.Type.TOOL_INVOCATION);
        if (fallback >= 0) {
            log.warn("[Report] No assistant text, using text of tool invocation #{}", fallback);
            return Optional.of(new Report(query, messages.get(fallback).getContent(), fallback, true));
        }
        fallback = lastIndexWithText(messages, Message.Type.TOOL_OUTCOME);
        if (fallback >= 0) {
            log.warn("[Report] No assistant text, using tool output #{}", fallback);
            return Optional.of(new Report(query, messages.get(fallback).text(), fallback, true));
        }
        log.warn("[Report] Conversation carries no text to report");
        return Optional.empty();
    }

    private static int lastIndexWithText(List<Message> messages, Message.Type type) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.getType() != type) {
                continue;
            }
            String text = message.text();
            if (text != null && !text.isBlank()) {
                return i;
            }
        }
        return -1;
    }
}
