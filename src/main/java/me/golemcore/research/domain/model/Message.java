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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A single entry of a {@link Conversation}. The {@link Type} discriminates the
 * four shapes a message can take; only the fields relevant to that shape are
 * populated.
 */
@Value
@Builder
public class Message {

    public enum Type {
        USER_TEXT, ASSISTANT_TEXT, TOOL_INVOCATION, TOOL_OUTCOME
    }

    String id;
    Type type;

    /**
     * Text content. For TOOL_INVOCATION this is whatever text the model sent
     * alongside its tool calls (often null).
     */
    String content;

    @Builder.Default
    List<ToolRequest> toolRequests = List.of();

    @Builder.Default
    List<ToolExecutionOutcome> toolOutcomes = List.of();

    Instant timestamp;

    public static Message userText(String content) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .type(Type.USER_TEXT)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    public static Message assistantText(String content) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .type(Type.ASSISTANT_TEXT)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    public static Message toolInvocation(String content, List<ToolRequest> requests) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .type(Type.TOOL_INVOCATION)
                .content(content)
                .toolRequests(List.copyOf(requests))
                .timestamp(Instant.now())
                .build();
    }

    public static Message toolOutcome(List<ToolExecutionOutcome> outcomes) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .type(Type.TOOL_OUTCOME)
                .toolOutcomes(List.copyOf(outcomes))
                .timestamp(Instant.now())
                .build();
    }

    public boolean isAssistantText() {
        return type == Type.ASSISTANT_TEXT;
    }

    public boolean isToolOutcome() {
        return type == Type.TOOL_OUTCOME;
    }

    public boolean hasText() {
        return content != null && !content.isBlank();
    }

    /**
     * Text carried by the message: its own content, or for a tool outcome the
     * concatenated tool message contents.
     */
    public String text() {
        if (type != Type.TOOL_OUTCOME) {
            return content;
        }
        StringBuilder sb = new StringBuilder();
        for (ToolExecutionOutcome outcome : toolOutcomes) {
            if (outcome.messageContent() == null || outcome.messageContent().isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(outcome.messageContent());
        }
        return sb.toString();
    }
}
