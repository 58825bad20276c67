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

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, append-only message log of one research request.
 *
 * <p>
 * Enforces causal ordering: every tool outcome must answer a request issued by
 * an earlier TOOL_INVOCATION message that has not been answered yet. Orphaned
 * or duplicate outcomes are dropped on append. A conversation is owned by the
 * single engine run that drives it and is not safe for concurrent writers.
 */
@Slf4j
public final class Conversation {

    private final List<Message> messages = new ArrayList<>();
    private final Set<String> pendingRequestIds = new LinkedHashSet<>();
    private final Set<String> knownRequestIds = new LinkedHashSet<>();

    private Conversation() {
    }

    /**
     * Starts a conversation holding exactly one user message.
     */
    public static Conversation start(String userText) {
        Conversation conversation = new Conversation();
        conversation.append(Message.userText(userText));
        return conversation;
    }

    public Message append(Message message) {
        Objects.requireNonNull(message, "message");
        Message accepted = switch (message.getType()) {
        case TOOL_INVOCATION -> registerRequests(message);
        case TOOL_OUTCOME -> filterOutcomes(message);
        default -> message;
        };
        messages.add(accepted);
        return accepted;
    }

    private Message registerRequests(Message message) {
        for (ToolRequest request : message.getToolRequests()) {
            if (request.id() == null || !knownRequestIds.add(request.id())) {
                throw new IllegalArgumentException("Tool request id must be present and unique: " + request.id());
            }
            pendingRequestIds.add(request.id());
        }
        return message;
    }

    private Message filterOutcomes(Message message) {
        List<ToolExecutionOutcome> accepted = new ArrayList<>();
        for (ToolExecutionOutcome outcome : message.getToolOutcomes()) {
            if (outcome.requestId() != null && pendingRequestIds.remove(outcome.requestId())) {
                accepted.add(outcome);
            } else {
                log.warn("[Conversation] Dropping orphaned tool result: id={}, tool={}",
                        outcome.requestId(), outcome.toolName());
            }
        }
        if (accepted.size() == message.getToolOutcomes().size()) {
            return message;
        }
        return Message.builder()
                .id(message.getId())
                .type(Message.Type.TOOL_OUTCOME)
                .toolOutcomes(List.copyOf(accepted))
                .timestamp(message.getTimestamp())
                .build();
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public Message get(int index) {
        return messages.get(index);
    }

    public int size() {
        return messages.size();
    }

    public boolean isKnownRequestId(String requestId) {
        return knownRequestIds.contains(requestId);
    }

    public Set<String> getPendingRequestIds() {
        return Collections.unmodifiableSet(pendingRequestIds);
    }

    public Optional<String> lastAssistantText() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.isAssistantText() && message.hasText()) {
                return Optional.of(message.getContent());
            }
        }
        return Optional.empty();
    }
}
