package me.golemcore.research.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool invocation requested by the model. Immutable once dispatched.
 *
 * @param id
 *            opaque correlation token (tool_call_id)
 * @param toolName
 *            name the model used to address the tool
 * @param arguments
 *            decoded JSON arguments
 */
public record ToolRequest(String id, String toolName, Map<String, Object> arguments) {

    public ToolRequest {
        // JSON nulls are legal argument values, so Map.copyOf is not an option
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public ToolRequest withId(String newId) {
        return new ToolRequest(newId, toolName, arguments);
    }
}
