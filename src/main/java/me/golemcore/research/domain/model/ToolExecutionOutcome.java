package me.golemcore.research.domain.model;

/**
 * Result of a single tool execution (real or synthetic), correlated to the
 * request that triggered it.
 *
 * @param requestId
 *            tool_call_id of the originating {@link ToolRequest}
 * @param toolName
 *            tool name (as used in history)
 * @param toolResult
 *            raw ToolResult (success/failure + structured data)
 * @param messageContent
 *            content handed back to the model (possibly truncated)
 * @param synthetic
 *            whether this result was produced without executing the tool
 */
public record ToolExecutionOutcome(String requestId, String toolName, ToolResult toolResult, String messageContent,
        boolean synthetic) {

    public static ToolExecutionOutcome synthetic(ToolRequest request, ToolFailureKind kind, String reason) {
        return new ToolExecutionOutcome(request.id(), request.toolName(), ToolResult.failure(kind, reason),
                "Error [" + kind + "]: " + reason, true);
    }

    public boolean isSuccess() {
        return toolResult != null && toolResult.isSuccess();
    }
}
