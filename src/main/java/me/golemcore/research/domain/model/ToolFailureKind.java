package me.golemcore.research.domain.model;

/**
 * Deterministic classification of a failed tool call. Every failure path of a
 * tool adapter maps to exactly one kind so the model (or the validator's retry
 * logic) can react to it.
 */
public enum ToolFailureKind {

    /**
     * Transport failure: DNS, connection refused, non-2xx status.
     */
    NETWORK_ERROR,

    /**
     * The call did not complete within its timeout.
     */
    TIMEOUT,

    /**
     * Malformed HTML or JSON returned by the provider.
     */
    PARSE_ERROR,

    /**
     * The provider answered but reported an unsuccessful or unsupported query.
     */
    PROVIDER_ERROR,

    /**
     * The requested tool is not registered (or disabled).
     */
    UNKNOWN_TOOL,

    /**
     * Arguments did not match the tool's declared schema.
     */
    INVALID_ARGUMENTS,

    /**
     * The research run was cancelled while the call was in flight.
     */
    CANCELLED,

    /**
     * Any other runtime failure inside the tool.
     */
    EXECUTION_FAILED
}
