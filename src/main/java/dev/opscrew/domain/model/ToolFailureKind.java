package dev.opscrew.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The model named a capability that is not registered.
     */
    NOT_FOUND,

    /**
     * Arguments did not match the capability's input schema, or could not be
     * parsed at all.
     */
    INVALID_INPUT,

    /**
     * The input was rejected by a tool's deny-list before anything ran.
     */
    POLICY_DENIED,

    /**
     * Tool execution failed during runtime (exceptions, non-zero exit, etc.).
     */
    EXECUTION_FAILED,

    /**
     * Tool did not finish within its wall-clock limit.
     */
    TIMEOUT
}
