package com.canihazhouze.agent.tool;

/**
 * Outcome of a tool invocation. Errors are data, not exceptions: the loop
 * records them on the tool turn and continues.
 */
public record ToolResult(boolean ok, String content, ErrorKind errorKind) {

    public enum ErrorKind {
        /** No tool with that name is registered */
        NOT_FOUND,
        /** The tool ran and failed, or its arguments were unusable */
        INVOCATION_FAILED,
        /** The tool's backing service failed in a way a later attempt may not */
        TRANSIENT,
        /** The agent did not declare the tool; it was never invoked */
        NOT_DECLARED
    }

    public boolean isTransient() {
        return errorKind == ErrorKind.TRANSIENT;
    }

    public static ToolResult ok(String content) {
        return new ToolResult(true, content, null);
    }

    public static ToolResult error(ErrorKind kind, String message) {
        return new ToolResult(false, "ERROR: " + message, kind);
    }
}
