package com.canihazhouze.agent.llm;

import com.canihazhouze.agent.exception.AgentException;

/**
 * Failure of a chat model call.
 *
 * | Kind      | Examples                                 | Retried |
 * |-----------|------------------------------------------|---------|
 * | TRANSIENT | network error, timeout, 429, 5xx         | yes     |
 * | MALFORMED | no choices, unparseable tool arguments   | yes     |
 * | FATAL     | 401, 400, unknown deployment             | no      |
 */
public class ChatModelException extends AgentException {

    public enum Kind { TRANSIENT, MALFORMED, FATAL }

    private final Kind kind;

    public ChatModelException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ChatModelException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ChatModelException transientFailure(String message, Throwable cause) {
        return new ChatModelException(Kind.TRANSIENT, message, cause);
    }

    public static ChatModelException malformed(String message) {
        return new ChatModelException(Kind.MALFORMED, message);
    }

    public static ChatModelException fatal(String message) {
        return new ChatModelException(Kind.FATAL, message);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind != Kind.FATAL;
    }
}
