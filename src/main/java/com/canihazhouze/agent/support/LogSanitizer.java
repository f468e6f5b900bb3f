package com.canihazhouze.agent.support;

/**
 * Strips line breaks from user-supplied values before they reach the log,
 * so a crafted agent name or input cannot forge extra log lines.
 */
public final class LogSanitizer {

    private LogSanitizer() {
    }

    public static String clean(String value) {
        if (value == null) {
            return null;
        }
        return value.replace('\r', '_').replace('\n', '_');
    }
}
