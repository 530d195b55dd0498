package com.jreinhal.querygate.util;

import java.util.regex.Pattern;

/**
 * Helpers for putting caller-supplied text into log lines. Questions are never logged verbatim.
 */
public final class LogSanitizer {
    // Control characters allow forged log lines.
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_VALUE_LENGTH = 128;

    private LogSanitizer() {
    }

    /**
     * Length and hash of a question, enough to correlate log lines without recording the text.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + query.length() + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    /**
     * Strips control characters and caps the length of an identifier-like value (caller id, role, resource key).
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        return cleaned.length() > MAX_VALUE_LENGTH ? cleaned.substring(0, MAX_VALUE_LENGTH) + "..." : cleaned;
    }
}
