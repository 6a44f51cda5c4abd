package com.phillippitts.groundstation.util;

/** Utility for privacy-safe logging of transcribed and typed text. */
public final class LogSanitizer {

    /** Default preview length for user text in log lines. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Short preview of user text with its full length, e.g. {@code "turn on the li…" (42 chars)}.
     */
    public static String preview(String s) {
        if (s == null) {
            return "\"\" (0 chars)";
        }
        String head = truncate(s, DEFAULT_PREVIEW_CHARS);
        String ellipsis = head.length() < s.length() ? "…" : "";
        return "\"" + head + ellipsis + "\" (" + s.length() + " chars)";
    }
}
