package com.phillippitts.draftsmith.util;

/** Privacy-safe previews of prompt and generated text for log lines. */
public final class LogSanitizer {

    /** Default number of characters kept by {@link #preview(String)}. */
    public static final int DEFAULT_PREVIEW_CHARS = 80;

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
     * Single-line preview: line breaks collapsed to spaces, truncated to
     * {@link #DEFAULT_PREVIEW_CHARS} with a trailing ellipsis when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ').trim();
        if (flat.length() <= DEFAULT_PREVIEW_CHARS) {
            return flat;
        }
        return truncate(flat, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
