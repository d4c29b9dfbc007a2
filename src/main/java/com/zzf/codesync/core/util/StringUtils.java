package com.zzf.codesync.core.util;

public final class StringUtils {
    private StringUtils() {}

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    public static int countNewlines(String s) {
        if (s == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    public static int countNewlines(String s, int from, int to) {
        int count = 0;
        for (int i = Math.max(0, from); i < Math.min(s.length(), to); i++) {
            if (s.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    /**
     * Prefixes every non-blank line after the first with {@code indent} and rewrites every line break,
     * {@code "\n"} or {@code "\r\n"}, to {@code lineSeparator}.
     */
    public static String indentContinuation(String code, String indent, String lineSeparator) {
        if (code == null || code.indexOf('\n') < 0) {
            return code;
        }
        String[] lines = code.split("\r?\n", -1);
        StringBuilder sb = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            sb.append(lineSeparator);
            if (indent != null && !lines[i].trim().isEmpty()) {
                sb.append(indent);
            }
            sb.append(lines[i]);
        }
        return sb.toString();
    }

    /**
     * Single-line preview for log messages.
     */
    public static String preview(String s, int maxChars) {
        if (s == null) {
            return "";
        }
        String flat = s.replace("\r", "").replace('\n', ' ').trim();
        return flat.length() <= maxChars ? flat : flat.substring(0, maxChars) + "...";
    }
}
