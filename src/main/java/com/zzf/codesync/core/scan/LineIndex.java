package com.zzf.codesync.core.scan;

import java.util.Arrays;

/**
 * Offset/line lookup for one immutable text. Lines are 1-based and split on {@code '\n'}; a {@code '\r'}
 * before it belongs to the line break, not to the line.
 */
public final class LineIndex {

    private final String text;
    private final int[] lineStarts;
    private final String lineSeparator;

    public LineIndex(String text) {
        this.text = text == null ? "" : text;
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < this.text.length(); i++) {
            if (this.text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
        this.lineSeparator = count > 1 && starts[1] > 1 && this.text.charAt(starts[1] - 2) == '\r' ? "\r\n" : "\n";
    }

    /**
     * Line break used by the text, taken from its first line: {@code "\r\n"} or {@code "\n"}.
     */
    public String lineSeparator() {
        return lineSeparator;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * 1-based line holding {@code offset}; offsets past the end map to the last line.
     */
    public int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, Math.max(0, offset));
        if (idx >= 0) {
            return idx + 1;
        }
        return -idx - 1;
    }

    public int lineStart(int line) {
        int idx = Math.max(1, Math.min(line, lineStarts.length)) - 1;
        return lineStarts[idx];
    }

    /**
     * Offset just past the line's content: its line break ({@code '\r'} of a CRLF, else {@code '\n'}), or
     * the text length for the last line.
     */
    public int lineEnd(int line) {
        if (line >= lineStarts.length) {
            return text.length();
        }
        int end = lineStarts[Math.max(1, line)] - 1;
        return end > 0 && text.charAt(end - 1) == '\r' ? end - 1 : end;
    }

    /**
     * Start of the next line, or the text length for the last line.
     */
    public int nextLineStart(int line) {
        return line >= lineStarts.length ? text.length() : lineStarts[Math.max(1, line)];
    }

    public String lineText(int line) {
        return text.substring(lineStart(line), lineEnd(line));
    }

    public String indentationOf(int line) {
        String lineText = lineText(line);
        int i = 0;
        while (i < lineText.length() && (lineText.charAt(i) == ' ' || lineText.charAt(i) == '\t')) {
            i++;
        }
        return lineText.substring(0, i);
    }

    /**
     * True when only spaces or tabs precede {@code offset} on its line.
     */
    public boolean startsLine(int offset) {
        int start = lineStart(lineOf(offset));
        for (int i = start; i < offset; i++) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }
}
