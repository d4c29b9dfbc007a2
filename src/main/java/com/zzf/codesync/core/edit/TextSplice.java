package com.zzf.codesync.core.edit;

/**
 * Replacement of {@code [start, end)} of the original text.
 */
final class TextSplice {
    final int start;
    final int end;
    final String replacement;

    TextSplice(int start, int end, String replacement) {
        this.start = start;
        this.end = end;
        this.replacement = replacement;
    }

    static TextSplice insert(int at, String text) {
        return new TextSplice(at, at, text);
    }

    static TextSplice remove(int start, int end) {
        return new TextSplice(start, end, "");
    }
}
