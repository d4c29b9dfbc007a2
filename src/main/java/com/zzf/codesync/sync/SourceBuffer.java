package com.zzf.codesync.sync;

import lombok.Value;

/**
 * Full source text with the version it was published under. Every accepted write bumps the version by one.
 */
@Value
public class SourceBuffer {
    public static final SourceBuffer EMPTY = new SourceBuffer("", 0L);

    String text;
    long version;

    public SourceBuffer next(String newText) {
        return new SourceBuffer(newText, version + 1);
    }
}
