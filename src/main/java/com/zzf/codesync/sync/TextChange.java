package com.zzf.codesync.sync;

import lombok.Value;

/**
 * Payload of the text-changed channel.
 */
@Value
public class TextChange {
    long version;
    String text;
    int linesDelta;
}
