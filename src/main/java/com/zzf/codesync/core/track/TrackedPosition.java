package com.zzf.codesync.core.track;

import lombok.Value;

/**
 * A tracked line as currently resolved.
 */
@Value
public class TrackedPosition {
    long id;
    int line;
}
