package com.zzf.codesync.core.edit;

import java.util.Locale;

public enum InsertPosition {
    AS_CHILD,
    BEFORE,
    AFTER,
    REPLACE;

    /**
     * Lenient lookup accepting {@code asChild}, {@code as_child}, {@code AS-CHILD} and the like.
     *
     * @throws IllegalArgumentException for an unknown or empty value
     */
    public static InsertPosition from(String value) {
        if (value != null) {
            String wanted = value.replace("_", "").replace("-", "").trim().toLowerCase(Locale.ROOT);
            for (InsertPosition position : values()) {
                if (position.name().replace("_", "").toLowerCase(Locale.ROOT).equals(wanted)) {
                    return position;
                }
            }
        }
        throw new IllegalArgumentException("Unknown insert position: " + value);
    }
}
