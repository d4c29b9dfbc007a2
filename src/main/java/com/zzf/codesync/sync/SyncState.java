package com.zzf.codesync.sync;

public enum SyncState {
    /** No buffer loaded yet. */
    EMPTY,
    PARSED,
    /** A structural edit is being applied on the writer. */
    EDITING
}
