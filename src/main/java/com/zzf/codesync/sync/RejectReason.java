package com.zzf.codesync.sync;

import com.zzf.codesync.core.edit.EditFailure;

public enum RejectReason {
    NO_BUFFER,
    TARGET_NOT_FOUND,
    NO_CHILD_SLOT,
    NO_SIBLING_SLOT,
    NOT_SIBLINGS;

    static RejectReason of(EditFailure failure) {
        switch (failure) {
            case NO_CHILD_SLOT:
                return NO_CHILD_SLOT;
            case NO_SIBLING_SLOT:
                return NO_SIBLING_SLOT;
            case NOT_SIBLINGS:
                return NOT_SIBLINGS;
            case TARGET_NOT_FOUND:
            default:
                return TARGET_NOT_FOUND;
        }
    }
}
