package com.zzf.codesync.core.edit;

/**
 * Why a structural edit left the text unchanged.
 */
public enum EditFailure {
    /** No node starts on the requested line. */
    TARGET_NOT_FOUND,
    /** The target has no free child slot and its name is not a known container. */
    NO_CHILD_SLOT,
    /** The target is the value of a named argument, which holds exactly one node. */
    NO_SIBLING_SLOT,
    /** The two nodes of a reorder are not positional elements of the same list. */
    NOT_SIBLINGS
}
