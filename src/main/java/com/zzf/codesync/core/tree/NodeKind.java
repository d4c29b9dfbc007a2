package com.zzf.codesync.core.tree;

/**
 * Coarse classification of a node by its name.
 */
public enum NodeKind {
    ROOT,
    APP,
    LAYOUT,
    INPUT,
    DISPLAY,
    COMPONENT
}
