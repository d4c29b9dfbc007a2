package com.zzf.codesync.sync;

import com.zzf.codesync.core.tree.UiTreeNode;
import lombok.Value;

/**
 * A node picked by line, with the tracker id that follows its start line through later edits.
 */
@Value
public class NodeSelection {
    UiTreeNode node;
    long trackingId;
    int line;
    long version;
}
