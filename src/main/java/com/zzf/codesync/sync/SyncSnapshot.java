package com.zzf.codesync.sync;

import com.zzf.codesync.core.tree.UiTreeNode;
import lombok.Value;

/**
 * What readers see: the last published buffer, its tree, the undo/redo depths and the orchestrator state.
 */
@Value
public class SyncSnapshot {
    SourceBuffer buffer;
    UiTreeNode tree;
    HistoryState history;
    SyncState state;

    SyncSnapshot withState(SyncState newState) {
        return new SyncSnapshot(buffer, tree, history, newState);
    }
}
