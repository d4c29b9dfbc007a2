package com.zzf.codesync.sync;

import com.zzf.codesync.bus.SyncBus.Channel;
import com.zzf.codesync.core.tree.UiTreeNode;

public final class SyncChannels {
    private SyncChannels() {}

    public static final Channel<UiTreeNode> TREE_CHANGED = Channel.of("tree-changed", UiTreeNode.class);
    public static final Channel<TextChange> TEXT_CHANGED = Channel.of("text-changed", TextChange.class);
    public static final Channel<NodeSelection> SELECTION_CHANGED = Channel.of("selection-changed", NodeSelection.class);
    public static final Channel<HistoryState> HISTORY_CHANGED = Channel.of("history-changed", HistoryState.class);
}
