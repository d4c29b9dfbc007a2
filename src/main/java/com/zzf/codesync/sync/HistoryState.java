package com.zzf.codesync.sync;

import lombok.Value;

@Value
public class HistoryState {
    boolean canUndo;
    boolean canRedo;
    int undoDepth;
    int redoDepth;
}
