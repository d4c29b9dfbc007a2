package com.zzf.codesync.sync;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Bounded undo/redo stacks of whole-text snapshots. Only touched from the writer thread.
 */
final class UndoHistory {
    private final int maxDepth;
    private final Deque<String> undo = new ArrayDeque<>();
    private final Deque<String> redo = new ArrayDeque<>();

    UndoHistory(int maxDepth) {
        this.maxDepth = Math.max(1, maxDepth);
    }

    /**
     * Records the text a new write replaces. Clears redo; the oldest entry falls off past the depth limit.
     */
    void record(String previousText) {
        undo.push(previousText);
        while (undo.size() > maxDepth) {
            undo.removeLast();
        }
        redo.clear();
    }

    Optional<String> undo(String currentText) {
        if (undo.isEmpty()) {
            return Optional.empty();
        }
        redo.push(currentText);
        return Optional.of(undo.pop());
    }

    Optional<String> redo(String currentText) {
        if (redo.isEmpty()) {
            return Optional.empty();
        }
        undo.push(currentText);
        while (undo.size() > maxDepth) {
            undo.removeLast();
        }
        return Optional.of(redo.pop());
    }

    void clear() {
        undo.clear();
        redo.clear();
    }

    HistoryState state() {
        return new HistoryState(!undo.isEmpty(), !redo.isEmpty(), undo.size(), redo.size());
    }
}
