package com.zzf.codesync.sync;

import com.zzf.codesync.bus.SyncBus;
import com.zzf.codesync.config.SyncConfig;
import com.zzf.codesync.core.edit.EditResult;
import com.zzf.codesync.core.edit.InsertPosition;
import com.zzf.codesync.core.edit.StructuralEditor;
import com.zzf.codesync.core.track.PositionTracker;
import com.zzf.codesync.core.tree.UiTreeNode;
import com.zzf.codesync.core.tree.UiTreeParser;
import com.zzf.codesync.core.util.StringUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Owns the source buffer, its tree, the position tracker and the undo history.
 *
 * <p>Every write runs on a single writer thread in arrival order and publishes a new immutable
 * {@link SyncSnapshot}; reads only look at the last published snapshot and never wait for the writer.
 * Notifications go out through the {@link SyncBus} after the snapshot is published. Writing from the
 * writer thread itself (a synchronous subscriber calling back) is refused.
 */
@Slf4j
@Service
public class SyncOrchestrator {

    private static final UiTreeNode EMPTY_TREE = new UiTreeParser().parse("");
    private static final HistoryState NO_HISTORY = new HistoryState(false, false, 0, 0);

    private final UiTreeParser parser;
    private final StructuralEditor editor;
    private final SyncBus bus;
    private final PositionTracker tracker = new PositionTracker();
    private final UndoHistory history;
    private final ExecutorService writer;
    private final Counter appliedEdits;
    private final Counter rejectedEdits;

    private volatile Thread writerThread;
    private volatile SyncSnapshot snapshot = new SyncSnapshot(SourceBuffer.EMPTY, EMPTY_TREE, NO_HISTORY,
            SyncState.EMPTY);

    public SyncOrchestrator(UiTreeParser parser, StructuralEditor editor, SyncBus bus,
                            MeterRegistry meterRegistry, SyncConfig config) {
        this.parser = parser;
        this.editor = editor;
        this.bus = bus;
        this.history = new UndoHistory(config.getMaxUndoDepth());
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sync-writer");
            t.setDaemon(true);
            writerThread = t;
            return t;
        });
        this.appliedEdits = Counter.builder("codesync.edits").tag("outcome", "applied").register(meterRegistry);
        this.rejectedEdits = Counter.builder("codesync.edits").tag("outcome", "rejected").register(meterRegistry);
    }

    /**
     * Replaces the buffer wholesale. Resets the tracker and clears undo/redo.
     */
    public UiTreeNode loadBuffer(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text is null");
        }
        return write("load", () -> {
            UiTreeNode tree = parser.parse(text);
            tracker.reset();
            history.clear();
            SyncSnapshot next = publish(snapshot.getBuffer().next(text), tree);
            log.info("sync.buffer.loaded version={} lines={} nodes={}", next.getBuffer().getVersion(),
                    StringUtils.countNewlines(text) + 1, tree.flatten().size() - 1);
            notifyChanged(next, 0);
            return tree;
        });
    }

    public EditOutcome requestEdit(int targetLine, String code, InsertPosition position) {
        return write("edit", () -> runEdit("edit", targetLine, false,
                text -> editor.apply(text, targetLine, code, position)));
    }

    public EditOutcome requestDelete(int targetLine) {
        return write("delete", () -> runEdit("delete", targetLine, false, text -> editor.delete(text, targetLine)));
    }

    public EditOutcome requestWrap(int targetLine, String wrapperName, Map<String, String> wrapperProperties) {
        return write("wrap", () -> runEdit("wrap", targetLine, false,
                text -> editor.wrap(text, targetLine, wrapperName, wrapperProperties)));
    }

    public EditOutcome requestPropertyUpdate(int targetLine, String name, String valueCode) {
        return write("property", () -> runEdit("property", targetLine, false,
                text -> editor.updateProperty(text, targetLine, name, valueCode)));
    }

    /**
     * Swaps two sibling nodes. Lines move without a single insertion point, so tracked lines are dropped.
     */
    public EditOutcome requestReorder(int firstLine, int secondLine) {
        return write("reorder", () -> runEdit("reorder", firstLine, true,
                text -> editor.reorder(text, firstLine, secondLine)));
    }

    /**
     * Accepts text typed in the code editor. The change is undoable; tracked lines are dropped since no
     * line delta is known.
     */
    public EditOutcome applyTextChange(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text is null");
        }
        return write("text", () -> {
            SyncSnapshot current = snapshot;
            if (current.getState() == SyncState.EMPTY) {
                return reject("text", 0, RejectReason.NO_BUFFER, current);
            }
            String previous = current.getBuffer().getText();
            if (previous.equals(text)) {
                return EditOutcome.applied(current, 0);
            }
            UiTreeNode tree = parser.parse(text);
            tracker.reset();
            history.record(previous);
            SyncSnapshot next = publish(current.getBuffer().next(text), tree);
            int delta = StringUtils.countNewlines(text) - StringUtils.countNewlines(previous);
            log.info("sync.text.applied version={} delta={}", next.getBuffer().getVersion(), delta);
            appliedEdits.increment();
            notifyChanged(next, delta);
            return EditOutcome.applied(next, delta);
        });
    }

    public Optional<UiTreeNode> undo() {
        return write("undo", () -> restore("undo", history::undo));
    }

    public Optional<UiTreeNode> redo() {
        return write("redo", () -> restore("redo", history::redo));
    }

    public long trackLine(int line) {
        return tracker.track(line);
    }

    public Optional<Integer> resolveLine(long id) {
        return tracker.resolve(id);
    }

    /**
     * Selects the innermost node at {@code line} and starts tracking its start line.
     */
    public Optional<NodeSelection> selectLine(int line) {
        SyncSnapshot current = snapshot;
        Optional<UiTreeNode> node = current.getTree().findAtLine(line);
        if (!node.isPresent()) {
            log.debug("sync.select.miss line={}", line);
            return Optional.empty();
        }
        int startLine = node.get().getStartLine();
        NodeSelection selection = new NodeSelection(node.get(), tracker.track(startLine), startLine,
                current.getBuffer().getVersion());
        bus.publish(SyncChannels.SELECTION_CHANGED, selection);
        return Optional.of(selection);
    }

    public SyncSnapshot snapshot() {
        return snapshot;
    }

    public UiTreeNode currentTree() {
        return snapshot.getTree();
    }

    public String currentText() {
        return snapshot.getBuffer().getText();
    }

    public HistoryState historyState() {
        return snapshot.getHistory();
    }

    public PositionTracker getTracker() {
        return tracker;
    }

    private EditOutcome runEdit(String op, int targetLine, boolean dropTracked, Function<String, EditResult> edit) {
        SyncSnapshot current = snapshot;
        if (current.getState() == SyncState.EMPTY) {
            return reject(op, targetLine, RejectReason.NO_BUFFER, current);
        }
        snapshot = current.withState(SyncState.EDITING);
        try {
            EditResult result = edit.apply(current.getBuffer().getText());
            if (!result.isApplied()) {
                return reject(op, targetLine, RejectReason.of(result.getFailure().get()), current);
            }
            UiTreeNode tree = parser.parse(result.getNewText());
            if (dropTracked) {
                tracker.reset();
            } else {
                shiftTracker(result);
            }
            history.record(current.getBuffer().getText());
            SyncSnapshot next = publish(current.getBuffer().next(result.getNewText()), tree);
            log.info("sync.edit.applied op={} line={} delta={} version={}", op, targetLine,
                    result.getLinesDelta(), next.getBuffer().getVersion());
            appliedEdits.increment();
            notifyChanged(next, result.getLinesDelta());
            return EditOutcome.applied(next, result.getLinesDelta());
        } finally {
            if (snapshot.getState() == SyncState.EDITING) {
                snapshot = current;
            }
        }
    }

    private Optional<UiTreeNode> restore(String op, Function<String, Optional<String>> step) {
        SyncSnapshot current = snapshot;
        if (current.getState() == SyncState.EMPTY) {
            return Optional.empty();
        }
        Optional<String> text = step.apply(current.getBuffer().getText());
        if (!text.isPresent()) {
            log.debug("sync.{}.empty version={}", op, current.getBuffer().getVersion());
            return Optional.empty();
        }
        UiTreeNode tree = parser.parse(text.get());
        tracker.reset();
        SyncSnapshot next = publish(current.getBuffer().next(text.get()), tree);
        int delta = StringUtils.countNewlines(text.get()) - StringUtils.countNewlines(current.getBuffer().getText());
        log.info("sync.{}.applied version={}", op, next.getBuffer().getVersion());
        notifyChanged(next, delta);
        return Optional.of(tree);
    }

    private void shiftTracker(EditResult result) {
        int delta = result.getLinesDelta();
        if (delta > 0) {
            tracker.onInsertion(result.getChangeLine(), delta);
        } else if (delta < 0) {
            tracker.onDeletion(result.getChangeLine(), -delta);
        }
    }

    private EditOutcome reject(String op, int targetLine, RejectReason reason, SyncSnapshot current) {
        log.warn("sync.edit.rejected op={} line={} reason={}", op, targetLine, reason);
        rejectedEdits.increment();
        return EditOutcome.rejected(reason, current);
    }

    private SyncSnapshot publish(SourceBuffer buffer, UiTreeNode tree) {
        SyncSnapshot next = new SyncSnapshot(buffer, tree, history.state(), SyncState.PARSED);
        snapshot = next;
        return next;
    }

    private void notifyChanged(SyncSnapshot next, int linesDelta) {
        bus.publish(SyncChannels.TREE_CHANGED, next.getTree());
        bus.publish(SyncChannels.TEXT_CHANGED,
                new TextChange(next.getBuffer().getVersion(), next.getBuffer().getText(), linesDelta));
        bus.publish(SyncChannels.HISTORY_CHANGED, next.getHistory());
    }

    private <T> T write(String op, Callable<T> task) {
        if (Thread.currentThread() == writerThread) {
            throw new IllegalStateException("re-entrant sync write '" + op + "' from the writer thread");
        }
        Future<T> future = writer.submit(task);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted waiting for sync write '" + op + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("sync write '" + op + "' failed", cause);
        }
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
    }
}
