package com.zzf.codesync.core.track;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps previously handed-out line numbers valid across edits without reparsing.
 *
 * <p>Each tracked line gets an id; insertions and deletions shift the lines behind them. A line inside a
 * deleted range stops being tracked and its id no longer resolves.
 */
@Slf4j
public final class PositionTracker {

    private final AtomicLong ids = new AtomicLong();
    private final Map<Long, Integer> lines = new LinkedHashMap<Long, Integer>();

    /**
     * Starts tracking {@code line}. Returns the existing id when the line is already tracked.
     */
    public synchronized long track(int line) {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1, got " + line);
        }
        for (Map.Entry<Long, Integer> entry : lines.entrySet()) {
            if (entry.getValue() == line) {
                return entry.getKey();
            }
        }
        long id = ids.incrementAndGet();
        lines.put(id, line);
        log.debug("tracker.track id={} line={}", id, line);
        return id;
    }

    public synchronized Optional<Integer> resolve(long id) {
        return Optional.ofNullable(lines.get(id));
    }

    /**
     * Every tracked line {@code >= atLine} moves down by {@code count}.
     */
    public synchronized void onInsertion(int atLine, int count) {
        if (count <= 0) {
            return;
        }
        int shifted = 0;
        for (Map.Entry<Long, Integer> entry : lines.entrySet()) {
            if (entry.getValue() >= atLine) {
                entry.setValue(entry.getValue() + count);
                shifted++;
            }
        }
        log.debug("tracker.insertion at={} count={} shifted={}", atLine, count, shifted);
    }

    /**
     * Lines in {@code [startLine, startLine + count)} are dropped; lines after the range move up by {@code count}.
     */
    public synchronized void onDeletion(int startLine, int count) {
        if (count <= 0) {
            return;
        }
        int end = startLine + count;
        int dropped = 0;
        Iterator<Map.Entry<Long, Integer>> it = lines.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Long, Integer> entry = it.next();
            int line = entry.getValue();
            if (line >= startLine && line < end) {
                it.remove();
                dropped++;
            } else if (line >= end) {
                entry.setValue(line - count);
            }
        }
        log.debug("tracker.deletion start={} count={} dropped={}", startLine, count, dropped);
    }

    public synchronized void reset() {
        if (!lines.isEmpty()) {
            log.debug("tracker.reset tracked={}", lines.size());
        }
        lines.clear();
    }

    public synchronized int size() {
        return lines.size();
    }

    public synchronized List<TrackedPosition> positions() {
        List<TrackedPosition> out = new ArrayList<TrackedPosition>(lines.size());
        for (Map.Entry<Long, Integer> entry : lines.entrySet()) {
            out.add(new TrackedPosition(entry.getKey(), entry.getValue()));
        }
        return out;
    }
}
