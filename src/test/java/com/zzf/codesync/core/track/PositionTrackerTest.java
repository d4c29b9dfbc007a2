package com.zzf.codesync.core.track;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PositionTrackerTest {

    @Test
    public void testInsertionShiftsLinesAtOrAfter() {
        PositionTracker tracker = new PositionTracker();
        long ten = tracker.track(10);
        long three = tracker.track(3);
        long five = tracker.track(5);
        tracker.onInsertion(5, 3);
        assertEquals(13, tracker.resolve(ten).get());
        assertEquals(3, tracker.resolve(three).get());
        assertEquals(8, tracker.resolve(five).get());
    }

    @Test
    public void testDeletionDropsRangeAndShiftsTail() {
        PositionTracker tracker = new PositionTracker();
        long five = tracker.track(5);
        long ten = tracker.track(10);
        long thirteen = tracker.track(13);
        long fifteen = tracker.track(15);
        tracker.onDeletion(12, 3);
        assertEquals(5, tracker.resolve(five).get());
        assertEquals(10, tracker.resolve(ten).get());
        assertFalse(tracker.resolve(thirteen).isPresent());
        assertEquals(12, tracker.resolve(fifteen).get());
        assertEquals(3, tracker.size());
    }

    @Test
    public void testTrackIsIdempotentPerLine() {
        PositionTracker tracker = new PositionTracker();
        long first = tracker.track(7);
        assertEquals(first, tracker.track(7));
        assertEquals(1, tracker.size());

        tracker.onInsertion(1, 2);
        assertEquals(first, tracker.track(9));
        assertNotEquals(first, tracker.track(7));
        assertEquals(2, tracker.size());
    }

    @Test
    public void testNonPositiveCountsAreIgnored() {
        PositionTracker tracker = new PositionTracker();
        long id = tracker.track(4);
        tracker.onInsertion(1, 0);
        tracker.onInsertion(1, -2);
        tracker.onDeletion(1, 0);
        tracker.onDeletion(4, -1);
        assertEquals(4, tracker.resolve(id).get());
        assertThrows(IllegalArgumentException.class, () -> tracker.track(0));
    }

    @Test
    public void testResetAndSnapshot() {
        PositionTracker tracker = new PositionTracker();
        long a = tracker.track(2);
        tracker.track(8);
        List<TrackedPosition> positions = tracker.positions();
        assertEquals(2, positions.size());
        assertEquals(new TrackedPosition(a, 2), positions.get(0));

        tracker.reset();
        assertEquals(0, tracker.size());
        assertFalse(tracker.resolve(a).isPresent());
        assertTrue(tracker.track(2) > a, "ids are never reused");
    }

    @Test
    public void testConcurrentTracking() throws Exception {
        PositionTracker tracker = new PositionTracker();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 1; i <= 200; i++) {
            int line = i;
            pool.submit(() -> tracker.track(line));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(200, tracker.size());
    }
}
