package dev.nishisan.monitor.stats.list;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SlidingWindowTest {

    @Test
    void totalsCoverOnlyTheWindow() {
        SlidingWindow window = new SlidingWindow(Duration.ofSeconds(10), 10);
        assertEquals(1000, window.bucketWidthMillis());

        window.add(0, 1.0);
        window.add(500, 2.0);
        window.add(5_000, 7.0);

        SlidingWindow.Totals totals = window.totals(5_000);
        assertEquals(3, totals.count());
        assertEquals(10.0, totals.sum());
        assertEquals(7.0, totals.max());
        assertEquals(10.0 / 3, totals.average(), 1e-9);

        // first bucket [0, 1000) drops out once the window slides past it
        totals = window.totals(10_000);
        assertEquals(1, totals.count());
        assertEquals(7.0, totals.sum());
    }

    @Test
    void emptyWindowReportsNoData() {
        SlidingWindow window = new SlidingWindow(Duration.ofMinutes(5), 60);
        window.add(0, 3.0);

        SlidingWindow.Totals totals = window.totals(Duration.ofMinutes(6).toMillis());
        assertEquals(0, totals.count());
        assertEquals(0.0, totals.sum());
        assertTrue(Double.isNaN(totals.max()));
        assertTrue(Double.isNaN(totals.average()));
    }

    @Test
    void reusedSlotIsCleared() {
        SlidingWindow window = new SlidingWindow(Duration.ofSeconds(4), 4);
        window.add(0, 100.0);
        // same slot, four buckets later
        window.add(4_000, 1.0);

        SlidingWindow.Totals totals = window.totals(4_000);
        assertEquals(1, totals.count());
        assertEquals(1.0, totals.max());
    }

    @Test
    void rejectsWindowNarrowerThanBucketCount() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindow(Duration.ofMillis(5), 10));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindow(Duration.ofSeconds(1), 0));
    }
}
