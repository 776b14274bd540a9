package dev.nishisan.monitor.stats;

import dev.nishisan.monitor.stats.dto.MetricSnapshot;
import dev.nishisan.monitor.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link MetricStore}.
 */
class MetricStoreTest {

    private MutableClock clock;
    private MetricStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        store = new MetricStore(8, Duration.ofSeconds(5), 128, clock);
    }

    @Test
    void counterAccumulates() {
        store.incrementCounter("agent_execution_started", Map.of("agent_id", "a1"));
        store.recordMetric("agent_execution_started", 2, Map.of("agent_id", "a1"), MetricKind.COUNTER);

        MetricSnapshot snapshot = store.get("agent_execution_started", Map.of("agent_id", "a1")).orElseThrow();
        assertEquals(MetricKind.COUNTER, snapshot.kind());
        assertEquals(3.0, snapshot.value());
        assertEquals(2, snapshot.count());
        assertEquals(clock.instant(), snapshot.lastUpdated());
    }

    @Test
    void labelOrderDoesNotSplitSeries() {
        store.incrementCounter("c", Map.of("a", "1", "b", "2"));
        store.incrementCounter("c", Map.of("b", "2", "a", "1"));
        assertEquals(1, store.size());
        assertEquals(2.0, store.get("c", Map.of("b", "2", "a", "1")).orElseThrow().sum());
    }

    @Test
    void timerTracksDistribution() {
        for (int i = 1; i <= 100; i++) {
            store.recordTimer("agent_response_time_ms", i, null);
        }
        MetricSnapshot snapshot = store.get("agent_response_time_ms", null).orElseThrow();
        assertEquals(100, snapshot.count());
        assertEquals(1.0, snapshot.min());
        assertEquals(100.0, snapshot.max());
        assertEquals(50.5, snapshot.average());
        assertEquals(50.5, snapshot.value());
        assertEquals(95.0, snapshot.p95());
        assertEquals(99.0, snapshot.p99());
    }

    @Test
    void gaugeKeepsLastReading() {
        store.setGauge("queue_depth", 10, Map.of());
        store.setGauge("queue_depth", -3, Map.of());
        MetricSnapshot snapshot = store.get("queue_depth", Map.of()).orElseThrow();
        assertEquals(-3.0, snapshot.value());
        assertEquals(-3.0, snapshot.min());
        assertEquals(10.0, snapshot.max());
    }

    @Test
    void kindMismatchIsRejected() {
        store.incrementCounter("x", Map.of());
        MetricKindMismatchException e = assertThrows(MetricKindMismatchException.class,
                () -> store.recordMetric("x", 5, Map.of(), MetricKind.TIMER));
        assertEquals(MetricKind.COUNTER, e.getExisting());
        assertEquals(MetricKind.TIMER, e.getRequested());
        assertEquals("x", e.getKey().name());
        assertEquals(1.0, store.get("x", Map.of()).orElseThrow().value());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> store.recordMetric("c", -1, Map.of(), MetricKind.COUNTER));
        assertThrows(IllegalArgumentException.class,
                () -> store.recordMetric("t", Double.NaN, Map.of(), MetricKind.TIMER));
        assertThrows(IllegalArgumentException.class,
                () -> store.recordMetric("g", Double.POSITIVE_INFINITY, Map.of(), MetricKind.GAUGE));
        assertThrows(IllegalArgumentException.class,
                () -> store.recordMetric(" ", 1, Map.of(), MetricKind.COUNTER));
        assertEquals(0, store.size());
    }

    @Test
    void summaryKeepsSeriesWhoseLabelsRenderAlike() {
        Map<String, String> packed = Map.of("agent_id", "a1, category=x");
        Map<String, String> split = Map.of("agent_id", "a1", "category", "x");
        store.incrementCounter("error_by_category", packed);
        store.incrementCounter("error_by_category", split);
        store.incrementCounter("error_by_category", split);

        MetricKey packedKey = MetricKey.of("error_by_category", packed);
        MetricKey splitKey = MetricKey.of("error_by_category", split);
        assertNotEquals(packedKey, splitKey);
        assertNotEquals(0, packedKey.compareTo(splitKey));
        assertEquals(-Integer.signum(packedKey.compareTo(splitKey)), Integer.signum(splitKey.compareTo(packedKey)));

        SortedMap<MetricKey, MetricSnapshot> summary = store.summary();
        assertEquals(2, summary.size());
        assertEquals(1.0, summary.get(packedKey).value());
        assertEquals(2.0, summary.get(splitKey).value());
    }

    @Test
    void labelOrderingComparesEntriesThenSize() {
        MetricKey none = MetricKey.of("m");
        MetricKey one = MetricKey.of("m", Map.of("a", "1"));
        MetricKey two = MetricKey.of("m", Map.of("a", "1", "b", "2"));
        MetricKey other = MetricKey.of("m", Map.of("a", "2"));

        assertTrue(none.compareTo(one) < 0);
        assertTrue(one.compareTo(two) < 0);
        assertTrue(two.compareTo(other) < 0);
        assertEquals(0, two.compareTo(MetricKey.of("m", Map.of("b", "2", "a", "1"))));
    }

    @Test
    void kindParsesCallSiteNames() {
        assertEquals(MetricKind.COUNTER, MetricKind.parse("counter"));
        assertEquals(MetricKind.TIMER, MetricKind.parse(" Timer "));
        assertThrows(IllegalArgumentException.class, () -> MetricKind.parse("histogram"));
    }

    @Test
    void unknownSeriesIsEmpty() {
        assertTrue(store.get("nope", Map.of()).isEmpty());
    }

    @Test
    void summaryIsSortedAndUnmodifiable() {
        store.incrementCounter("b_metric", Map.of());
        store.incrementCounter("a_metric", Map.of("agent_id", "2"));
        store.incrementCounter("a_metric", Map.of("agent_id", "1"));

        SortedMap<MetricKey, MetricSnapshot> summary = store.summary();
        List<String> keys = new ArrayList<>();
        summary.keySet().forEach(k -> keys.add(k.toString()));
        assertEquals(List.of("a_metric{agent_id=1}", "a_metric{agent_id=2}", "b_metric"), keys);
        assertThrows(UnsupportedOperationException.class, () -> summary.clear());
        assertEquals(summary, store.summary());
    }

    @Test
    void listenersSeeEveryUpdateAndFailuresAreContained() {
        List<MetricSample> seen = new ArrayList<>();
        List<MetricKey> created = new ArrayList<>();
        store.addListener(new MetricListener() {
            @Override
            public void onMetricCreated(MetricKey key, MetricKind kind) {
                created.add(key);
            }

            @Override
            public void onMetricRecorded(MetricSample sample) {
                seen.add(sample);
            }
        });
        store.addListener(sample -> {
            throw new IllegalStateException("boom");
        });

        store.incrementCounter("c", Map.of());
        store.incrementCounter("c", Map.of());

        assertEquals(1, created.size());
        assertEquals(2, seen.size());
        assertEquals(1.0, seen.get(1).value());
        assertEquals(2.0, seen.get(1).aggregate());
        assertEquals(2.0, store.get("c", Map.of()).orElseThrow().value());
    }

    @Test
    @Timeout(20)
    void concurrentCounterUpdatesSumExactly() throws Exception {
        int threads = 8;
        int perThread = 5_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String agent = "agent-" + (t % 2);
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.incrementCounter("agent_execution_started", Map.of("agent_id", agent));
                        store.recordTimer("agent_response_time_ms", 10, Map.of());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(20, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        double total = store.get("agent_execution_started", Map.of("agent_id", "agent-0")).orElseThrow().sum()
                + store.get("agent_execution_started", Map.of("agent_id", "agent-1")).orElseThrow().sum();
        assertEquals((double) threads * perThread, total);
        assertEquals((long) threads * perThread,
                store.get("agent_response_time_ms", Map.of()).orElseThrow().count());
    }
}
