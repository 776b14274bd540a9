package dev.nishisan.monitor.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ShardedTableTest {

    @Test
    void shardCountIsRoundedUpToPowerOfTwo() {
        assertEquals(16, new ShardedTable<String, Integer>("t", 10, Duration.ofSeconds(1)).shardCount());
        assertEquals(1, new ShardedTable<String, Integer>("t", 1, Duration.ofSeconds(1)).shardCount());
        assertEquals(32, new ShardedTable<String, Integer>("t", 32, Duration.ofSeconds(1)).shardCount());
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ShardedTable<>("t", 0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new ShardedTable<>("t", 4, Duration.ZERO));
    }

    @Test
    void readCollectAndRemove() {
        ShardedTable<String, Integer> table = new ShardedTable<>("t", 4, Duration.ofSeconds(1));
        for (int i = 0; i < 20; i++) {
            int value = i;
            table.withShard("k" + i, entries -> entries.put("k" + value, value));
        }
        assertEquals(20, table.size());
        assertEquals(7, table.read("k7", v -> v).orElseThrow());
        assertTrue(table.read("missing", v -> v).isEmpty());

        List<Integer> even = table.collect((k, v) -> v % 2 == 0 ? v : null);
        assertEquals(10, even.size());

        assertEquals(10, table.removeIf((k, v) -> v % 2 == 1));
        assertEquals(10, table.size());
    }

    @Test
    @Timeout(10)
    void concurrentUpdatesOnOneKeyAreNotLost() throws Exception {
        ShardedTable<String, long[]> table = new ShardedTable<>("t", 8, Duration.ofSeconds(5));
        table.withShard("hot", entries -> entries.put("hot", new long[1]));
        int threads = 8;
        int perThread = 10_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            Future<?>[] futures = new Future<?>[threads];
            for (int t = 0; t < threads; t++) {
                futures[t] = pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        table.withShard("hot", entries -> entries.get("hot")[0]++);
                    }
                    return null;
                });
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals((long) threads * perThread, table.read("hot", v -> v[0]).orElseThrow());
    }

    @Test
    @Timeout(10)
    void lockTimeoutRaisesMonitorStateException() throws Exception {
        ShardedTable<String, Integer> table = new ShardedTable<>("stuck", 1, Duration.ofMillis(50));
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> table.withShard("a", entries -> {
            holding.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        try {
            assertTrue(holding.await(5, TimeUnit.SECONDS));
            MonitorStateException e = assertThrows(MonitorStateException.class,
                    () -> table.withShard("b", entries -> entries.put("b", 1)));
            assertTrue(e.getMessage().contains("stuck"));
        } finally {
            release.countDown();
            holder.join();
        }
    }
}
