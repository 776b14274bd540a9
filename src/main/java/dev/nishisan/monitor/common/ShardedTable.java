/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.monitor.common;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Hash table partitioned into a fixed number of shards, each a plain
 * {@link HashMap} guarded by its own {@link ReentrantLock}.
 * <p>
 * Keys that land in different shards never contend. Whole-table traversals lock
 * one shard at a time, so they observe per-shard atomicity only: there is no
 * consistent cut across shards.
 *
 * <h2>Thread safety</h2>
 * Every callback runs while the owning shard lock is held. Callbacks must be
 * short, must not block on I/O and must not re-enter the same table.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class ShardedTable<K, V> {

    private final List<Shard<K, V>> shards;
    private final int mask;
    private final long lockTimeoutNanos;
    private final String name;

    /**
     * @param name        label used in lock failure messages
     * @param shardCount  requested number of shards, rounded up to a power of two
     * @param lockTimeout maximum wait for one shard lock
     */
    public ShardedTable(String name, int shardCount, Duration lockTimeout) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(lockTimeout, "lockTimeout");
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be positive");
        }
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive");
        }
        int size = Integer.highestOneBit(shardCount);
        if (size < shardCount) {
            size <<= 1;
        }
        this.mask = size - 1;
        this.lockTimeoutNanos = lockTimeout.toNanos();
        this.shards = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            shards.add(new Shard<>());
        }
    }

    /**
     * Runs {@code action} against the shard map that owns {@code key}, under
     * that shard's lock. The action may read, insert, replace or remove entries
     * of that shard.
     */
    public <R> R withShard(K key, Function<Map<K, V>, R> action) {
        Shard<K, V> shard = shardFor(key);
        lock(shard);
        try {
            return action.apply(shard.entries);
        } finally {
            shard.lock.unlock();
        }
    }

    /**
     * Maps the value stored under {@code key}, if any, while its shard is locked.
     */
    public <R> Optional<R> read(K key, Function<V, R> mapper) {
        return withShard(key, entries -> {
            V value = entries.get(key);
            return value == null ? Optional.empty() : Optional.ofNullable(mapper.apply(value));
        });
    }

    /**
     * Maps every entry, shard by shard. {@code null} results are skipped.
     */
    public <R> List<R> collect(BiFunction<K, V, R> mapper) {
        List<R> out = new ArrayList<>();
        for (Shard<K, V> shard : shards) {
            lock(shard);
            try {
                for (Map.Entry<K, V> entry : shard.entries.entrySet()) {
                    R mapped = mapper.apply(entry.getKey(), entry.getValue());
                    if (mapped != null) {
                        out.add(mapped);
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }
        return out;
    }

    /**
     * Visits every entry, shard by shard, allowing in-place mutation of values.
     */
    public void forEach(BiConsumer<K, V> visitor) {
        for (Shard<K, V> shard : shards) {
            lock(shard);
            try {
                shard.entries.forEach(visitor);
            } finally {
                shard.lock.unlock();
            }
        }
    }

    /**
     * Removes every entry matching {@code filter}.
     *
     * @return the number of removed entries
     */
    public int removeIf(BiPredicate<K, V> filter) {
        int removed = 0;
        for (Shard<K, V> shard : shards) {
            lock(shard);
            try {
                Iterator<Map.Entry<K, V>> it = shard.entries.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<K, V> entry = it.next();
                    if (filter.test(entry.getKey(), entry.getValue())) {
                        it.remove();
                        removed++;
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }
        return removed;
    }

    /**
     * Total number of entries. Shards are summed one at a time, so the result
     * may be stale under concurrent writes.
     */
    public int size() {
        int total = 0;
        for (Shard<K, V> shard : shards) {
            lock(shard);
            try {
                total += shard.entries.size();
            } finally {
                shard.lock.unlock();
            }
        }
        return total;
    }

    public int shardCount() {
        return shards.size();
    }

    private Shard<K, V> shardFor(K key) {
        Objects.requireNonNull(key, "key");
        int h = key.hashCode();
        return shards.get((h ^ (h >>> 16)) & mask);
    }

    private void lock(Shard<K, V> shard) {
        TimedLocks.acquire(shard.lock, lockTimeoutNanos, name + " shard lock");
    }

    private static final class Shard<K, V> {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<K, V> entries = new HashMap<>();
    }
}
