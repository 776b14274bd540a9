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

package dev.nishisan.monitor.stats;

import dev.nishisan.monitor.common.MonitorStateException;
import dev.nishisan.monitor.common.ShardedTable;
import dev.nishisan.monitor.stats.dto.MetricSeries;
import dev.nishisan.monitor.stats.dto.MetricSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;


/**
 * Process-local store of named, labeled metric series (counters, timers and
 * gauges).
 * <p>
 * Series are spread over the shards of a {@link ShardedTable}; an update locks
 * only the shard that owns its key, so unrelated series never contend. Every
 * accepted update is then handed to the registered {@link MetricListener}s on
 * the caller's thread, outside the shard lock.
 */
public class MetricStore {

    private static final Logger logger = LoggerFactory.getLogger(MetricStore.class);
    private final ShardedTable<MetricKey, MetricSeries> series;
    private final CopyOnWriteArrayList<MetricListener> listeners = new CopyOnWriteArrayList<>();
    private final int reservoirSize;
    private final Clock clock;

    /**
     * @param shardCount    number of lock shards
     * @param lockTimeout   maximum wait for one shard lock before failing loudly
     * @param reservoirSize how many recent samples each timer keeps for percentiles
     * @param clock         time source for {@code lastUpdated}
     */
    public MetricStore(int shardCount, Duration lockTimeout, int reservoirSize, Clock clock) {
        if (reservoirSize <= 0) {
            throw new IllegalArgumentException("reservoirSize must be positive");
        }
        this.series = new ShardedTable<>("metric", shardCount, lockTimeout);
        this.reservoirSize = reservoirSize;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records one value against the series {@code (name, labels)}, creating the
     * series on first use.
     *
     * @param name   the metric name, not blank
     * @param value  a finite value; counters and timers require {@code value >= 0}
     * @param labels the label set, may be {@code null} or empty
     * @param kind   the series kind
     * @throws IllegalArgumentException    if the name or value is invalid
     * @throws MetricKindMismatchException if the series exists with another kind
     */
    public void recordMetric(String name, double value, Map<String, String> labels, MetricKind kind) {
        Objects.requireNonNull(kind, "kind");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(String.format("Metric:[%s] value must be finite, got %s", name, value));
        }
        if (kind != MetricKind.GAUGE && value < 0) {
            throw new IllegalArgumentException(String.format("Metric:[%s] %s value must be >= 0, got %s",
                    name, kind, value));
        }
        MetricKey key = new MetricKey(name, labels);
        Instant now = clock.instant();
        Update update = series.withShard(key, entries -> {
            MetricSeries current = entries.get(key);
            boolean created = false;
            if (current == null) {
                current = new MetricSeries(key, kind, reservoirSize, now);
                entries.put(key, current);
                created = true;
            } else if (current.getKind() != kind) {
                throw new MetricKindMismatchException(key, current.getKind(), kind);
            }
            current.record(value, now);
            return new Update(created, current.aggregate());
        });
        if (listeners.isEmpty()) {
            return;
        }
        MetricSample sample = new MetricSample(key, kind, value, update.aggregate(), now);
        for (MetricListener listener : listeners) {
            try {
                if (update.created()) {
                    listener.onMetricCreated(key, kind);
                }
                listener.onMetricRecorded(sample);
            } catch (MonitorStateException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.warn("Metric listener failed for [{}]", key, e);
            }
        }
    }

    /**
     * Adds one to a counter.
     */
    public void incrementCounter(String name, Map<String, String> labels) {
        recordMetric(name, 1, labels, MetricKind.COUNTER);
    }

    /**
     * Records a duration in milliseconds.
     */
    public void recordTimer(String name, double durationMs, Map<String, String> labels) {
        recordMetric(name, durationMs, labels, MetricKind.TIMER);
    }

    /**
     * Overwrites a gauge reading.
     */
    public void setGauge(String name, double value, Map<String, String> labels) {
        recordMetric(name, value, labels, MetricKind.GAUGE);
    }

    /**
     * Retrieves the aggregate of one series.
     *
     * @return the snapshot, or empty if the series was never recorded
     */
    public Optional<MetricSnapshot> get(String name, Map<String, String> labels) {
        MetricKey key = new MetricKey(name, labels);
        return series.read(key, MetricSeries::snapshot);
    }

    /**
     * Copies every known series, sorted by key. Shards are copied one at a
     * time, so the result is atomic per series but not across series.
     *
     * @return an unmodifiable, sorted map of key to aggregate
     */
    public SortedMap<MetricKey, MetricSnapshot> summary() {
        TreeMap<MetricKey, MetricSnapshot> out = new TreeMap<>();
        for (MetricSnapshot snapshot : series.collect((key, s) -> s.snapshot())) {
            out.put(snapshot.key(), snapshot);
        }
        return Collections.unmodifiableSortedMap(out);
    }

    public int size() {
        return series.size();
    }

    /**
     * Dumps every series to the log at DEBUG.
     */
    public void logSummary() {
        if (!logger.isDebugEnabled()) {
            return;
        }
        SortedMap<MetricKey, MetricSnapshot> current = summary();
        if (current.isEmpty()) {
            logger.debug("Empty Stats Received");
            return;
        }
        logger.debug(" ---------------------------------------------------------------------------------------------");
        current.forEach((key, s) -> logger.debug(String.format("  %-7s [%-45s]:=[%12.3f] count:(%9d)",
                s.kind(), key, s.value(), s.count())));
        logger.debug(" ---------------------------------------------------------------------------------------------");
    }

    /**
     * Registers a listener. Registering the same instance twice has no effect.
     */
    public void addListener(MetricListener listener) {
        listeners.addIfAbsent(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(MetricListener listener) {
        listeners.remove(listener);
    }

    private record Update(boolean created, double aggregate) {
    }
}
