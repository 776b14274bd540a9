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

package dev.nishisan.monitor.stats.dto;

import dev.nishisan.monitor.stats.MetricKey;
import dev.nishisan.monitor.stats.MetricKind;
import dev.nishisan.monitor.stats.list.FixedSizeList;

import java.time.Instant;

/**
 * Mutable running aggregate of one metric series.
 * <p>
 * Not thread-safe: instances live inside a shard of the metric store and are
 * only touched while that shard's lock is held.
 */
public class MetricSeries {
    private final MetricKey key;
    private final MetricKind kind;
    private final FixedSizeList<Double> recent;
    private long count;
    private double sum;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double last;
    private Instant lastUpdated;

    public MetricSeries(MetricKey key, MetricKind kind, int reservoirSize, Instant createdAt) {
        this.key = key;
        this.kind = kind;
        this.recent = kind == MetricKind.TIMER ? new FixedSizeList<>(key.toString(), reservoirSize) : null;
        this.lastUpdated = createdAt;
    }

    /**
     * Applies one value. Every kind keeps count, sum, min and max of what it was
     * given; for gauges the reading that matters is {@code last}.
     */
    public void record(double value, Instant at) {
        count++;
        last = value;
        sum += value;
        if (value < min) {
            min = value;
        }
        if (value > max) {
            max = value;
        }
        if (recent != null) {
            recent.add(value);
        }
        lastUpdated = at;
    }

    /**
     * Primary value without building a full snapshot.
     */
    public double aggregate() {
        return switch (kind) {
            case COUNTER -> sum;
            case TIMER -> count == 0 ? 0.0 : sum / count;
            case GAUGE -> last;
        };
    }

    public MetricSnapshot snapshot() {
        double[] pct = recent != null ? recent.percentiles(0.50, 0.95, 0.99) : new double[3];
        return new MetricSnapshot(key, kind, count, sum,
                count == 0 ? 0.0 : min,
                count == 0 ? 0.0 : max,
                last, pct[0], pct[1], pct[2], lastUpdated);
    }

    public MetricKind getKind() {
        return kind;
    }

}
