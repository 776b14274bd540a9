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

import java.time.Instant;

/**
 * Immutable copy of one series' aggregate.
 *
 * @param key         series identity
 * @param kind        series kind
 * @param count       number of accepted updates
 * @param sum         sum of recorded values (the counter total for counters)
 * @param min         smallest recorded value
 * @param max         largest recorded value
 * @param last        most recent recorded value (the gauge reading for gauges)
 * @param p50         median of the recent timer samples, {@code 0} for other kinds
 * @param p95         95th percentile of the recent timer samples, {@code 0} for other kinds
 * @param p99         99th percentile of the recent timer samples, {@code 0} for other kinds
 * @param lastUpdated when the series was last written
 */
public record MetricSnapshot(
        MetricKey key,
        MetricKind kind,
        long count,
        double sum,
        double min,
        double max,
        double last,
        double p50,
        double p95,
        double p99,
        Instant lastUpdated) {

    public double average() {
        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * The single number that best represents the series: the total for
     * counters, the mean for timers and the current reading for gauges.
     */
    public double value() {
        return switch (kind) {
            case COUNTER -> sum;
            case TIMER -> average();
            case GAUGE -> last;
        };
    }
}
