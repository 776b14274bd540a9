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

import java.util.Locale;

/**
 * Aggregation kind of a metric series. A series keeps its kind for its whole
 * lifetime.
 */
public enum MetricKind {
    /** Monotonic sum of non-negative increments. */
    COUNTER,
    /** Durations in milliseconds: count, sum, min, max and percentiles. */
    TIMER,
    /** Last written value. */
    GAUGE;

    /**
     * Case-insensitive lookup, accepting the lowercase names used by the agent
     * service call sites ({@code "counter"}, {@code "timer"}, {@code "gauge"}).
     */
    public static MetricKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Metric kind must not be blank");
        }
        return MetricKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
