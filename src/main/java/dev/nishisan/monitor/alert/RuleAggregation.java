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

package dev.nishisan.monitor.alert;

import dev.nishisan.monitor.stats.MetricKind;
import dev.nishisan.monitor.stats.list.SlidingWindow;

import java.util.Locale;

/**
 * How an {@link AlertRule} reduces the samples of its metric to one number.
 * <p>
 * All but {@link #LAST} are computed over the rule's sliding window, so they
 * decay back to "no data" once the metric stops being recorded.
 */
public enum RuleAggregation {
    /** Sum of the values recorded inside the window. */
    SUM,
    /** Number of updates inside the window. */
    COUNT,
    /** Mean of the values recorded inside the window. */
    AVERAGE,
    /** Largest value recorded inside the window. */
    MAX,
    /** Last value seen, regardless of age. */
    LAST;

    /**
     * Reduces window totals. {@code NaN} means there is nothing to compare.
     */
    double apply(SlidingWindow.Totals totals, double lastValue) {
        return switch (this) {
            case SUM -> totals.count() == 0 ? Double.NaN : totals.sum();
            case COUNT -> totals.count();
            case AVERAGE -> totals.average();
            case MAX -> totals.max();
            case LAST -> lastValue;
        };
    }

    /**
     * Aggregation used when a rule does not name one.
     */
    public static RuleAggregation defaultFor(MetricKind kind) {
        return switch (kind) {
            case COUNTER -> SUM;
            case TIMER -> AVERAGE;
            case GAUGE -> LAST;
        };
    }

    public static RuleAggregation parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Aggregation must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("AVG")) {
            return AVERAGE;
        }
        return valueOf(normalized);
    }
}
