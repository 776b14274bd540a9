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

import dev.nishisan.monitor.common.TimedLocks;
import dev.nishisan.monitor.stats.MetricKind;
import dev.nishisan.monitor.stats.MetricSample;
import dev.nishisan.monitor.stats.list.SlidingWindow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Evaluation state of one rule: its sliding window, the unresolved alert if
 * any, and every resolved one. Guarded by its own lock.
 */
final class RuleState {

    private static final int MAX_BUCKETS = 60;

    private final AlertRule rule;
    private final ReentrantLock lock = new ReentrantLock();
    private final long lockTimeoutNanos;
    private final SlidingWindow window;
    private final List<Alert> resolved = new ArrayList<>();
    private MetricKind kind;
    private double lastValue = Double.NaN;
    private String lastMetric;
    private Alert current;

    RuleState(AlertRule rule, long lockTimeoutNanos) {
        this.rule = rule;
        this.lockTimeoutNanos = lockTimeoutNanos;
        long windowMillis = rule.window().toMillis();
        this.window = new SlidingWindow(rule.window(), (int) Math.max(1L, Math.min(MAX_BUCKETS, windowMillis)));
    }

    AlertRule rule() {
        return rule;
    }

    /**
     * Feeds one sample (or none, for a periodic re-evaluation) and compares the
     * aggregate against the threshold.
     *
     * @param sample the new sample, {@code null} to re-evaluate the window as it stands
     * @param now    evaluation time
     * @return what changed, never {@code null}
     */
    Transition evaluate(MetricSample sample, Instant now) {
        TimedLocks.acquire(lock, lockTimeoutNanos, "alert rule " + rule.name());
        try {
            if (sample != null) {
                if (kind == null) {
                    kind = sample.kind();
                }
                window.add(sample.recordedAt().toEpochMilli(), sample.value());
                lastValue = sample.kind() == MetricKind.COUNTER ? sample.aggregate() : sample.value();
                lastMetric = sample.key().toString();
            }
            if (kind == null && rule.aggregation() == null) {
                return Transition.NONE;
            }
            RuleAggregation aggregation = kind == null ? rule.aggregation() : rule.effectiveAggregation(kind);
            double value = aggregation.apply(window.totals(now.toEpochMilli()), lastValue);
            boolean crossed = rule.comparator().test(value, rule.threshold());

            if (crossed) {
                String message = "Rule [" + rule.name() + "] " + rule.describe(aggregation) + " (value: "
                        + value + ")";
                String metric = lastMetric != null ? lastMetric : rule.metricName();
                if (current == null) {
                    current = new Alert(UUID.randomUUID().toString(), rule.name(), rule.severity(), message,
                            metric, value, rule.threshold(), now, now, false, null);
                    return new Transition(Transition.Kind.RAISED, current);
                }
                if (sample != null) {
                    current = current.retriggered(message, metric, value, now);
                    return new Transition(Transition.Kind.UPDATED, current);
                }
                // a periodic pass keeps the alert as is: timestamp tracks real triggers only
                return Transition.NONE;
            }
            if (current != null) {
                Alert cleared = current.resolve(value, now);
                current = null;
                resolved.add(cleared);
                return new Transition(Transition.Kind.RESOLVED, cleared);
            }
            return Transition.NONE;
        } finally {
            lock.unlock();
        }
    }

    Alert current() {
        TimedLocks.acquire(lock, lockTimeoutNanos, "alert rule " + rule.name());
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unresolved alert first (if any), then resolved ones, in no particular order.
     */
    List<Alert> history() {
        TimedLocks.acquire(lock, lockTimeoutNanos, "alert rule " + rule.name());
        try {
            List<Alert> all = new ArrayList<>(resolved.size() + 1);
            if (current != null) {
                all.add(current);
            }
            all.addAll(resolved);
            return all;
        } finally {
            lock.unlock();
        }
    }

    record Transition(Kind kind, Alert alert) {

        static final Transition NONE = new Transition(Kind.NONE, null);

        enum Kind {
            NONE, RAISED, UPDATED, RESOLVED
        }
    }
}
