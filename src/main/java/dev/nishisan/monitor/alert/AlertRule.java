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

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Threshold rule bound to one metric name.
 *
 * @param name        unique rule name, also the alert's {@code ruleName}
 * @param metricName  metric the rule observes
 * @param comparator  comparison between the aggregated value and {@code threshold}
 * @param threshold   the threshold
 * @param severity    severity of the alerts this rule raises
 * @param aggregation reduction applied to the samples, {@code null} to pick one
 *                    from the metric kind on first sample
 * @param window      span the aggregation looks back over
 * @param labelFilter only series whose labels contain all of these entries are
 *                    considered, empty for every series of the metric
 */
public record AlertRule(
        String name,
        String metricName,
        ThresholdComparator comparator,
        double threshold,
        AlertSeverity severity,
        RuleAggregation aggregation,
        Duration window,
        Map<String, String> labelFilter) {

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);

    public AlertRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(comparator, "comparator");
        Objects.requireNonNull(severity, "severity");
        if (name.isBlank() || metricName.isBlank()) {
            throw new IllegalArgumentException("Rule name and metric name must not be blank");
        }
        if (!Double.isFinite(threshold)) {
            throw new IllegalArgumentException("Rule [" + name + "] threshold must be finite");
        }
        window = window == null ? DEFAULT_WINDOW : window;
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Rule [" + name + "] window must be positive");
        }
        labelFilter = labelFilter == null ? Map.of() : Map.copyOf(labelFilter);
    }

    /**
     * Rule with the default window, no label filter and an aggregation derived
     * from the metric kind.
     */
    public static AlertRule of(String name, String metricName, ThresholdComparator comparator,
            double threshold, AlertSeverity severity) {
        return new AlertRule(name, metricName, comparator, threshold, severity, null, DEFAULT_WINDOW, Map.of());
    }

    public AlertRule withAggregation(RuleAggregation aggregation) {
        return new AlertRule(name, metricName, comparator, threshold, severity, aggregation, window, labelFilter);
    }

    public AlertRule withWindow(Duration window) {
        return new AlertRule(name, metricName, comparator, threshold, severity, aggregation, window, labelFilter);
    }

    public AlertRule withLabelFilter(Map<String, String> labelFilter) {
        return new AlertRule(name, metricName, comparator, threshold, severity, aggregation, window, labelFilter);
    }

    /**
     * The aggregation in effect for a metric of the given kind.
     */
    public RuleAggregation effectiveAggregation(MetricKind kind) {
        return aggregation != null ? aggregation : RuleAggregation.defaultFor(kind);
    }

    /**
     * e.g. {@code agent_execution_error SUM(5m) >= 1.0}
     */
    public String describe(RuleAggregation effective) {
        return metricName + " " + (effective == null ? "?" : effective.name()) + "(" + window + ") "
                + comparator.symbol() + " " + threshold;
    }
}
