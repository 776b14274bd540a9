package dev.nishisan.monitor.stats;

import java.time.Instant;

/**
 * One accepted {@code recordMetric} call, as handed to {@link MetricListener}s.
 *
 * @param key        the series the value was recorded against
 * @param kind       the series kind
 * @param value      the raw value of this call (increment, duration or gauge value)
 * @param aggregate  the series' primary value after the update: sum for counters,
 *                   average for timers, last value for gauges
 * @param recordedAt when the update was applied
 */
public record MetricSample(MetricKey key, MetricKind kind, double value, double aggregate, Instant recordedAt) {
}
