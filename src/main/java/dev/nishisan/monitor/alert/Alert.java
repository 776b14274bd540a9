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

import java.time.Instant;

/**
 * Immutable view of an alert raised by the {@link AlertEngine}.
 * <p>
 * The engine keeps at most one unresolved alert per rule and publishes a fresh
 * copy each time it is re-triggered or resolved.
 *
 * @param id               generated identifier, stable across updates
 * @param ruleName         rule that raised the alert
 * @param severity         severity copied from the rule
 * @param message          human-readable description of the last trigger
 * @param triggeringMetric key of the series whose update last triggered the rule
 * @param value            aggregated value at the last evaluation
 * @param threshold        rule threshold
 * @param createdAt        when the alert was first raised
 * @param timestamp        when the rule last triggered
 * @param resolved         whether the condition has cleared
 * @param resolvedAt       when it cleared, {@code null} while unresolved
 */
public record Alert(
        String id,
        String ruleName,
        AlertSeverity severity,
        String message,
        String triggeringMetric,
        double value,
        double threshold,
        Instant createdAt,
        Instant timestamp,
        boolean resolved,
        Instant resolvedAt) {

    Alert retriggered(String newMessage, String metric, double newValue, Instant at) {
        return new Alert(id, ruleName, severity, newMessage, metric, newValue, threshold, createdAt, at, false, null);
    }

    Alert resolve(double lastValue, Instant at) {
        return new Alert(id, ruleName, severity, message, triggeringMetric, lastValue, threshold, createdAt,
                timestamp, true, at);
    }
}
