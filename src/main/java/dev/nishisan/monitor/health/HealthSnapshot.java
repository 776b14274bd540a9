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

package dev.nishisan.monitor.health;

import dev.nishisan.monitor.alert.Alert;
import dev.nishisan.monitor.execution.ExecutionCounts;
import dev.nishisan.monitor.stats.MetricKey;
import dev.nishisan.monitor.stats.dto.MetricSnapshot;

import java.util.List;
import java.util.SortedMap;

/**
 * Immutable point-in-time composite of the monitor's state.
 * <p>
 * It deliberately carries no capture timestamp: two snapshots taken with no
 * writes in between compare equal.
 *
 * @param status              overall status derived from {@code activeAlerts}
 * @param activeAlerts        unresolved alerts within the active window, newest first
 * @param executions          retained executions by status
 * @param metrics             every metric series, sorted by key
 * @param diagnosticsReported problems reported by best-effort recording paths so far
 */
public record HealthSnapshot(
        HealthStatus status,
        List<Alert> activeAlerts,
        ExecutionCounts executions,
        SortedMap<MetricKey, MetricSnapshot> metrics,
        long diagnosticsReported) {

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
