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
import dev.nishisan.monitor.alert.AlertEngine;
import dev.nishisan.monitor.execution.ExecutionCounts;
import dev.nishisan.monitor.execution.ExecutionTracker;
import dev.nishisan.monitor.stats.MetricKey;
import dev.nishisan.monitor.stats.MetricStore;
import dev.nishisan.monitor.stats.dto.MetricSnapshot;

import java.util.List;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Composes a {@link HealthSnapshot} from the metric store, the execution
 * tracker and the alert engine. Reads only; each part is copied under its own
 * locks, so the composite is not a consistent cut across components.
 */
public final class HealthReporter {

    private final MetricStore metricStore;
    private final ExecutionTracker executionTracker;
    private final AlertEngine alertEngine;

    public HealthReporter(MetricStore metricStore, ExecutionTracker executionTracker, AlertEngine alertEngine) {
        this.metricStore = Objects.requireNonNull(metricStore, "metricStore");
        this.executionTracker = Objects.requireNonNull(executionTracker, "executionTracker");
        this.alertEngine = Objects.requireNonNull(alertEngine, "alertEngine");
    }

    /**
     * @throws dev.nishisan.monitor.common.MonitorStateException if an internal lock cannot be acquired
     */
    public HealthSnapshot systemHealth() {
        List<Alert> active = alertEngine.activeAlerts();
        ExecutionCounts executions = executionTracker.counts();
        SortedMap<MetricKey, MetricSnapshot> metrics = metricStore.summary();
        return new HealthSnapshot(HealthStatus.of(active), active, executions, metrics,
                executionTracker.diagnosticCount());
    }
}
