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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import dev.nishisan.monitor.alert.Alert;
import dev.nishisan.monitor.stats.MetricKey;
import dev.nishisan.monitor.stats.MetricKind;
import dev.nishisan.monitor.stats.dto.MetricSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodically captures a {@link HealthSnapshot} and dumps it as a YAML
 * dashboard file on disk.
 * <p>
 * The file holds overall status, execution counts, active alerts and one entry
 * per metric series, in a shape monitoring scripts can consume directly.
 */
public final class HealthDashboardReporter implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HealthDashboardReporter.class);

    private static final ObjectMapper YAML_MAPPER;

    static {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build();
        YAML_MAPPER = new ObjectMapper(factory);
        YAML_MAPPER.findAndRegisterModules();
    }

    private final Supplier<HealthSnapshot> snapshotSupplier;
    private final ScheduledExecutorService scheduler;
    private final Path outputPath;
    private final Duration reportInterval;
    private final Clock clock;
    private volatile boolean running;
    private volatile ScheduledFuture<?> reportTask;

    /**
     * @param snapshotSupplier supplies the health snapshot on each tick
     * @param scheduler        shared scheduler for periodic execution
     * @param outputPath       path to write the YAML dashboard file
     * @param reportInterval   interval between reports
     * @param clock            stamps {@code capturedAt}
     */
    public HealthDashboardReporter(Supplier<HealthSnapshot> snapshotSupplier,
            ScheduledExecutorService scheduler,
            Path outputPath,
            Duration reportInterval,
            Clock clock) {
        this.snapshotSupplier = Objects.requireNonNull(snapshotSupplier, "snapshotSupplier");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.outputPath = Objects.requireNonNull(outputPath, "outputPath");
        this.reportInterval = Objects.requireNonNull(reportInterval, "reportInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts the periodic reporting loop.
     */
    public void start() {
        if (running) {
            return;
        }
        running = true;
        long periodMs = Math.max(1000L, reportInterval.toMillis());
        reportTask = scheduler.scheduleAtFixedRate(this::reportScheduled, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Captures a snapshot and writes the dashboard YAML. Can be called manually.
     *
     * @return {@code true} if the file was written
     */
    public boolean report() {
        try {
            HealthSnapshot snapshot = snapshotSupplier.get();
            if (snapshot == null) {
                return false;
            }
            String yaml = YAML_MAPPER.writeValueAsString(buildDashboard(snapshot));
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, yaml);
            logger.debug("Dashboard report written to {}", outputPath);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Dashboard report generation failed", e);
            return false;
        }
    }

    private void reportScheduled() {
        if (!running) {
            return;
        }
        report();
    }

    /**
     * Builds the dashboard data structure from the snapshot.
     * Package-private for testing.
     */
    Map<String, Object> buildDashboard(HealthSnapshot snapshot) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("capturedAt", clock.instant().toString());
        root.put("status", snapshot.status().name());

        Map<String, Object> executions = new LinkedHashMap<>();
        executions.put("running", snapshot.executions().running());
        executions.put("completed", snapshot.executions().completed());
        executions.put("error", snapshot.executions().error());
        executions.put("diagnosticsReported", snapshot.diagnosticsReported());
        root.put("executions", executions);

        List<Map<String, Object>> alerts = new ArrayList<>();
        for (Alert alert : snapshot.activeAlerts()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rule", alert.ruleName());
            entry.put("severity", alert.severity().name());
            entry.put("message", alert.message());
            entry.put("metric", alert.triggeringMetric());
            entry.put("value", alert.value());
            entry.put("threshold", alert.threshold());
            entry.put("createdAt", alert.createdAt().toString());
            entry.put("timestamp", alert.timestamp().toString());
            alerts.add(entry);
        }
        root.put("activeAlerts", alerts);

        Map<String, Object> metrics = new LinkedHashMap<>();
        for (Map.Entry<MetricKey, MetricSnapshot> e : snapshot.metrics().entrySet()) {
            MetricSnapshot m = e.getValue();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", m.kind().name());
            entry.put("count", m.count());
            entry.put("value", round(m.value()));
            entry.put("min", round(m.min()));
            entry.put("max", round(m.max()));
            if (m.kind() == MetricKind.TIMER) {
                entry.put("p50", round(m.p50()));
                entry.put("p95", round(m.p95()));
                entry.put("p99", round(m.p99()));
            }
            entry.put("lastUpdated", m.lastUpdated().toString());
            metrics.put(e.getKey().toString(), entry);
        }
        root.put("metrics", metrics);
        return root;
    }

    /**
     * Returns the YAML string representation of the current dashboard.
     * Useful for programmatic access without touching the filesystem.
     *
     * @return YAML string, or null if snapshot is unavailable
     */
    public String toYaml() {
        HealthSnapshot snapshot = snapshotSupplier.get();
        if (snapshot == null) {
            return null;
        }
        try {
            return YAML_MAPPER.writeValueAsString(buildDashboard(snapshot));
        } catch (IOException e) {
            logger.warn("Failed to serialize dashboard to YAML", e);
            return null;
        }
    }

    @Override
    public void close() {
        running = false;
        ScheduledFuture<?> task = reportTask;
        if (task != null) {
            task.cancel(false);
            reportTask = null;
        }
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
