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

package dev.nishisan.monitor;

import dev.nishisan.monitor.alert.Alert;
import dev.nishisan.monitor.alert.AlertEngine;
import dev.nishisan.monitor.common.DiagnosticSink;
import dev.nishisan.monitor.common.LoggingDiagnosticSink;
import dev.nishisan.monitor.config.MonitorConfig;
import dev.nishisan.monitor.execution.ExecutionReport;
import dev.nishisan.monitor.execution.ExecutionStatus;
import dev.nishisan.monitor.execution.ExecutionTracker;
import dev.nishisan.monitor.health.HealthDashboardReporter;
import dev.nishisan.monitor.health.HealthReporter;
import dev.nishisan.monitor.health.HealthSnapshot;
import dev.nishisan.monitor.stats.MetricKey;
import dev.nishisan.monitor.stats.MetricKind;
import dev.nishisan.monitor.stats.MetricStore;
import dev.nishisan.monitor.stats.dto.MetricSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Entry point of the monitor: owns the metric store, execution tracker, alert
 * engine and health reporter, and exposes the operations request handlers
 * call.
 * <p>
 * Instances are constructed explicitly and injected where needed. Every
 * operation may be called concurrently from any thread.
 *
 * <h2>Maintenance</h2>
 * {@link #start()} schedules a loop that, every {@code maintenanceInterval},
 * evicts expired executions and re-evaluates all alert rules so that windowed
 * alerts resolve without new samples. When a dashboard path is configured the
 * YAML dashboard is refreshed on the same scheduler.
 */
public class MonitoringService implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(MonitoringService.class);

    private final MonitorConfig config;
    private final Clock clock;
    private final MetricStore metricStore;
    private final ExecutionTracker executionTracker;
    private final AlertEngine alertEngine;
    private final HealthReporter healthReporter;
    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> maintenanceTask;
    private HealthDashboardReporter dashboardReporter;

    public MonitoringService(MonitorConfig config) {
        this(config, Clock.systemUTC(), new LoggingDiagnosticSink());
    }

    public MonitoringService(MonitorConfig config, Clock clock, DiagnosticSink diagnosticSink) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(diagnosticSink, "diagnosticSink");
        this.metricStore = new MetricStore(config.shardCount(), config.lockTimeout(),
                config.timerReservoirSize(), clock);
        this.executionTracker = ExecutionTracker.builder(clock)
                .shardCount(config.shardCount())
                .lockTimeout(config.lockTimeout())
                .retention(config.executionRetention())
                .maxRetained(config.maxRetainedExecutions())
                .staleCeiling(config.staleExecutionCeiling())
                .sweepInterval(config.sweepInterval())
                .diagnosticSink(diagnosticSink)
                .build();
        this.alertEngine = AlertEngine.builder(clock)
                .rules(config.rules())
                .activeWindow(config.activeAlertWindow())
                .lockTimeout(config.lockTimeout())
                .build();
        this.metricStore.addListener(alertEngine);
        this.healthReporter = new HealthReporter(metricStore, executionTracker, alertEngine);
    }

    /**
     * Starts the maintenance loop and, if configured, the dashboard reporter.
     * Calling it twice has no effect.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "monitor-maintenance-worker");
                t.setDaemon(true);
                return t;
            });
            long periodMs = Math.max(1L, config.maintenanceInterval().toMillis());
            maintenanceTask = scheduler.scheduleWithFixedDelay(this::runMaintenance, periodMs, periodMs,
                    TimeUnit.MILLISECONDS);
            if (config.dashboardPath() != null) {
                dashboardReporter = new HealthDashboardReporter(this::getSystemHealth, scheduler,
                        config.dashboardPath(), config.dashboardInterval(), clock);
                dashboardReporter.start();
            }
            logger.info("Monitoring started: rules:[{}] maintenance every {}", alertEngine.rules().size(),
                    config.maintenanceInterval());
        }
    }

    /**
     * One maintenance pass: eviction, alert re-evaluation, then a DEBUG dump of
     * the metrics. Runs on the
     * scheduler; can also be called directly.
     */
    public void runMaintenance() {
        try {
            int evicted = executionTracker.evictExpired();
            int resolved = alertEngine.evaluateAll();
            metricStore.logSummary();
            if (evicted > 0 || resolved > 0) {
                logger.debug("Maintenance: evicted:[{}] resolved alerts:[{}]", evicted, resolved);
            }
        } catch (RuntimeException e) {
            logger.error("Monitoring maintenance failed", e);
        }
    }

    // ── Execution tracking ──

    /**
     * @throws IllegalArgumentException if the id is blank
     * @throws dev.nishisan.monitor.execution.DuplicateExecutionException if the id is still retained
     */
    public void startExecution(String executionId, Map<String, Object> metadata) {
        executionTracker.startExecution(executionId, metadata);
    }

    /**
     * Best-effort: problems go to the diagnostic sink.
     */
    public void recordFunctionCall(String executionId, String callName, double durationMs, boolean success) {
        executionTracker.recordFunctionCall(executionId, callName, durationMs, success);
    }

    /**
     * Best-effort: problems go to the diagnostic sink.
     */
    public void endExecution(String executionId, ExecutionStatus status, String errorMessage) {
        executionTracker.endExecution(executionId, status, errorMessage);
    }

    /**
     * Runs {@code call}, timing it and recording it as a function call of the
     * execution. A call that throws is recorded as failed and the exception is
     * rethrown unchanged.
     */
    public <T> T trackFunctionCall(String executionId, String callName, Supplier<T> call) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            T result = call.get();
            success = true;
            return result;
        } finally {
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            executionTracker.recordFunctionCall(executionId, callName, elapsedMs, success);
        }
    }

    public Optional<ExecutionReport> getPerformanceReport(String executionId) {
        return executionTracker.getPerformanceReport(executionId);
    }

    // ── Metrics ──

    /**
     * @throws IllegalArgumentException if the name is blank or the value invalid for the kind
     * @throws dev.nishisan.monitor.stats.MetricKindMismatchException if the series exists with another kind
     */
    public void recordMetric(String name, double value, Map<String, String> labels, MetricKind kind) {
        metricStore.recordMetric(name, value, labels, kind);
    }

    public SortedMap<MetricKey, MetricSnapshot> getMetricsSummary() {
        return metricStore.summary();
    }

    // ── Health and alerts ──

    /**
     * Composes the health snapshot. Read only: alerts whose window has decayed
     * are resolved by the next maintenance pass, not here.
     */
    public HealthSnapshot getSystemHealth() {
        return healthReporter.systemHealth();
    }

    /**
     * Unresolved alerts triggered within {@code window} of now, newest first.
     * Read only, like {@link #getSystemHealth()}.
     */
    public List<Alert> listActiveAlerts(Duration window) {
        return alertEngine.activeAlerts(window);
    }

    public List<Alert> listActiveAlerts() {
        return listActiveAlerts(config.activeAlertWindow());
    }

    // ── Accessors ──

    public MonitorConfig config() {
        return config;
    }

    public MetricStore metricStore() {
        return metricStore;
    }

    public ExecutionTracker executionTracker() {
        return executionTracker;
    }

    public AlertEngine alertEngine() {
        return alertEngine;
    }

    /**
     * Returns the dashboard reporter, or {@code null} if not started or not configured.
     */
    public HealthDashboardReporter dashboardReporter() {
        synchronized (lifecycleLock) {
            return dashboardReporter;
        }
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (scheduler == null) {
                return;
            }
            if (dashboardReporter != null) {
                dashboardReporter.close();
                dashboardReporter = null;
            }
            maintenanceTask.cancel(false);
            maintenanceTask = null;
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
            logger.info("Monitoring stopped");
        }
    }
}
