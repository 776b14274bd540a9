package dev.nishisan.monitor;

import dev.nishisan.monitor.alert.Alert;
import dev.nishisan.monitor.alert.AlertListener;
import dev.nishisan.monitor.config.MonitorConfig;
import dev.nishisan.monitor.execution.DuplicateExecutionException;
import dev.nishisan.monitor.execution.ExecutionReport;
import dev.nishisan.monitor.execution.ExecutionStatus;
import dev.nishisan.monitor.health.HealthSnapshot;
import dev.nishisan.monitor.health.HealthStatus;
import dev.nishisan.monitor.stats.MetricKey;
import dev.nishisan.monitor.stats.MetricKind;
import dev.nishisan.monitor.stats.MetricKindMismatchException;
import dev.nishisan.monitor.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of {@link MonitoringService} driving the agent request flow.
 */
class MonitoringServiceTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private List<String> diagnostics;
    private MonitoringService monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        diagnostics = Collections.synchronizedList(new ArrayList<>());
        monitor = new MonitoringService(MonitorConfig.defaults(), clock,
                (operation, id, reason) -> diagnostics.add(operation + ":" + id));
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    private void handleRequest(String executionId, String agentId, boolean fail) {
        monitor.startExecution(executionId, Map.of(AgentMetrics.LABEL_AGENT_ID, agentId, "input_length", 42));
        monitor.recordMetric(AgentMetrics.EXECUTION_STARTED, 1, AgentMetrics.agent(agentId), MetricKind.COUNTER);
        monitor.recordFunctionCall(executionId, "agent_manager.execute_agent", 850, true);
        if (fail) {
            monitor.recordMetric(AgentMetrics.EXECUTION_ERROR, 1,
                    Map.of(AgentMetrics.LABEL_AGENT_ID, agentId, AgentMetrics.LABEL_ERROR_TYPE, "TimeoutError"),
                    MetricKind.COUNTER);
            monitor.endExecution(executionId, ExecutionStatus.ERROR, "upstream timeout");
            return;
        }
        monitor.recordMetric(AgentMetrics.RESPONSE_TIME_MS, 900,
                Map.of(AgentMetrics.LABEL_AGENT_ID, agentId, AgentMetrics.LABEL_SUCCESS, "true"), MetricKind.TIMER);
        monitor.recordMetric(AgentMetrics.EXECUTION_SUCCESS, 1, AgentMetrics.agent(agentId), MetricKind.COUNTER);
        monitor.endExecution(executionId, ExecutionStatus.COMPLETED, null);
    }

    @Test
    void successfulRequestFlow() {
        handleRequest("req-1", "a1", false);

        ExecutionReport report = monitor.getPerformanceReport("req-1").orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, report.status());
        assertEquals(1, report.callCount());
        assertEquals("a1", report.metadata().get(AgentMetrics.LABEL_AGENT_ID));

        Map<MetricKey, ?> summary = monitor.getMetricsSummary();
        assertTrue(summary.containsKey(MetricKey.of(AgentMetrics.EXECUTION_SUCCESS, AgentMetrics.agent("a1"))));

        HealthSnapshot health = monitor.getSystemHealth();
        assertEquals(HealthStatus.HEALTHY, health.status());
        assertEquals(1, health.executions().completed());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void failedRequestRaisesDefaultAlertThatResolvesOnMaintenance() {
        handleRequest("req-1", "a1", true);

        List<Alert> active = monitor.listActiveAlerts();
        assertEquals(1, active.size());
        assertEquals(AgentMetrics.RULE_EXECUTION_ERRORS, active.get(0).ruleName());
        assertEquals(HealthStatus.DEGRADED, monitor.getSystemHealth().status());
        assertEquals("upstream timeout", monitor.getPerformanceReport("req-1").orElseThrow().errorMessage());

        clock.advance(Duration.ofMinutes(6));
        monitor.runMaintenance();
        assertTrue(monitor.listActiveAlerts().isEmpty());
        assertEquals(HealthStatus.HEALTHY, monitor.getSystemHealth().status());
        assertEquals(1, monitor.alertEngine().alertHistory().size());
    }

    @Test
    void healthReadsLeaveAlertStateToMaintenance() {
        List<Alert> resolved = Collections.synchronizedList(new ArrayList<>());
        monitor.alertEngine().addListener(new AlertListener() {
            @Override
            public void onAlertRaised(Alert alert) {
            }

            @Override
            public void onAlertResolved(Alert alert) {
                resolved.add(alert);
            }
        });
        handleRequest("req-1", "a1", true);

        clock.advance(Duration.ofMinutes(6));
        assertEquals(HealthStatus.DEGRADED, monitor.getSystemHealth().status());
        assertEquals(1, monitor.listActiveAlerts().size());
        assertTrue(resolved.isEmpty());
        assertFalse(monitor.alertEngine().alertHistory().get(0).resolved());

        monitor.runMaintenance();
        assertEquals(1, resolved.size());
        assertEquals(HealthStatus.HEALTHY, monitor.getSystemHealth().status());
    }

    @Test
    void voiceFailuresDriveHealthToError() {
        for (int i = 0; i < 5; i++) {
            monitor.recordMetric(AgentMetrics.VOICE_SYNTHESIS_FAILURE, 1, AgentMetrics.agent("a1"),
                    MetricKind.COUNTER);
        }
        assertEquals(HealthStatus.ERROR, monitor.getSystemHealth().status());
    }

    @Test
    void usageErrorsSurface() {
        monitor.startExecution("req-1", Map.of());
        assertThrows(DuplicateExecutionException.class, () -> monitor.startExecution("req-1", Map.of()));

        monitor.recordMetric("m", 1, Map.of(), MetricKind.COUNTER);
        assertThrows(MetricKindMismatchException.class,
                () -> monitor.recordMetric("m", 1, Map.of(), MetricKind.GAUGE));
    }

    @Test
    void bestEffortPathsNeverThrow() {
        assertDoesNotThrow(() -> monitor.recordFunctionCall("unknown", "f", 1, true));
        assertDoesNotThrow(() -> monitor.endExecution("unknown", ExecutionStatus.COMPLETED, null));
        assertEquals(2, diagnostics.size());
        assertEquals(2, monitor.getSystemHealth().diagnosticsReported());
    }

    @Test
    void trackFunctionCallRecordsOutcome() {
        monitor.startExecution("req-1", Map.of());

        String result = monitor.trackFunctionCall("req-1", "memory.search", () -> "hit");
        assertEquals("hit", result);
        assertThrows(IllegalStateException.class, () -> monitor.trackFunctionCall("req-1", "voice.tts", () -> {
            throw new IllegalStateException("tts down");
        }));

        ExecutionReport report = monitor.getPerformanceReport("req-1").orElseThrow();
        assertEquals(2, report.callCount());
        assertTrue(report.calls().get(0).success());
        assertFalse(report.calls().get(1).success());
        assertEquals("voice.tts", report.calls().get(1).name());
    }

    @Test
    void systemHealthIsStableWithoutWrites() {
        handleRequest("req-1", "a1", false);
        handleRequest("req-2", "a2", true);
        monitor.startExecution("req-3", Map.of());

        assertEquals(monitor.getSystemHealth(), monitor.getSystemHealth());
    }

    @Test
    @Timeout(30)
    void concurrentRequestsAreAllAccountedFor() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        handleRequest("w" + worker + "-" + i, "agent-" + (i % 3), i % 10 == 0);
                        monitor.getSystemHealth();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        double started = monitor.getMetricsSummary().entrySet().stream()
                .filter(e -> e.getKey().name().equals(AgentMetrics.EXECUTION_STARTED))
                .mapToDouble(e -> e.getValue().sum())
                .sum();
        assertEquals((double) threads * perThread, started);
        HealthSnapshot health = monitor.getSystemHealth();
        assertEquals((long) threads * perThread / 10, health.executions().error());
        assertEquals((long) threads * perThread * 9 / 10, health.executions().completed());
        assertEquals(0, health.executions().running());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    @Timeout(30)
    void maintenanceLoopEvictsInTheBackground() {
        MonitorConfig config = MonitorConfig.builder()
                .maintenanceInterval(Duration.ofMillis(50))
                .executionRetention(Duration.ofMinutes(1))
                .sweepInterval(Duration.ofHours(1))
                .build();
        try (MonitoringService service = new MonitoringService(config, clock, (op, id, reason) -> {
        })) {
            service.start();
            service.start();
            service.startExecution("old", Map.of());
            service.endExecution("old", ExecutionStatus.COMPLETED, null);
            clock.advance(Duration.ofMinutes(5));

            await("expired execution evicted")
                    .atMost(Duration.ofSeconds(10))
                    .until(() -> service.getPerformanceReport("old").isEmpty());
        }
    }

    @Test
    @Timeout(30)
    void dashboardIsWrittenWhenConfigured() throws Exception {
        Path dashboard = tempDir.resolve("dashboard.yaml");
        MonitorConfig config = MonitorConfig.builder()
                .rules(AgentMetrics.defaultRules())
                .dashboardPath(dashboard)
                .dashboardInterval(Duration.ofSeconds(1))
                .build();
        try (MonitoringService service = new MonitoringService(config, clock, (op, id, reason) -> {
        })) {
            service.start();
            assertNotNull(service.dashboardReporter());
            service.recordMetric(AgentMetrics.EXECUTION_ERROR, 1, Map.of(), MetricKind.COUNTER);

            await("dashboard written")
                    .atMost(Duration.ofSeconds(10))
                    .until(() -> Files.exists(dashboard)
                            && Files.readString(dashboard).contains(AgentMetrics.RULE_EXECUTION_ERRORS));
        }
    }
}
