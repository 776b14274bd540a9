package dev.nishisan.monitor.health;

import dev.nishisan.monitor.alert.Alert;
import dev.nishisan.monitor.alert.AlertSeverity;
import dev.nishisan.monitor.execution.ExecutionCounts;
import dev.nishisan.monitor.stats.MetricKey;
import dev.nishisan.monitor.stats.MetricKind;
import dev.nishisan.monitor.stats.dto.MetricSnapshot;
import dev.nishisan.monitor.testutil.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link HealthDashboardReporter}.
 */
class HealthDashboardReporterTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");

    private HealthSnapshot createSnapshot() {
        Instant now = clock.instant();
        MetricKey timerKey = MetricKey.of("agent_response_time_ms", Map.of("agent_id", "a1"));
        TreeMap<MetricKey, MetricSnapshot> metrics = new TreeMap<>();
        metrics.put(timerKey, new MetricSnapshot(timerKey, MetricKind.TIMER, 4, 1000, 100, 400, 400,
                250, 400, 400, now));
        Alert alert = new Alert("id-1", "slow_agent_responses", AlertSeverity.WARNING,
                "Rule [slow_agent_responses] too slow", timerKey.toString(), 31_000, 30_000,
                now, now, false, null);
        return new HealthSnapshot(HealthStatus.DEGRADED, List.of(alert), new ExecutionCounts(2, 5, 1),
                metrics, 3);
    }

    @Test
    void reportWritesYamlFile() throws Exception {
        Path outputFile = tempDir.resolve("out").resolve("dashboard.yaml");
        AtomicReference<HealthSnapshot> snapshot = new AtomicReference<>(createSnapshot());
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

        try {
            HealthDashboardReporter reporter = new HealthDashboardReporter(
                    snapshot::get, scheduler, outputFile, Duration.ofMinutes(5), clock);

            assertTrue(reporter.report());

            assertTrue(Files.exists(outputFile));
            String content = Files.readString(outputFile);
            assertTrue(content.contains("status: \"DEGRADED\"") || content.contains("status: DEGRADED"));
            assertTrue(content.contains("running: 2"));
            assertTrue(content.contains("diagnosticsReported: 3"));
            assertTrue(content.contains("slow_agent_responses"));
            assertTrue(content.contains("agent_response_time_ms{agent_id=a1}"));
            assertTrue(content.contains("p95: 400.0"));
            assertFalse(content.startsWith("---"));
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void buildDashboardSections() {
        HealthDashboardReporter reporter = new HealthDashboardReporter(
                this::createSnapshot, Executors.newSingleThreadScheduledExecutor(),
                tempDir.resolve("d.yaml"), Duration.ofMinutes(1), clock);

        Map<String, Object> dashboard = reporter.buildDashboard(createSnapshot());
        assertEquals(clock.instant().toString(), dashboard.get("capturedAt"));
        assertEquals("DEGRADED", dashboard.get("status"));

        @SuppressWarnings("unchecked")
        Map<String, Object> executions = (Map<String, Object>) dashboard.get("executions");
        assertEquals(5L, executions.get("completed"));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> alerts = (List<Map<String, Object>>) dashboard.get("activeAlerts");
        assertEquals(1, alerts.size());
        assertEquals("WARNING", alerts.get(0).get("severity"));

        @SuppressWarnings("unchecked")
        Map<String, Object> metrics = (Map<String, Object>) dashboard.get("metrics");
        @SuppressWarnings("unchecked")
        Map<String, Object> timer = (Map<String, Object>) metrics.get("agent_response_time_ms{agent_id=a1}");
        assertEquals(250.0, timer.get("value"));
        assertEquals(4L, timer.get("count"));
    }

    @Test
    void nullSnapshotIsSkipped() {
        HealthDashboardReporter reporter = new HealthDashboardReporter(
                () -> null, Executors.newSingleThreadScheduledExecutor(),
                tempDir.resolve("none.yaml"), Duration.ofMinutes(1), clock);

        assertFalse(reporter.report());
        assertNull(reporter.toYaml());
        assertFalse(Files.exists(tempDir.resolve("none.yaml")));
    }

    @Test
    void supplierFailureIsLoggedNotThrown() {
        HealthDashboardReporter reporter = new HealthDashboardReporter(
                () -> {
                    throw new IllegalStateException("no snapshot");
                }, Executors.newSingleThreadScheduledExecutor(),
                tempDir.resolve("fail.yaml"), Duration.ofMinutes(1), clock);

        assertFalse(reporter.report());
        assertFalse(Files.exists(tempDir.resolve("fail.yaml")));
    }

    @Test
    void toYamlMatchesDashboard() {
        HealthDashboardReporter reporter = new HealthDashboardReporter(
                this::createSnapshot, Executors.newSingleThreadScheduledExecutor(),
                tempDir.resolve("d.yaml"), Duration.ofMinutes(1), clock);

        String yaml = reporter.toYaml();
        assertNotNull(yaml);
        assertTrue(yaml.contains("capturedAt"));
        assertTrue(yaml.contains("activeAlerts"));
    }

    @Test
    void startAndCloseScheduleReports() throws Exception {
        Path outputFile = tempDir.resolve("periodic.yaml");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            HealthDashboardReporter reporter = new HealthDashboardReporter(
                    this::createSnapshot, scheduler, outputFile, Duration.ofSeconds(1), clock);
            reporter.start();
            await("dashboard written")
                    .atMost(Duration.ofSeconds(10))
                    .until(() -> Files.exists(outputFile));
            reporter.close();
        } finally {
            scheduler.shutdownNow();
        }
    }
}
