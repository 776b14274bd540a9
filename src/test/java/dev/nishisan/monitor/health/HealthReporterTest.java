package dev.nishisan.monitor.health;

import dev.nishisan.monitor.alert.AlertEngine;
import dev.nishisan.monitor.alert.AlertRule;
import dev.nishisan.monitor.alert.AlertSeverity;
import dev.nishisan.monitor.alert.ThresholdComparator;
import dev.nishisan.monitor.execution.ExecutionCounts;
import dev.nishisan.monitor.execution.ExecutionStatus;
import dev.nishisan.monitor.execution.ExecutionTracker;
import dev.nishisan.monitor.stats.MetricStore;
import dev.nishisan.monitor.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthReporterTest {

    private MutableClock clock;
    private MetricStore store;
    private ExecutionTracker tracker;
    private HealthReporter reporter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        store = new MetricStore(4, Duration.ofSeconds(5), 64, clock);
        tracker = ExecutionTracker.builder(clock).diagnosticSink((op, id, reason) -> {
        }).build();
        AlertEngine engine = AlertEngine.builder(clock)
                .rule(AlertRule.of("errors", "agent_execution_error",
                        ThresholdComparator.GREATER_OR_EQUAL, 1, AlertSeverity.WARNING))
                .rule(AlertRule.of("voice", "voice_synthesis_failure",
                        ThresholdComparator.GREATER_OR_EQUAL, 1, AlertSeverity.CRITICAL))
                .build();
        store.addListener(engine);
        reporter = new HealthReporter(store, tracker, engine);
    }

    @Test
    void healthyWhenNoAlerts() {
        HealthSnapshot health = reporter.systemHealth();
        assertEquals(HealthStatus.HEALTHY, health.status());
        assertTrue(health.isHealthy());
        assertTrue(health.activeAlerts().isEmpty());
        assertEquals(ExecutionCounts.EMPTY, health.executions());
        assertTrue(health.metrics().isEmpty());
    }

    @Test
    void degradedOnWarningAndErrorOnCritical() {
        store.incrementCounter("agent_execution_error", Map.of());
        assertEquals(HealthStatus.DEGRADED, reporter.systemHealth().status());

        store.incrementCounter("voice_synthesis_failure", Map.of());
        HealthSnapshot health = reporter.systemHealth();
        assertEquals(HealthStatus.ERROR, health.status());
        assertEquals(2, health.activeAlerts().size());
    }

    @Test
    void includesExecutionCountsMetricsAndDiagnostics() {
        tracker.startExecution("e1", Map.of());
        tracker.startExecution("e2", Map.of());
        tracker.endExecution("e2", ExecutionStatus.COMPLETED, null);
        tracker.recordFunctionCall("missing", "f", 1, true);
        store.incrementCounter("agent_execution_started", Map.of("agent_id", "a1"));

        HealthSnapshot health = reporter.systemHealth();
        assertEquals(new ExecutionCounts(1, 1, 0), health.executions());
        assertEquals(1, health.metrics().size());
        assertEquals(1, health.diagnosticsReported());
    }

    @Test
    void repeatedReadsWithoutWritesAreEqual() {
        tracker.startExecution("e1", Map.of());
        store.incrementCounter("agent_execution_error", Map.of());
        store.recordTimer("agent_response_time_ms", 42, Map.of());

        assertEquals(reporter.systemHealth(), reporter.systemHealth());
    }
}
