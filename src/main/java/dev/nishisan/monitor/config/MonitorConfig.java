package dev.nishisan.monitor.config;

import dev.nishisan.monitor.AgentMetrics;
import dev.nishisan.monitor.alert.AlertRule;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings of a {@link dev.nishisan.monitor.MonitoringService}.
 */
public final class MonitorConfig {
    private final int shardCount;
    private final Duration lockTimeout;
    private final int timerReservoirSize;
    private final Duration maintenanceInterval;
    private final Duration executionRetention;
    private final int maxRetainedExecutions;
    private final Duration staleExecutionCeiling;
    private final Duration sweepInterval;
    private final Duration activeAlertWindow;
    private final List<AlertRule> rules;
    private final Path dashboardPath;
    private final Duration dashboardInterval;

    private MonitorConfig(Builder builder) {
        this.shardCount = builder.shardCount;
        this.lockTimeout = Objects.requireNonNull(builder.lockTimeout, "lockTimeout");
        this.timerReservoirSize = builder.timerReservoirSize;
        this.maintenanceInterval = Objects.requireNonNull(builder.maintenanceInterval, "maintenanceInterval");
        this.executionRetention = Objects.requireNonNull(builder.executionRetention, "executionRetention");
        this.maxRetainedExecutions = builder.maxRetainedExecutions;
        this.staleExecutionCeiling = Objects.requireNonNull(builder.staleExecutionCeiling, "staleExecutionCeiling");
        this.sweepInterval = Objects.requireNonNull(builder.sweepInterval, "sweepInterval");
        this.activeAlertWindow = Objects.requireNonNull(builder.activeAlertWindow, "activeAlertWindow");
        this.rules = List.copyOf(builder.rules);
        this.dashboardPath = builder.dashboardPath;
        this.dashboardInterval = Objects.requireNonNull(builder.dashboardInterval, "dashboardInterval");
        validate();
    }

    /**
     * Production defaults with the agent service's built-in alert rules.
     *
     * @return the config
     */
    public static MonitorConfig defaults() {
        return builder().rules(AgentMetrics.defaultRules()).build();
    }

    /**
     * Creates a new builder with default settings and no alert rules.
     *
     * @return the builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the number of shards of the metric and execution tables. */
    public int shardCount() {
        return shardCount;
    }

    /** Returns the maximum wait for any internal lock. */
    public Duration lockTimeout() {
        return lockTimeout;
    }

    /** Returns how many recent samples each timer keeps for percentiles. */
    public int timerReservoirSize() {
        return timerReservoirSize;
    }

    /** Returns the period of the eviction and alert re-evaluation loop. */
    public Duration maintenanceInterval() {
        return maintenanceInterval;
    }

    /** Returns how long a finished execution stays queryable. */
    public Duration executionRetention() {
        return executionRetention;
    }

    /** Returns the maximum number of retained executions. */
    public int maxRetainedExecutions() {
        return maxRetainedExecutions;
    }

    /** Returns the age after which a running execution is force-terminated. */
    public Duration staleExecutionCeiling() {
        return staleExecutionCeiling;
    }

    /** Returns the minimum spacing of sweeps triggered by new executions. */
    public Duration sweepInterval() {
        return sweepInterval;
    }

    /** Returns the default look-back of the active alert view. */
    public Duration activeAlertWindow() {
        return activeAlertWindow;
    }

    /** Returns the alert rules. */
    public List<AlertRule> rules() {
        return rules;
    }

    /** Returns the dashboard file, or {@code null} when the dashboard is disabled. */
    public Path dashboardPath() {
        return dashboardPath;
    }

    /** Returns the dashboard refresh interval. */
    public Duration dashboardInterval() {
        return dashboardInterval;
    }

    private void validate() {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be > 0");
        }
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be > 0");
        }
        if (timerReservoirSize <= 0) {
            throw new IllegalArgumentException("timerReservoirSize must be > 0");
        }
        if (maintenanceInterval.isNegative() || maintenanceInterval.isZero()) {
            throw new IllegalArgumentException("maintenanceInterval must be > 0");
        }
        if (executionRetention.isNegative()) {
            throw new IllegalArgumentException("executionRetention cannot be negative");
        }
        if (maxRetainedExecutions <= 0) {
            throw new IllegalArgumentException("maxRetainedExecutions must be > 0");
        }
        if (staleExecutionCeiling.isNegative() || staleExecutionCeiling.isZero()) {
            throw new IllegalArgumentException("staleExecutionCeiling must be > 0");
        }
        if (sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval cannot be negative");
        }
        if (activeAlertWindow.isNegative() || activeAlertWindow.isZero()) {
            throw new IllegalArgumentException("activeAlertWindow must be > 0");
        }
        if (dashboardInterval.isNegative() || dashboardInterval.isZero()) {
            throw new IllegalArgumentException("dashboardInterval must be > 0");
        }
    }

    /**
     * Builder for {@link MonitorConfig}.
     */
    public static final class Builder {
        private int shardCount = 16;
        private Duration lockTimeout = Duration.ofSeconds(5);
        private int timerReservoirSize = 1024;
        private Duration maintenanceInterval = Duration.ofSeconds(30);
        private Duration executionRetention = Duration.ofHours(1);
        private int maxRetainedExecutions = 10_000;
        private Duration staleExecutionCeiling = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofSeconds(1);
        private Duration activeAlertWindow = Duration.ofHours(1);
        private final List<AlertRule> rules = new ArrayList<>();
        private Path dashboardPath;
        private Duration dashboardInterval = Duration.ofSeconds(30);

        private Builder() {
        }

        /** Sets the number of shards. */
        public Builder shardCount(int shardCount) {
            this.shardCount = shardCount;
            return this;
        }

        /** Sets the lock timeout. */
        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
            return this;
        }

        /** Sets the timer reservoir size. */
        public Builder timerReservoirSize(int size) {
            this.timerReservoirSize = size;
            return this;
        }

        /** Sets the maintenance interval. */
        public Builder maintenanceInterval(Duration interval) {
            this.maintenanceInterval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        /** Sets the execution retention window. */
        public Builder executionRetention(Duration retention) {
            this.executionRetention = Objects.requireNonNull(retention, "retention");
            return this;
        }

        /** Sets the maximum number of retained executions. */
        public Builder maxRetainedExecutions(int max) {
            this.maxRetainedExecutions = max;
            return this;
        }

        /** Sets the staleness ceiling of running executions. */
        public Builder staleExecutionCeiling(Duration ceiling) {
            this.staleExecutionCeiling = Objects.requireNonNull(ceiling, "ceiling");
            return this;
        }

        /** Sets the opportunistic sweep interval. */
        public Builder sweepInterval(Duration interval) {
            this.sweepInterval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        /** Sets the active alert window. */
        public Builder activeAlertWindow(Duration window) {
            this.activeAlertWindow = Objects.requireNonNull(window, "window");
            return this;
        }

        /** Adds an alert rule. */
        public Builder rule(AlertRule rule) {
            this.rules.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        /** Adds alert rules. */
        public Builder rules(Collection<AlertRule> rules) {
            rules.forEach(this::rule);
            return this;
        }

        /** Enables the YAML dashboard at the given path, {@code null} disables it. */
        public Builder dashboardPath(Path path) {
            this.dashboardPath = path;
            return this;
        }

        /** Sets the dashboard refresh interval. */
        public Builder dashboardInterval(Duration interval) {
            this.dashboardInterval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        /** Builds the configuration. */
        public MonitorConfig build() {
            return new MonitorConfig(this);
        }
    }
}
