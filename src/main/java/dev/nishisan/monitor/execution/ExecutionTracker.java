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

package dev.nishisan.monitor.execution;

import dev.nishisan.monitor.common.DiagnosticSink;
import dev.nishisan.monitor.common.LoggingDiagnosticSink;
import dev.nishisan.monitor.common.ShardedTable;
import dev.nishisan.monitor.common.TimedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks the lifecycle of every in-flight and recently finished execution.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 * <li>{@link #startExecution} creates a {@code RUNNING} record, rejecting ids
 * that are still retained</li>
 * <li>{@link #recordFunctionCall} appends to the record's call log</li>
 * <li>{@link #endExecution} moves it, exactly once, to {@code COMPLETED} or
 * {@code ERROR}</li>
 * </ul>
 * <p>
 * {@code recordFunctionCall} and {@code endExecution} are best-effort: they
 * return nothing and never throw for caller mistakes. Unknown ids, calls after
 * termination and malformed arguments go to the {@link DiagnosticSink}.
 *
 * <h2>Retention</h2>
 * Terminal records are evicted once they ended more than {@code retention} ago,
 * or, oldest first, when more than {@code maxRetained} records are held.
 * Running records are never evicted; instead, one that has been running longer
 * than {@code staleCeiling} is force-terminated as {@code ERROR} and then ages
 * out normally. The sweep runs opportunistically from {@code startExecution}
 * (at most once per {@code sweepInterval}) and from the monitor's maintenance
 * loop.
 */
public final class ExecutionTracker {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionTracker.class);

    static final String UNSPECIFIED_ERROR = "unspecified error";

    private final ShardedTable<String, ExecutionEntry> executions;
    private final Clock clock;
    private final DiagnosticSink diagnosticSink;
    private final Duration retention;
    private final int maxRetained;
    private final Duration staleCeiling;
    private final long sweepIntervalMs;
    private final long lockTimeoutNanos;
    private final AtomicLong lastSweepAtMs = new AtomicLong(Long.MIN_VALUE);
    // one sweep at a time, whoever triggers it
    private final ReentrantLock sweepLock = new ReentrantLock();
    private final AtomicLong diagnostics = new AtomicLong();

    private ExecutionTracker(Builder builder) {
        this.executions = new ShardedTable<>("execution", builder.shardCount, builder.lockTimeout);
        this.clock = builder.clock;
        this.diagnosticSink = builder.diagnosticSink;
        this.retention = builder.retention;
        this.maxRetained = builder.maxRetained;
        this.staleCeiling = builder.staleCeiling;
        this.sweepIntervalMs = builder.sweepInterval.toMillis();
        this.lockTimeoutNanos = builder.lockTimeout.toNanos();
    }

    /**
     * Starts tracking a new execution.
     *
     * @param executionId caller-supplied id, unique among retained executions
     * @param metadata    opaque context captured as-is, may be {@code null}
     * @throws IllegalArgumentException    if the id is blank
     * @throws DuplicateExecutionException if the id is already retained
     */
    public void startExecution(String executionId, Map<String, Object> metadata) {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId must not be blank");
        }
        maybeSweep();
        Map<String, Object> captured = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        Instant now = clock.instant();
        executions.withShard(executionId, entries -> {
            if (entries.containsKey(executionId)) {
                throw new DuplicateExecutionException(executionId);
            }
            entries.put(executionId, new ExecutionEntry(executionId, captured, now));
            return null;
        });
        logger.debug("Execution:[{}] started", executionId);
    }

    /**
     * Appends a function call to a running execution. Never throws for caller
     * mistakes.
     */
    public void recordFunctionCall(String executionId, String callName, double durationMs, boolean success) {
        if (executionId == null || executionId.isBlank()) {
            diagnose("recordFunctionCall", executionId, "blank execution id");
            return;
        }
        if (callName == null || callName.isBlank()) {
            diagnose("recordFunctionCall", executionId, "blank call name");
            return;
        }
        if (!Double.isFinite(durationMs) || durationMs < 0) {
            diagnose("recordFunctionCall", executionId, "invalid duration " + durationMs + " for " + callName);
            return;
        }
        FunctionCallRecord call = new FunctionCallRecord(callName, durationMs, success, clock.instant());
        Outcome outcome = executions.withShard(executionId, entries -> {
            ExecutionEntry entry = entries.get(executionId);
            if (entry == null) {
                return Outcome.UNKNOWN;
            }
            if (entry.isTerminal()) {
                return Outcome.ALREADY_TERMINAL;
            }
            entry.addCall(call);
            return Outcome.APPLIED;
        });
        if (outcome != Outcome.APPLIED) {
            diagnose("recordFunctionCall", executionId, outcome.describe() + ", dropped call " + callName);
        }
    }

    /**
     * Moves a running execution to its terminal state. Never throws for caller
     * mistakes.
     * <p>
     * Contract violations are resolved the same way every time: a
     * {@code RUNNING} status is ignored, {@code ERROR} without a message is
     * recorded with {@value #UNSPECIFIED_ERROR}, and a message sent with
     * {@code COMPLETED} is dropped. Each case is reported to the diagnostic sink.
     *
     * @param executionId  the execution id
     * @param status       {@link ExecutionStatus#COMPLETED} or {@link ExecutionStatus#ERROR}
     * @param errorMessage required iff {@code status} is {@code ERROR}
     */
    public void endExecution(String executionId, ExecutionStatus status, String errorMessage) {
        if (executionId == null || executionId.isBlank()) {
            diagnose("endExecution", executionId, "blank execution id");
            return;
        }
        if (status == null || !status.isTerminal()) {
            diagnose("endExecution", executionId, "status " + status + " is not terminal, ignored");
            return;
        }
        String message = errorMessage;
        if (status == ExecutionStatus.ERROR && (message == null || message.isBlank())) {
            diagnose("endExecution", executionId, "ERROR without message");
            message = UNSPECIFIED_ERROR;
        } else if (status == ExecutionStatus.COMPLETED && message != null) {
            diagnose("endExecution", executionId, "COMPLETED with error message, message dropped");
            message = null;
        }
        String finalMessage = message;
        Instant now = clock.instant();
        Outcome outcome = executions.withShard(executionId, entries -> {
            ExecutionEntry entry = entries.get(executionId);
            if (entry == null) {
                return Outcome.UNKNOWN;
            }
            if (entry.isTerminal()) {
                return Outcome.ALREADY_TERMINAL;
            }
            entry.finish(status, finalMessage, now);
            return Outcome.APPLIED;
        });
        if (outcome != Outcome.APPLIED) {
            diagnose("endExecution", executionId, outcome.describe() + ", ignored " + status);
            return;
        }
        logger.debug("Execution:[{}] finished as {}", executionId, status);
    }

    /**
     * Builds the performance report of one execution.
     *
     * @return the report, or empty if the id was never started or has been evicted
     */
    public Optional<ExecutionReport> getPerformanceReport(String executionId) {
        if (executionId == null || executionId.isBlank()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return executions.read(executionId, entry -> entry.toReport(now));
    }

    /**
     * Counts retained executions by status, shard by shard.
     */
    public ExecutionCounts counts() {
        long[] byStatus = new long[ExecutionStatus.values().length];
        executions.forEach((id, entry) -> byStatus[entry.status().ordinal()]++);
        return new ExecutionCounts(byStatus[ExecutionStatus.RUNNING.ordinal()],
                byStatus[ExecutionStatus.COMPLETED.ordinal()],
                byStatus[ExecutionStatus.ERROR.ordinal()]);
    }

    /**
     * Runs the retention policy now: force-terminates stale running executions,
     * drops terminal ones older than the retention window, then trims the
     * oldest terminal ones beyond the retained maximum. Waits for a sweep
     * already in progress on another thread.
     *
     * @return the number of evicted executions
     * @throws dev.nishisan.monitor.common.MonitorStateException if the sweep lock cannot be acquired in time
     */
    public int evictExpired() {
        TimedLocks.acquire(sweepLock, lockTimeoutNanos, "execution sweep");
        try {
            return sweep();
        } finally {
            sweepLock.unlock();
        }
    }

    private int sweep() {
        Instant now = clock.instant();
        lastSweepAtMs.set(now.toEpochMilli());

        Instant staleBefore = now.minus(staleCeiling);
        String staleMessage = "stale: no end_execution within " + staleCeiling;
        List<String> stale = new ArrayList<>();
        executions.forEach((id, entry) -> {
            if (!entry.isTerminal() && entry.startTime().isBefore(staleBefore)) {
                entry.finish(ExecutionStatus.ERROR, staleMessage, now);
                stale.add(id);
            }
        });
        stale.forEach(id -> diagnose("evictExpired", id, "force-terminated, running longer than " + staleCeiling));

        Instant expiredBefore = now.minus(retention);
        int evicted = executions.removeIf((id, entry) -> entry.isTerminal() && entry.endTime().isBefore(expiredBefore));
        evicted += trimToMaxRetained();
        if (evicted > 0 || !stale.isEmpty()) {
            logger.debug("Execution sweep: evicted:[{}] stale:[{}]", evicted, stale.size());
        }
        return evicted;
    }

    /**
     * Number of problems reported to the diagnostic sink so far.
     */
    public long diagnosticCount() {
        return diagnostics.get();
    }

    public int size() {
        return executions.size();
    }

    private int trimToMaxRetained() {
        int excess = executions.size() - maxRetained;
        if (excess <= 0) {
            return 0;
        }
        List<Candidate> terminal = executions.collect((id, entry) ->
                entry.isTerminal() ? new Candidate(id, entry.endTime()) : null);
        terminal.sort(Comparator.comparing(Candidate::endTime).thenComparing(Candidate::executionId));
        int removed = 0;
        for (Candidate candidate : terminal) {
            if (removed >= excess) {
                break;
            }
            boolean gone = executions.withShard(candidate.executionId(), entries -> {
                ExecutionEntry entry = entries.get(candidate.executionId());
                if (entry != null && entry.isTerminal() && entry.endTime().equals(candidate.endTime())) {
                    entries.remove(candidate.executionId());
                    return true;
                }
                return false;
            });
            if (gone) {
                removed++;
            }
        }
        return removed;
    }

    private void maybeSweep() {
        long now = clock.millis();
        long last = lastSweepAtMs.get();
        if (last != Long.MIN_VALUE && now - last < sweepIntervalMs) {
            return;
        }
        if (lastSweepAtMs.compareAndSet(last, now) && sweepLock.tryLock()) {
            try {
                sweep();
            } finally {
                sweepLock.unlock();
            }
        }
    }

    private void diagnose(String operation, String executionId, String reason) {
        diagnostics.incrementAndGet();
        try {
            diagnosticSink.report(operation, executionId, reason);
        } catch (RuntimeException e) {
            logger.warn("Diagnostic sink failed while reporting [{}] for execution [{}]", operation, executionId, e);
        }
    }

    private enum Outcome {
        APPLIED, UNKNOWN, ALREADY_TERMINAL;

        String describe() {
            return this == UNKNOWN ? "unknown or evicted execution" : "execution already terminal";
        }
    }

    private record Candidate(String executionId, Instant endTime) {
    }

    // ── Builder ──

    /**
     * Creates a builder with the default policy: 1h retention, 10 000 retained
     * executions, 24h staleness ceiling.
     *
     * @param clock time source
     * @return the builder
     */
    public static Builder builder(Clock clock) {
        return new Builder(clock);
    }

    /**
     * Builder for {@link ExecutionTracker}.
     */
    public static final class Builder {
        private final Clock clock;
        private DiagnosticSink diagnosticSink = new LoggingDiagnosticSink();
        private int shardCount = 16;
        private Duration lockTimeout = Duration.ofSeconds(5);
        private Duration retention = Duration.ofHours(1);
        private int maxRetained = 10_000;
        private Duration staleCeiling = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofSeconds(1);

        private Builder(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
        }

        public Builder diagnosticSink(DiagnosticSink sink) {
            this.diagnosticSink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder shardCount(int shardCount) {
            this.shardCount = shardCount;
            return this;
        }

        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
            return this;
        }

        /**
         * How long a terminal execution stays queryable after it ended.
         */
        public Builder retention(Duration retention) {
            this.retention = Objects.requireNonNull(retention, "retention");
            return this;
        }

        /**
         * Upper bound on retained executions; the oldest terminal ones go first.
         */
        public Builder maxRetained(int maxRetained) {
            this.maxRetained = maxRetained;
            return this;
        }

        /**
         * Age after which a still-running execution is force-terminated.
         */
        public Builder staleCeiling(Duration staleCeiling) {
            this.staleCeiling = Objects.requireNonNull(staleCeiling, "staleCeiling");
            return this;
        }

        /**
         * Minimum spacing between opportunistic sweeps triggered by
         * {@code startExecution}. Zero sweeps on every start.
         */
        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
            return this;
        }

        public ExecutionTracker build() {
            if (retention.isNegative()) {
                throw new IllegalArgumentException("retention must be >= 0");
            }
            if (maxRetained <= 0) {
                throw new IllegalArgumentException("maxRetained must be positive");
            }
            if (staleCeiling.isNegative() || staleCeiling.isZero()) {
                throw new IllegalArgumentException("staleCeiling must be positive");
            }
            if (sweepInterval.isNegative()) {
                throw new IllegalArgumentException("sweepInterval must be >= 0");
            }
            return new ExecutionTracker(this);
        }
    }
}
