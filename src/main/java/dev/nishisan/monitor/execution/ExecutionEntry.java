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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mutable execution record. Only touched under the lock of the tracker shard
 * that owns its id.
 */
final class ExecutionEntry {
    private final String executionId;
    private final Map<String, Object> metadata;
    private final Instant startTime;
    private final List<FunctionCallRecord> calls = new ArrayList<>();
    private ExecutionStatus status = ExecutionStatus.RUNNING;
    private Instant endTime;
    private String errorMessage;

    ExecutionEntry(String executionId, Map<String, Object> metadata, Instant startTime) {
        this.executionId = executionId;
        this.metadata = metadata;
        this.startTime = startTime;
    }

    void addCall(FunctionCallRecord call) {
        calls.add(call);
    }

    void finish(ExecutionStatus terminal, String message, Instant at) {
        if (!terminal.isTerminal() || status.isTerminal()) {
            throw new IllegalStateException("Execution:[" + executionId + "] cannot move from "
                    + status + " to " + terminal);
        }
        this.status = terminal;
        this.errorMessage = terminal == ExecutionStatus.ERROR ? message : null;
        this.endTime = at;
    }

    boolean isTerminal() {
        return status.isTerminal();
    }

    ExecutionStatus status() {
        return status;
    }

    Instant startTime() {
        return startTime;
    }

    Instant endTime() {
        return endTime;
    }

    ExecutionReport toReport(Instant now) {
        Instant until = endTime != null ? endTime : now;
        int failed = 0;
        double total = 0.0;
        FunctionCallRecord slowest = null;
        for (FunctionCallRecord call : calls) {
            if (!call.success()) {
                failed++;
            }
            total += call.durationMs();
            if (slowest == null || call.durationMs() > slowest.durationMs()) {
                slowest = call;
            }
        }
        return new ExecutionReport(executionId, metadata, status, startTime, endTime,
                Math.max(0L, Duration.between(startTime, until).toMillis()),
                errorMessage, List.copyOf(calls), failed, total,
                slowest == null ? null : slowest.name());
    }
}
