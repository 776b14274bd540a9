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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable performance report of one execution.
 *
 * @param executionId         the caller-supplied id
 * @param metadata            what the caller attached at start
 * @param status              current status
 * @param startTime           when the execution started
 * @param endTime             when it reached a terminal state, {@code null} while running
 * @param durationMs          end minus start once terminal, otherwise elapsed so far
 * @param errorMessage        set iff {@code status} is {@link ExecutionStatus#ERROR}
 * @param calls               function calls in the order they were reported
 * @param failedCalls         number of calls with {@code success == false}
 * @param totalCallDurationMs sum of all call durations
 * @param slowestCall         name of the longest call, {@code null} when there are none
 */
public record ExecutionReport(
        String executionId,
        Map<String, Object> metadata,
        ExecutionStatus status,
        Instant startTime,
        Instant endTime,
        long durationMs,
        String errorMessage,
        List<FunctionCallRecord> calls,
        int failedCalls,
        double totalCallDurationMs,
        String slowestCall) {

    public int callCount() {
        return calls.size();
    }

    public double successRate() {
        return calls.isEmpty() ? 1.0 : (double) (calls.size() - failedCalls) / calls.size();
    }
}
