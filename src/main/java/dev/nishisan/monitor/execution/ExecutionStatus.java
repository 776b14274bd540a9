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

import java.util.Locale;

/**
 * Lifecycle state of an execution. {@code RUNNING} moves to exactly one of the
 * two terminal states.
 */
public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * Case-insensitive lookup accepting {@code "completed"} and {@code "error"}
     * as sent by the agent service.
     */
    public static ExecutionStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Execution status must not be blank");
        }
        return ExecutionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
