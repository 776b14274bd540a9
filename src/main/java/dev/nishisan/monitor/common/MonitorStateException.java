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

package dev.nishisan.monitor.common;

/**
 * Raised when the monitor's internal state can no longer be trusted, such as a
 * lock that could not be acquired within the configured timeout.
 * <p>
 * This is never a caller error. It signals a deadlock or corruption bug and is
 * allowed to escape even the best-effort recording paths.
 */
public class MonitorStateException extends IllegalStateException {

    public MonitorStateException(String message) {
        super(message);
    }

    public MonitorStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
