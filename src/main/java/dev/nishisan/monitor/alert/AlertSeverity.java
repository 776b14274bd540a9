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

package dev.nishisan.monitor.alert;

import java.util.Locale;

/**
 * Severity levels for {@link Alert}s, in increasing order of urgency.
 */
public enum AlertSeverity {
    /** Informational, no action required. */
    INFO,
    /** Degraded behaviour worth looking at. */
    WARNING,
    /** Immediate attention required. Drives system health to {@code ERROR}. */
    CRITICAL;

    public static AlertSeverity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Alert severity must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
