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

package dev.nishisan.monitor.health;

import dev.nishisan.monitor.alert.Alert;
import dev.nishisan.monitor.alert.AlertSeverity;

import java.util.Collection;

/**
 * Overall system status derived from the active alerts.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    ERROR;

    /**
     * {@code ERROR} if any alert is critical, {@code DEGRADED} if there is any
     * alert at all, {@code HEALTHY} otherwise.
     */
    public static HealthStatus of(Collection<Alert> activeAlerts) {
        if (activeAlerts.isEmpty()) {
            return HEALTHY;
        }
        for (Alert alert : activeAlerts) {
            if (alert.severity() == AlertSeverity.CRITICAL) {
                return ERROR;
            }
        }
        return DEGRADED;
    }
}
