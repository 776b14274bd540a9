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

package dev.nishisan.monitor.stats;

/**
 * Raised when a value is recorded against an existing series with a different
 * {@link MetricKind} than the one it was created with.
 */
public class MetricKindMismatchException extends IllegalArgumentException {

    private final MetricKey key;
    private final MetricKind existing;
    private final MetricKind requested;

    public MetricKindMismatchException(MetricKey key, MetricKind existing, MetricKind requested) {
        super(String.format("Metric:[%s] is a %s, cannot record it as %s", key, existing, requested));
        this.key = key;
        this.existing = existing;
        this.requested = requested;
    }

    public MetricKey getKey() {
        return key;
    }

    public MetricKind getExisting() {
        return existing;
    }

    public MetricKind getRequested() {
        return requested;
    }
}
