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
 * Callback interface for metric series lifecycle events raised by
 * {@link MetricStore}.
 * <p>
 * Callbacks run synchronously on the recording thread, after the series lock
 * has been released. They must be quick and must not block on I/O.
 */
public interface MetricListener {

    /**
     * Callback method triggered when a series is recorded for the first time.
     *
     * @param key  the new series key
     * @param kind the kind the series is bound to from now on
     */
    default void onMetricCreated(MetricKey key, MetricKind kind) {
    }

    /**
     * Callback method triggered after every accepted update.
     *
     * @param sample the recorded value together with the series' current aggregate
     */
    void onMetricRecorded(MetricSample sample);
}
