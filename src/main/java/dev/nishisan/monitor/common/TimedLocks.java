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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * Bounded lock acquisition shared by every guarded structure of the monitor.
 */
public final class TimedLocks {

    private TimedLocks() {
    }

    /**
     * Acquires {@code lock}, waiting at most {@code timeoutNanos}.
     *
     * @param lock         the lock to acquire
     * @param timeoutNanos maximum wait
     * @param resource     description used in the failure message
     * @throws MonitorStateException if the lock is not acquired in time or the
     *                               thread is interrupted while waiting
     */
    public static void acquire(Lock lock, long timeoutNanos, String resource) {
        try {
            if (lock.tryLock(timeoutNanos, TimeUnit.NANOSECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MonitorStateException("Interrupted while waiting for " + resource, e);
        }
        throw new MonitorStateException("Timed out after "
                + TimeUnit.NANOSECONDS.toMillis(timeoutNanos) + "ms waiting for " + resource
                + " (possible deadlock)");
    }
}
