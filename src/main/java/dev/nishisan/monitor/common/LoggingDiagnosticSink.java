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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link DiagnosticSink}: writes every report to the log at WARN.
 */
public final class LoggingDiagnosticSink implements DiagnosticSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

    @Override
    public void report(String operation, String executionId, String reason) {
        logger.warn("Monitor diagnostic: [{}] execution:[{}] {}", operation, executionId, reason);
    }
}
