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

package dev.nishisan.monitor;

import dev.nishisan.monitor.alert.AlertRule;
import dev.nishisan.monitor.alert.AlertSeverity;
import dev.nishisan.monitor.alert.RuleAggregation;
import dev.nishisan.monitor.alert.ThresholdComparator;

import java.util.List;
import java.util.Map;

/**
 * Metric names and labels reported by the agent service request handlers,
 * and the alert rules installed by default on top of them.
 * <p>
 * These keys are designed to be used with
 * {@link MonitoringService#recordMetric}:
 * <ul>
 * <li><b>Counters</b>: one increment per event</li>
 * <li><b>Timers</b>: end-to-end latency in milliseconds</li>
 * </ul>
 */
public final class AgentMetrics {

    private AgentMetrics() {
    }

    // ── Counters ───────────────────────────────────────────────────────

    /** Incremented when an agent request starts executing. */
    public static final String EXECUTION_STARTED = "agent_execution_started";

    /** Incremented when an agent request completes. */
    public static final String EXECUTION_SUCCESS = "agent_execution_success";

    /** Incremented when an agent request fails, labelled with the error type. */
    public static final String EXECUTION_ERROR = "agent_execution_error";

    /** Incremented when text-to-speech produced audio. */
    public static final String VOICE_SYNTHESIS_SUCCESS = "voice_synthesis_success";

    /** Incremented when text-to-speech failed or returned nothing. */
    public static final String VOICE_SYNTHESIS_FAILURE = "voice_synthesis_failure";

    /** Incremented for requests executed in simulation mode. */
    public static final String SIMULATION_EXECUTION = "simulation_execution";

    /** Incremented per failure, labelled with its category. */
    public static final String ERROR_BY_CATEGORY = "error_by_category";

    // ── Timers ─────────────────────────────────────────────────────────

    /** End-to-end agent response time in milliseconds. */
    public static final String RESPONSE_TIME_MS = "agent_response_time_ms";

    // ── Labels ─────────────────────────────────────────────────────────

    public static final String LABEL_AGENT_ID = "agent_id";
    public static final String LABEL_ERROR_TYPE = "error_type";
    public static final String LABEL_CATEGORY = "category";
    public static final String LABEL_SUCCESS = "success";

    // ── Default rules ──────────────────────────────────────────────────

    public static final String RULE_EXECUTION_ERRORS = "agent_execution_errors";
    public static final String RULE_SLOW_RESPONSES = "slow_agent_responses";
    public static final String RULE_VOICE_FAILURES = "voice_synthesis_failures";
    public static final String RULE_ERROR_BURST = "error_burst";

    /** Average response time above which responses count as slow. */
    public static final double SLOW_RESPONSE_THRESHOLD_MS = 30_000;

    public static Map<String, String> agent(String agentId) {
        return Map.of(LABEL_AGENT_ID, agentId);
    }

    /**
     * The built-in rule set:
     * <ul>
     * <li>any execution error within 5 minutes raises a WARNING</li>
     * <li>an average response time above 30s raises a WARNING</li>
     * <li>5 or more voice synthesis failures within 5 minutes raise a CRITICAL</li>
     * <li>10 or more categorized errors within 5 minutes raise a CRITICAL</li>
     * </ul>
     */
    public static List<AlertRule> defaultRules() {
        return List.of(
                AlertRule.of(RULE_EXECUTION_ERRORS, EXECUTION_ERROR,
                        ThresholdComparator.GREATER_OR_EQUAL, 1, AlertSeverity.WARNING),
                AlertRule.of(RULE_SLOW_RESPONSES, RESPONSE_TIME_MS,
                        ThresholdComparator.GREATER_THAN, SLOW_RESPONSE_THRESHOLD_MS, AlertSeverity.WARNING)
                        .withAggregation(RuleAggregation.AVERAGE),
                AlertRule.of(RULE_VOICE_FAILURES, VOICE_SYNTHESIS_FAILURE,
                        ThresholdComparator.GREATER_OR_EQUAL, 5, AlertSeverity.CRITICAL),
                AlertRule.of(RULE_ERROR_BURST, ERROR_BY_CATEGORY,
                        ThresholdComparator.GREATER_OR_EQUAL, 10, AlertSeverity.CRITICAL)
                        .withAggregation(RuleAggregation.SUM));
    }
}
