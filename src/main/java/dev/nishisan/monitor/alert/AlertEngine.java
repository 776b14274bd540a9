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

import dev.nishisan.monitor.common.MonitorStateException;
import dev.nishisan.monitor.stats.MetricListener;
import dev.nishisan.monitor.stats.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Threshold alert engine fed by the {@link dev.nishisan.monitor.stats.MetricStore}.
 *
 * <h2>Evaluation</h2>
 * <ul>
 * <li>Every accepted metric update evaluates only the rules bound to that
 * metric name whose label filter matches the series.</li>
 * <li>A crossed rule with no unresolved alert raises one; a crossed rule with
 * an unresolved alert refreshes it in place; a rule no longer crossed
 * resolves it.</li>
 * <li>{@link #evaluateAll()} re-checks every rule against its window without a
 * new sample, which is how windowed aggregates on counters decay and their
 * alerts resolve.</li>
 * </ul>
 * <p>
 * The rule set is fixed at build time. Each rule carries its own lock; listener
 * callbacks run after it is released.
 */
public final class AlertEngine implements MetricListener {

    private static final Logger logger = LoggerFactory.getLogger(AlertEngine.class);

    private final Clock clock;
    private final Duration activeWindow;
    private final List<RuleState> states;
    private final Map<String, List<RuleState>> byMetric;
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();

    private AlertEngine(Builder builder) {
        this.clock = builder.clock;
        this.activeWindow = builder.activeWindow;
        long lockTimeoutNanos = builder.lockTimeout.toNanos();
        List<RuleState> all = new ArrayList<>(builder.rules.size());
        Map<String, List<RuleState>> index = new HashMap<>();
        for (AlertRule rule : builder.rules) {
            RuleState state = new RuleState(rule, lockTimeoutNanos);
            all.add(state);
            index.computeIfAbsent(rule.metricName(), k -> new ArrayList<>()).add(state);
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        this.states = List.copyOf(all);
        this.byMetric = Map.copyOf(index);
    }

    @Override
    public void onMetricRecorded(MetricSample sample) {
        List<RuleState> bound = byMetric.get(sample.key().name());
        if (bound == null) {
            return;
        }
        for (RuleState state : bound) {
            if (sample.key().matches(state.rule().labelFilter())) {
                dispatch(state.evaluate(sample, sample.recordedAt()));
            }
        }
    }

    /**
     * Re-evaluates every rule against its current window.
     *
     * @return number of alerts resolved by this pass
     */
    public int evaluateAll() {
        Instant now = clock.instant();
        int resolvedCount = 0;
        for (RuleState state : states) {
            RuleState.Transition transition = state.evaluate(null, now);
            if (transition.kind() == RuleState.Transition.Kind.RESOLVED) {
                resolvedCount++;
            }
            dispatch(transition);
        }
        return resolvedCount;
    }

    /**
     * Unresolved alerts triggered within {@code window} of now, newest first.
     */
    public List<Alert> activeAlerts(Duration window) {
        Objects.requireNonNull(window, "window");
        Instant since = clock.instant().minus(window);
        List<Alert> active = new ArrayList<>();
        for (RuleState state : states) {
            Alert alert = state.current();
            if (alert != null && !alert.timestamp().isBefore(since)) {
                active.add(alert);
            }
        }
        active.sort(Comparator.comparing(Alert::timestamp).reversed().thenComparing(Alert::ruleName));
        return List.copyOf(active);
    }

    /**
     * Unresolved alerts within the configured active window.
     */
    public List<Alert> activeAlerts() {
        return activeAlerts(activeWindow);
    }

    /**
     * Every alert still held, resolved ones included, newest first.
     */
    public List<Alert> alertHistory() {
        List<Alert> all = new ArrayList<>();
        for (RuleState state : states) {
            all.addAll(state.history());
        }
        all.sort(Comparator.comparing(Alert::timestamp).reversed().thenComparing(Alert::ruleName));
        return List.copyOf(all);
    }

    public List<AlertRule> rules() {
        List<AlertRule> rules = new ArrayList<>(states.size());
        states.forEach(state -> rules.add(state.rule()));
        return rules;
    }

    public Duration activeWindow() {
        return activeWindow;
    }

    /**
     * Registers an alert listener.
     *
     * @param listener the listener to add
     */
    public void addListener(AlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     */
    public void removeListener(AlertListener listener) {
        listeners.remove(listener);
    }

    /**
     * Returns the number of currently registered listeners.
     *
     * @return the listener count
     */
    public int listenerCount() {
        return listeners.size();
    }

    private void dispatch(RuleState.Transition transition) {
        Alert alert = transition.alert();
        switch (transition.kind()) {
            case RAISED -> {
                logger.info("[ALERT] {} {}: {}", alert.severity(), alert.ruleName(), alert.message());
                for (AlertListener listener : listeners) {
                    try {
                        listener.onAlertRaised(alert);
                    } catch (MonitorStateException e) {
                        throw e;
                    } catch (RuntimeException e) {
                        logger.warn("Alert listener threw exception", e);
                    }
                }
            }
            case RESOLVED -> {
                logger.info("[ALERT RESOLVED] {} {}: value {}", alert.severity(), alert.ruleName(), alert.value());
                for (AlertListener listener : listeners) {
                    try {
                        listener.onAlertResolved(alert);
                    } catch (MonitorStateException e) {
                        throw e;
                    } catch (RuntimeException e) {
                        logger.warn("Alert listener threw exception", e);
                    }
                }
            }
            case UPDATED -> logger.debug("Alert [{}] refreshed: {}", alert.ruleName(), alert.message());
            default -> {
            }
        }
    }

    // ── Builder ──

    /**
     * Creates a builder for an alert engine.
     *
     * @param clock time source for windows and alert timestamps
     * @return the builder
     */
    public static Builder builder(Clock clock) {
        return new Builder(clock);
    }

    /**
     * Builder for {@link AlertEngine}.
     */
    public static final class Builder {
        private final Clock clock;
        private final List<AlertRule> rules = new ArrayList<>();
        private Duration activeWindow = Duration.ofHours(1);
        private Duration lockTimeout = Duration.ofSeconds(5);

        private Builder(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
        }

        /**
         * Adds a rule.
         *
         * @param rule the rule
         * @return this builder
         */
        public Builder rule(AlertRule rule) {
            rules.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        /**
         * Adds several rules.
         *
         * @param rules the rules
         * @return this builder
         */
        public Builder rules(Collection<AlertRule> rules) {
            rules.forEach(this::rule);
            return this;
        }

        /**
         * Sets the default look-back of {@link AlertEngine#activeAlerts()}.
         *
         * @param window the window
         * @return this builder
         */
        public Builder activeWindow(Duration window) {
            this.activeWindow = Objects.requireNonNull(window, "window");
            return this;
        }

        /**
         * Sets the maximum wait for a rule lock.
         *
         * @param timeout the timeout
         * @return this builder
         */
        public Builder lockTimeout(Duration timeout) {
            this.lockTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        /**
         * Builds the alert engine.
         *
         * @return the engine
         */
        public AlertEngine build() {
            Set<String> names = new HashSet<>();
            for (AlertRule rule : rules) {
                if (!names.add(rule.name())) {
                    throw new IllegalArgumentException("Duplicate alert rule name: " + rule.name());
                }
            }
            if (activeWindow.isNegative() || activeWindow.isZero()) {
                throw new IllegalArgumentException("activeWindow must be positive");
            }
            if (lockTimeout.isNegative() || lockTimeout.isZero()) {
                throw new IllegalArgumentException("lockTimeout must be positive");
            }
            return new AlertEngine(this);
        }
    }
}
