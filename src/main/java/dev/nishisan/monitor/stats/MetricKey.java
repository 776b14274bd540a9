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

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Identity of a metric series: its name plus its label set. Labels are kept
 * sorted so that {@code {a=1,b=2}} and {@code {b=2,a=1}} address the same series.
 *
 * @param name   metric name, never blank
 * @param labels sorted, unmodifiable label set
 */
public record MetricKey(String name, Map<String, String> labels) implements Comparable<MetricKey> {

    public MetricKey {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be blank");
        }
        if (labels == null || labels.isEmpty()) {
            labels = Map.of();
        } else {
            TreeMap<String, String> sorted = new TreeMap<>();
            labels.forEach((k, v) -> sorted.put(Objects.requireNonNull(k, "label name"),
                    Objects.requireNonNull(v, "label value")));
            labels = Collections.unmodifiableSortedMap(sorted);
        }
    }

    public static MetricKey of(String name) {
        return new MetricKey(name, Map.of());
    }

    public static MetricKey of(String name, Map<String, String> labels) {
        return new MetricKey(name, labels);
    }

    /**
     * @return {@code true} if every entry of {@code filter} is present in this key's labels
     */
    public boolean matches(Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            if (!entry.getValue().equals(labels.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(MetricKey other) {
        int byName = name.compareTo(other.name);
        if (byName != 0) {
            return byName;
        }
        Iterator<Map.Entry<String, String>> mine = labels.entrySet().iterator();
        Iterator<Map.Entry<String, String>> theirs = other.labels.entrySet().iterator();
        while (mine.hasNext() && theirs.hasNext()) {
            Map.Entry<String, String> a = mine.next();
            Map.Entry<String, String> b = theirs.next();
            int byLabel = a.getKey().compareTo(b.getKey());
            if (byLabel != 0) {
                return byLabel;
            }
            int byValue = a.getValue().compareTo(b.getValue());
            if (byValue != 0) {
                return byValue;
            }
        }
        return Integer.compare(labels.size(), other.labels.size());
    }

    /**
     * Prometheus-like rendering, e.g. {@code agent_execution_error{agent_id=a1}}.
     */
    @Override
    public String toString() {
        if (labels.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        boolean first = true;
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }
}
