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

package dev.nishisan.monitor.stats.list;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Objects;

/**
 * Bounded reservoir of the most recent samples. Once full, each new sample
 * drops the oldest one.
 * <p>
 * Not thread-safe: the owning series guards it.
 *
 * @param <E> the sample type
 */
public class FixedSizeList<E extends Number> {
    private final ArrayDeque<E> samples;
    private final int capacity;
    private final String name;

    public FixedSizeList(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive.");
        }
        this.capacity = capacity;
        this.name = name;
        this.samples = new ArrayDeque<>(Math.min(capacity, 64));
    }

    public void add(E element) {
        Objects.requireNonNull(element, "element");
        if (samples.size() == capacity) {
            samples.pollFirst();
        }
        samples.addLast(element);
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public double getAverage() {
        return samples.stream()
                .mapToDouble(Number::doubleValue)
                .average()
                .orElse(0.0);
    }

    /**
     * Nearest-rank percentile over the retained samples.
     *
     * @param quantile value in {@code [0, 1]}
     * @return the percentile, or {@code 0.0} when empty
     */
    public double percentile(double quantile) {
        if (quantile < 0.0 || quantile > 1.0) {
            throw new IllegalArgumentException("quantile must be within [0, 1]");
        }
        if (samples.isEmpty()) {
            return 0.0;
        }
        double[] sorted = sortedValues();
        int rank = (int) Math.ceil(quantile * sorted.length);
        return sorted[Math.max(0, rank - 1)];
    }

    /**
     * Computes several percentiles with a single sort.
     */
    public double[] percentiles(double... quantiles) {
        double[] out = new double[quantiles.length];
        if (samples.isEmpty()) {
            return out;
        }
        double[] sorted = sortedValues();
        for (int i = 0; i < quantiles.length; i++) {
            int rank = (int) Math.ceil(quantiles[i] * sorted.length);
            out[i] = sorted[Math.max(0, Math.min(sorted.length, rank) - 1)];
        }
        return out;
    }

    public E getLastAddedElement() {
        return samples.peekLast();
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    private double[] sortedValues() {
        double[] values = samples.stream().mapToDouble(Number::doubleValue).toArray();
        Arrays.sort(values);
        return values;
    }
}
