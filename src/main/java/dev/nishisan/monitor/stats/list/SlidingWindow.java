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

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Time-bucketed sliding window over a stream of values.
 * <p>
 * The window is split into a fixed ring of buckets. A sample lands in the bucket
 * of its timestamp; a bucket is reused (and cleared) once its slot comes round
 * again. Memory is constant regardless of the sample rate and totals are
 * accurate to one bucket width.
 * <p>
 * Not thread-safe: the owner guards it.
 */
public class SlidingWindow {

    private final long bucketWidthMillis;
    private final long[] bucketIndex;
    private final long[] counts;
    private final double[] sums;
    private final double[] maxes;

    /**
     * @param window      total span covered by the window
     * @param bucketCount number of buckets the span is split into
     */
    public SlidingWindow(Duration window, int bucketCount) {
        Objects.requireNonNull(window, "window");
        if (bucketCount <= 0) {
            throw new IllegalArgumentException("bucketCount must be positive");
        }
        long windowMillis = window.toMillis();
        if (windowMillis < bucketCount) {
            throw new IllegalArgumentException("window must be at least " + bucketCount + "ms");
        }
        this.bucketWidthMillis = windowMillis / bucketCount;
        this.bucketIndex = new long[bucketCount];
        this.counts = new long[bucketCount];
        this.sums = new double[bucketCount];
        this.maxes = new double[bucketCount];
        Arrays.fill(bucketIndex, Long.MIN_VALUE);
    }

    public void add(long nowMillis, double value) {
        long index = Math.floorDiv(nowMillis, bucketWidthMillis);
        int slot = (int) Math.floorMod(index, (long) bucketIndex.length);
        if (bucketIndex[slot] != index) {
            bucketIndex[slot] = index;
            counts[slot] = 0;
            sums[slot] = 0.0;
            maxes[slot] = Double.NEGATIVE_INFINITY;
        }
        counts[slot]++;
        sums[slot] += value;
        if (value > maxes[slot]) {
            maxes[slot] = value;
        }
    }

    /**
     * Sums every bucket still inside the window ending at {@code nowMillis}.
     */
    public Totals totals(long nowMillis) {
        long current = Math.floorDiv(nowMillis, bucketWidthMillis);
        long oldest = current - bucketIndex.length + 1;
        long count = 0;
        double sum = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        for (int slot = 0; slot < bucketIndex.length; slot++) {
            long index = bucketIndex[slot];
            if (index < oldest || index > current) {
                continue;
            }
            count += counts[slot];
            sum += sums[slot];
            max = Math.max(max, maxes[slot]);
        }
        return new Totals(count, sum, count == 0 ? Double.NaN : max);
    }

    public long bucketWidthMillis() {
        return bucketWidthMillis;
    }

    /**
     * Window totals. {@code max} is {@code NaN} when {@code count} is zero.
     */
    public record Totals(long count, double sum, double max) {

        public double average() {
            return count == 0 ? Double.NaN : sum / count;
        }
    }
}
