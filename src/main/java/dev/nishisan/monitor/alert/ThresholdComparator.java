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

/**
 * Comparison applied between an aggregated metric value and a rule threshold.
 */
public enum ThresholdComparator {
    GREATER_THAN(">", "gt"),
    GREATER_OR_EQUAL(">=", "gte"),
    LESS_THAN("<", "lt"),
    LESS_OR_EQUAL("<=", "lte"),
    EQUAL("==", "eq");

    private final String symbol;
    private final String alias;

    ThresholdComparator(String symbol, String alias) {
        this.symbol = symbol;
        this.alias = alias;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return {@code true} if {@code value <op> threshold} holds. {@code NaN}
     *         never satisfies any comparison.
     */
    public boolean test(double value, double threshold) {
        if (Double.isNaN(value)) {
            return false;
        }
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case GREATER_OR_EQUAL -> value >= threshold;
            case LESS_THAN -> value < threshold;
            case LESS_OR_EQUAL -> value <= threshold;
            case EQUAL -> Double.compare(value, threshold) == 0;
        };
    }

    /**
     * Resolves a comparator from its symbol ({@code >=}), its short alias
     * ({@code gte}, handy in YAML where a leading {@code >} needs quoting) or its
     * constant name ({@code GREATER_OR_EQUAL}).
     */
    public static ThresholdComparator fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Comparator must not be blank");
        }
        String trimmed = symbol.trim();
        for (ThresholdComparator comparator : values()) {
            if (comparator.symbol.equals(trimmed) || comparator.alias.equalsIgnoreCase(trimmed)
                    || comparator.name().equalsIgnoreCase(trimmed)) {
                return comparator;
            }
        }
        throw new IllegalArgumentException("Unknown comparator: " + symbol);
    }
}
