package com.jay.proforma.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.jay.proforma.exception.ScheduleLookupException;

import java.util.Arrays;

/**
 * Immutable per-period values indexed by month (0 = acquisition). Every read is bounds-checked:
 * asking for a period the series does not hold fails instead of reading as zero.
 */
public final class PeriodSeries {

    private final String name;
    private final double[] values;

    public PeriodSeries(String name, double[] values) {
        this.name = name;
        this.values = values.clone();
    }

    public double get(int period) {
        if (period < 0 || period >= values.length) {
            throw new ScheduleLookupException(name, period, values.length);
        }
        return values[period];
    }

    public int size() {
        return values.length;
    }

    public String name() {
        return name;
    }

    /** Sum of periods {@code from} through {@code to}, both inclusive. */
    public double sum(int from, int to) {
        double total = 0;
        for (int t = from; t <= to; t++) total += get(t);
        return total;
    }

    @JsonValue
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PeriodSeries other && name.equals(other.name) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return name + "[" + values.length + " periods]";
    }
}
