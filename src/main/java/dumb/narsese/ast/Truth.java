package dumb.narsese.ast;

import dumb.narsese.util.Floats;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Empty, single (frequency) or double (frequency, confidence) truth value; every component lies in [0, 1].
 */
public record Truth(List<Double> values) {
    public static final Truth EMPTY = new Truth(List.of());

    public Truth {
        values = List.copyOf(requireNonNull(values));
        if (values.size() > 2)
            throw new IllegalArgumentException("Truth takes at most 2 components: " + values);
        for (var v : values)
            if (!Floats.isUnit(v))
                throw new IllegalArgumentException("Truth component out of [0, 1]: " + v);
    }

    public static Truth of(double f) {
        return new Truth(List.of(f));
    }

    public static Truth of(double f, double c) {
        return new Truth(List.of(f, c));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "Truth" + values;
    }
}
