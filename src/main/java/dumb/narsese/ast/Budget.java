package dumb.narsese.ast;

import dumb.narsese.util.Floats;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Empty, single (priority), double (priority, durability) or triple (priority, durability, quality) budget;
 * every component lies in [0, 1].
 */
public record Budget(List<Double> values) {
    public static final Budget EMPTY = new Budget(List.of());

    public Budget {
        values = List.copyOf(requireNonNull(values));
        if (values.size() > 3)
            throw new IllegalArgumentException("Budget takes at most 3 components: " + values);
        for (var v : values)
            if (!Floats.isUnit(v))
                throw new IllegalArgumentException("Budget component out of [0, 1]: " + v);
    }

    public static Budget of(double p) {
        return new Budget(List.of(p));
    }

    public static Budget of(double p, double d) {
        return new Budget(List.of(p, d));
    }

    public static Budget of(double p, double d, double q) {
        return new Budget(List.of(p, d, q));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "Budget" + values;
    }
}
