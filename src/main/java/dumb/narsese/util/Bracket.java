package dumb.narsese.util;

import static java.util.Objects.requireNonNull;

/**
 * A left/right literal pair, e.g. {@code "{"}/{@code "}"} or the empty pair {@code ""}/{@code ""}.
 */
public record Bracket(String left, String right) {
    public static final Bracket NONE = new Bracket("", "");

    public Bracket {
        requireNonNull(left);
        requireNonNull(right);
    }

    public static Bracket of(String left, String right) {
        return new Bracket(left, right);
    }

    public boolean isEmpty() {
        return left.isEmpty() && right.isEmpty();
    }

    public String wrap(String content) {
        return left + content + right;
    }

    @Override
    public String toString() {
        return left + "…" + right;
    }
}
