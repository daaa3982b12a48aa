package dumb.narsese.ast;

public sealed interface Stamp permits Stamp.Tense, Stamp.Fixed {

    static Stamp eternal() {
        return Tense.ETERNAL;
    }

    static Stamp fixed(long time) {
        return new Fixed(time);
    }

    default boolean isEternal() {
        return this == Tense.ETERNAL;
    }

    enum Tense implements Stamp {
        ETERNAL, PAST, PRESENT, FUTURE
    }

    /** Occurrence at an absolute time, which may be negative. */
    record Fixed(long time) implements Stamp {
    }
}
