package dumb.narsese.ast;

/**
 * How many components a term holds and whether their order matters.
 */
public enum TermCapacity {
    ATOM(1, true),
    UNARY(1, true),
    BINARY_VEC(2, true),
    BINARY_SET(2, false),
    VEC(3, true),
    SET(3, false);

    private final int baseNumber;
    private final boolean ordered;

    TermCapacity(int baseNumber, boolean ordered) {
        this.baseNumber = baseNumber;
        this.ordered = ordered;
    }

    /**
     * 1 for atoms and unary forms, 2 for binary forms, 3 for open-ended ones. Usable for ordering by arity class.
     */
    public int baseNumber() {
        return baseNumber;
    }

    public boolean ordered() {
        return ordered;
    }

    public boolean isBinary() {
        return baseNumber == 2;
    }
}
