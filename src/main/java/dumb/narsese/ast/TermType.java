package dumb.narsese.ast;

import static dumb.narsese.ast.TermCapacity.*;
import static dumb.narsese.ast.TermCategory.COMPOUND;
import static dumb.narsese.ast.TermCategory.STATEMENT;

public enum TermType {
    WORD(TermCategory.ATOM, ATOM),
    PLACEHOLDER(TermCategory.ATOM, ATOM),
    VARIABLE_INDEPENDENT(TermCategory.ATOM, ATOM),
    VARIABLE_DEPENDENT(TermCategory.ATOM, ATOM),
    VARIABLE_QUERY(TermCategory.ATOM, ATOM),
    INTERVAL(TermCategory.ATOM, ATOM),
    OPERATOR(TermCategory.ATOM, ATOM),

    SET_EXTENSION(COMPOUND, SET),
    SET_INTENSION(COMPOUND, SET),
    INTERSECTION_EXTENSION(COMPOUND, SET),
    INTERSECTION_INTENSION(COMPOUND, SET),
    DIFFERENCE_EXTENSION(COMPOUND, BINARY_VEC),
    DIFFERENCE_INTENSION(COMPOUND, BINARY_VEC),
    PRODUCT(COMPOUND, VEC),
    IMAGE_EXTENSION(COMPOUND, VEC),
    IMAGE_INTENSION(COMPOUND, VEC),
    CONJUNCTION(COMPOUND, SET),
    DISJUNCTION(COMPOUND, SET),
    NEGATION(COMPOUND, UNARY),
    CONJUNCTION_SEQUENTIAL(COMPOUND, VEC),
    CONJUNCTION_PARALLEL(COMPOUND, SET),

    INHERITANCE(STATEMENT, BINARY_VEC),
    SIMILARITY(STATEMENT, BINARY_SET),
    IMPLICATION(STATEMENT, BINARY_VEC),
    EQUIVALENCE(STATEMENT, BINARY_SET),
    IMPLICATION_PREDICTIVE(STATEMENT, BINARY_VEC),
    IMPLICATION_CONCURRENT(STATEMENT, BINARY_VEC),
    IMPLICATION_RETROSPECTIVE(STATEMENT, BINARY_VEC),
    EQUIVALENCE_PREDICTIVE(STATEMENT, BINARY_VEC),
    EQUIVALENCE_CONCURRENT(STATEMENT, BINARY_SET);

    private final TermCategory category;
    private final TermCapacity capacity;

    TermType(TermCategory category, TermCapacity capacity) {
        this.category = category;
        this.capacity = capacity;
    }

    public TermCategory category() {
        return category;
    }

    public TermCapacity capacity() {
        return capacity;
    }

    public boolean isAtom() {
        return category == TermCategory.ATOM;
    }

    public boolean isCompound() {
        return category == COMPOUND;
    }

    public boolean isStatement() {
        return category == STATEMENT;
    }

    public boolean isImage() {
        return this == IMAGE_EXTENSION || this == IMAGE_INTENSION;
    }

    /** Extension and intension sets, written with their own brackets instead of a connector. */
    public boolean isSet() {
        return this == SET_EXTENSION || this == SET_INTENSION;
    }
}
