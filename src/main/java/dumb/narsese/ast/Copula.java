package dumb.narsese.ast;

import java.util.Optional;

/**
 * Statement copulas as written. Three of them are shorthand for an inheritance with set-wrapped operands, and the
 * retrospective equivalence is stored as a predictive one with its operands swapped.
 */
public enum Copula {
    INHERITANCE,
    SIMILARITY,
    IMPLICATION,
    EQUIVALENCE,
    INSTANCE,
    PROPERTY,
    INSTANCE_PROPERTY,
    IMPLICATION_PREDICTIVE,
    IMPLICATION_CONCURRENT,
    IMPLICATION_RETROSPECTIVE,
    EQUIVALENCE_PREDICTIVE,
    EQUIVALENCE_CONCURRENT,
    EQUIVALENCE_RETROSPECTIVE;

    public Term.Statement apply(Term subject, Term predicate) {
        return switch (this) {
            case INSTANCE -> Term.inheritance(Term.setExtension(subject), predicate);
            case PROPERTY -> Term.inheritance(subject, Term.setIntension(predicate));
            case INSTANCE_PROPERTY -> Term.inheritance(Term.setExtension(subject), Term.setIntension(predicate));
            case EQUIVALENCE_RETROSPECTIVE -> Term.statement(TermType.EQUIVALENCE_PREDICTIVE, predicate, subject);
            default -> Term.statement(type().orElseThrow(), subject, predicate);
        };
    }

    /**
     * The statement type this copula produces directly; empty for the shorthand forms.
     */
    public Optional<TermType> type() {
        return switch (this) {
            case INHERITANCE -> Optional.of(TermType.INHERITANCE);
            case SIMILARITY -> Optional.of(TermType.SIMILARITY);
            case IMPLICATION -> Optional.of(TermType.IMPLICATION);
            case EQUIVALENCE -> Optional.of(TermType.EQUIVALENCE);
            case IMPLICATION_PREDICTIVE -> Optional.of(TermType.IMPLICATION_PREDICTIVE);
            case IMPLICATION_CONCURRENT -> Optional.of(TermType.IMPLICATION_CONCURRENT);
            case IMPLICATION_RETROSPECTIVE -> Optional.of(TermType.IMPLICATION_RETROSPECTIVE);
            case EQUIVALENCE_PREDICTIVE -> Optional.of(TermType.EQUIVALENCE_PREDICTIVE);
            case EQUIVALENCE_CONCURRENT -> Optional.of(TermType.EQUIVALENCE_CONCURRENT);
            case INSTANCE, PROPERTY, INSTANCE_PROPERTY, EQUIVALENCE_RETROSPECTIVE -> Optional.empty();
        };
    }

    public static Copula of(TermType type) {
        return switch (type) {
            case INHERITANCE -> INHERITANCE;
            case SIMILARITY -> SIMILARITY;
            case IMPLICATION -> IMPLICATION;
            case EQUIVALENCE -> EQUIVALENCE;
            case IMPLICATION_PREDICTIVE -> IMPLICATION_PREDICTIVE;
            case IMPLICATION_CONCURRENT -> IMPLICATION_CONCURRENT;
            case IMPLICATION_RETROSPECTIVE -> IMPLICATION_RETROSPECTIVE;
            case EQUIVALENCE_PREDICTIVE -> EQUIVALENCE_PREDICTIVE;
            case EQUIVALENCE_CONCURRENT -> EQUIVALENCE_CONCURRENT;
            default -> throw new IllegalArgumentException("Not a statement type: " + type);
        };
    }
}
