package dumb.narsese.format;

import dumb.narsese.ast.Copula;
import dumb.narsese.ast.Punctuation;
import dumb.narsese.ast.Stamp;
import dumb.narsese.ast.TermType;
import dumb.narsese.util.Bracket;
import dumb.narsese.util.BracketDict;
import dumb.narsese.util.Lexicon;

import java.util.*;
import java.util.function.IntPredicate;

import static java.util.Objects.requireNonNull;

/**
 * Syntax profile: every literal and character class that makes up one concrete Narsese notation. Parsers and
 * formatters are driven by a profile alone, so switching notation never changes their behavior otherwise.
 * <p>
 * Instances are immutable and validated on construction.
 */
public record NarseseFormat(String name, Space space, Atom atom, Compound compound, Statement statement,
                            Sentence sentence, Task task) {

    public NarseseFormat {
        requireNonNull(name);
        requireNonNull(space);
        requireNonNull(atom);
        requireNonNull(compound);
        requireNonNull(statement);
        requireNonNull(sentence);
        requireNonNull(task);
        validate(name, space, atom, compound, statement, sentence);
    }

    private static void validate(String name, Space space, Atom atom, Compound compound, Statement statement,
                                 Sentence sentence) {
        var types = EnumSet.allOf(TermType.class);
        types.removeIf(t -> !t.isAtom());
        if (!atom.prefixes().covers(types))
            throw new IllegalArgumentException(name + ": missing atom prefixes for " + missing(types, atom.prefixes().literals()));
        types = EnumSet.allOf(TermType.class);
        types.removeIf(t -> !t.isCompound() || t.isSet());
        if (!compound.connectors().covers(types))
            throw new IllegalArgumentException(name + ": missing connectors for " + missing(types, compound.connectors().literals()));
        if (!statement.copulas().covers(EnumSet.allOf(Copula.class)))
            throw new IllegalArgumentException(name + ": missing copulas for " + missing(EnumSet.allOf(Copula.class), statement.copulas().literals()));
        if (!sentence.punctuations().covers(EnumSet.allOf(Punctuation.class)))
            throw new IllegalArgumentException(name + ": missing punctuations for " + missing(EnumSet.allOf(Punctuation.class), sentence.punctuations().literals()));

        var reserved = new LinkedHashSet<String>();
        reserved.add(compound.separator());
        for (var b : List.of(compound.brackets(), compound.setExtension(), compound.setIntension(), statement.brackets())) {
            reserved.add(b.left());
            reserved.add(b.right());
        }
        for (var c : compound.connectors().dict())
            if (reserved.contains(c))
                throw new IllegalArgumentException(name + ": connector \"" + c + "\" collides with a bracket or separator");
        for (var c : statement.copulas().dict())
            if (reserved.contains(c))
                throw new IllegalArgumentException(name + ": copula \"" + c + "\" collides with a bracket or separator");

        if (!space.stripBeforeParse()) {
            for (var r : reserved)
                if (!r.isEmpty() && atom.isIdentifier().test(r.codePointAt(0)))
                    throw new IllegalArgumentException(name + ": \"" + r + "\" starts with an identifier character");
        }
    }

    private static <K extends Enum<K>> Set<K> missing(Set<K> required, Map<K, String> present) {
        var m = new TreeSet<>(required);
        m.removeAll(present.keySet());
        return m;
    }

    @Override
    public String toString() {
        return "NarseseFormat[" + name + ']';
    }

    /**
     * @param isSpace          characters ignored between syntactic items
     * @param stripBeforeParse remove every space character before parsing, making the notation whitespace-independent
     * @param formatTerms      emitted between a term and its separator or copula neighbor
     * @param formatItems      emitted between budget, sentence, stamp and truth
     */
    public record Space(IntPredicate isSpace, boolean stripBeforeParse, String formatTerms, String formatItems) {
        public Space {
            requireNonNull(isSpace);
            requireNonNull(formatTerms);
            requireNonNull(formatItems);
        }
    }

    /**
     * Atom prefixes by atom type. The empty prefix is always registered; when no type claims it, it denotes a word.
     */
    public record Atom(Lexicon<TermType> prefixes, IntPredicate isIdentifier) {
        public Atom {
            requireNonNull(isIdentifier);
            for (var t : prefixes.literals().keySet())
                if (!t.isAtom()) throw new IllegalArgumentException("Not an atom type: " + t);
            if (!prefixes.dict().contains(""))
                throw new IllegalArgumentException("The empty atom prefix must be registered");
        }

        public static Atom of(Map<TermType, String> prefixes, IntPredicate isIdentifier) {
            var m = new EnumMap<TermType, String>(TermType.class);
            m.putAll(prefixes);
            if (!m.containsValue("")) m.putIfAbsent(TermType.WORD, "");
            return new Atom(Lexicon.of(TermType.class, m, ""), isIdentifier);
        }

        public String prefix(TermType type) {
            return prefixes.literal(type);
        }

        public Optional<TermType> typeOf(String prefix) {
            return prefixes.kindOf(prefix);
        }
    }

    /**
     * @param brackets     around connector-built compounds
     * @param separator    between connector and components, and between components
     * @param setBrackets  the two set bracket pairs as one paired dictionary
     */
    public record Compound(Bracket brackets, String separator, Bracket setExtension, Bracket setIntension,
                           BracketDict setBrackets, Lexicon<TermType> connectors) {
        public Compound {
            requireNonNull(brackets);
            requireNonNull(separator);
            requireNonNull(setExtension);
            requireNonNull(setIntension);
            if (brackets.left().isEmpty() || brackets.right().isEmpty())
                throw new IllegalArgumentException("Compound brackets must not be empty");
            if (separator.isEmpty())
                throw new IllegalArgumentException("Compound separator must not be empty");
            for (var t : connectors.literals().keySet())
                if (!t.isCompound() || t.isSet())
                    throw new IllegalArgumentException("Not a connector-built compound type: " + t);
        }

        public static Compound of(Bracket brackets, String separator, Bracket setExtension, Bracket setIntension,
                                  Map<TermType, String> connectors) {
            return new Compound(brackets, separator, setExtension, setIntension,
                    BracketDict.of(setExtension, setIntension), Lexicon.of(TermType.class, connectors));
        }

        public String connector(TermType type) {
            return connectors.literal(type);
        }

        public Bracket setBracket(TermType type) {
            return switch (type) {
                case SET_EXTENSION -> setExtension;
                case SET_INTENSION -> setIntension;
                default -> throw new IllegalArgumentException("Not a set type: " + type);
            };
        }

        /** Set type opened by the given left bracket. */
        public Optional<TermType> setType(String left) {
            if (left.equals(setExtension.left())) return Optional.of(TermType.SET_EXTENSION);
            if (left.equals(setIntension.left())) return Optional.of(TermType.SET_INTENSION);
            return Optional.empty();
        }
    }

    public record Statement(Bracket brackets, Lexicon<Copula> copulas) {
        public Statement {
            requireNonNull(brackets);
            requireNonNull(copulas);
            if (brackets.left().isEmpty() || brackets.right().isEmpty())
                throw new IllegalArgumentException("Statement brackets must not be empty");
        }

        public static Statement of(Bracket brackets, Map<Copula, String> copulas) {
            return new Statement(brackets, Lexicon.of(Copula.class, copulas));
        }

        public String copula(Copula copula) {
            return copulas.literal(copula);
        }
    }

    /**
     * Sentence tail: punctuation, stamp and truth.
     * <p>
     * With non-empty {@code stampBrackets} a stamp is written {@code left content right}, the content being one of
     * the tense literals or the fixed marker followed by a signed integer. With empty brackets the tense literals
     * and the fixed marker stand alone and {@code stampDict} holds each of them as a left literal.
     */
    public record Sentence(Lexicon<Punctuation> punctuations,
                           Bracket truthBrackets, String truthSeparator, IntPredicate isTruthContent,
                           Bracket stampBrackets, String stampPast, String stampPresent, String stampFuture,
                           String stampFixed, IntPredicate isStampContent, BracketDict stampDict) {
        public Sentence {
            requireNonNull(punctuations);
            requireNonNull(truthBrackets);
            requireNonNull(truthSeparator);
            requireNonNull(isTruthContent);
            requireNonNull(stampBrackets);
            requireNonNull(isStampContent);
            if (truthBrackets.left().isEmpty() || truthBrackets.right().isEmpty())
                throw new IllegalArgumentException("Truth brackets must not be empty");
            for (var l : List.of(stampPast, stampPresent, stampFuture, stampFixed))
                if (requireNonNull(l).isEmpty())
                    throw new IllegalArgumentException("Stamp literals must not be empty");
        }

        public static Sentence of(Map<Punctuation, String> punctuations,
                                  Bracket truthBrackets, String truthSeparator, IntPredicate isTruthContent,
                                  Bracket stampBrackets, String past, String present, String future, String fixed,
                                  IntPredicate isStampContent) {
            var stamps = stampBrackets.isEmpty()
                    ? BracketDict.of(Bracket.of(past, ""), Bracket.of(present, ""), Bracket.of(future, ""), Bracket.of(fixed, ""))
                    : BracketDict.of(stampBrackets);
            return new Sentence(Lexicon.of(Punctuation.class, punctuations),
                    truthBrackets, truthSeparator, isTruthContent,
                    stampBrackets, past, present, future, fixed, isStampContent, stamps);
        }

        public String punctuation(Punctuation p) {
            return punctuations.literal(p);
        }

        /** The stamp as written; empty for eternal. */
        public String stamp(Stamp stamp) {
            if (stamp instanceof Stamp.Fixed f) return stampBrackets.wrap(stampFixed + f.time());
            return switch ((Stamp.Tense) stamp) {
                case ETERNAL -> "";
                case PAST -> stampBrackets.wrap(stampPast);
                case PRESENT -> stampBrackets.wrap(stampPresent);
                case FUTURE -> stampBrackets.wrap(stampFuture);
            };
        }
    }

    public record Task(Bracket budgetBrackets, String budgetSeparator, IntPredicate isBudgetContent) {
        public Task {
            requireNonNull(budgetBrackets);
            requireNonNull(budgetSeparator);
            requireNonNull(isBudgetContent);
            if (budgetBrackets.left().isEmpty() || budgetBrackets.right().isEmpty())
                throw new IllegalArgumentException("Budget brackets must not be empty");
        }
    }
}
