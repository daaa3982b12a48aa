package dumb.narsese.ast;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.narsese.util.Json;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Typed Narsese term. Compounds and statements whose capacity is unordered compare as sets; everything else
 * compares structurally.
 */
sealed public interface Term extends Narsese permits Term.Atom, Term.Compound, Term.Image, Term.Statement {

    Atom PLACEHOLDER = new Atom(TermType.PLACEHOLDER, "");

    static Atom atom(TermType type, String name) {
        return type == TermType.PLACEHOLDER && name.isEmpty() ? PLACEHOLDER : new Atom(type, name);
    }

    static Atom word(String name) {
        return new Atom(TermType.WORD, name);
    }

    static Atom placeholder() {
        return PLACEHOLDER;
    }

    static Atom variableIndependent(String name) {
        return new Atom(TermType.VARIABLE_INDEPENDENT, name);
    }

    static Atom variableDependent(String name) {
        return new Atom(TermType.VARIABLE_DEPENDENT, name);
    }

    static Atom variableQuery(String name) {
        return new Atom(TermType.VARIABLE_QUERY, name);
    }

    static Atom interval(long steps) {
        return new Atom(TermType.INTERVAL, Long.toString(steps));
    }

    static Atom operator(String name) {
        return new Atom(TermType.OPERATOR, name);
    }

    static Compound compound(TermType type, Term... components) {
        return new Compound(type, List.of(components));
    }

    static Compound compound(TermType type, List<? extends Term> components) {
        return new Compound(type, components);
    }

    static Compound setExtension(Term... components) {
        return compound(TermType.SET_EXTENSION, components);
    }

    static Compound setIntension(Term... components) {
        return compound(TermType.SET_INTENSION, components);
    }

    static Compound product(Term... components) {
        return compound(TermType.PRODUCT, components);
    }

    static Compound negation(Term t) {
        return compound(TermType.NEGATION, t);
    }

    static Image image(TermType type, int index, Term... components) {
        return new Image(type, index, List.of(components));
    }

    static Statement statement(TermType type, Term subject, Term predicate) {
        return new Statement(type, subject, predicate);
    }

    static Statement inheritance(Term subject, Term predicate) {
        return statement(TermType.INHERITANCE, subject, predicate);
    }

    static Statement similarity(Term subject, Term predicate) {
        return statement(TermType.SIMILARITY, subject, predicate);
    }

    static Statement implication(Term subject, Term predicate) {
        return statement(TermType.IMPLICATION, subject, predicate);
    }

    static Statement equivalence(Term subject, Term predicate) {
        return statement(TermType.EQUIVALENCE, subject, predicate);
    }

    TermType type();

    /**
     * Direct sub-terms: empty for atoms, subject and predicate for statements, the stored components (without the
     * placeholder) for images.
     */
    List<Term> components();

    default TermCategory category() {
        return type().category();
    }

    default TermCapacity capacity() {
        return type().capacity();
    }

    /**
     * @throws IllegalStateException on anything but an atom
     */
    default String name() {
        throw new IllegalStateException("Not an atom: " + this);
    }

    default JsonNode toJson() {
        var o = Json.node().put("type", type().name().toLowerCase(Locale.ROOT));
        if (this instanceof Atom a) {
            o.put("name", a.name());
        } else if (this instanceof Statement s) {
            o.set("subject", s.subject().toJson());
            o.set("predicate", s.predicate().toJson());
        } else {
            if (this instanceof Image i) o.put("placeholderIndex", i.index());
            var c = o.putArray("components");
            components().forEach(t -> c.add(t.toJson()));
        }
        return o;
    }

    record Atom(TermType type, String name) implements Term {
        public Atom {
            requireNonNull(type);
            requireNonNull(name);
            if (!type.isAtom())
                throw new IllegalArgumentException("Not an atom type: " + type);
            if (type == TermType.PLACEHOLDER) {
                if (!name.isEmpty())
                    throw new IllegalArgumentException("Placeholder cannot be named: " + name);
            } else if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty name for " + type);
            } else if (type == TermType.INTERVAL) {
                name = Long.toString(parseInterval(name));
            }
        }

        private static long parseInterval(String name) {
            for (var i = 0; i < name.length(); i++)
                if (!Character.isDigit(name.charAt(i)))
                    throw new IllegalArgumentException("Interval is not a natural number: " + name);
            try {
                return Long.parseLong(name);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Interval is not a natural number: " + name, e);
            }
        }

        public long interval() {
            if (type != TermType.INTERVAL) throw new IllegalStateException("Not an interval: " + this);
            return Long.parseLong(name);
        }

        @Override
        public List<Term> components() {
            return List.of();
        }

        @Override
        public String toString() {
            return type + "[" + name + ']';
        }
    }

    /**
     * Connector-built compound other than an image. Set-capacity compounds drop duplicates, keeping first occurrences.
     */
    final class Compound implements Term {
        private final TermType type;
        private final List<Term> components;
        private final int hash;

        public Compound(TermType type, List<? extends Term> components) {
            requireNonNull(type);
            if (!type.isCompound() || type.isImage())
                throw new IllegalArgumentException("Not a plain compound type: " + type);
            var list = List.<Term>copyOf(components);
            var capacity = type.capacity();
            if (capacity == TermCapacity.SET)
                list = List.copyOf(new LinkedHashSet<>(list));
            var arity = switch (capacity) {
                case UNARY -> list.size() == 1;
                case BINARY_VEC, BINARY_SET -> list.size() == 2;
                default -> !list.isEmpty();
            };
            if (!arity)
                throw new IllegalArgumentException(type + " cannot hold " + list.size() + " components");
            this.type = type;
            this.components = list;
            this.hash = 31 * type.hashCode() + (capacity.ordered() ? list.hashCode() : Set.copyOf(list).hashCode());
        }

        @Override
        public TermType type() {
            return type;
        }

        @Override
        public List<Term> components() {
            return components;
        }

        public int size() {
            return components.size();
        }

        public Term get(int index) {
            return components.get(index);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Compound that) || type != that.type || hash != that.hash) return false;
            return type.capacity().ordered()
                    ? components.equals(that.components)
                    : components.size() == that.components.size() && Set.copyOf(components).equals(Set.copyOf(that.components));
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return type + components.toString();
        }
    }

    /**
     * Extension or intension image. {@code index} is where the placeholder sits among the components, and may equal
     * their count (trailing placeholder).
     */
    record Image(TermType type, int index, List<Term> components) implements Term {
        public Image {
            requireNonNull(type);
            if (!type.isImage())
                throw new IllegalArgumentException("Not an image type: " + type);
            components = List.copyOf(components);
            if (index < 0 || index > components.size())
                throw new IllegalArgumentException("Placeholder index " + index + " outside 0.." + components.size());
        }

        /** Components with the placeholder re-inserted at its index. */
        public List<Term> withPlaceholder() {
            var all = new ArrayList<>(components);
            all.add(index, PLACEHOLDER);
            return Collections.unmodifiableList(all);
        }

        @Override
        public String toString() {
            return type + withPlaceholder().toString();
        }
    }

    /**
     * Binary statement. Symmetric types (similarity, equivalence, concurrent equivalence) ignore operand order.
     */
    record Statement(TermType type, Term subject, Term predicate) implements Term {
        public Statement {
            requireNonNull(type);
            requireNonNull(subject);
            requireNonNull(predicate);
            if (!type.isStatement())
                throw new IllegalArgumentException("Not a statement type: " + type);
        }

        public boolean symmetric() {
            return type.capacity() == TermCapacity.BINARY_SET;
        }

        public Copula copula() {
            return Copula.of(type);
        }

        @Override
        public List<Term> components() {
            return List.of(subject, predicate);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Statement that) || type != that.type) return false;
            return (subject.equals(that.subject) && predicate.equals(that.predicate))
                    || (symmetric() && subject.equals(that.predicate) && predicate.equals(that.subject));
        }

        @Override
        public int hashCode() {
            return 31 * type.hashCode() + (symmetric()
                    ? subject.hashCode() + predicate.hashCode()
                    : 31 * subject.hashCode() + predicate.hashCode());
        }

        @Override
        public String toString() {
            return type + "[" + subject + ", " + predicate + ']';
        }
    }
}
