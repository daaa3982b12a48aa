package dumb.narsese.ast;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Incremental construction of a term of a given type. Calls that do not fit the type's capacity fail with
 * {@link TermCapacityException} instead of producing a malformed term.
 */
public final class TermBuilder {
    private final TermType type;
    private final List<Term> components = new ArrayList<>();
    private String name;
    private int placeholderIndex = -1;

    private TermBuilder(TermType type) {
        this.type = type;
    }

    public static TermBuilder of(TermType type) {
        return new TermBuilder(requireNonNull(type));
    }

    public TermType type() {
        return type;
    }

    public TermBuilder name(String name) throws TermCapacityException {
        if (!type.isAtom()) throw new TermCapacityException(type, "Only atoms have a name");
        this.name = requireNonNull(name);
        return this;
    }

    public TermBuilder push(Term... terms) throws TermCapacityException {
        if (type.isAtom()) throw new TermCapacityException(type, "Atoms have no components");
        var limit = limit();
        for (var t : terms) {
            if (components.size() >= limit)
                throw new TermCapacityException(type, "Cannot hold more than " + limit + " components");
            components.add(requireNonNull(t));
        }
        return this;
    }

    /**
     * Fixes where the placeholder of an image goes. Without it, the first pushed placeholder marks the position.
     */
    public TermBuilder placeholderIndex(int index) throws TermCapacityException {
        if (!type.isImage()) throw new TermCapacityException(type, "Only images have a placeholder index");
        if (index < 0) throw new TermCapacityException(type, "Negative placeholder index " + index);
        this.placeholderIndex = index;
        return this;
    }

    public Term build() throws TermCapacityException {
        if (type.isAtom()) {
            if (name == null && type != TermType.PLACEHOLDER) throw new TermCapacityException(type, "Atom name not set");
            try {
                return Term.atom(type, name == null ? "" : name);
            } catch (IllegalArgumentException e) {
                throw new TermCapacityException(type, e.getMessage());
            }
        }
        if (type.isStatement()) {
            if (components.size() != 2) throw new TermCapacityException(type, "Statement needs subject and predicate");
            return Term.statement(type, components.get(0), components.get(1));
        }
        if (type.isImage()) return image();
        var needed = type.capacity().isBinary() ? 2 : 1;
        if (components.size() < needed)
            throw new TermCapacityException(type, "Needs " + needed + " components, has " + components.size());
        return Term.compound(type, components);
    }

    private Term image() throws TermCapacityException {
        var list = new ArrayList<>(components);
        var index = placeholderIndex;
        if (index < 0) {
            index = list.indexOf(Term.PLACEHOLDER);
            if (index < 0) throw new TermCapacityException(type, "Image without placeholder");
            list.remove(index);
        }
        if (index > list.size())
            throw new TermCapacityException(type, "Placeholder index " + index + " past " + list.size() + " components");
        return new Term.Image(type, index, list);
    }

    private int limit() {
        return switch (type.capacity()) {
            case UNARY -> 1;
            case BINARY_VEC, BINARY_SET -> 2;
            default -> Integer.MAX_VALUE;
        };
    }
}
