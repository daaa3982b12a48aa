package dumb.narsese.util;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Named literals of one syntactic family (atom prefixes, connectors, copulas, punctuations) plus the
 * {@link PrefixMatchDict} built from them.
 */
public final class Lexicon<K extends Enum<K>> {
    private final Map<K, String> literals;
    private final Map<String, K> kinds;
    private final PrefixMatchDict dict;

    private Lexicon(Map<K, String> literals, Map<String, K> kinds, PrefixMatchDict dict) {
        this.literals = literals;
        this.kinds = kinds;
        this.dict = dict;
    }

    /**
     * @param extras literals matched without a kind, such as the always-present empty atom prefix
     */
    public static <K extends Enum<K>> Lexicon<K> of(Class<K> kindType, Map<K, String> literals, String... extras) {
        var named = new EnumMap<K, String>(kindType);
        var kinds = new HashMap<String, K>();
        literals.forEach((k, v) -> {
            requireNonNull(v, () -> "literal for " + k);
            var prev = kinds.put(v, k);
            if (prev != null)
                throw new IllegalArgumentException("Literal \"" + v + "\" assigned to both " + prev + " and " + k);
            named.put(k, v);
        });
        var all = new LinkedHashSet<>(named.values());
        all.addAll(Arrays.asList(extras));
        return new Lexicon<>(Collections.unmodifiableMap(named), Map.copyOf(kinds), PrefixMatchDict.of(all));
    }

    public String literal(K kind) {
        var l = literals.get(kind);
        if (l == null) throw new IllegalStateException("No literal registered for " + kind);
        return l;
    }

    public Optional<K> kindOf(String literal) {
        return Optional.ofNullable(kinds.get(literal));
    }

    public Optional<String> matchPrefix(String input, int cursor) {
        return dict.matchPrefix(input, cursor);
    }

    public Optional<String> matchSuffix(String input, int end) {
        return dict.matchSuffix(input, end);
    }

    public boolean covers(Collection<K> required) {
        return literals.keySet().containsAll(required);
    }

    public Map<K, String> literals() {
        return literals;
    }

    public PrefixMatchDict dict() {
        return dict;
    }

    @Override
    public String toString() {
        return "Lexicon" + literals;
    }
}
