package dumb.narsese.util;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Immutable set of literals with longest-match lookup anchored at a cursor (prefix) or at an end index (suffix).
 * Entries are kept longest first, so the first hit of a linear scan is the longest one.
 */
public final class PrefixMatchDict implements Iterable<String> {

    public static final PrefixMatchDict EMPTY = new PrefixMatchDict(List.of());

    private static final Comparator<String> LONGEST_FIRST =
            Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder());

    private final List<String> entries;

    private PrefixMatchDict(List<String> entries) {
        this.entries = entries;
    }

    public static PrefixMatchDict of(String... entries) {
        return of(Arrays.asList(entries));
    }

    public static PrefixMatchDict of(Collection<String> entries) {
        var seen = new HashSet<String>();
        for (var e : entries) {
            requireNonNull(e, "dictionary entry");
            if (!seen.add(e))
                throw new IllegalArgumentException("Duplicate dictionary entry: \"" + e + '"');
        }
        var sorted = new ArrayList<>(seen);
        sorted.sort(LONGEST_FIRST);
        return new PrefixMatchDict(List.copyOf(sorted));
    }

    /**
     * Longest entry that starts at {@code cursor} in {@code input}.
     */
    public Optional<String> matchPrefix(String input, int cursor) {
        if (cursor < 0 || cursor > input.length()) return Optional.empty();
        for (var e : entries) {
            if (input.startsWith(e, cursor)) return Optional.of(e);
        }
        return Optional.empty();
    }

    /**
     * Longest entry that ends exactly at {@code end} in {@code input}.
     */
    public Optional<String> matchSuffix(String input, int end) {
        if (end < 0 || end > input.length()) return Optional.empty();
        for (var e : entries) {
            var start = end - e.length();
            if (start >= 0 && input.startsWith(e, start)) return Optional.of(e);
        }
        return Optional.empty();
    }

    public boolean contains(String literal) {
        return entries.contains(literal);
    }

    public PrefixMatchDict with(String... more) {
        var all = new ArrayList<>(entries);
        all.addAll(Arrays.asList(more));
        return of(all);
    }

    public List<String> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public Iterator<String> iterator() {
        return entries.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PrefixMatchDict that && entries.equals(that.entries));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "PrefixMatchDict" + entries;
    }
}
