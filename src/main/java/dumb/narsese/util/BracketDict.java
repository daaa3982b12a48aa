package dumb.narsese.util;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Paired dictionary: every left literal belongs to exactly one {@link Bracket}, and a match on either side yields the
 * whole pair. Right literals may repeat (several stamp literals all close with the empty string).
 */
public final class BracketDict implements Iterable<Bracket> {

    public static final BracketDict EMPTY = new BracketDict(List.of(), PrefixMatchDict.EMPTY);

    private final List<Bracket> pairs;
    private final Map<String, Bracket> byLeft;
    private final PrefixMatchDict lefts;
    private final List<Bracket> byRightLength;

    private BracketDict(List<Bracket> pairs, PrefixMatchDict lefts) {
        this.pairs = pairs;
        this.lefts = lefts;
        var m = new HashMap<String, Bracket>();
        pairs.forEach(p -> m.put(p.left(), p));
        this.byLeft = Map.copyOf(m);
        var r = new ArrayList<>(pairs);
        r.sort(Comparator.comparingInt((Bracket b) -> b.right().length()).reversed());
        this.byRightLength = List.copyOf(r);
    }

    public static BracketDict of(Bracket... pairs) {
        return of(Arrays.asList(pairs));
    }

    public static BracketDict of(Collection<Bracket> pairs) {
        var list = List.copyOf(pairs);
        var lefts = PrefixMatchDict.of(list.stream().map(b -> requireNonNull(b).left()).toList());
        return new BracketDict(list, lefts);
    }

    public Optional<Bracket> matchLeft(String input, int cursor) {
        return lefts.matchPrefix(input, cursor).map(byLeft::get);
    }

    public Optional<Bracket> matchLeftSuffix(String input, int end) {
        return lefts.matchSuffix(input, end).map(byLeft::get);
    }

    /**
     * Longest right literal starting at {@code cursor}; among pairs sharing that right literal the first registered wins.
     */
    public Optional<Bracket> matchRight(String input, int cursor) {
        if (cursor < 0 || cursor > input.length()) return Optional.empty();
        for (var b : byRightLength) {
            if (input.startsWith(b.right(), cursor)) return Optional.of(b);
        }
        return Optional.empty();
    }

    public Optional<Bracket> matchRightSuffix(String input, int end) {
        if (end < 0 || end > input.length()) return Optional.empty();
        for (var b : byRightLength) {
            var start = end - b.right().length();
            if (start >= 0 && input.startsWith(b.right(), start)) return Optional.of(b);
        }
        return Optional.empty();
    }

    public boolean contains(Bracket pair) {
        return pair.equals(byLeft.get(pair.left()));
    }

    public List<Bracket> pairs() {
        return pairs;
    }

    public int size() {
        return pairs.size();
    }

    @Override
    public Iterator<Bracket> iterator() {
        return pairs.iterator();
    }

    @Override
    public String toString() {
        return "BracketDict" + pairs;
    }
}
