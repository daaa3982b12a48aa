package dumb.narsese.parse;

import dumb.narsese.ast.TermType;
import dumb.narsese.format.NarseseFormat;
import dumb.narsese.util.Bracket;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

import static dumb.narsese.parse.ParseException.*;
import static java.util.Objects.requireNonNull;

/**
 * Profile-driven recursive-descent scanner shared by the lexical and the typed parser. It recognizes the surface
 * structure and hands each finished construct to a hook; subclasses decide what to build from it.
 * <p>
 * Parsers are immutable and hold no per-input state, so one instance may serve many threads.
 *
 * @param <R> result of a top-level parse
 * @param <T> term representation
 * @param <S> sentence representation
 */
public abstract class AbstractParser<R, T extends R, S extends R> {

    private static final int CONTEXT = 4;

    protected final NarseseFormat format;

    protected AbstractParser(NarseseFormat format) {
        this.format = requireNonNull(format);
    }

    public NarseseFormat format() {
        return format;
    }

    /**
     * Parses a bare term, a sentence, or a task (a sentence preceded by a budget).
     */
    public R parse(String input) throws ParseException {
        return new Cursor(input).narsese();
    }

    /**
     * One result per input, in order; the first failure aborts.
     */
    public List<R> parseAll(Iterable<String> inputs) throws ParseException {
        var out = new ArrayList<R>();
        for (var i : inputs) out.add(parse(i));
        return out;
    }

    protected abstract T atom(String prefix, String name) throws ParseException;

    protected abstract T compound(String connector, List<T> terms) throws ParseException;

    protected abstract T set(Bracket brackets, List<T> terms) throws ParseException;

    protected abstract T statement(String copula, T subject, T predicate) throws ParseException;

    protected abstract S sentence(T term, String punctuation, String stamp, List<String> truth) throws ParseException;

    protected abstract R task(List<String> budget, S sentence) throws ParseException;

    @FunctionalInterface
    private interface Step<X> {
        X get() throws ParseException;
    }

    /**
     * Scan state over one input. When the profile strips whitespace, scanning runs over the stripped text and
     * {@link #origin} maps each position back to the caller's input.
     */
    private final class Cursor {
        private final String input;
        private final String s;
        private final int[] origin;
        private final IntPredicate isSpace;
        private int pos;

        Cursor(String input) {
            this.input = requireNonNull(input);
            this.isSpace = format.space().isSpace();
            if (format.space().stripBeforeParse()) {
                var sb = new StringBuilder(input.length());
                var map = new int[input.length() + 1];
                var n = 0;
                for (var i = 0; i < input.length(); ) {
                    var cp = input.codePointAt(i);
                    var len = Character.charCount(cp);
                    if (!isSpace.test(cp)) {
                        for (var k = 0; k < len; k++) map[n++] = i + k;
                        sb.appendCodePoint(cp);
                    }
                    i += len;
                }
                map[n] = input.length();
                this.s = sb.toString();
                this.origin = map;
            } else {
                this.s = input;
                this.origin = null;
            }
        }

        R narsese() throws ParseException {
            skipSpace();
            var budgetAt = pos;
            List<String> budget = null;
            var task = format.task();
            if (startsWith(task.budgetBrackets().left())) {
                try {
                    budget = numbers(task.budgetBrackets(), task.budgetSeparator(), task.isBudgetContent());
                } catch (ParseException notBudget) {
                    // the left bracket may equally open an atom, e.g. an ASCII independent variable
                    pos = budgetAt;
                }
            }
            var term = term();
            skipSpace();
            if (atEnd()) {
                if (budget != null) throw fail(MISSING_PUNCTUATION, pos);
                return term;
            }
            var sentence = sentence(term);
            if (budget == null) return sentence;
            var b = budget;
            return at(budgetAt, () -> AbstractParser.this.task(b, sentence));
        }

        private S sentence(T term) throws ParseException {
            var tail = format.sentence();
            var punctAt = pos;
            var punctuation = tail.punctuations().matchPrefix(s, pos)
                    .orElseThrow(() -> fail(UNKNOWN_PUNCTUATION, punctAt));
            pos += punctuation.length();
            skipSpace();

            var stamp = "";
            var stampBracket = tail.stampDict().matchLeft(s, pos);
            if (stampBracket.isPresent()) {
                var b = stampBracket.get();
                var start = pos;
                pos += b.left().length();
                while (!atEnd() && !startsWith(b.right()) && tail.isStampContent().test(s.codePointAt(pos)))
                    pos += Character.charCount(s.codePointAt(pos));
                if (!b.right().isEmpty()) {
                    if (!startsWith(b.right())) throw fail(UNMATCHED_BRACKET, start);
                    pos += b.right().length();
                }
                stamp = s.substring(start, pos);
                skipSpace();
            }

            List<String> truth = List.of();
            if (startsWith(tail.truthBrackets().left())) {
                truth = numbers(tail.truthBrackets(), tail.truthSeparator(), tail.isTruthContent());
                skipSpace();
            }
            if (!atEnd()) throw fail(TRAILING_INPUT, pos);

            var st = stamp;
            var tr = truth;
            return at(punctAt, () -> AbstractParser.this.sentence(term, punctuation, st, tr));
        }

        /** Numeric components between a bracket pair, e.g. {@code %1.0;0.9%}. */
        private List<String> numbers(Bracket brackets, String separator, IntPredicate content) throws ParseException {
            var start = pos;
            pos += brackets.left().length();
            skipSpace();
            var out = new ArrayList<String>();
            if (startsWith(brackets.right())) {
                pos += brackets.right().length();
                return out;
            }
            while (true) {
                var from = pos;
                while (!atEnd() && !startsWith(brackets.right()) && !startsWith(separator)
                        && content.test(s.codePointAt(pos)))
                    pos += Character.charCount(s.codePointAt(pos));
                if (pos == from) throw fail(atEnd() ? UNMATCHED_BRACKET : NON_NUMERIC, atEnd() ? start : pos);
                out.add(s.substring(from, pos));
                skipSpace();
                if (startsWith(brackets.right())) {
                    pos += brackets.right().length();
                    return out;
                }
                if (startsWith(separator)) {
                    pos += separator.length();
                    skipSpace();
                    continue;
                }
                throw atEnd() ? fail(UNMATCHED_BRACKET, start) : fail(NON_NUMERIC, pos);
            }
        }

        private T term() throws ParseException {
            skipSpace();
            var start = pos;
            if (atEnd()) throw fail(UNEXPECTED_END, pos);

            var set = format.compound().setBrackets().matchLeft(s, pos);
            if (set.isPresent()) {
                var b = set.get();
                pos += b.left().length();
                var terms = terms(format.compound().separator(), b.right(), start);
                return at(start, () -> AbstractParser.this.set(b, terms));
            }

            var compound = format.compound();
            if (startsWith(compound.brackets().left())) {
                pos += compound.brackets().left().length();
                skipSpace();
                var connectorAt = pos;
                var connector = compound.connectors().matchPrefix(s, pos)
                        .orElseThrow(() -> fail(atEnd() ? UNMATCHED_BRACKET : UNKNOWN_CONNECTOR, atEnd() ? start : connectorAt));
                pos += connector.length();
                skipSpace();
                if (!startsWith(compound.separator()))
                    throw fail(atEnd() ? UNMATCHED_BRACKET : MISSING_SEPARATOR, atEnd() ? start : pos);
                pos += compound.separator().length();
                var terms = terms(compound.separator(), compound.brackets().right(), start);
                return at(start, () -> AbstractParser.this.compound(connector, terms));
            }

            var statement = format.statement();
            if (startsWith(statement.brackets().left())) {
                pos += statement.brackets().left().length();
                var subject = term();
                skipSpace();
                var copulaAt = pos;
                var copula = statement.copulas().matchPrefix(s, pos)
                        .orElseThrow(() -> fail(atEnd() ? UNMATCHED_BRACKET : UNKNOWN_COPULA, atEnd() ? start : copulaAt));
                pos += copula.length();
                var predicate = term();
                skipSpace();
                if (!startsWith(statement.brackets().right()))
                    throw fail(UNMATCHED_BRACKET, start);
                pos += statement.brackets().right().length();
                return at(start, () -> AbstractParser.this.statement(copula, subject, predicate));
            }

            return atom(start);
        }

        /** Components up to the closing bracket. */
        private List<T> terms(String separator, String right, int start) throws ParseException {
            skipSpace();
            if (startsWith(right)) throw fail(EMPTY_COMPOUND, start);
            var out = new ArrayList<T>();
            while (true) {
                if (atEnd()) throw fail(UNMATCHED_BRACKET, start);
                out.add(term());
                skipSpace();
                if (startsWith(right)) {
                    pos += right.length();
                    return out;
                }
                if (atEnd()) throw fail(UNMATCHED_BRACKET, start);
                if (!startsWith(separator)) throw fail(MISSING_SEPARATOR, pos);
                pos += separator.length();
            }
        }

        /**
         * Longest prefix, then a run of identifier characters. The run stops wherever a copula begins, so
         * {@code <A-->B>} splits at {@code -->} even without whitespace.
         */
        private T atom(int start) throws ParseException {
            var atoms = format.atom();
            var prefix = atoms.prefixes().matchPrefix(s, pos).orElse("");
            pos += prefix.length();
            var from = pos;
            while (!atEnd() && atoms.isIdentifier().test(s.codePointAt(pos))
                    && format.statement().copulas().matchPrefix(s, pos).isEmpty())
                pos += Character.charCount(s.codePointAt(pos));
            var name = s.substring(from, pos);
            if (name.isEmpty()) {
                if (prefix.isEmpty()) throw fail(UNKNOWN_ATOM_PREFIX, start);
                if (!atoms.typeOf(prefix).map(t -> t == TermType.PLACEHOLDER).orElse(false))
                    throw fail(EMPTY_ATOM_NAME, start);
            }
            return at(start, () -> AbstractParser.this.atom(prefix, name));
        }

        private <X> X at(int start, Step<X> step) throws ParseException {
            try {
                return step.get();
            } catch (ParseException e) {
                if (e.located()) throw e;
                throw fail(e.reason(), start);
            }
        }

        private ParseException fail(String reason, int at) {
            var offset = origin == null ? at : origin[Math.min(at, s.length())];
            var from = Math.max(0, offset - CONTEXT);
            var to = Math.min(input.length(), offset + CONTEXT);
            return new ParseException(reason, offset, input.substring(from, to));
        }

        private boolean startsWith(String literal) {
            return !literal.isEmpty() && s.startsWith(literal, pos);
        }

        private boolean atEnd() {
            return pos >= s.length();
        }

        private void skipSpace() {
            while (!atEnd() && isSpace.test(s.codePointAt(pos)))
                pos += Character.charCount(s.codePointAt(pos));
        }
    }
}
