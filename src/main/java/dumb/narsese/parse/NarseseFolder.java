package dumb.narsese.parse;

import dumb.narsese.ast.*;
import dumb.narsese.format.NarseseFormat;
import dumb.narsese.lexical.LexicalNarsese;
import dumb.narsese.lexical.LexicalSentence;
import dumb.narsese.lexical.LexicalTask;
import dumb.narsese.lexical.LexicalTerm;
import dumb.narsese.util.Floats;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static dumb.narsese.parse.ParseException.*;
import static java.util.Objects.requireNonNull;

/**
 * Converts between the lexical tree and the typed AST under one profile. Folding resolves literals to types and
 * checks every value constraint; unfolding writes the profile's literals back.
 * <p>
 * Fold errors carry no offset; {@link NarseseParser} locates them in its input.
 */
public class NarseseFolder {

    private static final Pattern DECIMAL = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

    private final NarseseFormat format;

    public NarseseFolder(NarseseFormat format) {
        this.format = requireNonNull(format);
    }

    public NarseseFormat format() {
        return format;
    }

    public Narsese fold(LexicalNarsese n) throws ParseException {
        if (n instanceof LexicalTerm t) return fold(t);
        if (n instanceof LexicalSentence s) return fold(s);
        return fold((LexicalTask) n);
    }

    public Term fold(LexicalTerm t) throws ParseException {
        if (t instanceof LexicalTerm.Atom a) return atom(a.prefix(), a.name());
        if (t instanceof LexicalTerm.Compound c) return compound(c.connector(), foldAll(c.terms()));
        if (t instanceof LexicalTerm.TermSet s) return set(s.left(), foldAll(s.terms()), s.right());
        var s = (LexicalTerm.Statement) t;
        return statement(s.copula(), fold(s.subject()), fold(s.predicate()));
    }

    public Sentence fold(LexicalSentence s) throws ParseException {
        return sentence(fold(s.term()), s.punctuation(), s.stamp(), s.truth());
    }

    public Task fold(LexicalTask t) throws ParseException {
        return task(t.budget(), fold(t.sentence()));
    }

    private List<Term> foldAll(List<LexicalTerm> terms) throws ParseException {
        var out = new ArrayList<Term>(terms.size());
        for (var t : terms) out.add(fold(t));
        return out;
    }

    public Term atom(String prefix, String name) throws ParseException {
        var type = format.atom().typeOf(prefix).orElseThrow(() -> new ParseException(UNKNOWN_ATOM_PREFIX));
        if (type == TermType.PLACEHOLDER) {
            if (!name.isEmpty()) throw new ParseException(NAMED_PLACEHOLDER);
            return Term.PLACEHOLDER;
        }
        if (name.isEmpty()) throw new ParseException(EMPTY_ATOM_NAME);
        try {
            return Term.atom(type, name);
        } catch (IllegalArgumentException e) {
            throw new ParseException(type == TermType.INTERVAL ? NON_INTEGER : e.getMessage());
        }
    }

    /**
     * Images take the position of their first placeholder component as the placeholder index.
     */
    public Term compound(String connector, List<Term> terms) throws ParseException {
        var type = format.compound().connectors().kindOf(connector)
                .orElseThrow(() -> new ParseException(UNKNOWN_CONNECTOR));
        if (type.isImage()) {
            var components = new ArrayList<>(terms);
            var index = components.indexOf(Term.PLACEHOLDER);
            if (index < 0) throw new ParseException(IMAGE_WITHOUT_PLACEHOLDER);
            components.remove(index);
            return new Term.Image(type, index, components);
        }
        if (terms.isEmpty()) throw new ParseException(EMPTY_COMPOUND);
        try {
            return Term.compound(type, terms);
        } catch (IllegalArgumentException e) {
            throw new ParseException(ARITY);
        }
    }

    public Term set(String left, List<Term> terms, String right) throws ParseException {
        var type = format.compound().setType(left).orElseThrow(() -> new ParseException(UNKNOWN_SET_BRACKET));
        if (!format.compound().setBracket(type).right().equals(right)) throw new ParseException(UNMATCHED_BRACKET);
        if (terms.isEmpty()) throw new ParseException(EMPTY_COMPOUND);
        return Term.compound(type, terms);
    }

    public Term statement(String copula, Term subject, Term predicate) throws ParseException {
        return format.statement().copulas().kindOf(copula)
                .orElseThrow(() -> new ParseException(UNKNOWN_COPULA))
                .apply(subject, predicate);
    }

    public Sentence sentence(Term term, String punctuation, String stamp, List<String> truth) throws ParseException {
        var p = format.sentence().punctuations().kindOf(punctuation)
                .orElseThrow(() -> new ParseException(UNKNOWN_PUNCTUATION));
        var t = truth(truth);
        if (!p.hasTruth() && !t.isEmpty()) throw new ParseException(TRUTH_NOT_ALLOWED);
        return Sentence.of(term, p, stamp(stamp), t);
    }

    public Task task(List<String> budget, Sentence sentence) throws ParseException {
        var values = floats(budget);
        if (values.size() > 3) throw new ParseException(TOO_MANY_VALUES);
        return new Task(new Budget(values), sentence);
    }

    public Truth truth(List<String> truth) throws ParseException {
        var values = floats(truth);
        if (values.size() > 2) throw new ParseException(TOO_MANY_VALUES);
        return new Truth(values);
    }

    /**
     * @param stamp as written, brackets included; empty for eternal
     */
    public Stamp stamp(String stamp) throws ParseException {
        if (stamp.isEmpty()) return Stamp.eternal();
        var f = format.sentence();
        var content = stamp;
        var b = f.stampBrackets();
        if (!b.isEmpty()) {
            var pair = f.stampDict().matchLeft(stamp, 0);
            if (pair.isEmpty() || !pair.equals(f.stampDict().matchRightSuffix(stamp, stamp.length()))
                    || stamp.length() < b.left().length() + b.right().length())
                throw new ParseException(UNMATCHED_BRACKET);
            content = content.substring(b.left().length(), content.length() - b.right().length());
        }
        if (content.equals(f.stampPast())) return Stamp.Tense.PAST;
        if (content.equals(f.stampPresent())) return Stamp.Tense.PRESENT;
        if (content.equals(f.stampFuture())) return Stamp.Tense.FUTURE;
        if (content.startsWith(f.stampFixed())) {
            try {
                return Stamp.fixed(Long.parseLong(content.substring(f.stampFixed().length())));
            } catch (NumberFormatException e) {
                throw new ParseException(NON_INTEGER);
            }
        }
        throw new ParseException(UNKNOWN_STAMP);
    }

    private static List<Double> floats(List<String> raw) throws ParseException {
        var out = new ArrayList<Double>(raw.size());
        for (var r : raw) {
            if (!DECIMAL.matcher(r).matches()) throw new ParseException(NON_NUMERIC);
            var v = Double.parseDouble(r);
            if (!Floats.isUnit(v)) throw new ParseException(OUT_OF_RANGE);
            out.add(v);
        }
        return out;
    }

    public LexicalNarsese unfold(Narsese n) {
        if (n instanceof Term t) return unfold(t);
        if (n instanceof Sentence s) return unfold(s);
        return unfold((Task) n);
    }

    public LexicalTerm unfold(Term t) {
        if (t instanceof Term.Atom a)
            return new LexicalTerm.Atom(format.atom().prefix(a.type()), a.name());
        if (t instanceof Term.Statement s)
            return new LexicalTerm.Statement(format.statement().copula(s.copula()), unfold(s.subject()), unfold(s.predicate()));
        if (t instanceof Term.Image i)
            return new LexicalTerm.Compound(format.compound().connector(i.type()), unfoldAll(i.withPlaceholder()));
        if (t.type().isSet()) {
            var b = format.compound().setBracket(t.type());
            return new LexicalTerm.TermSet(b.left(), unfoldAll(t.components()), b.right());
        }
        return new LexicalTerm.Compound(format.compound().connector(t.type()), unfoldAll(t.components()));
    }

    public LexicalSentence unfold(Sentence s) {
        var f = format.sentence();
        return new LexicalSentence(unfold(s.term()), f.punctuation(s.punctuation()), f.stamp(s.stamp()),
                s.truth().values().stream().map(Floats::plain).toList());
    }

    public LexicalTask unfold(Task t) {
        return new LexicalTask(t.budget().values().stream().map(Floats::plain).toList(), unfold(t.sentence()));
    }

    private List<LexicalTerm> unfoldAll(List<Term> terms) {
        return terms.stream().map(this::unfold).toList();
    }
}
