package dumb.narsese.format;

import dumb.narsese.lexical.LexicalNarsese;
import dumb.narsese.lexical.LexicalSentence;
import dumb.narsese.lexical.LexicalTask;
import dumb.narsese.lexical.LexicalTerm;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Writes lexical trees with a profile's brackets, separators and spacing. Literals inside the tree are emitted as
 * they are, so a tree parsed under one profile is re-emitted with that profile's own literals.
 */
public class LexicalFormatter {

    private final NarseseFormat format;

    public LexicalFormatter(NarseseFormat format) {
        this.format = requireNonNull(format);
    }

    public NarseseFormat format() {
        return format;
    }

    public String format(LexicalNarsese n) {
        if (n instanceof LexicalTerm t) return format(t);
        if (n instanceof LexicalSentence s) return format(s);
        return format((LexicalTask) n);
    }

    public String format(LexicalTerm t) {
        var out = new StringBuilder();
        term(out, t);
        return out.toString();
    }

    public String format(LexicalSentence s) {
        var out = new StringBuilder();
        sentence(out, s);
        return out.toString();
    }

    public String format(LexicalTask t) {
        var out = new StringBuilder();
        var task = format.task();
        numbers(out, task.budgetBrackets().left(), t.budget(), task.budgetSeparator(), task.budgetBrackets().right());
        out.append(format.space().formatItems());
        sentence(out, t.sentence());
        return out.toString();
    }

    private void sentence(StringBuilder out, LexicalSentence s) {
        term(out, s.term());
        out.append(s.punctuation());
        var items = format.space().formatItems();
        if (!s.stamp().isEmpty()) out.append(items).append(s.stamp());
        if (!s.truth().isEmpty()) {
            var truth = format.sentence();
            out.append(items);
            numbers(out, truth.truthBrackets().left(), s.truth(), truth.truthSeparator(), truth.truthBrackets().right());
        }
    }

    private void term(StringBuilder out, LexicalTerm t) {
        var space = format.space().formatTerms();
        if (t instanceof LexicalTerm.Atom a) {
            out.append(a.prefix()).append(a.name());
        } else if (t instanceof LexicalTerm.Compound c) {
            var compound = format.compound();
            out.append(compound.brackets().left()).append(c.connector()).append(compound.separator()).append(space);
            components(out, c.terms());
            out.append(compound.brackets().right());
        } else if (t instanceof LexicalTerm.TermSet s) {
            out.append(s.left());
            components(out, s.terms());
            out.append(s.right());
        } else {
            var s = (LexicalTerm.Statement) t;
            var brackets = format.statement().brackets();
            out.append(brackets.left());
            term(out, s.subject());
            out.append(space).append(s.copula()).append(space);
            term(out, s.predicate());
            out.append(brackets.right());
        }
    }

    private void components(StringBuilder out, List<LexicalTerm> terms) {
        var separator = format.compound().separator() + format.space().formatTerms();
        for (var i = 0; i < terms.size(); i++) {
            if (i > 0) out.append(separator);
            term(out, terms.get(i));
        }
    }

    private static void numbers(StringBuilder out, String left, List<String> values, String separator, String right) {
        out.append(left).append(String.join(separator, values)).append(right);
    }
}
