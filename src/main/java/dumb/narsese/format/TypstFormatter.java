package dumb.narsese.format;

import dumb.narsese.ast.*;
import dumb.narsese.util.Floats;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Typesets typed values as Typst math markup. Output only, not a profile: there is no parser for it.
 * <p>
 * Every fragment carries its own surrounding spaces; a final pass collapses whitespace runs and trims.
 */
public final class TypstFormatter {

    public static final TypstFormatter the = new TypstFormatter();

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final String COMPOUND_L = " lr(( ", COMPOUND_R = " )) ";
    static final String EXT_SET_L = " lr({ ", EXT_SET_R = " }) ";
    static final String INT_SET_L = " lr([ ", INT_SET_R = " ]) ";
    static final String STATEMENT_L = " lr(angle.l ", STATEMENT_R = " angle.r) ";
    static final String TRUTH_L = " lr(angle.l ", TRUTH_R = " angle.r) ";
    static final String BUDGET_L = " lr(\\$ ", BUDGET_R = " \\$) ";

    static final String SEPARATOR_COMPOUND = " space ";
    static final String SEPARATOR_ITEM = " space ";
    static final String SEPARATOR_TRUTH = ",";
    /** Quoted: a bare {@code ;} inside {@code lr(\$ ... \$)} breaks Typst. */
    static final String SEPARATOR_BUDGET = "\";\"";

    private TypstFormatter() {
    }

    public String format(Narsese n) {
        var out = new StringBuilder();
        if (n instanceof Term t) term(out, t);
        else if (n instanceof Sentence s) sentence(out, s);
        else task(out, (Task) n);
        return collapse(out);
    }

    public String format(Truth truth) {
        var out = new StringBuilder();
        truth(out, truth);
        return collapse(out);
    }

    public String format(Budget budget) {
        var out = new StringBuilder();
        budget(out, budget);
        return collapse(out);
    }

    public String format(Stamp stamp) {
        return collapse(new StringBuilder(stamp(stamp)));
    }

    public String format(Punctuation p) {
        return collapse(new StringBuilder(punctuation(p)));
    }

    private void sentence(StringBuilder out, Sentence s) {
        term(out, s.term());
        out.append(punctuation(s.punctuation())).append(stamp(s.stamp())).append(SEPARATOR_ITEM);
        truth(out, s.truth());
    }

    private void task(StringBuilder out, Task t) {
        budget(out, t.budget());
        out.append(SEPARATOR_ITEM);
        term(out, t.term());
        out.append(punctuation(t.punctuation())).append(SEPARATOR_ITEM);
        out.append(stamp(t.stamp())).append(SEPARATOR_ITEM);
        truth(out, t.truth());
    }

    private void term(StringBuilder out, Term t) {
        if (t instanceof Term.Atom a) {
            out.append(prefix(a.type()));
            if (a.type() != TermType.PLACEHOLDER) out.append(quote(a.name()));
        } else if (t instanceof Term.Statement s) {
            out.append(STATEMENT_L);
            term(out, s.subject());
            out.append(copula(s.type()));
            term(out, s.predicate());
            out.append(STATEMENT_R);
        } else {
            var components = t instanceof Term.Image i ? i.withPlaceholder() : t.components();
            compound(out, t.type(), components);
        }
    }

    /** Sets list their components; binary forms are infix; the rest put the connector first. */
    private void compound(StringBuilder out, TermType type, List<Term> components) {
        var set = type.isSet();
        out.append(type == TermType.SET_EXTENSION ? EXT_SET_L : type == TermType.SET_INTENSION ? INT_SET_L : COMPOUND_L);
        if (set) {
            join(out, components, SEPARATOR_COMPOUND);
        } else if (components.size() == 2) {
            join(out, components, connector(type));
        } else {
            out.append(connector(type)).append(SEPARATOR_COMPOUND);
            join(out, components, SEPARATOR_COMPOUND);
        }
        out.append(type == TermType.SET_EXTENSION ? EXT_SET_R : type == TermType.SET_INTENSION ? INT_SET_R : COMPOUND_R);
    }

    private void join(StringBuilder out, List<Term> terms, String separator) {
        for (var i = 0; i < terms.size(); i++) {
            if (i > 0) out.append(separator);
            term(out, terms.get(i));
        }
    }

    private static void truth(StringBuilder out, Truth truth) {
        if (!truth.isEmpty()) numbers(out, TRUTH_L, truth.values(), SEPARATOR_TRUTH, TRUTH_R);
    }

    /** An empty budget still writes its brackets, or the task would read as a sentence. */
    private static void budget(StringBuilder out, Budget budget) {
        numbers(out, BUDGET_L, budget.values(), SEPARATOR_BUDGET, BUDGET_R);
    }

    private static void numbers(StringBuilder out, String left, List<Double> values, String separator, String right) {
        out.append(left);
        for (var i = 0; i < values.size(); i++) {
            if (i > 0) out.append(separator);
            out.append(Floats.shortest(values.get(i)));
        }
        out.append(right);
    }

    static String prefix(TermType type) {
        return switch (type) {
            case WORD -> "";
            case PLACEHOLDER -> " diamond.small ";
            case VARIABLE_INDEPENDENT -> " \\$ #h(-0.05em) ";
            case VARIABLE_DEPENDENT -> " \\# #h(-0.05em) ";
            case VARIABLE_QUERY -> " ? #h(-0.05em) ";
            case INTERVAL -> " + #h(-0.05em) ";
            case OPERATOR -> " arrow.t.double #h(-0.05em) ";
            default -> throw new IllegalArgumentException("Not an atom type: " + type);
        };
    }

    static String connector(TermType type) {
        return switch (type) {
            case INTERSECTION_EXTENSION -> " sect ";
            case INTERSECTION_INTENSION -> " union ";
            case DIFFERENCE_EXTENSION -> " minus ";
            case DIFFERENCE_INTENSION -> " minus.circle ";
            case PRODUCT -> " times ";
            case IMAGE_EXTENSION -> " \\/ ";
            case IMAGE_INTENSION -> " \\\\ ";
            case CONJUNCTION -> " and ";
            case DISJUNCTION -> " or ";
            case NEGATION -> " not ";
            case CONJUNCTION_SEQUENTIAL -> " , ";
            case CONJUNCTION_PARALLEL -> " ; ";
            default -> throw new IllegalArgumentException("Not a connector-built compound: " + type);
        };
    }

    static String copula(TermType type) {
        return switch (type) {
            case INHERITANCE -> " arrow.r ";
            case SIMILARITY -> " arrow.l.r ";
            case IMPLICATION -> " arrow.r.double ";
            case EQUIVALENCE -> " arrow.l.r.double ";
            case IMPLICATION_PREDICTIVE -> " space\\/#h(-0.6em)arrow.r.double ";
            case IMPLICATION_CONCURRENT -> " space\\|#h(-0.6em)arrow.r.double ";
            case IMPLICATION_RETROSPECTIVE -> " space\\\\#h(-0.6em)arrow.r.double ";
            case EQUIVALENCE_PREDICTIVE -> " space\\/#h(-0.6em)arrow.l.r.double ";
            case EQUIVALENCE_CONCURRENT -> " space\\|#h(-0.6em)arrow.l.r.double ";
            default -> throw new IllegalArgumentException("Not a statement type: " + type);
        };
    }

    static String stamp(Stamp stamp) {
        if (stamp instanceof Stamp.Fixed f) return " t= " + f.time();
        return switch ((Stamp.Tense) stamp) {
            case ETERNAL -> "";
            case PAST -> " \\\\#h(-0.6em)arrow.r.double ";
            case PRESENT -> " \\|#h(-0.6em)arrow.r.double ";
            case FUTURE -> " \\/#h(-0.6em)arrow.r.double ";
        };
    }

    static String punctuation(Punctuation p) {
        return switch (p) {
            case JUDGEMENT -> " . ";
            case GOAL -> " ! ";
            case QUESTION -> " ? ";
            case QUEST -> " quest.inv ";
        };
    }

    /** Typst string literal: quoted, with backslashes, quotes and control characters escaped. */
    static String quote(String name) {
        var sb = new StringBuilder(name.length() + 2).append('"');
        name.codePoints().forEach(c -> {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (Character.isISOControl(c)) sb.append(String.format("\\u{%x}", c));
                    else sb.appendCodePoint(c);
                }
            }
        });
        return sb.append('"').toString();
    }

    private static String collapse(StringBuilder out) {
        return WHITESPACE.matcher(out.toString().trim()).replaceAll(" ");
    }
}
