package dumb.narsese.parse;

import dumb.narsese.format.NarseseFormat;
import dumb.narsese.lexical.LexicalNarsese;
import dumb.narsese.lexical.LexicalSentence;
import dumb.narsese.lexical.LexicalTask;
import dumb.narsese.lexical.LexicalTerm;
import dumb.narsese.util.Bracket;

import java.util.List;

/**
 * Parses text into the untyped lexical tree, keeping every literal as written.
 */
public class LexicalParser extends AbstractParser<LexicalNarsese, LexicalTerm, LexicalSentence> {

    public LexicalParser(NarseseFormat format) {
        super(format);
    }

    @Override
    protected LexicalTerm atom(String prefix, String name) {
        return new LexicalTerm.Atom(prefix, name);
    }

    @Override
    protected LexicalTerm compound(String connector, List<LexicalTerm> terms) {
        return new LexicalTerm.Compound(connector, terms);
    }

    @Override
    protected LexicalTerm set(Bracket brackets, List<LexicalTerm> terms) {
        return new LexicalTerm.TermSet(brackets.left(), terms, brackets.right());
    }

    @Override
    protected LexicalTerm statement(String copula, LexicalTerm subject, LexicalTerm predicate) {
        return new LexicalTerm.Statement(copula, subject, predicate);
    }

    @Override
    protected LexicalSentence sentence(LexicalTerm term, String punctuation, String stamp, List<String> truth) {
        return new LexicalSentence(term, punctuation, stamp, truth);
    }

    @Override
    protected LexicalNarsese task(List<String> budget, LexicalSentence sentence) {
        return new LexicalTask(budget, sentence);
    }
}
