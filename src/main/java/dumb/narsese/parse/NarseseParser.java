package dumb.narsese.parse;

import dumb.narsese.ast.Narsese;
import dumb.narsese.ast.Sentence;
import dumb.narsese.ast.Task;
import dumb.narsese.ast.Term;
import dumb.narsese.format.NarseseFormat;
import dumb.narsese.util.Bracket;

import java.util.List;

/**
 * Parses text straight into the typed AST. Each construct is folded as soon as it is recognized, which gives the
 * same result as lexical parsing followed by {@link NarseseFolder#fold(dumb.narsese.lexical.LexicalNarsese)}, with
 * fold errors located in the input.
 */
public class NarseseParser extends AbstractParser<Narsese, Term, Sentence> {

    private final NarseseFolder folder;

    public NarseseParser(NarseseFormat format) {
        super(format);
        this.folder = new NarseseFolder(format);
    }

    @Override
    protected Term atom(String prefix, String name) throws ParseException {
        return folder.atom(prefix, name);
    }

    @Override
    protected Term compound(String connector, List<Term> terms) throws ParseException {
        return folder.compound(connector, terms);
    }

    @Override
    protected Term set(Bracket brackets, List<Term> terms) throws ParseException {
        return folder.set(brackets.left(), terms, brackets.right());
    }

    @Override
    protected Term statement(String copula, Term subject, Term predicate) throws ParseException {
        return folder.statement(copula, subject, predicate);
    }

    @Override
    protected Sentence sentence(Term term, String punctuation, String stamp, List<String> truth) throws ParseException {
        return folder.sentence(term, punctuation, stamp, truth);
    }

    @Override
    protected Task task(List<String> budget, Sentence sentence) throws ParseException {
        return folder.task(budget, sentence);
    }
}
