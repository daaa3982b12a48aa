package dumb.narsese;

import dumb.narsese.ast.Narsese;
import dumb.narsese.ast.Sentence;
import dumb.narsese.ast.Task;
import dumb.narsese.ast.Term;
import dumb.narsese.format.Formats;
import dumb.narsese.lexical.LexicalNarsese;
import dumb.narsese.lexical.LexicalSentence;
import dumb.narsese.lexical.LexicalTask;
import dumb.narsese.lexical.LexicalTerm;
import dumb.narsese.parse.LexicalParser;
import dumb.narsese.parse.NarseseParser;
import dumb.narsese.parse.ParseException;

import java.util.Locale;

/**
 * Constants written as ASCII Narsese, e.g. {@code term("<A --> B>")}. Tokens are joined with spaces before parsing,
 * which the whitespace-independent ASCII profile ignores. Malformed literals fail with
 * {@link IllegalArgumentException}.
 */
public enum NarseseLiterals {
    ;

    private static final class Parsers {
        static final NarseseParser AST = new NarseseParser(Formats.ascii());
        static final LexicalParser LEXICAL = new LexicalParser(Formats.ascii());
    }

    public static Narsese narsese(String... tokens) {
        var text = String.join(" ", tokens);
        try {
            return Parsers.AST.parse(text);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Malformed Narsese literal \"" + text + "\": " + e.getMessage(), e);
        }
    }

    public static Term term(String... tokens) {
        return cast(narsese(tokens), Term.class, tokens);
    }

    public static Sentence sentence(String... tokens) {
        return cast(narsese(tokens), Sentence.class, tokens);
    }

    /**
     * A sentence literal is accepted too and promoted with an empty budget.
     */
    public static Task task(String... tokens) {
        var n = narsese(tokens);
        if (n instanceof Sentence s) return Task.of(s);
        return cast(n, Task.class, tokens);
    }

    public static LexicalNarsese lexical(String... tokens) {
        var text = String.join(" ", tokens);
        try {
            return Parsers.LEXICAL.parse(text);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Malformed Narsese literal \"" + text + "\": " + e.getMessage(), e);
        }
    }

    public static LexicalTerm lexicalTerm(String... tokens) {
        return cast(lexical(tokens), LexicalTerm.class, tokens);
    }

    public static LexicalSentence lexicalSentence(String... tokens) {
        return cast(lexical(tokens), LexicalSentence.class, tokens);
    }

    public static LexicalTask lexicalTask(String... tokens) {
        var n = lexical(tokens);
        if (n instanceof LexicalSentence s) return LexicalTask.of(s);
        return cast(n, LexicalTask.class, tokens);
    }

    private static <X> X cast(Object value, Class<X> type, String... tokens) {
        if (type.isInstance(value)) return type.cast(value);
        throw new IllegalArgumentException("Narsese literal \"" + String.join(" ", tokens) + "\" is not a "
                + type.getSimpleName().replace("Lexical", "").toLowerCase(Locale.ROOT) + ": " + value);
    }
}
