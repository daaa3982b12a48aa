package dumb.narsese.parse;

import dumb.narsese.AbstractNarseseTest;
import dumb.narsese.lexical.LexicalNarsese;
import dumb.narsese.lexical.LexicalSentence;
import dumb.narsese.lexical.LexicalTask;
import dumb.narsese.lexical.LexicalTerm;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static dumb.narsese.lexical.LexicalTerm.*;
import static org.junit.jupiter.api.Assertions.*;

class LexicalParserTest extends AbstractNarseseTest {

    private static LexicalNarsese ascii(String text) {
        return lexical(ASCII, text);
    }

    @Test
    void literalsKeptAsWritten() {
        var t = (LexicalTask) ascii("$0.50;0.75$ <A --> B>. :!-1: %1.;.9%");
        assertEquals(List.of("0.50", "0.75"), t.budget());
        assertEquals(":!-1:", t.sentence().stamp());
        assertEquals(List.of("1.", ".9"), t.sentence().truth());
        assertEquals(".", t.sentence().punctuation());
        assertEquals(statement("-->", word("A"), word("B")), t.sentence().term());
    }

    @Test
    void structure() {
        assertEquals(
                statement("-->",
                        compound("*", set("{", List.of(word("SELF")), "}"), atom("$", "any")),
                        atom("^", "op")),
                ascii("<(*, {SELF}, $any) --> ^op>"));
        assertEquals(compound("/", word("R"), atom("_", ""), word("B")), ascii("(/, R, _, B)"));
    }

    @Test
    void questionVariableWithHyphen() {
        var s = (LexicalSentence) ascii("?q-var?");
        assertEquals(atom("?", "q-var"), s.term());
        assertEquals("?", s.punctuation());
    }

    @Test
    void longestMatchWins() {
        assertEquals(compound("&&", word("A"), word("B")), ascii("(&&, A, B)"));
        assertEquals(compound("&/", word("A"), word("B")), ascii("(&/, A, B)"));
        assertEquals(compound("&", word("A"), word("B")), ascii("(&, A, B)"));
        assertEquals(statement("<=>", word("A"), word("B")), ascii("<A<=>B>"));
        assertEquals(statement("</>", word("A"), word("B")), ascii("<A</>B>"));
    }

    @Test
    void nameStopsAtCopula() {
        assertEquals(statement("-->", word("A"), word("B")), ascii("<A-->B>"));
        assertEquals(statement("--]", word("a-b"), word("c")), ascii("<a-b--]c>"));
    }

    @Test
    void whitespaceIsIgnoredWhenStripping() {
        assertEquals(ascii("<(*,A,B)-->C>."), ascii("  < ( * , A , B )  -- >  C > .  "));
    }

    @Test
    void noValueChecksAtThisLevel() {
        assertEquals(compound("--", word("A"), word("B")), ascii("(--, A, B)"));
        var s = (LexicalSentence) ascii("<A --> B>? %1.0;0.9;0.1%");
        assertEquals(3, s.truth().size());
        var t = (LexicalTask) ascii("$9;9;9;9$ A.");
        assertEquals(4, t.budget().size());
        assertEquals(compound("/", word("R"), word("B")), ascii("(/, R, B)"));
    }

    @Test
    void hanAndLatex() {
        assertEquals(statement("具有", set("『", List.of(word("SELF")), "』"), word("good")),
                lexical(HAN, "「『SELF』具有good」。").asSentence().term());
        var latex = (LexicalSentence) lexical(LATEX, "\\left<A \\rightarrow{} B\\right>. t=-3 \\langle{}1.0,0.9\\rangle{}");
        assertEquals("t=-3", latex.stamp());
        assertEquals(statement("\\rightarrow{}", word("A"), word("B")), latex.term());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "<A --> B>",
            "<A --> B>. :|: %1.0;0.9%",
            "$0.5;0.75;0.4$ <(&/, <{ball} --> [left]>, <(*, {SELF}, $any, #some) --> ^do>) ==> <{SELF} --> [good]>>. :!-1: %1.0;0.9%",
            "(/, R, _, B)",
            "<(*, A, +12) =|> ^go>! :/:",
            "<?x <-> {a, b, c}>@",
            "(--, <#y {-] warm>)"
    })
    void reformatsExactly(String text) {
        assertEquals(text, format(ASCII, ascii(text)));
    }

    @Test
    void reformatsUnderEachProfile() {
        for (var f : FORMATS) {
            var text = format(f, parse(ASCII, "$0.5$ <(&&, {A}, [B], $c) ==> <#d --> ^e>>! :\\: %1.0%"));
            var tree = lexical(f, text);
            assertEquals(text, format(f, tree), f.name());
            assertInstanceOf(LexicalTask.class, tree);
        }
    }

    @Test
    void parseAllKeepsOrder() throws ParseException {
        var all = new LexicalParser(ASCII).parseAll(List.of("A", "B.", "$0.1$ C!"));
        assertInstanceOf(LexicalTerm.class, all.get(0));
        assertInstanceOf(LexicalSentence.class, all.get(1));
        assertInstanceOf(LexicalTask.class, all.get(2));
    }

    @Test
    void json() {
        var json = ascii("<A --> [b]>.").toJson();
        assertEquals("sentence", json.get("type").asText());
        assertEquals("statement", json.get("term").get("type").asText());
        assertEquals("set", json.get("term").get("predicate").get("type").asText());
    }
}
