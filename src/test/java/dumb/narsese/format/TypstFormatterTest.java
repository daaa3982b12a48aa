package dumb.narsese.format;

import dumb.narsese.AbstractNarseseTest;
import dumb.narsese.ast.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class TypstFormatterTest extends AbstractNarseseTest {

    private static String typst(String ascii) {
        return TypstFormatter.the.format(parse(ascii));
    }

    @Test
    void statementTerm() {
        assertEquals("lr(angle.l \"A\" arrow.r \"B\" angle.r)", typst("<A --> B>"));
    }

    @Test
    void eternalJudgementWithoutTruth() {
        assertEquals("lr(angle.l \"A\" arrow.r.double \"B\" angle.r) . space", typst("<A ==> B>."));
    }

    @Test
    void task() {
        assertEquals("lr(\\$ 0.4\";\"0.4\";\"0.4 \\$) space "
                        + "lr(angle.l lr({ \"SELF\" }) arrow.r lr([ \"good\" ]) angle.r) ! space "
                        + "\\|#h(-0.6em)arrow.r.double space lr(angle.l 1,0.9 angle.r)",
                typst("$0.4; 0.4; 0.4$ <{SELF} --> [good]>! :|: %1.0;0.9%"));
    }

    @Test
    void compounds() {
        assertEquals("lr(( \"A\" times \"B\" ))", typst("(*, A, B)"));
        assertEquals("lr(( times space \"A\" space \"B\" space \"C\" ))", typst("(*, A, B, C)"));
        assertEquals("lr(( not space \"A\" ))", typst("(--, A)"));
        assertEquals("lr({ \"A\" space \"B\" })", typst("{A, B}"));
        assertEquals("lr(( \\/ space \"R\" space diamond.small space \"B\" ))", typst("(/, R, _, B)"));
    }

    @Test
    void atoms() {
        assertEquals("\\$ #h(-0.05em) \"x\"", typst("$x"));
        assertEquals("\\# #h(-0.05em) \"y\"", typst("#y"));
        assertEquals("arrow.t.double #h(-0.05em) \"go\"", typst("^go"));
        assertEquals("\"a\\\"b\"", TypstFormatter.the.format(Term.word("a\"b")));
    }

    @Test
    void stamps() {
        assertEquals("t= -1", TypstFormatter.the.format(Stamp.fixed(-1)));
        assertEquals("", TypstFormatter.the.format(Stamp.eternal()));
        assertEquals("\\\\#h(-0.6em)arrow.r.double", TypstFormatter.the.format(Stamp.Tense.PAST));
        assertEquals("\\/#h(-0.6em)arrow.r.double", TypstFormatter.the.format(Stamp.Tense.FUTURE));
    }

    @Test
    void values() {
        assertEquals("lr(angle.l 0.5 angle.r)", TypstFormatter.the.format(Truth.of(0.5)));
        assertEquals("", TypstFormatter.the.format(Truth.EMPTY));
        assertEquals("lr(\\$ \\$)", TypstFormatter.the.format(Budget.EMPTY));
        assertEquals("quest.inv", TypstFormatter.the.format(Punctuation.QUEST));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "<(&&, <$x --> A>, (--, B)) ==> <#y --> [C]>>. :!12: %0.5;0.5%",
            "$0.5;0.75;0.4$ <(/, R, _, B) <-> {SELF}>@ :\\:",
            "<<A --> B> </> C>?",
            "(&/, A, +5, ^op)"
    })
    void outputIsCollapsed(String ascii) {
        var out = typst(ascii);
        assertEquals(out.trim(), out);
        assertFalse(out.contains("  "), out);
        assertFalse(out.contains("\n"), out);
    }
}
