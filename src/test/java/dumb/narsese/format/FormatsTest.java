package dumb.narsese.format;

import dumb.narsese.AbstractNarseseTest;
import dumb.narsese.ast.*;
import dumb.narsese.util.Bracket;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FormatsTest extends AbstractNarseseTest {

    private static NarseseFormat load(String json) throws IOException {
        return Formats.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void canonicalProfilesAreShared() {
        assertSame(Formats.ascii(), Formats.ascii());
        assertSame(Formats.latex(), Formats.named("LaTeX"));
        assertSame(Formats.han(), Formats.named(" han "));
        assertThrows(IllegalArgumentException.class, () -> Formats.named("typst"));
    }

    @Test
    void asciiLiterals() {
        var f = Formats.ascii();
        assertEquals("$", f.atom().prefix(TermType.VARIABLE_INDEPENDENT));
        assertEquals("", f.atom().prefix(TermType.WORD));
        assertEquals("&/", f.compound().connector(TermType.CONJUNCTION_SEQUENTIAL));
        assertEquals(Bracket.of("[", "]"), f.compound().setBracket(TermType.SET_INTENSION));
        assertEquals("{-]", f.statement().copula(Copula.INSTANCE_PROPERTY));
        assertEquals("@", f.sentence().punctuation(Punctuation.QUEST));
        assertEquals(":!-1:", f.sentence().stamp(Stamp.fixed(-1)));
        assertEquals(":\\:", f.sentence().stamp(Stamp.Tense.PAST));
        assertEquals("", f.sentence().stamp(Stamp.eternal()));
        assertTrue(f.space().stripBeforeParse());
    }

    @Test
    void unbracketedStampsStandAlone() {
        assertEquals("现在", HAN.sentence().stamp(Stamp.Tense.PRESENT));
        assertEquals("发生在42", HAN.sentence().stamp(Stamp.fixed(42)));
        assertEquals("t=-1", LATEX.sentence().stamp(Stamp.fixed(-1)));
        assertEquals(4, HAN.sentence().stampDict().size());
        assertEquals(1, ASCII.sentence().stampDict().size());
    }

    @Test
    void emptyPrefixIsAlwaysRegistered() {
        for (var f : FORMATS) {
            assertEquals(Optional.of(TermType.WORD), f.atom().typeOf(""), f.name());
            assertEquals(Optional.of(""), f.atom().prefixes().matchPrefix("anything", 0));
        }
    }

    @Test
    void wideWhitespaceInHan() {
        assertTrue(HAN.space().isSpace().test('\u3000'));
        assertTrue(ASCII.space().isSpace().test('\u3000'));
        assertTrue(HAN.space().isSpace().test('\u00A0'));
        assertFalse(ASCII.space().isSpace().test('\u00A0'));
        assertEquals(parse(HAN, "「A是B」。"), parse(HAN, "「A\u00A0是B」\u00A0。"));
    }

    @Test
    void emojiAreIdentifierCharacters() {
        assertTrue(CharClass.IDENTIFIER.test(0x1F600));
        assertTrue(CharClass.IDENTIFIER.test('-'));
        assertFalse(CharClass.IDENTIFIER.test(0x1F100));
        assertFalse(CharClass.IDENTIFIER.test('>'));
    }

    @Test
    void loadFromResource() throws IOException {
        NarseseFormat f;
        try (var in = getClass().getResourceAsStream("/formats/angled.json")) {
            f = Formats.load(in);
        }
        assertEquals("angled", f.name());
        assertFalse(f.space().stripBeforeParse());
        assertEquals("→", f.statement().copula(Copula.INHERITANCE));
        assertEquals("=/>", f.statement().copula(Copula.IMPLICATION_PREDICTIVE));
        assertEquals("¿", f.sentence().punctuation(Punctuation.QUEST));
        assertEquals(".", f.sentence().punctuation(Punctuation.JUDGEMENT));
        assertEquals("@|", f.sentence().stamp(Stamp.Tense.PRESENT));

        var judgement = parse(f, "⟨A → B⟩. @| ⟪1.0, 0.9⟫");
        assertEquals(Sentence.of(Term.inheritance(Term.word("A"), Term.word("B")), Punctuation.JUDGEMENT,
                Stamp.Tense.PRESENT, Truth.of(1.0, 0.9)), judgement);
        assertEquals("⟨A → B⟩. @| ⟪1.0,0.9⟫", format(f, judgement));
        assertEquals("⟨A → B⟩. @| ⟪1.0,0.9⟫", format(f, lexical(f, "⟨A → B⟩. @| ⟪1.0,0.9⟫")));
    }

    @Test
    void definitionDefaultsToAscii() throws IOException {
        var f = load("{}");
        assertEquals("custom", f.name());
        assertTrue(f.space().stripBeforeParse());
        assertFalse(load("{\"stripBeforeParse\": false}").space().stripBeforeParse());
        assertEquals(ASCII.statement().copulas().literals(), f.statement().copulas().literals());
        assertEquals(parse(ASCII, "$0.5$ <A --> B>! :|: %1.0%"), parse(f, "$0.5$ <A --> B>! :|: %1.0%"));
    }

    @Test
    void characterClassesByName() throws IOException {
        var f = load("""
                {"name": "wide", "space": "wide-whitespace", "identifier": "ALPHANUMERIC"}
                """);
        assertSame(CharClass.WIDE_WHITESPACE, f.space().isSpace());
        assertSame(CharClass.ALPHANUMERIC, f.atom().isIdentifier());
        assertThrows(IOException.class, () -> load("""
                {"space": "nothing-like-this"}
                """));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"connectors\": {\"PRODUCT\": \",\"}}",
            "{\"copulas\": {\"INHERITANCE\": \"<\"}}",
            "{\"copulas\": {\"SIMILARITY\": \"-->\"}}",
            "{\"stripBeforeParse\": false, \"compoundSeparator\": \"x\"}",
            "{\"stripBeforeParse\": false, \"statementBrackets\": {\"left\": \"s\", \"right\": \"e\"}}",
            "{\"truthBrackets\": {\"left\": \"\", \"right\": \"\"}}"
    })
    void inconsistentDefinitionsRejected(String json) {
        assertThrows(IllegalArgumentException.class, () -> load(json));
    }

    @Test
    void identifierBracketsAllowedWhenStripping() throws IOException {
        var f = load("{\"statementBrackets\": {\"left\": \"s(\", \"right\": \")e\"}}");
        assertEquals(Term.inheritance(Term.word("A"), Term.word("B")), parse(f, "s(A --> B)e"));
    }

    @Test
    void missingLiteralsRejected() {
        Map<Copula, String> copulas = new EnumMap<>(Copula.class);
        copulas.put(Copula.INHERITANCE, "-->");
        var e = assertThrows(IllegalArgumentException.class, () -> new NarseseFormat("partial",
                ASCII.space(), ASCII.atom(), ASCII.compound(),
                NarseseFormat.Statement.of(Bracket.of("<", ">"), copulas),
                ASCII.sentence(), ASCII.task()));
        assertTrue(e.getMessage().contains("SIMILARITY"));
    }

    @Test
    void builtInCode() {
        var f = new NarseseFormat("tight",
                new NarseseFormat.Space(CharClass.WHITESPACE, true, "", ""),
                ASCII.atom(), ASCII.compound(), ASCII.statement(), ASCII.sentence(), ASCII.task());
        var task = parse(ASCII, "$0.5;0.5$ <(*, A, B) --> C>. :|: %1.0;0.9%");
        assertEquals("$0.5;0.5$<(*,A,B)-->C>.:|:%1.0;0.9%", format(f, task));
        assertEquals(task, parse(f, format(f, task)));
    }
}
