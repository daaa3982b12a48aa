package dumb.narsese.util;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BracketDictTest {

    private final BracketDict sets = BracketDict.of(Bracket.of("{", "}"), Bracket.of("[", "]"));

    @Test
    void leftMatchYieldsPair() {
        assertEquals(Optional.of(Bracket.of("{", "}")), sets.matchLeft("{a, b}", 0));
        assertEquals(Optional.of(Bracket.of("[", "]")), sets.matchLeft("<[a] --> b>", 1));
        assertEquals(Optional.empty(), sets.matchLeft("(a)", 0));
    }

    @Test
    void rightMatchYieldsPair() {
        assertEquals(Optional.of(Bracket.of("{", "}")), sets.matchRight("{a}", 2));
        assertEquals(Optional.of(Bracket.of("[", "]")), sets.matchRightSuffix("[a]", 3));
        assertEquals(Optional.of(Bracket.of("{", "}")), sets.matchLeftSuffix("x{", 2));
    }

    @Test
    void longestLeftWins() {
        var latex = BracketDict.of(Bracket.of("\\left\\{", "\\right\\}"), Bracket.of("\\left[", "\\right]"), Bracket.of("\\", "/"));
        assertEquals("\\left\\{", latex.matchLeft("\\left\\{A\\right\\}", 0).orElseThrow().left());
        assertEquals("\\", latex.matchLeft("\\x", 0).orElseThrow().left());
    }

    @Test
    void rightsMayRepeat() {
        var stamps = BracketDict.of(Bracket.of("过去", ""), Bracket.of("现在", ""), Bracket.of("发生在", ""));
        assertEquals(3, stamps.size());
        assertEquals(Optional.of(Bracket.of("发生在", "")), stamps.matchLeft("发生在-1", 0));
        assertTrue(stamps.contains(Bracket.of("现在", "")));
        assertFalse(stamps.contains(Bracket.of("现在", "值")));
    }

    @Test
    void duplicateLeftRejected() {
        assertThrows(IllegalArgumentException.class, () -> BracketDict.of(Bracket.of("{", "}"), Bracket.of("{", "]")));
    }

    @Test
    void wrap() {
        assertEquals(":|:", Bracket.of(":", ":").wrap("|"));
        assertEquals("|", Bracket.NONE.wrap("|"));
        assertTrue(Bracket.NONE.isEmpty());
    }
}
