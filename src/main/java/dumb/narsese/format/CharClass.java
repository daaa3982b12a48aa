package dumb.narsese.format;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.function.IntPredicate;

/**
 * Named character predicates, so that profiles declared in JSON can refer to them.
 */
public enum CharClass implements IntPredicate {
    /** Java whitespace. */
    WHITESPACE("whitespace") {
        @Override
        public boolean test(int c) {
            return Character.isWhitespace(c);
        }
    },
    /** Java whitespace plus the no-break space separators U+00A0, U+2007 and U+202F. */
    WIDE_WHITESPACE("wide-whitespace") {
        @Override
        public boolean test(int c) {
            return Character.isWhitespace(c) || Character.isSpaceChar(c);
        }
    },
    ALPHANUMERIC("alphanumeric") {
        @Override
        public boolean test(int c) {
            return Character.isLetterOrDigit(c);
        }
    },
    /** Letters, digits, {@code _}, {@code -} and code points above U+1F2FF (most emoji). */
    IDENTIFIER("identifier") {
        @Override
        public boolean test(int c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c > 0x1F2FF;
        }
    },
    DECIMAL("decimal") {
        @Override
        public boolean test(int c) {
            return (c >= '0' && c <= '9') || c == '.';
        }
    },
    SIGNED_INTEGER("signed-integer") {
        @Override
        public boolean test(int c) {
            return (c >= '0' && c <= '9') || c == '+' || c == '-';
        }
    },
    /** Tense marks and fixed-time content of bracketed ASCII stamps. */
    ASCII_STAMP("ascii-stamp") {
        @Override
        public boolean test(int c) {
            return (c >= '0' && c <= '9') || "\\|/!+-".indexOf(c) >= 0;
        }
    };

    private final String id;

    CharClass(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CharClass of(String id) {
        var key = id.trim().toLowerCase(Locale.ROOT);
        for (var c : values())
            if (c.id.equals(key) || c.name().equalsIgnoreCase(key)) return c;
        throw new IllegalArgumentException("Unknown character class: " + id);
    }
}
