package dumb.narsese.parse;

/**
 * A failed parse or fold. {@link #offset()} indexes the caller's input as written, or is {@code -1} when the failure has
 * no position (folding a hand-built lexical tree).
 */
public class ParseException extends Exception {
    public static final String UNKNOWN_ATOM_PREFIX = "unknown atom prefix";
    public static final String UNKNOWN_CONNECTOR = "unknown connector";
    public static final String UNKNOWN_COPULA = "unknown copula";
    public static final String UNKNOWN_PUNCTUATION = "unknown punctuation";
    public static final String UNKNOWN_SET_BRACKET = "unknown set bracket";
    public static final String UNKNOWN_STAMP = "unknown stamp";
    public static final String UNMATCHED_BRACKET = "unmatched bracket";
    public static final String MISSING_SEPARATOR = "missing separator";
    public static final String EMPTY_ATOM_NAME = "empty atom name";
    public static final String NAMED_PLACEHOLDER = "placeholder cannot be named";
    public static final String EMPTY_COMPOUND = "compound without components";
    public static final String ARITY = "wrong number of components";
    public static final String IMAGE_WITHOUT_PLACEHOLDER = "image without placeholder";
    public static final String NON_NUMERIC = "non-numeric character";
    public static final String OUT_OF_RANGE = "component out of [0, 1]";
    public static final String TOO_MANY_VALUES = "too many components";
    public static final String NON_INTEGER = "not an integer";
    public static final String TRUTH_NOT_ALLOWED = "truth value on a question or quest";
    public static final String UNEXPECTED_END = "unexpected end of input";
    public static final String TRAILING_INPUT = "unexpected trailing input";
    public static final String MISSING_PUNCTUATION = "missing punctuation";

    private final String reason;
    private final int offset;
    private final String context;

    public ParseException(String reason) {
        this(reason, -1, "");
    }

    public ParseException(String reason, int offset, String context) {
        super(reason);
        this.reason = reason;
        this.offset = offset;
        this.context = context;
    }

    public String reason() {
        return reason;
    }

    public int offset() {
        return offset;
    }

    /** Input surrounding the offset, as written by the caller. */
    public String context() {
        return context;
    }

    public boolean located() {
        return offset >= 0;
    }

    @Override
    public String getMessage() {
        var location = offset >= 0 ? " at offset " + offset : "";
        var snippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
        return reason + location + snippet;
    }
}
