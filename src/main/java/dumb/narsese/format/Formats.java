package dumb.narsese.format;

import dumb.narsese.ast.Copula;
import dumb.narsese.ast.Punctuation;
import dumb.narsese.ast.TermType;
import dumb.narsese.util.Bracket;
import dumb.narsese.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import static dumb.narsese.ast.TermType.*;

/**
 * The canonical profiles (ASCII, LaTeX, Han), each built once on first use, and loading of user profiles from JSON.
 */
public enum Formats {
    ;

    private static final Logger logger = LoggerFactory.getLogger(Formats.class);

    static final Map<TermType, String> ASCII_ATOMS = atoms("", "_", "$", "#", "?", "+", "^");
    static final Map<TermType, String> ASCII_CONNECTORS =
            connectors("&", "|", "-", "~", "*", "/", "\\", "&&", "||", "--", "&/", "&|");
    static final Map<Copula, String> ASCII_COPULAS = copulas(
            "-->", "<->", "==>", "<=>",
            "{--", "--]", "{-]",
            "=/>", "=|>", "=\\>",
            "</>", "<|>", "<\\>");
    static final Map<Punctuation, String> ASCII_PUNCTUATIONS = punctuations(".", "!", "?", "@");

    public static NarseseFormat ascii() {
        return Ascii.FORMAT;
    }

    public static NarseseFormat latex() {
        return Latex.FORMAT;
    }

    public static NarseseFormat han() {
        return Han.FORMAT;
    }

    /**
     * @param name {@code ascii}, {@code latex} or {@code han}, case-insensitive
     */
    public static NarseseFormat named(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "ascii" -> ascii();
            case "latex" -> latex();
            case "han" -> han();
            default -> throw new IllegalArgumentException("Unknown Narsese format: " + name);
        };
    }

    public static NarseseFormat load(InputStream json) throws IOException {
        var def = Json.obj(json, FormatDefinition.class);
        logger.info("Loading Narsese format definition '{}'", def.name());
        try {
            return def.toFormat();
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected Narsese format definition '{}': {}", def.name(), e.getMessage());
            throw e;
        }
    }

    public static NarseseFormat load(Path path) throws IOException {
        try (var in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    static NarseseFormat createAscii() {
        return new NarseseFormat("ascii",
                new NarseseFormat.Space(CharClass.WHITESPACE, true, " ", " "),
                NarseseFormat.Atom.of(ASCII_ATOMS, CharClass.IDENTIFIER),
                NarseseFormat.Compound.of(Bracket.of("(", ")"), ",", Bracket.of("{", "}"), Bracket.of("[", "]"), ASCII_CONNECTORS),
                NarseseFormat.Statement.of(Bracket.of("<", ">"), ASCII_COPULAS),
                NarseseFormat.Sentence.of(ASCII_PUNCTUATIONS,
                        Bracket.of("%", "%"), ";", CharClass.DECIMAL,
                        Bracket.of(":", ":"), "\\", "|", "/", "!", CharClass.ASCII_STAMP),
                new NarseseFormat.Task(Bracket.of("$", "$"), ";", CharClass.DECIMAL));
    }

    /** TeX commands end in {@code {}} where a following letter would otherwise continue the command name. */
    static NarseseFormat createLatex() {
        return new NarseseFormat("latex",
                new NarseseFormat.Space(CharClass.WHITESPACE, true, " ", " "),
                NarseseFormat.Atom.of(atoms("", "\\diamond{}", "\\$", "\\#", "?", "+", "\\Uparrow{}"), CharClass.IDENTIFIER),
                NarseseFormat.Compound.of(Bracket.of("\\left(", "\\right)"), "\\;",
                        Bracket.of("\\left\\{", "\\right\\}"), Bracket.of("\\left[", "\\right]"),
                        connectors("\\cap{}", "\\cup{}", "\\minus{}", "\\sim{}", "\\times{}", "/", "\\backslash{}",
                                "\\wedge{}", "\\vee{}", "\\neg{}", ",", ";")),
                NarseseFormat.Statement.of(Bracket.of("\\left<", "\\right>"), copulas(
                        "\\rightarrow{}", "\\leftrightarrow{}", "\\Rightarrow{}", "\\Leftrightarrow{}",
                        "\\circ\\!\\!\\!\\rightarrow{}", "\\rightarrow\\!\\!\\!\\circ{}", "\\circ\\!\\!\\!\\rightarrow\\!\\!\\!\\circ{}",
                        "/\\!\\!\\!\\!\\!\\Rightarrow{}", "|\\!\\!\\!\\!\\!\\Rightarrow{}", "\\backslash\\!\\!\\!\\!\\!\\Rightarrow{}",
                        "/\\!\\!\\!\\Leftrightarrow{}", "|\\!\\!\\!\\Leftrightarrow{}", "\\backslash\\!\\!\\!\\Leftrightarrow{}")),
                NarseseFormat.Sentence.of(punctuations(".", "!", "?", "¿"),
                        Bracket.of("\\langle{}", "\\rangle{}"), ",", CharClass.DECIMAL,
                        Bracket.NONE,
                        "\\backslash\\!\\!\\!\\!\\!\\Rightarrow{}", "|\\!\\!\\!\\!\\!\\Rightarrow{}",
                        "/\\!\\!\\!\\!\\!\\Rightarrow{}", "t=", CharClass.SIGNED_INTEGER),
                new NarseseFormat.Task(Bracket.of("\\$", "\\$"), ";", CharClass.DECIMAL));
    }

    static NarseseFormat createHan() {
        return new NarseseFormat("han",
                new NarseseFormat.Space(CharClass.WIDE_WHITESPACE, true, "", " "),
                NarseseFormat.Atom.of(atoms("", "某", "任一", "其一", "所问", "间隔", "操作"), CharClass.IDENTIFIER),
                NarseseFormat.Compound.of(Bracket.of("（", "）"), "，", Bracket.of("『", "』"), Bracket.of("【", "】"),
                        connectors("外交", "内交", "外差", "内差", "积", "外像", "内像", "与", "或", "非", "接连", "同时")),
                NarseseFormat.Statement.of(Bracket.of("「", "」"), copulas(
                        "是", "似", "得", "同",
                        "为", "有", "具有",
                        "将得", "现得", "曾得",
                        "将同", "现同", "曾同")),
                NarseseFormat.Sentence.of(punctuations("。", "！", "？", "；"),
                        Bracket.of("真", "值"), "、", CharClass.DECIMAL,
                        Bracket.NONE, "过去", "现在", "将来", "发生在", CharClass.SIGNED_INTEGER),
                new NarseseFormat.Task(Bracket.of("预", "算"), "、", CharClass.DECIMAL));
    }

    static Map<TermType, String> atoms(String word, String placeholder, String independent, String dependent,
                                       String query, String interval, String operator) {
        var m = new EnumMap<TermType, String>(TermType.class);
        m.put(WORD, word);
        m.put(PLACEHOLDER, placeholder);
        m.put(VARIABLE_INDEPENDENT, independent);
        m.put(VARIABLE_DEPENDENT, dependent);
        m.put(VARIABLE_QUERY, query);
        m.put(INTERVAL, interval);
        m.put(OPERATOR, operator);
        return m;
    }

    static Map<TermType, String> connectors(String... literals) {
        var types = new TermType[]{
                INTERSECTION_EXTENSION, INTERSECTION_INTENSION, DIFFERENCE_EXTENSION, DIFFERENCE_INTENSION,
                PRODUCT, IMAGE_EXTENSION, IMAGE_INTENSION,
                CONJUNCTION, DISJUNCTION, NEGATION, CONJUNCTION_SEQUENTIAL, CONJUNCTION_PARALLEL};
        var m = new EnumMap<TermType, String>(TermType.class);
        for (var i = 0; i < types.length; i++) m.put(types[i], literals[i]);
        return m;
    }

    /** Literals in {@link Copula} declaration order. */
    static Map<Copula, String> copulas(String... literals) {
        var m = new EnumMap<Copula, String>(Copula.class);
        for (var c : Copula.values()) m.put(c, literals[c.ordinal()]);
        return m;
    }

    static Map<Punctuation, String> punctuations(String judgement, String goal, String question, String quest) {
        var m = new EnumMap<Punctuation, String>(Punctuation.class);
        m.put(Punctuation.JUDGEMENT, judgement);
        m.put(Punctuation.GOAL, goal);
        m.put(Punctuation.QUESTION, question);
        m.put(Punctuation.QUEST, quest);
        return m;
    }

    private static NarseseFormat created(NarseseFormat f) {
        logger.debug("Initialized {} Narsese format", f.name());
        return f;
    }

    private static final class Ascii {
        static final NarseseFormat FORMAT = created(createAscii());
    }

    private static final class Latex {
        static final NarseseFormat FORMAT = created(createLatex());
    }

    private static final class Han {
        static final NarseseFormat FORMAT = created(createHan());
    }
}
