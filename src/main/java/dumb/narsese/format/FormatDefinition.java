package dumb.narsese.format;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.narsese.ast.Copula;
import dumb.narsese.ast.Punctuation;
import dumb.narsese.ast.TermType;
import dumb.narsese.util.Bracket;
import org.jetbrains.annotations.Nullable;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON form of a {@link NarseseFormat}. Every field is optional; an absent field takes the ASCII profile's value, and
 * literal maps are merged over the ASCII ones entry by entry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FormatDefinition(
        String name,
        CharClass space,
        boolean stripBeforeParse,
        String formatTerms,
        String formatItems,
        Map<TermType, String> atomPrefixes,
        CharClass identifier,
        Bracket compoundBrackets,
        String compoundSeparator,
        Bracket setExtension,
        Bracket setIntension,
        Map<TermType, String> connectors,
        Bracket statementBrackets,
        Map<Copula, String> copulas,
        Map<Punctuation, String> punctuations,
        Bracket truthBrackets,
        String truthSeparator,
        CharClass truthContent,
        Bracket stampBrackets,
        String stampPast,
        String stampPresent,
        String stampFuture,
        String stampFixed,
        CharClass stampContent,
        Bracket budgetBrackets,
        String budgetSeparator,
        CharClass budgetContent) {

    @JsonCreator
    public FormatDefinition(
            @JsonProperty("name") @Nullable String name,
            @JsonProperty("space") @Nullable CharClass space,
            @JsonProperty("stripBeforeParse") @Nullable Boolean stripBeforeParse,
            @JsonProperty("formatTerms") @Nullable String formatTerms,
            @JsonProperty("formatItems") @Nullable String formatItems,
            @JsonProperty("atomPrefixes") @Nullable Map<TermType, String> atomPrefixes,
            @JsonProperty("identifier") @Nullable CharClass identifier,
            @JsonProperty("compoundBrackets") @Nullable Bracket compoundBrackets,
            @JsonProperty("compoundSeparator") @Nullable String compoundSeparator,
            @JsonProperty("setExtension") @Nullable Bracket setExtension,
            @JsonProperty("setIntension") @Nullable Bracket setIntension,
            @JsonProperty("connectors") @Nullable Map<TermType, String> connectors,
            @JsonProperty("statementBrackets") @Nullable Bracket statementBrackets,
            @JsonProperty("copulas") @Nullable Map<Copula, String> copulas,
            @JsonProperty("punctuations") @Nullable Map<Punctuation, String> punctuations,
            @JsonProperty("truthBrackets") @Nullable Bracket truthBrackets,
            @JsonProperty("truthSeparator") @Nullable String truthSeparator,
            @JsonProperty("truthContent") @Nullable CharClass truthContent,
            @JsonProperty("stampBrackets") @Nullable Bracket stampBrackets,
            @JsonProperty("stampPast") @Nullable String stampPast,
            @JsonProperty("stampPresent") @Nullable String stampPresent,
            @JsonProperty("stampFuture") @Nullable String stampFuture,
            @JsonProperty("stampFixed") @Nullable String stampFixed,
            @JsonProperty("stampContent") @Nullable CharClass stampContent,
            @JsonProperty("budgetBrackets") @Nullable Bracket budgetBrackets,
            @JsonProperty("budgetSeparator") @Nullable String budgetSeparator,
            @JsonProperty("budgetContent") @Nullable CharClass budgetContent) {
        this(
                Objects.requireNonNullElse(name, "custom"),
                Objects.requireNonNullElse(space, CharClass.WHITESPACE),
                stripBeforeParse == null || stripBeforeParse,
                Objects.requireNonNullElse(formatTerms, " "),
                Objects.requireNonNullElse(formatItems, " "),
                merge(Formats.ASCII_ATOMS, atomPrefixes, TermType.class),
                Objects.requireNonNullElse(identifier, CharClass.IDENTIFIER),
                Objects.requireNonNullElse(compoundBrackets, Bracket.of("(", ")")),
                Objects.requireNonNullElse(compoundSeparator, ","),
                Objects.requireNonNullElse(setExtension, Bracket.of("{", "}")),
                Objects.requireNonNullElse(setIntension, Bracket.of("[", "]")),
                merge(Formats.ASCII_CONNECTORS, connectors, TermType.class),
                Objects.requireNonNullElse(statementBrackets, Bracket.of("<", ">")),
                merge(Formats.ASCII_COPULAS, copulas, Copula.class),
                merge(Formats.ASCII_PUNCTUATIONS, punctuations, Punctuation.class),
                Objects.requireNonNullElse(truthBrackets, Bracket.of("%", "%")),
                Objects.requireNonNullElse(truthSeparator, ";"),
                Objects.requireNonNullElse(truthContent, CharClass.DECIMAL),
                Objects.requireNonNullElse(stampBrackets, Bracket.of(":", ":")),
                Objects.requireNonNullElse(stampPast, "\\"),
                Objects.requireNonNullElse(stampPresent, "|"),
                Objects.requireNonNullElse(stampFuture, "/"),
                Objects.requireNonNullElse(stampFixed, "!"),
                Objects.requireNonNullElse(stampContent, CharClass.ASCII_STAMP),
                Objects.requireNonNullElse(budgetBrackets, Bracket.of("$", "$")),
                Objects.requireNonNullElse(budgetSeparator, ";"),
                Objects.requireNonNullElse(budgetContent, CharClass.DECIMAL));
    }

    private static <K extends Enum<K>> Map<K, String> merge(Map<K, String> base, @Nullable Map<K, String> over, Class<K> type) {
        var m = new EnumMap<K, String>(type);
        m.putAll(base);
        if (over != null) m.putAll(over);
        return m;
    }

    /**
     * @throws IllegalArgumentException when the resulting profile is inconsistent
     */
    public NarseseFormat toFormat() {
        return new NarseseFormat(name,
                new NarseseFormat.Space(space, stripBeforeParse, formatTerms, formatItems),
                NarseseFormat.Atom.of(atomPrefixes, identifier),
                NarseseFormat.Compound.of(compoundBrackets, compoundSeparator, setExtension, setIntension, connectors),
                NarseseFormat.Statement.of(statementBrackets, copulas),
                NarseseFormat.Sentence.of(punctuations, truthBrackets, truthSeparator, truthContent,
                        stampBrackets, stampPast, stampPresent, stampFuture, stampFixed, stampContent),
                new NarseseFormat.Task(budgetBrackets, budgetSeparator, budgetContent));
    }
}
