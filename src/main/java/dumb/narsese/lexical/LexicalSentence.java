package dumb.narsese.lexical;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.narsese.util.Json;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * @param stamp the stamp exactly as written, brackets included; empty when eternal
 * @param truth raw numeric components; empty when absent
 */
public record LexicalSentence(LexicalTerm term, String punctuation, String stamp, List<String> truth)
        implements LexicalNarsese {

    public LexicalSentence {
        requireNonNull(term);
        requireNonNull(punctuation);
        requireNonNull(stamp);
        truth = List.copyOf(truth);
    }

    public static LexicalSentence of(LexicalTerm term, String punctuation) {
        return new LexicalSentence(term, punctuation, "", List.of());
    }

    @Override
    public JsonNode toJson() {
        var o = Json.node().put("type", "sentence");
        o.set("term", term.toJson());
        o.put("punctuation", punctuation).put("stamp", stamp);
        var t = o.putArray("truth");
        truth.forEach(t::add);
        return o;
    }
}
