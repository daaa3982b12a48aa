package dumb.narsese.lexical;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.narsese.util.Json;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record LexicalTask(List<String> budget, LexicalSentence sentence) implements LexicalNarsese {

    public LexicalTask {
        budget = List.copyOf(budget);
        requireNonNull(sentence);
    }

    /** Promotes a sentence to a task with an empty budget. */
    public static LexicalTask of(LexicalSentence sentence) {
        return new LexicalTask(List.of(), sentence);
    }

    @Override
    public JsonNode toJson() {
        var o = Json.node().put("type", "task");
        var b = o.putArray("budget");
        budget.forEach(b::add);
        o.set("sentence", sentence.toJson());
        return o;
    }
}
