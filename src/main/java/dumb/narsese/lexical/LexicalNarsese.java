package dumb.narsese.lexical;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Untyped parse result: every literal is kept as written, so it can be re-emitted under any profile.
 */
public sealed interface LexicalNarsese permits LexicalTerm, LexicalSentence, LexicalTask {

    /** Structural view of the tree, for inspection and debugging. */
    JsonNode toJson();

    default LexicalTerm asTerm() {
        if (this instanceof LexicalTerm t) return t;
        throw new IllegalStateException("Not a term: " + this);
    }

    default LexicalSentence asSentence() {
        if (this instanceof LexicalSentence s) return s;
        throw new IllegalStateException("Not a sentence: " + this);
    }

    default LexicalTask asTask() {
        if (this instanceof LexicalTask t) return t;
        throw new IllegalStateException("Not a task: " + this);
    }
}
