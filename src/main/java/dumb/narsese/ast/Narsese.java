package dumb.narsese.ast;

/**
 * Any value a top-level parse may produce: a bare term, a sentence, or a task.
 */
public sealed interface Narsese permits Term, Sentence, Task {

    default boolean isTerm() {
        return this instanceof Term;
    }

    default boolean isSentence() {
        return this instanceof Sentence;
    }

    default boolean isTask() {
        return this instanceof Task;
    }

    default Term asTerm() {
        if (this instanceof Term t) return t;
        throw new IllegalStateException("Not a term: " + this);
    }

    default Sentence asSentence() {
        if (this instanceof Sentence s) return s;
        throw new IllegalStateException("Not a sentence: " + this);
    }

    default Task asTask() {
        if (this instanceof Task t) return t;
        throw new IllegalStateException("Not a task: " + this);
    }
}
