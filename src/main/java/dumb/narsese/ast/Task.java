package dumb.narsese.ast;

import static java.util.Objects.requireNonNull;

public record Task(Budget budget, Sentence sentence) implements Narsese {
    public Task {
        requireNonNull(budget);
        requireNonNull(sentence);
    }

    /**
     * Promotes a sentence to a task with an empty budget.
     */
    public static Task of(Sentence sentence) {
        return new Task(Budget.EMPTY, sentence);
    }

    public Term term() {
        return sentence.term();
    }

    public Punctuation punctuation() {
        return sentence.punctuation();
    }

    public Stamp stamp() {
        return sentence.stamp();
    }

    public Truth truth() {
        return sentence.truth();
    }
}
