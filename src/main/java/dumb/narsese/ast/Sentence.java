package dumb.narsese.ast;

import static java.util.Objects.requireNonNull;

public sealed interface Sentence extends Narsese permits Sentence.Judgement, Sentence.Goal, Sentence.Question, Sentence.Quest {

    /**
     * @throws IllegalArgumentException when a question or quest is given a non-empty truth
     */
    static Sentence of(Term term, Punctuation punctuation, Stamp stamp, Truth truth) {
        if (!punctuation.hasTruth() && !truth.isEmpty())
            throw new IllegalArgumentException(punctuation + " cannot carry a truth value: " + truth);
        return switch (punctuation) {
            case JUDGEMENT -> new Judgement(term, truth, stamp);
            case GOAL -> new Goal(term, truth, stamp);
            case QUESTION -> new Question(term, stamp);
            case QUEST -> new Quest(term, stamp);
        };
    }

    static Sentence of(Term term, Punctuation punctuation) {
        return of(term, punctuation, Stamp.eternal(), Truth.EMPTY);
    }

    Term term();

    Stamp stamp();

    Punctuation punctuation();

    /** Empty for questions and quests. */
    default Truth truth() {
        return Truth.EMPTY;
    }

    record Judgement(Term term, Truth truth, Stamp stamp) implements Sentence {
        public Judgement {
            requireNonNull(term);
            requireNonNull(truth);
            requireNonNull(stamp);
        }

        @Override
        public Punctuation punctuation() {
            return Punctuation.JUDGEMENT;
        }
    }

    record Goal(Term term, Truth truth, Stamp stamp) implements Sentence {
        public Goal {
            requireNonNull(term);
            requireNonNull(truth);
            requireNonNull(stamp);
        }

        @Override
        public Punctuation punctuation() {
            return Punctuation.GOAL;
        }
    }

    record Question(Term term, Stamp stamp) implements Sentence {
        public Question {
            requireNonNull(term);
            requireNonNull(stamp);
        }

        @Override
        public Punctuation punctuation() {
            return Punctuation.QUESTION;
        }
    }

    record Quest(Term term, Stamp stamp) implements Sentence {
        public Quest {
            requireNonNull(term);
            requireNonNull(stamp);
        }

        @Override
        public Punctuation punctuation() {
            return Punctuation.QUEST;
        }
    }
}
