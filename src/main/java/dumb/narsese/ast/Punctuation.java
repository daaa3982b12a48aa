package dumb.narsese.ast;

public enum Punctuation {
    JUDGEMENT,
    GOAL,
    QUESTION,
    QUEST;

    /** Judgements and goals carry a truth value, questions and quests do not. */
    public boolean hasTruth() {
        return this == JUDGEMENT || this == GOAL;
    }
}
