package com.wordlegame.engine;

/**
 * Scores every guess against one answer committed up front (normal and daily games).
 */
public class FixedAnswerEvaluator implements GuessEvaluator {

    private final GuessScorer scorer;
    private final String answer;

    public FixedAnswerEvaluator(GuessScorer scorer, String answer) {
        this.scorer = scorer;
        this.answer = WordFormat.normalize(answer, scorer.getWordLength());
    }

    public String getAnswer() {
        return answer;
    }

    @Override
    public MarkSequence evaluate(String guess) {
        return scorer.score(answer, guess);
    }
}
