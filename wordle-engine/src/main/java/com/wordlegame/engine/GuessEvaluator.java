package com.wordlegame.engine;

/**
 * Mode-specific step of a session: turns an accepted guess into marks and updates whatever
 * answer state the mode keeps. Called at most once per round, in submission order.
 */
public interface GuessEvaluator {

    MarkSequence evaluate(String guess);
}
