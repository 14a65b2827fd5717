package com.wordlegame.engine;

/**
 * A well-formed guess that is not in the allowed-guess dictionary. No round is consumed.
 */
public class WordNotAllowedException extends GameException {

    public WordNotAllowedException(String word) {
        super("WordNotAllowed", "Not in word list: " + word);
    }
}
