package com.wordlegame.engine;

import java.time.LocalDate;

/**
 * The answer of one calendar day.
 */
public class DailyPuzzle {

    private final LocalDate date;
    private final int wordIndex;
    private final String answer;

    public DailyPuzzle(LocalDate date, int wordIndex, String answer) {
        this.date = date;
        this.wordIndex = wordIndex;
        this.answer = answer;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getDateKey() {
        return DailySeed.dateKey(date);
    }

    public int getWordIndex() {
        return wordIndex;
    }

    public String getAnswer() {
        return answer;
    }
}
