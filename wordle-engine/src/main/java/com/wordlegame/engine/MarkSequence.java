package com.wordlegame.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable per-position marks produced by scoring one guess.
 * Value semantics, so it can key a partition.
 */
public final class MarkSequence {

    private final List<Mark> marks;
    private final int hits;
    private final int presents;

    public MarkSequence(List<Mark> marks) {
        if (marks == null || marks.isEmpty()) {
            throw new IllegalArgumentException("Mark sequence must not be empty");
        }
        this.marks = Collections.unmodifiableList(new ArrayList<>(marks));
        this.hits = (int) marks.stream().filter(m -> m == Mark.HIT).count();
        this.presents = (int) marks.stream().filter(m -> m == Mark.PRESENT).count();
    }

    public static MarkSequence of(Mark... marks) {
        return new MarkSequence(List.of(marks));
    }

    public static MarkSequence allMiss(int length) {
        return new MarkSequence(Collections.nCopies(length, Mark.MISS));
    }

    public List<Mark> getMarks() {
        return marks;
    }

    public Mark get(int position) {
        return marks.get(position);
    }

    public int length() {
        return marks.size();
    }

    public int getHits() {
        return hits;
    }

    public int getPresents() {
        return presents;
    }

    public boolean isAllHit() {
        return hits == marks.size();
    }

    public List<String> toWireNames() {
        return marks.stream().map(Mark::getWireName).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MarkSequence)) {
            return false;
        }
        return marks.equals(((MarkSequence) o).marks);
    }

    @Override
    public int hashCode() {
        return marks.hashCode();
    }

    /**
     * Compact pattern form: {@code O} hit, {@code ?} present, {@code _} miss.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(marks.size());
        for (Mark mark : marks) {
            sb.append(switch (mark) {
                case HIT -> 'O';
                case PRESENT -> '?';
                case MISS -> '_';
            });
        }
        return sb.toString();
    }
}
