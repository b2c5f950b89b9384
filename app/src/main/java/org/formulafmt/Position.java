package org.formulafmt;

import java.text.MessageFormat;
import java.util.Comparator;

// A place in the source: (lineNum, colNum), both zero-indexed.
//
// colNum points right after the cursor, so a token's end position is the
// column of its last character.
public record Position(int lineNum, int colNum) implements Comparable<Position> {
    @Override
    public String toString() {
        return MessageFormat.format("{0}:{1}", String.valueOf(lineNum), String.valueOf(colNum));
    }

    @Override
    public int compareTo(Position other) {
        return Comparator.comparingInt(Position::lineNum)
            .thenComparingInt(Position::colNum)
            .compare(this, other);
    }
}
