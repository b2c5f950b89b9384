package org.formulafmt;

import java.util.*;

// Conversions between Positions and offsets into the text the lines came from
// (lines joined with '\n').
public class Positions {
    private Positions() {}

    public static List<String> splitLines(String text) {
        var lines = new ArrayList<String>();
        for (var line : text.split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return lines;
    }

    // Offset of the first character of every line
    static int[] lineIndex(List<String> lines) {
        var index = new int[lines.size()];
        int offset = 0;
        for (int i = 0; i < lines.size(); i++) {
            index[i] = offset;
            // one more for the newline
            offset += lines.get(i).length() + 1;
        }
        return index;
    }

    // Out of range offsets clamp to the first or the last position
    public static Position toPosition(List<String> lines, int index) {
        if (index < 0 || lines.isEmpty()) {
            return new Position(0, 0);
        }

        var lineIndex = lineIndex(lines);
        var lineFind = Arrays.binarySearch(lineIndex, index);

        int lineNum;
        if (lineFind >= 0) {
            lineNum = lineFind;
        } else {
            // binarySearch returns (-(insertion_point) - 1) so we reverse that,
            // the line is the one before the insertion point
            lineNum = -(lineFind + 1) - 1;
        }

        var line = lines.get(lineNum);
        int colNum = index - lineIndex[lineNum];
        if (colNum > line.length()) {
            // Past the end of the text
            var last = lines.size() - 1;
            return new Position(last, lines.get(last).length());
        }
        return new Position(lineNum, colNum);
    }

    // Out of range lines clamp to the start or the end of the text, out of
    // range columns to their line
    public static int toIndex(List<String> lines, Position position) {
        if (position.lineNum() < 0 || lines.isEmpty()) {
            return 0;
        }

        var lineIndex = lineIndex(lines);
        if (position.lineNum() >= lines.size()) {
            var last = lines.size() - 1;
            return lineIndex[last] + lines.get(last).length();
        }

        var line = lines.get(position.lineNum());
        var colNum = Math.min(Math.max(0, position.colNum()), line.length());
        return lineIndex[position.lineNum()] + colNum;
    }
}
