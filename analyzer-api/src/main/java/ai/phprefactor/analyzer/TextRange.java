package ai.phprefactor.analyzer;

public record TextRange(TextPosition start, TextPosition end) implements Comparable<TextRange> {
    public TextRange {
        if (end.compareTo(start) < 0) {
            throw new IllegalArgumentException("Range end " + end + " precedes start " + start);
        }
    }

    public static TextRange of(int startLine, int startColumn, int endLine, int endColumn) {
        return new TextRange(new TextPosition(startLine, startColumn), new TextPosition(endLine, endColumn));
    }

    public static TextRange empty(TextPosition at) {
        return new TextRange(at, at);
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    /** True when the two ranges share at least one character. Touching ranges do not overlap. */
    public boolean overlaps(TextRange other) {
        return start.compareTo(other.end) < 0 && other.start.compareTo(end) < 0;
    }

    @Override
    public int compareTo(TextRange o) {
        int c = start.compareTo(o.start);
        return c != 0 ? c : end.compareTo(o.end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
