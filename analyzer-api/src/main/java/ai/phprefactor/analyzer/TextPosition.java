package ai.phprefactor.analyzer;

/** Zero-based line and column, the convention edit consumers expect. */
public record TextPosition(int line, int column) implements Comparable<TextPosition> {
    public TextPosition {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Negative position " + line + ":" + column);
        }
    }

    @Override
    public int compareTo(TextPosition o) {
        int c = Integer.compare(line, o.line);
        return c != 0 ? c : Integer.compare(column, o.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
