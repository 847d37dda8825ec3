package ai.phprefactor.analyzer;

/**
 * Location of a syntax element. Offsets are character (UTF-16) offsets into the file text, lines are 1-based and
 * columns 0-based.
 */
public record SourceSpan(int startOffset, int endOffset, int startLine, int startColumn, int endLine, int endColumn) {
    public SourceSpan {
        if (endOffset < startOffset) {
            throw new IllegalArgumentException("Span end " + endOffset + " precedes start " + startOffset);
        }
    }

    public int length() {
        return endOffset - startOffset;
    }

    public boolean contains(int offset) {
        return offset >= startOffset && offset <= endOffset;
    }

    public boolean contains(SourceSpan other) {
        return other.startOffset >= startOffset && other.endOffset <= endOffset;
    }

    /** Converts to the zero-based line convention used by edits. */
    public TextRange toTextRange() {
        return TextRange.of(startLine - 1, startColumn, endLine - 1, endColumn);
    }
}
