package ai.phprefactor.analyzer.php;

import ai.phprefactor.analyzer.SourceSpan;
import ai.phprefactor.analyzer.TextPosition;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * File text plus the bookkeeping needed to translate TreeSitter's UTF-8 byte offsets into character offsets and
 * line/column positions.
 */
public final class SourceText {
    private final String text;
    private final byte[] bytes;
    private final int[] lineStarts;
    private int[] byteToChar;

    private SourceText(String text) {
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public static SourceText of(String text) {
        return new SourceText(text);
    }

    public String text() {
        return text;
    }

    public byte[] bytes() {
        return bytes;
    }

    /** Character offset for a UTF-8 byte offset. Offsets inside a multi-byte sequence map to the character start. */
    public int charOffset(int byteOffset) {
        if (bytes.length == text.length()) {
            return Math.max(0, Math.min(byteOffset, text.length()));
        }
        var map = byteToChar();
        return map[Math.max(0, Math.min(byteOffset, map.length - 1))];
    }

    private int[] byteToChar() {
        if (byteToChar == null) {
            var map = new int[bytes.length + 1];
            int b = 0;
            for (int c = 0; c < text.length(); ) {
                int cp = text.codePointAt(c);
                int width = Character.charCount(cp);
                int encoded = utf8Length(cp, width);
                for (int k = 0; k < encoded && b + k < bytes.length; k++) {
                    map[b + k] = c;
                }
                b += encoded;
                c += width;
            }
            Arrays.fill(map, Math.min(b, map.length - 1), map.length, text.length());
            byteToChar = map;
        }
        return byteToChar;
    }

    private static int utf8Length(int cp, int width) {
        if (width == 1 && Character.isSurrogate((char) cp)) {
            return 1; // unpaired surrogate, encoded as '?'
        }
        if (cp < 0x80) return 1;
        if (cp < 0x800) return 2;
        if (cp < 0x10000) return 3;
        return 4;
    }

    public SourceSpan spanForBytes(int startByte, int endByte) {
        return span(charOffset(startByte), charOffset(endByte));
    }

    public SourceSpan span(int startOffset, int endOffset) {
        int startLine = lineIndex(startOffset);
        int endLine = lineIndex(endOffset);
        return new SourceSpan(
                startOffset,
                endOffset,
                startLine + 1,
                startOffset - lineStarts[startLine],
                endLine + 1,
                endOffset - lineStarts[endLine]);
    }

    /** Zero-based line index containing the character offset. */
    public int lineIndex(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx : -idx - 2;
    }

    public TextPosition position(int offset) {
        int line = lineIndex(offset);
        return new TextPosition(line, offset - lineStarts[line]);
    }

    /** Character offset of a zero-based line and column, clamped to the text. */
    public int offsetOf(TextPosition position) {
        if (position.line() >= lineStarts.length) {
            return text.length();
        }
        int start = lineStarts[position.line()];
        int lineEnd = position.line() + 1 < lineStarts.length ? lineStarts[position.line() + 1] : text.length();
        return Math.min(start + position.column(), lineEnd);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int lineStart(int lineIndex) {
        return lineStarts[lineIndex];
    }

    /** Line content without its terminator. */
    public String line(int lineIndex) {
        int start = lineStarts[lineIndex];
        int end = lineIndex + 1 < lineStarts.length ? lineStarts[lineIndex + 1] - 1 : text.length();
        if (end > start && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(start, Math.max(start, end));
    }

    public List<String> lines() {
        var result = new ArrayList<String>(lineStarts.length);
        for (int i = 0; i < lineStarts.length; i++) {
            result.add(line(i));
        }
        return result;
    }

    public String slice(SourceSpan span) {
        return text.substring(span.startOffset(), span.endOffset());
    }

    /** The line separator the file predominantly uses. */
    public String lineSeparator() {
        return text.contains("\r\n") ? "\r\n" : "\n";
    }
}
