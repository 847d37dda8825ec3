package ai.phprefactor.analyzer;

/** One place a class or method is named. {@code range} covers just the name as written. */
public record SymbolReference(ProjectFile file, TextRange range, Kind kind) implements Comparable<SymbolReference> {
    public enum Kind {
        DECLARATION,
        IMPORT,
        TYPE,
        CALL
    }

    @Override
    public int compareTo(SymbolReference o) {
        int c = file.compareTo(o.file);
        return c != 0 ? c : range.compareTo(o.range);
    }
}
