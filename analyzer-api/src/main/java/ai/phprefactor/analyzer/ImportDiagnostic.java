package ai.phprefactor.analyzer;

/** A reference to a type that is neither imported, built in, nor visible from the file's own namespace. */
public record ImportDiagnostic(ProjectFile file, SourceSpan span, String name, String message, String code, String source) {
    public static final String MISSING_IMPORT = "missing-import";
    public static final String SOURCE = "php-refactor";

    public static ImportDiagnostic missingImport(ProjectFile file, SourceSpan span, String name) {
        return new ImportDiagnostic(
                file, span, name, "Class '%s' is not imported. Add 'use' statement.".formatted(name), MISSING_IMPORT, SOURCE);
    }

    public TextRange range() {
        return span.toTextRange();
    }
}
