package ai.phprefactor.analyzer;

/** One text replacement in one file. An empty range is an insertion, empty replacement text a deletion. */
public record EditOperation(ProjectFile file, TextRange range, String replacementText) {
    public static EditOperation replace(ProjectFile file, SourceSpan span, String replacement) {
        return new EditOperation(file, span.toTextRange(), replacement);
    }

    public static EditOperation insert(ProjectFile file, TextPosition at, String text) {
        return new EditOperation(file, TextRange.empty(at), text);
    }

    @Override
    public String toString() {
        return file + "@" + range + " -> \"" + replacementText.replace("\n", "\\n") + "\"";
    }
}
