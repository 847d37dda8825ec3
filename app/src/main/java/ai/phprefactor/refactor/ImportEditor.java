package ai.phprefactor.refactor;

import ai.phprefactor.analyzer.EditOperation;
import ai.phprefactor.analyzer.ProjectFile;
import ai.phprefactor.analyzer.TextPosition;
import ai.phprefactor.analyzer.TextRange;
import ai.phprefactor.analyzer.php.SourceText;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Adds and removes class imports by rewriting the whole {@link ImportBlock} in one edit: statements are deduplicated
 * and sorted alphabetically by their text. A file without imports gets a new block after its namespace declaration,
 * separated from neighbouring non-blank lines by exactly one blank line.
 */
public final class ImportEditor {
    static final Comparator<String> STATEMENT_ORDER =
            String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private ImportEditor() {}

    public static Optional<EditOperation> addImports(ProjectFile file, SourceText source, Collection<String> fqns) {
        return rewrite(file, source, fqns, List.of());
    }

    /**
     * @param add names to import unless already imported
     * @param remove names whose single-name {@code use} statements are dropped
     * @return the edit, or empty when the block would not change
     */
    public static Optional<EditOperation> rewrite(
            ProjectFile file, SourceText source, Collection<String> add, Collection<String> remove) {
        var block = ImportBlock.detect(source);
        var statements = new LinkedHashMap<String, String>();
        for (var statement : block.statements()) {
            statements.putIfAbsent(key(statement), statement);
        }
        boolean changed = statements.size() != block.statements().size();

        for (var fqn : remove) {
            var name = stripLeadingSeparator(fqn);
            changed |= statements.values().removeIf(s -> {
                var imported = ImportBlock.importedName(s);
                return imported != null && imported.equalsIgnoreCase(name) && !s.toLowerCase(Locale.ROOT).contains(" as ");
            });
        }
        var additions = new ArrayList<String>();
        for (var fqn : add) {
            var name = stripLeadingSeparator(fqn);
            boolean present = statements.values().stream().anyMatch(s -> name.equalsIgnoreCase(ImportBlock.importedName(s)))
                    || additions.stream().anyMatch(s -> s.equalsIgnoreCase("use " + name + ";"));
            if (!present) {
                additions.add("use " + name + ";");
            }
        }
        if (!changed && additions.isEmpty()) {
            return Optional.empty();
        }

        var separator = source.lineSeparator();
        if (block.exists()) {
            var all = new ArrayList<>(statements.values());
            all.addAll(additions);
            all.sort(STATEMENT_ORDER);
            if (all.isEmpty()) {
                return Optional.of(deleteBlock(file, source, block));
            }
            var text = String.join("\n", all);
            if (!separator.equals("\n")) {
                text = text.replace("\n", separator);
            }
            return Optional.of(new EditOperation(file, block.range(source), text));
        }
        if (additions.isEmpty()) {
            return Optional.empty();
        }
        additions.sort(STATEMENT_ORDER);
        return Optional.of(insertBlock(file, source, block.insertLine(), String.join(separator, additions)));
    }

    private static EditOperation insertBlock(ProjectFile file, SourceText source, int insertLine, String text) {
        var separator = source.lineSeparator();
        if (insertLine >= source.lineCount()) {
            int lastLine = source.lineCount() - 1;
            var lastText = source.line(lastLine);
            var prefix = lastText.isBlank() ? separator : separator + separator;
            return EditOperation.insert(
                    file, new TextPosition(lastLine, lastText.length()), prefix + text + separator);
        }
        var prefix = insertLine > 0 && !source.line(insertLine - 1).isBlank() ? separator : "";
        var suffix = source.line(insertLine).isBlank() ? separator : separator + separator;
        return EditOperation.insert(file, new TextPosition(insertLine, 0), prefix + text + suffix);
    }

    private static EditOperation deleteBlock(ProjectFile file, SourceText source, ImportBlock block) {
        int endLine = block.lastLine() + 1;
        // swallow one following blank line so removing the block does not leave two blank lines behind
        if (endLine < source.lineCount()
                && source.line(endLine).isBlank()
                && block.firstLine() > 0
                && source.line(block.firstLine() - 1).isBlank()) {
            endLine++;
        }
        var end = endLine < source.lineCount()
                ? new TextPosition(endLine, 0)
                : new TextPosition(source.lineCount() - 1, source.line(source.lineCount() - 1).length());
        return new EditOperation(file, new TextRange(new TextPosition(block.firstLine(), 0), end), "");
    }

    private static String key(String statement) {
        int semicolon = statement.indexOf(';');
        var body = semicolon < 0 ? statement : statement.substring(0, semicolon);
        return body.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String stripLeadingSeparator(String name) {
        return name.startsWith("\\") ? name.substring(1) : name;
    }
}
