package ai.phprefactor.refactor;

import ai.phprefactor.analyzer.TextRange;
import ai.phprefactor.analyzer.php.SourceText;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * The leading run of {@code use} statements of a file, found line by line without parsing so it also works on files
 * with syntax errors. The block starts at the first import line, may contain blank lines between imports, and ends at
 * the last import line; it stops at the first other statement once an import has been seen, and never reaches past a
 * class, interface, trait or enum declaration.
 *
 * @param firstLine zero-based first line of the block, or -1 when the file has no imports
 * @param lastLine zero-based last line holding an import, or -1
 * @param statements the import statements in file order, one entry per statement
 * @param namespaceLine zero-based line of the namespace declaration, or -1
 * @param insertLine where a new block goes when none exists: after the namespace or {@code <?php} line
 */
public record ImportBlock(
        int firstLine, int lastLine, List<String> statements, int namespaceLine, int insertLine) {

    private static final Pattern USE_STATEMENT = Pattern.compile("^use\\s+([^;]+);", Pattern.CASE_INSENSITIVE);
    private static final Pattern USE_START = Pattern.compile("^use\\s", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAMESPACE_DECLARATION = Pattern.compile("^namespace\\s+[^;]+;", Pattern.CASE_INSENSITIVE);
    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "^(?:(?:abstract|final|readonly)\\s+)*(?:class|interface|trait|enum)\\s+", Pattern.CASE_INSENSITIVE);

    public ImportBlock {
        statements = List.copyOf(statements);
    }

    public static ImportBlock detect(SourceText source) {
        var lines = source.lines();
        int namespaceLine = -1;
        int phpTagLine = -1;
        int first = -1;
        int last = -1;
        var statements = new ArrayList<String>();
        for (int i = 0; i < lines.size(); i++) {
            var trimmed = lines.get(i).trim();
            if (phpTagLine < 0 && trimmed.contains("<?php")) {
                phpTagLine = i;
            }
            if (namespaceLine < 0 && NAMESPACE_DECLARATION.matcher(trimmed).find()) {
                namespaceLine = i;
                continue;
            }
            if (USE_START.matcher(trimmed).find()) {
                int end = i;
                var statement = new StringBuilder(trimmed);
                while (!statement.toString().contains(";") && end + 1 < lines.size()) {
                    end++;
                    statement.append('\n').append(lines.get(end).trim());
                }
                if (!USE_STATEMENT.matcher(statement.toString().replace('\n', ' ')).find()) {
                    break;
                }
                statements.add(normalize(statement.toString()));
                if (first < 0) {
                    first = i;
                }
                last = end;
                i = end;
                continue;
            }
            if (trimmed.isEmpty()) {
                continue;
            }
            if (first >= 0 || TYPE_DECLARATION.matcher(trimmed).find()) {
                break;
            }
        }
        int insertLine = namespaceLine >= 0 ? namespaceLine + 1 : phpTagLine >= 0 ? phpTagLine + 1 : 0;
        return new ImportBlock(first, last, statements, namespaceLine, insertLine);
    }

    /** Lowercases the keyword so that {@code USE A;} and {@code use A;} sort and compare alike. */
    static String normalize(String statement) {
        return "use" + statement.substring(3);
    }

    public boolean exists() {
        return firstLine >= 0;
    }

    /** From the start of the first import line to the end of the last one. */
    public TextRange range(SourceText source) {
        if (!exists()) {
            throw new IllegalStateException("No import block");
        }
        return TextRange.of(firstLine, 0, lastLine, source.line(lastLine).length());
    }

    /** The imported name of a single-name statement such as {@code use A\B;} or {@code use A\B as C;}, else null. */
    static @Nullable String importedName(String statement) {
        var matcher = USE_STATEMENT.matcher(statement.replace('\n', ' '));
        if (!matcher.find()) {
            return null;
        }
        var body = matcher.group(1).trim();
        if (body.contains(",") || body.contains("{")) {
            return null;
        }
        var lower = body.toLowerCase(Locale.ROOT);
        if (lower.startsWith("function ") || lower.startsWith("const ")) {
            return null;
        }
        int as = lower.indexOf(" as ");
        var name = as < 0 ? body : body.substring(0, as).trim();
        return name.startsWith("\\") ? name.substring(1) : name;
    }
}
