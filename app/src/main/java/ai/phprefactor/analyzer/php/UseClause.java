package ai.phprefactor.analyzer.php;

import ai.phprefactor.analyzer.SourceSpan;
import org.jetbrains.annotations.Nullable;

/**
 * One imported name. For grouped imports {@code name} is the full name with the group prefix applied while
 * {@code nameSpan} covers only the text written inside the braces.
 */
public record UseClause(String name, @Nullable String alias, SourceSpan nameSpan, SourceSpan span) {
    /** The short name the import introduces into the file. */
    public String localName() {
        if (alias != null) {
            return alias;
        }
        int idx = name.lastIndexOf('\\');
        return idx < 0 ? name : name.substring(idx + 1);
    }
}
