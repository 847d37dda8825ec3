package ai.phprefactor.analyzer.php;

import ai.phprefactor.analyzer.SourceSpan;
import java.util.Locale;
import java.util.Set;

/** A class or primitive name as written at a reference site, possibly qualified or with a leading backslash. */
public record TypeRef(String text, SourceSpan span) {
    public static final Set<String> BUILTIN_TYPES = Set.of(
            "int", "string", "bool", "float", "array", "object", "callable", "iterable", "void", "mixed", "never",
            "null", "true", "false", "self", "parent", "static");

    public boolean isFullyQualified() {
        return text.startsWith("\\");
    }

    /** True for {@code A\B} and {@code \A\B}, false for a bare {@code B}. */
    public boolean isQualified() {
        return text.indexOf('\\') >= 0;
    }

    public String simpleName() {
        int idx = text.lastIndexOf('\\');
        return idx < 0 ? text : text.substring(idx + 1);
    }

    /** Text with any leading backslash removed. */
    public String withoutLeadingSeparator() {
        return isFullyQualified() ? text.substring(1) : text;
    }

    public boolean isBuiltin() {
        return !isQualified() && BUILTIN_TYPES.contains(text.toLowerCase(Locale.ROOT));
    }

    public boolean isRelativeScope() {
        var lower = text.toLowerCase(Locale.ROOT);
        return lower.equals("self") || lower.equals("static") || lower.equals("parent");
    }
}
