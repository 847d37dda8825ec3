package ai.phprefactor.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A class-like or method definition recorded by the index.
 *
 * @param name short name as declared
 * @param fullyQualifiedName namespace-qualified name without a leading backslash; methods use {@code ClassFqn::name}
 * @param kind what was declared
 * @param file the defining file
 * @param span span of the declared name
 * @param parentSymbol for methods, the FQN of the owning class-like
 */
public record SymbolDefinition(
        String name,
        String fullyQualifiedName,
        SymbolKind kind,
        ProjectFile file,
        SourceSpan span,
        @Nullable String parentSymbol) {

    public static SymbolDefinition classLike(
            String name, String fqn, SymbolKind kind, ProjectFile file, SourceSpan span) {
        assert kind.isClassLike() : kind;
        return new SymbolDefinition(name, fqn, kind, file, span, null);
    }

    public static SymbolDefinition method(String name, String classFqn, ProjectFile file, SourceSpan span) {
        return new SymbolDefinition(name, classFqn + "::" + name, SymbolKind.METHOD, file, span, classFqn);
    }

    /** Namespace portion of the FQN, empty for the global namespace. */
    public String namespace() {
        var fqn = kind == SymbolKind.METHOD && parentSymbol != null ? parentSymbol : fullyQualifiedName;
        int idx = fqn.lastIndexOf('\\');
        return idx < 0 ? "" : fqn.substring(0, idx);
    }
}
