package ai.phprefactor.analyzer;

import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Declared supertypes of one class-like. Supertype names are kept as written in the source (minus a leading
 * backslash) rather than resolved, so comparisons happen on short names. An interface's parent interfaces are held in
 * {@code implementsNames}.
 */
public record InheritanceEdge(
        String className,
        String classFqn,
        ProjectFile file,
        @Nullable String extendsName,
        Set<String> implementsNames) {

    public InheritanceEdge {
        implementsNames = Set.copyOf(implementsNames);
    }

    public boolean implementsType(String name) {
        var wanted = simpleName(name);
        return implementsNames.stream().anyMatch(n -> simpleName(n).equalsIgnoreCase(wanted));
    }

    public boolean extendsType(String name) {
        return extendsName != null && simpleName(extendsName).equalsIgnoreCase(simpleName(name));
    }

    public static String simpleName(String name) {
        int idx = name.lastIndexOf('\\');
        return idx < 0 ? name : name.substring(idx + 1);
    }
}
