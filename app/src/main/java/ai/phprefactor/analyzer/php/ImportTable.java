package ai.phprefactor.analyzer.php;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Class imports of one file, keyed by the local (aliased or short) name, case-insensitively as PHP does. */
public final class ImportTable {
    private final Map<String, String> byLocalName;

    private ImportTable(Map<String, String> byLocalName) {
        this.byLocalName = byLocalName;
    }

    public static ImportTable of(List<PhpNode.UseDeclaration> declarations) {
        var map = new LinkedHashMap<String, String>();
        for (var declaration : declarations) {
            if (declaration.kind() != PhpNode.UseKind.CLASS) {
                continue;
            }
            for (var clause : declaration.clauses()) {
                map.putIfAbsent(clause.localName().toLowerCase(Locale.ROOT), clause.name());
            }
        }
        return new ImportTable(map);
    }

    public Optional<String> lookup(String localName) {
        return Optional.ofNullable(byLocalName.get(localName.toLowerCase(Locale.ROOT)));
    }

    public boolean imports(String localName) {
        return byLocalName.containsKey(localName.toLowerCase(Locale.ROOT));
    }

    /** True if some clause imports exactly this FQN. */
    public boolean importsFqn(String fqn) {
        return byLocalName.values().stream().anyMatch(v -> v.equalsIgnoreCase(fqn));
    }

    /**
     * Resolves a class name as written into a FQN without leading separator: fully qualified names stand as they are,
     * otherwise the first segment goes through the imports, otherwise the current namespace is prepended.
     */
    public String resolve(String written, String currentNamespace) {
        if (written.startsWith("\\")) {
            return written.substring(1);
        }
        if (written.regionMatches(true, 0, "namespace\\", 0, 10)) {
            return join(currentNamespace, written.substring(10));
        }
        int sep = written.indexOf('\\');
        var first = sep < 0 ? written : written.substring(0, sep);
        var imported = lookup(first);
        if (imported.isPresent()) {
            return sep < 0 ? imported.get() : imported.get() + written.substring(sep);
        }
        return join(currentNamespace, written);
    }

    public String resolve(TypeRef ref, String currentNamespace) {
        return resolve(ref.text(), currentNamespace);
    }

    public boolean isEmpty() {
        return byLocalName.isEmpty();
    }

    public static String join(String namespace, String name) {
        return namespace.isEmpty() ? name : namespace + "\\" + name;
    }
}
