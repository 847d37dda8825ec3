package ai.phprefactor.analyzer;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Read-only view of the project's symbol tables. Data is eventually consistent with the file system; callers that need
 * exact positions re-parse the files involved.
 */
public interface ISymbolIndex {
    /** Class-like definitions whose short name matches, case-insensitively. Several files may define the same name. */
    List<SymbolDefinition> lookupDefinitions(String name);

    /**
     * Method definitions for {@code ClassName::methodName}. A namespace-qualified class restricts the result to
     * methods whose owning class has exactly that FQN.
     */
    List<SymbolDefinition> lookupMethod(String classFqn, String methodName);

    /** Short names of the class-likes that declare the interface among their implemented (or extended) interfaces. */
    List<String> implementationsOf(String interfaceName);

    /** Definitions of every class-like returned by {@link #implementationsOf}. */
    List<SymbolDefinition> implementorsOf(String interfaceName);

    /** Direct subclasses of the named class. */
    List<SymbolDefinition> subclassesOf(String className);

    /** Files referencing the short name through an import or a bare name. Coarse; for candidate selection only. */
    Set<ProjectFile> filesUsing(String shortName);

    List<SymbolDefinition> definitionsInFile(ProjectFile file);

    Collection<InheritanceEdge> inheritanceEdges();

    Set<ProjectFile> indexedFiles();

    boolean isEmpty();
}
