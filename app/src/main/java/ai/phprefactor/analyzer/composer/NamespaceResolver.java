package ai.phprefactor.analyzer.composer;

import ai.phprefactor.analyzer.ProjectFile;
import java.util.Optional;

public interface NamespaceResolver {
    /** Logical namespace of the file derived from its location; empty when no mapping applies. */
    Optional<String> resolve(ProjectFile file);

    /** Drops cached configuration, e.g. after composer.json changed. */
    void invalidate();
}
