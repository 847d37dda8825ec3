package ai.phprefactor.analyzer;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

public interface IProject {
    Path getRoot();

    /** All PHP source files that survive the configured exclusions. */
    Set<ProjectFile> getAllFiles();

    /** Directory names skipped wherever they appear in the tree. */
    Set<String> getExcludedDirectories();

    default Optional<ProjectFile> toProjectFile(Path path) {
        var abs = path.toAbsolutePath().normalize();
        if (!abs.startsWith(getRoot())) {
            return Optional.empty();
        }
        return Optional.of(new ProjectFile(getRoot(), getRoot().relativize(abs)));
    }

    default ProjectFile file(String relPath) {
        return new ProjectFile(getRoot(), relPath);
    }
}
