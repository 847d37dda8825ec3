package ai.phprefactor;

import ai.phprefactor.analyzer.IProject;
import ai.phprefactor.analyzer.ProjectFile;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** A directory of PHP sources. The file list is computed on demand and cached until {@link #invalidateAllFiles()}. */
public final class PhpProject implements IProject {
    private static final Logger logger = LogManager.getLogger(PhpProject.class);

    private final Path root;
    private final ProjectSettings settings;
    private final List<PathMatcher> excludeMatchers;

    @Nullable
    private volatile Set<ProjectFile> allFilesCache;

    public PhpProject(Path root, ProjectSettings settings) {
        this.root = root.toAbsolutePath().normalize();
        this.settings = settings;
        this.excludeMatchers = settings.excludePatterns().stream()
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p))
                .toList();
    }

    public static PhpProject open(Path root) {
        var normalized = root.toAbsolutePath().normalize();
        return new PhpProject(normalized, ProjectSettings.load(normalized));
    }

    @Override
    public Path getRoot() {
        return root;
    }

    public ProjectSettings getSettings() {
        return settings;
    }

    @Override
    public Set<String> getExcludedDirectories() {
        return settings.excludedDirectories();
    }

    @Override
    public synchronized Set<ProjectFile> getAllFiles() {
        var cached = allFilesCache;
        if (cached == null) {
            cached = Collections.unmodifiableSet(walk());
            allFilesCache = cached;
        }
        return cached;
    }

    public synchronized void invalidateAllFiles() {
        allFilesCache = null;
    }

    /** True when the file is a PHP source this project would index. */
    public boolean isIncluded(ProjectFile file) {
        if (!file.isPhp()) {
            return false;
        }
        var rel = file.getRelPath();
        for (int i = 0; i < rel.getNameCount() - 1; i++) {
            if (getExcludedDirectories().contains(rel.getName(i).toString())) {
                return false;
            }
        }
        return excludeMatchers.stream().noneMatch(m -> m.matches(rel));
    }

    private Set<ProjectFile> walk() {
        var files = new TreeSet<ProjectFile>();
        var excludedDirs = getExcludedDirectories();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && excludedDirs.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        var projectFile = new ProjectFile(root, root.relativize(file));
                        if (isIncluded(projectFile)) {
                            files.add(projectFile);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        logger.debug("Found {} PHP files under {}", files.size(), root);
        return files;
    }
}
