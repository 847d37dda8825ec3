package ai.phprefactor.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * A source file named relative to its project root. Two ProjectFiles compare equal only when both the root and the
 * normalized relative path match, which bare Paths do not guarantee.
 */
public final class ProjectFile implements Comparable<ProjectFile> {
    private final Path root;
    private final Path relPath;

    /** root must be absolute and normalized; relPath is normalized here */
    @JsonCreator
    public ProjectFile(@JsonProperty("root") Path root, @JsonProperty("relPath") Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }
        this.root = root;
        this.relPath = relPath.normalize();
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    @JsonGetter("root")
    public Path getRoot() {
        return root;
    }

    @JsonGetter("relPath")
    public Path getRelPath() {
        return relPath;
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    public String read() throws IOException {
        return Files.readString(absPath());
    }

    public void write(String content) throws IOException {
        Files.createDirectories(absPath().getParent());
        Files.writeString(absPath(), content);
    }

    public boolean exists() {
        return Files.exists(absPath());
    }

    /** Relative parent directory; the empty path for files at the root. */
    @JsonIgnore
    public Path getParent() {
        var p = relPath.getParent();
        return p == null ? Path.of("") : p;
    }

    @JsonIgnore
    public String getFileName() {
        return relPath.getFileName().toString();
    }

    /** File name without its extension. */
    @JsonIgnore
    public String stem() {
        var name = getFileName();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(0, lastDot) : name;
    }

    /** return the (lowercased) extension [not including the dot] */
    @JsonIgnore
    public String extension() {
        var filename = getFileName();
        int lastDot = filename.lastIndexOf('.');
        if (lastDot > 0 && lastDot < filename.length() - 1) {
            return filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }

    @JsonIgnore
    public boolean isPhp() {
        return "php".equals(extension());
    }

    /** Relative path with forward slashes regardless of platform. */
    public String toUnixPath() {
        return relPath.toString().replace('\\', '/');
    }

    @Override
    public int compareTo(ProjectFile o) {
        return absPath().compareTo(o.absPath());
    }

    @Override
    public String toString() {
        return relPath.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile projectFile)) return false;
        return Objects.equals(root, projectFile.root) && Objects.equals(relPath, projectFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
