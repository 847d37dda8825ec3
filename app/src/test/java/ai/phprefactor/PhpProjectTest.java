package ai.phprefactor;

import static org.junit.jupiter.api.Assertions.*;

import ai.phprefactor.analyzer.ProjectFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PhpProjectTest {

    @TempDir
    Path root;

    private void write(String rel, String content) throws IOException {
        var path = root.resolve(rel);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
    }

    private static Set<String> relPaths(PhpProject project) {
        return project.getAllFiles().stream().map(ProjectFile::toUnixPath).collect(Collectors.toSet());
    }

    @Test
    void skipsVendorAndNonPhpFilesByDefault() throws IOException {
        write("src/A.php", "<?php\n");
        write("src/readme.md", "# A\n");
        write("vendor/lib/B.php", "<?php\n");
        write("node_modules/x/C.php", "<?php\n");

        var project = PhpProject.open(root);

        assertEquals(Set.of("src/A.php"), relPaths(project));
    }

    @Test
    void vendorCanBeIncluded() throws IOException {
        write("src/A.php", "<?php\n");
        write("vendor/lib/B.php", "<?php\n");
        write(".php-refactor/project.properties", "indexer.excludeVendor=false\n");

        var project = PhpProject.open(root);

        assertEquals(Set.of("src/A.php", "vendor/lib/B.php"), relPaths(project));
    }

    @Test
    void globExcludesApplyToRelativePaths() throws IOException {
        write("src/A.php", "<?php\n");
        write("tests/fixtures/Broken.php", "<?php\n");
        var props = new Properties();
        props.setProperty(ProjectSettings.EXCLUDE_KEY, "tests/fixtures/**, *.tmp");

        var project = new PhpProject(root, ProjectSettings.of(props));

        assertEquals(Set.of("src/A.php"), relPaths(project));
        assertFalse(project.isIncluded(new ProjectFile(root, "tests/fixtures/Other.php")));
        assertTrue(project.isIncluded(new ProjectFile(root, "tests/Unit/Other.php")));
    }

    @Test
    void fileListIsCachedUntilInvalidated() throws IOException {
        write("A.php", "<?php\n");
        var project = PhpProject.open(root);
        assertEquals(1, project.getAllFiles().size());

        write("B.php", "<?php\n");
        assertEquals(1, project.getAllFiles().size());

        project.invalidateAllFiles();
        assertEquals(2, project.getAllFiles().size());
    }

    @Test
    void settingsFallBackToDefaults() throws IOException {
        write(".php-refactor/project.properties", "phpstan.enabled=true\nphpstan.level=oops\nphpstan.timeoutSeconds=7\n");

        var settings = ProjectSettings.load(root);

        assertTrue(settings.isPhpstanEnabled());
        assertEquals(5, settings.phpstanLevel());
        assertEquals(7, settings.phpstanTimeout().toSeconds());
        assertTrue(settings.phpstanConfigFile().isEmpty());
        assertTrue(settings.isExcludeVendor());
        assertTrue(ProjectSettings.defaults().excludePatterns().isEmpty());
    }
}
