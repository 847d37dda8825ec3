package ai.phprefactor.analyzer.composer;

import static org.junit.jupiter.api.Assertions.*;

import ai.phprefactor.analyzer.ProjectFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ComposerNamespaceResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void resolvesAutoloadAndAutoloadDev() throws IOException {
        Files.writeString(
                tempDir.resolve("composer.json"),
                """
                {
                  "autoload": { "psr-4": { "App\\\\": "src/" } },
                  "autoload-dev": { "psr-4": { "Tests\\\\": ["tests/", "tests-extra/"] } }
                }
                """);
        var resolver = new ComposerNamespaceResolver(tempDir);

        assertEquals(Optional.of("App\\Services"), resolver.resolve(new ProjectFile(tempDir, "src/Services/Mailer.php")));
        assertEquals(Optional.of("Tests\\Unit"), resolver.resolve(new ProjectFile(tempDir, "tests/Unit/MailerTest.php")));
        assertEquals(Optional.of("Tests"), resolver.resolve(new ProjectFile(tempDir, "tests-extra/Helper.php")));
        assertEquals(Optional.empty(), resolver.resolve(new ProjectFile(tempDir, "scripts/run.php")));
    }

    @Test
    void nearestComposerJsonGoverns() throws IOException {
        Files.writeString(tempDir.resolve("composer.json"), "{\"autoload\":{\"psr-4\":{\"App\\\\\":\"src/\"}}}");
        var package1 = tempDir.resolve("packages/billing");
        Files.createDirectories(package1);
        Files.writeString(package1.resolve("composer.json"), "{\"autoload\":{\"psr-4\":{\"Billing\\\\\":\"lib/\"}}}");
        var resolver = new ComposerNamespaceResolver(tempDir);

        assertEquals(
                Optional.of("Billing\\Invoice"),
                resolver.resolve(new ProjectFile(tempDir, "packages/billing/lib/Invoice/Pdf.php")));
    }

    @Test
    void missingOrBrokenConfigurationResolvesNothing() throws IOException {
        var resolver = new ComposerNamespaceResolver(tempDir);
        assertEquals(Optional.empty(), resolver.resolve(new ProjectFile(tempDir, "src/A.php")));

        Files.writeString(tempDir.resolve("composer.json"), "{ not json");
        resolver.invalidate();
        assertEquals(Optional.empty(), resolver.resolve(new ProjectFile(tempDir, "src/A.php")));
    }

    @Test
    void invalidateReloadsConfiguration() throws IOException {
        Files.writeString(tempDir.resolve("composer.json"), "{\"autoload\":{\"psr-4\":{\"Old\\\\\":\"src/\"}}}");
        var resolver = new ComposerNamespaceResolver(tempDir);
        var file = new ProjectFile(tempDir, "src/A.php");
        assertEquals(Optional.of("Old"), resolver.resolve(file));

        Files.writeString(tempDir.resolve("composer.json"), "{\"autoload\":{\"psr-4\":{\"New\\\\\":\"src/\"}}}");
        assertEquals(Optional.of("Old"), resolver.resolve(file));
        resolver.invalidate();
        assertEquals(Optional.of("New"), resolver.resolve(file));
    }
}
