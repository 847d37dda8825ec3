package ai.phprefactor.analyzer.composer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class Psr4MappingTest {

    @Test
    void mapsNestedDirectoriesOntoNamespaceSegments() {
        var mapping = new Psr4Mapping(List.of(new Psr4Mapping.Entry("App\\", "src")));
        assertEquals(Optional.of("App"), mapping.namespaceFor("src"));
        assertEquals(Optional.of("App\\Services\\Mail"), mapping.namespaceFor("src/Services/Mail"));
        assertEquals(Optional.empty(), mapping.namespaceFor("lib/Services"));
        assertEquals(Optional.empty(), mapping.namespaceFor("srcfoo"));
    }

    @Test
    void longestDirectoryWins() {
        var mapping = new Psr4Mapping(List.of(
                new Psr4Mapping.Entry("App\\", "src"),
                new Psr4Mapping.Entry("Domain\\", "src/Domain")));
        assertEquals(Optional.of("Domain\\Order"), mapping.namespaceFor("src/Domain/Order"));
        assertEquals(Optional.of("App\\Http"), mapping.namespaceFor("src/Http"));
    }

    @Test
    void firstDeclaredEntryWinsATie() {
        var mapping = new Psr4Mapping(List.of(
                new Psr4Mapping.Entry("First\\", "src"),
                new Psr4Mapping.Entry("Second\\", "src")));
        assertEquals(Optional.of("First\\Util"), mapping.namespaceFor("src/Util"));
    }

    @Test
    void emptyDirectoryMapsTheWholeTree() {
        var mapping = new Psr4Mapping(List.of(new Psr4Mapping.Entry("Lib\\", "")));
        assertEquals(Optional.of("Lib"), mapping.namespaceFor(""));
        assertEquals(Optional.of("Lib\\Cache"), mapping.namespaceFor("Cache"));
    }

    @Test
    void normalizesDirectories() {
        assertEquals("src/App", Psr4Mapping.normalizeDirectory("./src/App/"));
        assertEquals("", Psr4Mapping.normalizeDirectory("./"));
        assertEquals("lib/x", Psr4Mapping.normalizeDirectory("lib\\x"));
    }
}
