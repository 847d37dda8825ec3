package ai.phprefactor.analyzer.php;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ImportTableTest {

    @Test
    void resolvesNamesAsPhpDoes() throws PhpParseException {
        var tree = new PhpParser().parse(
                """
                <?php
                namespace App\\Http;

                use App\\Models;
                use Vendor\\Lib\\Client as HttpClient;
                """,
                "x.php");
        var imports = tree.importTable();
        var ns = tree.namespaceName();

        assertEquals("Vendor\\Lib\\Client", imports.resolve("HttpClient", ns));
        assertEquals("App\\Models\\User", imports.resolve("Models\\User", ns));
        assertEquals("Other\\Thing", imports.resolve("\\Other\\Thing", ns));
        assertEquals("App\\Http\\Request", imports.resolve("Request", ns));
        assertEquals("App\\Http\\Sub\\X", imports.resolve("namespace\\Sub\\X", ns));
        assertTrue(imports.importsFqn("vendor\\lib\\client"));
    }

    @Test
    void joinHandlesTheGlobalNamespace() {
        assertEquals("Foo", ImportTable.join("", "Foo"));
        assertEquals("A\\Foo", ImportTable.join("A", "Foo"));
    }
}
