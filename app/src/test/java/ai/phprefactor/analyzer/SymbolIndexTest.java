package ai.phprefactor.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.phprefactor.analyzer.php.PhpParseException;
import ai.phprefactor.analyzer.php.PhpParser;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SymbolIndexTest {
    private static final Path ROOT = Path.of("/workspace").toAbsolutePath();

    private final PhpParser parser = new PhpParser();
    private SymbolIndex index;

    private final ProjectFile contractFile = new ProjectFile(ROOT, "src/Contracts/Notifier.php");
    private final ProjectFile mailFile = new ProjectFile(ROOT, "src/Services/MailNotifier.php");
    private final ProjectFile smsFile = new ProjectFile(ROOT, "src/Services/SmsNotifier.php");

    private static final String CONTRACT =
            """
            <?php
            namespace App\\Contracts;

            interface Notifier
            {
                public function send(string $message): void;
            }
            """;

    private static final String MAIL =
            """
            <?php
            namespace App\\Services;

            use App\\Contracts\\Notifier;

            class MailNotifier extends BaseNotifier implements Notifier
            {
                public function send(string $message): void
                {
                    $transport = new SmtpTransport();
                    $transport->deliver($message);
                }

                private function format(string $message): string
                {
                    return $message;
                }
            }
            """;

    @BeforeEach
    void setUp() throws PhpParseException {
        index = new SymbolIndex();
        index.scanFile(contractFile, parser.parse(CONTRACT, contractFile.toString()));
        index.scanFile(mailFile, parser.parse(MAIL, mailFile.toString()));
    }

    @Test
    void recordsDefinitionsWithNamespaceQualifiedNames() {
        var defs = index.lookupDefinitions("MailNotifier");
        assertEquals(1, defs.size());
        var def = defs.get(0);
        assertEquals("App\\Services\\MailNotifier", def.fullyQualifiedName());
        assertEquals(SymbolKind.CLASS, def.kind());
        assertEquals(mailFile, def.file());
        assertEquals(SymbolKind.INTERFACE, index.lookupDefinitions("notifier").get(0).kind());
        assertEquals(defs, index.lookupDefinitions("\\App\\Services\\MailNotifier"));
    }

    @Test
    void recordsMethodsPerClass() {
        var methods = index.lookupMethod("MailNotifier", "send");
        assertEquals(1, methods.size());
        assertEquals("App\\Services\\MailNotifier::send", methods.get(0).fullyQualifiedName());
        assertEquals(1, index.lookupMethod("App\\Services\\MailNotifier", "FORMAT").size());
        assertTrue(index.lookupMethod("Other\\MailNotifier", "send").isEmpty());
        assertEquals(1, index.lookupMethod("Notifier", "send").size());
    }

    @Test
    void recordsInheritanceAsWritten() {
        assertEquals(List.of("MailNotifier"), index.implementationsOf("Notifier"));
        assertEquals(List.of("MailNotifier"), index.implementationsOf("App\\Contracts\\Notifier"));
        assertEquals("MailNotifier", index.subclassesOf("BaseNotifier").get(0).name());
        var edge = index.inheritanceEdges().stream()
                .filter(e -> e.className().equals("MailNotifier"))
                .findFirst()
                .orElseThrow();
        assertEquals("BaseNotifier", edge.extendsName());
        assertEquals(Set.of("Notifier"), edge.implementsNames());
    }

    @Test
    void usageIndexTracksImportsAndReferences() {
        assertEquals(Set.of(mailFile), index.filesUsing("Notifier"));
        assertEquals(Set.of(mailFile), index.filesUsing("SmtpTransport"));
        assertTrue(index.filesUsing("string").isEmpty());
    }

    @Test
    void rescanningAFileIsIdempotent() throws PhpParseException {
        var before = index.stats();
        index.scanFile(mailFile, parser.parse(MAIL, mailFile.toString()));
        index.scanFile(mailFile, parser.parse(MAIL, mailFile.toString()));

        assertEquals(before, index.stats());
        assertEquals(1, index.lookupDefinitions("MailNotifier").size());
        assertEquals(1, index.lookupMethod("MailNotifier", "send").size());
        assertEquals(1, index.implementorsOf("Notifier").size());
    }

    @Test
    void rescanReplacesRemovedDeclarations() throws PhpParseException {
        index.scanFile(
                mailFile,
                parser.parse("<?php\nnamespace App\\Services;\n\nclass Renamed {}\n", mailFile.toString()));

        assertTrue(index.lookupDefinitions("MailNotifier").isEmpty());
        assertTrue(index.lookupMethod("MailNotifier", "send").isEmpty());
        assertTrue(index.implementationsOf("Notifier").isEmpty());
        assertTrue(index.filesUsing("SmtpTransport").isEmpty());
        assertEquals("App\\Services\\Renamed", index.definitionsInFile(mailFile).get(0).fullyQualifiedName());
    }

    @Test
    void sameShortNameInSeveralFilesIsKept() throws PhpParseException {
        var other = new ProjectFile(ROOT, "legacy/MailNotifier.php");
        index.scanFile(other, parser.parse("<?php\nnamespace Legacy;\nclass MailNotifier {}\n", other.toString()));

        var defs = index.lookupDefinitions("MailNotifier");
        assertEquals(2, defs.size());
        assertEquals("Legacy\\MailNotifier", index.findDefinition("Legacy\\MailNotifier").get(0).fullyQualifiedName());
        assertEquals(
                "App\\Services\\MailNotifier",
                index.findDefinition("App\\Services\\MailNotifier").get(0).fullyQualifiedName());
    }

    @Test
    void removeFilePrunesEverything() throws PhpParseException {
        index.scanFile(
                smsFile,
                parser.parse(
                        "<?php\nnamespace App\\Services;\nuse App\\Contracts\\Notifier;\nclass SmsNotifier implements Notifier {}\n",
                        smsFile.toString()));
        assertEquals(2, index.implementorsOf("Notifier").size());

        index.removeFile(mailFile);

        assertEquals(List.of("SmsNotifier"), index.implementationsOf("Notifier"));
        assertTrue(index.lookupDefinitions("MailNotifier").isEmpty());
        assertEquals(Set.of(smsFile), index.filesUsing("Notifier"));
        assertFalse(index.indexedFiles().contains(mailFile));
    }

    @Test
    void interfaceParentsCountAsImplementedInterfaces() throws PhpParseException {
        var file = new ProjectFile(ROOT, "src/Contracts/UrgentNotifier.php");
        index.scanFile(
                file,
                parser.parse(
                        "<?php\nnamespace App\\Contracts;\ninterface UrgentNotifier extends Notifier {}\n",
                        file.toString()));
        var implementors = index.implementorsOf("Notifier");
        assertTrue(implementors.stream().anyMatch(d -> d.name().equals("UrgentNotifier")));
    }
}
