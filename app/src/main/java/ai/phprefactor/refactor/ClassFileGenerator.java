package ai.phprefactor.refactor;

import ai.phprefactor.analyzer.ProjectFile;
import ai.phprefactor.analyzer.SymbolKind;
import ai.phprefactor.analyzer.composer.NamespaceResolver;
import ai.phprefactor.util.AtomicWrites;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.util.Locale;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Writes an empty class, interface, trait or enum named after the file, in the namespace its location maps to. */
public final class ClassFileGenerator {
    private static final Logger logger = LogManager.getLogger(ClassFileGenerator.class);

    private static final Pattern CLASS_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final NamespaceResolver namespaces;

    public ClassFileGenerator(NamespaceResolver namespaces) {
        this.namespaces = namespaces;
    }

    public String skeleton(ProjectFile file, SymbolKind kind) {
        if (!kind.isClassLike()) {
            throw new IllegalArgumentException("Not a class-like kind: " + kind);
        }
        var name = file.stem();
        if (!CLASS_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("'%s' is not a valid class name".formatted(name));
        }
        var text = new StringBuilder("<?php\n\n");
        namespaces.resolve(file)
                .filter(ns -> !ns.isEmpty())
                .ifPresent(ns -> text.append("namespace ").append(ns).append(";\n\n"));
        text.append(kind.name().toLowerCase(Locale.ROOT)).append(' ').append(name).append("\n{\n}\n");
        return text.toString();
    }

    /** @throws FileAlreadyExistsException if the file exists; it is never overwritten */
    public void create(ProjectFile file, SymbolKind kind) throws IOException {
        if (file.exists()) {
            throw new FileAlreadyExistsException(file.absPath().toString());
        }
        AtomicWrites.atomicOverwrite(file.absPath(), skeleton(file, kind));
        logger.info("Created {} {}", kind.name().toLowerCase(Locale.ROOT), file);
    }
}
