package ai.phprefactor.analyzer.composer;

import ai.phprefactor.analyzer.ProjectFile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves namespaces from the PSR-4 sections of the nearest composer.json, searching from the file's directory up to
 * the project root. Each composer.json is read once and cached until {@link #invalidate()}.
 */
public final class ComposerNamespaceResolver implements NamespaceResolver {
    private static final Logger logger = LogManager.getLogger(ComposerNamespaceResolver.class);
    public static final String COMPOSER_JSON = "composer.json";
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Path projectRoot;
    private final Map<Path, Optional<Psr4Mapping>> mappings = new ConcurrentHashMap<>();

    public ComposerNamespaceResolver(Path projectRoot) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
    }

    @Override
    public Optional<String> resolve(ProjectFile file) {
        var abs = file.absPath().toAbsolutePath().normalize();
        if (!abs.startsWith(projectRoot)) {
            return Optional.empty();
        }
        var mappingRoot = findMappingRoot(abs.getParent());
        if (mappingRoot.isEmpty()) {
            return Optional.empty();
        }
        var mapping = mappingFor(mappingRoot.get());
        if (mapping.isEmpty()) {
            return Optional.empty();
        }
        var relativeDir = mappingRoot.get().relativize(abs.getParent()).toString().replace('\\', '/');
        return mapping.get().namespaceFor(relativeDir);
    }

    @Override
    public void invalidate() {
        mappings.clear();
    }

    private Optional<Path> findMappingRoot(Path start) {
        for (Path dir = start; dir != null && dir.startsWith(projectRoot); dir = dir.getParent()) {
            if (Files.isRegularFile(dir.resolve(COMPOSER_JSON))) {
                return Optional.of(dir);
            }
        }
        return Optional.empty();
    }

    private Optional<Psr4Mapping> mappingFor(Path mappingRoot) {
        return mappings.computeIfAbsent(mappingRoot, ComposerNamespaceResolver::load);
    }

    static Optional<Psr4Mapping> load(Path mappingRoot) {
        var composerFile = mappingRoot.resolve(COMPOSER_JSON);
        JsonNode root;
        try {
            root = objectMapper.readTree(composerFile.toFile());
        } catch (IOException e) {
            logger.warn("Unable to read {}: {}", composerFile, e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            logger.warn("Ignoring {}: not a JSON object", composerFile);
            return Optional.empty();
        }
        var entries = new ArrayList<Psr4Mapping.Entry>();
        addPsr4(root.path("autoload").path("psr-4"), entries);
        addPsr4(root.path("autoload-dev").path("psr-4"), entries);
        logger.debug("Loaded {} PSR-4 entries from {}", entries.size(), composerFile);
        return Optional.of(new Psr4Mapping(entries));
    }

    private static void addPsr4(JsonNode psr4, List<Psr4Mapping.Entry> out) {
        if (!psr4.isObject()) {
            return;
        }
        var fields = psr4.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var value = field.getValue();
            if (value.isTextual()) {
                out.add(new Psr4Mapping.Entry(field.getKey(), Psr4Mapping.normalizeDirectory(value.asText())));
            } else if (value.isArray()) {
                for (var dir : value) {
                    if (dir.isTextual()) {
                        out.add(new Psr4Mapping.Entry(field.getKey(), Psr4Mapping.normalizeDirectory(dir.asText())));
                    }
                }
            }
        }
    }
}
