package ai.phprefactor;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Per-project options read from {@code .php-refactor/project.properties}; every key has a default. */
public final class ProjectSettings {
    private static final Logger logger = LogManager.getLogger(ProjectSettings.class);

    public static final String CONFIG_DIR = ".php-refactor";
    public static final String PROJECT_PROPERTIES_FILE = "project.properties";

    public static final String EXCLUDE_VENDOR_KEY = "indexer.excludeVendor";
    public static final String EXCLUDE_KEY = "indexer.exclude";
    public static final String PHPSTAN_ENABLED_KEY = "phpstan.enabled";
    public static final String PHPSTAN_LEVEL_KEY = "phpstan.level";
    public static final String PHPSTAN_CONFIG_KEY = "phpstan.configFile";
    public static final String PHPSTAN_TIMEOUT_KEY = "phpstan.timeoutSeconds";

    public static final Set<String> DEFAULT_EXCLUDED_DIRECTORIES = Set.of("node_modules", "storage", "var", ".git");
    public static final String VENDOR_DIR = "vendor";

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final Properties props;

    private ProjectSettings(Properties props) {
        this.props = props;
    }

    public static ProjectSettings defaults() {
        return new ProjectSettings(new Properties());
    }

    public static ProjectSettings load(Path projectRoot) {
        var file = projectRoot.resolve(CONFIG_DIR).resolve(PROJECT_PROPERTIES_FILE);
        var props = new Properties();
        if (Files.exists(file)) {
            try (var reader = Files.newBufferedReader(file)) {
                props.load(reader);
            } catch (IOException e) {
                logger.error("Error loading project properties from {}: {}", file, e.getMessage());
                props.clear();
            }
        }
        return new ProjectSettings(props);
    }

    public static ProjectSettings of(Properties props) {
        var copy = new Properties();
        copy.putAll(props);
        return new ProjectSettings(copy);
    }

    public boolean isExcludeVendor() {
        return Boolean.parseBoolean(props.getProperty(EXCLUDE_VENDOR_KEY, "true"));
    }

    /** Directory names skipped anywhere in the tree. */
    public Set<String> excludedDirectories() {
        var dirs = new LinkedHashSet<>(DEFAULT_EXCLUDED_DIRECTORIES);
        if (isExcludeVendor()) {
            dirs.add(VENDOR_DIR);
        }
        return dirs;
    }

    /** Glob patterns matched against project-relative paths, e.g. {@code tests/fixtures/**}. */
    public List<String> excludePatterns() {
        return LIST_SPLITTER.splitToList(props.getProperty(EXCLUDE_KEY, ""));
    }

    public boolean isPhpstanEnabled() {
        return Boolean.parseBoolean(props.getProperty(PHPSTAN_ENABLED_KEY, "false"));
    }

    public int phpstanLevel() {
        return intProperty(PHPSTAN_LEVEL_KEY, 5);
    }

    public Optional<String> phpstanConfigFile() {
        return Optional.ofNullable(props.getProperty(PHPSTAN_CONFIG_KEY)).filter(s -> !s.isBlank());
    }

    public Duration phpstanTimeout() {
        return Duration.ofSeconds(intProperty(PHPSTAN_TIMEOUT_KEY, 30));
    }

    private int intProperty(String key, int defaultValue) {
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer for {}: '{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }
}
