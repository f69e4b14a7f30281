package org.dxworks.cobolscope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.cobolscope.dialect.DialectExtension;
import org.dxworks.cobolscope.dialect.DialectOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public class CobolScopeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(CobolScopeConfig.class);

    private static final String CONFIG_FILE_NAME = "cobolscope-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final List<String> DEFAULT_SOURCE_EXTENSIONS = List.of("cbl", "cob", "cobol", "cpy");
    private static final List<String> DEFAULT_COPYBOOK_EXTENSIONS = List.of("cpy", "cbl", "cob", "copy");

    private final List<Path> copybookPaths;
    private final List<String> copybookExtensions;
    private final List<String> sourceExtensions;
    private final int maxFileLines;
    private final int ingestionThreads;
    private final DialectOptions dialect;
    private final Path cacheDirectory;

    private CobolScopeConfig(List<Path> copybookPaths, List<String> copybookExtensions, List<String> sourceExtensions,
                             int maxFileLines, int ingestionThreads, DialectOptions dialect, Path cacheDirectory) {
        this.copybookPaths = List.copyOf(copybookPaths);
        this.copybookExtensions = List.copyOf(copybookExtensions);
        this.sourceExtensions = List.copyOf(sourceExtensions);
        this.maxFileLines = maxFileLines;
        this.ingestionThreads = ingestionThreads;
        this.dialect = dialect;
        this.cacheDirectory = cacheDirectory;
    }

    /**
     * Include search path for COPY members.
     */
    public List<Path> getCopybookPaths() {
        return copybookPaths;
    }

    public List<String> getCopybookExtensions() {
        return copybookExtensions;
    }

    public List<String> getSourceExtensions() {
        return sourceExtensions;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getIngestionThreads() {
        return ingestionThreads;
    }

    public DialectOptions getDialect() {
        return dialect;
    }

    /**
     * Directory for persisted models; null when persistence is off.
     */
    public Path getCacheDirectory() {
        return cacheDirectory;
    }

    public static CobolScopeConfig defaults() {
        return new CobolScopeConfig(List.of(), DEFAULT_COPYBOOK_EXTENSIONS, DEFAULT_SOURCE_EXTENSIONS,
                DEFAULT_MAX_FILE_LINES, defaultThreads(), DialectOptions.defaults(), null);
    }

    public static CobolScopeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CobolScopeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Ignoring unreadable configuration {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static CobolScopeConfig with(List<Path> copybookPaths, int maxFileLines) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return defaults().withCopybookPaths(copybookPaths).withMaxFileLines(effectiveMaxFileLines);
    }

    public CobolScopeConfig withCopybookPaths(List<Path> paths) {
        return new CobolScopeConfig(paths, copybookExtensions, sourceExtensions, maxFileLines, ingestionThreads,
                dialect, cacheDirectory);
    }

    public CobolScopeConfig withMaxFileLines(int lines) {
        return new CobolScopeConfig(copybookPaths, copybookExtensions, sourceExtensions,
                lines > 0 ? lines : DEFAULT_MAX_FILE_LINES, ingestionThreads, dialect, cacheDirectory);
    }

    public CobolScopeConfig withIngestionThreads(int threads) {
        return new CobolScopeConfig(copybookPaths, copybookExtensions, sourceExtensions, maxFileLines,
                threads > 0 ? threads : defaultThreads(), dialect, cacheDirectory);
    }

    public CobolScopeConfig withDialect(DialectOptions options) {
        return new CobolScopeConfig(copybookPaths, copybookExtensions, sourceExtensions, maxFileLines,
                ingestionThreads, options, cacheDirectory);
    }

    public CobolScopeConfig withCacheDirectory(Path directory) {
        return new CobolScopeConfig(copybookPaths, copybookExtensions, sourceExtensions, maxFileLines,
                ingestionThreads, dialect, directory);
    }

    private static CobolScopeConfig fromYaml(YamlConfig yaml) {
        List<Path> copybookPaths = yaml.copybookPaths == null
                ? List.of()
                : yaml.copybookPaths.stream().map(Paths::get).collect(Collectors.toList());
        List<String> copybookExtensions = extensions(yaml.copybookExtensions, DEFAULT_COPYBOOK_EXTENSIONS);
        List<String> sourceExtensions = extensions(yaml.sourceExtensions, DEFAULT_SOURCE_EXTENSIONS);
        int maxFileLines = (yaml.maxFileLines != null && yaml.maxFileLines > 0)
                ? yaml.maxFileLines
                : DEFAULT_MAX_FILE_LINES;
        int threads = (yaml.ingestionThreads != null && yaml.ingestionThreads > 0)
                ? yaml.ingestionThreads
                : defaultThreads();

        Set<DialectExtension> extensions = yaml.dialectExtensions == null
                ? DialectOptions.defaults().getExtensions()
                : parseExtensions(yaml.dialectExtensions);
        DialectOptions dialect = DialectOptions.of(extensions, yaml.extraVerbs);

        Path cache = yaml.cacheDirectory == null || yaml.cacheDirectory.isBlank()
                ? null
                : Paths.get(yaml.cacheDirectory);
        return new CobolScopeConfig(copybookPaths, copybookExtensions, sourceExtensions, maxFileLines, threads,
                dialect, cache);
    }

    private static Set<DialectExtension> parseExtensions(Collection<String> names) {
        Set<DialectExtension> result = EnumSet.noneOf(DialectExtension.class);
        for (String name : names) {
            result.add(DialectExtension.valueOf(name.trim().toUpperCase(Locale.ROOT)));
        }
        return result;
    }

    private static List<String> extensions(List<String> configured, List<String> fallback) {
        if (configured == null || configured.isEmpty()) {
            return fallback;
        }
        List<String> result = new ArrayList<>();
        for (String extension : configured) {
            String e = extension.trim().toLowerCase(Locale.ROOT);
            result.add(e.startsWith(".") ? e.substring(1) : e);
        }
        return result;
    }

    private static int defaultThreads() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private static class YamlConfig {
        public List<String> copybookPaths;
        public List<String> copybookExtensions;
        public List<String> sourceExtensions;
        public Integer maxFileLines;
        public Integer ingestionThreads;
        public List<String> dialectExtensions;
        public List<String> extraVerbs;
        public String cacheDirectory;
    }
}
