package org.dxworks.cobolscope.ingest;

import org.dxworks.cobolscope.CobolScopeConfig;
import org.dxworks.cobolscope.source.SourceUnit;
import org.dxworks.cobolscope.source.UnitKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the COBOL sources below an input path and reads them into {@link SourceUnit}s. Unit ids
 * are paths relative to the input root with {@code /} separators.
 */
public class SourceCollector {

    private static final Logger LOG = LoggerFactory.getLogger(SourceCollector.class);
    private static final Set<String> COPYBOOK_EXTENSIONS = Set.of("cpy", "copy");

    private final Set<String> extensions;
    private final int maxFileLines;

    public SourceCollector(CobolScopeConfig config) {
        this.extensions = config.getSourceExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        this.maxFileLines = config.getMaxFileLines();
    }

    public List<Path> collectFiles(Path input) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                        .filter(this::accepts)
                        .filter(p -> withinMaxLines(p, maxFileLines))
                        .sorted()
                        .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && accepts(input) && withinMaxLines(input, maxFileLines)) {
            files.add(input);
        }
        return files;
    }

    /**
     * Reads every collected file; a file that cannot be read is logged and skipped.
     */
    public List<SourceUnit> collect(Path input) throws IOException {
        Path root = Files.isDirectory(input) ? input : input.getParent();
        List<SourceUnit> units = new ArrayList<>();
        for (Path file : collectFiles(input)) {
            try {
                units.add(read(root, file));
            } catch (UncheckedIOException e) {
                LOG.warn("Skipping unreadable source {}: {}", file, e.getCause().getMessage());
            }
        }
        return units;
    }

    public SourceUnit read(Path root, Path file) {
        String id = unitId(root, file);
        return SourceUnit.read(id, kindOf(file), readText(file));
    }

    public static String unitId(Path root, Path file) {
        Path relative = root == null ? file.getFileName() : root.relativize(file);
        return relative.toString().replace('\\', '/');
    }

    public static UnitKind kindOf(Path file) {
        return COPYBOOK_EXTENSIONS.contains(extensionOf(file)) ? UnitKind.COPYBOOK : UnitKind.PROGRAM;
    }

    private boolean accepts(Path file) {
        return extensions.contains(extensionOf(file));
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    // Legacy sources are often Latin-1 rather than UTF-8.
    private static String readText(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            try {
                return Files.readString(file, StandardCharsets.ISO_8859_1);
            } catch (IOException inner) {
                throw new UncheckedIOException(inner);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.ISO_8859_1)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            if (count > maxFileLines) {
                LOG.info("Skipping {}: more than {} lines", path, maxFileLines);
                return false;
            }
            return true;
        } catch (IOException | UncheckedIOException e) {
            return true;
        }
    }
}
