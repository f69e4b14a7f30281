package org.dxworks.cobolscope.preprocessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Run-scoped repository of copy members found under the configured search path.
 *
 * - Indexed by member name (with and without extension) and by {@code library/member}, where the
 *   library is the name of the directory holding the member.
 * - Duplicate names across paths are logged once and resolved deterministically.
 */
public final class CopybookRepository implements CopybookResolver {

    private static final Logger LOG = LoggerFactory.getLogger(CopybookRepository.class);

    private final Map<String, Entry> byNormalizedName;

    public CopybookRepository(List<Path> searchPath, Collection<String> extensions) {
        Objects.requireNonNull(searchPath, "searchPath");
        Set<String> allowed = extensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        Map<String, List<Entry>> candidatesByKey = new HashMap<>();
        for (Path root : searchPath) {
            if (root == null || !Files.isDirectory(root)) {
                LOG.warn("Copybook directory does not exist: {}", root);
                continue;
            }
            for (Path file : listFiles(root)) {
                String fileName = file.getFileName().toString();
                String extension = extensionOf(fileName);
                if (!extension.isEmpty() && !allowed.contains(extension)) {
                    continue;
                }
                Entry entry = new Entry(file, root.relativize(file).toString().replace('\\', '/'));

                String keyBase = normalizeCopybookToken(stripExtension(fileName));
                String keyFull = normalizeCopybookToken(fileName);
                candidatesByKey.computeIfAbsent(keyBase, k -> new ArrayList<>()).add(entry);
                candidatesByKey.computeIfAbsent(keyFull, k -> new ArrayList<>()).add(entry);

                Path parent = file.getParent();
                if (parent != null && !parent.equals(root)) {
                    String library = normalizeCopybookToken(parent.getFileName().toString());
                    candidatesByKey.computeIfAbsent(library + "/" + keyBase, k -> new ArrayList<>()).add(entry);
                    candidatesByKey.computeIfAbsent(library + "/" + keyFull, k -> new ArrayList<>()).add(entry);
                }
            }
        }

        logDuplicates(candidatesByKey);

        Map<String, Entry> index = new HashMap<>();
        for (Map.Entry<String, List<Entry>> e : candidatesByKey.entrySet()) {
            index.put(e.getKey(), pickWinner(e.getValue()));
        }
        this.byNormalizedName = Collections.unmodifiableMap(index);
    }

    @Override
    public Optional<Copybook> resolve(String member, String library) {
        String key = normalizeCopybookToken(member);
        Entry entry = library != null
                ? byNormalizedName.get(normalizeCopybookToken(library) + "/" + key)
                : null;
        if (entry == null) {
            entry = byNormalizedName.get(key);
        }
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new Copybook(member, entry.id, read(entry.path)));
    }

    public int size() {
        return (int) byNormalizedName.values().stream().map(e -> e.id).distinct().count();
    }

    private static List<Path> listFiles(Path root) {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list copybook directory " + root, e);
        }
    }

    private static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            try {
                return Files.readString(path, StandardCharsets.ISO_8859_1);
            } catch (IOException inner) {
                throw new UncheckedIOException("Cannot read copybook " + path, inner);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read copybook " + path, e);
        }
    }

    private static void logDuplicates(Map<String, List<Entry>> candidatesByKey) {
        Map<String, List<Entry>> dupes = new TreeMap<>();

        for (Map.Entry<String, List<Entry>> e : candidatesByKey.entrySet()) {
            LinkedHashMap<String, Entry> unique = new LinkedHashMap<>();
            for (Entry entry : e.getValue()) {
                unique.put(entry.path.toAbsolutePath().toString(), entry);
            }
            if (unique.size() > 1 && !e.getKey().contains("/")) {
                dupes.put(e.getKey(), new ArrayList<>(unique.values()));
            }
        }

        for (Map.Entry<String, List<Entry>> e : dupes.entrySet()) {
            LOG.warn("Duplicate copybook name {} found at {}; using {}", e.getKey(),
                    e.getValue().stream().map(x -> x.path.toAbsolutePath().toString()).collect(Collectors.toList()),
                    pickWinner(e.getValue()).path.toAbsolutePath());
        }
    }

    private static Entry pickWinner(List<Entry> candidates) {
        // shortest absolute path first, then lexicographically smallest
        return candidates.stream()
                .min(Comparator
                        .comparingInt((Entry e) -> e.path.toAbsolutePath().toString().length())
                        .thenComparing(e -> e.path.toAbsolutePath().toString()))
                .orElseThrow(() -> new IllegalArgumentException("No copybook candidates"));
    }

    static String normalizeCopybookToken(String token) {
        String t = token.trim().toLowerCase(Locale.ROOT);

        if ((t.startsWith("\"") && t.endsWith("\"")) || (t.startsWith("'") && t.endsWith("'"))) {
            t = t.substring(1, t.length() - 1).trim();
        }

        t = t.replaceAll("[.;,]+$", "");
        t = t.replace('\\', '/');

        int slash = t.lastIndexOf('/');
        if (slash >= 0 && slash + 1 < t.length()) {
            t = t.substring(slash + 1);
        }
        return t;
    }

    static String stripExtension(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0) return fileName;
        return fileName.substring(0, lastDot);
    }

    private static String extensionOf(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0) return "";
        return fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT);
    }

    private static final class Entry {
        private final Path path;
        private final String id;

        private Entry(Path path, String id) {
            this.path = path;
            this.id = id;
        }
    }
}
