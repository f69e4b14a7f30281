package org.dxworks.cobolscope.preprocessor;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up copy members by name and optional library. Implementations are shared read-only by
 * all unit pipelines.
 */
public interface CopybookResolver {

    Optional<Copybook> resolve(String member, String library);

    static CopybookResolver none() {
        return (member, library) -> Optional.empty();
    }

    /**
     * In-memory members keyed by file name; the key without extension is also a member name.
     */
    static CopybookResolver of(Map<String, String> membersByFile) {
        Map<String, Copybook> byName = new HashMap<>();
        membersByFile.forEach((file, text) -> {
            String base = CopybookRepository.stripExtension(file);
            Copybook copybook = new Copybook(base, file, text);
            byName.putIfAbsent(CopybookRepository.normalizeCopybookToken(file), copybook);
            byName.putIfAbsent(CopybookRepository.normalizeCopybookToken(base), copybook);
        });
        return (member, library) -> Optional.ofNullable(
                byName.get(CopybookRepository.normalizeCopybookToken(member)));
    }
}
