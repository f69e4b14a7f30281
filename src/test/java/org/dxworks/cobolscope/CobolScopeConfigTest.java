package org.dxworks.cobolscope;

import org.dxworks.cobolscope.dialect.DialectExtension;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CobolScopeConfigTest {

    private static final Path CONFIG_DIR = Paths.get("src/test/resources/config");

    @Test
    void loadsEverySettingFromYaml() {
        CobolScopeConfig config = CobolScopeConfig.load(CONFIG_DIR.resolve("cobolscope-config.yml"));

        assertEquals(List.of(Paths.get("copylib"), Paths.get("shared/copy")), config.getCopybookPaths());
        assertEquals(List.of("cpy", "copy"), config.getCopybookExtensions());
        assertEquals(List.of("cbl"), config.getSourceExtensions());
        assertEquals(5000, config.getMaxFileLines());
        assertEquals(3, config.getIngestionThreads());
        assertTrue(config.getDialect().has(DialectExtension.FLOATING_COMMENTS));
        assertTrue(config.getDialect().has(DialectExtension.RELAXED_AREA_A));
        assertFalse(config.getDialect().has(DialectExtension.UNDERSCORE_IN_WORDS));
        assertTrue(config.getDialect().getExtraVerbs().contains("XML"));
        assertEquals(Paths.get("build/cobolscope-cache"), config.getCacheDirectory());
    }

    @Test
    void missingFileGivesDefaults() {
        CobolScopeConfig config = CobolScopeConfig.load(CONFIG_DIR.resolve("absent.yml"));

        assertTrue(config.getCopybookPaths().isEmpty());
        assertEquals(20000, config.getMaxFileLines());
        assertNull(config.getCacheDirectory());
        assertEquals(List.of("cbl", "cob", "cobol", "cpy"), config.getSourceExtensions());
    }

    @Test
    void unreadableFileFallsBackToDefaults() {
        CobolScopeConfig config = CobolScopeConfig.load(CONFIG_DIR.resolve("broken-config.yml"));

        assertEquals(CobolScopeConfig.defaults().getDialect().getExtensions(), config.getDialect().getExtensions());
    }

    @Test
    void withersKeepOtherSettings() {
        CobolScopeConfig config = CobolScopeConfig.with(List.of(Paths.get("copy")), 0)
                .withIngestionThreads(2)
                .withCacheDirectory(Paths.get("cache"));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(List.of(Paths.get("copy")), config.getCopybookPaths());
        assertEquals(2, config.getIngestionThreads());
        assertEquals(Paths.get("cache"), config.getCacheDirectory());
    }
}
