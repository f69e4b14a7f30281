package org.dxworks.cobolscope.ingest;

import org.dxworks.cobolscope.CobolScopeConfig;
import org.dxworks.cobolscope.source.SourceUnit;
import org.dxworks.cobolscope.source.UnitKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SourceCollectorTest {

    @TempDir
    Path root;

    @Test
    void collectsMatchingFilesInPathOrder() throws Exception {
        Files.createDirectories(root.resolve("sub"));
        Files.writeString(root.resolve("B.cbl"), "       IDENTIFICATION DIVISION.\n");
        Files.writeString(root.resolve("sub/A.cob"), "       IDENTIFICATION DIVISION.\n");
        Files.writeString(root.resolve("REC.cpy"), "       01  REC PIC X.\n");
        Files.writeString(root.resolve("notes.txt"), "not cobol\n");

        List<SourceUnit> units = new SourceCollector(CobolScopeConfig.defaults()).collect(root);

        assertEquals(List.of("B.cbl", "REC.cpy", "sub/A.cob"),
                units.stream().map(SourceUnit::getId).collect(Collectors.toList()));
        assertEquals(UnitKind.COPYBOOK, units.get(1).getKind());
        assertEquals(UnitKind.PROGRAM, units.get(2).getKind());
    }

    @Test
    void skipsFilesOverTheLineLimit() throws Exception {
        Files.writeString(root.resolve("BIG.cbl"), "       MOVE A TO B.\n".repeat(20));
        Files.writeString(root.resolve("SMALL.cbl"), "       MOVE A TO B.\n");

        List<Path> files = new SourceCollector(CobolScopeConfig.defaults().withMaxFileLines(10)).collectFiles(root);

        assertEquals(List.of(root.resolve("SMALL.cbl")), files);
    }

    @Test
    void fallsBackToLatin1() throws Exception {
        Path file = root.resolve("LATIN.cbl");
        Files.write(file, "       * café\n".getBytes(StandardCharsets.ISO_8859_1));

        SourceUnit unit = new SourceCollector(CobolScopeConfig.defaults()).read(root, file);

        assertTrue(unit.getLines().get(0).getText().endsWith("café"));
    }

    @Test
    void unitIdsUseForwardSlashes() {
        Path base = Paths.get("base");

        assertEquals("a/b/C.cbl", SourceCollector.unitId(base, base.resolve("a").resolve("b").resolve("C.cbl")));
        assertEquals(UnitKind.COPYBOOK, SourceCollector.kindOf(Paths.get("X.CPY")));
        assertEquals(UnitKind.PROGRAM, SourceCollector.kindOf(Paths.get("X.cbl")));
    }

    @Test
    void singleFileInputIsAccepted() throws Exception {
        Path file = root.resolve("ONE.cbl");
        Files.writeString(file, "       IDENTIFICATION DIVISION.\n");

        List<SourceUnit> units = new SourceCollector(CobolScopeConfig.defaults()).collect(file);

        assertEquals(1, units.size());
        assertEquals("ONE.cbl", units.get(0).getId());
    }
}
