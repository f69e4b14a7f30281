package org.dxworks.cobolscope.store;

import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.exception.ModelStoreException;
import org.dxworks.cobolscope.model.ProgramModel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ModelStoreTest {

    private static ProgramModel model;

    @TempDir
    Path directory;

    @BeforeAll
    static void buildSample() {
        model = TestUtils.sampleModel("CUSTUPD.cbl");
    }

    @Test
    void storedModelReadsBackToTheSameCanonicalJson() {
        ModelStore store = new ModelStore(directory);

        store.save(model);
        Optional<ProgramModel> loaded = store.load("CUSTUPD.cbl", model.getContentHash());

        assertTrue(loaded.isPresent());
        assertEquals(CanonicalJson.write(model), CanonicalJson.write(loaded.get()));
        assertEquals(model.getEdges().size(), loaded.get().getEdges().size());
        assertEquals(2, loaded.get().getDataItemTable().lookup("BALANCE").size());
    }

    @Test
    void staleHashIsAMiss() {
        ModelStore store = new ModelStore(directory);
        store.save(model);

        assertTrue(store.load("CUSTUPD.cbl", "not-the-hash").isEmpty());
        assertTrue(store.load("OTHER.cbl", model.getContentHash()).isEmpty());
    }

    @Test
    void deleteRemovesTheFile() {
        ModelStore store = new ModelStore(directory);
        store.save(model);

        assertTrue(store.delete("CUSTUPD.cbl"));
        assertFalse(store.delete("CUSTUPD.cbl"));
        assertTrue(store.load("CUSTUPD.cbl", model.getContentHash()).isEmpty());
    }

    @Test
    void unitIdsWithPathSeparatorsGetDistinctFiles() {
        ModelStore store = new ModelStore(directory);

        Path nested = store.pathFor("src/a.cbl");
        Path flat = store.pathFor("src_a.cbl");

        assertNotEquals(nested, flat);
        assertEquals(directory, nested.getParent());
        assertTrue(nested.getFileName().toString().startsWith("src_a.cbl-"));
    }

    @Test
    void corruptFileIsReported() throws Exception {
        ModelStore store = new ModelStore(directory);
        Files.writeString(store.pathFor("CUSTUPD.cbl"), "{not json");

        assertThrows(ModelStoreException.class, () -> store.load("CUSTUPD.cbl", model.getContentHash()));
    }

    @Test
    void canonicalJsonIsIndependentOfBuildRuns() {
        ProgramModel again = TestUtils.sampleModel("CUSTUPD.cbl");

        assertEquals(CanonicalJson.write(model), CanonicalJson.write(again));
    }
}
