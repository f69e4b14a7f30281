package org.dxworks.cobolscope.ingest;

import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.diagnostic.DiagnosticKind;
import org.dxworks.cobolscope.dialect.DialectOptions;
import org.dxworks.cobolscope.index.CodeIndex;
import org.dxworks.cobolscope.preprocessor.CopybookRepository;
import org.dxworks.cobolscope.preprocessor.PreprocessedSource;
import org.dxworks.cobolscope.source.SourceUnit;
import org.dxworks.cobolscope.store.CanonicalJson;
import org.dxworks.cobolscope.store.ModelStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class IngestionServiceTest {

    private static final List<String> PROGRAMS = List.of("CUSTUPD.cbl", "AUDITLOG.cbl", "DANGLER.cbl", "LOOPER.cbl");

    private IngestionService service;

    @TempDir
    Path cache;

    @AfterEach
    void shutdown() {
        if (service != null) {
            service.close();
        }
    }

    private static List<SourceUnit> samples() {
        return PROGRAMS.stream().map(TestUtils::sample).collect(Collectors.toList());
    }

    private static SourceUnit broken(String id) {
        return TestUtils.program(id, "    MOVE A TO B.");
    }

    @Test
    void ingestAllCommitsEveryUnitInSubmissionOrder() throws Exception {
        CodeIndex index = new CodeIndex();
        service = new IngestionService(TestUtils.samplesPipeline(), index, null, 4);

        List<IngestionResult> results = service.ingestAll(samples());

        assertEquals(PROGRAMS, results.stream().map(IngestionResult::getUnitId).collect(Collectors.toList()));
        assertTrue(results.stream().allMatch(r -> r.getStatus() == IngestionStatus.COMMITTED));
        assertEquals(4, index.snapshot().size());
    }

    @Test
    void reingestingUnchangedSourceIsANoOp() throws Exception {
        CodeIndex index = new CodeIndex();
        service = new IngestionService(TestUtils.samplesPipeline(), index, null, 1);
        service.ingest(TestUtils.sample("CUSTUPD.cbl"));
        long generation = index.snapshot().getGeneration();

        IngestionResult again = service.ingest(TestUtils.sample("CUSTUPD.cbl"));

        assertEquals(IngestionStatus.UNCHANGED, again.getStatus());
        assertTrue(again.isSuccess());
        assertEquals(generation, index.snapshot().getGeneration());
    }

    @Test
    void independentIngestionsProduceIdenticalModels() throws Exception {
        service = new IngestionService(TestUtils.samplesPipeline(), new CodeIndex(), null, 4);
        List<IngestionResult> first = service.ingestAll(samples());
        try (IngestionService other = new IngestionService(TestUtils.samplesPipeline(), new CodeIndex(), null, 1)) {
            List<IngestionResult> second = other.ingestAll(samples());

            for (int i = 0; i < first.size(); i++) {
                assertEquals(CanonicalJson.write(first.get(i).getModel().orElseThrow()),
                        CanonicalJson.write(second.get(i).getModel().orElseThrow()));
            }
        }
    }

    @Test
    void unitWithoutStructureFails() {
        CodeIndex index = new CodeIndex();
        service = new IngestionService(TestUtils.samplesPipeline(), index, null, 1);

        IngestionResult result = service.ingest(broken("BROKEN.cbl"));

        assertEquals(IngestionStatus.FAILED, result.getStatus());
        assertFalse(result.isSuccess());
        assertTrue(result.getModel().isEmpty());
        assertTrue(result.getDiagnostics().stream().anyMatch(d -> d.getKind() == DiagnosticKind.NO_DIVISION_STRUCTURE));
        assertEquals(0, index.snapshot().size());
    }

    @Test
    void failedReingestRemovesThePreviousContribution() {
        CodeIndex index = new CodeIndex();
        service = new IngestionService(TestUtils.samplesPipeline(), index, null, 1);
        service.ingest(TestUtils.sample("LOOPER.cbl"));
        assertTrue(index.snapshot().unit("LOOPER.cbl").isPresent());

        IngestionResult result = service.ingest(broken("LOOPER.cbl"));

        assertEquals(IngestionStatus.FAILED, result.getStatus());
        assertTrue(index.snapshot().unit("LOOPER.cbl").isEmpty());
    }

    @Test
    void storedModelsSurviveANewIndex() {
        ModelStore store = new ModelStore(cache);
        service = new IngestionService(TestUtils.samplesPipeline(), new CodeIndex(), store, 1);
        String built = CanonicalJson.write(service.ingest(TestUtils.sample("CUSTUPD.cbl")).getModel().orElseThrow());

        CodeIndex fresh = new CodeIndex();
        try (IngestionService restarted = new IngestionService(TestUtils.samplesPipeline(), fresh, store, 1)) {
            IngestionResult result = restarted.ingest(TestUtils.sample("CUSTUPD.cbl"));

            assertEquals(IngestionStatus.COMMITTED, result.getStatus());
            assertEquals(built, CanonicalJson.write(result.getModel().orElseThrow()));
            assertEquals(1, fresh.snapshot().size());
        }
    }

    @Test
    void removeDropsIndexAndStore() {
        ModelStore store = new ModelStore(cache);
        CodeIndex index = new CodeIndex();
        service = new IngestionService(TestUtils.samplesPipeline(), index, store, 1);
        String hash = service.ingest(TestUtils.sample("LOOPER.cbl")).getModel().orElseThrow().getContentHash();

        assertTrue(service.remove("LOOPER.cbl"));
        assertFalse(service.remove("LOOPER.cbl"));
        assertTrue(store.load("LOOPER.cbl", hash).isEmpty());
    }

    @Test
    void cancelledBatchSkipsUnitsNotYetStarted() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        UnitPipeline blocking = new UnitPipeline(new CopybookRepository(List.of(TestUtils.SAMPLES), List.of("cpy")),
                DialectOptions.defaults()) {
            @Override
            public PreprocessedSource preprocess(SourceUnit unit, DiagnosticCollector diagnostics) {
                if (unit.getId().equals("CUSTUPD.cbl")) {
                    started.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.preprocess(unit, diagnostics);
            }
        };
        CodeIndex index = new CodeIndex();
        service = new IngestionService(blocking, index, null, 1);

        IngestionBatch batch = service.submit(samples());
        assertTrue(started.await(10, TimeUnit.SECONDS));
        batch.cancel();
        release.countDown();
        List<IngestionResult> results = batch.await();

        assertTrue(batch.isCancelled());
        assertEquals(IngestionStatus.COMMITTED, results.get(0).getStatus());
        assertTrue(results.subList(1, results.size()).stream()
                .allMatch(r -> r.getStatus() == IngestionStatus.CANCELLED));
        assertEquals(1, index.snapshot().size());
    }

    @Test
    void unitLocksStayBoundedAcrossManyUnits() {
        service = new IngestionService(TestUtils.samplesPipeline(), new CodeIndex(), null, 1);
        Set<Object> locks = Collections.newSetFromMap(new IdentityHashMap<>());

        for (int i = 0; i < 1000; i++) {
            String unitId = "PROG" + i + ".cbl";
            assertSame(service.lockFor(unitId), service.lockFor(unitId));
            locks.add(service.lockFor(unitId));
        }

        assertTrue(locks.size() <= IngestionService.LOCK_STRIPES);
    }
}
