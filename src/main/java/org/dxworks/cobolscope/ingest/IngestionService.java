package org.dxworks.cobolscope.ingest;

import org.dxworks.cobolscope.CobolScopeConfig;
import org.dxworks.cobolscope.diagnostic.Diagnostic;
import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.exception.ModelStoreException;
import org.dxworks.cobolscope.exception.UnitFailedException;
import org.dxworks.cobolscope.index.CodeIndex;
import org.dxworks.cobolscope.index.UnitIndex;
import org.dxworks.cobolscope.model.ProgramModel;
import org.dxworks.cobolscope.preprocessor.PreprocessedSource;
import org.dxworks.cobolscope.source.SourceUnit;
import org.dxworks.cobolscope.store.ModelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the unit pipeline for batches of sources on a fixed thread pool and commits each finished
 * unit to the {@link CodeIndex}.
 *
 * <p>Units are independent: a pipeline reads only the shared read-only configuration and writes
 * only its own model. Committing is the single synchronization point. A unit whose expanded
 * source hash equals the committed one is not rebuilt.</p>
 */
public class IngestionService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(IngestionService.class);

    private final UnitPipeline pipeline;
    private final CodeIndex index;
    private final ModelStore store;
    private final ExecutorService executor;
    static final int LOCK_STRIPES = 64;

    private final Object[] unitLocks = new Object[LOCK_STRIPES];

    public IngestionService(UnitPipeline pipeline, CodeIndex index, ModelStore store, int threads) {
        this.pipeline = pipeline;
        this.index = index;
        this.store = store;
        for (int i = 0; i < unitLocks.length; i++) {
            unitLocks[i] = new Object();
        }
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread thread = new Thread(r, "cobolscope-ingest-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public static IngestionService fromConfig(CobolScopeConfig config, CodeIndex index) {
        ModelStore store = config.getCacheDirectory() != null ? new ModelStore(config.getCacheDirectory()) : null;
        return new IngestionService(UnitPipeline.fromConfig(config), index, store, config.getIngestionThreads());
    }

    public CodeIndex getIndex() {
        return index;
    }

    /**
     * Schedules every unit; each one is checked for cancellation just before its pipeline starts.
     */
    public IngestionBatch submit(List<SourceUnit> units) {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        List<Future<IngestionResult>> futures = new ArrayList<>(units.size());
        for (SourceUnit unit : units) {
            futures.add(executor.submit(() -> cancelled.get()
                    ? IngestionResult.cancelled(unit.getId())
                    : ingest(unit)));
        }
        LOG.info("Submitted {} units for ingestion", units.size());
        return new IngestionBatch(futures, cancelled);
    }

    public List<IngestionResult> ingestAll(List<SourceUnit> units) throws InterruptedException {
        return submit(units).await();
    }

    /**
     * Ingests one unit on the calling thread, replacing any previous contribution of the same unit.
     */
    public IngestionResult ingest(SourceUnit unit) {
        synchronized (lockFor(unit.getId())) {
            DiagnosticCollector diagnostics = new DiagnosticCollector();
            try {
                PreprocessedSource source = pipeline.preprocess(unit, diagnostics);
                String hash = source.getContentHash();

                Optional<UnitIndex> committed = index.snapshot().unit(unit.getId());
                if (committed.isPresent() && hash.equals(committed.get().getContentHash())) {
                    LOG.debug("{} unchanged", unit.getId());
                    return IngestionResult.unchanged(committed.get().getModel());
                }

                Optional<ProgramModel> stored = loadStored(unit.getId(), hash);
                ProgramModel model = stored.orElseGet(() -> pipeline.build(source, diagnostics));
                if (stored.isEmpty()) {
                    saveStored(model);
                }
                index.commit(model);
                return IngestionResult.committed(model);
            } catch (UnitFailedException e) {
                LOG.warn("Failed to ingest {}: {}", unit.getId(), e.getMessage());
                discard(unit.getId());
                List<Diagnostic> all = new ArrayList<>(diagnostics.all());
                all.add(e.getDiagnostic());
                return IngestionResult.failed(unit.getId(), all, e.getMessage());
            } catch (RuntimeException e) {
                LOG.warn("Unexpected error ingesting {}", unit.getId(), e);
                discard(unit.getId());
                return IngestionResult.failed(unit.getId(), diagnostics.all(),
                        e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    /**
     * Drops a unit from the index and the store; returns false when it was not indexed.
     */
    public boolean remove(String unitId) {
        synchronized (lockFor(unitId)) {
            return discard(unitId);
        }
    }

    // a unit id always maps to the same stripe
    Object lockFor(String unitId) {
        return unitLocks[Math.floorMod(unitId.hashCode(), LOCK_STRIPES)];
    }

    private boolean discard(String unitId) {
        if (store != null) {
            try {
                store.delete(unitId);
            } catch (ModelStoreException e) {
                LOG.warn(e.getMessage());
            }
        }
        return index.remove(unitId);
    }

    private Optional<ProgramModel> loadStored(String unitId, String hash) {
        if (store == null) {
            return Optional.empty();
        }
        try {
            Optional<ProgramModel> model = store.load(unitId, hash);
            model.ifPresent(m -> LOG.debug("Loaded stored model of {}", unitId));
            return model;
        } catch (ModelStoreException e) {
            LOG.warn("{}; rebuilding", e.getMessage());
            return Optional.empty();
        }
    }

    private void saveStored(ProgramModel model) {
        if (store == null) {
            return;
        }
        try {
            store.save(model);
        } catch (ModelStoreException e) {
            LOG.warn(e.getMessage());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
