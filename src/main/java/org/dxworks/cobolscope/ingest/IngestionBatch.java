package org.dxworks.cobolscope.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Handle on a batch submitted to {@link IngestionService#submit}. Cancelling stops units that
 * have not started yet; a unit already in its pipeline always runs to completion.
 */
public final class IngestionBatch {

    private final List<Future<IngestionResult>> futures;
    private final AtomicBoolean cancelled;

    IngestionBatch(List<Future<IngestionResult>> futures, AtomicBoolean cancelled) {
        this.futures = futures;
        this.cancelled = cancelled;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int size() {
        return futures.size();
    }

    /**
     * Waits for every unit and returns the results in submission order.
     */
    public List<IngestionResult> await() throws InterruptedException {
        return await(result -> {
        });
    }

    /**
     * Waits for every unit, handing each result to {@code onResult} as soon as it and all units
     * submitted before it are done.
     */
    public List<IngestionResult> await(Consumer<IngestionResult> onResult) throws InterruptedException {
        List<IngestionResult> results = new ArrayList<>(futures.size());
        for (Future<IngestionResult> future : futures) {
            try {
                IngestionResult result = future.get();
                onResult.accept(result);
                results.add(result);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Ingestion task failed unexpectedly", e.getCause());
            }
        }
        return results;
    }
}
