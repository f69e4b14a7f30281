package org.dxworks.cobolscope.index;

import org.dxworks.cobolscope.model.ProgramModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * The shared index over all ingested units.
 *
 * <p>Writers build a unit's contribution off to the side and publish a new {@link IndexSnapshot}
 * in one reference swap; writers are serialized with each other, readers never take a lock.</p>
 */
public class CodeIndex {

    private static final Logger LOG = LoggerFactory.getLogger(CodeIndex.class);

    private final AtomicReference<IndexSnapshot> current = new AtomicReference<>(IndexSnapshot.empty());

    /**
     * The latest committed snapshot.
     */
    public IndexSnapshot snapshot() {
        return current.get();
    }

    public UnitIndex commit(ProgramModel model) {
        UnitIndex unit = UnitIndexBuilder.build(model);
        commit(unit);
        return unit;
    }

    public synchronized void commit(UnitIndex unit) {
        IndexSnapshot next = current.get().with(unit);
        current.set(next);
        LOG.debug("Committed {} (generation {})", unit.getUnitId(), next.getGeneration());
    }

    /**
     * Drops the contribution of {@code unitId}; returns false when the unit was not indexed.
     */
    public synchronized boolean remove(String unitId) {
        IndexSnapshot before = current.get();
        IndexSnapshot next = before.without(unitId);
        if (next == before) {
            return false;
        }
        current.set(next);
        LOG.debug("Removed {} (generation {})", unitId, next.getGeneration());
        return true;
    }
}
