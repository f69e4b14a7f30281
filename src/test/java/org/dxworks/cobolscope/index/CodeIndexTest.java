package org.dxworks.cobolscope.index;

import org.dxworks.cobolscope.TestUtils;
import org.dxworks.cobolscope.model.Edge;
import org.dxworks.cobolscope.model.EdgeKind;
import org.dxworks.cobolscope.model.ProgramModel;
import org.dxworks.cobolscope.model.SymbolOccurrence;
import org.dxworks.cobolscope.model.SymbolRole;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CodeIndexTest {

    private static ProgramModel customerUpdate;
    private static ProgramModel auditLog;

    @BeforeAll
    static void buildSamples() {
        customerUpdate = TestUtils.sampleModel("CUSTUPD.cbl");
        auditLog = TestUtils.sampleModel("AUDITLOG.cbl");
    }

    @Test
    void unitIndexGroupsOccurrencesByName() {
        UnitIndex unit = UnitIndexBuilder.build(customerUpdate);

        List<SymbolOccurrence> balance = unit.entry("BALANCE").orElseThrow().getOccurrences();
        assertEquals(2, balance.stream().filter(o -> o.getRole() == SymbolRole.DEFINITION).count());
        assertTrue(balance.stream().anyMatch(o -> o.getRole() == SymbolRole.REFERENCE));
        for (int i = 1; i < balance.size(); i++) {
            assertTrue(balance.get(i - 1).getRange().compareTo(balance.get(i).getRange()) <= 0);
        }
        assertTrue(unit.entry("balance").isEmpty());
        assertEquals("CUSTUPD", unit.getProgramId().orElseThrow());
    }

    @Test
    void unitIndexKeepsBothEdgeDirections() {
        UnitIndex unit = UnitIndexBuilder.build(customerUpdate);

        List<Edge> incoming = unit.incoming("PROCEDURE/UPDATE-BALANCE");
        assertEquals(1, incoming.size());
        assertEquals("PROCEDURE/MAIN-PARA", incoming.get(0).getFrom());
        assertEquals(2, unit.outgoing("PROCEDURE/MAIN-PARA").size());
        assertTrue(unit.outgoing("PROCEDURE/NOPE").isEmpty());

        List<Edge> calls = unit.calls();
        assertEquals(1, calls.size());
        assertEquals(EdgeKind.CALL, calls.get(0).getKind());
        assertEquals("AUDITLOG", calls.get(0).getTarget());
    }

    @Test
    void commitPublishesANewSnapshot() {
        CodeIndex index = new CodeIndex();
        IndexSnapshot before = index.snapshot();

        index.commit(customerUpdate);
        index.commit(auditLog);

        IndexSnapshot after = index.snapshot();
        assertEquals(0, before.size());
        assertEquals(2, after.size());
        assertEquals(before.getGeneration() + 2, after.getGeneration());
        assertEquals(List.of("AUDITLOG.cbl", "CUSTUPD.cbl"),
                after.units().stream().map(UnitIndex::getUnitId).collect(Collectors.toList()));
    }

    @Test
    void recommitReplacesThePreviousContribution() {
        CodeIndex index = new CodeIndex();
        index.commit(customerUpdate);
        UnitIndex first = index.snapshot().unit("CUSTUPD.cbl").orElseThrow();

        index.commit(customerUpdate);

        assertEquals(1, index.snapshot().size());
        assertNotSame(first, index.snapshot().unit("CUSTUPD.cbl").orElseThrow());
    }

    @Test
    void removeDropsTheUnit() {
        CodeIndex index = new CodeIndex();
        index.commit(customerUpdate);
        IndexSnapshot held = index.snapshot();

        assertTrue(index.remove("CUSTUPD.cbl"));
        assertFalse(index.remove("CUSTUPD.cbl"));

        assertEquals(0, index.snapshot().size());
        assertEquals(1, held.size());
    }

    @Test
    void snapshotMapsProgramsAndCallers() {
        CodeIndex index = new CodeIndex();
        index.commit(customerUpdate);
        index.commit(auditLog);
        IndexSnapshot snapshot = index.snapshot();

        assertEquals(List.of("AUDITLOG.cbl"), snapshot.unitsForProgram("auditlog"));
        List<CallSite> callers = snapshot.callsTo("AUDITLOG");
        assertEquals(1, callers.size());
        assertEquals("CUSTUPD.cbl", callers.get(0).getUnitId());
        assertEquals("PROCEDURE/MAIN-PARA", callers.get(0).getEdge().getFrom());
        assertTrue(snapshot.callsTo("NOBODY").isEmpty());
    }
}
