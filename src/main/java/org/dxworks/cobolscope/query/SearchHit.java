package org.dxworks.cobolscope.query;

import org.dxworks.cobolscope.model.SymbolOccurrence;

import java.util.Comparator;

public final class SearchHit {

    /**
     * Match strength, then unit, then position in the unit, then name.
     */
    static final Comparator<SearchHit> RANKING = Comparator
            .comparing(SearchHit::getMatch)
            .thenComparing(SearchHit::getUnitId)
            .thenComparingInt(h -> h.getOccurrence().getRange().getStartLine())
            .thenComparingInt(h -> h.getOccurrence().getRange().getStartColumn())
            .thenComparing(h -> h.getOccurrence().getRange().getFile())
            .thenComparing(h -> h.getOccurrence().getText());

    private final MatchKind match;
    private final String unitId;
    private final SymbolOccurrence occurrence;

    public SearchHit(MatchKind match, String unitId, SymbolOccurrence occurrence) {
        this.match = match;
        this.unitId = unitId;
        this.occurrence = occurrence;
    }

    public MatchKind getMatch() {
        return match;
    }

    public String getUnitId() {
        return unitId;
    }

    public SymbolOccurrence getOccurrence() {
        return occurrence;
    }

    @Override
    public String toString() {
        return match + " " + occurrence;
    }
}
