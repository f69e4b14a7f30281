package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class ProgramMetrics {

    private final int lineCount;
    private final int statementCount;
    private final int decisionPoints;
    private final int dataItemCount;
    private final Complexity complexity;

    @JsonCreator
    public ProgramMetrics(@JsonProperty("lineCount") int lineCount,
                          @JsonProperty("statementCount") int statementCount,
                          @JsonProperty("decisionPoints") int decisionPoints,
                          @JsonProperty("dataItemCount") int dataItemCount,
                          @JsonProperty("complexity") Complexity complexity) {
        this.lineCount = lineCount;
        this.statementCount = statementCount;
        this.decisionPoints = decisionPoints;
        this.dataItemCount = dataItemCount;
        this.complexity = complexity;
    }

    /**
     * Physical lines of the unit itself, copy members excluded.
     */
    public int getLineCount() {
        return lineCount;
    }

    public int getStatementCount() {
        return statementCount;
    }

    /**
     * Occurrences of IF, WHEN, PERFORM, UNTIL and WHILE.
     */
    public int getDecisionPoints() {
        return decisionPoints;
    }

    public int getDataItemCount() {
        return dataItemCount;
    }

    public Complexity getComplexity() {
        return complexity;
    }
}
