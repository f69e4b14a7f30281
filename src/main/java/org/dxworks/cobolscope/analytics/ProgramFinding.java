package org.dxworks.cobolscope.analytics;

public class ProgramFinding {
    public String programId;
    public String unitId;
    public int lineCount;
    public String complexity;
    public Integer dependencyCount;
}
