package org.dxworks.cobolscope.analytics;

public class AnalyticsReport {
    public String kind = "analytics";
    public long generation;
    public CodebaseOverview overview;
    public ProgramRelationships relationships;
    public RefactoringOpportunities refactoring;
}
