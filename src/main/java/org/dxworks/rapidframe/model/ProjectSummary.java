package org.dxworks.rapidframe.model;

public final class ProjectSummary {
    public final String kind = "summary";
    public final int filesAnalyzed;
    public final int totalLines;
    public final int procedureCount;
    public final int unreachableCount;
    public final int waitTimeCount;
    public final int uniqueVariableCount;
    public final double averageComplexity;
    public final double rawAverageReadability;
    public final double averageReadability;

    public ProjectSummary(int filesAnalyzed, int totalLines, int procedureCount, int unreachableCount,
                          int waitTimeCount, int uniqueVariableCount, double averageComplexity,
                          double rawAverageReadability, double averageReadability) {
        this.filesAnalyzed = filesAnalyzed;
        this.totalLines = totalLines;
        this.procedureCount = procedureCount;
        this.unreachableCount = unreachableCount;
        this.waitTimeCount = waitTimeCount;
        this.uniqueVariableCount = uniqueVariableCount;
        this.averageComplexity = averageComplexity;
        this.rawAverageReadability = rawAverageReadability;
        this.averageReadability = averageReadability;
    }
}
