package org.dxworks.rapidframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Metrics snapshot of one file. Line and nesting figures come from the file
 * alone; call-chain depth, unused variables, unreachable procedures and the
 * readability score need the whole analyzed set and are filled in after the
 * call graph is built.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FileMetrics {
    public final String kind = "file";
    public final String file;
    public final String fileKind;
    public final String moduleName;
    public final boolean stepExcluded;

    public final int totalLines;
    public final int codeLines;
    public final int commentLines;
    public final int blankLines;
    public final double commentRatio;
    public final double commentScore;
    public final double averageIndent;

    public final int simpleComplexity;
    public final int decisionPoints;
    public final int depthComplexity;
    public final int maxNesting;
    public final Integer maxNestingLine;
    public final String maxNestingProcedure;
    public final int maxCallChainDepth;

    public final int procedureCount;
    public final String largestProcedure;
    public final int largestProcedureSize;
    public final double largestProcedureShare;

    public final int variableCount;
    public final double namingScore;
    public final List<String> badWords;
    public final List<FlaggedToken> flaggedTokens;
    public final List<String> unusedVariables;
    public final List<String> unreachableProcedures;
    public final int waitTimeCount;
    public final double readabilityScore;

    private FileMetrics(Builder b) {
        this.file = b.file;
        this.fileKind = b.fileKind;
        this.moduleName = b.moduleName;
        this.stepExcluded = b.stepExcluded;
        this.totalLines = b.totalLines;
        this.codeLines = b.codeLines;
        this.commentLines = b.commentLines;
        this.blankLines = b.blankLines;
        this.commentRatio = b.commentRatio;
        this.commentScore = b.commentScore;
        this.averageIndent = b.averageIndent;
        this.simpleComplexity = b.simpleComplexity;
        this.decisionPoints = b.decisionPoints;
        this.depthComplexity = b.depthComplexity;
        this.maxNesting = b.maxNesting;
        this.maxNestingLine = b.maxNestingLine;
        this.maxNestingProcedure = b.maxNestingProcedure;
        this.maxCallChainDepth = b.maxCallChainDepth;
        this.procedureCount = b.procedureCount;
        this.largestProcedure = b.largestProcedure;
        this.largestProcedureSize = b.largestProcedureSize;
        this.largestProcedureShare = b.largestProcedureShare;
        this.variableCount = b.variableCount;
        this.namingScore = b.namingScore;
        this.badWords = List.copyOf(b.badWords);
        this.flaggedTokens = List.copyOf(b.flaggedTokens);
        this.unusedVariables = List.copyOf(b.unusedVariables);
        this.unreachableProcedures = List.copyOf(b.unreachableProcedures);
        this.waitTimeCount = b.waitTimeCount;
        this.readabilityScore = b.readabilityScore;
    }

    public static Builder builder(String file) {
        return new Builder(file);
    }

    public Builder toBuilder() {
        Builder b = new Builder(file);
        b.fileKind = fileKind;
        b.moduleName = moduleName;
        b.stepExcluded = stepExcluded;
        b.totalLines = totalLines;
        b.codeLines = codeLines;
        b.commentLines = commentLines;
        b.blankLines = blankLines;
        b.commentRatio = commentRatio;
        b.commentScore = commentScore;
        b.averageIndent = averageIndent;
        b.simpleComplexity = simpleComplexity;
        b.decisionPoints = decisionPoints;
        b.depthComplexity = depthComplexity;
        b.maxNesting = maxNesting;
        b.maxNestingLine = maxNestingLine;
        b.maxNestingProcedure = maxNestingProcedure;
        b.maxCallChainDepth = maxCallChainDepth;
        b.procedureCount = procedureCount;
        b.largestProcedure = largestProcedure;
        b.largestProcedureSize = largestProcedureSize;
        b.largestProcedureShare = largestProcedureShare;
        b.variableCount = variableCount;
        b.namingScore = namingScore;
        b.badWords = new ArrayList<>(badWords);
        b.flaggedTokens = new ArrayList<>(flaggedTokens);
        b.unusedVariables = new ArrayList<>(unusedVariables);
        b.unreachableProcedures = new ArrayList<>(unreachableProcedures);
        b.waitTimeCount = waitTimeCount;
        b.readabilityScore = readabilityScore;
        return b;
    }

    public static final class Builder {
        private final String file;
        private String fileKind;
        private String moduleName;
        private boolean stepExcluded;
        private int totalLines;
        private int codeLines;
        private int commentLines;
        private int blankLines;
        private double commentRatio;
        private double commentScore;
        private double averageIndent;
        private int simpleComplexity;
        private int decisionPoints;
        private int depthComplexity;
        private int maxNesting;
        private Integer maxNestingLine;
        private String maxNestingProcedure;
        private int maxCallChainDepth;
        private int procedureCount;
        private String largestProcedure;
        private int largestProcedureSize;
        private double largestProcedureShare;
        private int variableCount;
        private double namingScore = 100.0;
        private List<String> badWords = new ArrayList<>();
        private List<FlaggedToken> flaggedTokens = new ArrayList<>();
        private List<String> unusedVariables = new ArrayList<>();
        private List<String> unreachableProcedures = new ArrayList<>();
        private int waitTimeCount;
        private double readabilityScore;

        private Builder(String file) {
            this.file = file;
        }

        public Builder fileKind(String fileKind) { this.fileKind = fileKind; return this; }
        public Builder moduleName(String moduleName) { this.moduleName = moduleName; return this; }
        public Builder stepExcluded(boolean stepExcluded) { this.stepExcluded = stepExcluded; return this; }
        public Builder totalLines(int totalLines) { this.totalLines = totalLines; return this; }
        public Builder codeLines(int codeLines) { this.codeLines = codeLines; return this; }
        public Builder commentLines(int commentLines) { this.commentLines = commentLines; return this; }
        public Builder blankLines(int blankLines) { this.blankLines = blankLines; return this; }
        public Builder commentRatio(double commentRatio) { this.commentRatio = commentRatio; return this; }
        public Builder commentScore(double commentScore) { this.commentScore = commentScore; return this; }
        public Builder averageIndent(double averageIndent) { this.averageIndent = averageIndent; return this; }
        public Builder simpleComplexity(int simpleComplexity) { this.simpleComplexity = simpleComplexity; return this; }
        public Builder decisionPoints(int decisionPoints) { this.decisionPoints = decisionPoints; return this; }
        public Builder depthComplexity(int depthComplexity) { this.depthComplexity = depthComplexity; return this; }
        public Builder maxNesting(int maxNesting) { this.maxNesting = maxNesting; return this; }
        public Builder maxNestingLine(Integer maxNestingLine) { this.maxNestingLine = maxNestingLine; return this; }
        public Builder maxNestingProcedure(String maxNestingProcedure) { this.maxNestingProcedure = maxNestingProcedure; return this; }
        public Builder maxCallChainDepth(int maxCallChainDepth) { this.maxCallChainDepth = maxCallChainDepth; return this; }
        public Builder procedureCount(int procedureCount) { this.procedureCount = procedureCount; return this; }
        public Builder largestProcedure(String largestProcedure) { this.largestProcedure = largestProcedure; return this; }
        public Builder largestProcedureSize(int largestProcedureSize) { this.largestProcedureSize = largestProcedureSize; return this; }
        public Builder largestProcedureShare(double largestProcedureShare) { this.largestProcedureShare = largestProcedureShare; return this; }
        public Builder variableCount(int variableCount) { this.variableCount = variableCount; return this; }
        public Builder namingScore(double namingScore) { this.namingScore = namingScore; return this; }
        public Builder badWords(List<String> badWords) { this.badWords = new ArrayList<>(badWords); return this; }
        public Builder flaggedTokens(List<FlaggedToken> flaggedTokens) { this.flaggedTokens = new ArrayList<>(flaggedTokens); return this; }
        public Builder unusedVariables(List<String> unusedVariables) { this.unusedVariables = new ArrayList<>(unusedVariables); return this; }
        public Builder unreachableProcedures(List<String> unreachableProcedures) { this.unreachableProcedures = new ArrayList<>(unreachableProcedures); return this; }
        public Builder waitTimeCount(int waitTimeCount) { this.waitTimeCount = waitTimeCount; return this; }
        public Builder readabilityScore(double readabilityScore) { this.readabilityScore = readabilityScore; return this; }

        public int totalLines() { return totalLines; }
        public int codeLines() { return codeLines; }
        public int simpleComplexity() { return simpleComplexity; }
        public int maxNesting() { return maxNesting; }
        public int maxCallChainDepth() { return maxCallChainDepth; }
        public int procedureCount() { return procedureCount; }
        public double largestProcedureShare() { return largestProcedureShare; }
        public double commentScore() { return commentScore; }
        public int badWordCount() { return badWords.size(); }
        public int unusedVariableCount() { return unusedVariables.size(); }

        public FileMetrics build() {
            return new FileMetrics(this);
        }
    }
}
