package org.dxworks.rapidframe.analyzer;

import org.dxworks.rapidframe.model.FileMetrics;
import org.dxworks.rapidframe.model.LineKind;
import org.dxworks.rapidframe.model.NamingScore;
import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.Procedure;

import java.util.List;

public class MetricsCalculator {

    private final ReadabilityScorer readabilityScorer;

    public MetricsCalculator() {
        this(new ReadabilityScorer());
    }

    public MetricsCalculator(ReadabilityScorer readabilityScorer) {
        this.readabilityScorer = readabilityScorer;
    }

    /**
     * Metrics that depend on this file only.
     */
    public FileMetrics computeLocal(ParsedFile parsed, NamingScore naming, int waitTimeCount) {
        FileMetrics.Builder b = FileMetrics.builder(parsed.file)
                .fileKind(parsed.kind.getName())
                .moduleName(parsed.moduleName)
                .stepExcluded(parsed.noStepIn);

        int code = 0;
        int comments = 0;
        int blanks = 0;
        long indent = 0;
        for (int i = 0; i < parsed.lineCount(); i++) {
            LineKind kind = parsed.lineKinds.get(i);
            if (kind == LineKind.CODE) {
                code++;
                indent += RapidSyntax.leadingWhitespace(parsed.source.line(i + 1));
            } else if (kind == LineKind.COMMENT) {
                comments++;
            } else {
                blanks++;
            }
        }
        int total = parsed.lineCount();
        double commentRatio = total == 0 ? 0.0 : (double) comments / total;
        b.totalLines(total)
                .codeLines(code)
                .commentLines(comments)
                .blankLines(blanks)
                .commentRatio(commentRatio)
                .commentScore(readabilityScorer.commentScore(commentRatio))
                .averageIndent(code == 0 ? 0.0 : (double) indent / code);

        applyNesting(parsed, b);
        applyProcedures(parsed, b, code);

        b.variableCount(naming.variableCount)
                .namingScore(naming.score)
                .badWords(naming.badWords)
                .flaggedTokens(naming.flaggedTokens)
                .waitTimeCount(waitTimeCount);
        return b.build();
    }

    /**
     * Adds the facts that need the complete analyzed set and scores readability.
     */
    public FileMetrics complete(FileMetrics local, int maxCallChainDepth, List<String> unusedVariables,
                                List<String> unreachableProcedures, boolean stepExcluded) {
        FileMetrics.Builder b = local.toBuilder()
                .stepExcluded(stepExcluded)
                .maxCallChainDepth(maxCallChainDepth)
                .unusedVariables(unusedVariables)
                .unreachableProcedures(unreachableProcedures);
        return b.readabilityScore(readabilityScorer.score(b)).build();
    }

    private void applyNesting(ParsedFile parsed, FileMetrics.Builder b) {
        int depthSum = 0;
        int max = 0;
        Integer maxLine = null;
        for (int i = 0; i < parsed.nestingDepths.size(); i++) {
            int depth = parsed.nestingDepths.get(i);
            depthSum += depth;
            if (depth > max) {
                max = depth;
                maxLine = i + 1;
            }
        }
        b.simpleComplexity(parsed.blockOpeners)
                .decisionPoints(parsed.decisionPoints)
                .depthComplexity(depthSum)
                .maxNesting(max)
                .maxNestingLine(maxLine)
                .maxNestingProcedure(maxLine == null ? null : procedureAt(parsed.procedures, maxLine));
    }

    private void applyProcedures(ParsedFile parsed, FileMetrics.Builder b, int codeLines) {
        b.procedureCount(parsed.procedures.size());
        Procedure largest = null;
        for (Procedure procedure : parsed.procedures) {
            // strict comparison keeps the first one on ties
            if (largest == null || procedure.size() > largest.size()) {
                largest = procedure;
            }
        }
        if (largest != null) {
            b.largestProcedure(largest.name)
                    .largestProcedureSize(largest.size())
                    .largestProcedureShare(codeLines == 0 ? 0.0 : (double) largest.codeLines / codeLines);
        }
    }

    private static String procedureAt(List<Procedure> procedures, int line) {
        for (Procedure procedure : procedures) {
            if (line >= procedure.startLine && line <= procedure.endLine) {
                return procedure.name;
            }
        }
        return null;
    }
}
