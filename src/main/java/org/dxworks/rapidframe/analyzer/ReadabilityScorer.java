package org.dxworks.rapidframe.analyzer;

import org.dxworks.rapidframe.model.FileMetrics;

/**
 * Overall readability on a 0-100 scale: 100 minus a set of capped penalties.
 */
public class ReadabilityScorer {

    /**
     * Comment health, 0-100: ramps up to 6% comments, stays at 100 up to 25%,
     * then drops linearly to 0 at 60%.
     */
    public double commentScore(double commentRatio) {
        if (commentRatio <= 0.0) {
            return 0.0;
        }
        if (commentRatio < 0.06) {
            return commentRatio / 0.06 * 100.0;
        }
        if (commentRatio <= 0.25) {
            return 100.0;
        }
        if (commentRatio >= 0.60) {
            return 0.0;
        }
        return (1.0 - (commentRatio - 0.25) / (0.60 - 0.25)) * 100.0;
    }

    public double score(FileMetrics.Builder metrics) {
        double complexityPenalty = clamp(metrics.simpleComplexity() - 50, 30.0);
        double nestingPenalty = clamp((metrics.maxNesting() - 8) * 5.0, 30.0);
        double callDepthPenalty = clamp((metrics.maxCallChainDepth() - 3) * 15.0, 50.0);
        double procedureCountPenalty = clamp(metrics.procedureCount() - 20, 20.0);

        double procedureSizePenalty = 0.0;
        if (metrics.largestProcedureShare() > 0.60 && metrics.totalLines() > 300) {
            procedureSizePenalty = (metrics.largestProcedureShare() - 0.60) * 50.0;
        }

        double fileLengthPenalty = 0.0;
        if (metrics.totalLines() > 600 && metrics.procedureCount() > 1) {
            fileLengthPenalty = clamp((metrics.totalLines() - 600) * 0.05, 20.0);
        }

        double badWordPenalty = clamp(metrics.badWordCount() * 0.5, 20.0);
        double unusedVariablePenalty = clamp(metrics.unusedVariableCount() * 0.5, 20.0);
        double commentPenalty = 5.0 - metrics.commentScore() * 0.05;

        double total = complexityPenalty + nestingPenalty + callDepthPenalty + procedureCountPenalty
                + procedureSizePenalty + fileLengthPenalty + badWordPenalty + unusedVariablePenalty
                + commentPenalty;
        return Math.max(0.0, Math.min(100.0, 100.0 - total));
    }

    private static double clamp(double value, double cap) {
        return Math.min(cap, Math.max(0.0, value));
    }
}
