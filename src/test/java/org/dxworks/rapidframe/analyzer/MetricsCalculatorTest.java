package org.dxworks.rapidframe.analyzer;

import org.dxworks.rapidframe.model.FileMetrics;
import org.dxworks.rapidframe.model.NamingScore;
import org.dxworks.rapidframe.model.ParsedFile;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.dxworks.rapidframe.TestUtils.parse;
import static org.dxworks.rapidframe.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MetricsCalculatorTest {

    private final MetricsCalculator calculator = new MetricsCalculator();

    @Test
    void localMetricsOfMainModule() throws IOException {
        FileMetrics metrics = calculator.computeLocal(parse(sample("MainModule.mod")), NamingScore.neutral(true), 2);

        assertEquals("MainModule.mod", metrics.file);
        assertEquals("module", metrics.fileKind);
        assertEquals("MainModule", metrics.moduleName);
        assertEquals(37, metrics.totalLines);
        assertEquals(31, metrics.codeLines);
        assertEquals(2, metrics.commentLines);
        assertEquals(4, metrics.blankLines);
        assertEquals(2.0 / 37, metrics.commentRatio, 1e-9);

        assertEquals(2, metrics.simpleComplexity);
        assertEquals(2, metrics.decisionPoints);
        assertEquals(14, metrics.depthComplexity);
        assertEquals(2, metrics.maxNesting);
        assertEquals(11, metrics.maxNestingLine);
        assertEquals("main", metrics.maxNestingProcedure);

        assertEquals(4, metrics.procedureCount);
        assertEquals("main", metrics.largestProcedure);
        assertEquals(11, metrics.largestProcedureSize);
        assertEquals(10.0 / 31, metrics.largestProcedureShare, 1e-9);
        assertEquals(2, metrics.waitTimeCount);
    }

    @Test
    void emptyFileHasZeroRatios() {
        FileMetrics metrics = calculator.computeLocal(parse("empty.mod"), NamingScore.neutral(true), 0);

        assertEquals(0, metrics.totalLines);
        assertEquals(0.0, metrics.commentRatio);
        assertEquals(0.0, metrics.averageIndent);
        assertEquals(0, metrics.procedureCount);
        assertNull(metrics.largestProcedure);
        assertNull(metrics.maxNestingLine);
    }

    @Test
    void averageIndentCountsCodeLinesOnly() {
        ParsedFile parsed = parse("indent.mod",
                "MODULE M",
                "    VAR num a;",
                "",
                "        ! comment");

        assertEquals(2.0, calculator.computeLocal(parsed, NamingScore.neutral(true), 0).averageIndent, 1e-9);
    }

    @Test
    void largestProcedureTieKeepsFirst() {
        ParsedFile parsed = parse("tie.mod",
                "MODULE M",
                "PROC first()",
                "    a := 1;",
                "ENDPROC",
                "PROC second()",
                "    b := 1;",
                "ENDPROC",
                "ENDMODULE");

        assertEquals("first", calculator.computeLocal(parsed, NamingScore.neutral(true), 0).largestProcedure);
    }

    @Test
    void completeAddsGraphFactsAndReadability() throws IOException {
        FileMetrics local = calculator.computeLocal(parse(sample("MainModule.mod")), NamingScore.neutral(true), 2);

        FileMetrics metrics = calculator.complete(local, 4, List.of("unusedText"), List.of("OldRoutine"), false);

        assertEquals(4, metrics.maxCallChainDepth);
        assertEquals(List.of("unusedText"), metrics.unusedVariables);
        assertEquals(List.of("OldRoutine"), metrics.unreachableProcedures);
        assertEquals(local.totalLines, metrics.totalLines);
        assertTrue(metrics.readabilityScore > 0.0 && metrics.readabilityScore < 100.0);
        // call depth 4 costs 15, one unused variable 0.5, thin comments about 0.5
        assertEquals(100.0 - 15.0 - 0.5 - (5.0 - metrics.commentScore * 0.05), metrics.readabilityScore, 1e-9);
    }

    @Test
    void configFileLinesAreClassified() throws IOException {
        ParsedFile parsed = new ConfigFileAnalyzer().analyze(sample("robot.cfg"));
        FileMetrics metrics = calculator.computeLocal(parsed, NamingScore.neutral(true), 0);

        assertEquals("config", metrics.fileKind);
        assertEquals(6, metrics.totalLines);
        assertEquals(3, metrics.codeLines);
        assertEquals(2, metrics.commentLines);
        assertEquals(1, metrics.blankLines);
        assertEquals(0, metrics.procedureCount);
    }
}
