package org.dxworks.rapidframe.report;

import org.dxworks.rapidframe.model.AnalysisResult;
import org.dxworks.rapidframe.model.CallGraph;
import org.dxworks.rapidframe.model.Diagnostic;
import org.dxworks.rapidframe.model.DiagnosticKind;
import org.dxworks.rapidframe.model.FileMetrics;
import org.dxworks.rapidframe.model.NamingScore;
import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.ProjectSummary;
import org.dxworks.rapidframe.model.ReachabilityResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.dxworks.rapidframe.TestUtils.parse;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ReportAssemblerTest {

    private final ReportAssembler assembler = new ReportAssembler();
    private final CallGraph emptyGraph = new CallGraph(List.of(), List.of(), List.of());
    private final ReachabilityResult noEntry = new ReachabilityResult("main", List.of(), Set.of(), Set.of(), Map.of());

    @Test
    void averageIsRawMeanWhenNoFileDragsItDown() {
        List<FileReport> reports = List.of(report("a.mod", 90), report("b.mod", 90), report("c.mod", 90),
                report("d.mod", 10));

        ProjectSummary summary = assembler.summarize(reports, noEntry, 0);

        assertEquals(70.0, summary.rawAverageReadability, 1e-9);
        assertEquals(70.0, summary.averageReadability, 1e-9);
    }

    @Test
    void worstFilesCapTheAverage() {
        List<FileReport> reports = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            reports.add(report("good" + i + ".mod", 100));
        }
        for (int i = 0; i < 3; i++) {
            reports.add(report("bad" + i + ".mod", 0));
        }

        ProjectSummary summary = assembler.summarize(reports, noEntry, 0);

        assertEquals(400.0 / 7, summary.rawAverageReadability, 1e-9);
        assertEquals(40.0, summary.averageReadability, 1e-9);
    }

    @Test
    void emptyProjectSummary() {
        ProjectSummary summary = assembler.summarize(List.of(), noEntry, 0);

        assertEquals(0, summary.filesAnalyzed);
        assertEquals(0.0, summary.averageReadability, 1e-9);
    }

    @Test
    void uniqueVariablesIgnoreCase() {
        FileReport first = report(parse("a.mod", "MODULE A", "VAR num Counter;", "ENDMODULE"), 100);
        FileReport second = report(parse("b.mod", "MODULE B", "VAR num counter;", "VAR num total;", "ENDMODULE"), 100);

        assertEquals(2, assembler.summarize(List.of(first, second), noEntry, 0).uniqueVariableCount);
    }

    @Test
    void assembleKeepsFileOrderAndMergesDiagnostics() {
        FileReport broken = report(parse("z.mod", "MODULE Z", "ENDIF", "ENDMODULE"), 80);
        FileReport clean = report("a.mod", 100);
        Diagnostic global = Diagnostic.of(DiagnosticKind.ENTRY_MISSING, "no main");

        AnalysisResult result = assembler.assemble(List.of(broken, clean), emptyGraph, noEntry, List.of(global));

        assertEquals(List.of("z.mod", "a.mod"), new ArrayList<>(result.files.keySet()));
        assertEquals(2, result.diagnostics.size());
        assertEquals(DiagnosticKind.MALFORMED_NESTING, result.diagnostics.get(0).kind);
        assertEquals(DiagnosticKind.ENTRY_MISSING, result.diagnostics.get(1).kind);
        assertEquals(90.0, result.summary.averageReadability, 1e-9);
    }

    private static FileReport report(String fileId, double readability) {
        return report(parse(fileId, "MODULE M", "ENDMODULE"), readability);
    }

    private static FileReport report(ParsedFile parsed, double readability) {
        FileMetrics metrics = FileMetrics.builder(parsed.file)
                .totalLines(parsed.lineCount())
                .readabilityScore(readability)
                .build();
        return new FileReport(parsed, NamingScore.neutral(true), metrics, List.of());
    }
}
