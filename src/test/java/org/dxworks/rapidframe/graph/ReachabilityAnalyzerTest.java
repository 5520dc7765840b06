package org.dxworks.rapidframe.graph;

import org.dxworks.rapidframe.model.CallGraph;
import org.dxworks.rapidframe.model.Diagnostic;
import org.dxworks.rapidframe.model.DiagnosticKind;
import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.ProcedureId;
import org.dxworks.rapidframe.model.ReachabilityResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.dxworks.rapidframe.TestUtils.parse;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReachabilityAnalyzerTest {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Test
    void unreachableProcedureIsReported() {
        CallGraph graph = graph(parse("cell.mod",
                "MODULE Cell",
                "PROC main()",
                "    PickPart;",
                "ENDPROC",
                "PROC PickPart()",
                "    CloseGripper;",
                "ENDPROC",
                "PROC CloseGripper()",
                "ENDPROC",
                "PROC OldRoutine()",
                "ENDPROC",
                "ENDMODULE"));

        ReachabilityResult result = new ReachabilityAnalyzer().analyze(graph, "main", diagnostics);

        assertTrue(result.entryFound);
        assertEquals(Set.of("OldRoutine"), result.unreachableNames());
        assertEquals(0, result.entryDistance.get(id("cell.mod", "main")));
        assertEquals(1, result.entryDistance.get(id("cell.mod", "PickPart")));
        assertEquals(2, result.entryDistance.get(id("cell.mod", "CloseGripper")));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void compactIfBodyAndConnectedTrapAreReachable() {
        CallGraph graph = graph(parse("traps.mod",
                "MODULE Traps",
                "VAR intnum intno1;",
                "PROC main()",
                "    IF di1 = 1 Foo;",
                "    CONNECT intno1 WITH OnStop;",
                "ENDPROC",
                "PROC Foo()",
                "ENDPROC",
                "TRAP OnStop",
                "ENDTRAP",
                "ENDMODULE"));

        ReachabilityResult result = new ReachabilityAnalyzer().analyze(graph, "main", diagnostics);

        assertEquals(Set.of(), result.unreachableNames());
        assertEquals(1, result.entryDistance.get(id("traps.mod", "Foo")));
        assertEquals(1, result.entryDistance.get(id("traps.mod", "OnStop")));
        assertTrue(graph.unresolvedCalls().isEmpty());
    }

    @Test
    void reachableAndUnreachablePartitionTheNodes() {
        CallGraph graph = graph(parse("cell.mod",
                "MODULE Cell",
                "PROC main()",
                "    a;",
                "ENDPROC",
                "PROC a()",
                "ENDPROC",
                "PROC b()",
                "    a;",
                "ENDPROC",
                "ENDMODULE"));

        ReachabilityResult result = new ReachabilityAnalyzer().analyze(graph, "main", diagnostics);

        assertEquals(graph.size(), result.reachable.size() + result.unreachable.size());
        for (ProcedureId id : graph.nodeIds()) {
            assertTrue(result.reachable.contains(id) ^ result.unreachable.contains(id));
        }
    }

    @Test
    void missingEntryMakesEverythingUnreachable() {
        CallGraph graph = graph(parse("lib.mod",
                "MODULE Lib",
                "PROC a()",
                "    b;",
                "ENDPROC",
                "PROC b()",
                "ENDPROC",
                "ENDMODULE"));

        ReachabilityResult result = new ReachabilityAnalyzer().analyze(graph, "main", diagnostics);

        assertFalse(result.entryFound);
        assertEquals(Set.of("a", "b"), result.unreachableNames());
        assertTrue(result.reachable.isEmpty());
        assertEquals(DiagnosticKind.ENTRY_MISSING, diagnostics.get(0).kind);
    }

    @Test
    void cyclesTerminate() {
        CallGraph graph = graph(parse("loop.mod",
                "MODULE Loop",
                "PROC main()",
                "    a;",
                "ENDPROC",
                "PROC a()",
                "    main;",
                "    a;",
                "ENDPROC",
                "ENDMODULE"));

        ReachabilityResult result = new ReachabilityAnalyzer().analyze(graph, "main", diagnostics);

        assertTrue(result.unreachable.isEmpty());
        assertEquals(2, result.reachable.size());
    }

    @Test
    void entryMatchIgnoresCaseAndCoversEveryFile() {
        CallGraph graph = graph(
                parse("one.mod", "MODULE One", "PROC Main()", "    a;", "ENDPROC", "PROC a()", "ENDPROC", "ENDMODULE"),
                parse("two.mod", "MODULE Two", "PROC MAIN()", "    b;", "ENDPROC", "PROC b()", "ENDPROC", "ENDMODULE"));

        ReachabilityResult result = new ReachabilityAnalyzer().analyze(graph, "main", diagnostics);

        assertEquals(2, result.roots.size());
        assertTrue(result.unreachable.isEmpty());
    }

    @Test
    void customEntryProcedure() {
        CallGraph graph = graph(parse("svc.mod",
                "MODULE Svc",
                "PROC main()",
                "ENDPROC",
                "PROC service()",
                "    calibrate;",
                "ENDPROC",
                "PROC calibrate()",
                "ENDPROC",
                "ENDMODULE"));

        ReachabilityResult result = new ReachabilityAnalyzer().analyze(graph, "service", diagnostics);

        assertEquals(Set.of("main"), result.unreachableNames());
    }

    @Test
    void resultDoesNotDependOnFileOrder() {
        List<ParsedFile> files = new ArrayList<>(List.of(
                parse("a.mod", "MODULE A", "PROC main()", "    Shared;", "ENDPROC", "ENDMODULE"),
                parse("b.mod", "MODULE B", "PROC Shared()", "    onlyB;", "ENDPROC", "PROC onlyB()", "ENDPROC", "ENDMODULE"),
                parse("c.mod", "MODULE C", "PROC Shared()", "ENDPROC", "PROC orphan()", "ENDPROC", "ENDMODULE")));

        ReachabilityResult forward = new ReachabilityAnalyzer()
                .analyze(new CallGraphBuilder().build(files, Set.of(), new ArrayList<>()), "main", new ArrayList<>());
        Collections.reverse(files);
        ReachabilityResult reversed = new ReachabilityAnalyzer()
                .analyze(new CallGraphBuilder().build(files, Set.of(), new ArrayList<>()), "main", new ArrayList<>());

        assertEquals(forward.unreachable, reversed.unreachable);
        assertEquals(Set.of(id("c.mod", "orphan")), forward.unreachable);
    }

    private CallGraph graph(ParsedFile... files) {
        return new CallGraphBuilder().build(List.of(files), Set.of(), diagnostics);
    }

    private static ProcedureId id(String file, String name) {
        return new ProcedureId(file, name);
    }
}
