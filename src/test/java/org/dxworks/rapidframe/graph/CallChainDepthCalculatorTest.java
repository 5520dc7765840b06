package org.dxworks.rapidframe.graph;

import org.dxworks.rapidframe.model.CallEdge;
import org.dxworks.rapidframe.model.CallGraph;
import org.dxworks.rapidframe.model.CallKind;
import org.dxworks.rapidframe.model.Procedure;
import org.dxworks.rapidframe.model.ProcedureId;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

public class CallChainDepthCalculatorTest {

    private static final String FILE = "chain.mod";

    @Test
    void straightChain() {
        CallGraph graph = graph("main>a", "a>b", "b>c");

        assertEquals(3, new CallChainDepthCalculator(graph).depthFrom(id("main")));
    }

    @Test
    void leafAndUnknownProcedureHaveZeroDepth() {
        CallChainDepthCalculator calculator = new CallChainDepthCalculator(graph("main>a"));

        assertEquals(0, calculator.depthFrom(id("a")));
        assertEquals(0, calculator.depthFrom(new ProcedureId("other.mod", "ghost")));
    }

    @Test
    void cycleCountsSimplePathOnly() {
        CallGraph graph = graph("main>a", "a>b", "b>a");

        assertEquals(2, new CallChainDepthCalculator(graph).depthFrom(id("main")));
    }

    @Test
    void selfRecursionAddsNothing() {
        assertEquals(0, new CallChainDepthCalculator(graph("p>p")).depthFrom(id("p")));
    }

    @Test
    void longestBranchWins() {
        CallGraph graph = graph("main>a", "main>b", "a>c", "b>c", "c>d", "main>d");

        assertEquals(3, new CallChainDepthCalculator(graph).depthFrom(id("main")));
    }

    @Test
    void cachedDepthsMatchFreshOnes() {
        CallGraph graph = graph("main>a", "a>b", "b>c", "c>a", "main>x", "x>y");
        CallChainDepthCalculator warm = new CallChainDepthCalculator(graph);
        warm.depthFrom(id("b"));
        warm.depthFrom(id("x"));

        assertEquals(new CallChainDepthCalculator(graph).depthFrom(id("main")), warm.depthFrom(id("main")));
        assertEquals(3, warm.depthFrom(id("main")));
    }

    @Test
    void maxOverSeveralStarts() {
        CallChainDepthCalculator calculator = new CallChainDepthCalculator(graph("a>b", "c>d", "d>e"));

        assertEquals(2, calculator.maxDepthFrom(List.of(id("a"), id("c"))));
        assertEquals(0, calculator.maxDepthFrom(List.of()));
    }

    @Test
    void recursiveLeafUnderWideLadderStaysFast() {
        List<String> calls = new ArrayList<>();
        int layers = 26;
        for (int i = 0; i < layers - 1; i++) {
            for (String from : List.of("A" + i, "B" + i)) {
                calls.add(from + ">A" + (i + 1));
                calls.add(from + ">B" + (i + 1));
            }
        }
        int last = layers - 1;
        calls.add("A" + last + ">Again");
        calls.add("B" + last + ">Again");
        calls.add("Again>Again");
        CallGraph graph = graph(calls.toArray(new String[0]));

        int depth = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> new CallChainDepthCalculator(graph).depthFrom(id("A0")));

        assertEquals(layers, depth);
    }

    @Test
    void ladderOfMutuallyRecursivePairsStaysFast() {
        List<String> calls = new ArrayList<>();
        int layers = 26;
        for (int i = 0; i < layers; i++) {
            calls.add("A" + i + ">B" + i);
            calls.add("B" + i + ">A" + i);
            if (i < layers - 1) {
                for (String from : List.of("A" + i, "B" + i)) {
                    calls.add(from + ">A" + (i + 1));
                    calls.add(from + ">B" + (i + 1));
                }
            }
        }
        CallGraph graph = graph(calls.toArray(new String[0]));

        int depth = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> new CallChainDepthCalculator(graph).depthFrom(id("A0")));

        assertEquals(2 * layers - 1, depth);
    }

    @Test
    void expansionLimitBoundsWorkInsideOneCycle() {
        CallGraph graph = graph("main>a", "a>b", "b>c", "c>a");

        assertEquals(3, new CallChainDepthCalculator(graph).depthFrom(id("main")));
        assertEquals(2, new CallChainDepthCalculator(graph, 0).depthFrom(id("main")));
    }

    @Test
    void deepChainDoesNotOverflowTheStack() {
        int length = 20000;
        List<Procedure> procedures = new ArrayList<>();
        List<CallEdge> edges = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            procedures.add(Procedure.builder(FILE, "p" + i).startLine(i + 1).endLine(i + 1).build());
            if (i > 0) {
                edges.add(new CallEdge(id("p" + (i - 1)), "p" + i, i, CallKind.STATIC, id("p" + i)));
            }
        }
        CallGraph graph = new CallGraph(procedures, edges, List.of());

        assertEquals(length - 1, new CallChainDepthCalculator(graph).depthFrom(id("p0")));
    }

    private static CallGraph graph(String... calls) {
        Set<String> names = new LinkedHashSet<>();
        for (String call : calls) {
            String[] parts = call.split(">");
            names.add(parts[0]);
            names.add(parts[1]);
        }
        List<Procedure> procedures = new ArrayList<>();
        int line = 1;
        for (String name : names) {
            procedures.add(Procedure.builder(FILE, name).startLine(line).endLine(line + 1).build());
            line += 2;
        }
        List<CallEdge> edges = new ArrayList<>();
        for (String call : calls) {
            String[] parts = call.split(">");
            edges.add(new CallEdge(id(parts[0]), parts[1], 0, CallKind.STATIC, id(parts[1])));
        }
        return new CallGraph(procedures, edges, List.of());
    }

    private static ProcedureId id(String name) {
        return new ProcedureId(FILE, name);
    }
}
