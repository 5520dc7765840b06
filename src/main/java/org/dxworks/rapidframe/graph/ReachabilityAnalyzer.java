package org.dxworks.rapidframe.graph;

import org.dxworks.rapidframe.model.CallGraph;
import org.dxworks.rapidframe.model.Diagnostic;
import org.dxworks.rapidframe.model.DiagnosticKind;
import org.dxworks.rapidframe.model.ProcedureId;
import org.dxworks.rapidframe.model.ReachabilityResult;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Marks every procedure reachable from the entry procedure. Uses a queue
 * instead of recursion; the visited map makes cycles harmless.
 */
public class ReachabilityAnalyzer {

    public static final String DEFAULT_ENTRY = "main";

    public ReachabilityResult analyze(CallGraph graph, String entryProcedure, List<Diagnostic> diagnostics) {
        List<ProcedureId> roots = graph.findAllByName(entryProcedure);
        if (roots.isEmpty()) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.ENTRY_MISSING,
                    "Entry procedure " + entryProcedure + " not found; all " + graph.size()
                            + " procedures are reported unreachable"));
            return new ReachabilityResult(entryProcedure, roots, Set.of(), graph.nodeIds(), Map.of());
        }

        Map<ProcedureId, Integer> distance = new LinkedHashMap<>();
        Deque<ProcedureId> queue = new ArrayDeque<>();
        for (ProcedureId root : roots) {
            distance.put(root, 0);
            queue.add(root);
        }
        while (!queue.isEmpty()) {
            ProcedureId current = queue.poll();
            int next = distance.get(current) + 1;
            for (ProcedureId callee : graph.callees(current)) {
                if (!distance.containsKey(callee)) {
                    distance.put(callee, next);
                    queue.add(callee);
                }
            }
        }

        Set<ProcedureId> unreachable = new LinkedHashSet<>();
        for (ProcedureId id : graph.nodeIds()) {
            if (!distance.containsKey(id)) {
                unreachable.add(id);
            }
        }
        return new ReachabilityResult(entryProcedure, roots, distance.keySet(), unreachable, distance);
    }
}
