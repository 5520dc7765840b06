package org.dxworks.rapidframe.report;

import org.dxworks.rapidframe.model.CallGraph;
import org.dxworks.rapidframe.model.ProcedureId;
import org.dxworks.rapidframe.model.ReachabilityResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Renders the call tree below the entry procedure as indented text. Callees are
 * listed alphabetically; a procedure already on the current path is printed
 * once more with a cycle marker and not expanded. Each procedure's callees are
 * expanded only the first time it is printed; later occurrences are marked
 * "(see above)", which keeps the output linear in the size of the graph.
 */
public class CallTreePrinter {

    private static final Comparator<ProcedureId> BY_NAME = Comparator
            .comparing((ProcedureId id) -> id.name.toLowerCase(Locale.ROOT))
            .thenComparing(id -> id.file);
    private static final String CYCLE = "(cycle)";
    private static final String SEEN = "(see above)";

    public String print(CallGraph graph, ReachabilityResult reachability) {
        StringBuilder out = new StringBuilder();
        if (!reachability.entryFound) {
            out.append("(entry procedure ").append(reachability.entryProcedure).append(" not found)\n");
            return out.toString();
        }
        Set<ProcedureId> expanded = new HashSet<>();
        for (ProcedureId root : reachability.roots) {
            printFrom(graph, root, expanded, out);
        }
        return out.toString();
    }

    private void printFrom(CallGraph graph, ProcedureId root, Set<ProcedureId> expanded, StringBuilder out) {
        Deque<Iterator<ProcedureId>> stack = new ArrayDeque<>();
        Deque<ProcedureId> path = new ArrayDeque<>();
        Set<ProcedureId> onPath = new HashSet<>();

        if (!expanded.add(root)) {
            appendLine(out, 0, root, SEEN);
            return;
        }
        appendLine(out, 0, root, null);
        path.push(root);
        onPath.add(root);
        stack.push(sortedCallees(graph, root));

        while (!stack.isEmpty()) {
            Iterator<ProcedureId> callees = stack.peek();
            if (!callees.hasNext()) {
                stack.pop();
                onPath.remove(path.pop());
                continue;
            }
            ProcedureId callee = callees.next();
            int depth = path.size();
            if (onPath.contains(callee)) {
                appendLine(out, depth, callee, CYCLE);
                continue;
            }
            if (!graph.callees(callee).isEmpty() && !expanded.add(callee)) {
                appendLine(out, depth, callee, SEEN);
                continue;
            }
            appendLine(out, depth, callee, null);
            path.push(callee);
            onPath.add(callee);
            stack.push(sortedCallees(graph, callee));
        }
    }

    private static Iterator<ProcedureId> sortedCallees(CallGraph graph, ProcedureId id) {
        List<ProcedureId> callees = new ArrayList<>(graph.callees(id));
        callees.sort(BY_NAME);
        return callees.iterator();
    }

    private static void appendLine(StringBuilder out, int depth, ProcedureId id, String marker) {
        out.append("  ".repeat(depth)).append("- ").append(id.name).append(" [").append(id.file).append(']');
        if (marker != null) {
            out.append(' ').append(marker);
        }
        out.append('\n');
    }
}
