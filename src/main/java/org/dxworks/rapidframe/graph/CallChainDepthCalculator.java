package org.dxworks.rapidframe.graph;

import org.dxworks.rapidframe.model.CallGraph;
import org.dxworks.rapidframe.model.ProcedureId;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Longest simple call path (in edges) starting at a procedure.
 *
 * The walk keeps an explicit stack of frames and never revisits a node that is
 * already on the current path; reaching one ends that path with the length
 * accumulated so far.
 *
 * Nothing a procedure can reach lies in a strongly connected component above
 * it, so when a procedure is entered from another component (or is the start)
 * the current path cannot constrain it and its depth is memoized. Within one
 * component the walk enumerates simple paths. Once this calculator has spent its
 * expansion limit on such walks it stops descending inside components and counts
 * those callees as leaves, so later results may be lower bounds.
 */
public class CallChainDepthCalculator {

    public static final int DEFAULT_EXPANSION_LIMIT = 200_000;

    private final CallGraph graph;
    private final int expansionLimit;
    private final Map<ProcedureId, Integer> memo = new HashMap<>();
    private Map<ProcedureId, Integer> components;
    private int expansions;

    public CallChainDepthCalculator(CallGraph graph) {
        this(graph, DEFAULT_EXPANSION_LIMIT);
    }

    public CallChainDepthCalculator(CallGraph graph, int expansionLimit) {
        this.graph = graph;
        this.expansionLimit = expansionLimit;
    }

    public int depthFrom(ProcedureId start) {
        if (!graph.contains(start)) {
            return 0;
        }
        Integer known = memo.get(start);
        if (known != null) {
            return known;
        }
        Map<ProcedureId, Integer> component = components();

        Deque<Frame> stack = new ArrayDeque<>();
        Set<ProcedureId> onPath = new HashSet<>();
        stack.push(new Frame(start, graph.callees(start).iterator(), true));
        onPath.add(start);
        int result = 0;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.callees.hasNext()) {
                ProcedureId callee = frame.callees.next();
                if (onPath.contains(callee)) {
                    continue;
                }
                boolean crossesComponent = !component.get(callee).equals(component.get(frame.id));
                if (crossesComponent) {
                    Integer memoized = memo.get(callee);
                    if (memoized != null) {
                        frame.best = Math.max(frame.best, memoized + 1);
                        continue;
                    }
                } else if (expansions >= expansionLimit) {
                    frame.best = Math.max(frame.best, 1);
                    continue;
                } else {
                    expansions++;
                }
                stack.push(new Frame(callee, graph.callees(callee).iterator(), crossesComponent));
                onPath.add(callee);
                continue;
            }

            stack.pop();
            onPath.remove(frame.id);
            if (frame.pathIndependent) {
                memo.put(frame.id, frame.best);
            }
            Frame parent = stack.peek();
            if (parent != null) {
                parent.best = Math.max(parent.best, frame.best + 1);
            } else {
                result = frame.best;
            }
        }
        return result;
    }

    public int maxDepthFrom(Collection<ProcedureId> starts) {
        int max = 0;
        for (ProcedureId start : starts) {
            max = Math.max(max, depthFrom(start));
        }
        return max;
    }

    private Map<ProcedureId, Integer> components() {
        if (components == null) {
            components = new StronglyConnectedComponents(graph).compute();
        }
        return components;
    }

    private static final class Frame {
        final ProcedureId id;
        final Iterator<ProcedureId> callees;
        final boolean pathIndependent;
        int best;

        Frame(ProcedureId id, Iterator<ProcedureId> callees, boolean pathIndependent) {
            this.id = id;
            this.callees = callees;
            this.pathIndependent = pathIndependent;
        }
    }
}
