package org.dxworks.rapidframe.graph;

import org.dxworks.rapidframe.model.CallGraph;
import org.dxworks.rapidframe.model.ProcedureId;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Tarjan's algorithm over the call graph, iterative so that long call chains do
 * not overflow the thread stack. Maps every node to the number of its component.
 */
final class StronglyConnectedComponents {

    private final CallGraph graph;
    private final Map<ProcedureId, Integer> index = new HashMap<>();
    private final Map<ProcedureId, Integer> lowLink = new HashMap<>();
    private final Deque<ProcedureId> members = new ArrayDeque<>();
    private final Set<ProcedureId> onMembers = new HashSet<>();
    private final Map<ProcedureId, Integer> component = new HashMap<>();
    private int nextIndex;
    private int nextComponent;

    StronglyConnectedComponents(CallGraph graph) {
        this.graph = graph;
    }

    Map<ProcedureId, Integer> compute() {
        for (ProcedureId node : graph.nodeIds()) {
            if (!index.containsKey(node)) {
                visit(node);
            }
        }
        return component;
    }

    private void visit(ProcedureId root) {
        Deque<Frame> stack = new ArrayDeque<>();
        enter(root, stack);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.callees.hasNext()) {
                ProcedureId callee = frame.callees.next();
                if (!index.containsKey(callee)) {
                    enter(callee, stack);
                } else if (onMembers.contains(callee)) {
                    lower(frame.id, index.get(callee));
                }
                continue;
            }

            stack.pop();
            if (lowLink.get(frame.id).equals(index.get(frame.id))) {
                ProcedureId member;
                do {
                    member = members.pop();
                    onMembers.remove(member);
                    component.put(member, nextComponent);
                } while (!member.equals(frame.id));
                nextComponent++;
            }
            Frame parent = stack.peek();
            if (parent != null) {
                lower(parent.id, lowLink.get(frame.id));
            }
        }
    }

    private void enter(ProcedureId node, Deque<Frame> stack) {
        index.put(node, nextIndex);
        lowLink.put(node, nextIndex);
        nextIndex++;
        members.push(node);
        onMembers.add(node);
        stack.push(new Frame(node, graph.callees(node).iterator()));
    }

    private void lower(ProcedureId node, int candidate) {
        if (candidate < lowLink.get(node)) {
            lowLink.put(node, candidate);
        }
    }

    private static final class Frame {
        final ProcedureId id;
        final Iterator<ProcedureId> callees;

        Frame(ProcedureId id, Iterator<ProcedureId> callees) {
            this.id = id;
            this.callees = callees;
        }
    }
}
