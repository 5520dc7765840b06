package org.dxworks.rapidframe.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Procedure call graph over the whole analyzed set. Nodes are keyed by
 * (file, name); every edge's caller is a node. Cycles are allowed.
 */
public final class CallGraph {
    private final Map<ProcedureId, Procedure> nodes;
    private final List<CallEdge> edges;
    private final List<CallEdge> unresolvedCalls;
    private final Map<ProcedureId, Set<ProcedureId>> adjacency;
    private final Map<String, List<ProcedureId>> byName;

    public CallGraph(Collection<Procedure> procedures, List<CallEdge> edges, List<CallEdge> unresolvedCalls) {
        Map<ProcedureId, Procedure> nodeMap = new LinkedHashMap<>();
        Map<String, List<ProcedureId>> nameIndex = new LinkedHashMap<>();
        for (Procedure procedure : procedures) {
            if (nodeMap.putIfAbsent(procedure.id, procedure) == null) {
                nameIndex.computeIfAbsent(procedure.id.key(), k -> new ArrayList<>()).add(procedure.id);
            }
        }
        Map<ProcedureId, Set<ProcedureId>> adj = new LinkedHashMap<>();
        for (ProcedureId id : nodeMap.keySet()) {
            adj.put(id, new LinkedHashSet<>());
        }
        for (CallEdge edge : edges) {
            if (!nodeMap.containsKey(edge.caller)) {
                throw new IllegalArgumentException("Edge caller is not a node: " + edge.caller);
            }
            if (edge.callee == null || !nodeMap.containsKey(edge.callee)) {
                throw new IllegalArgumentException("Edge callee is not a node: " + edge);
            }
            adj.get(edge.caller).add(edge.callee);
        }
        this.nodes = Collections.unmodifiableMap(nodeMap);
        this.edges = List.copyOf(edges);
        this.unresolvedCalls = List.copyOf(unresolvedCalls);
        adj.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.adjacency = Collections.unmodifiableMap(adj);
        nameIndex.replaceAll((k, v) -> List.copyOf(v));
        this.byName = Collections.unmodifiableMap(nameIndex);
    }

    public Collection<Procedure> procedures() {
        return nodes.values();
    }

    public Set<ProcedureId> nodeIds() {
        return nodes.keySet();
    }

    public boolean contains(ProcedureId id) {
        return nodes.containsKey(id);
    }

    public Procedure procedure(ProcedureId id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    public List<CallEdge> edges() {
        return edges;
    }

    public List<CallEdge> unresolvedCalls() {
        return unresolvedCalls;
    }

    public Set<ProcedureId> callees(ProcedureId id) {
        Set<ProcedureId> callees = adjacency.get(id);
        return callees != null ? callees : Set.of();
    }

    /**
     * All nodes with the given name, in declaration order (file supply order,
     * then line). Matching ignores case.
     */
    public List<ProcedureId> findAllByName(String name) {
        List<ProcedureId> ids = byName.get(name.toLowerCase(Locale.ROOT));
        return ids != null ? ids : List.of();
    }

    /**
     * Best-effort lookup by bare name. When several files declare the name the
     * first-declared one wins; use {@link #isAmbiguous(String)} to detect that.
     */
    public Optional<Procedure> findByName(String name) {
        List<ProcedureId> ids = findAllByName(name);
        return ids.isEmpty() ? Optional.empty() : Optional.of(nodes.get(ids.get(0)));
    }

    public boolean isAmbiguous(String name) {
        return findAllByName(name).size() > 1;
    }

    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (List<ProcedureId> ids : byName.values()) {
            names.add(nodes.get(ids.get(0)).name);
        }
        return names;
    }
}
