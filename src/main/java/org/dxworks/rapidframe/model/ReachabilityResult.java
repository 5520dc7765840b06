package org.dxworks.rapidframe.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ReachabilityResult {
    public final String entryProcedure;
    public final boolean entryFound;
    public final List<ProcedureId> roots;
    public final Set<ProcedureId> reachable;
    public final Set<ProcedureId> unreachable;
    public final Map<ProcedureId, Integer> entryDistance;

    public ReachabilityResult(String entryProcedure, List<ProcedureId> roots, Set<ProcedureId> reachable,
                              Set<ProcedureId> unreachable, Map<ProcedureId, Integer> entryDistance) {
        this.entryProcedure = entryProcedure;
        this.roots = List.copyOf(roots);
        this.entryFound = !roots.isEmpty();
        this.reachable = Collections.unmodifiableSet(new LinkedHashSet<>(reachable));
        this.unreachable = Collections.unmodifiableSet(new LinkedHashSet<>(unreachable));
        this.entryDistance = Collections.unmodifiableMap(new LinkedHashMap<>(entryDistance));
    }

    public boolean isReachable(ProcedureId id) {
        return reachable.contains(id);
    }

    /**
     * Bare names of unreachable procedures. A name declared in several files
     * appears once.
     */
    public Set<String> unreachableNames() {
        Set<String> names = new LinkedHashSet<>();
        for (ProcedureId id : unreachable) {
            names.add(id.name);
        }
        return names;
    }
}
