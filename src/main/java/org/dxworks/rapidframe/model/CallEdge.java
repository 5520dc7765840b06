package org.dxworks.rapidframe.model;

import java.util.Objects;

/**
 * A call site: the calling procedure and the callee name as written. The callee
 * is null until the call graph resolves it, and stays null for external or
 * library routines.
 */
public final class CallEdge {
    public final ProcedureId caller;
    public final String calleeName;
    public final int line;
    public final CallKind kind;
    public final ProcedureId callee;

    public CallEdge(ProcedureId caller, String calleeName, int line, CallKind kind, ProcedureId callee) {
        this.caller = Objects.requireNonNull(caller, "caller");
        this.calleeName = Objects.requireNonNull(calleeName, "calleeName");
        this.line = line;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.callee = callee;
    }

    public static CallEdge unresolved(ProcedureId caller, String calleeName, int line, CallKind kind) {
        return new CallEdge(caller, calleeName, line, kind, null);
    }

    public CallEdge resolvedTo(ProcedureId target) {
        return new CallEdge(caller, calleeName, line, kind, target);
    }

    public boolean isResolved() {
        return callee != null;
    }

    @Override
    public String toString() {
        return caller + " -> " + (callee != null ? callee : calleeName + " (unresolved)");
    }
}
