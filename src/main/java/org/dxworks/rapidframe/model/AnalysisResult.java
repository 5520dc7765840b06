package org.dxworks.rapidframe.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything one engine run produced. Files keep the order they were supplied in.
 */
public final class AnalysisResult {
    public final Map<String, FileMetrics> files;
    public final CallGraph callGraph;
    public final ReachabilityResult reachability;
    public final List<WaitTimeOccurrence> waitTimes;
    public final List<Diagnostic> diagnostics;
    public final ProjectSummary summary;

    public AnalysisResult(Map<String, FileMetrics> files, CallGraph callGraph, ReachabilityResult reachability,
                          List<WaitTimeOccurrence> waitTimes, List<Diagnostic> diagnostics, ProjectSummary summary) {
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        this.callGraph = callGraph;
        this.reachability = reachability;
        this.waitTimes = List.copyOf(waitTimes);
        this.diagnostics = List.copyOf(diagnostics);
        this.summary = summary;
    }

    public FileMetrics metrics(String file) {
        return files.get(file);
    }

    public Set<ProcedureId> unreachable() {
        return reachability.unreachable;
    }

    public Set<String> unreachableNames() {
        return reachability.unreachableNames();
    }

    public boolean entryMissing() {
        return !reachability.entryFound;
    }

    public boolean hasDiagnostic(DiagnosticKind kind) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.kind == kind) {
                return true;
            }
        }
        return false;
    }
}
