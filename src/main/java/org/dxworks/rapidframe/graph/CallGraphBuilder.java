package org.dxworks.rapidframe.graph;

import org.dxworks.rapidframe.model.CallEdge;
import org.dxworks.rapidframe.model.CallGraph;
import org.dxworks.rapidframe.model.CallKind;
import org.dxworks.rapidframe.model.Diagnostic;
import org.dxworks.rapidframe.model.DiagnosticKind;
import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.Procedure;
import org.dxworks.rapidframe.model.ProcedureId;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges the procedures of all parsed files into one call graph.
 *
 * Static calls resolve by name, ignoring case. A name declared in the caller's
 * own file wins; otherwise the call links to every file declaring it, so the
 * graph does not depend on the order files were supplied in. Procedures of
 * excluded files are dropped before resolution and calls to them stay
 * unresolved. Bare name references become edges only when they name a known
 * procedure and are never listed as unresolved.
 */
public class CallGraphBuilder {

    private final boolean dynamicCallsAllVariants;

    public CallGraphBuilder() {
        this(true);
    }

    /**
     * @param dynamicCallsAllVariants link a CallByVar prefix to every matching
     *                                procedure, or only to the alphabetically first
     */
    public CallGraphBuilder(boolean dynamicCallsAllVariants) {
        this.dynamicCallsAllVariants = dynamicCallsAllVariants;
    }

    public CallGraph build(List<ParsedFile> files, Set<String> excludedFiles, List<Diagnostic> diagnostics) {
        List<Procedure> nodes = new ArrayList<>();
        Set<ProcedureId> seen = new HashSet<>();
        Map<String, List<ProcedureId>> byName = new LinkedHashMap<>();
        Set<String> excludedNames = new HashSet<>();

        for (ParsedFile file : files) {
            boolean excluded = excludedFiles.contains(file.file);
            for (Procedure procedure : file.procedures) {
                if (excluded) {
                    excludedNames.add(procedure.id.key());
                } else if (seen.add(procedure.id)) {
                    nodes.add(procedure);
                    byName.computeIfAbsent(procedure.id.key(), k -> new ArrayList<>()).add(procedure.id);
                }
            }
        }

        reportAmbiguousNames(byName, diagnostics);

        // sorted view for CallByVar prefix lookups
        TreeMap<String, List<ProcedureId>> sortedNames = new TreeMap<>(byName);

        List<CallEdge> resolved = new ArrayList<>();
        List<CallEdge> unresolved = new ArrayList<>();
        for (Procedure caller : nodes) {
            for (CallEdge call : caller.calls) {
                List<ProcedureId> targets = call.kind == CallKind.DYNAMIC
                        ? resolveDynamic(call.calleeName, sortedNames)
                        : resolveStatic(caller, call.calleeName, byName);
                if (targets.isEmpty()) {
                    unresolved.add(call);
                    if (excludedNames.contains(call.calleeName.toLowerCase(Locale.ROOT))) {
                        diagnostics.add(Diagnostic.at(DiagnosticKind.DANGLING_CALL, caller.file, call.line,
                                caller.name + " calls " + call.calleeName + ", which is only declared in excluded modules"));
                    }
                    continue;
                }
                for (ProcedureId target : targets) {
                    resolved.add(call.resolvedTo(target));
                }
            }
            for (CallEdge reference : caller.references) {
                for (ProcedureId target : resolveStatic(caller, reference.calleeName, byName)) {
                    resolved.add(reference.resolvedTo(target));
                }
            }
        }
        return new CallGraph(nodes, resolved, unresolved);
    }

    private static List<ProcedureId> resolveStatic(Procedure caller, String calleeName,
                                                   Map<String, List<ProcedureId>> byName) {
        List<ProcedureId> candidates = byName.get(calleeName.toLowerCase(Locale.ROOT));
        if (candidates == null) {
            return List.of();
        }
        for (ProcedureId candidate : candidates) {
            if (candidate.file.equals(caller.file)) {
                return List.of(candidate);
            }
        }
        return candidates;
    }

    private List<ProcedureId> resolveDynamic(String prefix, TreeMap<String, List<ProcedureId>> sortedNames) {
        String lowerPrefix = prefix.toLowerCase(Locale.ROOT);
        List<ProcedureId> targets = new ArrayList<>();
        for (Map.Entry<String, List<ProcedureId>> entry : sortedNames.tailMap(lowerPrefix, true).entrySet()) {
            if (!entry.getKey().startsWith(lowerPrefix)) {
                break;
            }
            if (dynamicCallsAllVariants) {
                targets.addAll(entry.getValue());
            } else {
                targets.add(entry.getValue().stream().sorted().findFirst().orElseThrow());
                break;
            }
        }
        return targets;
    }

    private static void reportAmbiguousNames(Map<String, List<ProcedureId>> byName, List<Diagnostic> diagnostics) {
        for (List<ProcedureId> ids : byName.values()) {
            if (ids.size() < 2) {
                continue;
            }
            List<String> files = new ArrayList<>();
            for (ProcedureId id : ids) {
                files.add(id.file);
            }
            diagnostics.add(Diagnostic.of(DiagnosticKind.AMBIGUOUS_NAME,
                    "Procedure " + ids.get(0).name + " is declared in " + String.join(", ", files)
                            + "; name lookups pick " + ids.get(0).file));
        }
    }
}
