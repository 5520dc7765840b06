package org.dxworks.rapidframe.report;

import org.dxworks.rapidframe.model.AnalysisResult;
import org.dxworks.rapidframe.model.CallGraph;
import org.dxworks.rapidframe.model.Diagnostic;
import org.dxworks.rapidframe.model.FileMetrics;
import org.dxworks.rapidframe.model.ProjectSummary;
import org.dxworks.rapidframe.model.ReachabilityResult;
import org.dxworks.rapidframe.model.WaitTimeOccurrence;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-file reports, the shared call graph and the diagnostics into one
 * {@link AnalysisResult}. Files keep their supply order.
 */
public class ReportAssembler {

    static final int WORST_FILES_FOR_CAP = 3;
    static final double WORST_FILES_MARGIN = 40.0;

    public AnalysisResult assemble(List<FileReport> reports, CallGraph graph, ReachabilityResult reachability,
                                   List<Diagnostic> diagnostics) {
        Map<String, FileMetrics> files = new LinkedHashMap<>();
        List<WaitTimeOccurrence> waitTimes = new ArrayList<>();
        List<Diagnostic> allDiagnostics = new ArrayList<>();
        for (FileReport report : reports) {
            files.put(report.parsed.file, report.metrics);
            waitTimes.addAll(report.waitTimes);
            allDiagnostics.addAll(report.parsed.diagnostics);
        }
        allDiagnostics.addAll(diagnostics);
        return new AnalysisResult(files, graph, reachability, waitTimes, allDiagnostics,
                summarize(reports, reachability, waitTimes.size()));
    }

    ProjectSummary summarize(List<FileReport> reports, ReachabilityResult reachability, int waitTimeCount) {
        int totalLines = 0;
        int procedures = 0;
        double complexitySum = 0.0;
        double readabilitySum = 0.0;
        List<Double> scores = new ArrayList<>();
        Set<String> variables = new HashSet<>();
        for (FileReport report : reports) {
            FileMetrics metrics = report.metrics;
            totalLines += metrics.totalLines;
            procedures += metrics.procedureCount;
            complexitySum += metrics.simpleComplexity;
            readabilitySum += metrics.readabilityScore;
            scores.add(metrics.readabilityScore);
            for (String variable : report.parsed.declaredVariables) {
                variables.add(variable.toLowerCase(Locale.ROOT));
            }
        }
        int count = reports.size();
        double rawAverage = count == 0 ? 0.0 : readabilitySum / count;
        double average = rawAverage;
        if (!scores.isEmpty()) {
            // a few bad modules cap the project score
            scores.sort(Double::compare);
            List<Double> worst = scores.subList(0, Math.min(WORST_FILES_FOR_CAP, scores.size()));
            double worstAverage = worst.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            average = Math.min(rawAverage, worstAverage + WORST_FILES_MARGIN);
        }
        return new ProjectSummary(count, totalLines, procedures, reachability.unreachable.size(), waitTimeCount,
                variables.size(), count == 0 ? 0.0 : complexitySum / count, rawAverage, average);
    }
}
