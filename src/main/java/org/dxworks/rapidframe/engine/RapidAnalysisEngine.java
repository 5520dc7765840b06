package org.dxworks.rapidframe.engine;

import org.dxworks.rapidframe.AnalyzerRegistry;
import org.dxworks.rapidframe.analyzer.MetricsCalculator;
import org.dxworks.rapidframe.analyzer.WaitTimeExtractor;
import org.dxworks.rapidframe.graph.CallChainDepthCalculator;
import org.dxworks.rapidframe.graph.CallGraphBuilder;
import org.dxworks.rapidframe.graph.ReachabilityAnalyzer;
import org.dxworks.rapidframe.model.AnalysisResult;
import org.dxworks.rapidframe.model.CallGraph;
import org.dxworks.rapidframe.model.Diagnostic;
import org.dxworks.rapidframe.model.DiagnosticKind;
import org.dxworks.rapidframe.model.FileMetrics;
import org.dxworks.rapidframe.model.NamingScore;
import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.Procedure;
import org.dxworks.rapidframe.model.ProcedureId;
import org.dxworks.rapidframe.model.ReachabilityResult;
import org.dxworks.rapidframe.model.SourceFile;
import org.dxworks.rapidframe.model.WaitTimeOccurrence;
import org.dxworks.rapidframe.naming.NamingScorer;
import org.dxworks.rapidframe.naming.WordOracle;
import org.dxworks.rapidframe.report.FileReport;
import org.dxworks.rapidframe.report.ReportAssembler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs a complete analysis over an in-memory set of RAPID files.
 *
 * Files are parsed and measured independently (in parallel unless disabled).
 * Once all of them are done the call graph is built from the merged procedures,
 * reachability and call-chain depth are computed, and the per-file metrics are
 * completed. A failure inside one file is recorded as a diagnostic and the run
 * continues with the remaining files.
 */
public class RapidAnalysisEngine {

    private final WordOracle oracle;
    private final AnalyzerRegistry registry;
    private final MetricsCalculator metricsCalculator;
    private final WaitTimeExtractor waitTimeExtractor;
    private final ReportAssembler reportAssembler;

    public RapidAnalysisEngine(WordOracle oracle) {
        this(oracle, new AnalyzerRegistry());
    }

    public RapidAnalysisEngine(WordOracle oracle, AnalyzerRegistry registry) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metricsCalculator = new MetricsCalculator();
        this.waitTimeExtractor = new WaitTimeExtractor();
        this.reportAssembler = new ReportAssembler();
    }

    public AnalysisResult analyze(List<SourceFile> files, AnalysisOptions options) {
        return analyze(files, options, CancellationToken.none());
    }

    public AnalysisResult analyze(List<SourceFile> files, AnalysisOptions options, CancellationToken token) {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(token, "token");
        token.throwIfCancelled();

        NamingScorer namingScorer = createNamingScorer(options);
        Stream<SourceFile> stream = options.isParallel() ? files.parallelStream() : files.stream();
        List<FileReport> reports = stream
                .map(file -> {
                    token.throwIfCancelled();
                    return analyzeFile(file, options, namingScorer);
                })
                .collect(Collectors.toList());

        token.throwIfCancelled();

        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<String> excluded = excludedFiles(reports, options);
        List<ParsedFile> parsedFiles = reports.stream().map(r -> r.parsed).collect(Collectors.toList());

        CallGraph graph = new CallGraphBuilder(options.isDynamicCallsAllVariants())
                .build(parsedFiles, excluded, diagnostics);
        ReachabilityResult reachability = new ReachabilityAnalyzer()
                .analyze(graph, options.getEntryProcedure(), diagnostics);
        CallChainDepthCalculator depths = new CallChainDepthCalculator(graph);
        Set<String> usedIdentifiers = usedIdentifiers(parsedFiles);

        List<FileReport> completed = new ArrayList<>();
        boolean oracleReported = false;
        for (FileReport report : reports) {
            completed.add(complete(report, graph, reachability, depths, usedIdentifiers, excluded));
            if (!report.naming.oracleAvailable && !oracleReported) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.ORACLE_UNAVAILABLE,
                        "Word reference unavailable; naming scores use the allow-list and heuristics only"));
                oracleReported = true;
            }
        }
        return reportAssembler.assemble(completed, graph, reachability, diagnostics);
    }

    private FileReport analyzeFile(SourceFile file, AnalysisOptions options, NamingScorer namingScorer) {
        try {
            ParsedFile parsed = registry.analyzerFor(file.kind).analyze(file);
            NamingScore naming = namingScorer.score(namesToScore(parsed, options));
            List<WaitTimeOccurrence> waitTimes = waitTimeExtractor.extract(parsed);
            FileMetrics metrics = metricsCalculator.computeLocal(parsed, naming, waitTimes.size());
            return new FileReport(parsed, naming, metrics, waitTimes);
        } catch (RuntimeException e) {
            Diagnostic failure = new Diagnostic(DiagnosticKind.FILE_FAILED, file.id, null,
                    "Analysis failed: " + e);
            ParsedFile parsed = ParsedFile.failed(file, failure);
            NamingScore naming = NamingScore.neutral(true);
            return new FileReport(parsed, naming, metricsCalculator.computeLocal(parsed, naming, 0), List.of());
        }
    }

    private FileReport complete(FileReport report, CallGraph graph, ReachabilityResult reachability,
                                CallChainDepthCalculator depths, Set<String> usedIdentifiers, Set<String> excluded) {
        ParsedFile parsed = report.parsed;
        boolean stepExcluded = excluded.contains(parsed.file);

        List<ProcedureId> nodes = new ArrayList<>();
        List<String> unreachable = new ArrayList<>();
        for (Procedure procedure : parsed.procedures) {
            if (!graph.contains(procedure.id) || !nodes.add(procedure.id)) {
                continue;
            }
            if (!reachability.isReachable(procedure.id)) {
                unreachable.add(procedure.name);
            }
        }

        List<String> unused = new ArrayList<>();
        for (String variable : parsed.declaredVariables) {
            if (!usedIdentifiers.contains(variable.toLowerCase(Locale.ROOT))) {
                unused.add(variable);
            }
        }

        FileMetrics metrics = metricsCalculator.complete(report.metrics, depths.maxDepthFrom(nodes), unused,
                unreachable, stepExcluded);
        return report.withMetrics(metrics);
    }

    private NamingScorer createNamingScorer(AnalysisOptions options) {
        Set<String> allowed = new HashSet<>(NamingScorer.DEFAULT_ALLOWED_TOKENS);
        allowed.addAll(options.getExtraAllowedTokens());
        return new NamingScorer(oracle, allowed, options.getMinTokenLength());
    }

    private static List<String> namesToScore(ParsedFile parsed, AnalysisOptions options) {
        Set<String> names = new LinkedHashSet<>(parsed.declaredVariables);
        if (options.isScoreSignalNames()) {
            names.addAll(parsed.signalNames);
        }
        return new ArrayList<>(names);
    }

    private static Set<String> excludedFiles(List<FileReport> reports, AnalysisOptions options) {
        Set<String> excluded = new LinkedHashSet<>(options.getExcludedFiles());
        if (options.isExcludeNoStepInModules()) {
            for (FileReport report : reports) {
                if (report.parsed.noStepIn) {
                    excluded.add(report.parsed.file);
                }
            }
        }
        return excluded;
    }

    private static Set<String> usedIdentifiers(List<ParsedFile> parsedFiles) {
        Set<String> used = new HashSet<>();
        for (ParsedFile parsed : parsedFiles) {
            used.addAll(parsed.identifierUses);
        }
        return used;
    }
}
