package org.dxworks.rapidframe;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.rapidframe.engine.AnalysisOptions;
import org.dxworks.rapidframe.engine.RapidAnalysisEngine;
import org.dxworks.rapidframe.model.AnalysisResult;
import org.dxworks.rapidframe.model.CallEdge;
import org.dxworks.rapidframe.model.Diagnostic;
import org.dxworks.rapidframe.model.FileMetrics;
import org.dxworks.rapidframe.model.ProcedureId;
import org.dxworks.rapidframe.model.ProjectSummary;
import org.dxworks.rapidframe.model.SourceFile;
import org.dxworks.rapidframe.model.WaitTimeOccurrence;
import org.dxworks.rapidframe.naming.CachingWordOracle;
import org.dxworks.rapidframe.naming.WordListOracle;
import org.dxworks.rapidframe.naming.WordOracle;
import org.dxworks.rapidframe.report.CallTreePrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {
    };
    private static final Charset LEGACY_CHARSET = Charset.forName("windows-1252");

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLine commandLine;
        try {
            commandLine = CommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return 2;
        }

        Path input = commandLine.input;
        if (!Files.exists(input)) {
            err.println("Error: Input path does not exist: " + input);
            return 1;
        }

        RapidframeConfig config = RapidframeConfig.load();
        AnalysisOptions.Builder options = config.toOptions().excludeFiles(commandLine.excludedFiles);
        if (commandLine.includeNoStepIn) {
            options.excludeNoStepInModules(false);
        }
        if (commandLine.entryProcedure != null) {
            options.entryProcedure(commandLine.entryProcedure);
        }

        try {
            analyze(input, commandLine.output, config, options.build(), out, err);
            return 0;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void analyze(Path input, Path jsonlOutput, RapidframeConfig config, AnalysisOptions options,
                                PrintStream out, PrintStream err) throws IOException {
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        out.println("Starting RAPID analysis...");
        out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectSourceFiles(input, config.getMaxFileLines());
        out.println("Found " + files.size() + " RAPID files");

        Instant startTime = Instant.now();
        Path root = Files.isDirectory(input) ? input : input.toAbsolutePath().getParent();

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            runInfo.put("entry_procedure", options.getEntryProcedure());
            writeRecord(writer, runInfo);

            List<SourceFile> sources = new ArrayList<>();
            int readErrors = 0;
            for (Path file : files) {
                String id = fileId(root, file);
                try {
                    sources.add(SourceFile.of(id, readSource(file)));
                } catch (IOException e) {
                    Map<String, String> error = new LinkedHashMap<>();
                    error.put("kind", "error");
                    error.put("file", id);
                    error.put("error", e.getMessage());
                    writeRecord(writer, error);
                    readErrors++;
                    err.println("  Error reading " + file.getFileName() + ": " + e.getMessage());
                }
            }

            AnalysisResult result = new RapidAnalysisEngine(createOracle(config, err)).analyze(sources, options);

            for (FileMetrics metrics : result.files.values()) {
                writeRecord(writer, metrics);
            }
            for (WaitTimeOccurrence occurrence : result.waitTimes) {
                Map<String, Object> record = new LinkedHashMap<>();
                record.put("kind", "waittime");
                record.putAll(MAPPER.convertValue(occurrence, RECORD));
                writeRecord(writer, record);
            }
            writeRecord(writer, graphRecord(result));
            for (Diagnostic diagnostic : result.diagnostics) {
                Map<String, Object> record = new LinkedHashMap<>();
                record.put("kind", "diagnostic");
                record.put("type", diagnostic.kind.name());
                record.putAll(withoutKind(MAPPER.convertValue(diagnostic, RECORD)));
                writeRecord(writer, record);
            }
            writeRecord(writer, result.summary);

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", result.files.size());
            doneInfo.put("files_with_errors", readErrors);
            doneInfo.put("diagnostics", result.diagnostics.size());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeRecord(writer, doneInfo);

            printSummary(result, out);
            for (Diagnostic diagnostic : result.diagnostics) {
                err.println("  " + diagnostic);
            }
        }

        out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        out.println("=".repeat(60));
    }

    private static void printSummary(AnalysisResult result, PrintStream out) {
        ProjectSummary summary = result.summary;
        out.println("\n" + "=".repeat(60));
        out.println("Analysis complete!");
        out.println("Files analyzed:        " + summary.filesAnalyzed);
        out.println("Total lines:           " + summary.totalLines);
        out.println("Procedures:            " + summary.procedureCount);
        out.println("Unreachable:           " + summary.unreachableCount);
        out.println("WaitTime occurrences:  " + summary.waitTimeCount);
        out.println("Unique variables:      " + summary.uniqueVariableCount);
        out.println(String.format(Locale.ROOT, "Average complexity:    %.1f", summary.averageComplexity));
        out.println(String.format(Locale.ROOT, "Readability:           %.1f (raw %.1f)",
                summary.averageReadability, summary.rawAverageReadability));
        out.println();
        out.println("Call tree from " + result.reachability.entryProcedure + ":");
        out.print(new CallTreePrinter().print(result.callGraph, result.reachability));
    }

    static Map<String, Object> graphRecord(AnalysisResult result) {
        Map<String, Object> graph = new LinkedHashMap<>();
        graph.put("kind", "graph");
        graph.put("entry", result.reachability.entryProcedure);
        graph.put("entry_found", result.reachability.entryFound);
        graph.put("nodes", result.callGraph.nodeIds().stream()
                .map(ProcedureId::qualifiedName)
                .collect(Collectors.toList()));
        List<Map<String, Object>> edges = new ArrayList<>();
        for (CallEdge edge : result.callGraph.edges()) {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("from", edge.caller.qualifiedName());
            e.put("to", edge.callee.qualifiedName());
            e.put("line", edge.line);
            e.put("type", edge.kind.name());
            edges.add(e);
        }
        graph.put("edges", edges);
        List<Map<String, Object>> unresolved = new ArrayList<>();
        for (CallEdge edge : result.callGraph.unresolvedCalls()) {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("from", edge.caller.qualifiedName());
            e.put("name", edge.calleeName);
            e.put("line", edge.line);
            unresolved.add(e);
        }
        graph.put("unresolved", unresolved);
        graph.put("unreachable", result.reachability.unreachable.stream()
                .map(ProcedureId::qualifiedName)
                .sorted()
                .collect(Collectors.toList()));
        Map<String, Integer> distances = new LinkedHashMap<>();
        result.reachability.entryDistance.forEach((id, distance) -> distances.put(id.qualifiedName(), distance));
        graph.put("entry_distance", distances);
        return graph;
    }

    private static Map<String, Object> withoutKind(Map<String, Object> record) {
        Map<String, Object> copy = new LinkedHashMap<>(record);
        copy.remove("kind");
        return copy;
    }

    private static void writeRecord(BufferedWriter writer, Object record) throws IOException {
        writer.write(MAPPER.writeValueAsString(record));
        writer.newLine();
    }

    private static WordOracle createOracle(RapidframeConfig config, PrintStream err) {
        WordListOracle words = config.getDictionaryPath() != null
                ? WordListOracle.fromFile(Paths.get(config.getDictionaryPath()))
                : WordListOracle.bundled();
        if (!words.isAvailable()) {
            err.println("Warning: word list " + words.getDescription()
                    + " could not be loaded, naming scores use heuristics only");
        }
        return new CachingWordOracle(words);
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> FileKind.detect(p.getFileName().toString()).isPresent())
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)
                && FileKind.detect(input.getFileName().toString()).isPresent()
                && withinMaxLines(input, maxFileLines)) {
            files.add(input);
        }
        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try {
            return SourceFile.of(path.toString(), readSource(path)).lineCount() <= maxFileLines;
        } catch (IOException e) {
            // unreadable files are reported when they are loaded
            return true;
        }
    }

    /**
     * Controller exports are usually UTF-8; older ones are Windows-1252.
     */
    static String readSource(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, LEGACY_CHARSET);
        }
    }

    static String fileId(Path root, Path file) {
        Path relative = root != null ? root.toAbsolutePath().relativize(file.toAbsolutePath()) : file.getFileName();
        return relative.toString().replace('\\', '/');
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: java -jar rapidframe.jar [options] <input-folder> <output-file>");
        err.println("  <input-folder>: Path to a RAPID program folder or a single file");
        err.println("  <output-file>:  Path to output JSONL file");
        err.println("Options:");
        err.println("  --entry <name>        Entry procedure (default: main)");
        err.println("  --exclude <file>      Leave a file out of the call graph (repeatable)");
        err.println("  --include-nostepin    Keep NOSTEPIN modules in the call graph");
        err.println("Supported files: .mod .modx .prg .sys .sysx .cfg");
    }

    static final class CommandLine {
        final Path input;
        final Path output;
        final String entryProcedure;
        final List<String> excludedFiles;
        final boolean includeNoStepIn;

        private CommandLine(Path input, Path output, String entryProcedure, List<String> excludedFiles,
                            boolean includeNoStepIn) {
            this.input = input;
            this.output = output;
            this.entryProcedure = entryProcedure;
            this.excludedFiles = excludedFiles;
            this.includeNoStepIn = includeNoStepIn;
        }

        static CommandLine parse(String[] args) {
            List<String> positional = new ArrayList<>();
            List<String> excluded = new ArrayList<>();
            String entry = null;
            boolean includeNoStepIn = false;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--include-nostepin":
                        includeNoStepIn = true;
                        break;
                    case "--entry":
                        entry = valueOf(args, ++i, arg);
                        break;
                    case "--exclude":
                        excluded.add(valueOf(args, ++i, arg).replace('\\', '/'));
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        positional.add(arg);
                }
            }
            if (positional.size() != 2) {
                throw new IllegalArgumentException("Expected <input-folder> and <output-file>");
            }
            return new CommandLine(Paths.get(positional.get(0)), Paths.get(positional.get(1)), entry,
                    List.copyOf(excluded), includeNoStepIn);
        }

        private static String valueOf(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }
    }
}
