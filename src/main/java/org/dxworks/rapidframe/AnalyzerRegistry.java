package org.dxworks.rapidframe;

import org.dxworks.rapidframe.analyzer.ConfigFileAnalyzer;
import org.dxworks.rapidframe.analyzer.FileAnalyzer;
import org.dxworks.rapidframe.analyzer.RapidModuleAnalyzer;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public class AnalyzerRegistry {

    private final Map<FileKind, FileAnalyzer> analyzers;

    public AnalyzerRegistry() {
        Map<FileKind, FileAnalyzer> map = new EnumMap<>(FileKind.class);
        RapidModuleAnalyzer rapid = new RapidModuleAnalyzer();
        for (FileKind kind : FileKind.values()) {
            map.put(kind, createAnalyzer(kind, rapid));
        }
        this.analyzers = Collections.unmodifiableMap(map);
    }

    public FileAnalyzer analyzerFor(FileKind kind) {
        return analyzers.get(kind);
    }

    private static FileAnalyzer createAnalyzer(FileKind kind, RapidModuleAnalyzer rapid) {
        return switch (kind) {
            case MODULE, PROGRAM, SYSTEM -> rapid;
            case CONFIG -> new ConfigFileAnalyzer();
        };
    }
}
