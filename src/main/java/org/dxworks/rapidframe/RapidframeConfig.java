package org.dxworks.rapidframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.rapidframe.engine.AnalysisOptions;
import org.dxworks.rapidframe.graph.ReachabilityAnalyzer;
import org.dxworks.rapidframe.naming.NamingScorer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class RapidframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "rapidframe-config.yml";
    private static final boolean DEFAULT_EXCLUDE_NOSTEPIN = true;
    private static final boolean DEFAULT_DYNAMIC_CALLS_ALL_VARIANTS = true;
    private static final boolean DEFAULT_SCORE_SIGNAL_NAMES = true;

    private final int maxFileLines;
    private final String entryProcedure;
    private final boolean excludeNoStepInModules;
    private final boolean dynamicCallsAllVariants;
    private final boolean scoreSignalNames;
    private final int minTokenLength;
    private final String dictionaryPath;
    private final List<String> extraAllowedTokens;

    private RapidframeConfig(int maxFileLines, String entryProcedure, boolean excludeNoStepInModules,
                             boolean dynamicCallsAllVariants, boolean scoreSignalNames, int minTokenLength,
                             String dictionaryPath, List<String> extraAllowedTokens) {
        this.maxFileLines = maxFileLines;
        this.entryProcedure = entryProcedure;
        this.excludeNoStepInModules = excludeNoStepInModules;
        this.dynamicCallsAllVariants = dynamicCallsAllVariants;
        this.scoreSignalNames = scoreSignalNames;
        this.minTokenLength = minTokenLength;
        this.dictionaryPath = dictionaryPath;
        this.extraAllowedTokens = List.copyOf(extraAllowedTokens);
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public String getEntryProcedure() {
        return entryProcedure;
    }

    public boolean isExcludeNoStepInModules() {
        return excludeNoStepInModules;
    }

    public boolean isDynamicCallsAllVariants() {
        return dynamicCallsAllVariants;
    }

    public boolean isScoreSignalNames() {
        return scoreSignalNames;
    }

    public int getMinTokenLength() {
        return minTokenLength;
    }

    /** Word list to score names against, or null for the bundled one. */
    public String getDictionaryPath() {
        return dictionaryPath;
    }

    public List<String> getExtraAllowedTokens() {
        return extraAllowedTokens;
    }

    public AnalysisOptions.Builder toOptions() {
        return AnalysisOptions.builder()
                .entryProcedure(entryProcedure)
                .excludeNoStepInModules(excludeNoStepInModules)
                .dynamicCallsAllVariants(dynamicCallsAllVariants)
                .scoreSignalNames(scoreSignalNames)
                .minTokenLength(minTokenLength)
                .allowTokens(extraAllowedTokens);
    }

    public static RapidframeConfig defaults() {
        return new RapidframeConfig(DEFAULT_MAX_FILE_LINES, ReachabilityAnalyzer.DEFAULT_ENTRY,
                DEFAULT_EXCLUDE_NOSTEPIN, DEFAULT_DYNAMIC_CALLS_ALL_VARIANTS, DEFAULT_SCORE_SIGNAL_NAMES,
                NamingScorer.DEFAULT_MIN_TOKEN_LENGTH, null, List.of());
    }

    public static RapidframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static RapidframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException e) {
            System.err.println("Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    private static RapidframeConfig fromYaml(YamlConfig yaml) {
        int effectiveMaxFileLines = (yaml.maxFileLines != null && yaml.maxFileLines > 0)
                ? yaml.maxFileLines
                : DEFAULT_MAX_FILE_LINES;
        String effectiveEntry = (yaml.entryProcedure != null && !yaml.entryProcedure.isBlank())
                ? yaml.entryProcedure.trim()
                : ReachabilityAnalyzer.DEFAULT_ENTRY;
        int effectiveMinTokenLength = (yaml.minTokenLength != null && yaml.minTokenLength > 0)
                ? yaml.minTokenLength
                : NamingScorer.DEFAULT_MIN_TOKEN_LENGTH;
        String effectiveDictionary = (yaml.dictionaryPath != null && !yaml.dictionaryPath.isBlank())
                ? yaml.dictionaryPath
                : null;

        return new RapidframeConfig(
                effectiveMaxFileLines,
                effectiveEntry,
                yaml.excludeNoStepInModules != null ? yaml.excludeNoStepInModules : DEFAULT_EXCLUDE_NOSTEPIN,
                yaml.dynamicCallsAllVariants != null
                        ? yaml.dynamicCallsAllVariants
                        : DEFAULT_DYNAMIC_CALLS_ALL_VARIANTS,
                yaml.scoreSignalNames != null ? yaml.scoreSignalNames : DEFAULT_SCORE_SIGNAL_NAMES,
                effectiveMinTokenLength,
                effectiveDictionary,
                yaml.extraAllowedTokens != null ? yaml.extraAllowedTokens : List.of());
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String entryProcedure;
        public Boolean excludeNoStepInModules;
        public Boolean dynamicCallsAllVariants;
        public Boolean scoreSignalNames;
        public Integer minTokenLength;
        public String dictionaryPath;
        public List<String> extraAllowedTokens;
    }
}
