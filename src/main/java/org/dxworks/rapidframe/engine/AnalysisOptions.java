package org.dxworks.rapidframe.engine;

import org.dxworks.rapidframe.graph.ReachabilityAnalyzer;
import org.dxworks.rapidframe.naming.NamingScorer;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public final class AnalysisOptions {
    private final String entryProcedure;
    private final Set<String> excludedFiles;
    private final boolean excludeNoStepInModules;
    private final boolean dynamicCallsAllVariants;
    private final boolean scoreSignalNames;
    private final int minTokenLength;
    private final List<String> extraAllowedTokens;
    private final boolean parallel;

    private AnalysisOptions(Builder b) {
        this.entryProcedure = b.entryProcedure;
        this.excludedFiles = Set.copyOf(b.excludedFiles);
        this.excludeNoStepInModules = b.excludeNoStepInModules;
        this.dynamicCallsAllVariants = b.dynamicCallsAllVariants;
        this.scoreSignalNames = b.scoreSignalNames;
        this.minTokenLength = b.minTokenLength;
        this.extraAllowedTokens = List.copyOf(b.extraAllowedTokens);
        this.parallel = b.parallel;
    }

    public static AnalysisOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getEntryProcedure() {
        return entryProcedure;
    }

    public Set<String> getExcludedFiles() {
        return excludedFiles;
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

    public List<String> getExtraAllowedTokens() {
        return extraAllowedTokens;
    }

    public boolean isParallel() {
        return parallel;
    }

    public static final class Builder {
        private String entryProcedure = ReachabilityAnalyzer.DEFAULT_ENTRY;
        private final Set<String> excludedFiles = new LinkedHashSet<>();
        private boolean excludeNoStepInModules = true;
        private boolean dynamicCallsAllVariants = true;
        private boolean scoreSignalNames = true;
        private int minTokenLength = NamingScorer.DEFAULT_MIN_TOKEN_LENGTH;
        private final Set<String> extraAllowedTokens = new LinkedHashSet<>();
        private boolean parallel = true;

        private Builder() {
        }

        public Builder entryProcedure(String entryProcedure) {
            this.entryProcedure = Objects.requireNonNull(entryProcedure, "entryProcedure");
            return this;
        }

        public Builder excludeFile(String fileId) {
            excludedFiles.add(fileId);
            return this;
        }

        public Builder excludeFiles(Iterable<String> fileIds) {
            for (String fileId : fileIds) {
                excludedFiles.add(fileId);
            }
            return this;
        }

        public Builder excludeNoStepInModules(boolean excludeNoStepInModules) {
            this.excludeNoStepInModules = excludeNoStepInModules;
            return this;
        }

        public Builder dynamicCallsAllVariants(boolean dynamicCallsAllVariants) {
            this.dynamicCallsAllVariants = dynamicCallsAllVariants;
            return this;
        }

        public Builder scoreSignalNames(boolean scoreSignalNames) {
            this.scoreSignalNames = scoreSignalNames;
            return this;
        }

        public Builder minTokenLength(int minTokenLength) {
            this.minTokenLength = minTokenLength > 0 ? minTokenLength : NamingScorer.DEFAULT_MIN_TOKEN_LENGTH;
            return this;
        }

        public Builder allowToken(String token) {
            extraAllowedTokens.add(token);
            return this;
        }

        public Builder allowTokens(Iterable<String> tokens) {
            for (String token : tokens) {
                extraAllowedTokens.add(token);
            }
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }
}
