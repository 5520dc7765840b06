package org.dxworks.rapidframe.model;

import org.dxworks.rapidframe.FileKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural view of one file: per-line classification and nesting, routines,
 * declarations and identifier uses. Line-indexed lists are 0-based
 * (index 0 is line 1).
 */
public final class ParsedFile {
    public final SourceFile source;
    public final String file;
    public final FileKind kind;
    public final String moduleName;
    public final List<String> moduleAttributes;
    public final boolean noStepIn;
    public final List<LineKind> lineKinds;
    public final List<Integer> nestingDepths;
    public final int blockOpeners;
    public final int decisionPoints;
    public final List<Procedure> procedures;
    public final List<String> declaredVariables;
    public final List<String> signalNames;
    public final Set<String> identifierUses;
    public final List<Diagnostic> diagnostics;

    private ParsedFile(Builder b) {
        this.source = b.source;
        this.file = b.source.id;
        this.kind = b.source.kind;
        this.moduleName = b.moduleName;
        this.moduleAttributes = List.copyOf(b.moduleAttributes);
        this.noStepIn = b.noStepIn;
        this.lineKinds = List.copyOf(b.lineKinds);
        this.nestingDepths = List.copyOf(b.nestingDepths);
        this.blockOpeners = b.blockOpeners;
        this.decisionPoints = b.decisionPoints;
        this.procedures = List.copyOf(b.procedures);
        this.declaredVariables = List.copyOf(b.declaredVariables);
        this.signalNames = List.copyOf(b.signalNames);
        this.identifierUses = Collections.unmodifiableSet(new LinkedHashSet<>(b.identifierUses));
        this.diagnostics = List.copyOf(b.diagnostics);
    }

    public static Builder builder(SourceFile source) {
        return new Builder(source);
    }

    /**
     * Placeholder for a file whose analysis failed: every line counts as code,
     * nothing else is known.
     */
    public static ParsedFile failed(SourceFile source, Diagnostic failure) {
        Builder b = new Builder(source);
        for (int i = 0; i < source.lineCount(); i++) {
            b.addLine(source.line(i + 1).isBlank() ? LineKind.BLANK : LineKind.CODE, 0);
        }
        b.addDiagnostic(failure);
        return b.build();
    }

    public int lineCount() {
        return lineKinds.size();
    }

    public static final class Builder {
        private final SourceFile source;
        private String moduleName;
        private final List<String> moduleAttributes = new ArrayList<>();
        private boolean noStepIn;
        private final List<LineKind> lineKinds = new ArrayList<>();
        private final List<Integer> nestingDepths = new ArrayList<>();
        private int blockOpeners;
        private int decisionPoints;
        private final List<Procedure> procedures = new ArrayList<>();
        private final Set<String> declaredVariables = new LinkedHashSet<>();
        private final Set<String> signalNames = new LinkedHashSet<>();
        private final Set<String> identifierUses = new LinkedHashSet<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        private Builder(SourceFile source) {
            this.source = source;
        }

        public Builder moduleName(String moduleName) {
            this.moduleName = moduleName;
            return this;
        }

        public boolean hasModuleName() {
            return moduleName != null;
        }

        public String moduleName() {
            return moduleName;
        }

        public Builder addModuleAttribute(String attribute) {
            moduleAttributes.add(attribute);
            return this;
        }

        public Builder noStepIn(boolean noStepIn) {
            this.noStepIn = noStepIn;
            return this;
        }

        public boolean noStepIn() {
            return noStepIn;
        }

        public Builder addLine(LineKind kind, int nestingDepth) {
            lineKinds.add(kind);
            nestingDepths.add(nestingDepth);
            return this;
        }

        public Builder addBlockOpener() {
            blockOpeners++;
            return this;
        }

        public Builder addDecisionPoint() {
            decisionPoints++;
            return this;
        }

        public Builder addProcedure(Procedure procedure) {
            procedures.add(procedure);
            return this;
        }

        public Builder addDeclaredVariable(String name) {
            declaredVariables.add(name);
            return this;
        }

        public Builder addSignalName(String name) {
            signalNames.add(name);
            return this;
        }

        public Builder addIdentifierUse(String lowercaseName) {
            identifierUses.add(lowercaseName);
            return this;
        }

        public Builder addDiagnostic(Diagnostic diagnostic) {
            diagnostics.add(diagnostic);
            return this;
        }

        public ParsedFile build() {
            return new ParsedFile(this);
        }
    }
}
