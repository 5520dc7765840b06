package org.dxworks.rapidframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A PROC, FUNC or TRAP routine as found by the structural parser.
 */
public final class Procedure {
    public final ProcedureId id;
    public final String name;
    public final String file;
    public final String moduleName;
    public final RoutineKind kind;
    public final boolean local;
    public final int startLine;
    public final int endLine;
    public final boolean terminated;
    public final int codeLines;
    public final int maxNesting;
    public final boolean noStepIn;
    public final List<String> localVariables;
    public final List<CallEdge> calls;
    public final List<CallEdge> references;
    @JsonIgnore
    public final List<Integer> nestingSamples;

    private Procedure(Builder b) {
        this.id = new ProcedureId(b.file, b.name);
        this.name = b.name;
        this.file = b.file;
        this.moduleName = b.moduleName;
        this.kind = b.kind;
        this.local = b.local;
        this.startLine = b.startLine;
        this.endLine = b.endLine;
        this.terminated = b.terminated;
        this.codeLines = b.codeLines;
        this.noStepIn = b.noStepIn;
        this.localVariables = Collections.unmodifiableList(new ArrayList<>(b.localVariables));
        this.nestingSamples = Collections.unmodifiableList(new ArrayList<>(b.nestingSamples));
        int max = 0;
        for (int sample : b.nestingSamples) {
            max = Math.max(max, sample);
        }
        this.maxNesting = max;
        List<CallEdge> edges = new ArrayList<>();
        for (Builder.PendingCall call : b.calls) {
            edges.add(CallEdge.unresolved(id, call.name, call.line, call.kind));
        }
        this.calls = Collections.unmodifiableList(edges);
        List<CallEdge> mentions = new ArrayList<>();
        for (Builder.PendingCall reference : b.references) {
            mentions.add(CallEdge.unresolved(id, reference.name, reference.line, CallKind.REFERENCE));
        }
        this.references = Collections.unmodifiableList(mentions);
    }

    /**
     * Line span used to rank procedure size.
     */
    public int size() {
        return endLine - startLine;
    }

    public static Builder builder(String file, String name) {
        return new Builder(file, name);
    }

    @Override
    public String toString() {
        return id.toString();
    }

    public static final class Builder {
        private final String file;
        private final String name;
        private String moduleName;
        private RoutineKind kind = RoutineKind.PROC;
        private boolean local;
        private int startLine;
        private int endLine;
        private boolean terminated;
        private int codeLines;
        private boolean noStepIn;
        private final List<String> localVariables = new ArrayList<>();
        private final List<Integer> nestingSamples = new ArrayList<>();
        private final List<PendingCall> calls = new ArrayList<>();
        private final List<PendingCall> references = new ArrayList<>();

        private Builder(String file, String name) {
            this.file = file;
            this.name = name;
        }

        public String name() {
            return name;
        }

        public Builder moduleName(String moduleName) {
            this.moduleName = moduleName;
            return this;
        }

        public Builder kind(RoutineKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder local(boolean local) {
            this.local = local;
            return this;
        }

        public Builder startLine(int startLine) {
            this.startLine = startLine;
            return this;
        }

        public Builder endLine(int endLine) {
            this.endLine = endLine;
            return this;
        }

        public Builder terminated(boolean terminated) {
            this.terminated = terminated;
            return this;
        }

        public Builder noStepIn(boolean noStepIn) {
            this.noStepIn = noStepIn;
            return this;
        }

        public Builder addCodeLine() {
            this.codeLines++;
            return this;
        }

        public Builder addLocalVariable(String variable) {
            if (!localVariables.contains(variable)) {
                localVariables.add(variable);
            }
            return this;
        }

        public Builder addNestingSample(int depth) {
            nestingSamples.add(depth);
            return this;
        }

        public Builder addCall(String calleeName, int line, CallKind kind) {
            calls.add(new PendingCall(calleeName, line, kind));
            return this;
        }

        public Builder addReference(String name, int line) {
            references.add(new PendingCall(name, line, CallKind.REFERENCE));
            return this;
        }

        public Procedure build() {
            return new Procedure(this);
        }

        private static final class PendingCall {
            final String name;
            final int line;
            final CallKind kind;

            PendingCall(String name, int line, CallKind kind) {
                this.name = name;
                this.line = line;
                this.kind = kind;
            }
        }
    }
}
