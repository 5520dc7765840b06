package org.dxworks.rapidframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A recovered problem reported as data. File and line are null when the
 * condition is not tied to one location.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Diagnostic {
    public final DiagnosticKind kind;
    public final String file;
    public final Integer line;
    public final String message;

    public Diagnostic(DiagnosticKind kind, String file, Integer line, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.file = file;
        this.line = line;
        this.message = Objects.requireNonNull(message, "message");
    }

    public static Diagnostic of(DiagnosticKind kind, String message) {
        return new Diagnostic(kind, null, null, message);
    }

    public static Diagnostic at(DiagnosticKind kind, String file, int line, String message) {
        return new Diagnostic(kind, file, line, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (file != null) {
            sb.append(' ').append(file);
            if (line != null) {
                sb.append(':').append(line);
            }
        }
        return sb.append(" - ").append(message).toString();
    }
}
