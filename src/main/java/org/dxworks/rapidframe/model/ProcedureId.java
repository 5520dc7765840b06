package org.dxworks.rapidframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Graph key of a procedure: declaring file plus routine name. RAPID identifiers
 * are case-insensitive, so equality ignores the name's case.
 */
public final class ProcedureId implements Comparable<ProcedureId> {
    public final String file;
    public final String name;

    public ProcedureId(String file, String name) {
        this.file = Objects.requireNonNull(file, "file");
        this.name = Objects.requireNonNull(name, "name");
    }

    public String key() {
        return name.toLowerCase(Locale.ROOT);
    }

    @JsonValue
    public String qualifiedName() {
        return file + "::" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProcedureId)) return false;
        ProcedureId other = (ProcedureId) o;
        return file.equals(other.file) && key().equals(other.key());
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, key());
    }

    @Override
    public int compareTo(ProcedureId other) {
        int byFile = file.compareTo(other.file);
        return byFile != 0 ? byFile : key().compareTo(other.key());
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
