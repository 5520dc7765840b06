package org.dxworks.rapidframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One timing call with up to two lines of context on each side.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WaitTimeOccurrence {
    public final String file;
    public final int line;
    public final String statement;
    public final List<String> before;
    public final List<String> after;
    public final Double durationSeconds;
    public final String procedure;

    public WaitTimeOccurrence(String file, int line, String statement, List<String> before, List<String> after,
                              Double durationSeconds, String procedure) {
        this.file = file;
        this.line = line;
        this.statement = statement;
        this.before = List.copyOf(before);
        this.after = List.copyOf(after);
        this.durationSeconds = durationSeconds;
        this.procedure = procedure;
    }
}
