package org.dxworks.rapidframe.report;

import org.dxworks.rapidframe.model.FileMetrics;
import org.dxworks.rapidframe.model.NamingScore;
import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.WaitTimeOccurrence;

import java.util.List;

/**
 * Output of the per-file phase, before the call graph exists.
 */
public final class FileReport {
    public final ParsedFile parsed;
    public final NamingScore naming;
    public final FileMetrics metrics;
    public final List<WaitTimeOccurrence> waitTimes;

    public FileReport(ParsedFile parsed, NamingScore naming, FileMetrics metrics, List<WaitTimeOccurrence> waitTimes) {
        this.parsed = parsed;
        this.naming = naming;
        this.metrics = metrics;
        this.waitTimes = List.copyOf(waitTimes);
    }

    public FileReport withMetrics(FileMetrics completed) {
        return new FileReport(parsed, naming, completed, waitTimes);
    }
}
