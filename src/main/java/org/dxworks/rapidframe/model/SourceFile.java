package org.dxworks.rapidframe.model;

import org.dxworks.rapidframe.FileKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One loaded file of the analyzed set: its identity, kind and raw lines.
 */
public final class SourceFile {
    public final String id;
    public final FileKind kind;
    public final List<String> lines;

    public SourceFile(String id, FileKind kind, List<String> lines) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.lines = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(lines, "lines")));
    }

    public static SourceFile of(String id, String text) {
        return new SourceFile(id, FileKind.fromIdentity(id), splitLines(text));
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * 1-based access.
     */
    public String line(int lineNumber) {
        return lines.get(lineNumber - 1);
    }

    static List<String> splitLines(String text) {
        List<String> result = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return result;
        }
        // Remove BOM if present (common in files exported from RobotStudio)
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                result.add(text.substring(start, i));
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                start = i + 1;
            }
        }
        if (start < text.length()) {
            result.add(text.substring(start));
        }
        return result;
    }

    @Override
    public String toString() {
        return id;
    }
}
