package org.dxworks.rapidframe.analyzer;

import org.dxworks.rapidframe.model.LineKind;
import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.Procedure;
import org.dxworks.rapidframe.model.WaitTimeOccurrence;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Finds WaitTime calls in code lines and captures two lines of context on each
 * side, clipped at the file boundaries.
 */
public class WaitTimeExtractor {

    static final int CONTEXT_LINES = 2;

    public List<WaitTimeOccurrence> extract(ParsedFile parsed) {
        List<WaitTimeOccurrence> occurrences = new ArrayList<>();
        if (!parsed.kind.isRapidCode()) {
            return occurrences;
        }
        List<String> lines = parsed.source.lines;
        for (int i = 0; i < lines.size(); i++) {
            if (parsed.lineKinds.get(i) != LineKind.CODE) {
                continue;
            }
            String code = RapidSyntax.stripStrings(RapidSyntax.stripInlineComment(lines.get(i)));
            if (!RapidSyntax.WAIT_TIME.matcher(code).find()) {
                continue;
            }
            int from = Math.max(0, i - CONTEXT_LINES);
            int to = Math.min(lines.size() - 1, i + CONTEXT_LINES);
            int lineNo = i + 1;
            occurrences.add(new WaitTimeOccurrence(
                    parsed.file,
                    lineNo,
                    lines.get(i).trim(),
                    lines.subList(from, i),
                    lines.subList(i + 1, to + 1),
                    parseSeconds(code),
                    enclosingProcedure(parsed, lineNo)));
        }
        return occurrences;
    }

    private static Double parseSeconds(String code) {
        Matcher matcher = RapidSyntax.WAIT_TIME_SECONDS.matcher(code);
        return matcher.find() ? Double.valueOf(matcher.group(1)) : null;
    }

    private static String enclosingProcedure(ParsedFile parsed, int lineNo) {
        for (Procedure procedure : parsed.procedures) {
            if (lineNo >= procedure.startLine && lineNo <= procedure.endLine) {
                return procedure.name;
            }
        }
        return null;
    }
}
