package org.dxworks.rapidframe.analyzer;

import org.dxworks.rapidframe.model.LineKind;
import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.SourceFile;

/**
 * Controller parameter files (.cfg). They hold no routines, so only line
 * classification is done: "#" starts a comment.
 */
public class ConfigFileAnalyzer implements FileAnalyzer {

    @Override
    public ParsedFile analyze(SourceFile source) {
        ParsedFile.Builder out = ParsedFile.builder(source);
        for (String line : source.lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                out.addLine(LineKind.BLANK, 0);
            } else if (trimmed.startsWith("#")) {
                out.addLine(LineKind.COMMENT, 0);
            } else {
                out.addLine(LineKind.CODE, 0);
            }
        }
        return out.build();
    }
}
