package org.dxworks.rapidframe.analyzer;

import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.SourceFile;

public interface FileAnalyzer {
    ParsedFile analyze(SourceFile source);
}
