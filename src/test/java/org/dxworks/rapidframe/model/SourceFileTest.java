package org.dxworks.rapidframe.model;

import org.dxworks.rapidframe.FileKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SourceFileTest {

    @Test
    void splitsAnyLineEnding() {
        SourceFile file = SourceFile.of("mixed.mod", "a\r\nb\nc\rd");

        assertEquals(List.of("a", "b", "c", "d"), file.lines);
        assertEquals("c", file.line(3));
    }

    @Test
    void trailingNewlineAddsNoLine() {
        assertEquals(2, SourceFile.of("t.mod", "a\nb\n").lineCount());
        assertEquals(List.of("a", ""), SourceFile.of("t.mod", "a\n\n").lines);
    }

    @Test
    void stripsByteOrderMark() {
        SourceFile file = SourceFile.of("bom.sys", "\uFEFFMODULE Bom");

        assertEquals("MODULE Bom", file.line(1));
        assertEquals(FileKind.SYSTEM, file.kind);
    }

    @Test
    void emptyTextHasNoLines() {
        assertTrue(SourceFile.of("empty.mod", "").lines.isEmpty());
    }
}
