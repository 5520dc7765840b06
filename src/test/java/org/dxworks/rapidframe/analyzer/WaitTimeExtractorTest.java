package org.dxworks.rapidframe.analyzer;

import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.WaitTimeOccurrence;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.dxworks.rapidframe.TestUtils.parse;
import static org.dxworks.rapidframe.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WaitTimeExtractorTest {

    private final WaitTimeExtractor extractor = new WaitTimeExtractor();

    @Test
    void findsOccurrencesWithContext() throws IOException {
        List<WaitTimeOccurrence> occurrences = extractor.extract(parse(sample("MainModule.mod")));

        assertEquals(2, occurrences.size());

        WaitTimeOccurrence first = occurrences.get(0);
        assertEquals("MainModule.mod", first.file);
        assertEquals(16, first.line);
        assertEquals("WaitTime 0.5;", first.statement);
        assertEquals(List.of("                partCount := partCount + 1;", "            ELSE"), first.before);
        assertEquals(List.of("            ENDIF", "        ENDWHILE"), first.after);
        assertEquals(0.5, first.durationSeconds, 1e-9);
        assertEquals("main", first.procedure);

        WaitTimeOccurrence second = occurrences.get(1);
        assertEquals(24, second.line);
        assertEquals(1.0, second.durationSeconds, 1e-9);
        assertEquals("PickPart", second.procedure);
    }

    @Test
    void contextIsClippedAtFileBoundaries() {
        ParsedFile parsed = parse("edge.mod",
                "WaitTime 2;",
                "x := 1;");

        WaitTimeOccurrence occurrence = extractor.extract(parsed).get(0);

        assertTrue(occurrence.before.isEmpty());
        assertEquals(List.of("x := 1;"), occurrence.after);
        assertNull(occurrence.procedure);
    }

    @Test
    void skipsSwitchArguments() throws IOException {
        List<WaitTimeOccurrence> occurrences = extractor.extract(parse(sample("Utilities.mod")));

        assertEquals(1, occurrences.size());
        assertEquals(0.2, occurrences.get(0).durationSeconds, 1e-9);
        assertEquals("Station1", occurrences.get(0).procedure);
    }

    @Test
    void variableDurationIsUnknown() {
        ParsedFile parsed = parse("var.mod",
                "PROC p()",
                "    WaitTime tDelay;",
                "ENDPROC");

        assertNull(extractor.extract(parsed).get(0).durationSeconds);
    }

    @Test
    void ignoresCommentsAndStrings() {
        ParsedFile parsed = parse("quiet.mod",
                "PROC p()",
                "    ! WaitTime 5;",
                "    TPWrite \"WaitTime 3\";",
                "    MoveJ p10, v100, fine, tool0; ! WaitTime 1",
                "ENDPROC");

        assertTrue(extractor.extract(parsed).isEmpty());
    }

    @Test
    void configFilesHaveNoOccurrences() throws IOException {
        ParsedFile parsed = new ConfigFileAnalyzer().analyze(sample("robot.cfg"));

        assertTrue(extractor.extract(parsed).isEmpty());
    }
}
