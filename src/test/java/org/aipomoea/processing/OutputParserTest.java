package org.aipomoea.processing;

import org.aipomoea.model.ExecutionRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OutputParserTest {

    @Test
    void testParseLine_windowsPathWithMarkers() {
        Optional<ExecutionRecord> record = OutputParser.parseLine(
                "INFO: C:\\uploads\\A_G7_1.jpg - Result: 0.93*", "leaf_area");

        assertTrue(record.isPresent());
        assertEquals(new ExecutionRecord("A_G7_1", "leaf_area", "0.93"), record.get());
    }

    @Test
    void testParseLine_unixPathAndTrailingSpaces() {
        Optional<ExecutionRecord> record = OutputParser.parseLine(
                "Processed: /srv/up/img-2.png Result:   ** healthy **  ", "classifier");

        assertEquals(Optional.of(new ExecutionRecord("img-2", "classifier", "healthy")), record);
    }

    @Test
    void testParseLine_extraFieldAfterPathIsIgnored() {
        Optional<ExecutionRecord> record = OutputParser.parseLine(
                "Image: /tmp/x/img1.jpg: ok Result: 12", "m1");

        assertEquals("img1", record.orElseThrow().imageName());
        assertEquals("12", record.orElseThrow().resultValue());
    }

    @Test
    void testParseLine_skipsIncidentalOutput() {
        assertTrue(OutputParser.parseLine("Loading model weights...", "m1").isEmpty());
        assertTrue(OutputParser.parseLine("Result: 1", "m1").isEmpty(), "separator needs a leading space");
        assertTrue(OutputParser.parseLine("no field Result: 1", "m1").isEmpty(), "left part has no path field");
        assertTrue(OutputParser.parseLine(null, "m1").isEmpty());
    }

    @Test
    void testParseLine_rejectsRepeatedSeparator() {
        assertTrue(OutputParser.parseLine("x: a.jpg Result: 1 Result: 2", "m1").isEmpty());
    }

    @Test
    void testParseLine_rejectsEmptyImageName() {
        assertTrue(OutputParser.parseLine("x:  - Result: 1", "m1").isEmpty());
    }

    @Test
    void testParseLine_isPure() {
        String line = "INFO: /a/b/c.jpg Result: 3";
        assertEquals(OutputParser.parseLine(line, "m"), OutputParser.parseLine(line, "m"));
    }

    @Test
    void testParse_keepsOnlyRecognizedLines() {
        List<ExecutionRecord> records = OutputParser.parse(List.of(
                "warming up",
                "INFO: /u/img1.jpg Result: 0.9",
                "",
                "INFO: /u/img2.jpg Result: 0.3"), "m1");

        assertEquals(List.of(
                new ExecutionRecord("img1", "m1", "0.9"),
                new ExecutionRecord("img2", "m1", "0.3")), records);
    }
}
