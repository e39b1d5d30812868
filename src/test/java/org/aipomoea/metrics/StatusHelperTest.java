package org.aipomoea.metrics;

import org.aipomoea.model.Batch;
import org.aipomoea.model.ExecutionRecord;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusHelperTest {

    private static BatchInfo passed(String id, String image) {
        return new BatchInfo(id, "Batch-" + id, Status.PASS, Duration.ofMillis(5), "main", List.of(Path.of(image)),
                List.of(new ExecutionRecord(image, "m1", "1")), null, null);
    }

    private static BatchInfo failed(String id) {
        return StatusHelper.createFailedBatchInfo(new Batch(id, 0, List.of(Path.of("x.jpg"))), "Batch-" + id,
                Duration.ZERO, "FBIN2", new IllegalStateException("exit 1"));
    }

    @Test
    void testDetermineOverallStatus() {
        assertEquals(Status.PASS, StatusHelper.determineOverallStatus(List.of(passed("1", "a")), 1, "Command", "m1"));
        assertEquals(Status.PARTIAL, StatusHelper.determineOverallStatus(List.of(passed("1", "a"), failed("2")), 2, "Command", "m1"));
        assertEquals(Status.FAIL, StatusHelper.determineOverallStatus(List.of(failed("1"), failed("2")), 2, "Command", "m1"));
        assertEquals(Status.PARTIAL, StatusHelper.determineOverallStatus(List.of(passed("1", "a")), 2, "Command", "m1"));
        assertEquals(Status.FAIL, StatusHelper.determineOverallStatus(List.<BatchInfo>of(), 2, "Command", "m1"));
        assertEquals(Status.PASS, StatusHelper.determineOverallStatus(List.<BatchInfo>of(), 0, "Command", "m1"));
    }

    @Test
    void testCommandInfo_recordsOnlyFromPassedBatches() {
        CommandInfo info = new CommandInfo("m1", Status.PARTIAL, Duration.ZERO, "main",
                List.of(passed("1.1", "a"), failed("1.2"), passed("2", "b")));

        assertEquals(List.of("a", "b"), info.records().stream().map(ExecutionRecord::imageName).toList());
        assertEquals(1, info.failedBatchCount());
        assertTrue(info.batchInfo().get(0).isRetry());
        assertFalse(info.batchInfo().get(2).isRetry());
    }

    @Test
    void testExecutionInfo_flattensCommands() {
        CommandInfo ok = new CommandInfo("m1", Status.PASS, Duration.ZERO, "main", List.of(passed("1", "a")));
        CommandInfo missing = StatusHelper.createFailedCommandInfo("m2", "FBIN3", new IllegalStateException("absent"));

        ExecutionInfo info = new ExecutionInfo(Duration.ZERO, List.of(ok, missing));

        assertEquals(1, info.records().size());
        assertEquals(List.of(missing), info.failedCommands());
    }
}
