package org.aipomoea.metrics;

import org.aipomoea.model.Batch;

import java.time.Duration;
import java.util.List;

/**
 * Helper methods for creating status records, especially for failure cases,
 * and determining overall status.
 */
public final class StatusHelper {

    private StatusHelper() {
    } // Prevent instantiation

    // --- Failure Record Creators ---

    public static CommandInfo createFailedCommandInfo(String commandName, String errorLabel, Throwable cause) {
        return new CommandInfo(commandName, Status.FAIL, Duration.ZERO, Thread.currentThread().getName(), List.of(),
                cause, errorLabel);
    }

    public static BatchInfo createFailedBatchInfo(Batch batch, String batchName, Duration duration, String errorLabel,
                                                  Throwable cause) {
        return new BatchInfo(batch.batchId(), batchName, Status.FAIL, duration, Thread.currentThread().getName(),
                batch.images(), List.of(), cause, errorLabel);
    }

    // --- Status Determination ---

    /**
     * Determines the overall status based on a collection of results,
     * considering if any sub-tasks failed or if expected tasks produced no results.
     * PARTIAL is returned when at least one sub-task passed and at least one failed.
     */
    public static <T extends HasStatus> Status determineOverallStatus(
            final List<T> results,
            final int expectedTaskCount,
            final String levelName,
            final Object identifier) {

        final String idStr = identifier != null ? identifier.toString() : "N/A";

        final long failed = results.stream().filter(r -> r.status() == Status.FAIL).count();
        final long passed = results.size() - failed;

        if (failed > 0 && passed == 0) {
            System.err.printf("  %s %s: Marked as FAIL, every sub-task reported FAIL status.%n", levelName, idStr);
            return Status.FAIL;
        }
        if (failed > 0) {
            System.err.printf("  %s %s: Marked as PARTIAL (%d/%d sub-tasks failed).%n", levelName, idStr, failed, results.size());
            return Status.PARTIAL;
        }

        // Note: This assumes that a failure during future execution prevents it from being added to 'results'.
        if (results.size() < expectedTaskCount) {
            System.err.printf("  %s %s: Marked as PARTIAL because some sub-tasks failed to produce results (%d/%d succeeded).%n",
                    levelName, idStr, results.size(), expectedTaskCount);
            return results.isEmpty() ? Status.FAIL : Status.PARTIAL;
        }

        if (expectedTaskCount == 0) {
            System.out.printf("  %s %s: Marked as PASS (no sub-tasks were expected or executed).%n", levelName, idStr);
        } else {
            System.out.printf("  %s %s: Marked as PASS (%d/%d sub-tasks succeeded).%n", levelName, idStr, results.size(), expectedTaskCount);
        }
        return Status.PASS;
    }
}
