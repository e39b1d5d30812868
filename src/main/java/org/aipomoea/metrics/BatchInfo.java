package org.aipomoea.metrics;

import org.aipomoea.model.ExecutionRecord;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Outcome of one binary invocation over a batch (or a halved sub-batch) of images.
 * A failed batch carries its cause and the error label reported to the user; its records list is empty.
 */
public record BatchInfo(String batchId, String batchName, Status status, Duration duration, String threadName,
                        List<Path> images, List<ExecutionRecord> records, Throwable failureCause,
                        String errorLabel) implements HasStatus {

    public BatchInfo {
        images = List.copyOf(images);
        records = List.copyOf(records);
    }

    public boolean isRetry() {
        return batchId.contains(".");
    }
}
