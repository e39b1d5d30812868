package org.aipomoea.metrics;

import org.aipomoea.model.ExecutionRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record CommandInfo(String commandName, Status status, Duration duration, String threadName,
                          List<BatchInfo> batchInfo, Throwable failureCause, String errorLabel) implements HasStatus {

    public CommandInfo(String commandName, Status status, Duration duration, String threadName, List<BatchInfo> batchInfo) {
        this(commandName, status, duration, threadName, batchInfo, null, null);
    }

    /**
     * Records of every batch that passed, in the order the batches completed.
     */
    public List<ExecutionRecord> records() {
        final List<ExecutionRecord> records = new ArrayList<>();
        for (BatchInfo batch : batchInfo) {
            if (batch.status() == Status.PASS)
                records.addAll(batch.records());
        }
        return records;
    }

    public long failedBatchCount() {
        return batchInfo.stream().filter(b -> b.status() == Status.FAIL).count();
    }
}
