package org.aipomoea.metrics;

import org.aipomoea.model.ExecutionRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record ExecutionInfo(Duration totalDuration, List<CommandInfo> commandInfo) {

    /**
     * Flattens the successful records of all commands into one stream. Failed commands contribute nothing.
     */
    public List<ExecutionRecord> records() {
        final List<ExecutionRecord> records = new ArrayList<>();
        for (CommandInfo info : commandInfo)
            records.addAll(info.records());
        return records;
    }

    public List<CommandInfo> failedCommands() {
        return commandInfo.stream().filter(c -> c.status() == Status.FAIL).toList();
    }
}
