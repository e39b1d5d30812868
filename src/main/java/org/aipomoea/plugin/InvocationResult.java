package org.aipomoea.plugin;

import org.aipomoea.metrics.HasStatus;
import org.aipomoea.metrics.Status;

import java.util.List;

/**
 * Either the output lines of a successful run or the failure that prevented it.
 */
public record InvocationResult(Status status, List<String> lines, ProcessInvocationException failure) implements HasStatus {

    public InvocationResult {
        lines = List.copyOf(lines);
    }

    public static InvocationResult success(List<String> lines) {
        return new InvocationResult(Status.PASS, lines, null);
    }

    public static InvocationResult failure(ProcessInvocationException failure) {
        return new InvocationResult(Status.FAIL, List.of(), failure);
    }

    public boolean isSuccess() {
        return status == Status.PASS;
    }
}
