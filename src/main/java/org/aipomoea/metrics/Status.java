package org.aipomoea.metrics;

/**
 * Represents the status of a processing step.
 */
public enum Status {
    PASS, // Completed successfully
    FAIL,  // Failed entirely
    PARTIAL // Some sub-tasks failed, the rest produced results
}
