package org.aipomoea.metrics;

public interface HasStatus {
    Status status();
}
