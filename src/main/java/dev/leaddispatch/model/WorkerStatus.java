package dev.leaddispatch.model;

public enum WorkerStatus {
    ACTIVE,
    INACTIVE
}
