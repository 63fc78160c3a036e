package dev.leaddispatch.model;

public enum MessageStatus {
    SENT,
    PENDING,
    FAILED
}
