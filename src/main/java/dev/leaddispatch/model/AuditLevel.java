package dev.leaddispatch.model;

public enum AuditLevel {
    INFO,
    WARN,
    ERROR
}
