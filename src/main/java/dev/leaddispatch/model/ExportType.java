package dev.leaddispatch.model;

import java.util.Locale;

public enum ExportType {
    LEADS,
    WORKERS,
    JOBS;

    public String defaultFileName() {
        return name().toLowerCase(Locale.ROOT) + "_export.csv";
    }

    public static ExportType fromText(String text) {
        return valueOf(text.trim().toUpperCase(Locale.ROOT));
    }
}
