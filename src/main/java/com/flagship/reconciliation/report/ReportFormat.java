package com.flagship.reconciliation.report;

public enum ReportFormat {
    MARKDOWN("md"),
    CSV("csv"),
    JSON("json");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
