package com.example.payreport.domain.model;

import java.util.List;

/**
 * Partial-success information returned next to every derived result.
 */
public record ReportDiagnostics(List<SkippedRecord> skippedRecords) {

    private static final ReportDiagnostics CLEAN = new ReportDiagnostics(List.of());

    public ReportDiagnostics {
        skippedRecords = skippedRecords == null ? List.of() : List.copyOf(skippedRecords);
    }

    public static ReportDiagnostics clean() {
        return CLEAN;
    }

    public int skippedCount() {
        return skippedRecords.size();
    }
}
