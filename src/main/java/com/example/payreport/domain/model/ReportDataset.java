package com.example.payreport.domain.model;

import java.util.List;

/**
 * Snapshot of raw records plus the aggregation derived from them, the input of the table builder.
 */
public record ReportDataset(
        List<Creator> creators,
        List<Video> videos,
        AggregationResult aggregation
) {

    public ReportDataset {
        creators = List.copyOf(creators);
        videos = List.copyOf(videos);
    }
}
