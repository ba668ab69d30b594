package com.example.payreport.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Reporting settings bound from the {@code payreport.*} properties.
 *
 * @param aggregation aggregation switches
 * @param workbook    workbook rendering limits
 * @param dashboard   dashboard window sizes
 * @param records     record source location
 */
@ConfigurationProperties(prefix = "payreport")
public record ReportProperties(
        @DefaultValue Aggregation aggregation,
        @DefaultValue Workbook workbook,
        @DefaultValue Dashboard dashboard,
        @DefaultValue Records records
) {

    /**
     * @param includeZeroVideoCreators emit zero-total summaries for creators without videos
     */
    public record Aggregation(@DefaultValue("false") boolean includeZeroVideoCreators) {
    }

    /**
     * @param maxColumnWidth upper bound for auto-sized columns, in characters
     */
    public record Workbook(@DefaultValue("60") int maxColumnWidth) {
    }

    /**
     * @param trendMonths  number of most recent months shown on the dashboard
     * @param recentVideos number of most recently recorded videos shown on the dashboard
     */
    public record Dashboard(@DefaultValue("6") int trendMonths, @DefaultValue("5") int recentVideos) {
    }

    /**
     * @param location Spring resource location of the JSON record snapshot
     */
    public record Records(@DefaultValue("classpath:records/sample-records.json") String location) {
    }
}
