package com.example.payreport.domain.model;

/**
 * Diagnostic entry for a video that was excluded from aggregation.
 *
 * @param videoId   identifier of the excluded video (may be {@code null} if the source omitted it)
 * @param creatorId owning creator reference as supplied by the source
 * @param reason    why the video was excluded
 */
public record SkippedRecord(Long videoId, Long creatorId, SkipReason reason) {
}
