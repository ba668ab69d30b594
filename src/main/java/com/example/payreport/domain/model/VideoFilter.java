package com.example.payreport.domain.model;

/**
 * Optional criteria for {@code RecordSource#listVideos}. A {@code null} field means "no restriction".
 */
public record VideoFilter(Long creatorId, PaymentState paymentState) {

    private static final VideoFilter NONE = new VideoFilter(null, null);

    public static VideoFilter none() {
        return NONE;
    }

	/**
	 * Checks whether the given video satisfies every populated criterion.
	 *
	 * @param video candidate video
	 * @return {@code true} when the video passes the filter
	 */
    public boolean matches(Video video) {
        if (creatorId != null && !creatorId.equals(video.creatorId())) {
            return false;
        }
        return paymentState == null || paymentState == video.paymentState();
    }
}
