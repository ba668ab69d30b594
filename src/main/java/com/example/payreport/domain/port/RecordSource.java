package com.example.payreport.domain.port;

import com.example.payreport.domain.model.Creator;
import com.example.payreport.domain.model.Video;
import com.example.payreport.domain.model.VideoFilter;

import java.util.List;

/**
 * Read-only access to creator and video records. Each call returns a complete snapshot taken at
 * call time; the reporting core never writes through this port and never revalidates a snapshot.
 * Implementations must be safe for concurrent callers.
 */
public interface RecordSource {

	/**
	 * @return every creator in the source's natural order
	 */
    List<Creator> listCreators();

	/**
	 * @param filter optional creator and payment-state restriction, {@link VideoFilter#none()} for all
	 * @return matching videos in the source's natural order
	 */
    List<Video> listVideos(VideoFilter filter);
}
