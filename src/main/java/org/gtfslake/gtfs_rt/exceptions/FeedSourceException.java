package org.gtfslake.gtfs_rt.exceptions;

/**
 * Thrown when the realtime tables of the lake database cannot be read.
 *
 * <p>There is no retry at this layer; the request fails with a server error.</p>
 *
 * @since 1.0
 */
public class FeedSourceException extends GtfsRtProcessingException {

    private static final long serialVersionUID = 1L;

    public FeedSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
