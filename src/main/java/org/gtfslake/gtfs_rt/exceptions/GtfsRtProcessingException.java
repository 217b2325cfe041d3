package org.gtfslake.gtfs_rt.exceptions;

/**
 * Base exception for failures while producing a GTFS-RT feed response.
 *
 * <p>A request that raises this exception is answered with a server error
 * and no payload. Subclasses tell apart where the pipeline failed:
 * <ul>
 *   <li>{@link FeedSourceException}: the lake database could not be read</li>
 *   <li>{@link FeedSchemaException}: the assembled feed does not conform to the GTFS-RT schema</li>
 * </ul>
 *
 * @since 1.0
 */
public class GtfsRtProcessingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new GTFS-RT processing exception with the specified detail message.
     *
     * @param message the detail message explaining the error
     */
    public GtfsRtProcessingException(String message) {
        super(message);
    }

    /**
     * Constructs a new GTFS-RT processing exception with the specified detail message and cause.
     *
     * @param message the detail message explaining the error
     * @param cause the underlying cause of the error
     */
    public GtfsRtProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
