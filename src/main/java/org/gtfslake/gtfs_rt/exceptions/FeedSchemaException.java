package org.gtfslake.gtfs_rt.exceptions;

/**
 * Thrown when row data cannot be expressed as a valid GTFS-RT message.
 *
 * <p>Typical causes are a required field left unset (an entity without id,
 * a vehicle position without coordinates, a trip update without trip) or an
 * enumerated column holding a value the protocol does not define.</p>
 *
 * @since 1.0
 */
public class FeedSchemaException extends GtfsRtProcessingException {

    private static final long serialVersionUID = 1L;

    public FeedSchemaException(String message) {
        super(message);
    }

    public FeedSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
