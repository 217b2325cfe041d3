package org.gtfslake.gtfs_rt.generator;

import java.time.Clock;
import java.util.List;

import org.gtfslake.gtfs_rt.exceptions.FeedSchemaException;
import org.springframework.stereotype.Component;

import com.google.protobuf.UninitializedMessageException;
import com.google.transit.realtime.GtfsRealtime;

/**
 * Wraps generated entities into a complete GTFS-RT feed message.
 *
 * <p>The header is fixed: version {@value #GTFS_REALTIME_VERSION}, incrementality
 * {@code FULL_DATASET}, and the assembly time in POSIX seconds read from the
 * injected clock. Timestamps carried by the data never influence the header.</p>
 *
 * @since 1.0
 */
@Component
public class FeedMessageFactory {

    /** GTFS Realtime version written to every header. */
    public static final String GTFS_REALTIME_VERSION = "2.0";

    private final Clock clock;

    public FeedMessageFactory(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates the feed message for a list of entities.
     *
     * @param entities the entities, kept in the given order
     * @return the built and validated feed message
     * @throws FeedSchemaException if the message misses a field the schema requires
     */
    public GtfsRealtime.FeedMessage create(List<GtfsRealtime.FeedEntity> entities) {
        GtfsRealtime.FeedMessage.Builder feedMessage = GtfsRealtime.FeedMessage.newBuilder();
        feedMessage.setHeader(GtfsRealtime.FeedHeader.newBuilder()
            .setGtfsRealtimeVersion(GTFS_REALTIME_VERSION)
            .setIncrementality(GtfsRealtime.FeedHeader.Incrementality.FULL_DATASET)
            .setTimestamp(clock.instant().getEpochSecond()));
        feedMessage.addAllEntity(entities);

        try {
            return feedMessage.build();
        } catch (UninitializedMessageException e) {
            throw new FeedSchemaException("Feed message is missing required fields " + e.getMissingFields(), e);
        }
    }
}
