package org.gtfslake.gtfs_rt.services;

import java.util.List;
import java.util.Optional;

import org.gtfslake.gtfs_rt.cache.ResponseCache;
import org.gtfslake.gtfs_rt.config.AppProperties;
import org.gtfslake.gtfs_rt.config.CachingProperties;
import org.gtfslake.gtfs_rt.encoding.FeedEncoder;
import org.gtfslake.gtfs_rt.encoding.FeedFormat;
import org.gtfslake.gtfs_rt.fetchers.RealtimeDataFetcher;
import org.gtfslake.gtfs_rt.generator.AlertGenerator;
import org.gtfslake.gtfs_rt.generator.FeedMessageFactory;
import org.gtfslake.gtfs_rt.generator.TripUpdateGenerator;
import org.gtfslake.gtfs_rt.generator.VehiclePositionGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.google.transit.realtime.GtfsRealtime;

/**
 * Service producing the serialized payload of a feed request.
 * <p>
 * For every request the service:
 * <ol>
 *   <li>Looks the payload up in the response cache, when caching is enabled</li>
 *   <li>On a miss, reads the feed's rows from the lake</li>
 *   <li>Generates the feed entities and wraps them into a feed message</li>
 *   <li>Encodes the message in the requested format</li>
 *   <li>Stores the payload in the cache with the feed kind's time-to-live</li>
 * </ol>
 * A cache hit is returned unchanged, so a response may lag the lake by up to
 * the configured TTL. A failing cache never fails a request: the request is
 * served as if caching were disabled.
 * </p>
 *
 * @since 1.0
 */
@Service
public class FeedService {
    private static final Logger logger = LoggerFactory.getLogger(FeedService.class);

    private final RealtimeDataFetcher fetcher;
    private final AlertGenerator alertGenerator;
    private final TripUpdateGenerator tripUpdateGenerator;
    private final VehiclePositionGenerator vehiclePositionGenerator;
    private final FeedMessageFactory feedMessageFactory;
    private final FeedEncoder feedEncoder;
    private final ResponseCache cache;
    private final AppProperties appProperties;
    private final CachingProperties cachingProperties;

    public FeedService(RealtimeDataFetcher fetcher,
                       AlertGenerator alertGenerator,
                       TripUpdateGenerator tripUpdateGenerator,
                       VehiclePositionGenerator vehiclePositionGenerator,
                       FeedMessageFactory feedMessageFactory,
                       FeedEncoder feedEncoder,
                       Optional<ResponseCache> cache,
                       AppProperties appProperties,
                       CachingProperties cachingProperties) {
        this.fetcher = fetcher;
        this.alertGenerator = alertGenerator;
        this.tripUpdateGenerator = tripUpdateGenerator;
        this.vehiclePositionGenerator = vehiclePositionGenerator;
        this.feedMessageFactory = feedMessageFactory;
        this.feedEncoder = feedEncoder;
        this.cache = cache.orElse(null);
        this.appProperties = appProperties;
        this.cachingProperties = cachingProperties;
    }

    /**
     * Returns the serialized feed for a feed kind and format.
     *
     * @param kind the requested feed
     * @param format the requested wire format
     * @return the payload bytes
     * @throws org.gtfslake.gtfs_rt.exceptions.GtfsRtProcessingException if the lake cannot be read
     *         or the data violates the GTFS-RT schema
     */
    public byte[] getFeed(FeedKind kind, FeedFormat format) {
        String cacheKey = cacheKey(kind, format);

        Optional<byte[]> cached = lookup(cacheKey);
        if (cached.isPresent()) {
            logger.debug("[{}] Serving {} from cache", kind, cacheKey);
            return cached.get();
        }

        byte[] payload = feedEncoder.encode(assemble(kind), format);
        store(cacheKey, payload, cachingProperties.ttlSecondsFor(kind));
        return payload;
    }

    /**
     * Reads the rows of a feed kind and builds its feed message.
     *
     * @param kind the feed kind
     * @return the validated feed message
     */
    public GtfsRealtime.FeedMessage assemble(FeedKind kind) {
        List<GtfsRealtime.FeedEntity> entities;
        switch (kind) {
            case SERVICE_ALERTS:
                entities = alertGenerator.generateAlerts(fetcher.fetchServiceAlerts());
                break;
            case TRIP_UPDATES:
                entities = tripUpdateGenerator.generateTripUpdates(fetcher.fetchTripUpdates());
                break;
            case VEHICLE_POSITIONS:
                entities = vehiclePositionGenerator.generateVehiclePositions(fetcher.fetchVehiclePositions());
                break;
            default:
                throw new IllegalArgumentException("Unknown feed kind: " + kind);
        }
        logger.debug("[{}] Generated {} entities", kind, entities.size());
        return feedMessageFactory.create(entities);
    }

    /**
     * Builds the cache key of a feed: its configured endpoint path and the format key,
     * e.g. {@code /gtfs/realtime/trip-updates.pbf-json}.
     */
    String cacheKey(FeedKind kind, FeedFormat format) {
        return endpointOf(kind) + "-" + format.getKey();
    }

    private String endpointOf(FeedKind kind) {
        AppProperties.Routing routing = appProperties.getRouting();
        switch (kind) {
            case SERVICE_ALERTS:
                return routing.getServiceAlertsEndpoint();
            case TRIP_UPDATES:
                return routing.getTripUpdatesEndpoint();
            case VEHICLE_POSITIONS:
                return routing.getVehiclePositionsEndpoint();
            default:
                throw new IllegalArgumentException("Unknown feed kind: " + kind);
        }
    }

    private Optional<byte[]> lookup(String cacheKey) {
        if (cache == null) {
            return Optional.empty();
        }
        try {
            return cache.get(cacheKey);
        } catch (RuntimeException e) {
            logger.warn("Response cache lookup for {} failed, serving uncached: {}", cacheKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String cacheKey, byte[] payload, int ttlSeconds) {
        if (cache == null) {
            return;
        }
        try {
            cache.set(cacheKey, payload, ttlSeconds);
        } catch (RuntimeException e) {
            logger.warn("Response cache store for {} failed: {}", cacheKey, e.getMessage());
        }
    }
}
