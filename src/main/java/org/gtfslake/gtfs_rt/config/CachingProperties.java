package org.gtfslake.gtfs_rt.config;

import org.gtfslake.gtfs_rt.services.FeedKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Response cache settings bound from the {@code caching} section of the configuration.
 *
 * <p>Only read when {@code app.caching_enabled} is true. Every feed kind has its own
 * time-to-live; memcached treats a TTL of zero as "never expires", so only
 * positive values are accepted.</p>
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "caching")
public class CachingProperties {

    /** memcached server, {@code host:port}. */
    private String cachingServerEndpoint = "localhost:11211";

    /** Upper bound of a single cache operation; a slower lookup is served uncached. */
    private int cachingOperationTimeoutMillis = 250;

    private int cachingServiceAlertsTtlSeconds = 60;

    private int cachingTripUpdatesTtlSeconds = 30;

    private int cachingVehiclePositionsTtlSeconds = 15;

    public String getCachingServerEndpoint() {
        return cachingServerEndpoint;
    }

    public void setCachingServerEndpoint(String cachingServerEndpoint) {
        this.cachingServerEndpoint = cachingServerEndpoint;
    }

    public int getCachingOperationTimeoutMillis() {
        return cachingOperationTimeoutMillis;
    }

    public void setCachingOperationTimeoutMillis(int cachingOperationTimeoutMillis) {
        this.cachingOperationTimeoutMillis = requirePositive("caching_operation_timeout_millis", cachingOperationTimeoutMillis);
    }

    public int getCachingServiceAlertsTtlSeconds() {
        return cachingServiceAlertsTtlSeconds;
    }

    public void setCachingServiceAlertsTtlSeconds(int cachingServiceAlertsTtlSeconds) {
        this.cachingServiceAlertsTtlSeconds = requirePositive("caching_service_alerts_ttl_seconds", cachingServiceAlertsTtlSeconds);
    }

    public int getCachingTripUpdatesTtlSeconds() {
        return cachingTripUpdatesTtlSeconds;
    }

    public void setCachingTripUpdatesTtlSeconds(int cachingTripUpdatesTtlSeconds) {
        this.cachingTripUpdatesTtlSeconds = requirePositive("caching_trip_updates_ttl_seconds", cachingTripUpdatesTtlSeconds);
    }

    public int getCachingVehiclePositionsTtlSeconds() {
        return cachingVehiclePositionsTtlSeconds;
    }

    public void setCachingVehiclePositionsTtlSeconds(int cachingVehiclePositionsTtlSeconds) {
        this.cachingVehiclePositionsTtlSeconds = requirePositive("caching_vehicle_positions_ttl_seconds", cachingVehiclePositionsTtlSeconds);
    }

    /**
     * Returns the time-to-live configured for a feed kind.
     *
     * @param kind the feed kind
     * @return the TTL in seconds, always positive
     */
    public int ttlSecondsFor(FeedKind kind) {
        switch (kind) {
            case SERVICE_ALERTS:
                return cachingServiceAlertsTtlSeconds;
            case TRIP_UPDATES:
                return cachingTripUpdatesTtlSeconds;
            case VEHICLE_POSITIONS:
                return cachingVehiclePositionsTtlSeconds;
            default:
                throw new IllegalArgumentException("Unknown feed kind: " + kind);
        }
    }

    private static int requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("caching." + key + " must be positive, got: " + value);
        }
        return value;
    }
}
