package org.gtfslake.gtfs_rt.config;

import org.gtfslake.gtfs_rt.services.FeedKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CachingProperties.
 */
class CachingPropertiesTest {

    private CachingProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CachingProperties();
    }

    @Test
    void testDefaults() {
        assertEquals("localhost:11211", properties.getCachingServerEndpoint());
        assertEquals(60, properties.ttlSecondsFor(FeedKind.SERVICE_ALERTS));
        assertEquals(30, properties.ttlSecondsFor(FeedKind.TRIP_UPDATES));
        assertEquals(15, properties.ttlSecondsFor(FeedKind.VEHICLE_POSITIONS));
        assertEquals(250, properties.getCachingOperationTimeoutMillis());
    }

    @Test
    void testTtlPerFeedKind() {
        properties.setCachingServiceAlertsTtlSeconds(300);
        properties.setCachingTripUpdatesTtlSeconds(20);
        properties.setCachingVehiclePositionsTtlSeconds(5);

        assertEquals(300, properties.ttlSecondsFor(FeedKind.SERVICE_ALERTS));
        assertEquals(20, properties.ttlSecondsFor(FeedKind.TRIP_UPDATES));
        assertEquals(5, properties.ttlSecondsFor(FeedKind.VEHICLE_POSITIONS));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    void testNonPositiveTtlIsRejected(int ttl) {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> properties.setCachingTripUpdatesTtlSeconds(ttl));
        assertTrue(exception.getMessage().contains("caching_trip_updates_ttl_seconds"));
    }

    @Test
    void testNonPositiveOperationTimeoutIsRejected() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> properties.setCachingOperationTimeoutMillis(0));
        assertTrue(exception.getMessage().contains("caching_operation_timeout_millis"));
    }
}
