package org.gtfslake.gtfs_rt.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.transit.realtime.GtfsRealtime;
import org.gtfslake.gtfs_rt.config.AppProperties;
import org.gtfslake.gtfs_rt.config.CachingProperties;
import org.gtfslake.gtfs_rt.encoding.FeedEncoder;
import org.gtfslake.gtfs_rt.fetchers.StubRealtimeDataFetcher;
import org.gtfslake.gtfs_rt.generator.AlertGenerator;
import org.gtfslake.gtfs_rt.generator.FeedMessageFactory;
import org.gtfslake.gtfs_rt.generator.TripUpdateGenerator;
import org.gtfslake.gtfs_rt.generator.VehiclePositionGenerator;
import org.gtfslake.gtfs_rt.records.ServiceAlertRow;
import org.gtfslake.gtfs_rt.records.ServiceAlertRows;
import org.gtfslake.gtfs_rt.records.TripReference;
import org.gtfslake.gtfs_rt.records.VehiclePositionRow;
import org.gtfslake.gtfs_rt.records.VehicleReference;
import org.gtfslake.gtfs_rt.services.FeedService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GTFSRTController class.
 *
 * Tests the REST API endpoints for serving GTFS-RT feeds.
 */
class GTFSRTControllerTest {

    private StubRealtimeDataFetcher fetcher;
    private GTFSRTController controller;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        fetcher = new StubRealtimeDataFetcher();
        AppProperties appProperties = new AppProperties();
        FeedService feedService = new FeedService(fetcher,
            new AlertGenerator(appProperties),
            new TripUpdateGenerator(),
            new VehiclePositionGenerator(),
            new FeedMessageFactory(Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC)),
            new FeedEncoder(),
            Optional.empty(),
            appProperties,
            new CachingProperties());
        controller = new GTFSRTController(feedService);
        objectMapper = new ObjectMapper();
    }

    @Test
    void testGetServiceAlertsDefaultsToBinary() throws Exception {
        fetcher.setServiceAlerts(new ServiceAlertRows(
            List.of(new ServiceAlertRow("SA1", null, null, "Header", null)), List.of(), List.of()));

        ResponseEntity<byte[]> response = controller.getServiceAlerts(null);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("application/octet-stream", response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE));
        GtfsRealtime.FeedMessage feedMessage = GtfsRealtime.FeedMessage.parseFrom(response.getBody());
        assertEquals("SA1", feedMessage.getEntity(0).getId());
    }

    @Test
    void testGetTripUpdatesAsJson() throws Exception {
        ResponseEntity<byte[]> response = controller.getTripUpdates("json");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("application/json", response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE));
        JsonNode root = objectMapper.readTree(response.getBody());
        assertEquals("2.0", root.get("header").get("gtfs_realtime_version").asText());
        assertFalse(root.has("entity"));
    }

    @Test
    void testUnknownFormatFallsBackToBinary() throws Exception {
        fetcher.setVehiclePositions(List.of(new VehiclePositionRow("VP1", TripReference.EMPTY, VehicleReference.EMPTY,
            52.5f, 13.4f, null, null, null, null, null, null, null, null)));

        ResponseEntity<byte[]> response = controller.getVehiclePositions("xml");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("application/octet-stream", response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE));
        assertEquals("VP1", GtfsRealtime.FeedMessage.parseFrom(response.getBody()).getEntity(0).getId());
    }

    @Test
    void testSourceFailureReturnsServerError() {
        fetcher.setFailing(true);

        ResponseEntity<byte[]> response = controller.getTripUpdates(null);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertNull(response.getBody());
    }

    @Test
    void testSchemaViolationReturnsServerError() {
        fetcher.setServiceAlerts(new ServiceAlertRows(
            List.of(new ServiceAlertRow("SA1", "EARTHQUAKE", null, null, null)), List.of(), List.of()));

        ResponseEntity<byte[]> response = controller.getServiceAlerts("json");

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertNull(response.getBody());
    }

    @Test
    void testUnexpectedFailureReturnsServerError() {
        fetcher.setFailure(new IllegalStateException("connection pool closed"));

        ResponseEntity<byte[]> response = controller.getVehiclePositions("json");

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertNull(response.getBody());
    }
}
