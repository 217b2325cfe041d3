package org.gtfslake.gtfs_rt.encoding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.util.JsonFormat;
import com.google.transit.realtime.GtfsRealtime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FeedEncoder.
 */
class FeedEncoderTest {

    private FeedEncoder encoder;
    private ObjectMapper objectMapper;
    private GtfsRealtime.FeedMessage feedMessage;

    @BeforeEach
    void setUp() {
        encoder = new FeedEncoder();
        objectMapper = new ObjectMapper();

        GtfsRealtime.FeedMessage.Builder builder = GtfsRealtime.FeedMessage.newBuilder();
        builder.getHeaderBuilder()
            .setGtfsRealtimeVersion("2.0")
            .setIncrementality(GtfsRealtime.FeedHeader.Incrementality.FULL_DATASET)
            .setTimestamp(1700000000L);

        GtfsRealtime.FeedEntity.Builder entity = builder.addEntityBuilder().setId("TU1");
        GtfsRealtime.TripUpdate.Builder tripUpdate = entity.getTripUpdateBuilder();
        tripUpdate.getTripBuilder().setTripId("T1");
        tripUpdate.addStopTimeUpdateBuilder()
            .setStopSequence(1)
            .setArrival(GtfsRealtime.TripUpdate.StopTimeEvent.newBuilder().setDelay(0))
            .setScheduleRelationship(GtfsRealtime.TripUpdate.StopTimeUpdate.ScheduleRelationship.SKIPPED);

        feedMessage = builder.build();
    }

    @Test
    void testBinaryIsProtocolBufferEncoding() throws Exception {
        byte[] payload = encoder.encode(feedMessage, FeedFormat.BINARY);

        assertEquals(feedMessage, GtfsRealtime.FeedMessage.parseFrom(payload));
        assertArrayEquals(payload, encoder.encode(feedMessage, FeedFormat.BINARY));
    }

    @Test
    void testJsonUsesSchemaFieldNames() throws Exception {
        byte[] payload = encoder.encode(feedMessage, FeedFormat.JSON);

        JsonNode root = objectMapper.readTree(payload);
        JsonNode header = root.get("header");
        assertEquals("2.0", header.get("gtfs_realtime_version").asText());
        assertEquals("FULL_DATASET", header.get("incrementality").asText());
        assertEquals("1700000000", header.get("timestamp").asText());

        JsonNode stopTimeUpdate = root.get("entity").get(0).get("trip_update").get("stop_time_update").get(0);
        assertEquals(0, stopTimeUpdate.get("arrival").get("delay").asInt());
        assertEquals("SKIPPED", stopTimeUpdate.get("schedule_relationship").asText());
        assertFalse(stopTimeUpdate.has("departure"));
    }

    @Test
    void testJsonParsesBackIntoEqualMessage() throws Exception {
        String json = new String(encoder.encode(feedMessage, FeedFormat.JSON), StandardCharsets.UTF_8);

        GtfsRealtime.FeedMessage.Builder parsed = GtfsRealtime.FeedMessage.newBuilder();
        JsonFormat.parser().merge(json, parsed);

        assertEquals(feedMessage, parsed.build());
    }

    @Test
    void testJsonIsCompact() {
        String json = new String(encoder.encode(feedMessage, FeedFormat.JSON), StandardCharsets.UTF_8);

        assertFalse(json.contains("\n"));
        assertTrue(json.startsWith("{\"header\":"));
    }
}
