package org.gtfslake.gtfs_rt;

import com.google.transit.realtime.GtfsRealtime;
import org.gtfslake.gtfs_rt.exceptions.FeedSourceException;
import org.gtfslake.gtfs_rt.fetchers.RealtimeDataFetcher;
import org.gtfslake.gtfs_rt.records.ServiceAlertRow;
import org.gtfslake.gtfs_rt.records.ServiceAlertRows;
import org.gtfslake.gtfs_rt.records.TripReference;
import org.gtfslake.gtfs_rt.records.TripUpdateRow;
import org.gtfslake.gtfs_rt.records.TripUpdateRows;
import org.gtfslake.gtfs_rt.records.VehiclePositionRow;
import org.gtfslake.gtfs_rt.records.VehicleReference;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Tests the assembled application over HTTP with the lake replaced by a mock.
 */
@SpringBootTest(properties = {
    "notifications.enabled=false",
    "app.cors_enabled=true",
    "app.routing.trip_updates_endpoint=/rt/trip-updates"
})
@AutoConfigureMockMvc
class GTFSRTApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RealtimeDataFetcher fetcher;

    @Test
    void testVehiclePositionsDefaultToBinary() throws Exception {
        when(fetcher.fetchVehiclePositions()).thenReturn(List.of(new VehiclePositionRow("VP1",
            TripReference.EMPTY, VehicleReference.EMPTY,
            52.5f, 13.4f, null, null, null, null, null, null, null, null)));

        MvcResult result = mockMvc.perform(get("/gtfs/realtime/vehicle-positions.pbf"))
            .andExpect(status().isOk())
            .andExpect(content().contentType("application/octet-stream"))
            .andReturn();

        GtfsRealtime.FeedMessage feedMessage = GtfsRealtime.FeedMessage.parseFrom(result.getResponse().getContentAsByteArray());
        assertEquals("VP1", feedMessage.getEntity(0).getId());
        assertEquals(52.5f, feedMessage.getEntity(0).getVehicle().getPosition().getLatitude());
    }

    @Test
    void testServiceAlertsAsJson() throws Exception {
        when(fetcher.fetchServiceAlerts()).thenReturn(new ServiceAlertRows(
            List.of(new ServiceAlertRow("SA1", "CONSTRUCTION", null, "Bridge closed", null)), List.of(), List.of()));

        mockMvc.perform(get("/gtfs/realtime/service-alerts.pbf").param("f", "json"))
            .andExpect(status().isOk())
            .andExpect(content().contentType("application/json"))
            .andExpect(jsonPath("$.header.gtfs_realtime_version").value("2.0"))
            .andExpect(jsonPath("$.header.incrementality").value("FULL_DATASET"))
            .andExpect(jsonPath("$.entity[0].id").value("SA1"))
            .andExpect(jsonPath("$.entity[0].alert.cause").value("CONSTRUCTION"))
            .andExpect(jsonPath("$.entity[0].alert.header_text.translation[0].language").value("de-DE"));
    }

    @Test
    void testTripUpdatesServedOnConfiguredRoute() throws Exception {
        when(fetcher.fetchTripUpdates()).thenReturn(new TripUpdateRows(
            List.of(new TripUpdateRow("TU1", new TripReference("T1", null, null, null, null, null), VehicleReference.EMPTY)),
            List.of()));

        mockMvc.perform(get("/rt/trip-updates").param("f", "json"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.entity[0].trip_update.trip.trip_id").value("T1"));

        mockMvc.perform(get("/gtfs/realtime/trip-updates.pbf"))
            .andExpect(status().isNotFound());
    }

    @Test
    void testLakeFailureReturnsServerError() throws Exception {
        when(fetcher.fetchServiceAlerts()).thenThrow(
            new FeedSourceException("Failed to read service alerts", new SQLException("database is locked")));

        mockMvc.perform(get("/gtfs/realtime/service-alerts.pbf"))
            .andExpect(status().isInternalServerError())
            .andExpect(content().bytes(new byte[0]));
    }

    @Test
    void testCrossOriginGetIsAllowed() throws Exception {
        when(fetcher.fetchVehiclePositions()).thenReturn(List.of());

        mockMvc.perform(get("/gtfs/realtime/vehicle-positions.pbf").header("Origin", "https://maps.example.org"))
            .andExpect(status().isOk())
            .andExpect(header().string("Access-Control-Allow-Origin", "https://maps.example.org"))
            .andExpect(header().string("Access-Control-Allow-Credentials", "true"));
    }

    @Test
    void testPreflightAllowsGet() throws Exception {
        mockMvc.perform(options("/gtfs/realtime/vehicle-positions.pbf")
                .header("Origin", "https://maps.example.org")
                .header("Access-Control-Request-Method", "GET"))
            .andExpect(status().isOk())
            .andExpect(header().string("Access-Control-Allow-Origin", "https://maps.example.org"))
            .andExpect(header().string("Access-Control-Allow-Methods", "GET"));
    }
}
