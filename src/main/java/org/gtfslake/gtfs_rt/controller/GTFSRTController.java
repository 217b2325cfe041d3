package org.gtfslake.gtfs_rt.controller;

import org.gtfslake.gtfs_rt.encoding.FeedFormat;
import org.gtfslake.gtfs_rt.exceptions.GtfsRtProcessingException;
import org.gtfslake.gtfs_rt.services.FeedKind;
import org.gtfslake.gtfs_rt.services.FeedService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller serving the GTFS-RT (General Transit Feed Specification - Realtime) feeds.
 *
 * <p>This controller provides the three realtime endpoints of the lake: service alerts,
 * trip updates and vehicle positions. Their paths are read from the
 * {@code app.routing} configuration and default to
 * {@code /gtfs/realtime/service-alerts.pbf}, {@code /gtfs/realtime/trip-updates.pbf} and
 * {@code /gtfs/realtime/vehicle-positions.pbf}.</p>
 *
 * <p>Every endpoint accepts the optional query parameter {@code f}. {@code f=json}
 * returns the feed as JSON with content type {@code application/json}; a missing
 * parameter or any other value returns the protocol buffer encoding with content
 * type {@code application/octet-stream}.</p>
 *
 * <p>Each response is a complete {@code FULL_DATASET} snapshot.</p>
 *
 * @since 1.0
 */
@RestController
public class GTFSRTController {
    private static final Logger logger = LoggerFactory.getLogger(GTFSRTController.class);

    private final FeedService feedService;

    public GTFSRTController(FeedService feedService) {
        this.feedService = feedService;
    }

    /**
     * Retrieves the GTFS-RT service alerts feed.
     *
     * @param format the format selector, {@code json} or anything else for binary
     * @return ResponseEntity containing the encoded feed with HTTP status 200 (OK),
     *         or HTTP status 500 (INTERNAL_SERVER_ERROR) if the feed cannot be produced
     */
    @GetMapping("${app.routing.service_alerts_endpoint:/gtfs/realtime/service-alerts.pbf}")
    public ResponseEntity<byte[]> getServiceAlerts(@RequestParam(name = "f", required = false) String format) {
        return serve(FeedKind.SERVICE_ALERTS, format);
    }

    /**
     * Retrieves the GTFS-RT trip updates feed.
     *
     * @param format the format selector, {@code json} or anything else for binary
     * @return ResponseEntity containing the encoded feed with HTTP status 200 (OK),
     *         or HTTP status 500 (INTERNAL_SERVER_ERROR) if the feed cannot be produced
     */
    @GetMapping("${app.routing.trip_updates_endpoint:/gtfs/realtime/trip-updates.pbf}")
    public ResponseEntity<byte[]> getTripUpdates(@RequestParam(name = "f", required = false) String format) {
        return serve(FeedKind.TRIP_UPDATES, format);
    }

    /**
     * Retrieves the GTFS-RT vehicle positions feed.
     *
     * @param format the format selector, {@code json} or anything else for binary
     * @return ResponseEntity containing the encoded feed with HTTP status 200 (OK),
     *         or HTTP status 500 (INTERNAL_SERVER_ERROR) if the feed cannot be produced
     */
    @GetMapping("${app.routing.vehicle_positions_endpoint:/gtfs/realtime/vehicle-positions.pbf}")
    public ResponseEntity<byte[]> getVehiclePositions(@RequestParam(name = "f", required = false) String format) {
        return serve(FeedKind.VEHICLE_POSITIONS, format);
    }

    private ResponseEntity<byte[]> serve(FeedKind kind, String selector) {
        FeedFormat format = FeedFormat.fromSelector(selector);

        byte[] payload;
        try {
            payload = feedService.getFeed(kind, format);
        } catch (GtfsRtProcessingException e) {
            logger.error("[{}] Failed to produce feed: {}", kind, e.getMessage(), e);
            return new ResponseEntity<>(HttpStatus.INTERNAL_SERVER_ERROR);
        } catch (RuntimeException e) {
            logger.error("[{}] Unexpected error while producing feed", kind, e);
            return new ResponseEntity<>(HttpStatus.INTERNAL_SERVER_ERROR);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.CONTENT_TYPE, format.getContentType());

        return new ResponseEntity<>(payload, headers, HttpStatus.OK);
    }
}
