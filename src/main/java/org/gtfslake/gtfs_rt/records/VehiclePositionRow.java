package org.gtfslake.gtfs_rt.records;

/**
 * One row of {@code realtime_vehicle_positions}.
 * <p>
 * Latitude and longitude are mandatory in GTFS-RT; every other value is
 * nullable and only emitted when present.
 * </p>
 *
 * @param vehiclePositionId   identifier, also used as the feed entity id
 * @param trip                trip reference columns
 * @param vehicle             vehicle reference columns
 * @param latitude            WGS-84 latitude
 * @param longitude           WGS-84 longitude
 * @param bearing             bearing in degrees clockwise from north
 * @param odometer            odometer value in meters
 * @param speed               momentary speed in meters per second
 * @param currentStopSequence stop sequence of the current stop
 * @param stopId              current stop identifier
 * @param currentStatus       GTFS-RT vehicle stop status name or number
 * @param timestamp           measurement time in POSIX seconds
 * @param congestionLevel     GTFS-RT congestion level name or number
 *
 * @since 1.0
 */
public record VehiclePositionRow(
        String vehiclePositionId,
        TripReference trip,
        VehicleReference vehicle,
        Float latitude,
        Float longitude,
        Float bearing,
        Double odometer,
        Float speed,
        Integer currentStopSequence,
        String stopId,
        String currentStatus,
        Long timestamp,
        String congestionLevel) {}
