package org.gtfslake.gtfs_rt.records;

/**
 * One row of {@code realtime_trip_updates}.
 *
 * @param tripUpdateId trip update identifier, also used as the feed entity id
 * @param trip         trip reference columns
 * @param vehicle      vehicle reference columns
 *
 * @since 1.0
 */
public record TripUpdateRow(String tripUpdateId, TripReference trip, VehicleReference vehicle) {}
