package org.gtfslake.gtfs_rt.records;

/**
 * Trip reference columns carried by trip update, vehicle position and
 * informed entity rows.
 * <p>
 * Every component is nullable; {@code null} means the column is absent for
 * this row. The lake stores these columns with a {@code trip_} prefix.
 * </p>
 *
 * @param tripId               the GTFS {@code trip_id}
 * @param routeId              the route the trip belongs to ({@code trip_route_id})
 * @param directionId          the direction of travel ({@code trip_direction_id})
 * @param startTime            the scheduled start time, {@code HH:MM:SS}
 * @param startDate            the service date, {@code YYYYMMDD}
 * @param scheduleRelationship the GTFS-RT trip schedule relationship name or number
 *
 * @since 1.0
 */
public record TripReference(
        String tripId,
        String routeId,
        Integer directionId,
        String startTime,
        String startDate,
        String scheduleRelationship) {

    /** A reference with every column absent. */
    public static final TripReference EMPTY = new TripReference(null, null, null, null, null, null);
}
