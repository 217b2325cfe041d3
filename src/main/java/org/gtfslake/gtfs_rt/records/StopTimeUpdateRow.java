package org.gtfslake.gtfs_rt.records;

/**
 * One row of {@code realtime_trip_stop_time_updates}: the prediction for one stop of a trip update.
 * <p>
 * Arrival and departure values are independent; each of time, delay and
 * uncertainty is {@code null} when absent. A delay of {@code 0} is a present
 * value meaning "on time".
 * </p>
 *
 * @param tripUpdateId         the owning trip update
 * @param stopSequence         stop sequence in the trip, nullable
 * @param stopId               stop identifier, nullable
 * @param arrivalTime          predicted arrival in POSIX seconds
 * @param arrivalDelay         arrival delay in seconds
 * @param arrivalUncertainty   arrival uncertainty in seconds
 * @param departureTime        predicted departure in POSIX seconds
 * @param departureDelay       departure delay in seconds
 * @param departureUncertainty departure uncertainty in seconds
 * @param scheduleRelationship GTFS-RT stop time schedule relationship name or number
 *
 * @since 1.0
 */
public record StopTimeUpdateRow(
        String tripUpdateId,
        Integer stopSequence,
        String stopId,
        Long arrivalTime,
        Integer arrivalDelay,
        Integer arrivalUncertainty,
        Long departureTime,
        Integer departureDelay,
        Integer departureUncertainty,
        String scheduleRelationship) {}
