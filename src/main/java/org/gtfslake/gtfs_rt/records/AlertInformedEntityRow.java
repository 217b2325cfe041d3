package org.gtfslake.gtfs_rt.records;

/**
 * One row of {@code realtime_alert_informed_entities}, the scope an alert applies to.
 *
 * @param serviceAlertId the owning alert
 * @param agencyId       affected agency, nullable
 * @param routeId        affected route, nullable
 * @param routeType      affected GTFS route type, nullable
 * @param stopId         affected stop, nullable
 * @param trip           affected trip, never {@code null} but possibly {@link TripReference#EMPTY}
 *
 * @since 1.0
 */
public record AlertInformedEntityRow(
        String serviceAlertId,
        String agencyId,
        String routeId,
        Integer routeType,
        String stopId,
        TripReference trip) {}
