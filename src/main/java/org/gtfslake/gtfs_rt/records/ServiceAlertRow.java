package org.gtfslake.gtfs_rt.records;

/**
 * One row of {@code realtime_service_alerts}.
 *
 * @param serviceAlertId  alert identifier, also used as the feed entity id
 * @param cause           GTFS-RT cause name or number, nullable
 * @param effect          GTFS-RT effect name or number, nullable
 * @param headerText      short summary, nullable
 * @param descriptionText full description, nullable
 *
 * @since 1.0
 */
public record ServiceAlertRow(
        String serviceAlertId,
        String cause,
        String effect,
        String headerText,
        String descriptionText) {}
