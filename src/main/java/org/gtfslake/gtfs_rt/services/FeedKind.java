package org.gtfslake.gtfs_rt.services;

/**
 * The three GTFS-RT feeds served by this application.
 *
 * @since 1.0
 */
public enum FeedKind {
    SERVICE_ALERTS,
    TRIP_UPDATES,
    VEHICLE_POSITIONS
}
