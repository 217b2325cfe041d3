package org.gtfslake.gtfs_rt.records;

import java.util.List;

/**
 * Snapshot of the trip update tables, read together.
 *
 * @param tripUpdates     trip update rows, in table order
 * @param stopTimeUpdates stop time update rows, joined by trip update id
 *
 * @since 1.0
 */
public record TripUpdateRows(List<TripUpdateRow> tripUpdates, List<StopTimeUpdateRow> stopTimeUpdates) {}
