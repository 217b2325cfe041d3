package org.gtfslake.gtfs_rt.fetchers;

import java.util.List;

import org.gtfslake.gtfs_rt.exceptions.FeedSourceException;
import org.gtfslake.gtfs_rt.records.ServiceAlertRows;
import org.gtfslake.gtfs_rt.records.TripUpdateRows;
import org.gtfslake.gtfs_rt.records.VehiclePositionRow;

/**
 * Read-only access to the realtime tables of the GTFS lake.
 * <p>
 * Each method returns a complete snapshot of one feed kind. Row order is the
 * order the lake returns them in; callers must not rely on any sorting.
 * Implementations must be safe for concurrent use by request threads.
 * </p>
 *
 * @since 1.0
 */
public interface RealtimeDataFetcher {

    /**
     * Reads the service alerts together with their active periods and informed entities.
     *
     * @return the three alert row-sets
     * @throws FeedSourceException if the lake cannot be read
     */
    ServiceAlertRows fetchServiceAlerts();

    /**
     * Reads the trip updates together with their stop time updates.
     *
     * @return the two trip update row-sets
     * @throws FeedSourceException if the lake cannot be read
     */
    TripUpdateRows fetchTripUpdates();

    /**
     * Reads the vehicle positions.
     *
     * @return the vehicle position rows
     * @throws FeedSourceException if the lake cannot be read
     */
    List<VehiclePositionRow> fetchVehiclePositions();
}
