package org.gtfslake.gtfs_rt.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.gtfslake.gtfs_rt.records.StopTimeUpdateRow;
import org.gtfslake.gtfs_rt.records.TripUpdateRow;
import org.gtfslake.gtfs_rt.records.TripUpdateRows;
import org.springframework.stereotype.Component;

import com.google.transit.realtime.GtfsRealtime;

/**
 * Generator for GTFS Realtime TripUpdate entities from the lake's trip update tables.
 *
 * <p>This component is responsible for:
 * <ul>
 *   <li>Building the trip and vehicle descriptors of each trip update, when referenced</li>
 *   <li>Attaching the stop time updates of each trip update in table order</li>
 *   <li>Emitting only the stored values of each arrival and departure prediction</li>
 * </ul>
 *
 * <p>GTFS-RT declares the trip of a trip update as required. A trip update row
 * without any trip reference column therefore fails with a
 * {@link org.gtfslake.gtfs_rt.exceptions.FeedSchemaException}.</p>
 *
 * @since 1.0
 */
@Component
public class TripUpdateGenerator {

    /**
     * Generates the trip update entities of a trip update snapshot.
     *
     * @param rows the trip update and stop time update row-sets
     * @return one entity per trip update row, in trip update row order
     * @throws org.gtfslake.gtfs_rt.exceptions.FeedSchemaException if a row cannot be expressed in GTFS-RT
     */
    public List<GtfsRealtime.FeedEntity> generateTripUpdates(TripUpdateRows rows) {
        Map<String, List<StopTimeUpdateRow>> stopTimeUpdates =
            FeedEntities.groupByParent(rows.stopTimeUpdates(), StopTimeUpdateRow::tripUpdateId);

        List<GtfsRealtime.FeedEntity> entities = new ArrayList<>(rows.tripUpdates().size());
        for (TripUpdateRow tripUpdate : rows.tripUpdates()) {
            GtfsRealtime.FeedEntity.Builder entity = GtfsRealtime.FeedEntity.newBuilder();
            if (tripUpdate.tripUpdateId() != null) {
                entity.setId(tripUpdate.tripUpdateId());
            }

            GtfsRealtime.TripUpdate.Builder tripUpdateBuilder = entity.getTripUpdateBuilder();
            DescriptorFactory.tripDescriptor(tripUpdate.trip()).ifPresent(tripUpdateBuilder::setTrip);
            DescriptorFactory.vehicleDescriptor(tripUpdate.vehicle()).ifPresent(tripUpdateBuilder::setVehicle);

            for (StopTimeUpdateRow stopTimeUpdate : FeedEntities.childrenOf(stopTimeUpdates, tripUpdate.tripUpdateId())) {
                tripUpdateBuilder.addStopTimeUpdate(createStopTimeUpdate(stopTimeUpdate));
            }

            entities.add(FeedEntities.build(entity));
        }
        return entities;
    }

    /**
     * Creates a stop time update from a stop time update row.
     *
     * <p>The arrival and departure events are always set, each holding exactly
     * the stored subset of time, delay and uncertainty.</p>
     *
     * @param row the stop time update row
     * @return the stop time update
     */
    GtfsRealtime.TripUpdate.StopTimeUpdate createStopTimeUpdate(StopTimeUpdateRow row) {
        GtfsRealtime.TripUpdate.StopTimeUpdate.Builder stopTimeUpdate = GtfsRealtime.TripUpdate.StopTimeUpdate.newBuilder();
        if (row.stopSequence() != null) {
            stopTimeUpdate.setStopSequence(row.stopSequence());
        }
        if (row.stopId() != null) {
            stopTimeUpdate.setStopId(row.stopId());
        }

        stopTimeUpdate.setArrival(createStopTimeEvent(row.arrivalTime(), row.arrivalDelay(), row.arrivalUncertainty()));
        stopTimeUpdate.setDeparture(createStopTimeEvent(row.departureTime(), row.departureDelay(), row.departureUncertainty()));

        if (row.scheduleRelationship() != null) {
            stopTimeUpdate.setScheduleRelationship(ProtocolEnums.resolve(
                GtfsRealtime.TripUpdate.StopTimeUpdate.ScheduleRelationship.class,
                "schedule_relationship", row.scheduleRelationship()));
        }
        return stopTimeUpdate.build();
    }

    private GtfsRealtime.TripUpdate.StopTimeEvent createStopTimeEvent(Long time, Integer delay, Integer uncertainty) {
        GtfsRealtime.TripUpdate.StopTimeEvent.Builder stopTimeEvent = GtfsRealtime.TripUpdate.StopTimeEvent.newBuilder();
        if (time != null) {
            stopTimeEvent.setTime(time);
        }
        if (delay != null) {
            stopTimeEvent.setDelay(delay);
        }
        if (uncertainty != null) {
            stopTimeEvent.setUncertainty(uncertainty);
        }
        return stopTimeEvent.build();
    }
}
