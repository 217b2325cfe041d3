package org.gtfslake.gtfs_rt.generator;

import java.util.ArrayList;
import java.util.List;

import org.gtfslake.gtfs_rt.records.VehiclePositionRow;
import org.springframework.stereotype.Component;

import com.google.transit.realtime.GtfsRealtime;

/**
 * Generator for GTFS Realtime VehiclePosition entities from the lake's vehicle position table.
 *
 * <p>Latitude and longitude are always written; a row missing either one is a
 * schema violation. Every other attribute is written only when stored.</p>
 *
 * @since 1.0
 */
@Component
public class VehiclePositionGenerator {

    /**
     * Generates the vehicle position entities of a vehicle position snapshot.
     *
     * @param rows the vehicle position rows
     * @return one entity per row, in row order
     * @throws org.gtfslake.gtfs_rt.exceptions.FeedSchemaException if a row cannot be expressed in GTFS-RT
     */
    public List<GtfsRealtime.FeedEntity> generateVehiclePositions(List<VehiclePositionRow> rows) {
        List<GtfsRealtime.FeedEntity> entities = new ArrayList<>(rows.size());
        for (VehiclePositionRow vehiclePosition : rows) {
            GtfsRealtime.FeedEntity.Builder entity = GtfsRealtime.FeedEntity.newBuilder();
            if (vehiclePosition.vehiclePositionId() != null) {
                entity.setId(vehiclePosition.vehiclePositionId());
            }
            populateVehiclePosition(entity.getVehicleBuilder(), vehiclePosition);
            entities.add(FeedEntities.build(entity));
        }
        return entities;
    }

    private void populateVehiclePosition(GtfsRealtime.VehiclePosition.Builder vehicle, VehiclePositionRow row) {
        DescriptorFactory.tripDescriptor(row.trip()).ifPresent(vehicle::setTrip);
        DescriptorFactory.vehicleDescriptor(row.vehicle()).ifPresent(vehicle::setVehicle);

        // latitude and longitude are required, a missing one is reported when the entity is built
        GtfsRealtime.Position.Builder position = vehicle.getPositionBuilder();
        if (row.latitude() != null) {
            position.setLatitude(row.latitude());
        }
        if (row.longitude() != null) {
            position.setLongitude(row.longitude());
        }
        if (row.bearing() != null) {
            position.setBearing(row.bearing());
        }
        if (row.odometer() != null) {
            position.setOdometer(row.odometer());
        }
        if (row.speed() != null) {
            position.setSpeed(row.speed());
        }

        if (row.currentStopSequence() != null) {
            vehicle.setCurrentStopSequence(row.currentStopSequence());
        }
        if (row.stopId() != null) {
            vehicle.setStopId(row.stopId());
        }
        if (row.currentStatus() != null) {
            vehicle.setCurrentStatus(ProtocolEnums.resolve(
                GtfsRealtime.VehiclePosition.VehicleStopStatus.class, "current_status", row.currentStatus()));
        }
        if (row.timestamp() != null) {
            vehicle.setTimestamp(row.timestamp());
        }
        if (row.congestionLevel() != null) {
            vehicle.setCongestionLevel(ProtocolEnums.resolve(
                GtfsRealtime.VehiclePosition.CongestionLevel.class, "congestion_level", row.congestionLevel()));
        }
    }
}
