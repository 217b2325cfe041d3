package org.gtfslake.gtfs_rt.generator;

import java.util.Optional;

import org.gtfslake.gtfs_rt.records.TripReference;
import org.gtfslake.gtfs_rt.records.VehicleReference;

import com.google.transit.realtime.GtfsRealtime;

/**
 * Builds the optional trip and vehicle descriptors nested in feed entities.
 *
 * <p>A descriptor is only produced when at least one of its source columns is
 * present. When every column is absent, no descriptor exists and the caller
 * must leave the field unset rather than emit an empty message. Within a
 * descriptor, only present columns are set.</p>
 *
 * <p>Both methods are pure: the same reference always yields an equal descriptor.</p>
 *
 * @since 1.0
 */
public final class DescriptorFactory {

    private DescriptorFactory() {
    }

    /**
     * Builds a trip descriptor from the six trip reference columns.
     *
     * @param trip the trip reference, may be {@code null}
     * @return the descriptor, or empty if no column is present
     * @throws org.gtfslake.gtfs_rt.exceptions.FeedSchemaException if the schedule relationship is unknown
     */
    public static Optional<GtfsRealtime.TripDescriptor> tripDescriptor(TripReference trip) {
        if (trip == null || isEmpty(trip)) {
            return Optional.empty();
        }

        GtfsRealtime.TripDescriptor.Builder descriptor = GtfsRealtime.TripDescriptor.newBuilder();
        if (trip.tripId() != null) {
            descriptor.setTripId(trip.tripId());
        }
        if (trip.routeId() != null) {
            descriptor.setRouteId(trip.routeId());
        }
        if (trip.directionId() != null) {
            descriptor.setDirectionId(trip.directionId());
        }
        if (trip.startTime() != null) {
            descriptor.setStartTime(trip.startTime());
        }
        if (trip.startDate() != null) {
            descriptor.setStartDate(trip.startDate());
        }
        if (trip.scheduleRelationship() != null) {
            descriptor.setScheduleRelationship(ProtocolEnums.resolve(
                GtfsRealtime.TripDescriptor.ScheduleRelationship.class,
                "trip_schedule_relationship", trip.scheduleRelationship()));
        }
        return Optional.of(descriptor.build());
    }

    /**
     * Builds a vehicle descriptor from the four vehicle reference columns.
     *
     * @param vehicle the vehicle reference, may be {@code null}
     * @return the descriptor, or empty if no column is present
     * @throws org.gtfslake.gtfs_rt.exceptions.FeedSchemaException if the wheelchair value is unknown
     */
    public static Optional<GtfsRealtime.VehicleDescriptor> vehicleDescriptor(VehicleReference vehicle) {
        if (vehicle == null || isEmpty(vehicle)) {
            return Optional.empty();
        }

        GtfsRealtime.VehicleDescriptor.Builder descriptor = GtfsRealtime.VehicleDescriptor.newBuilder();
        if (vehicle.vehicleId() != null) {
            descriptor.setId(vehicle.vehicleId());
        }
        if (vehicle.label() != null) {
            descriptor.setLabel(vehicle.label());
        }
        if (vehicle.licensePlate() != null) {
            descriptor.setLicensePlate(vehicle.licensePlate());
        }
        if (vehicle.wheelchairAccessible() != null) {
            descriptor.setWheelchairAccessible(ProtocolEnums.resolve(
                GtfsRealtime.VehicleDescriptor.WheelchairAccessible.class,
                "vehicle_wheelchair_accessible", vehicle.wheelchairAccessible()));
        }
        return Optional.of(descriptor.build());
    }

    private static boolean isEmpty(TripReference trip) {
        return trip.tripId() == null
            && trip.routeId() == null
            && trip.directionId() == null
            && trip.startTime() == null
            && trip.startDate() == null
            && trip.scheduleRelationship() == null;
    }

    private static boolean isEmpty(VehicleReference vehicle) {
        return vehicle.vehicleId() == null
            && vehicle.label() == null
            && vehicle.licensePlate() == null
            && vehicle.wheelchairAccessible() == null;
    }
}
