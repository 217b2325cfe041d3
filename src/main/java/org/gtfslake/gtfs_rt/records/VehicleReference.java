package org.gtfslake.gtfs_rt.records;

/**
 * Vehicle reference columns carried by trip update and vehicle position rows.
 * <p>
 * Every component is nullable; {@code null} means the column is absent for this row.
 * </p>
 *
 * @param vehicleId            internal vehicle identifier ({@code vehicle_id})
 * @param label                user visible label ({@code vehicle_label})
 * @param licensePlate         license plate ({@code vehicle_license_plate})
 * @param wheelchairAccessible GTFS-RT wheelchair accessibility name or number
 *
 * @since 1.0
 */
public record VehicleReference(
        String vehicleId,
        String label,
        String licensePlate,
        String wheelchairAccessible) {

    /** A reference with every column absent. */
    public static final VehicleReference EMPTY = new VehicleReference(null, null, null, null);
}
