package org.gtfslake.gtfs_rt.fetchers;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import javax.sql.DataSource;

import org.gtfslake.gtfs_rt.exceptions.FeedSourceException;
import org.gtfslake.gtfs_rt.records.AlertActivePeriodRow;
import org.gtfslake.gtfs_rt.records.AlertInformedEntityRow;
import org.gtfslake.gtfs_rt.records.ServiceAlertRow;
import org.gtfslake.gtfs_rt.records.ServiceAlertRows;
import org.gtfslake.gtfs_rt.records.StopTimeUpdateRow;
import org.gtfslake.gtfs_rt.records.TripReference;
import org.gtfslake.gtfs_rt.records.TripUpdateRow;
import org.gtfslake.gtfs_rt.records.TripUpdateRows;
import org.gtfslake.gtfs_rt.records.VehiclePositionRow;
import org.gtfslake.gtfs_rt.records.VehicleReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RealtimeDataFetcher} reading the realtime tables of the lake database over JDBC.
 *
 * <p>The tables read are:
 * <ul>
 *   <li>{@code realtime_service_alerts}, {@code realtime_alert_active_periods},
 *       {@code realtime_alert_informed_entities}</li>
 *   <li>{@code realtime_trip_updates}, {@code realtime_trip_stop_time_updates}</li>
 *   <li>{@code realtime_vehicle_positions}</li>
 * </ul>
 *
 * <p>All queries of one feed kind run on a single pooled connection inside one
 * transaction, so the parent and child row-sets come from the same database
 * snapshot even while the lake is being loaded. Nothing is ever written.</p>
 *
 * <p>SQL {@code NULL} is mapped to {@code null}; numeric columns accept both
 * numeric and textual storage, as SQLite does not enforce column types.</p>
 *
 * @since 1.0
 */
public class LakeRealtimeDataFetcher implements RealtimeDataFetcher {
    private static final Logger logger = LoggerFactory.getLogger(LakeRealtimeDataFetcher.class);

    private static final String TRIP_COLUMNS =
        "trip_id, trip_route_id, trip_direction_id, trip_start_time, trip_start_date, trip_schedule_relationship";

    private static final String VEHICLE_COLUMNS =
        "vehicle_id, vehicle_label, vehicle_license_plate, vehicle_wheelchair_accessible";

    private static final String SELECT_SERVICE_ALERTS =
        "SELECT service_alert_id, cause, effect, header_text, description_text FROM realtime_service_alerts";

    private static final String SELECT_ALERT_ACTIVE_PERIODS =
        "SELECT service_alert_id, start_timestamp, end_timestamp FROM realtime_alert_active_periods";

    private static final String SELECT_ALERT_INFORMED_ENTITIES =
        "SELECT service_alert_id, agency_id, route_id, route_type, stop_id, " + TRIP_COLUMNS
            + " FROM realtime_alert_informed_entities";

    private static final String SELECT_TRIP_UPDATES =
        "SELECT trip_update_id, " + TRIP_COLUMNS + ", " + VEHICLE_COLUMNS + " FROM realtime_trip_updates";

    private static final String SELECT_STOP_TIME_UPDATES =
        "SELECT trip_update_id, stop_sequence, stop_id, "
            + "arrival_time, arrival_delay, arrival_uncertainty, "
            + "departure_time, departure_delay, departure_uncertainty, "
            + "schedule_relationship FROM realtime_trip_stop_time_updates";

    private static final String SELECT_VEHICLE_POSITIONS =
        "SELECT vehicle_position_id, " + TRIP_COLUMNS + ", " + VEHICLE_COLUMNS + ", "
            + "position_latitude, position_longitude, position_bearing, position_odometer, position_speed, "
            + "current_stop_sequence, stop_id, current_status, timestamp, congestion_level "
            + "FROM realtime_vehicle_positions";

    private final DataSource dataSource;

    /**
     * @param dataSource pooled data source pointing at the lake database
     */
    public LakeRealtimeDataFetcher(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public ServiceAlertRows fetchServiceAlerts() {
        return inSnapshot("service alerts", conn -> new ServiceAlertRows(
            query(conn, SELECT_SERVICE_ALERTS, LakeRealtimeDataFetcher::mapServiceAlert),
            query(conn, SELECT_ALERT_ACTIVE_PERIODS, LakeRealtimeDataFetcher::mapActivePeriod),
            query(conn, SELECT_ALERT_INFORMED_ENTITIES, LakeRealtimeDataFetcher::mapInformedEntity)));
    }

    @Override
    public TripUpdateRows fetchTripUpdates() {
        return inSnapshot("trip updates", conn -> new TripUpdateRows(
            query(conn, SELECT_TRIP_UPDATES, LakeRealtimeDataFetcher::mapTripUpdate),
            query(conn, SELECT_STOP_TIME_UPDATES, LakeRealtimeDataFetcher::mapStopTimeUpdate)));
    }

    @Override
    public List<VehiclePositionRow> fetchVehiclePositions() {
        return inSnapshot("vehicle positions",
            conn -> query(conn, SELECT_VEHICLE_POSITIONS, LakeRealtimeDataFetcher::mapVehiclePosition));
    }

    @FunctionalInterface
    private interface SnapshotRead<T> {
        T read(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /**
     * Runs all reads of one feed kind inside a single transaction.
     */
    private <T> T inSnapshot(String feedName, SnapshotRead<T> read) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = read.read(conn);
                conn.commit();
                return result;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            logger.error("Failed to read {} from the lake database", feedName, e);
            throw new FeedSourceException("Failed to read " + feedName + " from the lake database", e);
        }
    }

    private static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper) throws SQLException {
        List<T> rows = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                rows.add(mapper.map(rs));
            }
        }
        return rows;
    }

    private static ServiceAlertRow mapServiceAlert(ResultSet rs) throws SQLException {
        return new ServiceAlertRow(
            rs.getString("service_alert_id"),
            rs.getString("cause"),
            rs.getString("effect"),
            rs.getString("header_text"),
            rs.getString("description_text"));
    }

    private static AlertActivePeriodRow mapActivePeriod(ResultSet rs) throws SQLException {
        return new AlertActivePeriodRow(
            rs.getString("service_alert_id"),
            getLong(rs, "start_timestamp"),
            getLong(rs, "end_timestamp"));
    }

    private static AlertInformedEntityRow mapInformedEntity(ResultSet rs) throws SQLException {
        return new AlertInformedEntityRow(
            rs.getString("service_alert_id"),
            rs.getString("agency_id"),
            rs.getString("route_id"),
            getInteger(rs, "route_type"),
            rs.getString("stop_id"),
            mapTripReference(rs));
    }

    private static TripUpdateRow mapTripUpdate(ResultSet rs) throws SQLException {
        return new TripUpdateRow(
            rs.getString("trip_update_id"),
            mapTripReference(rs),
            mapVehicleReference(rs));
    }

    private static StopTimeUpdateRow mapStopTimeUpdate(ResultSet rs) throws SQLException {
        return new StopTimeUpdateRow(
            rs.getString("trip_update_id"),
            getInteger(rs, "stop_sequence"),
            rs.getString("stop_id"),
            getLong(rs, "arrival_time"),
            getInteger(rs, "arrival_delay"),
            getInteger(rs, "arrival_uncertainty"),
            getLong(rs, "departure_time"),
            getInteger(rs, "departure_delay"),
            getInteger(rs, "departure_uncertainty"),
            rs.getString("schedule_relationship"));
    }

    private static VehiclePositionRow mapVehiclePosition(ResultSet rs) throws SQLException {
        return new VehiclePositionRow(
            rs.getString("vehicle_position_id"),
            mapTripReference(rs),
            mapVehicleReference(rs),
            getFloat(rs, "position_latitude"),
            getFloat(rs, "position_longitude"),
            getFloat(rs, "position_bearing"),
            getDouble(rs, "position_odometer"),
            getFloat(rs, "position_speed"),
            getInteger(rs, "current_stop_sequence"),
            rs.getString("stop_id"),
            rs.getString("current_status"),
            getLong(rs, "timestamp"),
            rs.getString("congestion_level"));
    }

    private static TripReference mapTripReference(ResultSet rs) throws SQLException {
        return new TripReference(
            rs.getString("trip_id"),
            rs.getString("trip_route_id"),
            getInteger(rs, "trip_direction_id"),
            rs.getString("trip_start_time"),
            rs.getString("trip_start_date"),
            rs.getString("trip_schedule_relationship"));
    }

    private static VehicleReference mapVehicleReference(ResultSet rs) throws SQLException {
        return new VehicleReference(
            rs.getString("vehicle_id"),
            rs.getString("vehicle_label"),
            rs.getString("vehicle_license_plate"),
            rs.getString("vehicle_wheelchair_accessible"));
    }

    private static Integer getInteger(ResultSet rs, String column) throws SQLException {
        BigDecimal value = getExact(rs, column);
        try {
            return value == null ? null : value.intValueExact();
        } catch (ArithmeticException e) {
            throw new SQLException("Column " + column + " does not hold a 32-bit integer: " + value, e);
        }
    }

    private static Long getLong(ResultSet rs, String column) throws SQLException {
        BigDecimal value = getExact(rs, column);
        try {
            return value == null ? null : value.longValueExact();
        } catch (ArithmeticException e) {
            throw new SQLException("Column " + column + " does not hold a 64-bit integer: " + value, e);
        }
    }

    private static Float getFloat(ResultSet rs, String column) throws SQLException {
        Number value = getNumber(rs, column);
        return value == null ? null : value.floatValue();
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        Number value = getNumber(rs, column);
        return value == null ? null : value.doubleValue();
    }

    private static BigDecimal getExact(ResultSet rs, String column) throws SQLException {
        Number value = getNumber(rs, column);
        if (value == null || value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(value.doubleValue());
        }
        return new BigDecimal(value.toString());
    }

    private static Number getNumber(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        if (value == null || value instanceof Number) {
            return (Number) value;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new SQLException("Column " + column + " holds a non-numeric value: " + value, e);
        }
    }
}
