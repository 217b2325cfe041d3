package org.gtfslake.gtfs_rt.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application settings bound from the {@code app} section of the configuration.
 *
 * <p>Keys are written in underscore notation in YAML
 * ({@code app.caching_enabled}, {@code app.routing.trip_updates_endpoint}, ...);
 * the defaults below apply when no configuration file is present.</p>
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /** Whether serialized feeds are cached in memcached. */
    private boolean cachingEnabled = false;

    /** Whether cross-origin GET requests are allowed. */
    private boolean corsEnabled = false;

    /** Language tag of the header and description translations of alerts. */
    private String alertLanguage = "de-DE";

    /** JDBC URL of the lake database. Overridden by {@code DATABASE_URL} in the environment. */
    private String databaseUrl = "jdbc:sqlite:./gtfs-lake.db";

    private final Routing routing = new Routing();

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public void setCachingEnabled(boolean cachingEnabled) {
        this.cachingEnabled = cachingEnabled;
    }

    public boolean isCorsEnabled() {
        return corsEnabled;
    }

    public void setCorsEnabled(boolean corsEnabled) {
        this.corsEnabled = corsEnabled;
    }

    public String getAlertLanguage() {
        return alertLanguage;
    }

    public void setAlertLanguage(String alertLanguage) {
        this.alertLanguage = alertLanguage;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public void setDatabaseUrl(String databaseUrl) {
        this.databaseUrl = databaseUrl;
    }

    public Routing getRouting() {
        return routing;
    }

    /**
     * Paths of the three feed endpoints.
     */
    public static class Routing {

        private String serviceAlertsEndpoint = "/gtfs/realtime/service-alerts.pbf";

        private String tripUpdatesEndpoint = "/gtfs/realtime/trip-updates.pbf";

        private String vehiclePositionsEndpoint = "/gtfs/realtime/vehicle-positions.pbf";

        public String getServiceAlertsEndpoint() {
            return serviceAlertsEndpoint;
        }

        public void setServiceAlertsEndpoint(String serviceAlertsEndpoint) {
            this.serviceAlertsEndpoint = requirePath("service_alerts_endpoint", serviceAlertsEndpoint);
        }

        public String getTripUpdatesEndpoint() {
            return tripUpdatesEndpoint;
        }

        public void setTripUpdatesEndpoint(String tripUpdatesEndpoint) {
            this.tripUpdatesEndpoint = requirePath("trip_updates_endpoint", tripUpdatesEndpoint);
        }

        public String getVehiclePositionsEndpoint() {
            return vehiclePositionsEndpoint;
        }

        public void setVehiclePositionsEndpoint(String vehiclePositionsEndpoint) {
            this.vehiclePositionsEndpoint = requirePath("vehicle_positions_endpoint", vehiclePositionsEndpoint);
        }

        private static String requirePath(String key, String path) {
            if (path == null || !path.startsWith("/")) {
                throw new IllegalArgumentException("app.routing." + key + " must be an absolute path, got: " + path);
            }
            return path;
        }
    }
}
