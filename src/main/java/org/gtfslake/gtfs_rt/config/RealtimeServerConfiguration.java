package org.gtfslake.gtfs_rt.config;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

import org.apache.commons.dbcp2.BasicDataSource;
import org.gtfslake.gtfs_rt.cache.MemcachedResponseCache;
import org.gtfslake.gtfs_rt.fetchers.LakeRealtimeDataFetcher;
import org.gtfslake.gtfs_rt.fetchers.RealtimeDataFetcher;
import org.gtfslake.gtfs_rt.notifications.ChangeListener;
import org.gtfslake.gtfs_rt.notifications.MqttChangeSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Wires the collaborators of the feed pipeline that are not plain components:
 * the lake connection pool, the optional memcached cache and the change subscriber.
 *
 * <p>Deployment secrets are read with dotenv from a {@code .env} file in the working
 * directory, falling back to the process environment:</p>
 * <ul>
 *   <li>{@code DATABASE_URL}: overrides {@code app.database_url}</li>
 *   <li>{@code MQTT_USERNAME}, {@code MQTT_PASSWORD}: broker credentials</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@EnableConfigurationProperties({AppProperties.class, CachingProperties.class, NotificationProperties.class})
public class RealtimeServerConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(RealtimeServerConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Dotenv dotenv() {
        return Dotenv.configure().ignoreIfMissing().load();
    }

    /**
     * Connection pool for the lake database. Connections are opened lazily, so a
     * missing database only fails the requests that need it.
     */
    @Bean(destroyMethod = "close")
    public BasicDataSource lakeDataSource(AppProperties appProperties, Dotenv dotenv) {
        String url = dotenv.get("DATABASE_URL");
        if (url == null || url.isEmpty()) {
            url = appProperties.getDatabaseUrl();
        }
        logger.info("Reading realtime data from {}", url);

        BasicDataSource dataSource = new BasicDataSource();
        dataSource.setUrl(url);
        dataSource.setMinIdle(2);
        dataSource.setMaxIdle(8);
        dataSource.setMaxTotal(16);
        dataSource.setDefaultQueryTimeout(Duration.ofSeconds(30));
        return dataSource;
    }

    @Bean
    public RealtimeDataFetcher realtimeDataFetcher(BasicDataSource lakeDataSource) {
        return new LakeRealtimeDataFetcher(lakeDataSource);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "app", name = "caching-enabled", havingValue = "true")
    public MemcachedResponseCache responseCache(CachingProperties cachingProperties) throws IOException {
        return new MemcachedResponseCache(cachingProperties.getCachingServerEndpoint(),
            cachingProperties.getCachingOperationTimeoutMillis());
    }

    @Bean
    public MqttChangeSubscriber mqttChangeSubscriber(NotificationProperties notificationProperties,
                                                     ChangeListener changeListener, Dotenv dotenv) {
        return new MqttChangeSubscriber(notificationProperties, changeListener,
            dotenv.get("MQTT_USERNAME"), dotenv.get("MQTT_PASSWORD"));
    }
}
