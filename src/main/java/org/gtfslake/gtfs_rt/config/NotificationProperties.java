package org.gtfslake.gtfs_rt.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Change notification settings bound from the {@code notifications} section.
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "notifications")
public class NotificationProperties {

    private boolean enabled = true;

    /** MQTT broker URI, e.g. {@code tcp://localhost:1883}. */
    private String brokerUrl = "tcp://localhost:1883";

    /** Topic filter to subscribe to; MQTT wildcards are allowed. */
    private String topic = "gtfs-lake/realtime/#";

    private String clientId = "gtfs-lake-realtime";

    /** Delay between two attempts when the first connect fails. */
    private int retryIntervalSeconds = 30;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBrokerUrl() {
        return brokerUrl;
    }

    public void setBrokerUrl(String brokerUrl) {
        this.brokerUrl = brokerUrl;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public int getRetryIntervalSeconds() {
        return retryIntervalSeconds;
    }

    public void setRetryIntervalSeconds(int retryIntervalSeconds) {
        if (retryIntervalSeconds <= 0) {
            throw new IllegalArgumentException("notifications.retry_interval_seconds must be positive, got: " + retryIntervalSeconds);
        }
        this.retryIntervalSeconds = retryIntervalSeconds;
    }
}
