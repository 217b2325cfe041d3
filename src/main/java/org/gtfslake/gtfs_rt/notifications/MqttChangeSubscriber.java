package org.gtfslake.gtfs_rt.notifications;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.gtfslake.gtfs_rt.config.NotificationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Long-lived MQTT subscription forwarding change notifications to a {@link ChangeListener}.
 *
 * <p>The subscriber is started with the application context and stopped on shutdown.
 * All broker interaction happens on a dedicated daemon thread, so an unreachable or
 * failing broker never delays startup or affects request serving:</p>
 * <ul>
 *   <li>a failed connect is logged and retried after the configured interval</li>
 *   <li>a dropped connection is re-established by Paho's automatic reconnect,
 *       after which the topic is subscribed again</li>
 *   <li>an exception thrown by the listener is logged and the message discarded</li>
 * </ul>
 *
 * @since 1.0
 */
public class MqttChangeSubscriber implements SmartLifecycle, MqttCallbackExtended {
    private static final Logger logger = LoggerFactory.getLogger(MqttChangeSubscriber.class);

    private static final int QOS_AT_LEAST_ONCE = 1;

    private final NotificationProperties properties;
    private final ChangeListener listener;
    private final String username;
    private final String password;

    private ScheduledExecutorService executor;
    private volatile MqttClient client;
    private volatile boolean running;

    /**
     * @param properties broker, topic and retry settings
     * @param listener receiver of every message
     * @param username broker user name, or {@code null} for anonymous access
     * @param password broker password, or {@code null}
     */
    public MqttChangeSubscriber(NotificationProperties properties, ChangeListener listener,
                                String username, String password) {
        this.properties = properties;
        this.listener = listener;
        this.username = username;
        this.password = password;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        if (!properties.isEnabled()) {
            logger.info("Change notifications are disabled");
            return;
        }

        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mqtt-change-subscriber");
            thread.setDaemon(true);
            return thread;
        });
        executor.execute(this::connect);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }

        MqttClient current = client;
        client = null;
        if (current != null) {
            release(current);
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * @return whether the subscriber currently holds a broker connection
     */
    public boolean isConnected() {
        MqttClient current = client;
        return current != null && current.isConnected();
    }

    private void connect() {
        if (!running) {
            return;
        }
        MqttClient current = client;
        try {
            if (current == null) {
                current = createClient();
                current.setCallback(this);
                client = current;
            }
            current.connect(connectOptions());
        } catch (MqttException | RuntimeException e) {
            logger.warn("Failed to connect to MQTT broker {}, retrying in {} s: {}",
                properties.getBrokerUrl(), properties.getRetryIntervalSeconds(), e.getMessage());
            scheduleRetry(this::connect);
            return;
        }

        if (!running) {
            // stopped while the connect was in flight
            release(current);
            return;
        }
        logger.info("Connected to MQTT broker {}", properties.getBrokerUrl());
        subscribe();
    }

    private void subscribe() {
        MqttClient current = client;
        if (!running || current == null || !current.isConnected()) {
            // resubscribed by connectComplete once reconnected
            return;
        }
        try {
            current.subscribe(properties.getTopic(), QOS_AT_LEAST_ONCE);
            logger.info("Subscribed to change notifications on {}", properties.getTopic());
        } catch (MqttException | RuntimeException e) {
            logger.warn("Failed to subscribe to {}, retrying in {} s: {}",
                properties.getTopic(), properties.getRetryIntervalSeconds(), e.getMessage());
            scheduleRetry(this::subscribe);
        }
    }

    /**
     * Creates the Paho client for the configured broker.
     */
    MqttClient createClient() throws MqttException {
        return new MqttClient(properties.getBrokerUrl(), properties.getClientId(), new MemoryPersistence());
    }

    private void release(MqttClient current) {
        try {
            if (current.isConnected()) {
                current.disconnect();
            }
            current.close();
        } catch (MqttException e) {
            logger.warn("Failed to disconnect from MQTT broker {}: {}", properties.getBrokerUrl(), e.getMessage());
        }
    }

    private void scheduleRetry(Runnable task) {
        submit(() -> executor.schedule(task, properties.getRetryIntervalSeconds(), TimeUnit.SECONDS));
    }

    private synchronized void submit(Runnable task) {
        if (!running || executor == null) {
            return;
        }
        try {
            task.run();
        } catch (RejectedExecutionException e) {
            logger.debug("Subscriber is shutting down, dropping scheduled task");
        }
    }

    private MqttConnectOptions connectOptions() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(true);
        options.setCleanSession(true);
        if (username != null && !username.isEmpty()) {
            options.setUserName(username);
        }
        if (password != null && !password.isEmpty()) {
            options.setPassword(password.toCharArray());
        }
        return options;
    }

    @Override
    public void connectComplete(boolean reconnect, String serverURI) {
        // clean sessions drop subscriptions on reconnect
        if (reconnect) {
            logger.info("Reconnected to MQTT broker {}", serverURI);
            submit(() -> executor.execute(this::subscribe));
        }
    }

    @Override
    public void connectionLost(Throwable cause) {
        logger.warn("Lost connection to MQTT broker {}, reconnecting: {}",
            properties.getBrokerUrl(), cause == null ? "unknown cause" : cause.getMessage());
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        try {
            listener.onMessage(topic, message.getPayload());
        } catch (RuntimeException e) {
            logger.warn("Change listener failed for message on {}", topic, e);
        }
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        // never publishes
    }
}
