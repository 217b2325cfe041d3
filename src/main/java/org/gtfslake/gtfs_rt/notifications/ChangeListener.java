package org.gtfslake.gtfs_rt.notifications;

/**
 * Receives change notifications published for the lake's realtime tables.
 *
 * <p>This is the hook future cache invalidation will attach to. Implementations
 * run on the subscriber's own thread and must not block for long.</p>
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ChangeListener {

    /**
     * Called once for every received message.
     *
     * @param topic the topic the message was published on
     * @param payload the raw message payload
     */
    void onMessage(String topic, byte[] payload);
}
