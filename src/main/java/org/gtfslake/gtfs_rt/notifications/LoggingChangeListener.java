package org.gtfslake.gtfs_rt.notifications;

import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ChangeListener} that only logs the received messages.
 *
 * @since 1.0
 */
@Component
public class LoggingChangeListener implements ChangeListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingChangeListener.class);

    @Override
    public void onMessage(String topic, byte[] payload) {
        logger.info("Change notification on {}: {}", topic, new String(payload, StandardCharsets.UTF_8));
    }
}
