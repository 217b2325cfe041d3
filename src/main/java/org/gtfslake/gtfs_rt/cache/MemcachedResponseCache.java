package org.gtfslake.gtfs_rt.cache;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.spy.memcached.AddrUtil;
import net.spy.memcached.ConnectionFactoryBuilder;
import net.spy.memcached.FailureMode;
import net.spy.memcached.MemcachedClient;

/**
 * {@link ResponseCache} backed by a memcached server.
 *
 * <p>Expiry is left to memcached. The spymemcached client is thread-safe and
 * reconnects on its own. Operations against a server that is down are cancelled
 * right away instead of being queued, and every operation is bounded by the
 * configured timeout; both surface as runtime exceptions that the caller is
 * expected to handle.</p>
 *
 * @since 1.0
 */
public class MemcachedResponseCache implements ResponseCache {
    private static final Logger logger = LoggerFactory.getLogger(MemcachedResponseCache.class);

    static {
        // route spymemcached's own logging through SLF4J
        System.setProperty("net.spy.log.LoggerImpl", "net.spy.memcached.compat.log.SLF4JLogger");
    }

    private final MemcachedClient client;

    /**
     * Connects to a memcached server.
     *
     * @param serverEndpoint {@code host:port} of the server
     * @param operationTimeoutMillis upper bound of a single get or set
     * @throws IOException if the client cannot be created
     */
    public MemcachedResponseCache(String serverEndpoint, long operationTimeoutMillis) throws IOException {
        this(new MemcachedClient(
            new ConnectionFactoryBuilder()
                .setFailureMode(FailureMode.Cancel)
                .setOpTimeout(operationTimeoutMillis)
                .setDaemon(true)
                .build(),
            AddrUtil.getAddresses(serverEndpoint)));
        logger.info("Caching feed responses in memcached at {}", serverEndpoint);
    }

    MemcachedResponseCache(MemcachedClient client) {
        this.client = client;
    }

    @Override
    public Optional<byte[]> get(String key) {
        Object value = client.get(key);
        if (value instanceof byte[] bytes) {
            return Optional.of(bytes);
        }
        return Optional.empty();
    }

    @Override
    public void set(String key, byte[] value, int ttlSeconds) {
        client.set(key, ttlSeconds, value);
    }

    /**
     * Closes the connection, waiting briefly for pending writes.
     */
    public void shutdown() {
        client.shutdown(5, TimeUnit.SECONDS);
    }
}
