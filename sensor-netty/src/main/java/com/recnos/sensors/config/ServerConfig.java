package com.recnos.sensors.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Properties;

/**
 * Server settings. Defaults are overridden by system properties, which are in
 * turn overridden by the positional command line arguments
 * {@code [port] [queryTimeoutSeconds]}.
 */
public record ServerConfig(
        int port,
        Duration queryTimeout,
        int maxContentLength,
        int workerThreads
) {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final int DEFAULT_PORT = 8080;
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_CONTENT_LENGTH = 65536; // 64KB

    static final String PORT_PROPERTY = "sensors.port";
    static final String QUERY_TIMEOUT_PROPERTY = "sensors.query.timeout.ms";
    static final String MAX_CONTENT_LENGTH_PROPERTY = "sensors.max.content.length";
    static final String WORKER_THREADS_PROPERTY = "sensors.worker.threads";

    public ServerConfig {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port must be in 0..65535");
        if (queryTimeout == null || queryTimeout.isZero() || queryTimeout.isNegative()) {
            throw new IllegalArgumentException("queryTimeout must be > 0");
        }
        if (maxContentLength <= 0) throw new IllegalArgumentException("maxContentLength must be > 0");
        if (workerThreads <= 0) throw new IllegalArgumentException("workerThreads must be > 0");
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_PORT, DEFAULT_QUERY_TIMEOUT, DEFAULT_MAX_CONTENT_LENGTH,
                Runtime.getRuntime().availableProcessors() * 2);
    }

    public ServerConfig withPort(int newPort) {
        return new ServerConfig(newPort, queryTimeout, maxContentLength, workerThreads);
    }

    public ServerConfig withQueryTimeout(Duration newTimeout) {
        return new ServerConfig(port, newTimeout, maxContentLength, workerThreads);
    }

    public static ServerConfig load(String[] args) {
        return load(System.getProperties(), args);
    }

    /**
     * Resolves the configuration. Invalid values are logged and the previous
     * value is kept.
     */
    public static ServerConfig load(Properties properties, String[] args) {
        ServerConfig defaults = defaults();
        int port = intValue(properties.getProperty(PORT_PROPERTY), PORT_PROPERTY, defaults.port());
        long timeoutMs = longValue(properties.getProperty(QUERY_TIMEOUT_PROPERTY), QUERY_TIMEOUT_PROPERTY,
                defaults.queryTimeout().toMillis());
        int maxContentLength = intValue(properties.getProperty(MAX_CONTENT_LENGTH_PROPERTY),
                MAX_CONTENT_LENGTH_PROPERTY, defaults.maxContentLength());
        int workerThreads = intValue(properties.getProperty(WORKER_THREADS_PROPERTY), WORKER_THREADS_PROPERTY,
                defaults.workerThreads());

        if (args.length > 0) {
            port = intValue(args[0], "port argument", port);
        }
        if (args.length > 1) {
            try {
                timeoutMs = Math.multiplyExact(Long.parseLong(args[1].trim()), 1000L);
            } catch (NumberFormatException | ArithmeticException e) {
                logger.error("Invalid query timeout: {}. Using: {} ms", args[1], timeoutMs);
            }
        }

        if (port < 0 || port > 65535) {
            logger.error("Port {} out of range. Using default port: {}", port, DEFAULT_PORT);
            port = DEFAULT_PORT;
        }
        if (timeoutMs <= 0) {
            logger.error("Query timeout must be positive, got {} ms. Using default: {} ms",
                    timeoutMs, DEFAULT_QUERY_TIMEOUT.toMillis());
            timeoutMs = DEFAULT_QUERY_TIMEOUT.toMillis();
        }
        if (maxContentLength <= 0) {
            logger.error("Max content length must be positive, got {}. Using default: {}",
                    maxContentLength, DEFAULT_MAX_CONTENT_LENGTH);
            maxContentLength = DEFAULT_MAX_CONTENT_LENGTH;
        }
        if (workerThreads <= 0) {
            logger.error("Worker threads must be positive, got {}. Using default: {}",
                    workerThreads, defaults.workerThreads());
            workerThreads = defaults.workerThreads();
        }

        return new ServerConfig(port, Duration.ofMillis(timeoutMs), maxContentLength, workerThreads);
    }

    private static int intValue(String raw, String name, int fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.error("Invalid {}: {}. Using: {}", name, raw, fallback);
            return fallback;
        }
    }

    private static long longValue(String raw, String name, long fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.error("Invalid {}: {}. Using: {}", name, raw, fallback);
            return fallback;
        }
    }
}
