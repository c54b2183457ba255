package com.recnos.sensors;

import com.recnos.sensors.config.ServerConfig;
import com.recnos.sensors.handler.HttpRequestHandler;
import com.recnos.sensors.metrics.SensorMetrics;
import com.recnos.sensors.service.AggregatorRegistry;
import com.recnos.sensors.service.QueryCoordinator;
import com.recnos.sensors.service.SensorIngestService;
import com.recnos.sensors.service.VehicleBatchParser;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.hotspot.DefaultExports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server for traffic sensor ingestion and cross-location queries.
 */
public class SensorServer {

    private static final Logger logger = LoggerFactory.getLogger(SensorServer.class);

    private final ServerConfig config;
    private final SensorMetrics metrics;
    private final AggregatorRegistry registry = new AggregatorRegistry();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ExecutorService businessExecutor;
    private ExecutorService snapshotExecutor;
    private volatile Channel serverChannel;

    public SensorServer(ServerConfig config, CollectorRegistry collectorRegistry) {
        this.config = config;
        this.metrics = new SensorMetrics(collectorRegistry);
    }

    public AggregatorRegistry registry() {
        return registry;
    }

    /**
     * Binds the server socket and returns once it is accepting connections.
     */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started");
        }

        // Unbounded like a thread-per-task executor, so waiting queries never
        // starve ingestion of a thread
        businessExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("sensors-business", true));
        snapshotExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("sensors-snapshot", true));

        SensorIngestService ingestService = new SensorIngestService(registry, new VehicleBatchParser(), metrics);
        QueryCoordinator queryCoordinator =
                new QueryCoordinator(registry, snapshotExecutor, config.queryTimeout(), metrics);

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.workerThreads());

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new LoggingHandler(LogLevel.DEBUG))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        // HTTP codec for request/response encoding
                        pipeline.addLast(new HttpServerCodec());

                        // Aggregate HTTP chunks into FullHttpRequest
                        pipeline.addLast(new HttpObjectAggregator(config.maxContentLength()));

                        pipeline.addLast(new HttpRequestHandler(
                                ingestService, registry, queryCoordinator, metrics, businessExecutor));
                    }
                })
                .option(ChannelOption.SO_BACKLOG, 1024)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true);

        try {
            serverChannel = bootstrap.bind(config.port()).sync().channel();
        } catch (Exception e) {
            shutdownResources();
            throw e;
        }

        int boundPort = port();
        logger.info("╔═══════════════════════════════════════════════════════════════╗");
        logger.info("║  Sensor Server Started Successfully                           ║");
        logger.info("╠═══════════════════════════════════════════════════════════════╣");
        logger.info(bannerLine("Port:                    " + boundPort));
        logger.info(bannerLine("Worker Threads:          " + config.workerThreads()));
        logger.info(bannerLine("Query Timeout:           " + config.queryTimeout().toMillis() + " ms"));
        logger.info(bannerLine("Max Content Length:      " + config.maxContentLength() / 1024 + " KB"));
        logger.info("╠═══════════════════════════════════════════════════════════════╣");
        logger.info("║  Endpoints:                                                   ║");
        logger.info(bannerLine("  POST http://localhost:" + boundPort + "/sensorapi/data"));
        logger.info(bannerLine("  GET  http://localhost:" + boundPort + "/api/locations"));
        logger.info(bannerLine("  GET  http://localhost:" + boundPort + "/api/data[?location=&vehicle=]"));
        logger.info(bannerLine("  GET  http://localhost:" + boundPort + "/health"));
        logger.info(bannerLine("  GET  http://localhost:" + boundPort + "/metrics"));
        logger.info("╚═══════════════════════════════════════════════════════════════╝");
    }

    /**
     * Pads a banner row to the box width and closes it.
     */
    static String bannerLine(String text) {
        return String.format("║  %-61s║", text);
    }

    /**
     * @return the port actually bound, which differs from the configured one when that was 0
     */
    public int port() {
        if (serverChannel == null) {
            throw new IllegalStateException("Server not started");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void blockUntilShutdown() throws InterruptedException {
        Channel channel = serverChannel;
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        logger.info("Shutting down sensor server...");
        serverChannel.close().syncUninterruptibly();
        serverChannel = null;
        shutdownResources();
    }

    private void shutdownResources() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (businessExecutor != null) {
            businessExecutor.shutdownNow();
        }
        if (snapshotExecutor != null) {
            snapshotExecutor.shutdownNow();
        }
    }

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.load(args);

        // JVM metrics (GC, memory pools, threads) on the default registry
        DefaultExports.initialize();

        SensorServer server = new SensorServer(config, CollectorRegistry.defaultRegistry);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "sensors-shutdown"));
        try {
            server.start();
            server.blockUntilShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted, stopping server");
        } catch (Exception e) {
            logger.error("Failed to start sensor server", e);
            System.exit(1);
        } finally {
            server.stop();
        }
    }
}
