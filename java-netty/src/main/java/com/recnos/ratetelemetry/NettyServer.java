package com.recnos.ratetelemetry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recnos.ratetelemetry.config.ServerConfig;
import com.recnos.ratetelemetry.dashboard.ConsoleRenderer;
import com.recnos.ratetelemetry.dashboard.DashboardFeed;
import com.recnos.ratetelemetry.handler.HttpRequestHandler;
import com.recnos.ratetelemetry.handler.MetricsRequestHandler;
import com.recnos.ratetelemetry.service.MetricsPublisher;
import com.recnos.ratetelemetry.service.PrometheusMetrics;
import com.recnos.ratetelemetry.telemetry.TelemetryAggregator;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Startup routine for the rate telemetry service.
 *
 * Owns the {@link TelemetryAggregator} and wires it to the ingress pipeline, the Prometheus
 * publisher and the terminal dashboard. Shutdown runs in a fixed order: ingress, sampler,
 * dashboard, metrics endpoint.
 */
public class NettyServer {

    private static final Logger logger = LoggerFactory.getLogger(NettyServer.class);
    private static final int MAX_CONTENT_LENGTH = 65536; // 64KB
    private static final long QUIET_PERIOD_MS = 100;
    private static final long SHUTDOWN_TIMEOUT_MS = 5_000;

    private final ServerConfig config;
    private final TelemetryAggregator aggregator;
    private final PrometheusMetrics metrics;
    private final ConsoleRenderer renderer;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    // accepted ingress connections; closed channels leave the group on their own
    private final ChannelGroup ingressConnections =
            new DefaultChannelGroup("ingress-connections", GlobalEventExecutor.INSTANCE);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel ingressChannel;
    private Channel metricsChannel;

    public NettyServer(ServerConfig config, TelemetryAggregator aggregator, PrometheusMetrics metrics,
                       ConsoleRenderer renderer) {
        this.config = config;
        this.aggregator = aggregator;
        this.metrics = metrics;
        this.renderer = renderer;
        this.objectMapper = HttpRequestHandler.newObjectMapper();

        aggregator.addConsumer(new MetricsPublisher(metrics));
        if (renderer != null) {
            aggregator.addConsumer(new DashboardFeed(renderer));
        }
    }

    public void start() throws InterruptedException {
        int numCores = Runtime.getRuntime().availableProcessors();
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(numCores * 2);

        aggregator.start();

        ingressChannel = bind(config.ingressPort(), ingressConnections,
                () -> new HttpRequestHandler(aggregator, metrics, objectMapper));
        metricsChannel = bind(config.metricsPort(), null,
                () -> new MetricsRequestHandler(metrics));

        logger.info("╔═══════════════════════════════════════════════════════════════╗");
        logger.info("║  Rate Telemetry Server Started Successfully                   ║");
        logger.info("╠═══════════════════════════════════════════════════════════════╣");
        logger.info("║  Ingress Port:            {}                               ║", ingressPort());
        logger.info("║  Metrics Port:            {}                               ║", metricsPort());
        logger.info("║  CPU Cores:               {}                                  ║", numCores);
        logger.info("║  Worker Threads:          {}                                 ║", numCores * 2);
        logger.info("║  Dashboard:               {}                               ║", renderer != null ? "enabled" : "disabled");
        logger.info("╠═══════════════════════════════════════════════════════════════╣");
        logger.info("║  Endpoints:                                                   ║");
        logger.info("║    POST http://localhost:{}/data                            ║", ingressPort());
        logger.info("║    GET  http://localhost:{}/stats                           ║", ingressPort());
        logger.info("║    GET  http://localhost:{}/health                          ║", ingressPort());
        logger.info("║    GET  http://localhost:{}/metrics (Prometheus)            ║", metricsPort());
        logger.info("╠═══════════════════════════════════════════════════════════════╣");
        logger.info("║  Sampling:                                                    ║");
        logger.info("║    ✓ requests_per_second every 1s                            ║");
        logger.info("║    ✓ requests_per_minute every 60s (atomic drain)            ║");
        logger.info("║    ✓ Lock-free event counting (LongAdder)                    ║");
        logger.info("╚═══════════════════════════════════════════════════════════════╝");
    }

    private Channel bind(int port, ChannelGroup connections, Supplier<ChannelHandler> handler)
            throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (connections != null) {
                            connections.add(ch);
                            // accepted while stop() was sweeping the group
                            if (stopped.get()) {
                                ch.close();
                                return;
                            }
                        }
                        ChannelPipeline pipeline = ch.pipeline();

                        // HTTP codec for request/response encoding
                        pipeline.addLast(new HttpServerCodec());

                        // Aggregate HTTP chunks into FullHttpRequest
                        pipeline.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));

                        pipeline.addLast(handler.get());
                    }
                })
                .option(ChannelOption.SO_BACKLOG, 8192)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true);

        return bootstrap.bind(port).sync().channel();
    }

    /**
     * Port the ingress channel is bound to; differs from the configured one when that was 0.
     */
    public int ingressPort() {
        return boundPort(ingressChannel, config.ingressPort());
    }

    public int metricsPort() {
        return boundPort(metricsChannel, config.metricsPort());
    }

    private static int boundPort(Channel channel, int configured) {
        return channel != null ? ((InetSocketAddress) channel.localAddress()).getPort() : configured;
    }

    /**
     * Blocks until the ingress channel is closed.
     */
    public void awaitTermination() throws InterruptedException {
        ingressChannel.closeFuture().sync();
    }

    /**
     * Tears the service down in a fixed order. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down: closing ingress channel and {} open connections", ingressConnections.size());
        if (ingressChannel != null) {
            ingressChannel.close().syncUninterruptibly();
        }
        ingressConnections.close().awaitUninterruptibly();

        logger.info("Shutting down: stopping rate sampler");
        aggregator.close();

        if (renderer != null) {
            logger.info("Shutting down: stopping dashboard");
            renderer.close();
        }

        logger.info("Shutting down: closing metrics endpoint");
        if (metricsChannel != null) {
            metricsChannel.close().syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(QUIET_PERIOD_MS, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                    .syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(QUIET_PERIOD_MS, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                    .syncUninterruptibly();
        }
        logger.info("Shutdown complete");
    }

    public static void main(String[] args) {
        ServerConfig config;
        try {
            config = ServerConfig.load(args);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        PrometheusMetrics metrics = new PrometheusMetrics(CollectorRegistry.defaultRegistry);
        metrics.registerJvmMetrics();

        TelemetryAggregator aggregator = new TelemetryAggregator();
        ConsoleRenderer renderer = config.dashboardEnabled() ? new ConsoleRenderer(System.out) : null;

        NettyServer server = new NettyServer(config, aggregator, metrics, renderer);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "shutdown"));
        try {
            server.start();
            server.awaitTermination();
        } catch (Exception e) {
            logger.error("Failed to start rate telemetry server", e);
            server.stop();
            System.exit(1);
        }
    }
}
