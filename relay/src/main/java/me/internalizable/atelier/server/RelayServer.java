package me.internalizable.atelier.server;

import com.google.common.base.Ticker;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import me.internalizable.atelier.adapter.AdapterRegistry;
import me.internalizable.atelier.api.command.CommandDispatcher;
import me.internalizable.atelier.channel.ChannelRegistry;
import me.internalizable.atelier.config.RelayConfig;
import me.internalizable.atelier.connection.ConnectionManager;
import me.internalizable.atelier.dispatch.RelayCommandDispatcher;
import me.internalizable.atelier.event.LocalEventService;
import me.internalizable.atelier.pipeline.RelayChannelInitializer;
import me.internalizable.atelier.routing.MessageRouter;
import me.internalizable.atelier.scheduler.RelayScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.net.InetSocketAddress;

/**
 * The Atelier relay: a WebSocket server that plugins connect to, and the
 * {@link CommandDispatcher} callers use to reach them.
 */
public class RelayServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayServer.class);

    public static final String VERSION = "1.0.0";

    private final RelayConfig config;
    private final RelayStats stats;
    private final RelayScheduler scheduler;
    private final ChannelRegistry channelRegistry;
    private final AdapterRegistry adapterRegistry;
    private final MessageRouter messageRouter;
    private final ConnectionManager connectionManager;
    private final LocalEventService eventService;
    private final RelayCommandDispatcher commandDispatcher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile boolean running = false;

    public RelayServer(@Nonnull RelayConfig config) {
        this(config, Ticker.systemTicker(), new LocalEventService());
    }

    public RelayServer(@Nonnull RelayConfig config, @Nonnull Ticker ticker, @Nonnull LocalEventService eventService) {
        config.validate();
        this.config = config;
        this.stats = new RelayStats();
        this.scheduler = new RelayScheduler();
        this.channelRegistry = new ChannelRegistry();
        this.adapterRegistry = AdapterRegistry.withBuiltins(config);
        this.messageRouter = new MessageRouter(channelRegistry, scheduler,
            config.getDeliveryMode(), config.getMaxPendingRequests());
        this.connectionManager = new ConnectionManager(config, channelRegistry, messageRouter,
            adapterRegistry, scheduler, stats, ticker, VERSION);
        this.eventService = eventService;
        this.commandDispatcher = new RelayCommandDispatcher(config, channelRegistry, messageRouter,
            adapterRegistry, connectionManager, stats, VERSION);
    }

    /**
     * Bind the WebSocket listener and start heartbeats.
     */
    public void start() throws InterruptedException {
        if (running) {
            throw new IllegalStateException("Relay server is already running");
        }

        LOGGER.info("Starting Atelier relay {}...", VERSION);
        LOGGER.info("Bind address: {}:{}{}", config.getBindAddress(), config.getBindPort(), config.getWebsocketPath());
        LOGGER.info("Delivery mode: {}, reconnect policy: {}", config.getDeliveryMode(), config.getReconnectPolicy());
        LOGGER.info("Debug mode: {}", config.isDebugMode());

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .option(ChannelOption.SO_BACKLOG, 128)
            .childOption(ChannelOption.TCP_NODELAY, true)
            .childOption(ChannelOption.SO_KEEPALIVE, true)
            .childHandler(new RelayChannelInitializer(this));

        InetSocketAddress bindAddress = new InetSocketAddress(config.getBindAddress(), config.getBindPort());
        try {
            serverChannel = bootstrap.bind(bindAddress).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw e;
        }

        connectionManager.startHeartbeats();
        running = true;

        LOGGER.info("Atelier relay started on {}", serverChannel.localAddress());
        LOGGER.info("Channel adapters:");
        config.getChannelAdapters().forEach((channel, adapter) -> LOGGER.info("  - {} -> {}", channel, adapter));
    }

    /**
     * Stop accepting, fail whatever is still in flight and close every connection.
     */
    public void stop() {
        if (!running) {
            scheduler.shutdown();
            eventService.shutdown();
            return;
        }

        LOGGER.info("Stopping Atelier relay...");
        running = false;

        connectionManager.stopHeartbeats();

        // close the listener first so no new sockets arrive
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }

        messageRouter.failAll("relay shutting down");
        connectionManager.closeAll();

        if (workerGroup != null) {
            workerGroup.shutdownGracefully().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().syncUninterruptibly();
        }

        scheduler.shutdown();
        eventService.shutdown();

        LOGGER.info("Atelier relay stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * The port actually bound, which differs from the configured one when that was 0.
     */
    public int getBoundPort() {
        if (serverChannel == null) {
            throw new IllegalStateException("Relay server is not started");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Nonnull
    public RelayConfig getConfig() {
        return config;
    }

    @Nonnull
    public RelayStats getStats() {
        return stats;
    }

    @Nonnull
    public RelayScheduler getScheduler() {
        return scheduler;
    }

    @Nonnull
    public ChannelRegistry getChannelRegistry() {
        return channelRegistry;
    }

    @Nonnull
    public AdapterRegistry getAdapterRegistry() {
        return adapterRegistry;
    }

    @Nonnull
    public MessageRouter getMessageRouter() {
        return messageRouter;
    }

    @Nonnull
    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    @Nonnull
    public LocalEventService getEventService() {
        return eventService;
    }

    @Nonnull
    public CommandDispatcher getCommandDispatcher() {
        return commandDispatcher;
    }
}
