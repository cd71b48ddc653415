package me.internalizable.atelier.connection;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.embedded.EmbeddedChannel;
import me.internalizable.atelier.adapter.AdapterRegistry;
import me.internalizable.atelier.channel.ChannelRegistry;
import me.internalizable.atelier.common.protocol.Frame;
import me.internalizable.atelier.common.protocol.FrameCodec;
import me.internalizable.atelier.common.protocol.FrameType;
import me.internalizable.atelier.config.DeliveryMode;
import me.internalizable.atelier.config.ReconnectPolicy;
import me.internalizable.atelier.config.RelayConfig;
import me.internalizable.atelier.routing.MessageRouter;
import me.internalizable.atelier.scheduler.RelayScheduler;
import me.internalizable.atelier.server.RelayStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class ConnectionManagerTest {

    private final TestConnections.ManualTicker ticker = new TestConnections.ManualTicker();
    private final RelayScheduler scheduler = new RelayScheduler(1);
    private final ChannelRegistry registry = new ChannelRegistry();
    private final RelayStats stats = new RelayStats();

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void handshakeTimeoutClosesWithoutJoining() {
        ConnectionManager manager = manager(new RelayConfig());
        EmbeddedChannel socket = new EmbeddedChannel();
        Connection connection = manager.register(socket);

        manager.expireHandshake(connection);
        manager.onChannelClosed(connection);

        Assertions.assertEquals(ConnectionState.CLOSED, connection.getState());
        Assertions.assertEquals(CloseReason.HANDSHAKE_TIMEOUT, connection.getCloseReason());
        Assertions.assertFalse(socket.isActive());
        Assertions.assertEquals(0, registry.channelCount());
        Assertions.assertEquals(0, manager.getConnectionCount());
    }

    @Test
    void handshakeTimeoutIgnoresJoinedConnections() {
        ConnectionManager manager = manager(new RelayConfig());
        Connection connection = manager.register(new EmbeddedChannel());
        manager.handleJoin(connection, Frame.join("default", null));

        manager.expireHandshake(connection);

        Assertions.assertEquals(ConnectionState.OPEN, connection.getState());
    }

    @Test
    void rejectsSocketsOverTheConnectionCap() {
        RelayConfig config = new RelayConfig();
        config.setMaxConnections(1);
        ConnectionManager manager = manager(config);

        Assertions.assertNotNull(manager.register(new EmbeddedChannel()));
        EmbeddedChannel second = new EmbeddedChannel();

        Assertions.assertNull(manager.register(second));
        Assertions.assertFalse(second.isActive());
        Assertions.assertEquals(1, stats.getRejectedConnections());
    }

    @Test
    void joinAckIsWrittenAfterMembership() {
        ConnectionManager manager = manager(new RelayConfig());
        EmbeddedChannel socket = new EmbeddedChannel();
        Connection connection = manager.register(socket);

        manager.handleJoin(connection, Frame.join("studio", null));

        Frame ack = socket.readOutbound();
        Assertions.assertEquals(FrameType.JOIN, ack.type());
        Assertions.assertEquals("studio", ack.channel());
        Assertions.assertEquals(0, ack.result().get("server").get("capabilities").size());
        Assertions.assertEquals("studio", connection.getChannelName());
    }

    @Test
    void joinWithoutChannelUsesApplicationThenRelayDefault() {
        ConnectionManager manager = manager(new RelayConfig());

        Assertions.assertEquals("blender",
            manager.resolveChannel(null, new PluginInfo(null, "blender", null)));
        Assertions.assertEquals("default",
            manager.resolveChannel(" ", new PluginInfo(null, "sketch", null)));
        Assertions.assertEquals("default", manager.resolveChannel(null, PluginInfo.UNKNOWN));
    }

    @Test
    void rejoinRequiredIgnoresPreviousChannel() {
        ConnectionManager manager = manager(new RelayConfig());
        joinAndClose(manager, "studio", "client-1");

        Assertions.assertEquals("default",
            manager.resolveChannel(null, new PluginInfo("client-1", null, null)));
    }

    @Test
    void resumePolicyRestoresPreviousChannelWithinTheWindow() {
        RelayConfig config = new RelayConfig();
        config.setReconnectPolicy(ReconnectPolicy.RESUME_PREVIOUS);
        config.setResumeWindowSeconds(60);
        ConnectionManager manager = manager(config);
        joinAndClose(manager, "studio", "client-1");

        ticker.advance(Duration.ofSeconds(30));
        Assertions.assertEquals("studio",
            manager.resolveChannel(null, new PluginInfo("client-1", null, null)));
        Assertions.assertEquals("project-x",
            manager.resolveChannel("project-x", new PluginInfo("client-1", null, null)));

        ticker.advance(Duration.ofSeconds(31));
        Assertions.assertEquals("default",
            manager.resolveChannel(null, new PluginInfo("client-1", null, null)));
    }

    @Test
    void cleanupRunsOnce() {
        ConnectionManager manager = manager(new RelayConfig());
        Connection connection = manager.register(new EmbeddedChannel());
        manager.handleJoin(connection, Frame.join("default", null));

        manager.onChannelClosed(connection);
        manager.onChannelClosed(connection);

        Assertions.assertEquals(0, manager.getConnectionCount());
        Assertions.assertEquals(0, registry.channelCount());
        Assertions.assertEquals(1, stats.getTotalConnections());
    }

    private void joinAndClose(ConnectionManager manager, String channel, String clientId) {
        Connection connection = manager.register(new EmbeddedChannel());
        ObjectNode params = FrameCodec.mapper().createObjectNode().put("clientId", clientId);
        manager.handleJoin(connection, Frame.join(channel, params));
        Assertions.assertEquals(channel, connection.getChannelName());
        manager.onChannelClosed(connection);
    }

    private ConnectionManager manager(RelayConfig config) {
        MessageRouter router = new MessageRouter(registry, scheduler, DeliveryMode.UNICAST, 100);
        return new ConnectionManager(config, registry, router, AdapterRegistry.withBuiltins(config),
            scheduler, stats, ticker, "test");
    }
}
