package me.internalizable.atelier.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.internalizable.atelier.api.command.CommandDispatcher;
import me.internalizable.atelier.api.command.RelayStatus;
import me.internalizable.atelier.api.error.ChannelNotFoundException;
import me.internalizable.atelier.api.error.CommandFailedException;
import me.internalizable.atelier.api.error.ConnectionLostException;
import me.internalizable.atelier.api.event.PluginEvent;
import me.internalizable.atelier.bridge.RelayBridge;
import me.internalizable.atelier.common.protocol.FrameCodec;
import me.internalizable.atelier.config.RelayConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

final class RelayServerTest {

    private RelayServer server;
    private final List<RelayBridge> bridges = new ArrayList<>();

    @BeforeEach
    void start() throws Exception {
        RelayConfig config = new RelayConfig();
        config.setBindAddress("127.0.0.1");
        config.setBindPort(0);
        config.setCommandTimeoutMillis(5000);
        server = new RelayServer(config);
        server.start();
    }

    @AfterEach
    void stop() {
        bridges.forEach(RelayBridge::close);
        server.stop();
    }

    @Test
    void commandReachesPluginAndResultComesBack() throws Exception {
        RelayBridge bridge = bridge("figma");
        bridge.onCommand("create_rectangle", (tool, params) -> {
            ObjectNode result = FrameCodec.mapper().createObjectNode();
            result.put("id", "1:2");
            result.put("width", params.path("width").asInt());
            return result;
        });
        JsonNode ack = bridge.connect().get(5, TimeUnit.SECONDS);

        Assertions.assertEquals("figma", ack.path("channel").asText());
        Assertions.assertEquals(ack.path("connectionId").asText(), bridge.getConnectionId());

        ObjectNode args = FrameCodec.mapper().createObjectNode().put("width", 120).put("height", 80);
        JsonNode result = server.getCommandDispatcher()
            .execute("create_rectangle", args, "figma")
            .get(5, TimeUnit.SECONDS);

        Assertions.assertEquals("1:2", result.path("id").asText());
        Assertions.assertEquals(120, result.path("width").asInt());
        Assertions.assertEquals(1, server.getStats().getTotalConnections());
    }

    @Test
    void pluginErrorFailsTheCommand() throws Exception {
        RelayBridge bridge = bridge("figma");
        bridge.connect().get(5, TimeUnit.SECONDS);

        CompletableFuture<JsonNode> future = server.getCommandDispatcher().execute("get_selection", null, "figma");

        ExecutionException e = Assertions.assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        CommandFailedException failed = Assertions.assertInstanceOf(CommandFailedException.class, e.getCause());
        Assertions.assertTrue(failed.getMessage().contains("get_selection"));
    }

    @Test
    void emptyChannelIsReportedImmediately() {
        CompletableFuture<JsonNode> future = server.getCommandDispatcher().execute("get_state", null, "blender");

        ExecutionException e = Assertions.assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        Assertions.assertInstanceOf(ChannelNotFoundException.class, e.getCause());
    }

    @Test
    void pluginEventsReachSubscribers() throws Exception {
        CountDownLatch received = new CountDownLatch(1);
        AtomicReference<PluginEvent> seen = new AtomicReference<>();
        server.getEventService().subscribe("figma", "selection_changed", event -> {
            seen.set(event);
            received.countDown();
        });

        RelayBridge bridge = bridge("figma");
        bridge.connect().get(5, TimeUnit.SECONDS);
        bridge.emitEvent("selection_changed", FrameCodec.mapper().createObjectNode().put("count", 2));

        Assertions.assertTrue(received.await(5, TimeUnit.SECONDS));
        Assertions.assertEquals("figma", seen.get().channel());
        Assertions.assertEquals(bridge.getConnectionId(), seen.get().connectionId());
        Assertions.assertEquals(2, seen.get().payload().path("count").asInt());
    }

    @Test
    void relayEventsReachThePlugin() throws Exception {
        CountDownLatch received = new CountDownLatch(1);
        AtomicReference<String> name = new AtomicReference<>();
        RelayBridge bridge = bridge("figma");
        bridge.onEvent((event, params) -> {
            name.set(event);
            received.countDown();
        });
        bridge.connect().get(5, TimeUnit.SECONDS);

        int delivered = server.getCommandDispatcher().broadcastEvent("figma", "theme_changed", null);

        Assertions.assertEquals(1, delivered);
        Assertions.assertTrue(received.await(5, TimeUnit.SECONDS));
        Assertions.assertEquals("theme_changed", name.get());
    }

    @Test
    void disconnectMidFlightFailsWithConnectionLost() throws Exception {
        CountDownLatch commandArrived = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RelayBridge bridge = bridge("blender");
        bridge.onCommand("get_state", (tool, params) -> {
            commandArrived.countDown();
            release.await();
            return null;
        });
        bridge.connect().get(5, TimeUnit.SECONDS);

        CompletableFuture<JsonNode> future = server.getCommandDispatcher().execute("get_state", null, "blender");
        Assertions.assertTrue(commandArrived.await(5, TimeUnit.SECONDS));
        bridge.close();

        ExecutionException e = Assertions.assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        Assertions.assertInstanceOf(ConnectionLostException.class, e.getCause());
        release.countDown();
    }

    @Test
    void statusListsChannelsAndConnections() throws Exception {
        bridge("figma").connect().get(5, TimeUnit.SECONDS);
        bridge("photoshop").connect().get(5, TimeUnit.SECONDS);

        CommandDispatcher dispatcher = server.getCommandDispatcher();
        RelayStatus status = dispatcher.status();

        Assertions.assertEquals(2, status.activeConnections());
        Assertions.assertEquals(List.of("figma", "photoshop"), status.channels());
        Assertions.assertEquals(List.of("blender", "figma", "photoshop"), status.adapters());
        Assertions.assertEquals(RelayServer.VERSION, status.version());
    }

    private RelayBridge bridge(String channel) {
        RelayBridge bridge = RelayBridge.builder(URI.create("ws://127.0.0.1:" + server.getBoundPort() + "/"))
            .channel(channel)
            .application(channel)
            .clientId("test-" + channel)
            .build();
        bridges.add(bridge);
        return bridge;
    }
}
