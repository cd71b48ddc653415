package me.internalizable.atelier.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import me.internalizable.atelier.api.event.PluginEvent;
import me.internalizable.atelier.common.protocol.Frame;
import me.internalizable.atelier.common.protocol.FrameCodec;
import me.internalizable.atelier.common.protocol.FrameType;
import me.internalizable.atelier.config.RelayConfig;
import me.internalizable.atelier.connection.CloseReason;
import me.internalizable.atelier.connection.Connection;
import me.internalizable.atelier.connection.ConnectionState;
import me.internalizable.atelier.connection.TestConnections;
import me.internalizable.atelier.event.LocalEventService;
import me.internalizable.atelier.server.RelayServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

final class RelayFrameHandlerTest {

    private final TestConnections.ManualTicker ticker = new TestConnections.ManualTicker();
    private final RelayServer server = new RelayServer(new RelayConfig(), ticker, new LocalEventService(Runnable::run));

    private EmbeddedChannel socket;
    private Connection connection;

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void joinOpensTheConnectionAndAcknowledges() {
        accept();

        inbound("{\"type\":\"join\",\"channel\":\"default\",\"params\":{\"protocolVersion\":1,\"application\":\"figma\"}}");

        Frame ack = outbound();
        Assertions.assertEquals(FrameType.JOIN, ack.type());
        Assertions.assertFalse(ack.hasError());
        JsonNode result = ack.result();
        Assertions.assertEquals(connection.getId(), result.get("connectionId").asText());
        Assertions.assertEquals("default", result.get("channel").asText());
        Assertions.assertEquals(1, result.get("protocolVersion").asInt());
        Assertions.assertEquals("atelier-relay", result.get("server").get("name").asText());
        Assertions.assertTrue(containsText(result.get("server").get("capabilities"), "create_rectangle"));

        Assertions.assertEquals(ConnectionState.OPEN, connection.getState());
        Assertions.assertEquals("figma", connection.getPluginInfo().application());
        Assertions.assertEquals(List.of(connection), server.getChannelRegistry().membersOf("default"));
    }

    @Test
    void nonJoinFirstFrameFailsTheHandshake() {
        accept();

        inbound("{\"type\":\"ping\"}");

        Frame rejection = outbound();
        Assertions.assertEquals(FrameType.JOIN, rejection.type());
        Assertions.assertEquals("ProtocolViolation", rejection.error().kind());
        assertClosedWith(WebSocketCloseStatus.POLICY_VIOLATION);
        Assertions.assertEquals(CloseReason.HANDSHAKE_FAILED, connection.getCloseReason());
        Assertions.assertEquals(0, server.getChannelRegistry().channelCount());
    }

    @Test
    void unsupportedProtocolVersionFailsTheHandshake() {
        accept();

        inbound("{\"type\":\"join\",\"channel\":\"default\",\"params\":{\"protocolVersion\":2}}");

        Frame rejection = outbound();
        Assertions.assertTrue(rejection.error().message().contains("unsupported protocol version"));
        assertClosedWith(WebSocketCloseStatus.POLICY_VIOLATION);
        Assertions.assertTrue(server.getChannelRegistry().membersOf("default").isEmpty());
    }

    @Test
    void malformedFirstFrameFailsTheHandshake() {
        accept();

        inbound("{\"type\":");

        Frame rejection = outbound();
        Assertions.assertEquals("ProtocolViolation", rejection.error().kind());
        assertClosedWith(WebSocketCloseStatus.POLICY_VIOLATION);
        Assertions.assertEquals(1, server.getStats().getProtocolErrors());
    }

    @Test
    void pluginCommandIsAProtocolViolation() {
        accept();
        join("default");

        inbound("{\"id\":\"x1\",\"type\":\"command\",\"name\":\"delete_node\"}");

        assertClosedWith(WebSocketCloseStatus.PROTOCOL_ERROR);
        Assertions.assertEquals(CloseReason.PROTOCOL_VIOLATION, connection.getCloseReason());
        Assertions.assertEquals(0, server.getChannelRegistry().channelCount());
    }

    @Test
    void binaryDataIsAProtocolViolation() {
        accept();
        join("default");

        socket.writeInbound(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(new byte[]{1, 2, 3})));
        socket.runPendingTasks();

        assertClosedWith(WebSocketCloseStatus.PROTOCOL_ERROR);
    }

    @Test
    void pingIsAnsweredWithPong() {
        accept();
        join("default");

        inbound("{\"type\":\"ping\"}");

        Assertions.assertEquals(FrameType.PONG, outbound().type());
        Assertions.assertTrue(socket.isActive());
    }

    @Test
    void responseFrameResolvesDispatchedCommand() throws Exception {
        accept();
        join("default");
        ObjectNode args = FrameCodec.mapper().createObjectNode().put("x", 0).put("y", 0).put("w", 10).put("h", 10);

        CompletableFuture<JsonNode> result = server.getCommandDispatcher().execute("create_rectangle", args, "default");
        Frame command = outbound();
        inbound("{\"id\":\"" + command.id() + "\",\"type\":\"response\",\"result\":{\"nodeId\":\"r1\"}}");

        Assertions.assertEquals("r1", result.get(1, TimeUnit.SECONDS).get("nodeId").asText());
    }

    @Test
    void closingMidFlightFailsTheCommandAndEvictsTheChannel() {
        accept();
        join("default");

        CompletableFuture<JsonNode> result = server.getCommandDispatcher()
            .execute("get_selection", null, "default");
        outbound();
        socket.close();
        socket.runPendingTasks();

        Assertions.assertTrue(result.isCompletedExceptionally());
        Assertions.assertEquals(ConnectionState.CLOSED, connection.getState());
        Assertions.assertEquals(0, server.getChannelRegistry().channelCount());
        Assertions.assertEquals(0, server.getMessageRouter().pendingCount());
        Assertions.assertEquals(0, server.getConnectionManager().getConnectionCount());
    }

    @Test
    void eventsReachSubscribers() {
        List<PluginEvent> events = new ArrayList<>();
        server.getEventService().subscribe("default", "selection_changed", events::add);
        accept();
        join("default");

        inbound("{\"type\":\"event\",\"name\":\"selection_changed\",\"params\":{\"count\":2}}");

        Assertions.assertEquals(1, events.size());
        PluginEvent event = events.get(0);
        Assertions.assertEquals("default", event.channel());
        Assertions.assertEquals(connection.getId(), event.connectionId());
        Assertions.assertEquals(2, event.payload().get("count").asInt());
    }

    @Test
    void silentConnectionIsClosedAfterIntervalAndGrace() {
        accept();
        join("default");

        ticker.advance(Duration.ofSeconds(25));
        Assertions.assertEquals(0, server.getConnectionManager().sweepHeartbeats());
        Assertions.assertEquals(FrameType.PING, outbound().type());

        inbound("{\"type\":\"pong\"}");
        ticker.advance(Duration.ofSeconds(25));
        Assertions.assertEquals(0, server.getConnectionManager().sweepHeartbeats());
        outbound();

        ticker.advance(Duration.ofSeconds(31));
        Assertions.assertEquals(1, server.getConnectionManager().sweepHeartbeats());
        assertClosedWith(WebSocketCloseStatus.ENDPOINT_UNAVAILABLE);
        Assertions.assertEquals(CloseReason.HEARTBEAT_TIMEOUT, connection.getCloseReason());
    }

    @Test
    void rejoinMovesTheConnectionToAnotherChannel() {
        accept();
        join("default");

        inbound("{\"type\":\"join\",\"channel\":\"blender\"}");

        Frame ack = outbound();
        Assertions.assertEquals("blender", ack.result().get("channel").asText());
        Assertions.assertTrue(server.getChannelRegistry().getChannel("default").isEmpty());
        Assertions.assertEquals(List.of(connection), server.getChannelRegistry().membersOf("blender"));
    }

    // ==================== Helpers ====================

    private void accept() {
        socket = new EmbeddedChannel();
        connection = server.getConnectionManager().register(socket);
        Assertions.assertNotNull(connection);
        socket.pipeline().addLast(new RelayFrameCodec(false), new RelayFrameHandler(server, connection));
        connection.markUpgraded();
    }

    private void join(String channel) {
        inbound("{\"type\":\"join\",\"channel\":\"" + channel + "\"}");
        Frame ack = outbound();
        Assertions.assertFalse(ack.hasError());
    }

    private void inbound(String json) {
        socket.writeInbound(new TextWebSocketFrame(json));
        socket.runPendingTasks();
    }

    private Frame outbound() {
        Object message = socket.readOutbound();
        Assertions.assertInstanceOf(TextWebSocketFrame.class, message);
        TextWebSocketFrame text = (TextWebSocketFrame) message;
        try {
            return FrameCodec.decode(text.text());
        } finally {
            text.release();
        }
    }

    private void assertClosedWith(WebSocketCloseStatus status) {
        Object message = socket.readOutbound();
        Assertions.assertInstanceOf(CloseWebSocketFrame.class, message);
        CloseWebSocketFrame close = (CloseWebSocketFrame) message;
        try {
            Assertions.assertEquals(status.code(), close.statusCode());
        } finally {
            close.release();
        }
        socket.runPendingTasks();
        Assertions.assertFalse(socket.isActive());
        Assertions.assertEquals(ConnectionState.CLOSED, connection.getState());
    }

    private static boolean containsText(JsonNode array, String value) {
        for (JsonNode node : array) {
            if (value.equals(node.asText())) {
                return true;
            }
        }
        return false;
    }
}
