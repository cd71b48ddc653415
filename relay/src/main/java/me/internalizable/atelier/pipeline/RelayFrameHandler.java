package me.internalizable.atelier.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import me.internalizable.atelier.api.error.ErrorKind;
import me.internalizable.atelier.api.error.ProtocolViolationException;
import me.internalizable.atelier.api.event.PluginEvent;
import me.internalizable.atelier.common.protocol.Frame;
import me.internalizable.atelier.common.protocol.FrameCodec;
import me.internalizable.atelier.common.protocol.FrameType;
import me.internalizable.atelier.connection.CloseReason;
import me.internalizable.atelier.connection.Connection;
import me.internalizable.atelier.connection.ConnectionManager;
import me.internalizable.atelier.connection.ConnectionState;
import me.internalizable.atelier.server.RelayServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.time.Instant;

/**
 * Handles frames from one plugin connection.
 *
 * <ul>
 *   <li>{@code join} - handshake, or a move to another channel once open</li>
 *   <li>{@code response} - handed to the router</li>
 *   <li>{@code event} - handed to the event service</li>
 *   <li>{@code ping} - answered with {@code pong}</li>
 *   <li>{@code command} - not allowed from a plugin, closes the connection</li>
 * </ul>
 */
public class RelayFrameHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayFrameHandler.class);

    private final RelayServer relayServer;
    private final Connection connection;

    public RelayFrameHandler(@Nonnull RelayServer relayServer, @Nonnull Connection connection) {
        this.relayServer = relayServer;
        this.connection = connection;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        ConnectionManager manager = relayServer.getConnectionManager();

        if (msg instanceof FullHttpRequest request) {
            // anything but an upgrade on the WebSocket path
            LOGGER.debug("Connection {}: rejecting HTTP {} {}", connection.getId(), request.method(), request.uri());
            FullHttpResponse response = new DefaultFullHttpResponse(request.protocolVersion(), HttpResponseStatus.NOT_FOUND);
            response.headers().set(HttpHeaderNames.CONTENT_LENGTH, 0);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
            return;
        }

        if (msg instanceof WebSocketFrame frame) {
            manager.onFrameReceived(connection);
            manager.protocolViolation(connection, "unsupported " + frame.getClass().getSimpleName());
            return;
        }

        if (!(msg instanceof Frame frame)) {
            LOGGER.warn("Connection {}: Received unknown message type: {}", connection.getId(), msg.getClass().getName());
            return;
        }

        manager.onFrameReceived(connection);

        if (connection.getState() == ConnectionState.CONNECTING && frame.type() != FrameType.JOIN) {
            manager.protocolViolation(connection, "expected join, got " + frame.type().getWireName());
            return;
        }

        switch (frame.type()) {
            case JOIN -> manager.handleJoin(connection, frame);
            case RESPONSE -> relayServer.getMessageRouter().resolve(connection.getId(), frame);
            case EVENT -> handleEvent(frame);
            case PING -> connection.send(Frame.pong());
            case PONG -> LOGGER.trace("Connection {}: pong", connection.getId());
            case COMMAND -> manager.protocolViolation(connection, "plugins may not send commands");
        }
    }

    private void handleEvent(Frame frame) {
        String channel = connection.getChannelName();
        if (channel == null || !connection.isOpen()) {
            LOGGER.debug("Connection {}: dropping event {} - not in a channel", connection.getId(), frame.name());
            return;
        }
        JsonNode payload = frame.params() == null ? FrameCodec.mapper().createObjectNode() : frame.params();
        relayServer.getEventService().publish(
            new PluginEvent(channel, connection.getId(), frame.name(), payload, Instant.now()));
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete handshake) {
            connection.markUpgraded();
            LOGGER.debug("Connection {}: WebSocket upgrade complete on {}", connection.getId(), handshake.requestUri());
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        relayServer.getConnectionManager().onChannelClosed(connection);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        ConnectionManager manager = relayServer.getConnectionManager();
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;

        if (root instanceof ProtocolViolationException violation) {
            manager.protocolViolation(connection, violation.getMessage());
            return;
        }
        if (root instanceof IOException) {
            LOGGER.info("Connection {}: transport error: {}", connection.getId(), root.getMessage());
            ctx.close();
            return;
        }

        LOGGER.error("Connection {}: Exception in relay handler", connection.getId(), cause);
        if (connection.getState() == ConnectionState.CONNECTING) {
            manager.failHandshake(connection, CloseReason.TRANSPORT_ERROR, ErrorKind.PROTOCOL_VIOLATION, "internal error");
        } else {
            manager.close(connection, CloseReason.TRANSPORT_ERROR, "internal error");
        }
    }
}
