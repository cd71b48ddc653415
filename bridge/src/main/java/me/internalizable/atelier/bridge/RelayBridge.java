package me.internalizable.atelier.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ChannelPromise;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import me.internalizable.atelier.api.error.ProtocolViolationException;
import me.internalizable.atelier.common.protocol.Frame;
import me.internalizable.atelier.common.protocol.FrameCodec;
import me.internalizable.atelier.common.protocol.FrameError;
import me.internalizable.atelier.common.protocol.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiConsumer;

/**
 * Connects a creative application's plugin host to the Atelier relay.
 *
 * <p>The bridge opens a WebSocket, joins a channel, and answers every {@code command} frame
 * with exactly one {@code response} through the handler registered for that tool. Handlers
 * run on a dedicated thread, never on the socket thread.</p>
 *
 * <pre>{@code
 * RelayBridge bridge = RelayBridge.builder(URI.create("ws://127.0.0.1:9003/"))
 *     .channel("figma")
 *     .application("figma")
 *     .build();
 * bridge.onCommand("get_selection", (tool, params) -> describeSelection());
 * bridge.connect().get();
 * }</pre>
 */
public class RelayBridge implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayBridge.class);
    private static final int MAX_HTTP_CONTENT = 65536;

    private final URI uri;
    private final String channel;
    private final String clientId;
    private final String application;
    private final String version;
    private final boolean answerPings;

    private final Map<String, CommandHandler> handlers = new ConcurrentHashMap<>();
    private final List<BiConsumer<String, JsonNode>> eventListeners = new CopyOnWriteArrayList<>();
    private final ExecutorService handlerExecutor;
    private final EventLoopGroup group;

    private volatile CommandHandler fallback;
    private volatile Channel socket;
    private volatile String connectionId;
    private volatile String joinedChannel;
    private final CompletableFuture<JsonNode> joinFuture = new CompletableFuture<>();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

    private RelayBridge(Builder builder) {
        this.uri = builder.uri;
        this.channel = builder.channel;
        this.clientId = builder.clientId;
        this.application = builder.application;
        this.version = builder.version;
        this.answerPings = builder.answerPings;
        this.handlerExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "Atelier-Bridge-Handler");
            t.setDaemon(true);
            return t;
        });
        this.group = new NioEventLoopGroup(1);
    }

    @Nonnull
    public static Builder builder(@Nonnull URI uri) {
        return new Builder(uri);
    }

    // ==================== Handlers ====================

    /**
     * Register the handler for one tool, replacing any previous one.
     */
    @Nonnull
    public RelayBridge onCommand(@Nonnull String toolName, @Nonnull CommandHandler handler) {
        handlers.put(Objects.requireNonNull(toolName, "toolName"), Objects.requireNonNull(handler, "handler"));
        return this;
    }

    /**
     * Handler for tools without a dedicated one. Without it such tools are answered with
     * an {@code UnknownCommand} error.
     */
    @Nonnull
    public RelayBridge onUnknownCommand(@Nonnull CommandHandler handler) {
        this.fallback = Objects.requireNonNull(handler, "handler");
        return this;
    }

    /**
     * Receive relay-originated events as (name, params).
     */
    @Nonnull
    public RelayBridge onEvent(@Nonnull BiConsumer<String, JsonNode> listener) {
        eventListeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    // ==================== Connection ====================

    /**
     * Open the socket, upgrade it and send the join frame.
     *
     * @return a future completed with the relay's join result, or failed with
     *     {@link JoinRejectedException} when the relay refused the join
     */
    @Nonnull
    public CompletableFuture<JsonNode> connect() {
        if (socket != null) {
            throw new IllegalStateException("Bridge already connected");
        }

        BridgeClientHandler clientHandler = new BridgeClientHandler(
            WebSocketClientHandshakerFactory.newHandshaker(uri, WebSocketVersion.V13, null, false,
                new DefaultHttpHeaders()));

        int port = uri.getPort() == -1 ? 80 : uri.getPort();
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline p = ch.pipeline();
                    p.addLast(new HttpClientCodec());
                    p.addLast(new HttpObjectAggregator(MAX_HTTP_CONTENT));
                    p.addLast(clientHandler);
                }
            });

        bootstrap.connect(uri.getHost(), port).addListener((ChannelFutureListener) connected -> {
            if (!connected.isSuccess()) {
                joinFuture.completeExceptionally(connected.cause());
                return;
            }
            socket = connected.channel();
            socket.closeFuture().addListener(f -> onSocketClosed());
            clientHandler.handshakeFuture().addListener(handshake -> {
                if (handshake.isSuccess()) {
                    sendJoin();
                } else {
                    joinFuture.completeExceptionally(handshake.cause());
                    socket.close();
                }
            });
        });
        return joinFuture;
    }

    private void sendJoin() {
        ObjectNode params = FrameCodec.mapper().createObjectNode();
        params.put(Protocol.PARAM_PROTOCOL_VERSION, Protocol.CURRENT_VERSION);
        if (clientId != null) {
            params.put(Protocol.PARAM_CLIENT_ID, clientId);
        }
        if (application != null) {
            params.put(Protocol.PARAM_APPLICATION, application);
        }
        if (version != null) {
            params.put(Protocol.PARAM_VERSION, version);
        }
        send(Frame.join(channel, params));
    }

    /**
     * Ask the relay to move this connection to another channel.
     */
    public void switchChannel(@Nonnull String newChannel) {
        send(Frame.join(newChannel, null));
    }

    /**
     * Emit an unsolicited event to the relay.
     */
    public void emitEvent(@Nonnull String name, @Nullable ObjectNode params) {
        send(Frame.event(null, name, params));
    }

    /**
     * Write a frame as is. Plugins normally never need this.
     */
    @Nonnull
    public ChannelFuture send(@Nonnull Frame frame) {
        return sendText(FrameCodec.encode(frame));
    }

    /**
     * Write raw text, bypassing frame encoding.
     */
    @Nonnull
    public ChannelFuture sendText(@Nonnull String text) {
        Channel ch = socket;
        if (ch == null) {
            throw new IllegalStateException("Bridge not connected");
        }
        return ch.writeAndFlush(new TextWebSocketFrame(text));
    }

    private void onSocketClosed() {
        LOGGER.info("Bridge {}: socket closed", connectionId == null ? uri : connectionId);
        joinFuture.completeExceptionally(new IllegalStateException("socket closed before join completed"));
        closeFuture.complete(null);
    }

    public boolean isConnected() {
        Channel ch = socket;
        return ch != null && ch.isActive() && joinFuture.isDone() && !joinFuture.isCompletedExceptionally();
    }

    /**
     * Completes when the socket is gone, whichever side closed it.
     */
    @Nonnull
    public CompletableFuture<Void> closeFuture() {
        return closeFuture;
    }

    @Nullable
    public String getConnectionId() {
        return connectionId;
    }

    @Nullable
    public String getJoinedChannel() {
        return joinedChannel;
    }

    /**
     * Send a normal close frame and release the bridge's threads.
     */
    @Override
    public void close() {
        Channel ch = socket;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(new CloseWebSocketFrame()).addListener(f -> ch.close());
            ch.closeFuture().awaitUninterruptibly(2000);
        }
        handlerExecutor.shutdownNow();
        group.shutdownGracefully().syncUninterruptibly();
    }

    // ==================== Inbound ====================

    private void handleFrame(Frame frame) {
        switch (frame.type()) {
            case JOIN -> handleJoinAck(frame);
            case COMMAND -> dispatchCommand(frame);
            case PING -> {
                if (answerPings) {
                    send(Frame.pong());
                }
            }
            case EVENT -> {
                JsonNode params = frame.params() == null ? NullNode.getInstance() : frame.params();
                for (BiConsumer<String, JsonNode> listener : eventListeners) {
                    try {
                        listener.accept(frame.name(), params);
                    } catch (RuntimeException e) {
                        LOGGER.error("Bridge {}: event listener failed for {}", connectionId, frame.name(), e);
                    }
                }
            }
            case PONG -> LOGGER.trace("Bridge {}: pong", connectionId);
            case RESPONSE -> LOGGER.warn("Bridge {}: unexpected response frame {}", connectionId, frame.id());
        }
    }

    private void handleJoinAck(Frame frame) {
        FrameError error = frame.error();
        if (error != null) {
            LOGGER.warn("Bridge: join rejected [{}] {}", error.kind(), error.message());
            joinFuture.completeExceptionally(new JoinRejectedException(error.kind(), error.message()));
            return;
        }
        JsonNode result = frame.result() == null ? NullNode.getInstance() : frame.result();
        connectionId = result.path(Protocol.RESULT_CONNECTION_ID).asText(null);
        joinedChannel = result.path(Protocol.RESULT_CHANNEL).asText(frame.channel());
        LOGGER.info("Bridge {}: joined channel '{}'", connectionId, joinedChannel);
        joinFuture.complete(result);
    }

    private void dispatchCommand(Frame frame) {
        String id = frame.id();
        String tool = frame.name();
        ObjectNode params = frame.params() == null ? FrameCodec.mapper().createObjectNode() : frame.params();
        CommandHandler handler = handlers.getOrDefault(tool, fallback);
        try {
            handlerExecutor.execute(() -> runCommand(id, tool, params, handler));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Bridge {}: dropping command {} - bridge is closing", connectionId, id);
        }
    }

    private void runCommand(String id, String tool, ObjectNode params, @Nullable CommandHandler handler) {
        Frame reply;
        if (handler == null) {
            reply = Frame.errorResponse(id, "UnknownCommand", "No handler for " + tool);
        } else {
            try {
                JsonNode result = handler.handle(tool, params);
                reply = Frame.response(id, result == null ? NullNode.getInstance() : result);
            } catch (CommandRejectedException e) {
                reply = Frame.errorResponse(id, e.getKind(), e.getMessage());
            } catch (Exception e) {
                LOGGER.warn("Bridge {}: command {} ({}) failed", connectionId, id, tool, e);
                reply = Frame.errorResponse(id, "CommandFailed", String.valueOf(e.getMessage()));
            }
        }
        Channel ch = socket;
        if (ch != null && ch.isActive()) {
            send(reply);
        }
    }

    private final class BridgeClientHandler extends SimpleChannelInboundHandler<Object> {
        private final WebSocketClientHandshaker handshaker;
        private ChannelPromise handshakeFuture;

        BridgeClientHandler(WebSocketClientHandshaker handshaker) {
            this.handshaker = handshaker;
        }

        ChannelFuture handshakeFuture() {
            return handshakeFuture;
        }

        @Override
        public void handlerAdded(ChannelHandlerContext ctx) {
            handshakeFuture = ctx.newPromise();
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            handshaker.handshake(ctx.channel());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            Channel ch = ctx.channel();
            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    try {
                        handshaker.finishHandshake(ch, response);
                        handshakeFuture.setSuccess();
                    } catch (WebSocketHandshakeException e) {
                        handshakeFuture.setFailure(e);
                    }
                }
                return;
            }

            if (msg instanceof FullHttpResponse response) {
                throw new IllegalStateException("Unexpected FullHttpResponse (status=" + response.status() + ")");
            }

            if (msg instanceof TextWebSocketFrame text) {
                Frame frame;
                try {
                    frame = FrameCodec.decode(text.text());
                } catch (ProtocolViolationException e) {
                    LOGGER.warn("Bridge {}: undecodable frame from relay: {}", connectionId, e.getMessage());
                    return;
                }
                handleFrame(frame);
            } else if (msg instanceof PingWebSocketFrame ping) {
                ch.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            } else if (msg instanceof CloseWebSocketFrame close) {
                LOGGER.info("Bridge {}: relay closed the connection ({} {})",
                    connectionId, close.statusCode(), close.reasonText());
                ch.close();
            } else if (msg instanceof WebSocketFrame frame) {
                LOGGER.debug("Bridge {}: ignoring {}", connectionId, frame.getClass().getSimpleName());
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOGGER.error("Bridge {}: Exception in client handler", connectionId, cause);
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(cause);
            }
            ctx.close();
        }
    }

    public static final class Builder {
        private final URI uri;
        private String channel;
        private String clientId;
        private String application;
        private String version;
        private boolean answerPings = true;

        private Builder(URI uri) {
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        /**
         * Channel to join; when unset the relay picks one.
         */
        @Nonnull
        public Builder channel(@Nullable String channel) {
            this.channel = channel;
            return this;
        }

        @Nonnull
        public Builder clientId(@Nullable String clientId) {
            this.clientId = clientId;
            return this;
        }

        @Nonnull
        public Builder application(@Nullable String application) {
            this.application = application;
            return this;
        }

        @Nonnull
        public Builder version(@Nullable String version) {
            this.version = version;
            return this;
        }

        /**
         * Whether relay pings get a pong. Only tests turn this off.
         */
        @Nonnull
        public Builder answerPings(boolean answerPings) {
            this.answerPings = answerPings;
            return this;
        }

        @Nonnull
        public RelayBridge build() {
            return new RelayBridge(this);
        }
    }
}
