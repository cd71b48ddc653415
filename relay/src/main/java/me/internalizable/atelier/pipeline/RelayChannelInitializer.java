package me.internalizable.atelier.pipeline;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import me.internalizable.atelier.config.RelayConfig;
import me.internalizable.atelier.connection.Connection;
import me.internalizable.atelier.server.RelayServer;

import javax.annotation.Nonnull;
import java.util.concurrent.TimeUnit;

/**
 * Builds the pipeline of an accepted socket: HTTP upgrade, WebSocket framing, the JSON frame
 * codec and the per-connection handler.
 */
public class RelayChannelInitializer extends ChannelInitializer<SocketChannel> {

    private static final int MAX_HTTP_CONTENT = 65536;

    private final RelayServer relayServer;
    private final RelayFrameCodec frameCodec;

    public RelayChannelInitializer(@Nonnull RelayServer relayServer) {
        this.relayServer = relayServer;
        this.frameCodec = new RelayFrameCodec(relayServer.getConfig().isDebugMode());
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        Connection connection = relayServer.getConnectionManager().register(ch);
        if (connection == null) {
            return;
        }

        RelayConfig config = relayServer.getConfig();
        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
            .websocketPath(config.getWebsocketPath())
            .maxFramePayloadLength(config.getMaxFrameBytes())
            .handshakeTimeoutMillis(TimeUnit.SECONDS.toMillis(config.getHandshakeTimeoutSeconds()))
            .checkStartsWith(false)
            .build();

        ChannelPipeline pipeline = ch.pipeline();
        pipeline.addLast("http-codec", new HttpServerCodec());
        pipeline.addLast("http-aggregator", new HttpObjectAggregator(MAX_HTTP_CONTENT));
        pipeline.addLast("websocket", new WebSocketServerProtocolHandler(wsConfig));
        pipeline.addLast("websocket-aggregator", new WebSocketFrameAggregator(config.getMaxFrameBytes()));
        pipeline.addLast("frame-codec", frameCodec);
        pipeline.addLast("handler", new RelayFrameHandler(relayServer, connection));
    }
}
