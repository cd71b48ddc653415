package me.internalizable.atelier.pipeline;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import me.internalizable.atelier.common.protocol.Frame;
import me.internalizable.atelier.common.protocol.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns text WebSocket frames into {@link Frame}s and back.
 *
 * <p>Malformed text surfaces as a {@code DecoderException} wrapping a
 * {@link me.internalizable.atelier.api.error.ProtocolViolationException}. Other WebSocket
 * frame types pass through untouched.</p>
 */
@ChannelHandler.Sharable
public class RelayFrameCodec extends MessageToMessageCodec<TextWebSocketFrame, Frame> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayFrameCodec.class);

    private final boolean debugMode;

    public RelayFrameCodec(boolean debugMode) {
        this.debugMode = debugMode;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Frame frame, List<Object> out) {
        String text = FrameCodec.encode(frame);
        if (debugMode) {
            LOGGER.debug("[{}] -> {}", ctx.channel().remoteAddress(), text);
        }
        out.add(new TextWebSocketFrame(text));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, TextWebSocketFrame msg, List<Object> out) {
        String text = msg.text();
        if (debugMode) {
            LOGGER.debug("[{}] <- {}", ctx.channel().remoteAddress(), text);
        }
        out.add(FrameCodec.decode(text));
    }
}
