package me.internalizable.atelier.connection;

import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;

import javax.annotation.Nonnull;

/**
 * Why the relay (or the peer) ended a connection.
 */
public enum CloseReason {

    HANDSHAKE_FAILED(WebSocketCloseStatus.POLICY_VIOLATION),
    HANDSHAKE_TIMEOUT(WebSocketCloseStatus.POLICY_VIOLATION),
    HEARTBEAT_TIMEOUT(WebSocketCloseStatus.ENDPOINT_UNAVAILABLE),
    PROTOCOL_VIOLATION(WebSocketCloseStatus.PROTOCOL_ERROR),
    TRANSPORT_ERROR(WebSocketCloseStatus.INTERNAL_SERVER_ERROR),
    CAPACITY(WebSocketCloseStatus.TRY_AGAIN_LATER),
    SERVER_SHUTDOWN(WebSocketCloseStatus.ENDPOINT_UNAVAILABLE),
    PEER_CLOSED(WebSocketCloseStatus.NORMAL_CLOSURE);

    private final WebSocketCloseStatus closeStatus;

    CloseReason(WebSocketCloseStatus closeStatus) {
        this.closeStatus = closeStatus;
    }

    @Nonnull
    public WebSocketCloseStatus getCloseStatus() {
        return closeStatus;
    }
}
