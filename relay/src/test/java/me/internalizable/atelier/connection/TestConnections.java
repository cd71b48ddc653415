package me.internalizable.atelier.connection;

import com.google.common.base.Ticker;
import io.netty.channel.Channel;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connections in a chosen state, without a handshake.
 */
public final class TestConnections {

    private TestConnections() {
    }

    public static Connection open(Channel channel) {
        Connection connection = new Connection(channel, 0L);
        connection.markUpgraded();
        connection.transition(ConnectionState.CONNECTING, ConnectionState.OPEN);
        return connection;
    }

    public static void markClosed(Connection connection) {
        connection.markClosed();
    }

    /**
     * A ticker that only moves when told to.
     */
    public static final class ManualTicker extends Ticker {
        private final AtomicLong nanos = new AtomicLong();

        @Override
        public long read() {
            return nanos.get();
        }

        public void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }
    }
}
