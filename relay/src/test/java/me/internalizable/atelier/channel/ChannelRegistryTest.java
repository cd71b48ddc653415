package me.internalizable.atelier.channel;

import io.netty.channel.embedded.EmbeddedChannel;
import me.internalizable.atelier.common.protocol.Frame;
import me.internalizable.atelier.common.protocol.FrameType;
import me.internalizable.atelier.config.DeliveryMode;
import me.internalizable.atelier.connection.Connection;
import me.internalizable.atelier.connection.TestConnections;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

final class ChannelRegistryTest {

    private final ChannelRegistry registry = new ChannelRegistry();

    @Test
    void joiningTwiceKeepsOneMembership() {
        Connection c1 = TestConnections.open(new EmbeddedChannel());

        RelayChannel first = registry.join(c1, "default");
        RelayChannel second = registry.join(c1, "default");

        Assertions.assertSame(first, second);
        Assertions.assertEquals(1, registry.membersOf("default").size());
        Assertions.assertEquals(Optional.of("default"), registry.channelOf(c1));
    }

    @Test
    void joiningAnotherChannelLeavesThePreviousOne() {
        Connection c1 = TestConnections.open(new EmbeddedChannel());
        registry.join(c1, "a");

        registry.join(c1, "b");

        Assertions.assertTrue(registry.getChannel("a").isEmpty());
        Assertions.assertEquals(List.of(c1), registry.membersOf("b"));
        Assertions.assertEquals(List.of("b"), registry.channelNames());
    }

    @Test
    void leavingTheLastMemberEvictsTheChannel() {
        Connection c1 = TestConnections.open(new EmbeddedChannel());
        Connection c2 = TestConnections.open(new EmbeddedChannel());
        registry.join(c1, "default");
        registry.join(c2, "default");

        Assertions.assertEquals(Optional.of("default"), registry.leave(c1));
        Assertions.assertEquals(1, registry.channelCount());
        Assertions.assertEquals(Optional.of("default"), registry.leave(c2));

        Assertions.assertEquals(0, registry.channelCount());
        Assertions.assertTrue(registry.membersOf("default").isEmpty());
        Assertions.assertEquals(Optional.empty(), registry.leave(c2));
        Assertions.assertNull(c2.getChannelName());
    }

    @Test
    void memberSnapshotDoesNotChangeUnderTheReader() {
        Connection c1 = TestConnections.open(new EmbeddedChannel());
        Connection c2 = TestConnections.open(new EmbeddedChannel());
        registry.join(c1, "default");

        List<Connection> snapshot = registry.membersOf("default");
        registry.join(c2, "default");

        Assertions.assertEquals(List.of(c1), snapshot);
        Assertions.assertEquals(List.of(c1, c2), registry.membersOf("default"));
    }

    @Test
    void unicastPicksTheEarliestOpenMember() {
        Connection c1 = TestConnections.open(new EmbeddedChannel());
        Connection c2 = TestConnections.open(new EmbeddedChannel());
        registry.join(c1, "default");
        registry.join(c2, "default");

        Assertions.assertEquals(List.of(c1), registry.selectTargets("default", DeliveryMode.UNICAST));
        Assertions.assertEquals(List.of(c1, c2), registry.selectTargets("default", DeliveryMode.BROADCAST));

        TestConnections.markClosed(c1);
        Assertions.assertEquals(List.of(c2), registry.selectTargets("default", DeliveryMode.UNICAST));
        Assertions.assertTrue(registry.selectTargets("nonexistent", DeliveryMode.UNICAST).isEmpty());
    }

    @Test
    void deliverSkipsTargetsThatLeftAfterSelection() {
        EmbeddedChannel ch1 = new EmbeddedChannel();
        EmbeddedChannel ch2 = new EmbeddedChannel();
        Connection c1 = TestConnections.open(ch1);
        Connection c2 = TestConnections.open(ch2);
        registry.join(c1, "default");
        registry.join(c2, "default");
        List<Connection> targets = registry.selectTargets("default", DeliveryMode.BROADCAST);

        registry.join(c2, "other");
        List<Connection> skipped = registry.deliver("default", targets, Frame.ping(), null);

        Assertions.assertEquals(List.of(c2), skipped);
        Frame written = ch1.readOutbound();
        Assertions.assertEquals(FrameType.PING, written.type());
        Assertions.assertNull(ch2.readOutbound());
    }

    @Test
    void broadcastStaysInsideTheChannel() {
        EmbeddedChannel chA = new EmbeddedChannel();
        EmbeddedChannel chB = new EmbeddedChannel();
        Connection a = TestConnections.open(chA);
        Connection b = TestConnections.open(chB);
        registry.join(a, "A");
        registry.join(b, "B");

        int written = registry.broadcast("A", Frame.event("A", "selection_changed", null));

        Assertions.assertEquals(1, written);
        Frame received = chA.readOutbound();
        Assertions.assertEquals("selection_changed", received.name());
        Assertions.assertNull(chB.readOutbound());
    }

    @Test
    void rejectsBlankChannelNames() {
        Connection c1 = TestConnections.open(new EmbeddedChannel());

        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.join(c1, " "));
    }
}
