package me.internalizable.atelier.routing;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.embedded.EmbeddedChannel;
import me.internalizable.atelier.api.command.Command;
import me.internalizable.atelier.api.error.CommandFailedException;
import me.internalizable.atelier.api.error.ConnectionLostException;
import me.internalizable.atelier.api.error.RelayTimeoutException;
import me.internalizable.atelier.channel.ChannelRegistry;
import me.internalizable.atelier.common.protocol.Frame;
import me.internalizable.atelier.common.protocol.FrameCodec;
import me.internalizable.atelier.config.DeliveryMode;
import me.internalizable.atelier.connection.Connection;
import me.internalizable.atelier.connection.TestConnections;
import me.internalizable.atelier.scheduler.RelayScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class MessageRouterConcurrencyTest {

    private static final int CHANNELS = 4;
    private static final int COMMANDS_PER_CHANNEL = 100;
    private static final int REPLIES_PER_COMMAND = 2;

    private final ChannelRegistry registry = new ChannelRegistry();
    private final RelayScheduler scheduler = new RelayScheduler(2);
    private final MessageRouter router = new MessageRouter(registry, scheduler, DeliveryMode.UNICAST, 10_000);
    private final ExecutorService workers = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() throws InterruptedException {
        workers.shutdownNow();
        Assertions.assertTrue(workers.awaitTermination(5, TimeUnit.SECONDS));
        scheduler.shutdown();
    }

    @RepeatedTest(5)
    void racingRepliesDeadlinesAndDisconnectsResolveEachCommandOnce() throws Exception {
        List<Connection> connections = new ArrayList<>();
        List<EmbeddedChannel> sockets = new ArrayList<>();
        for (int c = 0; c < CHANNELS; c++) {
            EmbeddedChannel socket = new EmbeddedChannel();
            Connection connection = TestConnections.open(socket);
            registry.join(connection, "ch-" + c);
            connections.add(connection);
            sockets.add(socket);
        }

        List<CompletableFuture<JsonNode>> futures = new ArrayList<>();
        List<CompletableFuture<JsonNode>> observed = new ArrayList<>();
        Map<CompletableFuture<JsonNode>, AtomicInteger> completions = new ConcurrentHashMap<>();
        List<Runnable> tasks = new ArrayList<>();
        AtomicInteger acceptedReplies = new AtomicInteger();
        AtomicInteger rejectedReplies = new AtomicInteger();
        Map<String, AtomicInteger> acceptedById = new ConcurrentHashMap<>();

        for (int c = 0; c < CHANNELS; c++) {
            Connection connection = connections.get(c);
            for (int i = 0; i < COMMANDS_PER_CHANNEL; i++) {
                // every third command gets a deadline short enough to race its replies
                Duration timeout = i % 3 == 0 ? Duration.ofMillis(1) : Duration.ofSeconds(30);
                CompletableFuture<JsonNode> future = router.send(command("ch-" + c, i), timeout);
                AtomicInteger count = new AtomicInteger();
                completions.put(future, count);
                observed.add(future.whenComplete((result, error) -> count.incrementAndGet()));
                futures.add(future);

                Frame sent = sockets.get(c).readOutbound();
                String id = sent.id();
                acceptedById.put(id, new AtomicInteger());
                for (int r = 0; r < REPLIES_PER_COMMAND; r++) {
                    Frame reply = (i + r) % 5 == 0
                        ? Frame.errorResponse(id, "NodeNotFound", "gone")
                        : Frame.response(id, FrameCodec.mapper().createObjectNode().put("nodeId", id));
                    tasks.add(() -> {
                        if (router.resolve(connection.getId(), reply)) {
                            acceptedReplies.incrementAndGet();
                            acceptedById.get(id).incrementAndGet();
                        } else {
                            rejectedReplies.incrementAndGet();
                        }
                    });
                }
            }
        }
        Connection lost = connections.get(0);
        tasks.add(() -> router.onConnectionClosed(lost.getId(), "socket closed"));
        Collections.shuffle(tasks, new Random(42));

        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> submitted = new ArrayList<>();
        for (Runnable task : tasks) {
            submitted.add(workers.submit(() -> {
                start.await();
                task.run();
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : submitted) {
            f.get(10, TimeUnit.SECONDS);
        }

        CompletableFuture.allOf(observed.toArray(new CompletableFuture<?>[0]))
            .exceptionally(e -> null)
            .get(10, TimeUnit.SECONDS);

        int succeeded = 0;
        int pluginErrors = 0;
        int timedOut = 0;
        int connectionLost = 0;
        for (CompletableFuture<JsonNode> future : futures) {
            Assertions.assertEquals(1, completions.get(future).get());
            Assertions.assertFalse(future.isCancelled());
            if (!future.isCompletedExceptionally()) {
                succeeded++;
                continue;
            }
            CompletionException e = Assertions.assertThrows(CompletionException.class, future::join);
            Throwable cause = e.getCause();
            if (cause instanceof CommandFailedException) {
                pluginErrors++;
            } else if (cause instanceof RelayTimeoutException) {
                timedOut++;
            } else if (cause instanceof ConnectionLostException) {
                connectionLost++;
            } else {
                Assertions.fail("unexpected outcome " + cause);
            }
        }

        int commands = CHANNELS * COMMANDS_PER_CHANNEL;
        int replies = commands * REPLIES_PER_COMMAND;
        Assertions.assertEquals(commands, succeeded + pluginErrors + timedOut + connectionLost);
        Assertions.assertEquals(acceptedReplies.get(), succeeded + pluginErrors);
        Assertions.assertEquals(replies, acceptedReplies.get() + rejectedReplies.get());
        Assertions.assertEquals(rejectedReplies.get(), router.droppedResponseCount());
        acceptedById.values().forEach(accepted -> Assertions.assertTrue(accepted.get() <= 1));
        Assertions.assertEquals(0, router.pendingCount());
    }

    private static Command command(String channel, int index) {
        return new Command("move_node",
            FrameCodec.mapper().createObjectNode().put("node_id", "n" + index).put("x", index).put("y", 0),
            channel);
    }
}
