package com.agentic.test;

import com.agentic.domain.message.model.entity.AgentMessageEntity;
import com.agentic.domain.message.model.valobj.MessageBusStats;
import com.agentic.infrastructure.message.InMemoryMessageBus;
import com.agentic.test.support.Conditions;
import com.agentic.types.enums.MessageTypeEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

public class InMemoryMessageBusTest {

    private ExecutorService deliveryExecutor;
    private InMemoryMessageBus bus;

    @BeforeEach
    public void setUp() {
        deliveryExecutor = Executors.newFixedThreadPool(4);
        bus = new InMemoryMessageBus(deliveryExecutor);
    }

    @AfterEach
    public void tearDown() {
        deliveryExecutor.shutdownNow();
    }

    @Test
    public void shouldDeliverInSendOrderPerSenderAndRecipient() throws Exception {
        List<Object> received = new CopyOnWriteArrayList<>();
        bus.register("b", message -> received.add(message.getContent()));

        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            bus.send(AgentMessageEntity.of("a", "b", MessageTypeEnum.COORDINATION, i));
            expected.add(i);
        }

        Assertions.assertTrue(bus.awaitIdle("b", Duration.ofSeconds(5)));
        Assertions.assertEquals(expected, received);
        Assertions.assertEquals(500L, bus.getStats().getMessagesDelivered());
    }

    @Test
    public void shouldReturnBeforeSlowRecipientFinishes() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch handled = new CountDownLatch(1);
        bus.register("slow", message -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            handled.countDown();
        });

        bus.send(AgentMessageEntity.of("a", "slow", MessageTypeEnum.STATUS, "ping"));

        Assertions.assertEquals(1L, handled.getCount());
        release.countDown();
        Assertions.assertTrue(handled.await(2, TimeUnit.SECONDS));
    }

    @Test
    public void shouldDropSilentlyWhenRecipientUnknown() {
        bus.send(AgentMessageEntity.of("a", "nobody", MessageTypeEnum.STATUS, "ping"));

        MessageBusStats stats = bus.getStats();
        Assertions.assertEquals(1L, stats.getMessagesSent());
        Assertions.assertEquals(1L, stats.getMessagesDropped());
        Assertions.assertEquals(0L, stats.getMessagesDelivered());
    }

    @Test
    public void shouldBroadcastToEndpointsRegisteredAtSendTimeExceptSender() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        bus.register("sender", message -> received.add("sender"));
        bus.register("a1", message -> received.add("a1"));
        bus.register("a2", message -> received.add("a2"));
        bus.register("a3", message -> received.add("a3"));

        bus.send(AgentMessageEntity.broadcast("sender", MessageTypeEnum.BROADCAST, "hello"));
        bus.register("late", message -> received.add("late"));

        Assertions.assertTrue(Conditions.await(() -> received.size() >= 3, 2_000));
        Assertions.assertTrue(bus.awaitIdle("late", Duration.ofSeconds(1)));
        Thread.sleep(50L);
        Assertions.assertEquals(3, received.size());
        Assertions.assertTrue(received.containsAll(List.of("a1", "a2", "a3")));
        Assertions.assertFalse(received.contains("late"));
        Assertions.assertFalse(received.contains("sender"));
    }

    @Test
    public void shouldKeepDeliveringAfterHandlerFailure() throws Exception {
        List<Object> received = new CopyOnWriteArrayList<>();
        bus.register("b", message -> {
            if ("boom".equals(message.getContent())) {
                throw new IllegalArgumentException("boom");
            }
            received.add(message.getContent());
        });

        bus.send(AgentMessageEntity.of("a", "b", MessageTypeEnum.STATUS, "boom"));
        bus.send(AgentMessageEntity.of("a", "b", MessageTypeEnum.STATUS, "after"));

        Assertions.assertTrue(Conditions.await(() -> received.contains("after"), 2_000));
        Assertions.assertEquals(1L, bus.getStats().getMessagesFailed());
    }

    @Test
    public void shouldRejectDuplicateRegistrationAndForgetUnregistered() {
        bus.register("b", message -> { });

        Assertions.assertThrows(IllegalStateException.class, () -> bus.register("b", message -> { }));

        bus.unregister("b");
        Assertions.assertFalse(bus.isRegistered("b"));
        Assertions.assertTrue(bus.getEndpoints().isEmpty());
        bus.send(AgentMessageEntity.of("a", "b", MessageTypeEnum.STATUS, "ping"));
        Assertions.assertEquals(1L, bus.getStats().getMessagesDropped());
    }

    @Test
    public void shouldRejectInvalidMessage() {
        AgentMessageEntity noType = AgentMessageEntity.of("a", "b", null, "x");

        Assertions.assertThrows(IllegalStateException.class, () -> bus.send(noType));
    }

    @Test
    public void shouldRerouteByFirstMatchingRule() throws Exception {
        List<Object> toB = new CopyOnWriteArrayList<>();
        List<Object> toC = new CopyOnWriteArrayList<>();
        bus.register("b", message -> toB.add(message.getContent()));
        bus.register("c", message -> toC.add(message.getContent()));
        bus.addRoutingRule(message -> {
            throw new IllegalStateException("broken rule");
        });
        bus.addRoutingRule(message -> " ");
        bus.addRoutingRule(message -> "urgent".equals(message.getContent()) ? "c" : null);
        bus.addRoutingRule(message -> "b");

        bus.send(AgentMessageEntity.of("a", "b", MessageTypeEnum.COORDINATION, "urgent"));
        bus.send(AgentMessageEntity.of("a", "b", MessageTypeEnum.COORDINATION, "normal"));
        bus.send(AgentMessageEntity.of("a", "nobody", MessageTypeEnum.COORDINATION, "lost"));

        Assertions.assertTrue(bus.awaitIdle("b", Duration.ofSeconds(2)));
        Assertions.assertTrue(bus.awaitIdle("c", Duration.ofSeconds(2)));
        Assertions.assertEquals(List.of("urgent"), toC);
        Assertions.assertEquals(List.of("normal", "lost"), toB);
        Assertions.assertEquals(0L, bus.getStats().getMessagesDropped());
        Assertions.assertEquals("c", bus.getMessagesFor("c", null).get(0).getRecipient());
    }

    @Test
    public void shouldNotRerouteBroadcast() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        bus.register("a1", message -> received.add("a1"));
        bus.register("a2", message -> received.add("a2"));
        bus.addRoutingRule(message -> "a1");

        bus.send(AgentMessageEntity.broadcast("orchestrator", MessageTypeEnum.BROADCAST, "hello"));

        Assertions.assertTrue(Conditions.await(() -> received.size() == 2, 2_000));
        Assertions.assertTrue(received.containsAll(List.of("a1", "a2")));
    }

    @Test
    public void shouldKeepBoundedHistoryPerRecipient() throws Exception {
        InMemoryMessageBus bounded = new InMemoryMessageBus(deliveryExecutor, 3);
        bounded.register("b", message -> { });

        bounded.send(AgentMessageEntity.of("a", "b", MessageTypeEnum.STATUS, 1));
        bounded.send(AgentMessageEntity.of("a", "c", MessageTypeEnum.STATUS, 2));
        bounded.send(AgentMessageEntity.of("a", "b", MessageTypeEnum.STATUS, 3));
        bounded.send(AgentMessageEntity.broadcast("a", MessageTypeEnum.BROADCAST, 4));

        List<Object> forB = bounded.getMessagesFor("b", null).stream()
                .map(AgentMessageEntity::getContent)
                .collect(Collectors.toList());
        Assertions.assertEquals(List.of(3, 4), forB);
        Assertions.assertTrue(bounded.getMessagesFor("a", null).isEmpty());
        Assertions.assertEquals(3, bounded.getStats().getHistorySize());
        Assertions.assertTrue(bounded.getMessagesFor(null, null).isEmpty());
    }

    @Test
    public void shouldFilterHistoryBySendTime() throws Exception {
        bus.register("b", message -> { });
        bus.send(AgentMessageEntity.of("a", "b", MessageTypeEnum.STATUS, "old"));
        Thread.sleep(20L);
        LocalDateTime since = LocalDateTime.now();
        Thread.sleep(20L);
        bus.send(AgentMessageEntity.of("a", "b", MessageTypeEnum.STATUS, "new"));

        List<AgentMessageEntity> recent = bus.getMessagesFor("b", since);

        Assertions.assertEquals(1, recent.size());
        Assertions.assertEquals("new", recent.get(0).getContent());
        Assertions.assertEquals(2, bus.getMessagesFor("b", null).size());
    }
}
