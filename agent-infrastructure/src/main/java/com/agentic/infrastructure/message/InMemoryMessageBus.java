package com.agentic.infrastructure.message;

import com.agentic.domain.message.adapter.bus.IMessageBus;
import com.agentic.domain.message.model.entity.AgentMessageEntity;
import com.agentic.domain.message.model.valobj.MessageBusStats;
import com.google.common.collect.EvictingQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 进程内消息总线。
 * <p>
 * 每个地址一个邮箱，同一时刻最多一个投递线程在处理某个邮箱，因此同一接收方的消息按入队顺序串行投递。
 * send 只负责入队，不会阻塞在接收方处理上。处理器抛出的异常记录日志后继续投递后续消息。
 * 经过路由后的消息按发送顺序写入有界历史，超出容量时淘汰最早的消息。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
@Slf4j
@Component
public class InMemoryMessageBus implements IMessageBus {

    public static final int DEFAULT_HISTORY_SIZE = 1000;

    private static final int DRAIN_BATCH_SIZE = 64;
    private static final long IDLE_POLL_MILLIS = 5L;

    private final ExecutorService deliveryExecutor;
    private final Map<String, Mailbox> mailboxes = new LinkedHashMap<>();
    private final List<Function<AgentMessageEntity, String>> routingRules = new CopyOnWriteArrayList<>();
    private final EvictingQueue<AgentMessageEntity> history;
    private final AtomicLong messagesSent = new AtomicLong(0);
    private final AtomicLong messagesDelivered = new AtomicLong(0);
    private final AtomicLong messagesDropped = new AtomicLong(0);
    private final AtomicLong messagesFailed = new AtomicLong(0);

    public InMemoryMessageBus(ExecutorService deliveryExecutor) {
        this(deliveryExecutor, DEFAULT_HISTORY_SIZE);
    }

    @Autowired
    public InMemoryMessageBus(@Qualifier("messageDeliveryExecutor") ExecutorService deliveryExecutor,
                              @Value("${coordinator.message-history-size:1000}") int historySize) {
        this.deliveryExecutor = deliveryExecutor;
        this.history = EvictingQueue.create(Math.max(historySize, 1));
    }

    @Override
    public void register(String endpointId, Consumer<AgentMessageEntity> handler) {
        if (endpointId == null || endpointId.isBlank()) {
            throw new IllegalArgumentException("Endpoint id cannot be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        synchronized (mailboxes) {
            if (mailboxes.containsKey(endpointId)) {
                throw new IllegalStateException("Endpoint already registered: " + endpointId);
            }
            mailboxes.put(endpointId, new Mailbox(endpointId, handler));
        }
        log.debug("Message endpoint registered. endpointId={}", endpointId);
    }

    @Override
    public void unregister(String endpointId) {
        Mailbox mailbox;
        synchronized (mailboxes) {
            mailbox = mailboxes.remove(endpointId);
        }
        if (mailbox == null) {
            return;
        }
        mailbox.closed = true;
        int discarded = mailbox.queue.size();
        mailbox.queue.clear();
        if (discarded > 0) {
            messagesDropped.addAndGet(discarded);
        }
        log.debug("Message endpoint unregistered. endpointId={}, discarded={}", endpointId, discarded);
    }

    @Override
    public boolean isRegistered(String endpointId) {
        synchronized (mailboxes) {
            return endpointId != null && mailboxes.containsKey(endpointId);
        }
    }

    @Override
    public void addRoutingRule(Function<AgentMessageEntity, String> rule) {
        if (rule == null) {
            throw new IllegalArgumentException("Routing rule cannot be null");
        }
        routingRules.add(rule);
    }

    @Override
    public void send(AgentMessageEntity outgoing) {
        outgoing.validate();
        AgentMessageEntity message = route(outgoing);
        messagesSent.incrementAndGet();
        synchronized (history) {
            history.add(message);
        }
        if (message.isBroadcast()) {
            List<Mailbox> targets;
            synchronized (mailboxes) {
                targets = new ArrayList<>(mailboxes.values());
            }
            for (Mailbox mailbox : targets) {
                if (!mailbox.endpointId.equals(message.getSender())) {
                    enqueue(mailbox, message);
                }
            }
            return;
        }
        Mailbox mailbox;
        synchronized (mailboxes) {
            mailbox = mailboxes.get(message.getRecipient());
        }
        if (mailbox == null) {
            messagesDropped.incrementAndGet();
            log.debug("Message dropped, recipient not registered. messageId={}, sender={}, recipient={}, type={}",
                    message.getId(), message.getSender(), message.getRecipient(), message.getMessageType());
            return;
        }
        enqueue(mailbox, message);
    }

    @Override
    public List<AgentMessageEntity> getMessagesFor(String recipient, LocalDateTime since) {
        if (recipient == null) {
            return List.of();
        }
        synchronized (history) {
            return history.stream()
                    .filter(message -> recipient.equals(message.getRecipient())
                            || (message.isBroadcast() && !recipient.equals(message.getSender())))
                    .filter(message -> since == null
                            || (message.getTimestamp() != null && !message.getTimestamp().isBefore(since)))
                    .collect(Collectors.toList());
        }
    }

    @Override
    public List<String> getEndpoints() {
        synchronized (mailboxes) {
            return new ArrayList<>(mailboxes.keySet());
        }
    }

    @Override
    public MessageBusStats getStats() {
        Map<String, Integer> queueSizes = new LinkedHashMap<>();
        List<String> endpoints;
        synchronized (mailboxes) {
            endpoints = new ArrayList<>(mailboxes.keySet());
            for (Mailbox mailbox : mailboxes.values()) {
                queueSizes.put(mailbox.endpointId, mailbox.queue.size());
            }
        }
        int historySize;
        synchronized (history) {
            historySize = history.size();
        }
        return MessageBusStats.builder()
                .messagesSent(messagesSent.get())
                .messagesDelivered(messagesDelivered.get())
                .messagesDropped(messagesDropped.get())
                .messagesFailed(messagesFailed.get())
                .historySize(historySize)
                .endpoints(endpoints)
                .queueSizes(queueSizes)
                .build();
    }

    @Override
    public boolean awaitIdle(String endpointId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + (timeout == null ? 0L : timeout.toNanos());
        while (true) {
            Mailbox mailbox;
            synchronized (mailboxes) {
                mailbox = mailboxes.get(endpointId);
            }
            if (mailbox == null || (mailbox.queue.isEmpty() && !mailbox.scheduled.get())) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            TimeUnit.MILLISECONDS.sleep(IDLE_POLL_MILLIS);
        }
    }

    private AgentMessageEntity route(AgentMessageEntity message) {
        if (message.isBroadcast()) {
            return message;
        }
        for (Function<AgentMessageEntity, String> rule : routingRules) {
            String target;
            try {
                target = rule.apply(message);
            } catch (RuntimeException ex) {
                log.warn("Routing rule failed, skipped. messageId={}, sender={}, recipient={}, error={}",
                        message.getId(), message.getSender(), message.getRecipient(), ex.getMessage());
                continue;
            }
            if (target == null || target.isBlank()) {
                continue;
            }
            String recipient = target.trim();
            if (recipient.equals(message.getRecipient())) {
                return message;
            }
            log.debug("Message rerouted. messageId={}, from={}, to={}", message.getId(), message.getRecipient(), recipient);
            return message.toBuilder().recipient(recipient).build();
        }
        return message;
    }

    private void enqueue(Mailbox mailbox, AgentMessageEntity message) {
        if (mailbox.closed) {
            messagesDropped.incrementAndGet();
            return;
        }
        mailbox.queue.offer(message);
        schedule(mailbox);
    }

    private void schedule(Mailbox mailbox) {
        if (!mailbox.scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.execute(() -> drain(mailbox));
        } catch (RejectedExecutionException ex) {
            mailbox.scheduled.set(false);
            int discarded = mailbox.queue.size();
            mailbox.queue.clear();
            messagesDropped.addAndGet(discarded);
            log.warn("Message delivery rejected, mailbox discarded. endpointId={}, discarded={}, error={}",
                    mailbox.endpointId, discarded, ex.getMessage());
        }
    }

    private void drain(Mailbox mailbox) {
        try {
            int delivered = 0;
            AgentMessageEntity message;
            while (delivered < DRAIN_BATCH_SIZE && !mailbox.closed && (message = mailbox.queue.poll()) != null) {
                deliver(mailbox, message);
                delivered++;
            }
        } finally {
            mailbox.scheduled.set(false);
            if (!mailbox.closed && !mailbox.queue.isEmpty()) {
                schedule(mailbox);
            }
        }
    }

    private void deliver(Mailbox mailbox, AgentMessageEntity message) {
        try {
            mailbox.handler.accept(message);
            messagesDelivered.incrementAndGet();
        } catch (Exception ex) {
            messagesFailed.incrementAndGet();
            log.warn("Message handler failed. endpointId={}, messageId={}, sender={}, type={}, error={}",
                    mailbox.endpointId, message.getId(), message.getSender(), message.getMessageType(),
                    ex.getMessage(), ex);
        }
    }

    private static final class Mailbox {

        private final String endpointId;
        private final Consumer<AgentMessageEntity> handler;
        private final Queue<AgentMessageEntity> queue = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean scheduled = new AtomicBoolean(false);
        private volatile boolean closed;

        private Mailbox(String endpointId, Consumer<AgentMessageEntity> handler) {
            this.endpointId = endpointId;
            this.handler = handler;
        }
    }
}
