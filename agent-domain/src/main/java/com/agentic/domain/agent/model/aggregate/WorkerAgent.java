package com.agentic.domain.agent.model.aggregate;

import com.agentic.domain.agent.adapter.handler.IAgentMessageHandler;
import com.agentic.domain.agent.adapter.handler.ITaskHandler;
import com.agentic.domain.agent.model.valobj.AgentStatusSnapshot;
import com.agentic.domain.message.adapter.bus.IMessageBus;
import com.agentic.domain.message.model.entity.AgentMessageEntity;
import com.agentic.domain.task.model.entity.AgentTaskEntity;
import com.agentic.domain.task.model.valobj.TaskOutcome;
import com.agentic.types.common.Constants;
import com.agentic.types.enums.AgentStatusEnum;
import com.agentic.types.enums.MessageTypeEnum;
import com.google.common.collect.EvictingQueue;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Agent 聚合：持有能力集合与并发上限，异步执行被分配的任务，
 * 并通过消息总线向编排器回报每次执行的结果（每次分配恰好一条 TASK_RESULT 或 TASK_FAILURE）。
 * <p>
 * 负载计数只由本类维护：接收任务时加一，执行结束（成功、失败或取消）时减一。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
@Slf4j
public class WorkerAgent {

    public static final int DEFAULT_INBOX_SIZE = 100;

    private final String name;
    private final Set<String> capabilities;
    private final int maxConcurrentTasks;
    private final ITaskHandler taskHandler;
    private final IMessageBus messageBus;
    private final String orchestratorId;
    private final EvictingQueue<AgentMessageEntity> inbox;
    private final Map<String, Execution> inFlight = new LinkedHashMap<>();

    private volatile IAgentMessageHandler messageHandler;
    private volatile long registrationOrder;

    private AgentStatusEnum status = AgentStatusEnum.STOPPED;
    private ThreadPoolExecutor executor;
    private ThreadPoolExecutor stoppingExecutor;
    private long tasksCompleted;
    private long tasksFailed;
    private long totalExecutionMillis;
    private LocalDateTime lastActivity;

    public WorkerAgent(String name,
                       Set<String> capabilities,
                       int maxConcurrentTasks,
                       ITaskHandler taskHandler,
                       IMessageBus messageBus) {
        this(name, capabilities, maxConcurrentTasks, taskHandler, messageBus,
                Constants.DEFAULT_ORCHESTRATOR_ID, DEFAULT_INBOX_SIZE);
    }

    public WorkerAgent(String name,
                       Set<String> capabilities,
                       int maxConcurrentTasks,
                       ITaskHandler taskHandler,
                       IMessageBus messageBus,
                       String orchestratorId,
                       int inboxSize) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Agent name cannot be empty");
        }
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("Max concurrent tasks must be positive: " + maxConcurrentTasks);
        }
        if (taskHandler == null) {
            throw new IllegalArgumentException("Task handler cannot be null");
        }
        if (messageBus == null) {
            throw new IllegalArgumentException("Message bus cannot be null");
        }
        this.name = name;
        this.capabilities = Collections.unmodifiableSet(capabilities == null
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(capabilities));
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.taskHandler = taskHandler;
        this.messageBus = messageBus;
        this.orchestratorId = orchestratorId == null || orchestratorId.isBlank()
                ? Constants.DEFAULT_ORCHESTRATOR_ID
                : orchestratorId;
        this.inbox = EvictingQueue.create(Math.max(inboxSize, 1));
    }

    public String getName() {
        return name;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public long getRegistrationOrder() {
        return registrationOrder;
    }

    public void setRegistrationOrder(long registrationOrder) {
        this.registrationOrder = registrationOrder;
    }

    public void setMessageHandler(IAgentMessageHandler messageHandler) {
        this.messageHandler = messageHandler;
    }

    public boolean hasCapability(String capability) {
        return capability != null && capabilities.contains(capability);
    }

    public synchronized int getCurrentLoad() {
        return inFlight.size();
    }

    public synchronized AgentStatusEnum getAgentStatus() {
        return status;
    }

    public synchronized boolean canAccept(AgentTaskEntity task) {
        if (task == null || status == AgentStatusEnum.STOPPED || executor == null) {
            return false;
        }
        if (inFlight.size() >= maxConcurrentTasks || inFlight.containsKey(task.getId())) {
            return false;
        }
        Set<String> required = task.getRequiredCapabilities();
        return required == null || capabilities.containsAll(required);
    }

    /**
     * 接收任务并异步执行。
     *
     * @return 未停止、有空余并发且能力覆盖时返回 true；否则任务保持原状，由调度器另选
     */
    public boolean assignTask(AgentTaskEntity task) {
        Execution execution;
        ThreadPoolExecutor target;
        synchronized (this) {
            if (!canAccept(task)) {
                log.debug("Agent rejected task. agent={}, taskId={}, status={}, load={}/{}",
                        name, task == null ? null : task.getId(), status, inFlight.size(), maxConcurrentTasks);
                return false;
            }
            execution = new Execution(task);
            inFlight.put(task.getId(), execution);
            lastActivity = LocalDateTime.now();
            refreshStatus();
            target = executor;
        }
        try {
            target.execute(execution);
        } catch (RejectedExecutionException ex) {
            synchronized (this) {
                inFlight.remove(task.getId(), execution);
                refreshStatus();
            }
            log.warn("Agent executor rejected task. agent={}, taskId={}, error={}", name, task.getId(), ex.getMessage());
            return false;
        }
        log.debug("Agent accepted task. agent={}, taskId={}, attempt={}", name, task.getId(), task.getExecutionAttempt());
        return true;
    }

    /**
     * 中断在途任务，Agent 随后回报带取消原因的 TASK_FAILURE。
     */
    public boolean cancelTask(String taskId, String reason) {
        Execution execution;
        synchronized (this) {
            execution = inFlight.get(taskId);
        }
        if (execution == null) {
            return false;
        }
        execution.cancelReason = reason;
        return execution.cancel(true);
    }

    public synchronized void start() {
        if (status != AgentStatusEnum.STOPPED || executor != null) {
            return;
        }
        if (stoppingExecutor != null && !stoppingExecutor.isTerminated()) {
            stoppingExecutor.shutdownNow();
        }
        stoppingExecutor = null;
        executor = newExecutor();
        refreshStatus();
        log.info("Agent started. agent={}, capabilities={}, maxConcurrentTasks={}", name, capabilities, maxConcurrentTasks);
    }

    /**
     * 停止接收新任务，在宽限期内等待在途任务结束，超时后中断剩余任务。
     *
     * @return 宽限期内全部自然结束返回 true
     */
    public boolean stop(Duration gracePeriod) {
        beginStop();
        return awaitStop(gracePeriod);
    }

    public synchronized void beginStop() {
        status = AgentStatusEnum.STOPPED;
        if (executor == null) {
            return;
        }
        stoppingExecutor = executor;
        executor = null;
        stoppingExecutor.shutdown();
        log.info("Agent stopping. agent={}, inFlight={}", name, inFlight.keySet());
    }

    public boolean awaitStop(Duration gracePeriod) {
        ThreadPoolExecutor draining;
        synchronized (this) {
            draining = stoppingExecutor;
        }
        if (draining == null) {
            return true;
        }
        long graceMillis = gracePeriod == null ? 0L : Math.max(gracePeriod.toMillis(), 0L);
        try {
            if (draining.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        int cancelled = cancelAll("Cancelled: agent " + name + " stopped");
        draining.shutdownNow();
        log.warn("Agent grace period elapsed, in-flight tasks cancelled. agent={}, cancelled={}", name, cancelled);
        return false;
    }

    private int cancelAll(String reason) {
        List<Execution> executions;
        synchronized (this) {
            executions = new ArrayList<>(inFlight.values());
        }
        int cancelled = 0;
        for (Execution execution : executions) {
            execution.cancelReason = reason;
            if (execution.cancel(true)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * 总线投递入口。
     */
    public void onMessage(AgentMessageEntity message) {
        if (message == null) {
            return;
        }
        synchronized (inbox) {
            inbox.add(message);
        }
        if (message.getMessageType() == MessageTypeEnum.TASK_ASSIGNMENT) {
            log.debug("Agent notified of assignment. agent={}, messageId={}", name, message.getId());
        }
        IAgentMessageHandler handler = this.messageHandler;
        if (handler == null) {
            return;
        }
        try {
            handler.onMessage(this, message);
        } catch (Exception ex) {
            log.warn("Agent message handler failed. agent={}, messageId={}, type={}, error={}",
                    name, message.getId(), message.getMessageType(), ex.getMessage());
        }
    }

    public void sendMessage(String recipient, MessageTypeEnum messageType, Object content) {
        messageBus.send(AgentMessageEntity.of(name, recipient, messageType, content));
    }

    public void broadcast(MessageTypeEnum messageType, Object content) {
        messageBus.send(AgentMessageEntity.broadcast(name, messageType, content));
    }

    public List<AgentMessageEntity> getInbox() {
        synchronized (inbox) {
            return new ArrayList<>(inbox);
        }
    }

    public synchronized AgentStatusSnapshot getStatus() {
        return AgentStatusSnapshot.builder()
                .name(name)
                .capabilities(new TreeSet<>(capabilities))
                .maxConcurrentTasks(maxConcurrentTasks)
                .currentLoad(inFlight.size())
                .status(status)
                .registrationOrder(registrationOrder)
                .runningTaskIds(new ArrayList<>(inFlight.keySet()))
                .tasksCompleted(tasksCompleted)
                .tasksFailed(tasksFailed)
                .totalExecutionMillis(totalExecutionMillis)
                .lastActivity(lastActivity)
                .build();
    }

    private void refreshStatus() {
        if (status == AgentStatusEnum.STOPPED && executor == null) {
            return;
        }
        status = inFlight.isEmpty() ? AgentStatusEnum.IDLE : AgentStatusEnum.BUSY;
    }

    private ThreadPoolExecutor newExecutor() {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                maxConcurrentTasks,
                maxConcurrentTasks,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder()
                        .setNameFormat("agent-" + name.replace("%", "%%") + "-worker-%d")
                        .setDaemon(true)
                        .build());
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    private void finish(Execution execution, TaskOutcome outcome) {
        synchronized (this) {
            inFlight.remove(execution.task.getId(), execution);
            if (outcome.isSuccess()) {
                tasksCompleted++;
            } else {
                tasksFailed++;
            }
            totalExecutionMillis += outcome.getDurationMillis();
            lastActivity = LocalDateTime.now();
            refreshStatus();
        }
        MessageTypeEnum type = outcome.isSuccess() ? MessageTypeEnum.TASK_RESULT : MessageTypeEnum.TASK_FAILURE;
        try {
            messageBus.send(AgentMessageEntity.of(name, orchestratorId, type, outcome));
        } catch (RuntimeException ex) {
            log.warn("Failed to report task outcome. agent={}, taskId={}, error={}",
                    name, outcome.getTaskId(), ex.getMessage());
        }
    }

    /**
     * 单次执行；FutureTask 保证 done() 只触发一次，因此每次分配只回报一次。
     */
    private final class Execution extends FutureTask<Object> {

        private final AgentTaskEntity task;
        private final long createdNanos;
        private volatile String cancelReason;

        private Execution(AgentTaskEntity task) {
            super(() -> taskHandler.handle(task));
            this.task = task;
            this.createdNanos = System.nanoTime();
        }

        @Override
        protected void done() {
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - createdNanos);
            finish(this, resolveOutcome(durationMillis));
        }

        private TaskOutcome resolveOutcome(long durationMillis) {
            String taskId = task.getId();
            Integer attempt = task.getExecutionAttempt();
            if (isCancelled()) {
                return TaskOutcome.cancelled(taskId, name, attempt, cancelReasonOrDefault(), durationMillis);
            }
            try {
                return TaskOutcome.success(taskId, name, attempt, get(), durationMillis);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                if (cause instanceof InterruptedException || cause instanceof CancellationException) {
                    return TaskOutcome.cancelled(taskId, name, attempt, cancelReasonOrDefault(), durationMillis);
                }
                log.warn("Task execution failed. agent={}, taskId={}, error={}", name, taskId, describe(cause));
                return TaskOutcome.failure(taskId, name, attempt, describe(cause), durationMillis);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return TaskOutcome.cancelled(taskId, name, attempt, cancelReasonOrDefault(), durationMillis);
            }
        }

        private String cancelReasonOrDefault() {
            String reason = cancelReason;
            return reason == null || reason.isBlank() ? "Cancelled: agent " + name + " interrupted" : reason;
        }

        private String describe(Throwable cause) {
            String message = cause.getMessage();
            return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
        }
    }
}
