package com.agentic.trigger.service;

import com.agentic.domain.agent.adapter.handler.ITaskHandler;
import com.agentic.domain.agent.adapter.repository.IAgentRegistryRepository;
import com.agentic.domain.agent.model.aggregate.WorkerAgent;
import com.agentic.domain.agent.model.valobj.AgentStatusSnapshot;
import com.agentic.domain.message.adapter.bus.IMessageBus;
import com.agentic.domain.message.model.entity.AgentMessageEntity;
import com.agentic.domain.task.model.entity.AgentTaskEntity;
import com.agentic.domain.task.model.valobj.TaskDescriptor;
import com.agentic.trigger.application.command.TaskScheduleApplicationService;
import com.agentic.trigger.application.query.SystemStatusQueryService;
import com.agentic.trigger.event.TaskOutcomeMessageListener;
import com.agentic.trigger.job.TaskSchedulerDaemon;
import com.agentic.types.enums.MessageTypeEnum;
import com.agentic.types.enums.ResponseCode;
import com.agentic.types.exception.AppException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Agent 系统编排服务：组合调度器、消息总线与 Agent 注册表，对外提供注册、提交、
 * 结果等待、启停与状态查询。
 * <p>
 * 由容器显式构造并持有生命周期（start/stop），不依赖任何进程级单例。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
@Slf4j
@Service
public class AgentSystemService {

    static final String STOP_REASON = "Cancelled: system stopped";

    private final IAgentRegistryRepository agentRegistryRepository;
    private final IMessageBus messageBus;
    private final TaskScheduleApplicationService taskScheduleApplicationService;
    private final TaskSchedulerDaemon taskSchedulerDaemon;
    private final TaskOutcomeMessageListener taskOutcomeMessageListener;
    private final SystemStatusQueryService systemStatusQueryService;
    private final Duration resultWaitTimeout;
    private final Duration agentStopGrace;
    private final int agentInboxSize;
    private volatile boolean running;

    @Autowired
    public AgentSystemService(IAgentRegistryRepository agentRegistryRepository,
                              IMessageBus messageBus,
                              TaskScheduleApplicationService taskScheduleApplicationService,
                              TaskSchedulerDaemon taskSchedulerDaemon,
                              TaskOutcomeMessageListener taskOutcomeMessageListener,
                              SystemStatusQueryService systemStatusQueryService,
                              @Value("${coordinator.result-wait-timeout-ms:30000}") long resultWaitTimeoutMs,
                              @Value("${coordinator.agent-stop-grace-ms:5000}") long agentStopGraceMs,
                              @Value("${coordinator.agent-inbox-size:100}") int agentInboxSize) {
        this.agentRegistryRepository = agentRegistryRepository;
        this.messageBus = messageBus;
        this.taskScheduleApplicationService = taskScheduleApplicationService;
        this.taskSchedulerDaemon = taskSchedulerDaemon;
        this.taskOutcomeMessageListener = taskOutcomeMessageListener;
        this.systemStatusQueryService = systemStatusQueryService;
        this.resultWaitTimeout = Duration.ofMillis(Math.max(resultWaitTimeoutMs, 0L));
        this.agentStopGrace = Duration.ofMillis(Math.max(agentStopGraceMs, 0L));
        this.agentInboxSize = agentInboxSize <= 0 ? WorkerAgent.DEFAULT_INBOX_SIZE : agentInboxSize;
    }

    /**
     * 按系统配置（总线、编排器地址、收件箱容量）创建 Agent，创建后仍需 registerAgent。
     */
    public WorkerAgent createAgent(String name, Set<String> capabilities, int maxConcurrentTasks, ITaskHandler handler) {
        return new WorkerAgent(name, capabilities, maxConcurrentTasks, handler, messageBus,
                taskScheduleApplicationService.getOrchestratorId(), agentInboxSize);
    }

    /**
     * 注册 Agent；系统运行中注册时立即启动并触发一轮分配。
     *
     * @throws AppException 名称已注册时抛出
     */
    public synchronized void registerAgent(WorkerAgent agent) {
        if (agent == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "agent is null");
        }
        if (agent.getName().equals(taskScheduleApplicationService.getOrchestratorId())) {
            throw new AppException(ResponseCode.DUPLICATE_AGENT, agent.getName() + " is reserved for the orchestrator");
        }
        if (!agentRegistryRepository.save(agent)) {
            throw new AppException(ResponseCode.DUPLICATE_AGENT, agent.getName());
        }
        try {
            messageBus.register(agent.getName(), agent::onMessage);
        } catch (IllegalStateException ex) {
            agentRegistryRepository.deleteByName(agent.getName());
            throw new AppException(ResponseCode.DUPLICATE_AGENT.getCode(), ex.getMessage(), ex);
        }
        log.info("Agent registered. agent={}, capabilities={}, maxConcurrentTasks={}",
                agent.getName(), agent.getCapabilities(), agent.getMaxConcurrentTasks());
        if (running) {
            agent.start();
            taskScheduleApplicationService.runAssignmentPass();
        }
    }

    /**
     * 注销 Agent：先移出注册表不再分配，宽限期内等待在途任务，随后移除总线地址。
     */
    public synchronized WorkerAgent unregisterAgent(String name) {
        WorkerAgent agent = agentRegistryRepository.deleteByName(name);
        if (agent == null) {
            throw new AppException(ResponseCode.AGENT_NOT_FOUND, name);
        }
        boolean drained = agent.stop(agentStopGrace);
        messageBus.unregister(name);
        log.info("Agent unregistered. agent={}, drained={}", name, drained);
        taskScheduleApplicationService.runAssignmentPass();
        return agent;
    }

    public String submitTask(TaskDescriptor descriptor) {
        return taskScheduleApplicationService.submit(descriptor);
    }

    /**
     * 使用默认等待时长获取结果。
     */
    public AgentTaskEntity getTaskResult(String taskId) {
        return getTaskResult(taskId, resultWaitTimeout);
    }

    /**
     * 等待任务进入终态并返回快照；超时返回 null，任务本身不受影响。timeout 为空时使用默认等待时长。
     */
    public AgentTaskEntity getTaskResult(String taskId, Duration timeout) {
        return taskScheduleApplicationService.awaitResult(taskId, timeout == null ? resultWaitTimeout : timeout);
    }

    public AgentTaskEntity getTask(String taskId) {
        return taskScheduleApplicationService.getTask(taskId);
    }

    public List<AgentTaskEntity> listTasks() {
        return taskScheduleApplicationService.listTasks();
    }

    public boolean cancelTask(String taskId, String reason) {
        return taskScheduleApplicationService.cancelTask(taskId, reason);
    }

    public AgentTaskEntity evictTask(String taskId) {
        return taskScheduleApplicationService.evictTask(taskId);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        String orchestratorId = taskScheduleApplicationService.getOrchestratorId();
        if (!messageBus.isRegistered(orchestratorId)) {
            messageBus.register(orchestratorId, taskOutcomeMessageListener::onMessage);
        }
        List<WorkerAgent> agents = agentRegistryRepository.findAll();
        agents.forEach(WorkerAgent::start);
        running = true;
        taskSchedulerDaemon.start();
        taskScheduleApplicationService.runAssignmentPass();
        log.info("Agent system started. agents={}", agents.size());
    }

    /**
     * 停止：停掉周期分配，取消未开始的任务，通知全部 Agent 排空；
     * 宽限期结束后仍未终结的任务强制标记为 CANCELLED。
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        taskSchedulerDaemon.stop();
        int pendingCancelled = taskScheduleApplicationService.cancelPendingTasks(STOP_REASON);

        List<WorkerAgent> agents = agentRegistryRepository.findAll();
        agents.forEach(WorkerAgent::beginStop);
        long deadline = System.nanoTime() + agentStopGrace.toNanos();
        int undrained = 0;
        for (WorkerAgent agent : agents) {
            Duration remaining = Duration.ofNanos(Math.max(deadline - System.nanoTime(), 0L));
            if (!agent.awaitStop(remaining)) {
                undrained++;
            }
        }
        awaitOutcomeDelivery();
        int forced = taskScheduleApplicationService.cancelAllNonTerminal(STOP_REASON);
        log.info("Agent system stopped. pendingCancelled={}, undrainedAgents={}, forceCancelled={}",
                pendingCancelled, undrained, forced);
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public SystemStatusQueryService.SystemStatusView getSystemStatus() {
        return systemStatusQueryService.query(running);
    }

    /**
     * 以编排器身份广播，投递给发送时刻已注册的全部 Agent。
     */
    public void broadcastMessage(MessageTypeEnum messageType, Object content) {
        messageBus.send(AgentMessageEntity.broadcast(taskScheduleApplicationService.getOrchestratorId(),
                messageType == null ? MessageTypeEnum.BROADCAST : messageType, content));
    }

    public void sendMessage(String recipient, MessageTypeEnum messageType, Object content) {
        messageBus.send(AgentMessageEntity.of(taskScheduleApplicationService.getOrchestratorId(),
                recipient, messageType, content));
    }

    /**
     * 追加消息路由规则，作用于之后发送的点对点消息。
     */
    public void addRoutingRule(Function<AgentMessageEntity, String> rule) {
        messageBus.addRoutingRule(rule);
    }

    /**
     * 查询总线历史中发往该 Agent 的消息。
     */
    public List<AgentMessageEntity> getMessagesForAgent(String agentName, LocalDateTime since) {
        return messageBus.getMessagesFor(agentName, since);
    }

    /**
     * 按能力查找 Agent，忽略当前负载，按注册顺序返回。
     */
    public List<AgentStatusSnapshot> findAgentsByCapability(String capability) {
        if (StringUtils.isBlank(capability)) {
            return List.of();
        }
        return agentRegistryRepository.findAll().stream()
                .filter(agent -> agent.hasCapability(capability))
                .map(WorkerAgent::getStatus)
                .collect(Collectors.toList());
    }

    private void awaitOutcomeDelivery() {
        try {
            if (!messageBus.awaitIdle(taskScheduleApplicationService.getOrchestratorId(), agentStopGrace)) {
                log.warn("Orchestrator mailbox not drained within grace period. graceMs={}", agentStopGrace.toMillis());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining orchestrator mailbox.");
        }
    }
}
