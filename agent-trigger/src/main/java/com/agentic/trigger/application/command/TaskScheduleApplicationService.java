package com.agentic.trigger.application.command;

import com.agentic.domain.agent.adapter.repository.IAgentRegistryRepository;
import com.agentic.domain.agent.model.aggregate.WorkerAgent;
import com.agentic.domain.agent.model.valobj.AgentStatusSnapshot;
import com.agentic.domain.message.adapter.bus.IMessageBus;
import com.agentic.domain.message.model.entity.AgentMessageEntity;
import com.agentic.domain.task.adapter.repository.IAgentTaskRepository;
import com.agentic.domain.task.model.entity.AgentTaskEntity;
import com.agentic.domain.task.model.valobj.TaskDescriptor;
import com.agentic.domain.task.model.valobj.TaskOutcome;
import com.agentic.domain.task.service.TaskAgentSelectionDomainService;
import com.agentic.domain.task.service.TaskDependencyGraphDomainService;
import com.agentic.domain.task.service.TaskDependencyPolicy;
import com.agentic.domain.task.service.TaskDispatchDomainService;
import com.agentic.domain.task.service.TaskRecoveryDomainService;
import com.agentic.types.common.Constants;
import com.agentic.types.enums.MessageTypeEnum;
import com.agentic.types.enums.ResponseCode;
import com.agentic.types.enums.TaskPriorityEnum;
import com.agentic.types.enums.TaskStatusEnum;
import com.agentic.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Task 调度写用例：任务注册表的唯一写入方，承载提交、分配轮次与执行结果回写。
 * <p>
 * 所有注册表读写都在同一把锁内完成；结果等待方只在锁外阻塞。
 * Agent 的负载计数由 Agent 自身维护，这里只通过 assignTask 请求接收。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
@Slf4j
@Service
public class TaskScheduleApplicationService {

    public static final String TIMEOUT_REASON = "Task timeout exceeded";

    private final IAgentTaskRepository agentTaskRepository;
    private final IAgentRegistryRepository agentRegistryRepository;
    private final IMessageBus messageBus;
    private final TaskDependencyPolicy taskDependencyPolicy;
    private final TaskDependencyGraphDomainService taskDependencyGraphDomainService;
    private final TaskDispatchDomainService taskDispatchDomainService;
    private final TaskAgentSelectionDomainService taskAgentSelectionDomainService;
    private final TaskRecoveryDomainService taskRecoveryDomainService;
    private final MeterRegistry meterRegistry;
    private final String orchestratorId;
    private final int defaultMaxRetries;

    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<String, CompletableFuture<AgentTaskEntity>> resultWaiters = new HashMap<>();
    private long submissionSeq;

    private final Counter submittedCounter;
    private final Counter assignedCounter;
    private final Counter retryCounter;

    @Autowired
    public TaskScheduleApplicationService(IAgentTaskRepository agentTaskRepository,
                                          IAgentRegistryRepository agentRegistryRepository,
                                          IMessageBus messageBus,
                                          TaskDependencyPolicy taskDependencyPolicy,
                                          TaskDependencyGraphDomainService taskDependencyGraphDomainService,
                                          TaskDispatchDomainService taskDispatchDomainService,
                                          TaskAgentSelectionDomainService taskAgentSelectionDomainService,
                                          TaskRecoveryDomainService taskRecoveryDomainService,
                                          ObjectProvider<MeterRegistry> meterRegistryProvider,
                                          @Value("${coordinator.orchestrator-id:orchestrator}") String orchestratorId,
                                          @Value("${coordinator.default-max-retries:0}") int defaultMaxRetries) {
        this(agentTaskRepository, agentRegistryRepository, messageBus, taskDependencyPolicy,
                taskDependencyGraphDomainService, taskDispatchDomainService, taskAgentSelectionDomainService,
                taskRecoveryDomainService, meterRegistryProvider.getIfAvailable(() -> Metrics.globalRegistry),
                orchestratorId, defaultMaxRetries);
    }

    public TaskScheduleApplicationService(IAgentTaskRepository agentTaskRepository,
                                          IAgentRegistryRepository agentRegistryRepository,
                                          IMessageBus messageBus,
                                          TaskDependencyPolicy taskDependencyPolicy,
                                          TaskDependencyGraphDomainService taskDependencyGraphDomainService,
                                          TaskDispatchDomainService taskDispatchDomainService,
                                          TaskAgentSelectionDomainService taskAgentSelectionDomainService,
                                          TaskRecoveryDomainService taskRecoveryDomainService,
                                          MeterRegistry meterRegistry,
                                          String orchestratorId,
                                          int defaultMaxRetries) {
        this.agentTaskRepository = agentTaskRepository;
        this.agentRegistryRepository = agentRegistryRepository;
        this.messageBus = messageBus;
        this.taskDependencyPolicy = taskDependencyPolicy;
        this.taskDependencyGraphDomainService = taskDependencyGraphDomainService;
        this.taskDispatchDomainService = taskDispatchDomainService;
        this.taskAgentSelectionDomainService = taskAgentSelectionDomainService;
        this.taskRecoveryDomainService = taskRecoveryDomainService;
        this.meterRegistry = meterRegistry == null ? Metrics.globalRegistry : meterRegistry;
        this.orchestratorId = StringUtils.defaultIfBlank(orchestratorId, Constants.DEFAULT_ORCHESTRATOR_ID);
        this.defaultMaxRetries = Math.max(defaultMaxRetries, 0);
        this.submittedCounter = Counter.builder("agent.task.submitted.total").register(this.meterRegistry);
        this.assignedCounter = Counter.builder("agent.task.assigned.total").register(this.meterRegistry);
        this.retryCounter = Counter.builder("agent.task.retry.total").register(this.meterRegistry);
    }

    public String getOrchestratorId() {
        return orchestratorId;
    }

    /**
     * 提交任务：校验依赖后以 PENDING 写入注册表并立即触发一轮分配。
     *
     * @return 任务 ID
     * @throws AppException 依赖未知、成环或任务 ID 重复时抛出，任务不会进入注册表
     */
    public String submit(TaskDescriptor descriptor) {
        if (descriptor == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "task descriptor is null");
        }
        registryLock.lock();
        try {
            String taskId = StringUtils.isBlank(descriptor.getTaskId())
                    ? UUID.randomUUID().toString()
                    : descriptor.getTaskId().trim();
            if (agentTaskRepository.existsById(taskId)) {
                throw new AppException(ResponseCode.DUPLICATE_TASK, taskId);
            }
            Set<String> dependencies = normalizeTags(descriptor.getDependencyTaskIds());
            taskDependencyGraphDomainService.validateDependencies(taskId, dependencies, agentTaskRepository::findById);

            LocalDateTime now = LocalDateTime.now();
            AgentTaskEntity task = new AgentTaskEntity();
            task.setId(taskId);
            task.setDescription(StringUtils.defaultString(descriptor.getDescription()));
            task.setRequiredCapabilities(normalizeTags(descriptor.getRequiredCapabilities()));
            task.setPriority(descriptor.getPriority() == null ? TaskPriorityEnum.MEDIUM : descriptor.getPriority());
            task.setDependencyTaskIds(dependencies);
            task.setParameters(descriptor.getParameters() == null
                    ? new HashMap<>()
                    : new HashMap<>(descriptor.getParameters()));
            task.setDeadline(descriptor.getDeadline());
            task.setExecutionTimeout(descriptor.getExecutionTimeout());
            task.setStatus(TaskStatusEnum.PENDING);
            task.setMaxRetries(descriptor.getMaxRetries() == null
                    ? defaultMaxRetries
                    : Math.max(descriptor.getMaxRetries(), 0));
            task.setCurrentRetry(0);
            task.setExecutionAttempt(0);
            task.setSubmissionSeq(++submissionSeq);
            task.setCreatedAt(now);
            task.setUpdatedAt(now);
            agentTaskRepository.save(task);
            resultWaiters.put(taskId, new CompletableFuture<>());
            submittedCounter.increment();
            log.info("Task submitted. taskId={}, priority={}, capabilities={}, dependencies={}",
                    taskId, task.getPriority(), task.getRequiredCapabilities(), dependencies);

            doAssignmentPass();
            return taskId;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 执行一轮分配：过期、执行超时、依赖失败级联取消，然后按优先级/FIFO 匹配可用 Agent。
     * 无状态变化时重复调用不会产生新的分配。
     */
    public AssignmentResult runAssignmentPass() {
        registryLock.lock();
        try {
            return doAssignmentPass();
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 回写 Agent 的执行结果。过期代际、已终结任务的回报直接忽略。
     */
    public void onTaskOutcome(TaskOutcome outcome) {
        if (outcome == null || StringUtils.isBlank(outcome.getTaskId())) {
            log.debug("Task outcome without task id ignored.");
            return;
        }
        registryLock.lock();
        try {
            AgentTaskEntity task = agentTaskRepository.findById(outcome.getTaskId());
            if (isStale(task, outcome)) {
                log.debug("Stale task outcome ignored. taskId={}, agent={}, attempt={}, status={}",
                        outcome.getTaskId(), outcome.getAgentName(), outcome.getExecutionAttempt(),
                        task == null ? null : task.getStatus());
                return;
            }
            if (outcome.isSuccess()) {
                task.complete(outcome.getResult());
                markTerminal(task);
                log.info("Task completed. taskId={}, agent={}, durationMillis={}",
                        task.getId(), outcome.getAgentName(), outcome.getDurationMillis());
            } else {
                TaskRecoveryDomainService.RecoveryDecision decision = taskRecoveryDomainService.applyFailure(
                        task, outcome.getError(), outcome.isCancelled(), true);
                if (decision == TaskRecoveryDomainService.RecoveryDecision.RETRY) {
                    retryCounter.increment();
                    log.info("Task requeued for retry. taskId={}, retry={}/{}, error={}",
                            task.getId(), task.getCurrentRetry(), task.getMaxRetries(), outcome.getError());
                } else if (decision.isTerminal()) {
                    markTerminal(task);
                    log.warn("Task ended without result. taskId={}, agent={}, status={}, reason={}",
                            task.getId(), outcome.getAgentName(), task.getStatus(), outcome.getError());
                }
            }
            doAssignmentPass();
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 取消任务；运行中的任务同时向 Agent 发出中断。
     *
     * @return 任务已处于终态时返回 false
     */
    public boolean cancelTask(String taskId, String reason) {
        registryLock.lock();
        try {
            AgentTaskEntity task = requireTask(taskId);
            if (task.isTerminal()) {
                return false;
            }
            cancelAndInterrupt(task, StringUtils.defaultIfBlank(reason, "Cancelled by request"));
            doAssignmentPass();
            return true;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 取消全部尚未开始执行的任务（PENDING/ASSIGNED）。
     */
    public int cancelPendingTasks(String reason) {
        registryLock.lock();
        try {
            int cancelled = 0;
            for (AgentTaskEntity task : agentTaskRepository.findAll()) {
                if (task.getStatus() == TaskStatusEnum.PENDING || task.getStatus() == TaskStatusEnum.ASSIGNED) {
                    task.cancel(reason);
                    markTerminal(task);
                    cancelled++;
                }
            }
            if (cancelled > 0) {
                log.info("Pending tasks cancelled. count={}, reason={}", cancelled, reason);
            }
            return cancelled;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 强制取消全部非终态任务，不等待 Agent 确认。
     */
    public int cancelAllNonTerminal(String reason) {
        registryLock.lock();
        try {
            int cancelled = 0;
            for (AgentTaskEntity task : agentTaskRepository.findAll()) {
                if (!task.isTerminal()) {
                    cancelAndInterrupt(task, reason);
                    cancelled++;
                }
            }
            if (cancelled > 0) {
                log.warn("Non-terminal tasks force-cancelled. count={}, reason={}", cancelled, reason);
            }
            return cancelled;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 等待任务进入终态，在锁外阻塞；超时返回 null，不影响任务状态。
     *
     * @throws AppException 任务不存在时抛出
     */
    public AgentTaskEntity awaitResult(String taskId, Duration timeout) {
        CompletableFuture<AgentTaskEntity> waiter;
        registryLock.lock();
        try {
            AgentTaskEntity task = requireTask(taskId);
            if (task.isTerminal()) {
                return task.snapshot();
            }
            waiter = resultWaiters.computeIfAbsent(taskId, key -> new CompletableFuture<>());
        } finally {
            registryLock.unlock();
        }
        long timeoutMillis = timeout == null ? 0L : Math.max(timeout.toMillis(), 0L);
        try {
            return waiter.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.debug("Result wait timed out. taskId={}, timeoutMillis={}", taskId, timeoutMillis);
            return null;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Result wait failed for task " + taskId, ex.getCause());
        }
    }

    public AgentTaskEntity getTask(String taskId) {
        registryLock.lock();
        try {
            AgentTaskEntity task = agentTaskRepository.findById(taskId);
            return task == null ? null : task.snapshot();
        } finally {
            registryLock.unlock();
        }
    }

    public List<AgentTaskEntity> listTasks() {
        registryLock.lock();
        try {
            return agentTaskRepository.findAll().stream()
                    .map(AgentTaskEntity::snapshot)
                    .collect(Collectors.toList());
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 从注册表移除终态任务；仍有非终态下游依赖时拒绝。
     */
    public AgentTaskEntity evictTask(String taskId) {
        registryLock.lock();
        try {
            AgentTaskEntity task = requireTask(taskId);
            if (!task.isTerminal()) {
                throw new AppException(ResponseCode.TASK_EVICTION_REJECTED,
                        "task " + taskId + " is " + task.getStatus());
            }
            List<String> liveDependents = agentTaskRepository.findDependents(taskId).stream()
                    .filter(dependent -> !dependent.isTerminal())
                    .map(AgentTaskEntity::getId)
                    .collect(Collectors.toList());
            if (!liveDependents.isEmpty()) {
                throw new AppException(ResponseCode.TASK_EVICTION_REJECTED,
                        "task " + taskId + " still referenced by " + liveDependents);
            }
            agentTaskRepository.deleteById(taskId);
            resultWaiters.remove(taskId);
            log.info("Task evicted. taskId={}, status={}", taskId, task.getStatus());
            return task.snapshot();
        } finally {
            registryLock.unlock();
        }
    }

    public Map<TaskStatusEnum, Long> countByStatus() {
        registryLock.lock();
        try {
            return agentTaskRepository.countByStatus();
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 依赖已满足、但没有任何已注册 Agent 能覆盖其能力要求的 PENDING 任务。
     */
    public List<String> findStarvedTaskIds() {
        registryLock.lock();
        try {
            List<AgentStatusSnapshot> agents = agentRegistryRepository.findAll().stream()
                    .map(WorkerAgent::getStatus)
                    .collect(Collectors.toList());
            Map<String, TaskStatusEnum> statusByTaskId = statusByTaskId();
            List<String> starved = new ArrayList<>();
            for (AgentTaskEntity task : agentTaskRepository.findByStatus(TaskStatusEnum.PENDING)) {
                TaskDependencyPolicy.DependencyDecision decision =
                        taskDependencyPolicy.resolveDependencyDecision(task, statusByTaskId);
                if (decision == TaskDependencyPolicy.DependencyDecision.SATISFIED
                        && taskAgentSelectionDomainService.findCapableAgents(task, agents).isEmpty()) {
                    starved.add(task.getId());
                }
            }
            return starved;
        } finally {
            registryLock.unlock();
        }
    }

    private AssignmentResult doAssignmentPass() {
        LocalDateTime now = LocalDateTime.now();
        int expiredCount = expireOverdueTasks(now);
        int timedOutCount = failTimedOutTasks(now);
        int cancelledCount = cancelBlockedTasks();

        List<AgentTaskEntity> readyTasks = collectReadyTasks(now);
        if (readyTasks.isEmpty()) {
            return new AssignmentResult(0, 0, 0, expiredCount, timedOutCount, cancelledCount);
        }

        Map<String, WorkerAgent> agentsByName = new LinkedHashMap<>();
        List<AgentStatusSnapshot> snapshots = new ArrayList<>();
        for (WorkerAgent agent : agentRegistryRepository.findAll()) {
            agentsByName.put(agent.getName(), agent);
            snapshots.add(agent.getStatus());
        }

        int assignedCount = 0;
        int waitingCount = 0;
        for (AgentTaskEntity task : taskDispatchDomainService.orderReadyTasks(readyTasks)) {
            if (tryDispatch(task, agentsByName, snapshots)) {
                assignedCount++;
            } else {
                waitingCount++;
            }
        }
        return new AssignmentResult(readyTasks.size(), assignedCount, waitingCount,
                expiredCount, timedOutCount, cancelledCount);
    }

    private boolean tryDispatch(AgentTaskEntity task,
                                Map<String, WorkerAgent> agentsByName,
                                List<AgentStatusSnapshot> snapshots) {
        Set<String> rejectedBy = new HashSet<>();
        while (true) {
            List<AgentStatusSnapshot> candidates = snapshots.stream()
                    .filter(snapshot -> !rejectedBy.contains(snapshot.getName()))
                    .collect(Collectors.toList());
            AgentStatusSnapshot selected = taskAgentSelectionDomainService.selectEligibleAgent(task, candidates);
            if (selected == null) {
                return false;
            }
            WorkerAgent agent = agentsByName.get(selected.getName());
            boolean accepted = agent != null && tryAssign(task, agent);
            if (agent != null) {
                refreshSnapshot(snapshots, agent);
            }
            if (accepted) {
                return true;
            }
            rejectedBy.add(selected.getName());
        }
    }

    private boolean tryAssign(AgentTaskEntity task, WorkerAgent agent) {
        task.assign(agent.getName());
        boolean accepted;
        try {
            accepted = agent.assignTask(task.snapshot());
        } catch (RuntimeException ex) {
            log.warn("Agent failed to accept task. taskId={}, agent={}, error={}",
                    task.getId(), agent.getName(), ex.getMessage());
            accepted = false;
        }
        if (!accepted) {
            task.rollbackToPending();
            log.debug("Task assignment rejected, back to PENDING. taskId={}, agent={}", task.getId(), agent.getName());
            return false;
        }
        task.start();
        assignedCounter.increment();
        messageBus.send(AgentMessageEntity.of(orchestratorId, agent.getName(),
                MessageTypeEnum.TASK_ASSIGNMENT, task.snapshot()));
        log.info("Task assigned. taskId={}, agent={}, priority={}, attempt={}",
                task.getId(), agent.getName(), task.getPriority(), task.getExecutionAttempt());
        return true;
    }

    private void refreshSnapshot(List<AgentStatusSnapshot> snapshots, WorkerAgent agent) {
        for (int i = 0; i < snapshots.size(); i++) {
            if (agent.getName().equals(snapshots.get(i).getName())) {
                snapshots.set(i, agent.getStatus());
                return;
            }
        }
    }

    private int expireOverdueTasks(LocalDateTime now) {
        int expired = 0;
        for (AgentTaskEntity task : agentTaskRepository.findAll()) {
            boolean waiting = task.getStatus() == TaskStatusEnum.PENDING || task.getStatus() == TaskStatusEnum.ASSIGNED;
            if (waiting && task.isDeadlinePassed(now)) {
                task.expire();
                markTerminal(task);
                expired++;
                log.warn("Task expired before completion. taskId={}, deadline={}", task.getId(), task.getDeadline());
            }
        }
        return expired;
    }

    private int failTimedOutTasks(LocalDateTime now) {
        int timedOut = 0;
        for (AgentTaskEntity task : agentTaskRepository.findByStatus(TaskStatusEnum.RUNNING)) {
            if (!task.isExecutionTimedOut(now)) {
                continue;
            }
            String agentName = task.getAssignedAgent();
            task.fail(TIMEOUT_REASON);
            markTerminal(task);
            timedOut++;
            interruptOnAgent(agentName, task.getId(), TIMEOUT_REASON);
            log.warn("Task execution timed out. taskId={}, agent={}, timeout={}",
                    task.getId(), agentName, task.getExecutionTimeout());
        }
        return timedOut;
    }

    private int cancelBlockedTasks() {
        Map<String, TaskStatusEnum> statusByTaskId = statusByTaskId();
        int cancelled = 0;
        boolean changed;
        do {
            changed = false;
            for (AgentTaskEntity task : agentTaskRepository.findByStatus(TaskStatusEnum.PENDING)) {
                TaskDependencyPolicy.DependencyDecision decision =
                        taskDependencyPolicy.resolveDependencyDecision(task, statusByTaskId);
                if (decision != TaskDependencyPolicy.DependencyDecision.BLOCKED) {
                    continue;
                }
                String blocker = findBlockingDependency(task, statusByTaskId);
                task.cancel("Cancelled: dependency " + blocker + " ended in " + statusByTaskId.get(blocker));
                markTerminal(task);
                statusByTaskId.put(task.getId(), task.getStatus());
                cancelled++;
                changed = true;
                log.info("Task cancelled due to failed dependency. taskId={}, dependency={}", task.getId(), blocker);
            }
        } while (changed);
        return cancelled;
    }

    private List<AgentTaskEntity> collectReadyTasks(LocalDateTime now) {
        Map<String, TaskStatusEnum> statusByTaskId = statusByTaskId();
        List<AgentTaskEntity> ready = new ArrayList<>();
        for (AgentTaskEntity task : agentTaskRepository.findByStatus(TaskStatusEnum.PENDING)) {
            if (task.isDeadlinePassed(now)) {
                continue;
            }
            if (taskDependencyPolicy.resolveDependencyDecision(task, statusByTaskId)
                    == TaskDependencyPolicy.DependencyDecision.SATISFIED) {
                ready.add(task);
            }
        }
        return ready;
    }

    private Map<String, TaskStatusEnum> statusByTaskId() {
        Map<String, TaskStatusEnum> statusByTaskId = new HashMap<>();
        for (AgentTaskEntity task : agentTaskRepository.findAll()) {
            statusByTaskId.put(task.getId(), task.getStatus());
        }
        return statusByTaskId;
    }

    private String findBlockingDependency(AgentTaskEntity task, Map<String, TaskStatusEnum> statusByTaskId) {
        for (String dependency : task.getDependencyTaskIds()) {
            TaskStatusEnum status = statusByTaskId.get(dependency);
            if (status != null && status.isBlocking()) {
                return dependency;
            }
        }
        return null;
    }

    private void cancelAndInterrupt(AgentTaskEntity task, String reason) {
        boolean running = task.getStatus() == TaskStatusEnum.RUNNING;
        String agentName = task.getAssignedAgent();
        task.cancel(reason);
        markTerminal(task);
        if (running) {
            interruptOnAgent(agentName, task.getId(), reason);
        }
        log.info("Task cancelled. taskId={}, agent={}, reason={}", task.getId(), agentName, reason);
    }

    private void interruptOnAgent(String agentName, String taskId, String reason) {
        WorkerAgent agent = agentRegistryRepository.findByName(agentName);
        if (agent == null) {
            return;
        }
        if (!agent.cancelTask(taskId, reason)) {
            log.debug("Agent had no in-flight execution to interrupt. taskId={}, agent={}", taskId, agentName);
        }
    }

    private void markTerminal(AgentTaskEntity task) {
        Counter.builder("agent.task.terminal.total")
                .tag("status", task.getStatus().name())
                .register(meterRegistry)
                .increment();
        CompletableFuture<AgentTaskEntity> waiter = resultWaiters.remove(task.getId());
        if (waiter != null) {
            waiter.complete(task.snapshot());
        }
    }

    private boolean isStale(AgentTaskEntity task, TaskOutcome outcome) {
        if (task == null || task.getStatus() != TaskStatusEnum.RUNNING) {
            return true;
        }
        if (outcome.getExecutionAttempt() != null
                && !Objects.equals(outcome.getExecutionAttempt(), task.getExecutionAttempt())) {
            return true;
        }
        return outcome.getAgentName() != null && !outcome.getAgentName().equals(task.getAssignedAgent());
    }

    private AgentTaskEntity requireTask(String taskId) {
        AgentTaskEntity task = agentTaskRepository.findById(taskId);
        if (task == null) {
            throw new AppException(ResponseCode.TASK_NOT_FOUND, taskId);
        }
        return task;
    }

    private Set<String> normalizeTags(Set<String> values) {
        Set<String> normalized = new LinkedHashSet<>();
        if (values == null) {
            return normalized;
        }
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                normalized.add(value.trim());
            }
        }
        return normalized;
    }

    public record AssignmentResult(int readyCount,
                                   int assignedCount,
                                   int waitingCount,
                                   int expiredCount,
                                   int timedOutCount,
                                   int cancelledCount) {

        public boolean hasActivity() {
            return assignedCount > 0 || expiredCount > 0 || timedOutCount > 0 || cancelledCount > 0;
        }
    }
}
