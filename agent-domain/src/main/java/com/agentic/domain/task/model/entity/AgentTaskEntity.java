package com.agentic.domain.task.model.entity;

import com.agentic.types.enums.TaskPriorityEnum;
import com.agentic.types.enums.TaskStatusEnum;
import lombok.Data;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 任务领域实体
 * <p>
 * 状态只通过本类的迁移方法推进：
 * PENDING -> ASSIGNED -> RUNNING -> COMPLETED/FAILED；
 * PENDING/ASSIGNED -> EXPIRED；任意非终态 -> CANCELLED。
 * result 仅在 COMPLETED 时非空，failureReason 仅在 FAILED 时非空。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
@Data
public class AgentTaskEntity {

    /**
     * 任务 ID
     */
    private String id;

    /**
     * 任务描述
     */
    private String description;

    /**
     * 所需能力标签
     */
    private Set<String> requiredCapabilities;

    /**
     * 优先级
     */
    private TaskPriorityEnum priority;

    /**
     * 依赖任务 IDs
     */
    private Set<String> dependencyTaskIds;

    /**
     * 任务参数，原样交给执行方
     */
    private Map<String, Object> parameters;

    /**
     * 截止时间，超过仍未开始执行则过期
     */
    private LocalDateTime deadline;

    /**
     * 单次执行超时
     */
    private Duration executionTimeout;

    /**
     * 状态
     */
    private TaskStatusEnum status;

    /**
     * 当前分配的 Agent 名称
     */
    private String assignedAgent;

    /**
     * 执行结果 (仅 COMPLETED)
     */
    private Object result;

    /**
     * 失败原因 (仅 FAILED)
     */
    private String failureReason;

    /**
     * 过期或取消说明
     */
    private String terminationReason;

    /**
     * 最近一次执行错误，重试后保留
     */
    private String lastError;

    /**
     * 最大重试次数
     */
    private Integer maxRetries;

    /**
     * 当前重试次数
     */
    private Integer currentRetry;

    /**
     * 执行代际（每次分配递增）
     */
    private Integer executionAttempt;

    /**
     * 提交序号，同一时间戳内保证 FIFO
     */
    private Long submissionSeq;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 分配时间
     */
    private LocalDateTime assignedAt;

    /**
     * 开始执行时间
     */
    private LocalDateTime startedAt;

    /**
     * 进入终态时间
     */
    private LocalDateTime completedAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 验证任务是否有效
     */
    public void validate() {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalStateException("Task ID cannot be empty");
        }
        if (priority == null) {
            throw new IllegalStateException("Priority cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (requiredCapabilities == null) {
            throw new IllegalStateException("Required capabilities cannot be null");
        }
        if (dependencyTaskIds == null) {
            throw new IllegalStateException("Dependency task IDs cannot be null");
        }
        if (dependencyTaskIds.contains(id)) {
            throw new IllegalStateException("Task cannot depend on itself: " + id);
        }
    }

    /**
     * 分配给 Agent
     */
    public void assign(String agentName) {
        if (this.status != TaskStatusEnum.PENDING) {
            throw new IllegalStateException("Task must be in PENDING status to be assigned, current: " + this.status);
        }
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalStateException("Agent name cannot be empty");
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = TaskStatusEnum.ASSIGNED;
        this.assignedAgent = agentName;
        this.assignedAt = now;
        this.executionAttempt = normalizedExecutionAttempt() + 1;
        this.updatedAt = now;
    }

    /**
     * Agent 拒绝接收，退回待处理
     */
    public void rollbackToPending() {
        if (this.status != TaskStatusEnum.ASSIGNED) {
            throw new IllegalStateException("Only ASSIGNED tasks can be rolled back to PENDING");
        }
        this.status = TaskStatusEnum.PENDING;
        this.assignedAgent = null;
        this.assignedAt = null;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 开始执行
     */
    public void start() {
        if (this.status != TaskStatusEnum.ASSIGNED) {
            throw new IllegalStateException("Task must be in ASSIGNED status to start");
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = TaskStatusEnum.RUNNING;
        this.startedAt = now;
        this.updatedAt = now;
    }

    /**
     * 完成任务
     */
    public void complete(Object result) {
        if (this.status != TaskStatusEnum.RUNNING) {
            throw new IllegalStateException("Task must be in RUNNING status to complete");
        }
        this.status = TaskStatusEnum.COMPLETED;
        this.result = result;
        this.failureReason = null;
        markTerminal();
    }

    /**
     * 失败任务
     */
    public void fail(String reason) {
        if (this.status != TaskStatusEnum.RUNNING) {
            throw new IllegalStateException("Task must be in RUNNING status to fail");
        }
        this.status = TaskStatusEnum.FAILED;
        this.failureReason = reason == null || reason.isBlank() ? "Task execution failed" : reason;
        this.lastError = this.failureReason;
        this.result = null;
        markTerminal();
    }

    /**
     * 截止时间已过，标记过期
     */
    public void expire() {
        if (this.status != TaskStatusEnum.PENDING && this.status != TaskStatusEnum.ASSIGNED) {
            throw new IllegalStateException("Only PENDING or ASSIGNED tasks can expire");
        }
        this.status = TaskStatusEnum.EXPIRED;
        this.terminationReason = "Deadline exceeded at " + this.deadline;
        this.assignedAgent = null;
        markTerminal();
    }

    /**
     * 取消任务
     */
    public void cancel(String reason) {
        if (isTerminal()) {
            throw new IllegalStateException("Terminal task cannot be cancelled: " + this.status);
        }
        this.status = TaskStatusEnum.CANCELLED;
        this.terminationReason = reason == null || reason.isBlank() ? "Cancelled" : reason;
        this.result = null;
        markTerminal();
    }

    /**
     * 失败后重新排队
     */
    public void retry(String error) {
        if (this.status != TaskStatusEnum.RUNNING) {
            throw new IllegalStateException("Task must be in RUNNING status to retry");
        }
        if (!hasRetryBudget()) {
            throw new IllegalStateException("Max retries exceeded");
        }
        this.currentRetry = normalizedCurrentRetry() + 1;
        this.lastError = error;
        this.status = TaskStatusEnum.PENDING;
        this.assignedAgent = null;
        this.assignedAt = null;
        this.startedAt = null;
        this.updatedAt = LocalDateTime.now();
    }

    private void markTerminal() {
        LocalDateTime now = LocalDateTime.now();
        this.completedAt = now;
        this.updatedAt = now;
    }

    public boolean isTerminal() {
        return this.status != null && this.status.isTerminal();
    }

    public boolean isDeadlinePassed(LocalDateTime now) {
        return this.deadline != null && now != null && this.deadline.isBefore(now);
    }

    public boolean isExecutionTimedOut(LocalDateTime now) {
        if (this.status != TaskStatusEnum.RUNNING || this.executionTimeout == null
                || this.startedAt == null || now == null) {
            return false;
        }
        return this.startedAt.plus(this.executionTimeout).isBefore(now);
    }

    public int normalizedCurrentRetry() {
        return this.currentRetry == null ? 0 : Math.max(this.currentRetry, 0);
    }

    public int normalizedMaxRetries() {
        return this.maxRetries == null ? 0 : Math.max(this.maxRetries, 0);
    }

    public int normalizedExecutionAttempt() {
        return this.executionAttempt == null ? 0 : Math.max(this.executionAttempt, 0);
    }

    public boolean hasRetryBudget() {
        return normalizedCurrentRetry() < normalizedMaxRetries();
    }

    /**
     * 检查是否有依赖
     */
    public boolean hasDependencies() {
        return this.dependencyTaskIds != null && !this.dependencyTaskIds.isEmpty();
    }

    /**
     * 生成对外快照，集合字段独立拷贝，调用方修改不会影响注册表。
     */
    public AgentTaskEntity snapshot() {
        AgentTaskEntity copy = new AgentTaskEntity();
        copy.setId(id);
        copy.setDescription(description);
        copy.setRequiredCapabilities(requiredCapabilities == null ? new LinkedHashSet<>() : new LinkedHashSet<>(requiredCapabilities));
        copy.setPriority(priority);
        copy.setDependencyTaskIds(dependencyTaskIds == null ? new LinkedHashSet<>() : new LinkedHashSet<>(dependencyTaskIds));
        copy.setParameters(parameters == null ? new HashMap<>() : new HashMap<>(parameters));
        copy.setDeadline(deadline);
        copy.setExecutionTimeout(executionTimeout);
        copy.setStatus(status);
        copy.setAssignedAgent(assignedAgent);
        copy.setResult(result);
        copy.setFailureReason(failureReason);
        copy.setTerminationReason(terminationReason);
        copy.setLastError(lastError);
        copy.setMaxRetries(maxRetries);
        copy.setCurrentRetry(currentRetry);
        copy.setExecutionAttempt(executionAttempt);
        copy.setSubmissionSeq(submissionSeq);
        copy.setCreatedAt(createdAt);
        copy.setAssignedAt(assignedAt);
        copy.setStartedAt(startedAt);
        copy.setCompletedAt(completedAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
