package com.agentic.domain.task.service;

import com.agentic.domain.task.model.entity.AgentTaskEntity;
import com.agentic.types.enums.TaskStatusEnum;

import java.util.Map;

/**
 * Task 依赖判定策略：根据依赖任务状态返回任务可推进决策。
 */
public interface TaskDependencyPolicy {

    DependencyDecision resolveDependencyDecision(AgentTaskEntity task,
                                                 Map<String, TaskStatusEnum> statusByTaskId);

    enum DependencyDecision {
        SATISFIED,
        WAITING,
        BLOCKED
    }
}
