package com.agentic.domain.task.service;

import com.agentic.domain.task.model.entity.AgentTaskEntity;
import com.agentic.types.enums.TaskStatusEnum;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;

/**
 * Task 依赖判定领域服务：全部依赖 COMPLETED 才可执行，任一依赖进入
 * FAILED/EXPIRED/CANCELLED 即阻断（下游随之取消）。
 */
@Service
public class TaskDependencyPolicyDomainService implements TaskDependencyPolicy {

    @Override
    public DependencyDecision resolveDependencyDecision(AgentTaskEntity task,
                                                        Map<String, TaskStatusEnum> statusByTaskId) {
        if (task == null || task.getStatus() != TaskStatusEnum.PENDING) {
            return DependencyDecision.WAITING;
        }

        Set<String> dependencies = task.getDependencyTaskIds();
        if (dependencies == null || dependencies.isEmpty()) {
            return DependencyDecision.SATISFIED;
        }

        if (statusByTaskId == null || statusByTaskId.isEmpty()) {
            return DependencyDecision.WAITING;
        }

        DependencyStatusSummary summary = summarizeDependencies(dependencies, statusByTaskId);
        if (summary.blockedCount > 0) {
            return DependencyDecision.BLOCKED;
        }
        if (summary.completedCount == summary.total) {
            return DependencyDecision.SATISFIED;
        }
        return DependencyDecision.WAITING;
    }

    private DependencyStatusSummary summarizeDependencies(Set<String> dependencies,
                                                          Map<String, TaskStatusEnum> statusByTaskId) {
        int completed = 0;
        int blocked = 0;
        int unresolved = 0;

        for (String dependency : dependencies) {
            TaskStatusEnum status = dependency == null ? null : statusByTaskId.get(dependency);
            if (status == TaskStatusEnum.COMPLETED) {
                completed++;
                continue;
            }
            if (status != null && status.isBlocking()) {
                blocked++;
                continue;
            }
            unresolved++;
        }

        return new DependencyStatusSummary(dependencies.size(), completed, blocked, unresolved);
    }

    private record DependencyStatusSummary(int total,
                                           int completedCount,
                                           int blockedCount,
                                           int unresolvedCount) {
    }
}
