package com.agentic.domain.task.service;

import com.agentic.domain.task.model.entity.AgentTaskEntity;
import com.agentic.types.enums.ResponseCode;
import com.agentic.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Task 依赖图校验领域服务：提交时拒绝未知依赖、自依赖与成环依赖。
 */
@Service
public class TaskDependencyGraphDomainService {

    /**
     * 校验待提交任务的依赖集合。
     *
     * @param taskId       待提交任务 ID
     * @param dependencies 依赖任务 IDs
     * @param registry     注册表查询函数，未知 ID 返回 null
     * @throws AppException 依赖不合法时抛出，任务不得进入注册表
     */
    public void validateDependencies(String taskId,
                                     Set<String> dependencies,
                                     Function<String, AgentTaskEntity> registry) {
        if (dependencies == null || dependencies.isEmpty()) {
            return;
        }
        for (String dependency : dependencies) {
            if (StringUtils.isBlank(dependency)) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "blank dependency id");
            }
            if (dependency.equals(taskId)) {
                throw new AppException(ResponseCode.DEPENDENCY_CYCLE, "task " + taskId + " depends on itself");
            }
            if (registry.apply(dependency) == null) {
                throw new AppException(ResponseCode.UNKNOWN_DEPENDENCY, dependency);
            }
        }
        if (reaches(dependencies, taskId, registry)) {
            throw new AppException(ResponseCode.DEPENDENCY_CYCLE, "dependency closure of " + taskId + " contains itself");
        }
    }

    private boolean reaches(Set<String> roots, String target, Function<String, AgentTaskEntity> registry) {
        Deque<String> stack = new ArrayDeque<>(roots);
        Set<String> visited = new HashSet<>();
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            if (current.equals(target)) {
                return true;
            }
            AgentTaskEntity node = registry.apply(current);
            if (node == null || node.getDependencyTaskIds() == null) {
                continue;
            }
            for (String next : node.getDependencyTaskIds()) {
                if (next != null && !visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        return false;
    }
}
