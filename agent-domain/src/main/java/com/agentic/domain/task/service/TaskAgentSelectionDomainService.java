package com.agentic.domain.task.service;

import com.agentic.domain.agent.model.valobj.AgentStatusSnapshot;
import com.agentic.domain.task.model.entity.AgentTaskEntity;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Task Agent 选择领域服务：在可接收的 Agent 中选出空余并发最多者，
 * 再按注册顺序、名称字典序决出。
 */
@Service
public class TaskAgentSelectionDomainService {

    private static final Comparator<AgentStatusSnapshot> PREFERENCE = Comparator
            .comparingInt(AgentStatusSnapshot::spareCapacity).reversed()
            .thenComparingLong(AgentStatusSnapshot::getRegistrationOrder)
            .thenComparing(AgentStatusSnapshot::getName, Comparator.nullsLast(String::compareTo));

    public AgentStatusSnapshot selectEligibleAgent(AgentTaskEntity task, List<AgentStatusSnapshot> agents) {
        if (task == null || agents == null || agents.isEmpty()) {
            return null;
        }
        return agents.stream()
                .filter(agent -> isEligible(task, agent))
                .min(PREFERENCE)
                .orElse(null);
    }

    public boolean isEligible(AgentTaskEntity task, AgentStatusSnapshot agent) {
        if (task == null || agent == null) {
            return false;
        }
        return agent.isAcceptingTasks() && agent.covers(task.getRequiredCapabilities());
    }

    /**
     * 忽略负载，只看能力是否覆盖；返回空列表表示当前没有任何 Agent 能执行该任务。
     */
    public List<AgentStatusSnapshot> findCapableAgents(AgentTaskEntity task, List<AgentStatusSnapshot> agents) {
        if (task == null || agents == null || agents.isEmpty()) {
            return Collections.emptyList();
        }
        List<AgentStatusSnapshot> capable = new ArrayList<>();
        for (AgentStatusSnapshot agent : agents) {
            if (agent != null && agent.covers(task.getRequiredCapabilities())) {
                capable.add(agent);
            }
        }
        return capable;
    }
}
