package com.agentic.domain.agent.model.valobj;

import com.agentic.types.enums.AgentStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Agent 状态只读快照。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStatusSnapshot {

    /**
     * Agent 名称
     */
    private String name;

    /**
     * 能力标签
     */
    private Set<String> capabilities;

    /**
     * 最大并发任务数
     */
    private int maxConcurrentTasks;

    /**
     * 当前在途任务数
     */
    private int currentLoad;

    /**
     * 状态
     */
    private AgentStatusEnum status;

    /**
     * 注册顺序
     */
    private long registrationOrder;

    /**
     * 在途任务 IDs
     */
    private List<String> runningTaskIds;

    /**
     * 成功任务数
     */
    private long tasksCompleted;

    /**
     * 失败任务数
     */
    private long tasksFailed;

    /**
     * 累计执行耗时（毫秒）
     */
    private long totalExecutionMillis;

    /**
     * 最近活动时间
     */
    private LocalDateTime lastActivity;

    public int spareCapacity() {
        return Math.max(maxConcurrentTasks - currentLoad, 0);
    }

    public boolean isAcceptingTasks() {
        return status != AgentStatusEnum.STOPPED && spareCapacity() > 0;
    }

    public boolean covers(Set<String> requiredCapabilities) {
        if (requiredCapabilities == null || requiredCapabilities.isEmpty()) {
            return true;
        }
        return capabilities != null && capabilities.containsAll(requiredCapabilities);
    }
}
