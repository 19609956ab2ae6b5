package com.agentic.domain.task.model.valobj;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent 回报的单次执行结果，作为 TASK_RESULT / TASK_FAILURE 消息内容。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskOutcome {

    /**
     * 任务 ID
     */
    @JsonAlias("task_id")
    private String taskId;

    /**
     * 执行 Agent
     */
    @JsonAlias({"agent", "agent_name"})
    private String agentName;

    /**
     * 执行代际，用于丢弃过期回报
     */
    @JsonAlias("execution_attempt")
    private Integer executionAttempt;

    /**
     * 是否成功
     */
    private boolean success;

    /**
     * 是否因取消而结束
     */
    private boolean cancelled;

    /**
     * 执行结果
     */
    private Object result;

    /**
     * 错误信息
     */
    private String error;

    /**
     * 执行耗时（毫秒）
     */
    @JsonAlias("duration_millis")
    private long durationMillis;

    public static TaskOutcome success(String taskId, String agentName, Integer attempt, Object result, long durationMillis) {
        return new TaskOutcome(taskId, agentName, attempt, true, false, result, null, durationMillis);
    }

    public static TaskOutcome failure(String taskId, String agentName, Integer attempt, String error, long durationMillis) {
        return new TaskOutcome(taskId, agentName, attempt, false, false, null, error, durationMillis);
    }

    public static TaskOutcome cancelled(String taskId, String agentName, Integer attempt, String reason, long durationMillis) {
        return new TaskOutcome(taskId, agentName, attempt, false, true, null, reason, durationMillis);
    }
}
