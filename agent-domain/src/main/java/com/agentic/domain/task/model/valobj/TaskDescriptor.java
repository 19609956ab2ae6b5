package com.agentic.domain.task.model.valobj;

import com.agentic.types.enums.TaskPriorityEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;

/**
 * 任务提交描述。taskId 为空时由调度器生成。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskDescriptor {

    /**
     * 调用方指定的任务 ID，可选
     */
    private String taskId;

    /**
     * 任务描述
     */
    private String description;

    /**
     * 所需能力标签
     */
    private Set<String> requiredCapabilities;

    /**
     * 优先级，默认 MEDIUM
     */
    private TaskPriorityEnum priority;

    /**
     * 依赖任务 IDs
     */
    private Set<String> dependencyTaskIds;

    /**
     * 截止时间
     */
    private LocalDateTime deadline;

    /**
     * 单次执行超时
     */
    private Duration executionTimeout;

    /**
     * 最大重试次数，为空时使用系统默认值
     */
    private Integer maxRetries;

    /**
     * 任务参数
     */
    private Map<String, Object> parameters;

    public static TaskDescriptor of(String description, TaskPriorityEnum priority, String... capabilities) {
        return TaskDescriptor.builder()
                .description(description)
                .priority(priority)
                .requiredCapabilities(capabilities == null ? Set.of() : Set.of(capabilities))
                .build();
    }
}
