package com.agentic.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 协调核心配置属性，前缀 coordinator。
 *
 * @author agentic
 * @since 2026-10-17
 */
@Data
@ConfigurationProperties(prefix = "coordinator", ignoreInvalidFields = true)
public class CoordinatorProperties {

    /** 周期分配间隔（毫秒），默认1000 */
    private Long tickIntervalMs = 1000L;

    /** 结果等待默认超时（毫秒），默认30000 */
    private Long resultWaitTimeoutMs = 30000L;

    /** Agent 停止宽限期（毫秒），默认5000 */
    private Long agentStopGraceMs = 5000L;

    /** Agent 未声明并发上限时的默认值 */
    private Integer defaultMaxConcurrentTasks = 1;

    /** 任务未声明重试次数时的默认值，0 表示不重试 */
    private Integer defaultMaxRetries = 0;

    /** 编排器在消息总线上的地址 */
    private String orchestratorId = "orchestrator";

    /** 每个 Agent 保留的最近消息数 */
    private Integer agentInboxSize = 100;

    /** 消息总线保留的历史消息数 */
    private Integer messageHistorySize = 1000;

    /** 注册完配置的 Agent 后是否自动启动 */
    private boolean autoStart = true;

    /** 启动时注册的 Agent */
    private List<AgentDefinition> agents = new ArrayList<>();

    @Data
    public static class AgentDefinition {

        /** Agent 名称 */
        private String name;

        /** 能力标签 */
        private List<String> capabilities = new ArrayList<>();

        /** 最大并发任务数，为空时取 defaultMaxConcurrentTasks */
        private Integer maxConcurrentTasks;

        /** ITaskHandler Bean 名称，为空时使用默认处理器 */
        private String handler;
    }
}
