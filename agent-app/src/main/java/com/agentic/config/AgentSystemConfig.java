package com.agentic.config;

import com.agentic.domain.agent.adapter.handler.ITaskHandler;
import com.agentic.domain.agent.model.aggregate.WorkerAgent;
import com.agentic.trigger.service.AgentSystemService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Agent 系统装配：默认任务处理器，以及启动时按配置注册 Agent 并启动系统。
 *
 * @author agentic
 * @since 2026-10-17
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CoordinatorProperties.class)
public class AgentSystemConfig {

    public static final String DEFAULT_TASK_HANDLER = "defaultTaskHandler";

    @Bean(name = DEFAULT_TASK_HANDLER)
    public ITaskHandler defaultTaskHandler() {
        return task -> String.format("Task '%s' completed by %s", task.getDescription(), task.getAssignedAgent());
    }

    @Bean
    public ApplicationRunner agentSystemBootstrapRunner(AgentSystemService agentSystemService,
                                                        CoordinatorProperties properties,
                                                        Map<String, ITaskHandler> taskHandlers) {
        return args -> {
            for (CoordinatorProperties.AgentDefinition definition : properties.getAgents()) {
                agentSystemService.registerAgent(buildAgent(agentSystemService, properties, definition, taskHandlers));
            }
            if (properties.isAutoStart()) {
                agentSystemService.start();
            } else {
                log.info("Skip agent system start because coordinator.auto-start=false");
            }
        };
    }

    private WorkerAgent buildAgent(AgentSystemService agentSystemService,
                                   CoordinatorProperties properties,
                                   CoordinatorProperties.AgentDefinition definition,
                                   Map<String, ITaskHandler> taskHandlers) {
        if (StringUtils.isBlank(definition.getName())) {
            throw new IllegalStateException("Configured agent requires a name");
        }
        String handlerName = StringUtils.defaultIfBlank(definition.getHandler(), DEFAULT_TASK_HANDLER);
        ITaskHandler handler = taskHandlers.get(handlerName);
        if (handler == null) {
            throw new IllegalStateException("Task handler not found: agent=" + definition.getName()
                    + ", handler=" + handlerName);
        }
        Set<String> capabilities = new LinkedHashSet<>();
        if (definition.getCapabilities() != null) {
            definition.getCapabilities().stream()
                    .filter(StringUtils::isNotBlank)
                    .map(String::trim)
                    .forEach(capabilities::add);
        }
        int maxConcurrentTasks = definition.getMaxConcurrentTasks() == null
                ? properties.getDefaultMaxConcurrentTasks()
                : definition.getMaxConcurrentTasks();
        return agentSystemService.createAgent(definition.getName(), capabilities, maxConcurrentTasks, handler);
    }
}
