package com.agentic.trigger.application.query;

import com.agentic.domain.agent.adapter.repository.IAgentRegistryRepository;
import com.agentic.domain.agent.model.aggregate.WorkerAgent;
import com.agentic.domain.agent.model.valobj.AgentStatusSnapshot;
import com.agentic.domain.message.adapter.bus.IMessageBus;
import com.agentic.domain.message.model.valobj.MessageBusStats;
import com.agentic.trigger.application.command.TaskScheduleApplicationService;
import com.agentic.types.enums.TaskStatusEnum;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 系统状态查询服务：聚合 Agent 快照、按状态的任务计数、饥饿任务与总线统计，只读。
 */
@Service
public class SystemStatusQueryService {

    private final IAgentRegistryRepository agentRegistryRepository;
    private final TaskScheduleApplicationService taskScheduleApplicationService;
    private final IMessageBus messageBus;

    public SystemStatusQueryService(IAgentRegistryRepository agentRegistryRepository,
                                    TaskScheduleApplicationService taskScheduleApplicationService,
                                    IMessageBus messageBus) {
        this.agentRegistryRepository = agentRegistryRepository;
        this.taskScheduleApplicationService = taskScheduleApplicationService;
        this.messageBus = messageBus;
    }

    public SystemStatusView query(boolean running) {
        List<AgentStatusSnapshot> agents = agentRegistryRepository.findAll().stream()
                .map(WorkerAgent::getStatus)
                .collect(Collectors.toList());
        Map<TaskStatusEnum, Long> taskCounts = taskScheduleApplicationService.countByStatus();
        long totalTasks = taskCounts.values().stream().mapToLong(Long::longValue).sum();
        return new SystemStatusView(
                running,
                agents,
                taskCounts,
                totalTasks,
                taskScheduleApplicationService.findStarvedTaskIds(),
                messageBus.getStats());
    }

    public record SystemStatusView(boolean running,
                                   List<AgentStatusSnapshot> agents,
                                   Map<TaskStatusEnum, Long> taskCounts,
                                   long totalTasks,
                                   List<String> starvedTaskIds,
                                   MessageBusStats messageBus) {

        public long countOf(TaskStatusEnum status) {
            Long count = taskCounts == null ? null : taskCounts.get(status);
            return count == null ? 0L : count;
        }
    }
}
