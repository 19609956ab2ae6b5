package com.agentic.trigger.event;

import com.agentic.domain.message.model.entity.AgentMessageEntity;
import com.agentic.domain.task.model.valobj.TaskOutcome;
import com.agentic.trigger.application.command.TaskScheduleApplicationService;
import com.agentic.types.enums.MessageTypeEnum;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 编排器地址的消息处理器：把 TASK_RESULT / TASK_FAILURE 转换为执行结果交给调度器。
 * <p>
 * 消息内容可以是 {@link TaskOutcome}，也可以是包含 task_id/success/result/error 的 Map。
 * 执行 Agent 以总线上的发送方为准，内容中声明的 Agent 与发送方不一致时整条回报丢弃。
 * </p>
 */
@Slf4j
@Component
public class TaskOutcomeMessageListener {

    private final TaskScheduleApplicationService taskScheduleApplicationService;
    private final ObjectMapper objectMapper;

    public TaskOutcomeMessageListener(TaskScheduleApplicationService taskScheduleApplicationService,
                                      ObjectMapper objectMapper) {
        this.taskScheduleApplicationService = taskScheduleApplicationService;
        this.objectMapper = objectMapper;
    }

    public void onMessage(AgentMessageEntity message) {
        if (message == null || message.getMessageType() == null) {
            return;
        }
        if (!message.getMessageType().isTaskOutcome()) {
            log.debug("Orchestrator received message. messageId={}, sender={}, type={}",
                    message.getId(), message.getSender(), message.getMessageType());
            return;
        }
        TaskOutcome outcome = toOutcome(message);
        if (outcome == null) {
            log.warn("Unreadable task outcome dropped. messageId={}, sender={}, contentType={}",
                    message.getId(), message.getSender(),
                    message.getContent() == null ? null : message.getContent().getClass().getName());
            return;
        }
        if (StringUtils.isNotBlank(outcome.getAgentName()) && !outcome.getAgentName().equals(message.getSender())) {
            log.warn("Task outcome dropped, reported agent differs from sender. messageId={}, taskId={}, sender={}, reportedAgent={}",
                    message.getId(), outcome.getTaskId(), message.getSender(), outcome.getAgentName());
            return;
        }
        outcome.setAgentName(message.getSender());
        taskScheduleApplicationService.onTaskOutcome(outcome);
    }

    private TaskOutcome toOutcome(AgentMessageEntity message) {
        Object content = message.getContent();
        TaskOutcome outcome;
        if (content instanceof TaskOutcome) {
            TaskOutcome reported = (TaskOutcome) content;
            outcome = reported.toBuilder().build();
        } else if (content instanceof Map) {
            Map<?, ?> payload = (Map<?, ?>) content;
            try {
                outcome = objectMapper.convertValue(payload, TaskOutcome.class);
            } catch (IllegalArgumentException ex) {
                log.warn("Failed to convert task outcome payload. messageId={}, error={}", message.getId(), ex.getMessage());
                return null;
            }
            if (!payload.containsKey("success")) {
                outcome.setSuccess(message.getMessageType() == MessageTypeEnum.TASK_RESULT);
            }
        } else {
            return null;
        }
        if (StringUtils.isBlank(outcome.getTaskId())) {
            return null;
        }
        return outcome;
    }
}
