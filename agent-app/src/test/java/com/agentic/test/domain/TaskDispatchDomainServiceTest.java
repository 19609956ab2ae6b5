package com.agentic.test.domain;

import com.agentic.domain.task.model.entity.AgentTaskEntity;
import com.agentic.domain.task.service.TaskDispatchDomainService;
import com.agentic.types.enums.TaskPriorityEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public class TaskDispatchDomainServiceTest {

    private final TaskDispatchDomainService service = new TaskDispatchDomainService();

    @Test
    public void shouldOrderByPriorityDescendingThenSubmissionOrder() {
        List<AgentTaskEntity> ordered = service.orderReadyTasks(Arrays.asList(
                newTask("low-1", TaskPriorityEnum.LOW, 1L),
                newTask("medium-2", TaskPriorityEnum.MEDIUM, 2L),
                newTask("critical-3", TaskPriorityEnum.CRITICAL, 3L),
                newTask("medium-4", TaskPriorityEnum.MEDIUM, 4L),
                newTask("high-5", TaskPriorityEnum.HIGH, 5L)));

        Assertions.assertEquals(List.of("critical-3", "high-5", "medium-2", "medium-4", "low-1"),
                ordered.stream().map(AgentTaskEntity::getId).collect(Collectors.toList()));
    }

    @Test
    public void shouldKeepFifoWithinSameTier() {
        List<AgentTaskEntity> ordered = service.orderReadyTasks(Arrays.asList(
                newTask("late", TaskPriorityEnum.HIGH, 9L),
                newTask("early", TaskPriorityEnum.HIGH, 3L)));

        Assertions.assertEquals("early", ordered.get(0).getId());
    }

    @Test
    public void shouldSkipNullEntriesAndHandleEmptyInput() {
        Assertions.assertTrue(service.orderReadyTasks(null).isEmpty());
        Assertions.assertEquals(1, service.orderReadyTasks(Arrays.asList(null,
                newTask("only", TaskPriorityEnum.LOW, 1L))).size());
    }

    private AgentTaskEntity newTask(String id, TaskPriorityEnum priority, Long seq) {
        AgentTaskEntity task = new AgentTaskEntity();
        task.setId(id);
        task.setPriority(priority);
        task.setSubmissionSeq(seq);
        return task;
    }
}
