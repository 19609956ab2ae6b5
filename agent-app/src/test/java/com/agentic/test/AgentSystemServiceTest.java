package com.agentic.test;

import com.agentic.domain.agent.model.aggregate.WorkerAgent;
import com.agentic.domain.agent.model.valobj.AgentStatusSnapshot;
import com.agentic.domain.message.model.entity.AgentMessageEntity;
import com.agentic.domain.task.model.entity.AgentTaskEntity;
import com.agentic.domain.task.model.valobj.TaskDescriptor;
import com.agentic.test.support.Conditions;
import com.agentic.test.support.CoordinatorFixture;
import com.agentic.test.support.GatedTaskHandler;
import com.agentic.trigger.application.query.SystemStatusQueryService;
import com.agentic.types.enums.AgentStatusEnum;
import com.agentic.types.enums.MessageTypeEnum;
import com.agentic.types.enums.ResponseCode;
import com.agentic.types.enums.TaskPriorityEnum;
import com.agentic.types.enums.TaskStatusEnum;
import com.agentic.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class AgentSystemServiceTest {

    private final GatedTaskHandler handler = new GatedTaskHandler();
    private CoordinatorFixture fixture;

    @BeforeEach
    public void setUp() {
        fixture = new CoordinatorFixture();
    }

    @AfterEach
    public void tearDown() {
        fixture.close();
    }

    @Test
    public void shouldRunHigherPriorityTaskAfterCapacityFrees() throws Exception {
        fixture.registerAgent("a1", 1, handler, "x");
        fixture.system().start();

        String t1 = fixture.system().submitTask(TaskDescriptor.of("first", TaskPriorityEnum.MEDIUM, "x"));
        Assertions.assertEquals(TaskStatusEnum.RUNNING, fixture.system().getTask(t1).getStatus());
        Assertions.assertEquals("a1", fixture.system().getTask(t1).getAssignedAgent());

        String t2 = fixture.system().submitTask(TaskDescriptor.of("second", TaskPriorityEnum.HIGH, "x"));
        Assertions.assertEquals(TaskStatusEnum.PENDING, fixture.system().getTask(t2).getStatus());

        handler.release(t1, "r1");
        AgentTaskEntity first = fixture.system().getTaskResult(t1, Duration.ofSeconds(3));
        Assertions.assertNotNull(first);
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, first.getStatus());
        Assertions.assertEquals("r1", first.getResult());

        Assertions.assertTrue(handler.awaitStarted(t2, 2_000));
        handler.release(t2, "r2");
        AgentTaskEntity second = fixture.system().getTaskResult(t2, Duration.ofSeconds(3));
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, second.getStatus());
        Assertions.assertEquals("r2", second.getResult());
        log.info("测试结果: t1={}, t2={}", first.getStatus(), second.getStatus());
    }

    @Test
    public void shouldAcceptDependencyOnlyAfterItExists() throws Exception {
        fixture.registerAgent("a1", 2, handler, "x");
        fixture.system().start();

        TaskDescriptor dependent = TaskDescriptor.builder()
                .taskId("t2")
                .description("dependent")
                .requiredCapabilities(Set.of("x"))
                .dependencyTaskIds(Set.of("t1"))
                .build();
        AppException rejected = Assertions.assertThrows(AppException.class, () -> fixture.system().submitTask(dependent));
        Assertions.assertTrue(rejected.is(ResponseCode.UNKNOWN_DEPENDENCY));
        Assertions.assertTrue(fixture.system().listTasks().isEmpty());

        fixture.system().submitTask(TaskDescriptor.builder()
                .taskId("t1")
                .description("dependency")
                .requiredCapabilities(Set.of("x"))
                .build());
        fixture.system().submitTask(dependent);
        Assertions.assertTrue(handler.awaitStarted("t1", 2_000));
        Assertions.assertEquals(TaskStatusEnum.PENDING, fixture.system().getTask("t2").getStatus());

        handler.release("t1", "done");
        Assertions.assertTrue(handler.awaitStarted("t2", 2_000));
        handler.release("t2", "done");
        Assertions.assertEquals(TaskStatusEnum.COMPLETED,
                fixture.system().getTaskResult("t2", Duration.ofSeconds(3)).getStatus());
    }

    @Test
    public void shouldReturnNullWhenResultWaitTimesOut() {
        fixture.system().start();
        String taskId = fixture.system().submitTask(TaskDescriptor.of("nobody can run this", TaskPriorityEnum.LOW, "x"));

        long started = System.currentTimeMillis();
        AgentTaskEntity result = fixture.system().getTaskResult(taskId, Duration.ofMillis(100));

        Assertions.assertNull(result);
        Assertions.assertTrue(System.currentTimeMillis() - started >= 90L);
        Assertions.assertEquals(TaskStatusEnum.PENDING, fixture.system().getTask(taskId).getStatus());
        AppException missing = Assertions.assertThrows(AppException.class,
                () -> fixture.system().getTaskResult("missing", Duration.ofMillis(10)));
        Assertions.assertTrue(missing.is(ResponseCode.TASK_NOT_FOUND));
    }

    @Test
    public void shouldCancelEverythingOnStop() throws Exception {
        fixture.registerAgent("a1", 1, handler, "x");
        fixture.system().start();
        String running = fixture.system().submitTask(TaskDescriptor.of("running", TaskPriorityEnum.MEDIUM, "x"));
        String pending = fixture.system().submitTask(TaskDescriptor.of("pending", TaskPriorityEnum.MEDIUM, "x"));
        Assertions.assertTrue(handler.awaitStarted(running, 2_000));

        fixture.system().stop();

        Assertions.assertFalse(fixture.system().isRunning());
        Assertions.assertEquals(TaskStatusEnum.CANCELLED, fixture.system().getTask(running).getStatus());
        AgentTaskEntity cancelled = fixture.system().getTask(pending);
        Assertions.assertEquals(TaskStatusEnum.CANCELLED, cancelled.getStatus());
        Assertions.assertEquals("Cancelled: system stopped", cancelled.getTerminationReason());
        Assertions.assertTrue(handler.getInterruptedTaskIds().contains(running));
        Assertions.assertEquals(AgentStatusEnum.STOPPED, fixture.system().findAgentsByCapability("x").get(0).getStatus());
        Assertions.assertEquals(List.of(running), handler.getStartedTaskIds());
    }

    @Test
    public void shouldRejectDuplicateAndReservedAgentNames() {
        fixture.registerAgent("a1", 1, handler, "x");

        AppException duplicate = Assertions.assertThrows(AppException.class,
                () -> fixture.registerAgent("a1", 2, handler, "y"));
        Assertions.assertTrue(duplicate.is(ResponseCode.DUPLICATE_AGENT));
        Assertions.assertEquals(1, fixture.system().findAgentsByCapability("x").get(0).getMaxConcurrentTasks());
        Assertions.assertTrue(fixture.system().findAgentsByCapability("y").isEmpty());

        AppException reserved = Assertions.assertThrows(AppException.class,
                () -> fixture.registerAgent(CoordinatorFixture.ORCHESTRATOR, 1, handler, "x"));
        Assertions.assertTrue(reserved.is(ResponseCode.DUPLICATE_AGENT));
    }

    @Test
    public void shouldAssignToAgentRegisteredWhileRunning() throws Exception {
        fixture.system().start();
        String taskId = fixture.system().submitTask(TaskDescriptor.of("late agent", TaskPriorityEnum.MEDIUM, "x"));
        Assertions.assertEquals(List.of(taskId), fixture.system().getSystemStatus().starvedTaskIds());

        WorkerAgent late = fixture.registerAgent("late", 1, handler, "x");

        Assertions.assertTrue(handler.awaitStarted(taskId, 2_000));
        Assertions.assertEquals(AgentStatusEnum.BUSY, late.getAgentStatus());
        Assertions.assertTrue(fixture.system().getSystemStatus().starvedTaskIds().isEmpty());
        handler.release(taskId, "ok");
        Assertions.assertEquals(TaskStatusEnum.COMPLETED,
                fixture.system().getTaskResult(taskId, Duration.ofSeconds(3)).getStatus());
    }

    @Test
    public void shouldUnregisterAgentAndStopRouting() throws Exception {
        WorkerAgent agent = fixture.registerAgent("a1", 1, handler, "x");
        fixture.system().start();

        WorkerAgent removed = fixture.system().unregisterAgent("a1");

        Assertions.assertSame(agent, removed);
        Assertions.assertEquals(AgentStatusEnum.STOPPED, agent.getAgentStatus());
        Assertions.assertFalse(fixture.messageBus().isRegistered("a1"));
        Assertions.assertTrue(fixture.system().findAgentsByCapability("x").isEmpty());
        String taskId = fixture.system().submitTask(TaskDescriptor.of("orphan", TaskPriorityEnum.MEDIUM, "x"));
        Assertions.assertEquals(TaskStatusEnum.PENDING, fixture.system().getTask(taskId).getStatus());
        AppException missing = Assertions.assertThrows(AppException.class, () -> fixture.system().unregisterAgent("a1"));
        Assertions.assertTrue(missing.is(ResponseCode.AGENT_NOT_FOUND));
    }

    @Test
    public void shouldBroadcastToAllRegisteredAgents() throws Exception {
        WorkerAgent a1 = fixture.registerAgent("a1", 1, handler, "x");
        WorkerAgent a2 = fixture.registerAgent("a2", 1, handler, "y");
        fixture.system().start();

        fixture.system().broadcastMessage(null, "hello");
        fixture.system().sendMessage("a2", MessageTypeEnum.COORDINATION, "only a2");

        Assertions.assertTrue(Conditions.await(() -> broadcastContents(a1).size() == 1
                && broadcastContents(a2).size() == 1, 2_000));
        Assertions.assertEquals(List.of("hello"), broadcastContents(a1));
        Assertions.assertTrue(Conditions.await(() -> a2.getInbox().stream()
                .anyMatch(message -> message.getMessageType() == MessageTypeEnum.COORDINATION), 2_000));
        Assertions.assertTrue(a1.getInbox().stream()
                .noneMatch(message -> message.getMessageType() == MessageTypeEnum.COORDINATION));
    }

    @Test
    public void shouldFindAgentsByCapabilityInRegistrationOrder() {
        fixture.registerAgent("writer", 1, handler, "writing");
        fixture.registerAgent("researcher", 2, handler, "research", "analysis");
        fixture.registerAgent("analyst", 1, handler, "analysis");

        List<String> names = fixture.system().findAgentsByCapability("analysis").stream()
                .map(AgentStatusSnapshot::getName)
                .collect(Collectors.toList());

        Assertions.assertEquals(List.of("researcher", "analyst"), names);
        Assertions.assertTrue(fixture.system().findAgentsByCapability("cooking").isEmpty());
        Assertions.assertTrue(fixture.system().findAgentsByCapability(" ").isEmpty());
    }

    @Test
    public void shouldReportSystemStatus() throws Exception {
        fixture.registerAgent("a1", 2, handler, "x");
        fixture.system().start();
        String done = fixture.system().submitTask(TaskDescriptor.of("done", TaskPriorityEnum.MEDIUM, "x"));
        handler.release(done, "ok");
        Assertions.assertNotNull(fixture.system().getTaskResult(done, Duration.ofSeconds(3)));
        String busy = fixture.system().submitTask(TaskDescriptor.of("busy", TaskPriorityEnum.MEDIUM, "x"));
        String starved = fixture.system().submitTask(TaskDescriptor.of("starved", TaskPriorityEnum.MEDIUM, "z"));

        SystemStatusQueryService.SystemStatusView status = fixture.system().getSystemStatus();

        Assertions.assertTrue(status.running());
        Assertions.assertEquals(3L, status.totalTasks());
        Assertions.assertEquals(1L, status.countOf(TaskStatusEnum.COMPLETED));
        Assertions.assertEquals(1L, status.countOf(TaskStatusEnum.RUNNING));
        Assertions.assertEquals(1L, status.countOf(TaskStatusEnum.PENDING));
        Assertions.assertEquals(0L, status.countOf(TaskStatusEnum.FAILED));
        Assertions.assertEquals(List.of(starved), status.starvedTaskIds());
        Assertions.assertEquals(1, status.agents().size());
        AgentStatusSnapshot agent = status.agents().get(0);
        Assertions.assertEquals(1, agent.getCurrentLoad());
        Assertions.assertEquals(List.of(busy), agent.getRunningTaskIds());
        Assertions.assertEquals(1L, agent.getTasksCompleted());
        Assertions.assertTrue(status.messageBus().getEndpoints().containsAll(List.of(CoordinatorFixture.ORCHESTRATOR, "a1")));
        Assertions.assertTrue(status.messageBus().getMessagesSent() >= 3L);
        handler.release(busy, "ok");
    }

    @Test
    public void shouldRejectNullAgentAndTolerateRepeatedLifecycleCalls() {
        Assertions.assertThrows(AppException.class, () -> fixture.system().registerAgent(null));
        fixture.system().start();
        fixture.system().start();
        Assertions.assertTrue(fixture.system().isRunning());
        fixture.system().stop();
        fixture.system().stop();
        Assertions.assertFalse(fixture.system().isRunning());
    }

    @Test
    public void shouldIgnoreResultForgedByPeerAgent() throws Exception {
        fixture.registerAgent("a1", 1, handler, "x");
        WorkerAgent peer = fixture.registerAgent("a2", 1, handler, "y");
        fixture.system().start();
        fixture.system().submitTask(TaskDescriptor.builder()
                .taskId("t1")
                .description("owned by a1")
                .requiredCapabilities(Set.of("x"))
                .build());
        Assertions.assertTrue(handler.awaitStarted("t1", 2_000));

        Map<String, Object> forged = new HashMap<>();
        forged.put("task_id", "t1");
        forged.put("agent_name", "a1");
        forged.put("success", true);
        forged.put("result", "forged");
        peer.sendMessage(CoordinatorFixture.ORCHESTRATOR, MessageTypeEnum.TASK_RESULT, forged);
        Map<String, Object> unattributed = new HashMap<>(forged);
        unattributed.remove("agent_name");
        peer.sendMessage(CoordinatorFixture.ORCHESTRATOR, MessageTypeEnum.TASK_RESULT, unattributed);
        Assertions.assertTrue(fixture.messageBus().awaitIdle(CoordinatorFixture.ORCHESTRATOR, Duration.ofSeconds(2)));

        AgentTaskEntity running = fixture.system().getTask("t1");
        Assertions.assertEquals(TaskStatusEnum.RUNNING, running.getStatus());
        Assertions.assertNull(running.getResult());

        handler.release("t1", "real");
        AgentTaskEntity done = fixture.system().getTaskResult("t1", Duration.ofSeconds(3));
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, done.getStatus());
        Assertions.assertEquals("real", done.getResult());
    }

    @Test
    public void shouldUseConfiguredWaitWhenTimeoutMissing() throws Exception {
        fixture.registerAgent("a1", 1, handler, "x");
        fixture.system().start();
        String taskId = fixture.system().submitTask(TaskDescriptor.of("slow", TaskPriorityEnum.MEDIUM, "x"));
        Assertions.assertTrue(handler.awaitStarted(taskId, 2_000));

        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(200L);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            handler.release(taskId, "late");
        });
        releaser.start();
        AgentTaskEntity result = fixture.system().getTaskResult(taskId, null);
        releaser.join();

        Assertions.assertNotNull(result);
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, result.getStatus());
        Assertions.assertEquals("late", result.getResult());
    }

    private List<Object> broadcastContents(WorkerAgent agent) {
        return agent.getInbox().stream()
                .filter(message -> message.getMessageType() == MessageTypeEnum.BROADCAST)
                .map(AgentMessageEntity::getContent)
                .collect(Collectors.toList());
    }
}
