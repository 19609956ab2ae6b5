package com.agentic.trigger.job;

import com.agentic.trigger.application.command.TaskScheduleApplicationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * 调度守护：按固定间隔触发分配轮次，没有新提交或回报时也能处理截止时间与执行超时。
 */
@Slf4j
@Component
public class TaskSchedulerDaemon {

    private final TaskScheduleApplicationService taskScheduleApplicationService;
    private final TaskScheduler taskScheduler;
    private final long tickIntervalMs;
    private ScheduledFuture<?> tickFuture;

    public TaskSchedulerDaemon(TaskScheduleApplicationService taskScheduleApplicationService,
                               @Qualifier("daemonScheduler") TaskScheduler taskScheduler,
                               @Value("${coordinator.tick-interval-ms:1000}") long tickIntervalMs) {
        this.taskScheduleApplicationService = taskScheduleApplicationService;
        this.taskScheduler = taskScheduler;
        this.tickIntervalMs = tickIntervalMs <= 0 ? 1000L : tickIntervalMs;
    }

    public synchronized void start() {
        if (tickFuture != null) {
            return;
        }
        Duration interval = Duration.ofMillis(tickIntervalMs);
        tickFuture = taskScheduler.scheduleWithFixedDelay(this::tick, Instant.now().plus(interval), interval);
        log.info("Task scheduler daemon started. tickIntervalMs={}", tickIntervalMs);
    }

    public synchronized void stop() {
        if (tickFuture == null) {
            return;
        }
        tickFuture.cancel(false);
        tickFuture = null;
        log.info("Task scheduler daemon stopped.");
    }

    public synchronized boolean isRunning() {
        return tickFuture != null;
    }

    public void tick() {
        try {
            TaskScheduleApplicationService.AssignmentResult result = taskScheduleApplicationService.runAssignmentPass();
            if (result.hasActivity()) {
                log.debug("Assignment tick. ready={}, assigned={}, waiting={}, expired={}, timedOut={}, cancelled={}",
                        result.readyCount(), result.assignedCount(), result.waitingCount(),
                        result.expiredCount(), result.timedOutCount(), result.cancelledCount());
            }
        } catch (Exception ex) {
            log.warn("Assignment tick failed. error={}", ex.getMessage(), ex);
        }
    }
}
