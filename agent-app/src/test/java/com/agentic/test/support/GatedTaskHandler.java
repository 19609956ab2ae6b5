package com.agentic.test.support;

import com.agentic.domain.agent.adapter.handler.ITaskHandler;
import com.agentic.domain.task.model.entity.AgentTaskEntity;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用任务处理器：每次执行阻塞到测试显式放行或判失败为止，执行结束后闸门作废，重试会拿到新的闸门。
 */
public class GatedTaskHandler implements ITaskHandler {

    private final ConcurrentMap<String, CompletableFuture<Object>> gates = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CountDownLatch> startLatches = new ConcurrentHashMap<>();
    private final List<String> startedTaskIds = new CopyOnWriteArrayList<>();
    private final List<String> interruptedTaskIds = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    @Override
    public Object handle(AgentTaskEntity task) throws Exception {
        startedTaskIds.add(task.getId());
        maxObservedConcurrency.accumulateAndGet(running.incrementAndGet(), Math::max);
        startLatch(task.getId()).countDown();
        CompletableFuture<Object> gate = gate(task.getId());
        try {
            return gate.get();
        } catch (InterruptedException ex) {
            interruptedTaskIds.add(task.getId());
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw ex;
        } finally {
            gates.remove(task.getId(), gate);
            running.decrementAndGet();
        }
    }

    public void release(String taskId, Object result) {
        gate(taskId).complete(result);
    }

    public void fail(String taskId, String error) {
        gate(taskId).completeExceptionally(new IllegalStateException(error));
    }

    public boolean awaitStarted(String taskId, long timeoutMillis) throws InterruptedException {
        return startLatch(taskId).await(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    public long startCount(String taskId) {
        return startedTaskIds.stream().filter(taskId::equals).count();
    }

    public List<String> getStartedTaskIds() {
        return startedTaskIds;
    }

    public List<String> getInterruptedTaskIds() {
        return interruptedTaskIds;
    }

    public int getMaxObservedConcurrency() {
        return maxObservedConcurrency.get();
    }

    private CompletableFuture<Object> gate(String taskId) {
        return gates.computeIfAbsent(taskId, key -> new CompletableFuture<>());
    }

    private CountDownLatch startLatch(String taskId) {
        return startLatches.computeIfAbsent(taskId, key -> new CountDownLatch(1));
    }
}
