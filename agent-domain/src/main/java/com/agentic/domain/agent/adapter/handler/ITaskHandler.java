package com.agentic.domain.agent.adapter.handler;

import com.agentic.domain.task.model.entity.AgentTaskEntity;

/**
 * 任务执行接口，由具体业务实现。
 * <p>
 * 在 Agent 的工作线程上调用，可长时间运行；取消时线程会被中断，实现方应响应中断。
 * 返回值作为任务结果，抛出异常视为执行失败。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
@FunctionalInterface
public interface ITaskHandler {

    /**
     * 执行任务
     *
     * @param task 任务快照
     * @return 执行结果
     */
    Object handle(AgentTaskEntity task) throws Exception;
}
