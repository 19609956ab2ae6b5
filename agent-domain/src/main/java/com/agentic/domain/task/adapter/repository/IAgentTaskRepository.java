package com.agentic.domain.task.adapter.repository;

import com.agentic.domain.task.model.entity.AgentTaskEntity;
import com.agentic.types.enums.TaskStatusEnum;

import java.util.List;
import java.util.Map;

/**
 * 任务注册表仓储接口
 * <p>
 * 调度器是唯一写入方，所有访问均在调度器的互斥锁内完成。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
public interface IAgentTaskRepository {

    /**
     * 保存任务
     */
    AgentTaskEntity save(AgentTaskEntity entity);

    /**
     * 根据 ID 删除
     */
    boolean deleteById(String id);

    /**
     * 根据 ID 查询
     */
    AgentTaskEntity findById(String id);

    /**
     * 检查 ID 是否存在
     */
    boolean existsById(String id);

    /**
     * 查询所有任务，按提交顺序
     */
    List<AgentTaskEntity> findAll();

    /**
     * 根据状态查询，按提交顺序
     */
    List<AgentTaskEntity> findByStatus(TaskStatusEnum status);

    /**
     * 查询依赖给定任务的任务
     */
    List<AgentTaskEntity> findDependents(String taskId);

    /**
     * 按状态聚合任务数量
     */
    Map<TaskStatusEnum, Long> countByStatus();
}
