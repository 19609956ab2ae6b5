package com.agentic.domain.agent.adapter.repository;

import com.agentic.domain.agent.model.aggregate.WorkerAgent;

import java.util.List;

/**
 * Agent 注册表仓储接口
 *
 * @author agentic
 * @since 2026-10-17
 */
public interface IAgentRegistryRepository {

    /**
     * 注册 Agent 并写入注册顺序，名称已存在时返回 false
     */
    boolean save(WorkerAgent agent);

    /**
     * 根据名称删除
     */
    WorkerAgent deleteByName(String name);

    /**
     * 根据名称查询
     */
    WorkerAgent findByName(String name);

    /**
     * 查询所有 Agent，按注册顺序
     */
    List<WorkerAgent> findAll();

    /**
     * 检查名称是否存在
     */
    boolean existsByName(String name);
}
