package com.agentic.infrastructure.repository.agent;

import com.agentic.domain.agent.adapter.repository.IAgentRegistryRepository;
import com.agentic.domain.agent.model.aggregate.WorkerAgent;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Agent 注册表仓储实现类（进程内），保持注册顺序。
 *
 * @author agentic
 * @since 2026-10-17
 */
@Repository
public class InMemoryAgentRegistryRepository implements IAgentRegistryRepository {

    private final Map<String, WorkerAgent> agents = new LinkedHashMap<>();
    private final AtomicLong registrationSeq = new AtomicLong(0);

    @Override
    public synchronized boolean save(WorkerAgent agent) {
        if (agent == null || agents.containsKey(agent.getName())) {
            return false;
        }
        agent.setRegistrationOrder(registrationSeq.incrementAndGet());
        agents.put(agent.getName(), agent);
        return true;
    }

    @Override
    public synchronized WorkerAgent deleteByName(String name) {
        return name == null ? null : agents.remove(name);
    }

    @Override
    public synchronized WorkerAgent findByName(String name) {
        return name == null ? null : agents.get(name);
    }

    @Override
    public synchronized List<WorkerAgent> findAll() {
        return new ArrayList<>(agents.values());
    }

    @Override
    public synchronized boolean existsByName(String name) {
        return name != null && agents.containsKey(name);
    }
}
