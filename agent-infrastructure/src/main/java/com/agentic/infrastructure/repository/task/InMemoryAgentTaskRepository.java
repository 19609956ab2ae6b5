package com.agentic.infrastructure.repository.task;

import com.agentic.domain.task.adapter.repository.IAgentTaskRepository;
import com.agentic.domain.task.model.entity.AgentTaskEntity;
import com.agentic.types.enums.TaskStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * 任务仓储实现类（进程内）。
 * <p>
 * 实体按引用保存，状态推进直接作用于保存的对象；读取方对外暴露前需自行生成快照。
 * 列表查询统一按提交序号排序。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
@Slf4j
@Repository
public class InMemoryAgentTaskRepository implements IAgentTaskRepository {

    private static final Comparator<AgentTaskEntity> SUBMISSION_ORDER = Comparator
            .comparing(AgentTaskEntity::getSubmissionSeq, Comparator.nullsLast(Long::compareTo))
            .thenComparing(AgentTaskEntity::getId);

    private final ConcurrentMap<String, AgentTaskEntity> tasks = new ConcurrentHashMap<>();

    @Override
    public AgentTaskEntity save(AgentTaskEntity entity) {
        entity.validate();
        tasks.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public boolean deleteById(String id) {
        if (id == null) {
            return false;
        }
        boolean removed = tasks.remove(id) != null;
        if (removed) {
            log.debug("Task removed from registry. taskId={}", id);
        }
        return removed;
    }

    @Override
    public AgentTaskEntity findById(String id) {
        return id == null ? null : tasks.get(id);
    }

    @Override
    public boolean existsById(String id) {
        return id != null && tasks.containsKey(id);
    }

    @Override
    public List<AgentTaskEntity> findAll() {
        return tasks.values().stream()
                .sorted(SUBMISSION_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public List<AgentTaskEntity> findByStatus(TaskStatusEnum status) {
        return tasks.values().stream()
                .filter(task -> task.getStatus() == status)
                .sorted(SUBMISSION_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public List<AgentTaskEntity> findDependents(String taskId) {
        return tasks.values().stream()
                .filter(task -> task.getDependencyTaskIds() != null && task.getDependencyTaskIds().contains(taskId))
                .sorted(SUBMISSION_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public Map<TaskStatusEnum, Long> countByStatus() {
        Map<TaskStatusEnum, Long> counts = new EnumMap<>(TaskStatusEnum.class);
        for (TaskStatusEnum status : TaskStatusEnum.values()) {
            counts.put(status, 0L);
        }
        for (AgentTaskEntity task : tasks.values()) {
            counts.merge(task.getStatus(), 1L, Long::sum);
        }
        return counts;
    }
}
