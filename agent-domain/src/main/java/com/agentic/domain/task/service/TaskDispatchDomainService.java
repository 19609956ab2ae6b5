package com.agentic.domain.task.service;

import com.agentic.domain.task.model.entity.AgentTaskEntity;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Task 调度顺序领域服务：优先级降序，同优先级按提交序号升序 (FIFO)。
 * 提交序号在调度器锁内单调分配，不受系统时钟回拨影响。
 */
@Service
public class TaskDispatchDomainService {

    public static final Comparator<AgentTaskEntity> DISPATCH_ORDER = Comparator
            .comparing((AgentTaskEntity task) -> task.getPriority() == null ? 0 : task.getPriority().getLevel(),
                    Comparator.reverseOrder())
            .thenComparing(AgentTaskEntity::getSubmissionSeq, Comparator.nullsLast(Long::compareTo))
            .thenComparing(AgentTaskEntity::getId, Comparator.nullsLast(String::compareTo));

    public List<AgentTaskEntity> orderReadyTasks(List<AgentTaskEntity> readyTasks) {
        if (readyTasks == null || readyTasks.isEmpty()) {
            return Collections.emptyList();
        }
        List<AgentTaskEntity> ordered = new ArrayList<>(readyTasks.size());
        for (AgentTaskEntity task : readyTasks) {
            if (task != null) {
                ordered.add(task);
            }
        }
        ordered.sort(DISPATCH_ORDER);
        return ordered;
    }
}
