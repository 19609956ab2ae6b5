package com.agentic.domain.task.service;

import com.agentic.domain.task.model.entity.AgentTaskEntity;
import com.agentic.types.enums.TaskStatusEnum;
import org.springframework.stereotype.Service;

/**
 * Task 失败恢复领域服务：执行失败时在重试预算内退回 PENDING，否则终结为 FAILED；
 * 取消回报直接终结为 CANCELLED，不参与重试。
 */
@Service
public class TaskRecoveryDomainService {

    public RecoveryDecision applyFailure(AgentTaskEntity task, String error, boolean cancelled, boolean retryAllowed) {
        if (task == null) {
            return RecoveryDecision.NOT_FOUND;
        }
        if (task.getStatus() != TaskStatusEnum.RUNNING) {
            return RecoveryDecision.NOT_RUNNING;
        }
        if (cancelled) {
            task.cancel(defaultString(error, "Cancelled by agent"));
            return RecoveryDecision.CANCELLED;
        }
        if (retryAllowed && task.hasRetryBudget()) {
            task.retry(defaultString(error, "Task execution failed"));
            return RecoveryDecision.RETRY;
        }
        task.fail(error);
        return RecoveryDecision.FAILED;
    }

    private String defaultString(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    public enum RecoveryDecision {
        NOT_FOUND,
        NOT_RUNNING,
        RETRY,
        FAILED,
        CANCELLED;

        public boolean isTerminal() {
            return this == FAILED || this == CANCELLED;
        }
    }
}
